package org.springaicommunity.gitea.migrator;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading optional values out of API response trees.
 */
final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	@Nullable
	static String text(JsonNode node, String field) {
		JsonNode value = node.path(field);
		if (value.isMissingNode() || value.isNull()) {
			return null;
		}
		return value.asText();
	}

	/**
	 * Read a due date that is either a plain date ({@code 2024-05-01}, GitLab) or a
	 * timestamp ({@code 2024-05-01T00:00:00Z}, Gitea). Timestamps are normalized to UTC.
	 */
	@Nullable
	static LocalDate date(JsonNode node, String field) {
		String value = text(node, field);
		if (value == null || value.isEmpty()) {
			return null;
		}
		try {
			if (value.length() == 10) {
				return LocalDate.parse(value);
			}
			return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
		}
		catch (DateTimeParseException e) {
			logger.warn("Ignoring unparseable date in field '{}': {}", field, value);
			return null;
		}
	}

	static List<JsonNode> elements(JsonNode node) {
		if (!node.isArray()) {
			return List.of();
		}
		List<JsonNode> result = new ArrayList<>(node.size());
		node.forEach(result::add);
		return result;
	}

}
