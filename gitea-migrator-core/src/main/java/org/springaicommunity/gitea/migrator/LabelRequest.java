package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

/**
 * Payload for creating a destination label.
 *
 * @param name the label name
 * @param description the label description
 * @param color the hex color triplet
 */
public record LabelRequest(String name, @Nullable String description, String color) {

	public static LabelRequest from(Label source) {
		return new LabelRequest(source.name(), source.description(), source.color());
	}

}
