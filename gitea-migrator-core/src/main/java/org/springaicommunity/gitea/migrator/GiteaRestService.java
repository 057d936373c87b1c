package org.springaicommunity.gitea.migrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read and write operations against the Gitea REST API (v1).
 *
 * <p>
 * Request bodies are built from the request records and responses are converted back to
 * the shared model records. Transport and status errors surface as
 * {@link RestApiClient.ApiException}.
 */
public class GiteaRestService {

	private final ApiClient client;

	private final ObjectMapper objectMapper;

	public GiteaRestService(ApiClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	/**
	 * Get the authenticated user. Used to check that the token and connection work.
	 * @return the current user
	 */
	public UserInfo getCurrentUser() {
		JsonNode node = readTree(client.get("/user"));
		return new UserInfo(node.path("id").asLong(), node.path("login").asText(""));
	}

	/**
	 * Get a repository by owner and name.
	 * @param owner repository owner (user or organization)
	 * @param repo repository name
	 * @return repository information
	 */
	public RepositoryInfo getRepository(String owner, String repo) {
		JsonNode node = readTree(client.get(repoPath(owner, repo, "")));
		return new RepositoryInfo(node.path("id").asLong(), node.path("name").asText(repo),
				node.path("full_name").asText(owner + "/" + repo), JsonNodeUtils.text(node, "description"),
				node.path("html_url").asText(""));
	}

	/**
	 * List one page of repository milestones.
	 * @param state "open", "closed" or "all"
	 * @param page 1-based page number
	 * @param limit page size
	 * @return the milestones of the page
	 */
	public List<Milestone> listMilestones(String owner, String repo, String state, int page, int limit) {
		String query = "state=" + state + "&page=" + page + "&limit=" + limit;
		JsonNode response = readTree(client.getWithQuery(repoPath(owner, repo, "/milestones"), query));
		List<Milestone> milestones = new ArrayList<>();
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			milestones.add(parseMilestone(node));
		}
		return milestones;
	}

	/**
	 * List one page of repository labels.
	 * @param page 1-based page number
	 * @param limit page size
	 * @return the labels of the page
	 */
	public List<Label> listLabels(String owner, String repo, int page, int limit) {
		String query = "page=" + page + "&limit=" + limit;
		JsonNode response = readTree(client.getWithQuery(repoPath(owner, repo, "/labels"), query));
		List<Label> labels = new ArrayList<>();
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			labels.add(parseLabel(node));
		}
		return labels;
	}

	/**
	 * List one page of repository issues, excluding pull requests.
	 * @param state "open", "closed" or "all"
	 * @param page 1-based page number
	 * @param limit page size
	 * @return the issues of the page
	 */
	public List<Issue> listIssues(String owner, String repo, String state, int page, int limit) {
		String query = "state=" + state + "&type=issues&page=" + page + "&limit=" + limit;
		JsonNode response = readTree(client.getWithQuery(repoPath(owner, repo, "/issues"), query));
		List<Issue> issues = new ArrayList<>();
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			issues.add(parseIssue(node));
		}
		return issues;
	}

	public Milestone createMilestone(String owner, String repo, MilestoneRequest request) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("title", request.title());
		putIfPresent(body, "description", request.description());
		putIfPresent(body, "due_on", toTimestamp(request.dueDate()));
		return parseMilestone(readTree(client.post(repoPath(owner, repo, "/milestones"), write(body))));
	}

	public Label createLabel(String owner, String repo, LabelRequest request) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("name", request.name());
		body.put("color", request.color());
		putIfPresent(body, "description", request.description());
		return parseLabel(readTree(client.post(repoPath(owner, repo, "/labels"), write(body))));
	}

	public Issue createIssue(String owner, String repo, IssueRequest request) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("title", request.title());
		putIfPresent(body, "body", request.body());
		putIfPresent(body, "due_date", toTimestamp(request.dueDate()));
		putIfPresent(body, "milestone", request.milestoneId());
		body.put("labels", request.labelIds());
		return parseIssue(readTree(client.post(repoPath(owner, repo, "/issues"), write(body))));
	}

	/**
	 * Overwrite title, body, milestone and deadline of an existing issue. Labels are not
	 * touched; see {@link #replaceIssueLabels}.
	 * @param index the per-repository issue number
	 * @param request the target issue state
	 * @return the updated issue
	 */
	public Issue editIssue(String owner, String repo, long index, IssueRequest request) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("title", request.title());
		body.put("body", request.body() != null ? request.body() : "");
		// milestone 0 detaches the issue from any milestone
		body.put("milestone", request.milestoneId() != null ? request.milestoneId() : 0L);
		if (request.dueDate() != null) {
			body.put("due_date", toTimestamp(request.dueDate()));
		}
		else {
			body.put("unset_due_date", true);
		}
		return parseIssue(readTree(client.patch(repoPath(owner, repo, "/issues/" + index), write(body))));
	}

	/**
	 * Replace the full label set of an existing issue.
	 * @param index the per-repository issue number
	 * @param labelIds destination label IDs
	 * @return the labels now attached to the issue
	 */
	public List<Label> replaceIssueLabels(String owner, String repo, long index, List<Long> labelIds) {
		Map<String, Object> body = Map.of("labels", labelIds);
		JsonNode response = readTree(client.put(repoPath(owner, repo, "/issues/" + index + "/labels"), write(body)));
		List<Label> labels = new ArrayList<>();
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			labels.add(parseLabel(node));
		}
		return labels;
	}

	// ========== JSON Mapping ==========

	private Milestone parseMilestone(JsonNode node) {
		return new Milestone(node.path("id").asLong(), node.path("title").asText(""),
				JsonNodeUtils.text(node, "description"), JsonNodeUtils.date(node, "due_on"),
				node.path("state").asText(""));
	}

	private Label parseLabel(JsonNode node) {
		return new Label(node.path("id").asLong(), node.path("name").asText(""),
				JsonNodeUtils.text(node, "description"), node.path("color").asText(""));
	}

	private Issue parseIssue(JsonNode node) {
		JsonNode milestone = node.path("milestone");
		String milestoneTitle = milestone.isObject() ? JsonNodeUtils.text(milestone, "title") : null;
		List<String> labels = new ArrayList<>();
		for (JsonNode label : JsonNodeUtils.elements(node.path("labels"))) {
			labels.add(label.path("name").asText(""));
		}
		return new Issue(node.path("number").asLong(), node.path("title").asText(""), JsonNodeUtils.text(node, "body"),
				JsonNodeUtils.date(node, "due_date"), milestoneTitle, labels, node.path("state").asText(""));
	}

	@Nullable
	private static OffsetDateTime toTimestamp(@Nullable LocalDate date) {
		return date != null ? date.atStartOfDay().atOffset(ZoneOffset.UTC) : null;
	}

	private static void putIfPresent(Map<String, Object> body, String field, @Nullable Object value) {
		if (value != null) {
			body.put(field, value);
		}
	}

	private static String repoPath(String owner, String repo, String resource) {
		return "/repos/" + encode(owner) + "/" + encode(repo) + resource;
	}

	private static String encode(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private String write(Map<String, Object> body) {
		try {
			return objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize Gitea request body", e);
		}
	}

	private JsonNode readTree(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new RestApiClient.ApiException("Malformed Gitea response: " + e.getOriginalMessage(), e);
		}
	}

}
