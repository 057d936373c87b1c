package org.springaicommunity.gitea.migrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only operations against the GitLab REST API (v4).
 *
 * <p>
 * Converts GitLab JSON responses to the shared model records at the service boundary.
 * Transport and status errors surface as {@link RestApiClient.ApiException}.
 */
public class GitLabRestService {

	private final ApiClient client;

	private final ObjectMapper objectMapper;

	public GitLabRestService(ApiClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	/**
	 * Get the authenticated user. Used to check that the token and connection work.
	 * @return the current user
	 */
	public UserInfo getCurrentUser() {
		JsonNode node = readTree(client.get("/user"));
		return new UserInfo(node.path("id").asLong(), node.path("username").asText(""));
	}

	/**
	 * Get a project by its full path.
	 * @param path project path in "namespace/name" format
	 * @return project information
	 */
	public ProjectInfo getProject(String path) {
		String encoded = URLEncoder.encode(path, StandardCharsets.UTF_8);
		JsonNode node = readTree(client.get("/projects/" + encoded));
		return new ProjectInfo(node.path("id").asLong(), node.path("path_with_namespace").asText(path),
				node.path("web_url").asText(""));
	}

	/**
	 * List one page of project milestones.
	 * @param projectId numeric project ID
	 * @param state "active" or "closed"
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return the milestones of the page
	 */
	public List<Milestone> listMilestones(long projectId, String state, int page, int perPage) {
		String query = "state=" + state + "&page=" + page + "&per_page=" + perPage;
		List<Milestone> milestones = new ArrayList<>();
		JsonNode response = readTree(client.getWithQuery(projectPath(projectId, "milestones"), query));
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			milestones.add(new Milestone(node.path("id").asLong(), node.path("title").asText(""),
					JsonNodeUtils.text(node, "description"), JsonNodeUtils.date(node, "due_date"),
					node.path("state").asText("")));
		}
		return milestones;
	}

	/**
	 * List one page of project labels.
	 * @param projectId numeric project ID
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return the labels of the page
	 */
	public List<Label> listLabels(long projectId, int page, int perPage) {
		String query = "page=" + page + "&per_page=" + perPage;
		List<Label> labels = new ArrayList<>();
		JsonNode response = readTree(client.getWithQuery(projectPath(projectId, "labels"), query));
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			labels.add(new Label(node.path("id").asLong(), node.path("name").asText(""),
					JsonNodeUtils.text(node, "description"), node.path("color").asText("")));
		}
		return labels;
	}

	/**
	 * List one page of project issues.
	 * @param projectId numeric project ID
	 * @param state "opened", "closed" or "all"
	 * @param page 1-based page number
	 * @param perPage page size
	 * @return the issues of the page
	 */
	public List<Issue> listIssues(long projectId, String state, int page, int perPage) {
		String query = "state=" + state + "&page=" + page + "&per_page=" + perPage;
		List<Issue> issues = new ArrayList<>();
		JsonNode response = readTree(client.getWithQuery(projectPath(projectId, "issues"), query));
		for (JsonNode node : JsonNodeUtils.elements(response)) {
			issues.add(parseIssue(node));
		}
		return issues;
	}

	private Issue parseIssue(JsonNode node) {
		JsonNode milestone = node.path("milestone");
		String milestoneTitle = milestone.isObject() ? JsonNodeUtils.text(milestone, "title") : null;

		// GitLab returns label names as plain strings unless with_labels_details is set
		List<String> labels = new ArrayList<>();
		for (JsonNode label : JsonNodeUtils.elements(node.path("labels"))) {
			labels.add(label.isObject() ? label.path("name").asText("") : label.asText());
		}

		return new Issue(node.path("iid").asLong(), node.path("title").asText(""),
				JsonNodeUtils.text(node, "description"), JsonNodeUtils.date(node, "due_date"), milestoneTitle, labels,
				node.path("state").asText(""));
	}

	private static String projectPath(long projectId, String resource) {
		return "/projects/" + projectId + "/" + resource;
	}

	private JsonNode readTree(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new RestApiClient.ApiException("Malformed GitLab response: " + e.getOriginalMessage(), e);
		}
	}

}
