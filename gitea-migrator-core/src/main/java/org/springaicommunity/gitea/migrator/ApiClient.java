package org.springaicommunity.gitea.migrator;

/**
 * Interface for HTTP operations against a remote issue tracker REST API.
 *
 * <p>
 * Both the GitLab source and the Gitea destination are reached through this abstraction,
 * which keeps the typed services testable with mocked responses.
 */
public interface ApiClient {

	/**
	 * Execute a GET request.
	 * @param path API path relative to the API root (e.g., "/user") or full URL
	 * @return Response body as String
	 * @throws RestApiClient.ApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws RestApiClient.ApiException if the request fails
	 */
	String getWithQuery(String path, String queryString);

	/**
	 * Execute a POST request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws RestApiClient.ApiException if the request fails
	 */
	String post(String path, String body);

	/**
	 * Execute a PATCH request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws RestApiClient.ApiException if the request fails
	 */
	String patch(String path, String body);

	/**
	 * Execute a PUT request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws RestApiClient.ApiException if the request fails
	 */
	String put(String path, String body);

}
