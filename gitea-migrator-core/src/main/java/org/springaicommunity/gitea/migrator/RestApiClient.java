package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for token-authenticated REST APIs using the Java 11+ HttpClient.
 *
 * <p>
 * One instance is bound to a single API root (e.g. {@code https://gitlab.com/api/v4} or
 * {@code https://gitea.example.com/api/v1}) and sends the token as a bearer credential on
 * every request. Non-2xx responses are turned into {@link ApiException}. No request is
 * retried.
 */
public class RestApiClient implements ApiClient {

	private static final Logger logger = LoggerFactory.getLogger(RestApiClient.class);

	private static final String JSON = "application/json";

	private final HttpClient httpClient;

	private final String apiRoot;

	private final String token;

	private final String userAgent;

	public RestApiClient(String apiRoot, String token, String userAgent, Duration connectTimeout) {
		this.apiRoot = stripTrailingSlash(apiRoot);
		this.token = token;
		this.userAgent = userAgent;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	/**
	 * Build the API root URL from a server URL and an API prefix, tolerating a trailing
	 * slash on the server URL (e.g. {@code https://gitlab.com/} + {@code /api/v4}).
	 * @param serverUrl server base URL
	 * @param apiPrefix API path prefix starting with a slash
	 * @return the API root URL
	 */
	public static String apiRoot(String serverUrl, String apiPrefix) {
		return stripTrailingSlash(serverUrl) + apiPrefix;
	}

	public String getApiRoot() {
		return apiRoot;
	}

	@Override
	public String get(String path) {
		return execute(newRequest(path).GET().build());
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		String target = path;
		if (queryString != null && !queryString.isEmpty()) {
			target += "?" + queryString;
		}
		return get(target);
	}

	@Override
	public String post(String path, String body) {
		return execute(newRequest(path).header("Content-Type", JSON)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build());
	}

	@Override
	public String patch(String path, String body) {
		return execute(newRequest(path).header("Content-Type", JSON)
			.method("PATCH", HttpRequest.BodyPublishers.ofString(body))
			.build());
	}

	@Override
	public String put(String path, String body) {
		return execute(newRequest(path).header("Content-Type", JSON)
			.PUT(HttpRequest.BodyPublishers.ofString(body))
			.build());
	}

	private HttpRequest.Builder newRequest(String path) {
		String url = path.startsWith("http") ? path : apiRoot + path;
		return HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", JSON)
			.header("User-Agent", userAgent);
	}

	private String execute(HttpRequest request) {
		String description = request.method() + " " + request.uri();
		logger.debug("{}", description);
		long start = System.currentTimeMillis();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.debug("{} failed after {}ms: {}", description, System.currentTimeMillis() - start, e.getMessage());
			throw new ApiException("HTTP request failed: " + description + ": " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ApiException("HTTP request interrupted: " + description, e);
		}

		int statusCode = response.statusCode();
		logger.debug("{} completed with {} in {}ms", description, statusCode, System.currentTimeMillis() - start);

		if (statusCode >= 200 && statusCode < 300) {
			return response.body();
		}
		else if (statusCode == 401) {
			throw new ApiException("Unauthorized: bad credentials for " + apiRoot + ". Check your token.", statusCode,
					response.body());
		}
		else if (statusCode == 403) {
			throw new ApiException("Forbidden: " + description, statusCode, response.body());
		}
		else if (statusCode == 404) {
			throw new ApiException("Not found: " + request.uri(), statusCode, response.body());
		}
		else if (statusCode == 422) {
			throw new ApiException("Validation failed for " + description + ": " + response.body(), statusCode,
					response.body());
		}
		else {
			throw new ApiException("API error " + statusCode + " for " + description, statusCode, response.body());
		}
	}

	private static String stripTrailingSlash(String url) {
		String result = url.trim();
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	/**
	 * Exception thrown when a remote API call fails, either at the transport level or
	 * with a non-2xx status code.
	 */
	public static class ApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		public ApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public ApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		/**
		 * Returns the HTTP status code, or -1 when no response was received.
		 */
		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

	}

}
