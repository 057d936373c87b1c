package org.springaicommunity.gitea.migrator;

/**
 * Configuration properties for a migration.
 *
 * <p>
 * Default values suit gitlab.com and a stock Gitea installation. Properties can be set
 * via setters and passed to {@link MigratorBuilder}.
 */
public class MigrationProperties {

	/**
	 * GitLab server used when none is given on the command line.
	 */
	private String defaultSourceServer = "https://gitlab.com/";

	/**
	 * Items requested per page from GitLab (GitLab caps this at 100).
	 */
	private int sourcePageSize = 100;

	/**
	 * Items requested per page from Gitea (the default MAX_RESPONSE_ITEMS is 50).
	 */
	private int destinationPageSize = 50;

	/**
	 * TCP connect timeout for both services, in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "gitea-migrator";

	public String getDefaultSourceServer() {
		return defaultSourceServer;
	}

	public void setDefaultSourceServer(String defaultSourceServer) {
		this.defaultSourceServer = defaultSourceServer;
	}

	public int getSourcePageSize() {
		return sourcePageSize;
	}

	public void setSourcePageSize(int sourcePageSize) {
		this.sourcePageSize = sourcePageSize;
	}

	public int getDestinationPageSize() {
		return destinationPageSize;
	}

	public void setDestinationPageSize(int destinationPageSize) {
		this.destinationPageSize = destinationPageSize;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

}
