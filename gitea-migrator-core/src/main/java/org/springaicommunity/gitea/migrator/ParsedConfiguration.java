package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Source (GitLab)
	@Nullable
	public String sourceToken;

	public String sourceServer;

	@Nullable
	public String sourceProject;

	// Destination (Gitea)
	@Nullable
	public String destinationToken;

	@Nullable
	public String destinationServer;

	@Nullable
	public String destinationProject; // null = same path as the source project

	// Mode flags
	public boolean dryRun = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(MigrationProperties defaultProperties) {
		this.sourceServer = defaultProperties.getDefaultSourceServer();
	}

	/**
	 * Destination project path, falling back to the source project path.
	 */
	@Nullable
	public String effectiveDestinationProject() {
		return destinationProject != null ? destinationProject : sourceProject;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "sourceServer='" + sourceServer + '\'' + ", sourceProject='" + sourceProject
				+ '\'' + ", sourceToken=" + mask(sourceToken) + ", destinationServer='" + destinationServer + '\''
				+ ", destinationProject='" + destinationProject + '\'' + ", destinationToken="
				+ mask(destinationToken) + ", dryRun=" + dryRun + ", verbose=" + verbose + ", helpRequested="
				+ helpRequested + '}';
	}

	static String mask(@Nullable String token) {
		return token == null ? "(not set)" : "****";
	}

}
