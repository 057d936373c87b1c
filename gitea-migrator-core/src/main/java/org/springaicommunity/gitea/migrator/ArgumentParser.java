package org.springaicommunity.gitea.migrator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Command-line argument parser for the migrator. Pure Java implementation with no
 * framework dependencies for maximum testability.
 *
 * <p>
 * Tokens not given on the command line are read from the {@code GITLAB_TOKEN} and
 * {@code GITEA_TOKEN} environment variables.
 */
public class ArgumentParser {

	private final MigrationProperties defaultProperties;

	private final UnaryOperator<String> environment;

	public ArgumentParser(MigrationProperties defaultProperties) {
		this(defaultProperties, EnvironmentSupport::get);
	}

	/**
	 * Create a parser with a custom environment lookup.
	 * @param defaultProperties defaults for optional settings
	 * @param environment variable lookup returning null for unset variables
	 */
	public ArgumentParser(MigrationProperties defaultProperties, UnaryOperator<String> environment) {
		this.defaultProperties = defaultProperties;
		this.environment = environment;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--gitlab-token", "--gitlabtoken":
					config.sourceToken = getRequiredValue(args, i, "gitlab-token");
					i++; // Skip next argument since we consumed it
					break;

				case "--gitlab-server", "--gitlabserver":
					config.sourceServer = getRequiredValue(args, i, "gitlab-server");
					i++;
					break;

				case "--gitlab-project", "--gitlabproject":
					config.sourceProject = getRequiredValue(args, i, "gitlab-project");
					i++;
					break;

				case "--gitea-token", "--giteatoken":
					config.destinationToken = getRequiredValue(args, i, "gitea-token");
					i++;
					break;

				case "--gitea-server", "--giteaserver":
					config.destinationServer = getRequiredValue(args, i, "gitea-server");
					i++;
					break;

				case "--gitea-project", "--giteaproject":
					config.destinationProject = getRequiredValue(args, i, "gitea-project");
					i++;
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (config.sourceToken == null) {
			config.sourceToken = environment.apply(EnvironmentSupport.GITLAB_TOKEN);
		}
		if (config.destinationToken == null) {
			config.destinationToken = environment.apply(EnvironmentSupport.GITEA_TOKEN);
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: gitea-migrator [OPTIONS]\n");
		help.append("\n");
		help.append("Migrate labels, issues and milestones from GitLab to Gitea.\n");
		help.append("Re-running against the same projects creates no duplicates and updates open issues.\n");
		help.append("\n");
		help.append("GITLAB OPTIONS:\n");
		help.append("    --gitlab-token TOKEN     Token for GitLab API access (default: $GITLAB_TOKEN)\n");
		help.append("    --gitlab-server URL      GitLab server URL (default: ")
			.append(defaultProperties.getDefaultSourceServer())
			.append(")\n");
		help.append("    --gitlab-project PATH    GitLab project, use namespace/name (required)\n");
		help.append("\n");
		help.append("GITEA OPTIONS:\n");
		help.append("    --gitea-token TOKEN      Token for Gitea API access (default: $GITEA_TOKEN)\n");
		help.append("    --gitea-server URL       Gitea server URL (required)\n");
		help.append("    --gitea-project PATH     Gitea project, use owner/name (default: GitLab project path)\n");
		help.append("\n");
		help.append("OTHER OPTIONS:\n");
		help.append("    -d, --dry-run            Read both projects and log changes without applying them\n");
		help.append("    -v, --verbose            Enable debug logging and stack traces\n");
		help.append("    -h, --help               Show this help message\n");
		help.append("\n");
		help.append("    The option names without dashes (--gitlabtoken, --giteaserver, ...) are also accepted.\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITLAB_TOKEN             GitLab personal access token\n");
		help.append("    GITEA_TOKEN              Gitea access token\n");
		help.append("    Both may also be set in a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    gitea-migrator --gitlab-project group/app --gitea-server https://gitea.example.com\n");
		help.append("    gitea-migrator --gitlab-server https://gitlab.example.com/ --gitlab-project group/app \\\n");
		help.append("        --gitea-server https://gitea.example.com --gitea-project team/app --dry-run\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.sourceToken == null || config.sourceToken.isBlank()) {
			errors.add("GitLab token is required (--gitlab-token or GITLAB_TOKEN)");
		}
		if (config.destinationToken == null || config.destinationToken.isBlank()) {
			errors.add("Gitea token is required (--gitea-token or GITEA_TOKEN)");
		}

		if (config.sourceProject == null || config.sourceProject.isBlank()) {
			errors.add("GitLab project is required (--gitlab-project)");
		}
		else if (!config.sourceProject.matches("^[^/\\s]+(/[^/\\s]+)+$")) {
			errors.add("GitLab project must be in format 'namespace/name' (got: " + config.sourceProject + ")");
		}

		if (!isHttpUrl(config.sourceServer)) {
			errors.add("GitLab server must be an http(s) URL (got: " + config.sourceServer + ")");
		}
		if (config.destinationServer == null || config.destinationServer.isBlank()) {
			errors.add("Gitea server is required (--gitea-server)");
		}
		else if (!isHttpUrl(config.destinationServer)) {
			errors.add("Gitea server must be an http(s) URL (got: " + config.destinationServer + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static boolean isHttpUrl(String url) {
		return url.startsWith("http://") || url.startsWith("https://");
	}

}
