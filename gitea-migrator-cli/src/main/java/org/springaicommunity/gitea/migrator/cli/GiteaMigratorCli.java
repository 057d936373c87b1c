package org.springaicommunity.gitea.migrator.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.gitea.migrator.*;

/**
 * GitLab to Gitea migrator CLI
 *
 * Plain Java command-line application that copies milestones, labels and open issues from
 * a GitLab project to a Gitea repository. Uses MigratorBuilder for service wiring.
 *
 * Usage: java -jar gitea-migrator-cli.jar [OPTIONS]
 *
 * Environment Variables: GITLAB_TOKEN, GITEA_TOKEN - access tokens used when not given on
 * the command line
 *
 * Examples: java -jar gitea-migrator-cli.jar --gitlab-project group/app --gitea-server
 * https://gitea.example.com java -jar gitea-migrator-cli.jar --gitlab-project group/app
 * --gitea-server https://gitea.example.com --gitea-project team/app --dry-run
 */
public class GiteaMigratorCli {

	private static final Logger logger = LoggerFactory.getLogger(GiteaMigratorCli.class);

	private static final String BASE_PACKAGE = "org.springaicommunity.gitea.migrator";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Migration failed: {}", e.getMessage());
			logger.debug("Stack trace:", e);
			System.exit(1);
		}
	}

	/**
	 * Parse arguments and run the migration.
	 * @param args command-line arguments
	 * @return exit code: 0 on success, 1 when setup or a migration phase fails
	 * @throws IllegalArgumentException if the arguments are invalid
	 */
	public static int run(String[] args) {
		MigrationProperties properties = new MigrationProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		if (config.verbose) {
			enableDebugLogging();
		}

		logConfiguration(config);

		MigrationEngine engine;
		try {
			engine = MigratorBuilder.fromConfiguration(config, properties).connect();
		}
		catch (MigrationSetupException e) {
			logger.error("Connecting to GitLab and Gitea failed: {}", e.getMessage());
			logger.debug("Stack trace:", e);
			return 1;
		}

		try {
			MigrationResult result = engine.migrate();
			logResults(result, config.dryRun);
			return 0;
		}
		catch (MigrationException e) {
			logger.error("Migrating the project failed: {}", e.getMessage());
			logger.debug("Stack trace:", e);
			return 1;
		}
	}

	private static void enableDebugLogging() {
		Logger projectLogger = LoggerFactory.getLogger(BASE_PACKAGE);
		if (projectLogger instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) projectLogger).setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  GitLab server: {}", config.sourceServer);
		logger.info("  GitLab project: {}", config.sourceProject);
		logger.info("  Gitea server: {}", config.destinationServer);
		logger.info("  Gitea project: {}", config.effectiveDestinationProject());
		logger.info("  Dry run: {}", config.dryRun);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(MigrationResult result, boolean dryRun) {
		logger.info(dryRun ? "Dry run finished successfully" : "Migration finished successfully");
		logger.info("  Milestones created: {} (already present: {})", result.milestonesCreated(),
				result.milestonesSkipped());
		logger.info("  Labels created: {} (already present: {})", result.labelsCreated(), result.labelsSkipped());
		logger.info("  Issues created: {}", result.issuesCreated());
		logger.info("  Issues updated: {}", result.issuesUpdated());
		if (result.unresolvedReferences() > 0) {
			logger.warn("  Unresolved milestone/label references: {}", result.unresolvedReferences());
		}
	}

}
