package org.springaicommunity.gitea.migrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MigrationReporter} that writes every event to SLF4J.
 */
public class LoggingMigrationReporter implements MigrationReporter {

	private static final Logger logger = LoggerFactory.getLogger(LoggingMigrationReporter.class);

	@Override
	public void phaseStarted(MigrationPhase phase) {
		logger.info("Migrating {}", phase.description());
	}

	@Override
	public void phaseCompleted(MigrationPhase phase) {
		logger.debug("Finished migrating {}", phase.description());
	}

	@Override
	public void milestoneCreated(Milestone milestone) {
		logger.info("Created milestone: title={}", milestone.title());
	}

	@Override
	public void labelCreated(Label label) {
		logger.info("Created label: name={}, color={}", label.name(), label.color());
	}

	@Override
	public void issueCreated(Issue issue) {
		logger.info("Created issue: title={}", issue.title());
	}

	@Override
	public void issueUpdated(Issue issue) {
		logger.info("Updated issue: title={}", issue.title());
	}

	@Override
	public void referenceUnresolved(Issue sourceIssue, ResolutionWarning warning) {
		switch (warning.kind()) {
			case UNKNOWN_MILESTONE -> logger.warn("Unknown milestone '{}' on issue '{}'", warning.value(),
					sourceIssue.title());
			case UNKNOWN_LABEL -> logger.warn("Unknown label '{}' on issue '{}'", warning.value(), sourceIssue.title());
		}
	}

	@Override
	public void issuePartiallyUpdated(Issue sourceIssue, long destinationNumber, RuntimeException cause) {
		logger.error("Issue '{}' (#{}) was edited but its labels could not be replaced: {}", sourceIssue.title(),
				destinationNumber, cause.getMessage());
	}

}
