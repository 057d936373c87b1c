package org.springaicommunity.gitea.migrator;

/**
 * Receives progress events from the {@link MigrationEngine}.
 *
 * <p>
 * Injected at construction instead of logging from the engine directly, so tests can
 * inspect exactly what a run reported.
 */
public interface MigrationReporter {

	void phaseStarted(MigrationPhase phase);

	void phaseCompleted(MigrationPhase phase);

	void milestoneCreated(Milestone milestone);

	void labelCreated(Label label);

	void issueCreated(Issue issue);

	void issueUpdated(Issue issue);

	/**
	 * A source issue referenced a milestone or label missing on the destination. The issue
	 * is still migrated without the reference.
	 */
	void referenceUnresolved(Issue sourceIssue, ResolutionWarning warning);

	/**
	 * The edit of an existing destination issue succeeded but replacing its labels failed,
	 * leaving the issue with the new body and milestone but its previous labels.
	 */
	void issuePartiallyUpdated(Issue sourceIssue, long destinationNumber, RuntimeException cause);

}
