package org.springaicommunity.gitea.migrator;

/**
 * Summary of a completed migration run.
 *
 * @param milestonesCreated milestones created on the destination
 * @param milestonesSkipped source milestones whose title already existed
 * @param labelsCreated labels created on the destination
 * @param labelsSkipped source labels whose name already existed
 * @param issuesCreated issues created on the destination
 * @param issuesUpdated existing destination issues updated in place
 * @param unresolvedReferences milestone and label references that could not be resolved
 */
public record MigrationResult(int milestonesCreated, int milestonesSkipped, int labelsCreated, int labelsSkipped,
		int issuesCreated, int issuesUpdated, int unresolvedReferences) {
}
