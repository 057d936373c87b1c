package org.springaicommunity.gitea.migrator;

/**
 * Paged read access to the project being migrated from.
 *
 * <p>
 * Every method returns a fresh, lazy {@link PagedSequence}; nothing is fetched until the
 * sequence is iterated. Transport or authentication errors abort the iteration.
 */
public interface SourceReader {

	/**
	 * Active milestones of the source project.
	 */
	PagedSequence<Milestone> listOpenMilestones();

	/**
	 * All labels of the source project.
	 */
	PagedSequence<Label> listLabels();

	/**
	 * Open issues of the source project.
	 */
	PagedSequence<Issue> listOpenIssues();

}
