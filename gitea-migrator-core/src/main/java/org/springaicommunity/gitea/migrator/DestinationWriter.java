package org.springaicommunity.gitea.migrator;

import java.util.List;

/**
 * Mutating operations on the destination project. Each call is individually fallible and
 * is never retried.
 */
public interface DestinationWriter {

	Milestone createMilestone(MilestoneRequest request);

	Label createLabel(LabelRequest request);

	Issue createIssue(IssueRequest request);

	/**
	 * Overwrite title, body, milestone and deadline of the issue with the given number.
	 */
	Issue editIssue(long number, IssueRequest request);

	/**
	 * Replace the complete label set of the issue with the given number.
	 */
	List<Label> replaceIssueLabels(long number, List<Long> labelIds);

}
