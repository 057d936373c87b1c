package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * Target state of a destination issue, used both for creation and for in-place updates.
 *
 * @param title the issue title
 * @param body the issue body
 * @param dueDate the deadline, if any
 * @param milestoneId the destination milestone ID, or null for no milestone
 * @param labelIds the destination label IDs, in source order
 */
public record IssueRequest(String title, @Nullable String body, @Nullable LocalDate dueDate,
		@Nullable Long milestoneId, List<Long> labelIds) {

	public IssueRequest {
		labelIds = List.copyOf(labelIds);
	}

}
