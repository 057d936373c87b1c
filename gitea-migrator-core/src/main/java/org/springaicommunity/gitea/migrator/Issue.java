package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * An issue as read from either the source or the destination project.
 *
 * <p>
 * References to milestones and labels are kept by title and name so that they can be
 * resolved against the other service's lookup tables.
 *
 * @param number the per-project issue number (GitLab iid, Gitea index)
 * @param title the issue title (the identity key)
 * @param body the issue description (may be null)
 * @param dueDate the due date, if any
 * @param milestoneTitle the title of the linked milestone, if any
 * @param labels names of the labels attached to the issue
 * @param state the service-specific state ("opened", "open" or "closed")
 */
public record Issue(long number, String title, @Nullable String body, @Nullable LocalDate dueDate,
		@Nullable String milestoneTitle, List<String> labels, String state) {

	public Issue {
		labels = List.copyOf(labels);
	}

}
