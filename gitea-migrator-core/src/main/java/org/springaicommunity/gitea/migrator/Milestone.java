package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * A milestone as read from either the source or the destination project.
 *
 * <p>
 * The title is the identity key used to match milestones across the two services.
 *
 * @param id the milestone ID assigned by the service that returned it
 * @param title the milestone title (exact, case-sensitive match)
 * @param description the milestone description (may be null)
 * @param dueDate the due date, if any
 * @param state the service-specific state ("active", "open" or "closed")
 */
public record Milestone(long id, String title, @Nullable String description, @Nullable LocalDate dueDate,
		String state) {
}
