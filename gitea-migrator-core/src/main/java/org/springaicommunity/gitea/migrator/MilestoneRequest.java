package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Payload for creating a destination milestone.
 *
 * @param title the milestone title
 * @param description the milestone description
 * @param dueDate the deadline, if any
 */
public record MilestoneRequest(String title, @Nullable String description, @Nullable LocalDate dueDate) {

	public static MilestoneRequest from(Milestone source) {
		return new MilestoneRequest(source.title(), source.description(), source.dueDate());
	}

}
