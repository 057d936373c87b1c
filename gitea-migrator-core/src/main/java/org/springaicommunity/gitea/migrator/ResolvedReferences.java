package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Destination IDs for the milestone and labels referenced by a source issue.
 *
 * @param milestoneId the destination milestone ID, or null when the issue has no
 * milestone or it could not be resolved
 * @param labelIds destination label IDs in source order, unresolved labels omitted
 * @param warnings one entry per unresolved reference
 */
public record ResolvedReferences(@Nullable Long milestoneId, List<Long> labelIds, List<ResolutionWarning> warnings) {

	public ResolvedReferences {
		labelIds = List.copyOf(labelIds);
		warnings = List.copyOf(warnings);
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}

}
