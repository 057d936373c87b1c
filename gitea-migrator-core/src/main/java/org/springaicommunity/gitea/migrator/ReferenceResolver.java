package org.springaicommunity.gitea.migrator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the milestone title and label names of a source issue to destination IDs.
 *
 * <p>
 * Resolution never fails: a missing milestone leaves the issue without one, missing
 * labels are dropped, and each miss is returned as a {@link ResolutionWarning}. No I/O is
 * performed.
 */
public class ReferenceResolver {

	/**
	 * Resolve the references of one issue.
	 * @param issue the source issue
	 * @param milestones destination milestones by title
	 * @param labels destination labels by name
	 * @return resolved IDs and warnings
	 */
	public ResolvedReferences resolve(Issue issue, Map<String, Milestone> milestones, Map<String, Label> labels) {
		List<ResolutionWarning> warnings = new ArrayList<>();

		Long milestoneId = null;
		String milestoneTitle = issue.milestoneTitle();
		if (milestoneTitle != null) {
			Milestone milestone = milestones.get(milestoneTitle);
			if (milestone != null) {
				milestoneId = milestone.id();
			}
			else {
				warnings.add(ResolutionWarning.unknownMilestone(milestoneTitle));
			}
		}

		List<Long> labelIds = new ArrayList<>();
		for (String name : issue.labels()) {
			Label label = labels.get(name);
			if (label != null) {
				labelIds.add(label.id());
			}
			else {
				warnings.add(ResolutionWarning.unknownLabel(name));
			}
		}

		return new ResolvedReferences(milestoneId, labelIds, warnings);
	}

}
