package org.springaicommunity.gitea.migrator;

import java.util.Map;

/**
 * Read access to the project being migrated to.
 *
 * <p>
 * Unlike {@link SourceReader}, every method drains pagination internally and returns a
 * complete lookup table keyed by the identity field, because the engine needs random
 * access. Milestones and issues are listed in all states so that closed items are still
 * recognized as already migrated.
 */
public interface DestinationReader {

	Map<String, Milestone> listAllMilestones();

	Map<String, Label> listAllLabels();

	Map<String, Issue> listAllIssues();

}
