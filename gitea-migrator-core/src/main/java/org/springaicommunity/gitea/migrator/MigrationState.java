package org.springaicommunity.gitea.migrator;

/**
 * Lifecycle of a single migration run.
 *
 * <pre>
 *   INIT → MILESTONES → LABELS → ISSUES → DONE
 *                 └────────┴────────┴──→ FAILED
 * </pre>
 */
public enum MigrationState {

	INIT,

	MILESTONES,

	LABELS,

	ISSUES,

	DONE,

	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}

}
