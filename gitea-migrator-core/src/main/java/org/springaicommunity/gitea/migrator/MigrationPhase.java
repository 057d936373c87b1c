package org.springaicommunity.gitea.migrator;

/**
 * The three migration phases, declared in execution order. Issues come last because they
 * reference both milestones and labels.
 */
public enum MigrationPhase {

	MILESTONES("milestones", MigrationState.MILESTONES),

	LABELS("labels", MigrationState.LABELS),

	ISSUES("issues", MigrationState.ISSUES);

	private final String description;

	private final MigrationState state;

	MigrationPhase(String description, MigrationState state) {
		this.description = description;
		this.state = state;
	}

	public String description() {
		return description;
	}

	public MigrationState state() {
		return state;
	}

}
