package org.springaicommunity.gitea.migrator;

/**
 * Fatal error during one of the migration phases. The remaining phases are not run.
 */
public class MigrationException extends RuntimeException {

	private final MigrationPhase phase;

	public MigrationException(MigrationPhase phase, Throwable cause) {
		super("migrating " + phase.description() + ": " + cause.getMessage(), cause);
		this.phase = phase;
	}

	public MigrationPhase getPhase() {
		return phase;
	}

}
