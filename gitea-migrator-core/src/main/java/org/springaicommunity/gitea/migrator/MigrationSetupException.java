package org.springaicommunity.gitea.migrator;

/**
 * Fatal error while connecting to the two services, raised before any migration phase
 * runs. The message names the failing step.
 */
public class MigrationSetupException extends RuntimeException {

	private final String step;

	public MigrationSetupException(String step, String message) {
		super(step + ": " + message);
		this.step = step;
	}

	public MigrationSetupException(String step, Throwable cause) {
		super(step + ": " + cause.getMessage(), cause);
		this.step = step;
	}

	public String getStep() {
		return step;
	}

}
