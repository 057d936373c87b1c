package org.springaicommunity.gitea.migrator;

/**
 * A reference on a source issue that has no counterpart on the destination.
 *
 * @param kind what kind of reference could not be resolved
 * @param value the milestone title or label name as found on the source issue
 */
public record ResolutionWarning(Kind kind, String value) {

	public enum Kind {

		UNKNOWN_MILESTONE,

		UNKNOWN_LABEL

	}

	public static ResolutionWarning unknownMilestone(String title) {
		return new ResolutionWarning(Kind.UNKNOWN_MILESTONE, title);
	}

	public static ResolutionWarning unknownLabel(String name) {
		return new ResolutionWarning(Kind.UNKNOWN_LABEL, name);
	}

}
