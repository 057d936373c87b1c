package org.springaicommunity.gitea.migrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs a migration from a {@link SourceReader} to a destination in three ordered phases:
 * milestones, labels, issues.
 *
 * <p>
 * Milestones and labels are created only when their title or name is absent from the
 * destination table fetched at the start of the phase. Open source issues are created
 * when their title is absent from the destination, otherwise the existing issue is edited
 * in place and its label set replaced. Destination tables are never refreshed within a
 * phase.
 *
 * <p>
 * Execution is single-threaded and blocking. The first error of a phase aborts the run
 * with a {@link MigrationException}; nothing is rolled back and nothing is retried, so a
 * re-run relies on the create-if-absent and create-or-update rules to converge.
 *
 * <p>
 * An engine instance performs a single run.
 */
public class MigrationEngine {

	private static final Logger logger = LoggerFactory.getLogger(MigrationEngine.class);

	private final SourceReader source;

	private final DestinationReader destinationReader;

	private final DestinationWriter destinationWriter;

	private final ReferenceResolver referenceResolver;

	private final MigrationReporter reporter;

	private MigrationState state = MigrationState.INIT;

	public MigrationEngine(SourceReader source, DestinationReader destinationReader,
			DestinationWriter destinationWriter, ReferenceResolver referenceResolver, MigrationReporter reporter) {
		this.source = source;
		this.destinationReader = destinationReader;
		this.destinationWriter = destinationWriter;
		this.referenceResolver = referenceResolver;
		this.reporter = reporter;
	}

	public MigrationState getState() {
		return state;
	}

	/**
	 * Run all three phases.
	 * @return counts of what was created, skipped and updated
	 * @throws MigrationException if a phase fails; the engine ends in
	 * {@link MigrationState#FAILED}
	 * @throws IllegalStateException if this engine has already run
	 */
	public MigrationResult migrate() {
		if (state != MigrationState.INIT) {
			throw new IllegalStateException("Migration engine has already run (state: " + state + ")");
		}

		Counters counters = new Counters();
		for (MigrationPhase phase : MigrationPhase.values()) {
			state = phase.state();
			reporter.phaseStarted(phase);
			try {
				switch (phase) {
					case MILESTONES -> migrateMilestones(counters);
					case LABELS -> migrateLabels(counters);
					case ISSUES -> migrateIssues(counters);
				}
			}
			catch (RuntimeException e) {
				state = MigrationState.FAILED;
				throw new MigrationException(phase, e);
			}
			reporter.phaseCompleted(phase);
		}

		state = MigrationState.DONE;
		return counters.toResult();
	}

	private void migrateMilestones(Counters counters) {
		Map<String, Milestone> existing = destinationReader.listAllMilestones();
		logger.debug("Destination has {} milestones", existing.size());

		for (Milestone milestone : source.listOpenMilestones()) {
			if (existing.containsKey(milestone.title())) {
				counters.milestonesSkipped++;
				continue;
			}
			Milestone created = destinationWriter.createMilestone(MilestoneRequest.from(milestone));
			counters.milestonesCreated++;
			reporter.milestoneCreated(created);
		}
	}

	private void migrateLabels(Counters counters) {
		Map<String, Label> existing = destinationReader.listAllLabels();
		logger.debug("Destination has {} labels", existing.size());

		for (Label label : source.listLabels()) {
			if (existing.containsKey(label.name())) {
				counters.labelsSkipped++;
				continue;
			}
			Label created = destinationWriter.createLabel(LabelRequest.from(label));
			counters.labelsCreated++;
			reporter.labelCreated(created);
		}
	}

	private void migrateIssues(Counters counters) {
		Map<String, Issue> issues = destinationReader.listAllIssues();
		Map<String, Milestone> milestones = destinationReader.listAllMilestones();
		Map<String, Label> labels = destinationReader.listAllLabels();
		logger.debug("Destination has {} issues, {} milestones, {} labels", issues.size(), milestones.size(),
				labels.size());

		for (Issue issue : source.listOpenIssues()) {
			migrateIssue(issue, issues, milestones, labels, counters);
		}
	}

	private void migrateIssue(Issue issue, Map<String, Issue> issues, Map<String, Milestone> milestones,
			Map<String, Label> labels, Counters counters) {
		ResolvedReferences references = referenceResolver.resolve(issue, milestones, labels);
		for (ResolutionWarning warning : references.warnings()) {
			counters.unresolvedReferences++;
			reporter.referenceUnresolved(issue, warning);
		}

		IssueRequest request = new IssueRequest(issue.title(), issue.body(), issue.dueDate(),
				references.milestoneId(), references.labelIds());

		Issue existing = issues.get(issue.title());
		if (existing == null) {
			Issue created = destinationWriter.createIssue(request);
			counters.issuesCreated++;
			reporter.issueCreated(created);
			return;
		}

		Issue updated = destinationWriter.editIssue(existing.number(), request);
		try {
			destinationWriter.replaceIssueLabels(existing.number(), request.labelIds());
		}
		catch (RuntimeException e) {
			reporter.issuePartiallyUpdated(issue, existing.number(), e);
			throw e;
		}
		counters.issuesUpdated++;
		reporter.issueUpdated(updated);
	}

	private static final class Counters {

		int milestonesCreated;

		int milestonesSkipped;

		int labelsCreated;

		int labelsSkipped;

		int issuesCreated;

		int issuesUpdated;

		int unresolvedReferences;

		MigrationResult toResult() {
			return new MigrationResult(milestonesCreated, milestonesSkipped, labelsCreated, labelsSkipped,
					issuesCreated, issuesUpdated, unresolvedReferences);
		}

	}

}
