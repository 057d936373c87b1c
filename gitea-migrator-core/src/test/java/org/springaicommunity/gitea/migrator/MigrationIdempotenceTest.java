package org.springaicommunity.gitea.migrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the engine repeatedly against an in-memory destination to check that re-runs
 * converge without duplicates.
 */
@DisplayName("Migration Re-run Tests - In-Memory Destination")
class MigrationIdempotenceTest {

	private InMemorySource source;

	private InMemoryDestination destination;

	@BeforeEach
	void setUp() {
		source = new InMemorySource();
		source.milestones.add(new Milestone(1, "v1", "First", null, "active"));
		source.milestones.add(new Milestone(2, "v2", null, null, "active"));
		source.labels.add(new Label(1, "bug", "Broken", "#d73a4a"));
		source.labels.add(new Label(2, "ui", null, "#0075ca"));
		source.issues.add(new Issue(1, "Bug A", "first", null, "v1", List.of("bug", "ui"), "opened"));
		source.issues.add(new Issue(2, "Bug B", "second", null, null, List.of(), "opened"));
		destination = new InMemoryDestination();
	}

	private MigrationResult runOnce() {
		return new MigrationEngine(source, destination, destination, new ReferenceResolver(),
				new LoggingMigrationReporter())
			.migrate();
	}

	@Test
	@DisplayName("Should create everything on the first run")
	void shouldCreateEverythingOnFirstRun() {
		MigrationResult result = runOnce();

		assertThat(result.milestonesCreated()).isEqualTo(2);
		assertThat(result.labelsCreated()).isEqualTo(2);
		assertThat(result.issuesCreated()).isEqualTo(2);
		assertThat(result.unresolvedReferences()).isZero();
		Issue bugA = destination.issues.get("Bug A");
		assertThat(destination.issueLabels.get(bugA.number())).containsExactly(destination.labels.get("bug").id(),
				destination.labels.get("ui").id());
		assertThat(destination.issueMilestones.get(bugA.number())).isEqualTo(destination.milestones.get("v1").id());
	}

	@Test
	@DisplayName("Should create no duplicates and update open issues on a second run")
	void shouldConvergeOnSecondRun() {
		runOnce();
		source.issues.set(0, new Issue(1, "Bug A", "edited", null, null, List.of("bug"), "opened"));

		MigrationResult second = runOnce();

		assertThat(second.milestonesCreated()).isZero();
		assertThat(second.milestonesSkipped()).isEqualTo(2);
		assertThat(second.labelsCreated()).isZero();
		assertThat(second.issuesCreated()).isZero();
		assertThat(second.issuesUpdated()).isEqualTo(2);
		assertThat(destination.milestones).hasSize(2);
		assertThat(destination.labels).hasSize(2);
		assertThat(destination.issues).hasSize(2);

		Issue bugA = destination.issues.get("Bug A");
		assertThat(bugA.body()).isEqualTo("edited");
		assertThat(destination.issueMilestones.get(bugA.number())).isNull();
		assertThat(destination.issueLabels.get(bugA.number())).containsExactly(destination.labels.get("bug").id());
	}

	/**
	 * Source serving fresh single-use sequences from mutable lists.
	 */
	static final class InMemorySource implements SourceReader {

		final List<Milestone> milestones = new ArrayList<>();

		final List<Label> labels = new ArrayList<>();

		final List<Issue> issues = new ArrayList<>();

		@Override
		public PagedSequence<Milestone> listOpenMilestones() {
			return paged(milestones);
		}

		@Override
		public PagedSequence<Label> listLabels() {
			return paged(labels);
		}

		@Override
		public PagedSequence<Issue> listOpenIssues() {
			return paged(issues);
		}

		// two items per page so sequences span several requests
		private static <T> PagedSequence<T> paged(List<T> items) {
			List<T> snapshot = List.copyOf(items);
			return PagedSequence.of(page -> {
				int from = Math.min((page - 1) * 2, snapshot.size());
				return snapshot.subList(from, Math.min(from + 2, snapshot.size()));
			});
		}

	}

	/**
	 * Destination keeping entities in insertion-ordered maps keyed by title or name.
	 */
	static final class InMemoryDestination implements DestinationReader, DestinationWriter {

		final Map<String, Milestone> milestones = new LinkedHashMap<>();

		final Map<String, Label> labels = new LinkedHashMap<>();

		final Map<String, Issue> issues = new LinkedHashMap<>();

		final Map<Long, Long> issueMilestones = new LinkedHashMap<>();

		final Map<Long, List<Long>> issueLabels = new LinkedHashMap<>();

		private long nextId = 100;

		@Override
		public Map<String, Milestone> listAllMilestones() {
			return new LinkedHashMap<>(milestones);
		}

		@Override
		public Map<String, Label> listAllLabels() {
			return new LinkedHashMap<>(labels);
		}

		@Override
		public Map<String, Issue> listAllIssues() {
			return new LinkedHashMap<>(issues);
		}

		@Override
		public Milestone createMilestone(MilestoneRequest request) {
			Milestone created = new Milestone(nextId++, request.title(), request.description(), request.dueDate(),
					"open");
			milestones.put(created.title(), created);
			return created;
		}

		@Override
		public Label createLabel(LabelRequest request) {
			Label created = new Label(nextId++, request.name(), request.description(), request.color());
			labels.put(created.name(), created);
			return created;
		}

		@Override
		public Issue createIssue(IssueRequest request) {
			Issue created = store(nextId++, request);
			issueLabels.put(created.number(), request.labelIds());
			return created;
		}

		@Override
		public Issue editIssue(long number, IssueRequest request) {
			return store(number, request);
		}

		@Override
		public List<Label> replaceIssueLabels(long number, List<Long> labelIds) {
			issueLabels.put(number, labelIds);
			return labels.values().stream().filter(label -> labelIds.contains(label.id())).toList();
		}

		private Issue store(long number, IssueRequest request) {
			Issue issue = new Issue(number, request.title(), request.body(), request.dueDate(), null, List.of(),
					"open");
			issues.put(issue.title(), issue);
			issueMilestones.put(number, request.milestoneId());
			return issue;
		}

	}

}
