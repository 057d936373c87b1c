package org.springaicommunity.gitea.migrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for MigrationEngine with mocked source and destination. NO real API calls.
 */
@DisplayName("MigrationEngine Tests - Mocked Source and Destination")
@ExtendWith(MockitoExtension.class)
class MigrationEngineTest {

	@Mock
	private SourceReader source;

	@Mock
	private DestinationReader destinationReader;

	@Mock
	private DestinationWriter destinationWriter;

	@Mock
	private MigrationReporter reporter;

	private MigrationEngine engine;

	@BeforeEach
	void setUp() {
		engine = new MigrationEngine(source, destinationReader, destinationWriter, new ReferenceResolver(), reporter);
	}

	static <T> PagedSequence<T> singlePage(List<T> items) {
		return PagedSequence.of(page -> page == 1 ? items : List.of());
	}

	private static Milestone milestone(long id, String title, String state) {
		return new Milestone(id, title, null, null, state);
	}

	private static Label label(long id, String name) {
		return new Label(id, name, null, "#d73a4a");
	}

	private static Issue issue(long number, String title, String milestone, List<String> labels) {
		return new Issue(number, title, "body of " + title, null, milestone, labels, "opened");
	}

	private void givenEmptyIssuePhase() {
		when(source.listOpenIssues()).thenReturn(singlePage(List.of()));
		when(destinationReader.listAllIssues()).thenReturn(Map.of());
	}

	@Nested
	@DisplayName("Milestone and Label Phases")
	class CreateIfAbsentTest {

		@Test
		@DisplayName("Should create only milestones missing from the destination, including closed ones")
		void shouldCreateOnlyMissingMilestones() {
			when(source.listOpenMilestones())
				.thenReturn(singlePage(List.of(milestone(1, "v1", "active"), milestone(2, "v2", "active"))));
			when(destinationReader.listAllMilestones()).thenReturn(Map.of("v1", milestone(30, "v1", "closed")));
			when(destinationWriter.createMilestone(any())).thenReturn(milestone(31, "v2", "open"));
			when(source.listLabels()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllLabels()).thenReturn(Map.of());
			givenEmptyIssuePhase();

			MigrationResult result = engine.migrate();

			verify(destinationWriter).createMilestone(new MilestoneRequest("v2", null, null));
			verify(destinationWriter, never()).createMilestone(new MilestoneRequest("v1", null, null));
			verify(reporter).milestoneCreated(milestone(31, "v2", "open"));
			assertThat(result.milestonesCreated()).isEqualTo(1);
			assertThat(result.milestonesSkipped()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should create labels absent from the destination with their color")
		void shouldCreateMissingLabels() {
			when(source.listOpenMilestones()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllMilestones()).thenReturn(Map.of());
			when(source.listLabels())
				.thenReturn(singlePage(List.of(label(1, "bug"), new Label(2, "ui", "UI", "#0075ca"))));
			when(destinationReader.listAllLabels()).thenReturn(Map.of("bug", label(11, "bug")));
			when(destinationWriter.createLabel(any())).thenReturn(new Label(12, "ui", "UI", "#0075ca"));
			givenEmptyIssuePhase();

			MigrationResult result = engine.migrate();

			verify(destinationWriter).createLabel(new LabelRequest("ui", "UI", "#0075ca"));
			verify(destinationWriter, times(1)).createLabel(any());
			assertThat(result.labelsCreated()).isEqualTo(1);
			assertThat(result.labelsSkipped()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should run phases in order and finish in DONE")
		void shouldRunPhasesInOrder() {
			when(source.listOpenMilestones()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllMilestones()).thenReturn(Map.of());
			when(source.listLabels()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllLabels()).thenReturn(Map.of());
			givenEmptyIssuePhase();

			assertThat(engine.getState()).isEqualTo(MigrationState.INIT);
			engine.migrate();

			InOrder inOrder = inOrder(reporter);
			inOrder.verify(reporter).phaseStarted(MigrationPhase.MILESTONES);
			inOrder.verify(reporter).phaseCompleted(MigrationPhase.MILESTONES);
			inOrder.verify(reporter).phaseStarted(MigrationPhase.LABELS);
			inOrder.verify(reporter).phaseCompleted(MigrationPhase.LABELS);
			inOrder.verify(reporter).phaseStarted(MigrationPhase.ISSUES);
			inOrder.verify(reporter).phaseCompleted(MigrationPhase.ISSUES);
			assertThat(engine.getState()).isEqualTo(MigrationState.DONE);
			assertThat(engine.getState().isTerminal()).isTrue();
		}

	}

	@Nested
	@DisplayName("Issue Phase")
	class IssuePhaseTest {

		@BeforeEach
		void givenNoMilestoneOrLabelWork() {
			when(source.listOpenMilestones()).thenReturn(singlePage(List.of()));
			when(source.listLabels()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllMilestones()).thenReturn(Map.of("v1", milestone(7, "v1", "open")));
			when(destinationReader.listAllLabels()).thenReturn(Map.of("bug", label(11, "bug")));
		}

		@Test
		@DisplayName("Should edit an existing issue by number and replace its labels")
		void shouldUpdateExistingIssue() {
			Issue source42 = issue(5, "Bug A", "v1", List.of("bug"));
			Issue destination42 = issue(42, "Bug A", null, List.of());
			IssueRequest expected = new IssueRequest("Bug A", "body of Bug A", null, 7L, List.of(11L));
			when(source.listOpenIssues()).thenReturn(singlePage(List.of(source42)));
			when(destinationReader.listAllIssues()).thenReturn(Map.of("Bug A", destination42));
			when(destinationWriter.editIssue(42, expected)).thenReturn(destination42);

			MigrationResult result = engine.migrate();

			InOrder inOrder = inOrder(destinationWriter);
			inOrder.verify(destinationWriter).editIssue(42, expected);
			inOrder.verify(destinationWriter).replaceIssueLabels(42, List.of(11L));
			verify(destinationWriter, never()).createIssue(any());
			verify(reporter).issueUpdated(destination42);
			assertThat(result.issuesUpdated()).isEqualTo(1);
			assertThat(result.issuesCreated()).isZero();
		}

		@Test
		@DisplayName("Should create an issue absent from the destination with resolved references")
		void shouldCreateMissingIssue() {
			Issue newIssue = new Issue(6, "Bug B", "details", LocalDate.of(2024, 7, 1), "v1", List.of("bug"),
					"opened");
			IssueRequest expected = new IssueRequest("Bug B", "details", LocalDate.of(2024, 7, 1), 7L, List.of(11L));
			Issue created = issue(43, "Bug B", "v1", List.of("bug"));
			when(source.listOpenIssues()).thenReturn(singlePage(List.of(newIssue)));
			when(destinationReader.listAllIssues()).thenReturn(Map.of());
			when(destinationWriter.createIssue(expected)).thenReturn(created);

			MigrationResult result = engine.migrate();

			verify(destinationWriter).createIssue(expected);
			verify(destinationWriter, never()).editIssue(anyLong(), any());
			verify(reporter).issueCreated(created);
			assertThat(result.issuesCreated()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should report unresolved references and still migrate the issue")
		void shouldReportUnresolvedReferences() {
			Issue withUnknowns = issue(7, "Bug C", "v9", List.of("bug", "wontfix"));
			IssueRequest expected = new IssueRequest("Bug C", "body of Bug C", null, null, List.of(11L));
			when(source.listOpenIssues()).thenReturn(singlePage(List.of(withUnknowns)));
			when(destinationReader.listAllIssues()).thenReturn(Map.of());
			when(destinationWriter.createIssue(expected)).thenReturn(issue(44, "Bug C", null, List.of("bug")));

			MigrationResult result = engine.migrate();

			verify(reporter).referenceUnresolved(withUnknowns, ResolutionWarning.unknownMilestone("v9"));
			verify(reporter).referenceUnresolved(withUnknowns, ResolutionWarning.unknownLabel("wontfix"));
			assertThat(result.unresolvedReferences()).isEqualTo(2);
			assertThat(result.issuesCreated()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should create both issues when a new title repeats in the source")
		void shouldNotRefreshIssueTableWithinPhase() {
			Issue first = issue(1, "Dup", null, List.of());
			Issue second = issue(2, "Dup", null, List.of("bug"));
			when(source.listOpenIssues()).thenReturn(singlePage(List.of(first, second)));
			when(destinationReader.listAllIssues()).thenReturn(Map.of());
			when(destinationWriter.createIssue(any())).thenReturn(issue(43, "Dup", null, List.of()),
					issue(44, "Dup", null, List.of("bug")));

			MigrationResult result = engine.migrate();

			verify(destinationWriter, times(2)).createIssue(any());
			verify(destinationWriter, never()).editIssue(anyLong(), any());
			verify(destinationWriter, never()).replaceIssueLabels(anyLong(), any());
			verify(destinationReader, times(1)).listAllIssues();
			assertThat(result.issuesCreated()).isEqualTo(2);
			assertThat(result.issuesUpdated()).isZero();
		}

		@Test
		@DisplayName("Should report a partial update when labels cannot be replaced")
		void shouldReportPartialUpdate() {
			Issue sourceIssue = issue(5, "Bug A", null, List.of("bug"));
			Issue existing = issue(42, "Bug A", null, List.of());
			RestApiClient.ApiException failure = new RestApiClient.ApiException("Forbidden", 403, "{}");
			when(source.listOpenIssues()).thenReturn(singlePage(List.of(sourceIssue)));
			when(destinationReader.listAllIssues()).thenReturn(Map.of("Bug A", existing));
			when(destinationWriter.editIssue(eq(42L), any())).thenReturn(existing);
			when(destinationWriter.replaceIssueLabels(42, List.of(11L))).thenThrow(failure);

			assertThatThrownBy(() -> engine.migrate()).isInstanceOf(MigrationException.class)
				.hasMessage("migrating issues: Forbidden")
				.hasCause(failure);

			verify(reporter).issuePartiallyUpdated(sourceIssue, 42, failure);
			verify(reporter, never()).issueUpdated(any());
			assertThat(engine.getState()).isEqualTo(MigrationState.FAILED);
		}

	}

	@Nested
	@DisplayName("Failure Handling")
	class FailureTest {

		@Test
		@DisplayName("Should wrap the error with the failing phase and skip later phases")
		void shouldAbortOnFirstError() {
			when(source.listOpenMilestones()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllMilestones()).thenReturn(Map.of());
			when(source.listLabels()).thenReturn(singlePage(List.of(label(1, "bug"), label(2, "ui"))));
			when(destinationReader.listAllLabels()).thenReturn(Map.of());
			when(destinationWriter.createLabel(any()))
				.thenThrow(new RestApiClient.ApiException("Validation failed", 422, "{}"));

			assertThatThrownBy(() -> engine.migrate()).isInstanceOfSatisfying(MigrationException.class, e -> {
				assertThat(e.getPhase()).isEqualTo(MigrationPhase.LABELS);
				assertThat(e.getMessage()).isEqualTo("migrating labels: Validation failed");
			});

			verify(destinationWriter, times(1)).createLabel(any());
			verify(source, never()).listOpenIssues();
			verify(destinationReader, never()).listAllIssues();
			verify(reporter, never()).phaseCompleted(MigrationPhase.LABELS);
			assertThat(engine.getState()).isEqualTo(MigrationState.FAILED);
		}

		@Test
		@DisplayName("Should fail the milestone phase when the destination listing fails")
		void shouldFailOnListingError() {
			when(destinationReader.listAllMilestones())
				.thenThrow(new RestApiClient.ApiException("Unauthorized", 401, "{}"));

			assertThatThrownBy(() -> engine.migrate()).isInstanceOf(MigrationException.class)
				.hasMessage("migrating milestones: Unauthorized");

			verifyNoInteractions(destinationWriter);
			verify(source, never()).listOpenMilestones();
		}

		@Test
		@DisplayName("Should refuse to run twice")
		void shouldRefuseSecondRun() {
			when(source.listOpenMilestones()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllMilestones()).thenReturn(Map.of());
			when(source.listLabels()).thenReturn(singlePage(List.of()));
			when(destinationReader.listAllLabels()).thenReturn(Map.of());
			givenEmptyIssuePhase();
			engine.migrate();

			assertThatThrownBy(() -> engine.migrate()).isInstanceOf(IllegalStateException.class);
		}

	}

}
