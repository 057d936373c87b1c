package org.springaicommunity.gitea.migrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Destination for dry runs. Reads go to the real destination, mutations are only logged.
 *
 * <p>
 * Milestones and labels that would have been created are overlaid on later listings, so
 * the issue phase resolves references exactly as a real run would. Returned entities
 * carry negative IDs.
 */
public class DryRunDestination implements DestinationReader, DestinationWriter {

	private static final Logger logger = LoggerFactory.getLogger(DryRunDestination.class);

	private final DestinationReader delegate;

	private final Map<String, Milestone> plannedMilestones = new LinkedHashMap<>();

	private final Map<String, Label> plannedLabels = new LinkedHashMap<>();

	private long nextId = -1;

	public DryRunDestination(DestinationReader delegate) {
		this.delegate = delegate;
	}

	@Override
	public Map<String, Milestone> listAllMilestones() {
		Map<String, Milestone> table = new LinkedHashMap<>(delegate.listAllMilestones());
		table.putAll(plannedMilestones);
		return table;
	}

	@Override
	public Map<String, Label> listAllLabels() {
		Map<String, Label> table = new LinkedHashMap<>(delegate.listAllLabels());
		table.putAll(plannedLabels);
		return table;
	}

	@Override
	public Map<String, Issue> listAllIssues() {
		return delegate.listAllIssues();
	}

	@Override
	public Milestone createMilestone(MilestoneRequest request) {
		logger.info("DRY RUN: Would create milestone '{}'", request.title());
		Milestone planned = new Milestone(nextId--, request.title(), request.description(), request.dueDate(),
				"open");
		plannedMilestones.put(planned.title(), planned);
		return planned;
	}

	@Override
	public Label createLabel(LabelRequest request) {
		logger.info("DRY RUN: Would create label '{}'", request.name());
		Label planned = new Label(nextId--, request.name(), request.description(), request.color());
		plannedLabels.put(planned.name(), planned);
		return planned;
	}

	@Override
	public Issue createIssue(IssueRequest request) {
		logger.info("DRY RUN: Would create issue '{}' (milestone={}, labels={})", request.title(),
				request.milestoneId(), request.labelIds());
		return new Issue(nextId--, request.title(), request.body(), request.dueDate(), null, List.of(), "open");
	}

	@Override
	public Issue editIssue(long number, IssueRequest request) {
		logger.info("DRY RUN: Would update issue #{} '{}' (milestone={})", number, request.title(),
				request.milestoneId());
		return new Issue(number, request.title(), request.body(), request.dueDate(), null, List.of(), "open");
	}

	@Override
	public List<Label> replaceIssueLabels(long number, List<Long> labelIds) {
		logger.info("DRY RUN: Would replace labels of issue #{} with {}", number, labelIds);
		return List.of();
	}

}
