package org.springaicommunity.gitea.migrator;

import java.util.List;
import java.util.Map;

/**
 * {@link DestinationReader} and {@link DestinationWriter} bound to one Gitea repository.
 */
public class GiteaDestination implements DestinationReader, DestinationWriter {

	static final String ALL_STATES = "all";

	private final GiteaRestService restService;

	private final String owner;

	private final String repo;

	private final int pageSize;

	public GiteaDestination(GiteaRestService restService, String owner, String repo, int pageSize) {
		this.restService = restService;
		this.owner = owner;
		this.repo = repo;
		this.pageSize = pageSize;
	}

	@Override
	public Map<String, Milestone> listAllMilestones() {
		return PagedSequence
			.of(page -> restService.listMilestones(owner, repo, ALL_STATES, page, pageSize))
			.toTable(Milestone::title);
	}

	@Override
	public Map<String, Label> listAllLabels() {
		return PagedSequence.of(page -> restService.listLabels(owner, repo, page, pageSize)).toTable(Label::name);
	}

	@Override
	public Map<String, Issue> listAllIssues() {
		return PagedSequence.of(page -> restService.listIssues(owner, repo, ALL_STATES, page, pageSize))
			.toTable(Issue::title);
	}

	@Override
	public Milestone createMilestone(MilestoneRequest request) {
		return restService.createMilestone(owner, repo, request);
	}

	@Override
	public Label createLabel(LabelRequest request) {
		return restService.createLabel(owner, repo, request);
	}

	@Override
	public Issue createIssue(IssueRequest request) {
		return restService.createIssue(owner, repo, request);
	}

	@Override
	public Issue editIssue(long number, IssueRequest request) {
		return restService.editIssue(owner, repo, number, request);
	}

	@Override
	public List<Label> replaceIssueLabels(long number, List<Long> labelIds) {
		return restService.replaceIssueLabels(owner, repo, number, labelIds);
	}

}
