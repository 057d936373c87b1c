package org.springaicommunity.gitea.migrator;

/**
 * {@link SourceReader} bound to one GitLab project.
 */
public class GitLabSourceReader implements SourceReader {

	static final String ACTIVE_MILESTONES = "active";

	static final String OPEN_ISSUES = "opened";

	private final GitLabRestService restService;

	private final long projectId;

	private final int pageSize;

	public GitLabSourceReader(GitLabRestService restService, long projectId, int pageSize) {
		this.restService = restService;
		this.projectId = projectId;
		this.pageSize = pageSize;
	}

	@Override
	public PagedSequence<Milestone> listOpenMilestones() {
		return PagedSequence.of(page -> restService.listMilestones(projectId, ACTIVE_MILESTONES, page, pageSize));
	}

	@Override
	public PagedSequence<Label> listLabels() {
		return PagedSequence.of(page -> restService.listLabels(projectId, page, pageSize));
	}

	@Override
	public PagedSequence<Issue> listOpenIssues() {
		return PagedSequence.of(page -> restService.listIssues(projectId, OPEN_ISSUES, page, pageSize));
	}

}
