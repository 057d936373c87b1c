package org.springaicommunity.gitea.migrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builder that connects to both services and creates a {@link MigrationEngine} without a
 * dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * MigrationEngine engine = MigratorBuilder.create()
 *     .sourceServer("https://gitlab.com/")
 *     .sourceToken(gitlabToken)
 *     .sourceProject("group/app")
 *     .destinationServer("https://gitea.example.com")
 *     .destinationToken(giteaToken)
 *     .connect();
 * MigrationResult result = engine.migrate();
 *
 * // For testing with mock HTTP clients
 * MigrationEngine testEngine = MigratorBuilder.create()
 *     .sourceClient(mockGitLab)
 *     .destinationClient(mockGitea)
 *     .sourceProject("group/app")
 *     .connect();
 * }
 * </pre>
 */
public class MigratorBuilder {

	private static final Logger logger = LoggerFactory.getLogger(MigratorBuilder.class);

	static final String GITLAB_API_PREFIX = "/api/v4";

	static final String GITEA_API_PREFIX = "/api/v1";

	private MigrationProperties properties;

	@Nullable
	private String sourceServer;

	@Nullable
	private String sourceToken;

	@Nullable
	private String sourceProject;

	@Nullable
	private String destinationServer;

	@Nullable
	private String destinationToken;

	@Nullable
	private String destinationProject;

	private boolean dryRun;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ApiClient sourceClient;

	@Nullable
	private ApiClient destinationClient;

	@Nullable
	private MigrationReporter reporter;

	private MigratorBuilder() {
		this.properties = new MigrationProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new MigratorBuilder
	 */
	public static MigratorBuilder create() {
		return new MigratorBuilder();
	}

	/**
	 * Create a builder pre-populated from parsed command-line arguments.
	 * @param config parsed configuration
	 * @param properties configuration properties
	 * @return new MigratorBuilder
	 */
	public static MigratorBuilder fromConfiguration(ParsedConfiguration config, MigrationProperties properties) {
		return create().properties(properties)
			.sourceServer(config.sourceServer)
			.sourceToken(config.sourceToken)
			.sourceProject(config.sourceProject)
			.destinationServer(config.destinationServer)
			.destinationToken(config.destinationToken)
			.destinationProject(config.destinationProject)
			.dryRun(config.dryRun);
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public MigratorBuilder properties(@Nullable MigrationProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public MigratorBuilder sourceServer(@Nullable String sourceServer) {
		this.sourceServer = sourceServer;
		return this;
	}

	public MigratorBuilder sourceToken(@Nullable String sourceToken) {
		this.sourceToken = sourceToken;
		return this;
	}

	/**
	 * Set the GitLab project to migrate from.
	 * @param sourceProject project path in "namespace/name" format
	 * @return this builder
	 */
	public MigratorBuilder sourceProject(@Nullable String sourceProject) {
		this.sourceProject = sourceProject;
		return this;
	}

	public MigratorBuilder destinationServer(@Nullable String destinationServer) {
		this.destinationServer = destinationServer;
		return this;
	}

	public MigratorBuilder destinationToken(@Nullable String destinationToken) {
		this.destinationToken = destinationToken;
		return this;
	}

	/**
	 * Set the Gitea repository to migrate to.
	 * @param destinationProject repository in "owner/name" format (null to reuse the
	 * source project path)
	 * @return this builder
	 */
	public MigratorBuilder destinationProject(@Nullable String destinationProject) {
		this.destinationProject = destinationProject;
		return this;
	}

	/**
	 * Route all destination mutations through a {@link DryRunDestination}.
	 * @param dryRun true to only log what would change
	 * @return this builder
	 */
	public MigratorBuilder dryRun(boolean dryRun) {
		this.dryRun = dryRun;
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public MigratorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom client for the GitLab API. When set, the source server and token are
	 * not required.
	 * @param sourceClient custom ApiClient (null to use default)
	 * @return this builder
	 */
	public MigratorBuilder sourceClient(@Nullable ApiClient sourceClient) {
		this.sourceClient = sourceClient;
		return this;
	}

	/**
	 * Set a custom client for the Gitea API. When set, the destination server and token
	 * are not required.
	 * @param destinationClient custom ApiClient (null to use default)
	 * @return this builder
	 */
	public MigratorBuilder destinationClient(@Nullable ApiClient destinationClient) {
		this.destinationClient = destinationClient;
		return this;
	}

	/**
	 * Set the reporter receiving migration progress.
	 * @param reporter custom reporter (null to log through SLF4J)
	 * @return this builder
	 */
	public MigratorBuilder reporter(@Nullable MigrationReporter reporter) {
		this.reporter = reporter;
		return this;
	}

	/**
	 * Connect to both services and build the engine. Verifies credentials with a
	 * current-user request on each side, then looks up the GitLab project and the Gitea
	 * repository.
	 * @return engine bound to the two projects
	 * @throws MigrationSetupException naming the step that failed
	 */
	public MigrationEngine connect() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();

		if (sourceProject == null || sourceProject.isBlank()) {
			throw new MigrationSetupException("reading GitLab project name", "GitLab project is required");
		}
		ApiClient gitlab = this.sourceClient != null ? this.sourceClient
				: newClient("creating GitLab client", sourceServer, GITLAB_API_PREFIX, sourceToken);
		ApiClient gitea = this.destinationClient != null ? this.destinationClient
				: newClient("creating Gitea client", destinationServer, GITEA_API_PREFIX, destinationToken);

		GitLabRestService gitLabService = new GitLabRestService(gitlab, mapper);
		UserInfo gitLabUser = step("getting GitLab user status", gitLabService::getCurrentUser);
		logger.info("Connected to GitLab as {}", gitLabUser.username());
		String sourcePath = sourceProject;
		ProjectInfo project = step("getting GitLab project info", () -> gitLabService.getProject(sourcePath));
		logger.info("GitLab project: {} (id {})", project.pathWithNamespace(), project.id());

		GiteaRestService giteaService = new GiteaRestService(gitea, mapper);
		UserInfo giteaUser = step("getting Gitea user info", giteaService::getCurrentUser);
		logger.info("Connected to Gitea as {}", giteaUser.username());
		String[] ownerAndName = splitRepositoryPath(destinationProject != null ? destinationProject : sourceProject);
		RepositoryInfo repository = step("getting Gitea repo info",
				() -> giteaService.getRepository(ownerAndName[0], ownerAndName[1]));
		logger.info("Gitea repository: {} (id {})", repository.fullName(), repository.id());

		SourceReader source = new GitLabSourceReader(gitLabService, project.id(), properties.getSourcePageSize());
		GiteaDestination destination = new GiteaDestination(giteaService, ownerAndName[0], ownerAndName[1],
				properties.getDestinationPageSize());
		MigrationReporter migrationReporter = this.reporter != null ? this.reporter : new LoggingMigrationReporter();

		if (dryRun) {
			DryRunDestination dryRunDestination = new DryRunDestination(destination);
			return new MigrationEngine(source, dryRunDestination, dryRunDestination, new ReferenceResolver(),
					migrationReporter);
		}
		return new MigrationEngine(source, destination, destination, new ReferenceResolver(), migrationReporter);
	}

	private ApiClient newClient(String step, @Nullable String server, String apiPrefix, @Nullable String token) {
		if (server == null || server.isBlank()) {
			throw new MigrationSetupException(step, "server URL is required");
		}
		if (token == null || token.isBlank()) {
			throw new MigrationSetupException(step, "access token is required");
		}
		return new RestApiClient(RestApiClient.apiRoot(server, apiPrefix), token, properties.getUserAgent(),
				Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
	}

	static String[] splitRepositoryPath(String path) {
		String[] parts = path.split("/", -1);
		if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
			throw new MigrationSetupException("parsing Gitea project name",
					"wrong format of Gitea project name '" + path + "', use owner/name");
		}
		return parts;
	}

	private static <T> T step(String step, SetupCall<T> call) {
		try {
			return call.run();
		}
		catch (RuntimeException e) {
			throw new MigrationSetupException(step, e);
		}
	}

	@FunctionalInterface
	private interface SetupCall<T> {

		T run();

	}

}
