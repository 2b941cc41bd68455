package org.springaicommunity.github.chronicle;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Builder for the report services.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Single user, token from GITHUB_TOKEN or a .env file
 * try (UserCollectionService service = GitHubChronicleBuilder.create()
 *     .tokenFromEnv()
 *     .buildUserCollector()) {
 *     MemberActivity activity = service.collect(ChronicleRequest.builder().user("octocat").build());
 * }
 *
 * // Organization, with custom pool sizes
 * ChronicleProperties props = new ChronicleProperties();
 * props.setMemberConcurrency(3);
 *
 * try (OrgCollectionService service = GitHubChronicleBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .confirmation(RunConfirmation.never())
 *     .buildOrgCollector()) {
 *     OrgAggregateResult result = service.collect(ChronicleRequest.builder().organization("w3c").days(30).build());
 * }
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * UserCollectionService testService = GitHubChronicleBuilder.create()
 *     .httpClient(mockClient)
 *     .buildUserCollector();
 * }
 * </pre>
 */
public class GitHubChronicleBuilder {

	private @Nullable String token;

	private ChronicleProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private CategoryRules categoryRules;

	private MirrorRules mirrorRules;

	private RunConfirmation confirmation;

	private GitHubChronicleBuilder() {
		this.properties = new ChronicleProperties();
		this.categoryRules = CategoryRules.defaults();
		this.mirrorRules = MirrorRules.defaults();
		this.confirmation = RunConfirmation.never();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubChronicleBuilder
	 */
	public static GitHubChronicleBuilder create() {
		return new GitHubChronicleBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubChronicleBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from a {@code .env} file or the GITHUB_TOKEN environment
	 * variable.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubChronicleBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.requireGitHubToken();
		return this;
	}

	/**
	 * Set chronicle properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubChronicleBuilder properties(@Nullable ChronicleProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubChronicleBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required and the client is used
	 * as given, without the retrying decorator.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubChronicleBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	public GitHubChronicleBuilder categoryRules(CategoryRules categoryRules) {
		this.categoryRules = categoryRules;
		return this;
	}

	public GitHubChronicleBuilder mirrorRules(MirrorRules mirrorRules) {
		this.mirrorRules = mirrorRules;
		return this;
	}

	/**
	 * Set how expensive organization runs are confirmed. Defaults to declining them.
	 * @param confirmation confirmation callback
	 * @return this builder
	 */
	public GitHubChronicleBuilder confirmation(RunConfirmation confirmation) {
		this.confirmation = confirmation;
		return this;
	}

	/**
	 * Build a UserCollectionService. The caller owns the returned service and must close
	 * it to release its worker pools.
	 * @return configured UserCollectionService
	 */
	public UserCollectionService buildUserCollector() {
		validateToken();
		Components components = buildComponents();
		return new UserCollectionService(components.collector(), components.pools());
	}

	/**
	 * Build an OrgCollectionService. The caller owns the returned service and must close
	 * it to release its worker pools.
	 * @return configured OrgCollectionService
	 */
	public OrgCollectionService buildOrgCollector() {
		validateToken();
		Components components = buildComponents();
		WorkerPools pools = components.pools();
		ActivityScanner scanner = new ActivityScanner(components.restService(), components.graphQLService(),
				pools.scrape(), pools.member(), properties);
		return new OrgCollectionService(components.restService(), new RateLimitBudget(components.restService(),
				properties), scanner, components.collector(), new OrgAggregator(), pools, confirmation);
	}

	/**
	 * Build the RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		validateToken();
		return new GitHubRestService(client(), mapper(), properties);
	}

	/**
	 * Build the GraphQLService directly (for advanced usage).
	 * @return configured GraphQLService
	 */
	public GraphQLService buildGraphQLService() {
		validateToken();
		return new GitHubGraphQLService(client(), mapper(), properties);
	}

	private void validateToken() {
		// A custom client carries its own credentials
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private ObjectMapper mapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private GitHubClient client() {
		if (this.httpClient != null) {
			return this.httpClient;
		}
		GitHubHttpClient transport = new GitHubHttpClient(token,
				Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
		return RetryingGitHubClient.builder()
			.wrapping(transport)
			.maxRetries(properties.getMaxRetries())
			.initialDelayMs(properties.getInitialRetryDelayMs())
			.pacingThreshold(properties.getPacingThreshold())
			.build();
	}

	private Components buildComponents() {
		ObjectMapper mapper = mapper();
		GitHubClient client = client();
		GitHubRestService restService = new GitHubRestService(client, mapper, properties);
		GitHubGraphQLService graphQLService = new GitHubGraphQLService(client, mapper, properties);

		WorkerPools pools = WorkerPools.create(properties);
		CategoryClassifier classifier = new CategoryClassifier(categoryRules, restService,
				properties.getTopicCacheSize());
		RepositoryFilter filter = new RepositoryFilter(mirrorRules);
		CommitAggregator commits = new CommitAggregator(restService, graphQLService, classifier, filter,
				pools.stats());
		MemberActivityCollector collector = new MemberActivityCollector(graphQLService, restService, commits,
				new ReviewAggregator(graphQLService), classifier, filter, pools.stats());
		return new Components(restService, graphQLService, pools, collector);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(RestService restService, GraphQLService graphQLService, WorkerPools pools,
			MemberActivityCollector collector) {
	}

}
