package org.springaicommunity.github.chronicle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for GitHub GraphQL API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary,
 * encapsulating all JSON parsing logic here. Batched lookups use one aliased field per
 * user or repository.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	private static final int MAX_SPAN_DAYS = 365;

	private static final int PAGE_SIZE = 100;

	private static final String REPOSITORY_FIELDS = """
			fragment RepositoryFields on Repository {
			    nameWithOwner
			    description
			    isPrivate
			    isFork
			    parent { nameWithOwner }
			    primaryLanguage { name }
			    defaultBranchRef { name }
			}
			""";

	private static final String SUMMARY_FIELDS = """
			fragment SummaryFields on User {
			    login
			    name
			    company
			    contributionsCollection(from: $from, to: $to) {
			        totalCommitContributions
			        totalPullRequestContributions
			        totalIssueContributions
			        totalPullRequestReviewContributions
			        restrictedContributionsCount
			        commitContributionsByRepository(maxRepositories: 100) {
			            repository { ...RepositoryFields }
			            contributions { totalCount }
			        }
			    }
			}
			""";

	private static final String PULL_REQUEST_FIELDS = """
			fragment PullRequestFields on PullRequest {
			    url
			    title
			    additions
			    deletions
			    state
			    merged
			    createdAt
			    author { login }
			    repository { nameWithOwner }
			}
			""";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int repositoryBatchSize;

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this(httpClient, objectMapper, new ChronicleProperties());
	}

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper, ChronicleProperties properties) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.repositoryBatchSize = properties.getRepositoryBatchSize();
	}

	@Override
	public @Nullable ContributionSummary getContributionSummary(String login, LocalDate from, LocalDate to) {
		String query = """
				query($login: String!, $from: DateTime!, $to: DateTime!) {
				    user(login: $login) { ...SummaryFields }
				}
				""" + SUMMARY_FIELDS + REPOSITORY_FIELDS;

		Map<String, Object> variables = rangeVariables(from, to);
		variables.put("login", login);

		JsonNode user = executeGraphQL(query, variables).path("user");
		if (user.isMissingNode() || user.isNull()) {
			return null;
		}
		return parseSummary(user, login);
	}

	@Override
	public Map<String, ContributionSummary> getContributionSummaries(List<String> logins, LocalDate from,
			LocalDate to) {
		if (logins.isEmpty()) {
			return Map.of();
		}
		StringBuilder query = new StringBuilder("query($from: DateTime!, $to: DateTime!) {\n");
		for (int i = 0; i < logins.size(); i++) {
			query.append("    u")
				.append(i)
				.append(": user(login: ")
				.append(quote(logins.get(i)))
				.append(") { ...SummaryFields }\n");
		}
		query.append("}\n").append(SUMMARY_FIELDS).append(REPOSITORY_FIELDS);

		JsonNode data = executeGraphQL(query.toString(), rangeVariables(from, to));

		Map<String, ContributionSummary> summaries = new LinkedHashMap<>();
		for (int i = 0; i < logins.size(); i++) {
			JsonNode user = data.path("u" + i);
			if (!user.isMissingNode() && !user.isNull()) {
				summaries.put(logins.get(i), parseSummary(user, logins.get(i)));
			}
		}
		logger.debug("Contribution summaries: {} of {} users returned", summaries.size(), logins.size());
		return summaries;
	}

	@Override
	public SearchResult<PullRequestRecord> getReviewContributions(String login, LocalDate from, LocalDate to,
			@Nullable String after) {
		String query = """
				query($login: String!, $from: DateTime!, $to: DateTime!, $first: Int!, $after: String) {
				    user(login: $login) {
				        contributionsCollection(from: $from, to: $to) {
				            pullRequestReviewContributions(first: $first, after: $after) {
				                totalCount
				                pageInfo { hasNextPage endCursor }
				                nodes { pullRequest { ...PullRequestFields } }
				            }
				        }
				    }
				}
				""" + PULL_REQUEST_FIELDS;

		Map<String, Object> variables = rangeVariables(from, to);
		variables.put("login", login);
		variables.put("first", PAGE_SIZE);
		variables.put("after", after);

		JsonNode contributions = executeGraphQL(query, variables).path("user")
			.path("contributionsCollection")
			.path("pullRequestReviewContributions");

		List<PullRequestRecord> reviewed = new ArrayList<>();
		for (JsonNode node : contributions.path("nodes")) {
			PullRequestRecord pr = parsePullRequest(node.path("pullRequest"));
			if (pr != null) {
				reviewed.add(pr);
			}
		}
		return page(reviewed, contributions);
	}

	@Override
	public SearchResult<PullRequestRecord> searchPullRequestsCreated(String login, LocalDate from, LocalDate to,
			@Nullable String after) {
		String query = """
				query($query: String!, $first: Int!, $after: String) {
				    search(query: $query, type: ISSUE, first: $first, after: $after) {
				        issueCount
				        pageInfo { hasNextPage endCursor }
				        nodes { ...PullRequestFields }
				    }
				}
				""" + PULL_REQUEST_FIELDS;

		Map<String, Object> variables = new HashMap<>();
		variables.put("query", "author:" + login + " is:pr created:" + from + ".." + to);
		variables.put("first", PAGE_SIZE);
		variables.put("after", after);

		JsonNode search = executeGraphQL(query, variables).path("search");

		List<PullRequestRecord> created = new ArrayList<>();
		for (JsonNode node : search.path("nodes")) {
			PullRequestRecord pr = parsePullRequest(node);
			if (pr != null) {
				created.add(pr);
			}
		}
		JsonNode pageInfo = search.path("pageInfo");
		boolean hasMore = pageInfo.path("hasNextPage").asBoolean(false);
		return new SearchResult<>(created, hasMore ? pageInfo.path("endCursor").asText(null) : null, hasMore,
				search.path("issueCount").asInt(created.size()));
	}

	/**
	 * {@inheritDoc}
	 *
	 * <p>
	 * Larger requests are split into several queries of at most the configured batch
	 * size.
	 */
	@Override
	public Map<String, RepositoryInfo> getRepositories(List<String> names) {
		Map<String, RepositoryInfo> repositories = new LinkedHashMap<>();
		for (int start = 0; start < names.size(); start += repositoryBatchSize) {
			List<String> batch = names.subList(start, Math.min(start + repositoryBatchSize, names.size()));
			repositories.putAll(getRepositoryBatch(batch));
		}
		return repositories;
	}

	private Map<String, RepositoryInfo> getRepositoryBatch(List<String> names) {
		StringBuilder query = new StringBuilder("query {\n");
		List<String> requested = new ArrayList<>();
		for (String name : names) {
			int slash = name.indexOf('/');
			if (slash <= 0 || slash == name.length() - 1) {
				logger.warn("Skipping invalid repository identity: {}", name);
				continue;
			}
			query.append("    r")
				.append(requested.size())
				.append(": repository(owner: ")
				.append(quote(name.substring(0, slash)))
				.append(", name: ")
				.append(quote(name.substring(slash + 1)))
				.append(") { ...RepositoryFields }\n");
			requested.add(name);
		}
		if (requested.isEmpty()) {
			return Map.of();
		}
		query.append("}\n").append(REPOSITORY_FIELDS);

		JsonNode data = executeGraphQL(query.toString(), Map.of());

		Map<String, RepositoryInfo> repositories = new LinkedHashMap<>();
		for (int i = 0; i < requested.size(); i++) {
			RepositoryInfo info = parseRepository(data.path("r" + i));
			if (info != null) {
				repositories.put(requested.get(i), info);
			}
		}
		return repositories;
	}

	@Override
	public SearchResult<RepositoryInfo> getUserForks(String login, @Nullable String after) {
		String query = """
				query($login: String!, $first: Int!, $after: String) {
				    user(login: $login) {
				        repositories(first: $first, after: $after, isFork: true, ownerAffiliations: [OWNER]) {
				            totalCount
				            pageInfo { hasNextPage endCursor }
				            nodes { ...RepositoryFields }
				        }
				    }
				}
				""" + REPOSITORY_FIELDS;

		Map<String, Object> variables = new HashMap<>();
		variables.put("login", login);
		variables.put("first", PAGE_SIZE);
		variables.put("after", after);

		JsonNode repositories = executeGraphQL(query, variables).path("user").path("repositories");

		List<RepositoryInfo> forks = new ArrayList<>();
		for (JsonNode node : repositories.path("nodes")) {
			RepositoryInfo info = parseRepository(node);
			if (info != null) {
				forks.add(info);
			}
		}
		return page(forks, repositories);
	}

	/**
	 * Clamp a range to the longest span {@code contributionsCollection} accepts.
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return {@code from}, or the start of the last {@value #MAX_SPAN_DAYS} days ending
	 * with {@code to} if that is later
	 */
	static LocalDate clampStart(LocalDate from, LocalDate to) {
		// Both ends are inclusive whole days, so the span is between() + 1 days
		if (ChronoUnit.DAYS.between(from, to) >= MAX_SPAN_DAYS) {
			LocalDate clamped = to.minusDays(MAX_SPAN_DAYS - 1);
			logger.info("Date range {}..{} exceeds one year, using {}..{}", from, to, clamped, to);
			return clamped;
		}
		return from;
	}

	// ========== JSON Parsing Methods (at service boundary) ==========

	private ContributionSummary parseSummary(JsonNode user, String requestedLogin) {
		JsonNode collection = user.path("contributionsCollection");
		Map<String, Integer> repositoryCommits = new LinkedHashMap<>();
		Map<String, RepositoryInfo> repositories = new LinkedHashMap<>();
		for (JsonNode entry : collection.path("commitContributionsByRepository")) {
			RepositoryInfo info = parseRepository(entry.path("repository"));
			if (info == null) {
				continue;
			}
			repositoryCommits.merge(info.nameWithOwner(), entry.path("contributions").path("totalCount").asInt(0),
					Integer::sum);
			repositories.put(info.nameWithOwner(), info);
		}
		return new ContributionSummary(user.path("login").asText(requestedLogin), textOrNull(user.path("name")),
				textOrNull(user.path("company")), collection.path("totalCommitContributions").asInt(0),
				collection.path("totalPullRequestContributions").asInt(0),
				collection.path("totalIssueContributions").asInt(0),
				collection.path("totalPullRequestReviewContributions").asInt(0),
				collection.path("restrictedContributionsCount").asInt(0), repositoryCommits, repositories);
	}

	private @Nullable RepositoryInfo parseRepository(JsonNode node) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return null;
		}
		String nameWithOwner = node.path("nameWithOwner").asText("");
		if (nameWithOwner.isEmpty()) {
			return null;
		}
		return new RepositoryInfo(nameWithOwner, textOrNull(node.path("description")),
				node.path("isPrivate").asBoolean(false), node.path("isFork").asBoolean(false),
				textOrNull(node.path("parent").path("nameWithOwner")),
				textOrNull(node.path("primaryLanguage").path("name")),
				textOrNull(node.path("defaultBranchRef").path("name")));
	}

	private @Nullable PullRequestRecord parsePullRequest(JsonNode node) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return null;
		}
		String url = node.path("url").asText("");
		if (url.isEmpty()) {
			return null;
		}
		return new PullRequestRecord(url, node.path("title").asText(""),
				node.path("repository").path("nameWithOwner").asText(""),
				node.path("author").path("login").asText("ghost"), node.path("additions").asInt(0),
				node.path("deletions").asInt(0), 0,
				PullRequestState.from(node.path("state").asText(""), node.path("merged").asBoolean(false)),
				parseInstant(node.path("createdAt").asText(null)));
	}

	private <T> SearchResult<T> page(List<T> items, JsonNode connection) {
		JsonNode pageInfo = connection.path("pageInfo");
		boolean hasMore = pageInfo.path("hasNextPage").asBoolean(false);
		String nextCursor = hasMore ? pageInfo.path("endCursor").asText(null) : null;
		return new SearchResult<>(items, nextCursor, hasMore && nextCursor != null,
				connection.path("totalCount").asInt(items.size()));
	}

	private static @Nullable String textOrNull(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return null;
		}
		String text = node.asText("");
		return text.isBlank() ? null : text;
	}

	private static @Nullable Instant parseInstant(@Nullable String value) {
		if (value == null || value.isEmpty()) {
			return null;
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse timestamp: {}", value);
			return null;
		}
	}

	// ========== Internal GraphQL Execution ==========

	private Map<String, Object> rangeVariables(LocalDate from, LocalDate to) {
		LocalDate start = clampStart(from, to);
		Map<String, Object> variables = new HashMap<>();
		variables.put("from", start.atStartOfDay().toInstant(ZoneOffset.UTC).toString());
		variables.put("to", to.atTime(23, 59, 59).toInstant(ZoneOffset.UTC).toString());
		return variables;
	}

	private static String quote(String value) {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	private JsonNode executeGraphQL(String query, Map<String, Object> variables) {
		String requestBody;
		try {
			Map<String, Object> body = new HashMap<>();
			body.put("query", query);
			body.put("variables", variables);
			requestBody = objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Unable to encode GraphQL request", e);
		}

		String response = httpClient.postGraphQL(requestBody);
		if (response == null) {
			return MissingNode.getInstance();
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new MalformedResponseException("Invalid GraphQL response: " + e.getOriginalMessage(), e);
		}

		JsonNode errors = root.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			JsonNode data = root.path("data");
			if (data.isMissingNode() || data.isNull()) {
				throw new MalformedResponseException(
						"GraphQL query failed: " + errors.path(0).path("message").asText("unknown error"));
			}
			logger.debug("GraphQL returned partial data with {} error(s), first: {}", errors.size(),
					errors.path(0).path("message").asText(""));
		}
		return root.path("data");
	}

}
