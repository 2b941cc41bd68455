package org.springaicommunity.github.chronicle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Service for GitHub REST API operations and the public contribution calendar.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed DTOs at the service boundary.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private static final String CONTRIBUTIONS_PAGE = "https://github.com/users/%s/contributions?from=%s&to=%s";

	private static final int PER_PAGE = 100;

	private static final int MAX_LIST_PAGES = 10;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int searchResultCap;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this(httpClient, objectMapper, new ChronicleProperties());
	}

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper, ChronicleProperties properties) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.searchResultCap = properties.getSearchResultCap();
	}

	@Override
	public RateLimitInfo getRateLimit(String resource) {
		String response = httpClient.get("/rate_limit");
		if (response == null) {
			throw new MalformedResponseException("Rate limit status unavailable");
		}
		JsonNode pool = readTree(response, "/rate_limit").path("resources").path(resource);
		if (pool.isMissingNode()) {
			throw new MalformedResponseException("Rate limit status has no '" + resource + "' pool");
		}
		return new RateLimitInfo(pool.path("limit").asInt(0), pool.path("remaining").asInt(0),
				pool.path("reset").asLong(0), pool.path("used").asInt(0), resource);
	}

	@Override
	public SearchResult<Commit> searchCommits(String login, LocalDate from, LocalDate to, int page) {
		String query = "author:" + login + " committer-date:" + from + ".." + to;
		String queryString = "q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
				+ "&sort=committer-date&order=desc&per_page=" + PER_PAGE + "&page=" + page;

		JsonNode result = getJson("/search/commits", queryString);
		List<Commit> commits = new ArrayList<>();
		for (JsonNode item : result.path("items")) {
			Commit commit = parseSearchCommit(item, login);
			if (commit != null) {
				commits.add(commit);
			}
		}

		int totalCount = result.path("total_count").asInt(0);
		int reachable = Math.min(totalCount, searchResultCap);
		boolean hasMore = commits.size() == PER_PAGE && page * PER_PAGE < reachable;
		if (!hasMore && totalCount > searchResultCap && page * PER_PAGE >= searchResultCap) {
			logger.info("Commit search for {} matched {} commits, only the first {} are available", login,
					totalCount, searchResultCap);
		}
		return new SearchResult<>(commits, hasMore ? String.valueOf(page + 1) : null, hasMore, totalCount);
	}

	@Override
	public @Nullable CommitStats getCommitStats(String repository, String sha) {
		String response = httpClient.get("/repos/" + repository + "/commits/" + sha);
		if (response == null) {
			return null;
		}
		JsonNode stats = readTree(response, "commit " + sha).path("stats");
		if (stats.isMissingNode() || stats.isNull()) {
			return null;
		}
		return new CommitStats(stats.path("additions").asInt(0), stats.path("deletions").asInt(0));
	}

	@Override
	public List<Branch> getBranches(String repository) {
		List<Branch> branches = new ArrayList<>();
		for (int page = 1; page <= MAX_LIST_PAGES; page++) {
			JsonNode nodes = getJson("/repos/" + repository + "/branches", "per_page=" + PER_PAGE + "&page=" + page);
			for (JsonNode node : nodes) {
				String name = node.path("name").asText("");
				if (!name.isEmpty()) {
					branches.add(new Branch(name, node.path("commit").path("sha").asText("")));
				}
			}
			if (nodes.size() < PER_PAGE) {
				break;
			}
		}
		return branches;
	}

	@Override
	public List<Commit> getBranchCommits(String repository, String branch, String login, LocalDate from,
			LocalDate to) {
		String since = from.atStartOfDay().toInstant(ZoneOffset.UTC).toString();
		String until = to.atTime(23, 59, 59).toInstant(ZoneOffset.UTC).toString();
		List<Commit> commits = new ArrayList<>();
		for (int page = 1; page <= MAX_LIST_PAGES; page++) {
			String queryString = "sha=" + URLEncoder.encode(branch, StandardCharsets.UTF_8) + "&author="
					+ URLEncoder.encode(login, StandardCharsets.UTF_8) + "&since=" + since + "&until=" + until
					+ "&per_page=" + PER_PAGE + "&page=" + page;
			JsonNode nodes = getJson("/repos/" + repository + "/commits", queryString);
			for (JsonNode node : nodes) {
				String sha = node.path("sha").asText("");
				if (!sha.isEmpty()) {
					commits.add(Commit.discovered(sha, repository, login,
							parseInstant(node.path("commit").path("committer").path("date").asText(null)), branch));
				}
			}
			if (nodes.size() < PER_PAGE) {
				break;
			}
		}
		return commits;
	}

	@Override
	public Map<String, Long> getLanguages(String repository) {
		JsonNode node = getJson("/repos/" + repository + "/languages", null);
		Map<String, Long> languages = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			languages.put(field.getKey(), field.getValue().asLong(0));
		}
		return languages;
	}

	@Override
	public List<String> getTopics(String repository) {
		JsonNode node = getJson("/repos/" + repository + "/topics", null);
		List<String> topics = new ArrayList<>();
		for (JsonNode name : node.path("names")) {
			topics.add(name.asText());
		}
		return topics;
	}

	@Override
	public @Nullable OrganizationProfile getOrganization(String organization) {
		JsonNode node = getJson("/orgs/" + organization, null);
		if (node.isMissingNode() || !node.isObject()) {
			return null;
		}
		return new OrganizationProfile(node.path("login").asText(organization), textOrNull(node.path("name")),
				textOrNull(node.path("description")), textOrNull(node.path("blog")));
	}

	@Override
	public List<String> getOrganizationMembers(String organization) {
		return listLogins("/orgs/" + organization + "/members");
	}

	@Override
	public List<String> getTeamMembers(String organization, String teamSlug) {
		return listLogins("/orgs/" + organization + "/teams/" + teamSlug + "/members");
	}

	@Override
	public @Nullable Map<LocalDate, Integer> getContributionCalendar(String login, LocalDate from, LocalDate to) {
		String html = httpClient.getPage(String.format(CONTRIBUTIONS_PAGE, login, from, to));
		if (html == null) {
			return null;
		}
		return parseContributionCalendar(html);
	}

	/**
	 * Extract the per-day activity levels from a contribution calendar page.
	 * @param html page markup
	 * @return level per day, or null if the page holds no calendar
	 */
	static @Nullable Map<LocalDate, Integer> parseContributionCalendar(String html) {
		Document document = Jsoup.parse(html);
		Map<LocalDate, Integer> levels = new TreeMap<>();
		for (Element cell : document.select("[data-date][data-level]")) {
			try {
				levels.put(LocalDate.parse(cell.attr("data-date")), Integer.parseInt(cell.attr("data-level")));
			}
			catch (DateTimeParseException | NumberFormatException e) {
				logger.debug("Ignoring calendar cell {}/{}: {}", cell.attr("data-date"), cell.attr("data-level"),
						e.getMessage());
			}
		}
		return levels.isEmpty() ? null : levels;
	}

	// ========== JSON Parsing Methods (at service boundary) ==========

	private @Nullable Commit parseSearchCommit(JsonNode item, String login) {
		String sha = item.path("sha").asText("");
		String repository = item.path("repository").path("full_name").asText("");
		if (sha.isEmpty() || repository.isEmpty()) {
			return null;
		}
		String author = item.path("author").path("login").asText(login);
		return Commit.discovered(sha, repository, author,
				parseInstant(item.path("commit").path("committer").path("date").asText(null)), null);
	}

	private List<String> listLogins(String path) {
		List<String> logins = new ArrayList<>();
		for (int page = 1; page <= MAX_LIST_PAGES * 10; page++) {
			JsonNode nodes = getJson(path, "per_page=" + PER_PAGE + "&page=" + page);
			for (JsonNode node : nodes) {
				String login = node.path("login").asText("");
				if (!login.isEmpty()) {
					logins.add(login);
				}
			}
			if (nodes.size() < PER_PAGE) {
				break;
			}
		}
		return logins;
	}

	private static @Nullable Instant parseInstant(@Nullable String value) {
		if (value == null || value.isEmpty()) {
			return null;
		}
		try {
			return OffsetDateTime.parse(value).toInstant();
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse timestamp: {}", value);
			return null;
		}
	}

	private static @Nullable String textOrNull(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return null;
		}
		String text = node.asText("");
		return text.isBlank() ? null : text;
	}

	private JsonNode getJson(String path, @Nullable String queryString) {
		String response = httpClient.getWithQuery(path, queryString);
		if (response == null) {
			return MissingNode.getInstance();
		}
		return readTree(response, path);
	}

	private JsonNode readTree(String response, String description) {
		try {
			return objectMapper.readTree(response);
		}
		catch (JsonProcessingException e) {
			throw new MalformedResponseException("Invalid JSON from " + description + ": " + e.getOriginalMessage(),
					e);
		}
	}

}
