package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers the pull requests a subject created and the ones they reviewed.
 *
 * <p>
 * Review contributions come one per submitted review, so a pull request reviewed three
 * times arrives three times; they are collapsed by URL into one record whose
 * {@code reviewCount} is the number of reviews. Pull requests authored by bots are dropped
 * from the reviewed pool.
 */
public class ReviewAggregator {

	private static final Logger logger = LoggerFactory.getLogger(ReviewAggregator.class);

	/**
	 * Hard stop on nodes read per pool, matching the search API cap.
	 */
	static final int MAX_NODES = 1000;

	private final GraphQLService graphQLService;

	public ReviewAggregator(GraphQLService graphQLService) {
		this.graphQLService = graphQLService;
	}

	/**
	 * Pull requests reviewed by the subject, one record per URL.
	 * @param login reviewer login
	 * @param from first day of the window
	 * @param to last day of the window
	 * @return reviewed pull requests with review counts
	 */
	public List<PullRequestRecord> collectReviewed(String login, LocalDate from, LocalDate to) {
		List<PullRequestRecord> nodes = readAll(after -> graphQLService.getReviewContributions(login, from, to, after));
		List<PullRequestRecord> reviewed = aggregate(nodes);
		logger.debug("{}: {} review contributions on {} pull requests", login, nodes.size(), reviewed.size());
		return reviewed;
	}

	/**
	 * Pull requests created by the subject, one record per URL.
	 * @param login author login
	 * @param from first day of the window
	 * @param to last day of the window
	 * @return created pull requests
	 */
	public List<PullRequestRecord> collectCreated(String login, LocalDate from, LocalDate to) {
		List<PullRequestRecord> nodes = readAll(
				after -> graphQLService.searchPullRequestsCreated(login, from, to, after));
		return dedupe(nodes);
	}

	/**
	 * Drop bot-authored pull requests and collapse review contributions by URL.
	 * @param reviewContributions one entry per review, in any order
	 * @return one record per URL, first occurrence order, with the review count
	 */
	public static List<PullRequestRecord> aggregate(Collection<PullRequestRecord> reviewContributions) {
		Map<String, PullRequestRecord> byUrl = new LinkedHashMap<>();
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (PullRequestRecord pr : reviewContributions) {
			if (BotAccounts.isBot(pr.author())) {
				continue;
			}
			byUrl.putIfAbsent(pr.url(), pr);
			counts.merge(pr.url(), 1, Integer::sum);
		}
		List<PullRequestRecord> reviewed = new ArrayList<>(byUrl.size());
		for (PullRequestRecord pr : byUrl.values()) {
			reviewed.add(pr.withReviewCount(counts.get(pr.url())));
		}
		return reviewed;
	}

	/**
	 * Keep the first record per URL.
	 */
	public static List<PullRequestRecord> dedupe(Collection<PullRequestRecord> pullRequests) {
		Map<String, PullRequestRecord> byUrl = new LinkedHashMap<>();
		for (PullRequestRecord pr : pullRequests) {
			byUrl.putIfAbsent(pr.url(), pr);
		}
		return new ArrayList<>(byUrl.values());
	}

	private static List<PullRequestRecord> readAll(PageReader reader) {
		List<PullRequestRecord> nodes = new ArrayList<>();
		String cursor = null;
		do {
			SearchResult<PullRequestRecord> page = reader.read(cursor);
			nodes.addAll(page.items());
			cursor = page.hasMore() && !page.items().isEmpty() ? page.nextCursor() : null;
		}
		while (cursor != null && nodes.size() < MAX_NODES);
		return nodes.size() > MAX_NODES ? new ArrayList<>(nodes.subList(0, MAX_NODES)) : nodes;
	}

	@FunctionalInterface
	private interface PageReader {

		SearchResult<PullRequestRecord> read(@Nullable String after);

	}

}
