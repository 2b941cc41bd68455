package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-phase filter that keeps inactive organization members out of full gathering.
 *
 * <p>
 * Phase 1 probes every member's public contribution calendar on the scrape pool. It
 * costs no API quota. A member is active if any day in range has a nonzero level, and
 * inactive if the calendar was read and every day is zero. Members whose probe failed
 * go to phase 1b, which asks the GraphQL contribution summary for them in batches on the
 * member pool. Members missing from a summary response count as inactive. Rate limit
 * exhaustion in phase 1b stops further batches and propagates.
 */
public class ActivityScanner {

	private static final Logger logger = LoggerFactory.getLogger(ActivityScanner.class);

	private final RestService restService;

	private final GraphQLService graphQLService;

	private final WorkerPool scrapePool;

	private final WorkerPool memberPool;

	private final int batchSize;

	public ActivityScanner(RestService restService, GraphQLService graphQLService, WorkerPool scrapePool,
			WorkerPool memberPool, ChronicleProperties properties) {
		this.restService = restService;
		this.graphQLService = graphQLService;
		this.scrapePool = scrapePool;
		this.memberPool = memberPool;
		this.batchSize = properties.getUserBatchSize();
	}

	/**
	 * Split members into active, inactive and unknown for the range.
	 * @param logins candidate members
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return the scan result
	 */
	public ActivityScan scan(Collection<String> logins, LocalDate from, LocalDate to) {
		Set<String> active = new LinkedHashSet<>();
		Set<String> inactive = new LinkedHashSet<>();
		Set<String> unknown = new LinkedHashSet<>();

		logger.info("Scanning {} members for activity between {} and {}", logins.size(), from, to);
		List<TaskOutcome<String, Map<LocalDate, Integer>>> probes = scrapePool.execute(logins,
				login -> restService.getContributionCalendar(login, from, to));
		for (TaskOutcome<String, Map<LocalDate, Integer>> probe : probes) {
			Boolean result = probe.isSuccess() ? isActive(probe.value(), from, to) : null;
			if (result == null) {
				unknown.add(probe.input());
			}
			else if (result) {
				active.add(probe.input());
			}
			else {
				inactive.add(probe.input());
			}
		}
		logger.info("Calendar scan: {} active, {} inactive, {} unknown", active.size(), inactive.size(),
				unknown.size());

		if (!unknown.isEmpty()) {
			resolveWithSummaries(unknown, active, inactive, from, to);
		}
		return new ActivityScan(Set.copyOf(active), Set.copyOf(inactive), Set.copyOf(unknown));
	}

	private void resolveWithSummaries(Set<String> unknown, Set<String> active, Set<String> inactive, LocalDate from,
			LocalDate to) {
		List<List<String>> batches = partition(new ArrayList<>(unknown), batchSize);
		logger.info("Checking {} members via {} contribution summary batch(es)", unknown.size(), batches.size());

		List<TaskOutcome<List<String>, Map<String, ContributionSummary>>> outcomes = memberPool.execute(batches,
				batch -> graphQLService.getContributionSummaries(batch, from, to));
		for (TaskOutcome<List<String>, Map<String, ContributionSummary>> outcome : outcomes) {
			Map<String, ContributionSummary> summaries = outcome.value();
			if (!outcome.isSuccess() || summaries == null) {
				logger.warn("Contribution summary batch failed, {} member(s) stay unknown", outcome.input().size());
				continue;
			}
			for (String login : outcome.input()) {
				ContributionSummary summary = summaries.get(login);
				unknown.remove(login);
				if (summary != null && summary.hasActivity()) {
					active.add(login);
				}
				else {
					inactive.add(login);
				}
			}
		}
	}

	/**
	 * Decide activity from a contribution calendar.
	 * @param levels level per day, null when the probe failed
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return true if any day in range is nonzero, false if none is, null if unknown
	 */
	static @Nullable Boolean isActive(@Nullable Map<LocalDate, Integer> levels, LocalDate from, LocalDate to) {
		if (levels == null) {
			return null;
		}
		for (Map.Entry<LocalDate, Integer> day : levels.entrySet()) {
			if (!day.getKey().isBefore(from) && !day.getKey().isAfter(to) && day.getValue() > 0) {
				return true;
			}
		}
		return false;
	}

	static <T> List<List<T>> partition(List<T> items, int size) {
		List<List<T>> batches = new ArrayList<>();
		for (int start = 0; start < items.size(); start += size) {
			batches.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
		}
		return batches;
	}

}
