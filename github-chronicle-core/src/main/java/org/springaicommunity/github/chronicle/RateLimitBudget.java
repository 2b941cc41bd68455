package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Quota gate for a run.
 *
 * <p>
 * Tracks the {@code graphql} pool, which the contribution and review queries drain; the
 * {@code core} pool is usually far healthier and would mislead. Refreshed once before
 * any gated decision and read-only afterwards.
 *
 * <p>
 * The cost model has two phases: batched contribution summaries for all candidates
 * ({@code ceil(members / 10)} calls), then full gathering for active members, which
 * grows sub-linearly with the window because repositories and pull requests are
 * revisited rather than newly discovered.
 */
public class RateLimitBudget {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitBudget.class);

	static final String RESOURCE = "graphql";

	/**
	 * Calls per member for a one-week window, calibrated on real organizations.
	 */
	static final double CALLS_PER_MEMBER_WEEK = 2.4;

	static final double TIME_SCALING_EXPONENT = 0.4;

	private static final double TOTAL_SHARE_WARNING = 0.5;

	private static final double REMAINING_SHARE_WARNING = 0.8;

	private final RestService restService;

	private final int batchSize;

	private final int total;

	private final int abortFloor;

	private final Clock clock;

	private volatile @Nullable RateLimitInfo current;

	public RateLimitBudget(RestService restService, ChronicleProperties properties) {
		this(restService, properties, Clock.systemUTC());
	}

	RateLimitBudget(RestService restService, ChronicleProperties properties, Clock clock) {
		this.restService = restService;
		this.batchSize = properties.getUserBatchSize();
		this.total = properties.getRateLimitTotal();
		this.abortFloor = properties.getAbortFloor();
		this.clock = clock;
	}

	/**
	 * Query the current quota of the GraphQL pool. Failure propagates: nothing downstream
	 * can run without knowing the budget.
	 * @return the quota status
	 */
	public RateLimitInfo refresh() {
		RateLimitInfo info = restService.getRateLimit(RESOURCE);
		this.current = info;
		logger.info("GraphQL rate limit: {}/{} remaining, resets at {}", info.remaining(), info.limit(),
				info.getResetTime());
		return info;
	}

	/**
	 * The status from the last {@link #refresh()}, or null before the first one.
	 */
	public @Nullable RateLimitInfo getCurrent() {
		return current;
	}

	/**
	 * Remaining quota from the last {@link #refresh()}.
	 * @return remaining requests, or null before the first refresh
	 */
	public @Nullable Integer remaining() {
		RateLimitInfo info = current;
		return info != null ? info.remaining() : null;
	}

	/**
	 * Project the API calls of a run over the full membership.
	 * @param memberCount candidate members
	 * @param days window length in days
	 * @return projected calls
	 */
	public long estimate(int memberCount, int days) {
		return estimate(memberCount, days, false);
	}

	/**
	 * Project the API calls of a run.
	 * @param memberCount members to gather
	 * @param days window length in days
	 * @param knownActive true when the members are already known to be active, which
	 * skips the summary phase
	 * @return projected calls
	 */
	public long estimate(int memberCount, int days, boolean knownActive) {
		if (memberCount <= 0) {
			return 0;
		}
		long summaryCalls = knownActive ? 0 : (memberCount + batchSize - 1) / batchSize;
		double gatherCalls = memberCount * CALLS_PER_MEMBER_WEEK
				* Math.pow(Math.max(days, 1) / 7.0, TIME_SCALING_EXPONENT);
		return Math.round(summaryCalls + gatherCalls);
	}

	/**
	 * Whether a run is expensive enough to ask before starting: the estimate exceeds half
	 * of the total hourly budget or 80% of what is left.
	 * @param estimate projected calls
	 * @param remaining remaining quota, null when unknown
	 * @return true to warn
	 */
	public boolean shouldWarn(long estimate, @Nullable Integer remaining) {
		int available = remaining != null ? remaining : total;
		return estimate > total * TOTAL_SHARE_WARNING || estimate > available * REMAINING_SHARE_WARNING;
	}

	/**
	 * Human-readable warning for an expensive run.
	 * @param estimate projected calls
	 * @param remaining remaining quota, null when unknown
	 * @return warning text
	 */
	public String warningMessage(long estimate, @Nullable Integer remaining) {
		int available = remaining != null ? remaining : total;
		long percent = available > 0 ? Math.round(estimate * 100.0 / available) : 100;
		return String.format(Locale.ROOT,
				"This run needs about %,d API calls, %d%% of the %,d remaining (hourly budget %,d).", estimate, percent,
				available, total);
	}

	/**
	 * Whether the quota is too low for any run to be worthwhile. No confirmation is
	 * offered in that case.
	 * @param remaining remaining quota
	 * @return true if remaining is below the absolute floor
	 */
	public boolean shouldAbort(int remaining) {
		return remaining < abortFloor;
	}

	/**
	 * Sleep until the quota resets if that happens within {@code maxWait}.
	 * @param maxWait longest acceptable wait
	 * @return true if the quota has reset (immediately or after waiting), false if the
	 * reset is further away or unknown
	 */
	public boolean waitForReset(Duration maxWait) {
		RateLimitInfo info = current;
		if (info == null || info.reset() <= 0) {
			logger.warn("Rate limit reset time unknown, not waiting");
			return false;
		}
		Duration untilReset = Duration.between(Instant.now(clock), info.getResetTime());
		if (untilReset.isNegative() || untilReset.isZero()) {
			return true;
		}
		if (untilReset.compareTo(maxWait) > 0) {
			logger.info("Rate limit resets in {} minutes, longer than the {} minute limit", untilReset.toMinutes(),
					maxWait.toMinutes());
			return false;
		}
		logger.info("Waiting {} seconds for the rate limit to reset", untilReset.toSeconds() + 1);
		try {
			Thread.sleep(untilReset.toMillis() + 1000);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for rate limit reset", e);
		}
		return true;
	}

	/**
	 * The exception to raise when a run cannot start for lack of quota.
	 */
	public RateLimitExceededException exhausted() {
		RateLimitInfo info = current;
		return new RateLimitExceededException(info != null ? info.getResetTime() : null);
	}

}
