package org.springaicommunity.github.chronicle;

import java.time.Instant;

/**
 * Quota status of one GitHub rate limit pool.
 *
 * <p>
 * GitHub tracks separate pools per protocol ({@code core} for REST resources,
 * {@code graphql}, {@code search}); the contribution and review queries that dominate a
 * run draw from {@code graphql}.
 *
 * @param limit the maximum number of requests allowed per window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the window resets (epoch seconds)
 * @param used the number of requests used in the current window
 * @param resource the pool this status describes
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used, String resource) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the pool has no requests left.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
