package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Thrown when the GitHub quota is exhausted. Fatal for the current run: worker pools stop
 * submitting tasks and the exception reaches the top-level caller with the reset time.
 */
public class RateLimitExceededException extends RuntimeException {

	private static final DateTimeFormatter RESET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z")
		.withZone(ZoneId.systemDefault());

	private final @Nullable Instant resetTime;

	public RateLimitExceededException(@Nullable Instant resetTime) {
		this(resetTime, null);
	}

	public RateLimitExceededException(@Nullable Instant resetTime, @Nullable Throwable cause) {
		super(describe(resetTime), cause);
		this.resetTime = resetTime;
	}

	/**
	 * Build from epoch seconds as reported in {@code X-RateLimit-Reset}.
	 * @param resetEpochSeconds reset time, or a non-positive value when unknown
	 * @param cause underlying failure
	 * @return the exception
	 */
	public static RateLimitExceededException fromEpochSeconds(long resetEpochSeconds, @Nullable Throwable cause) {
		return new RateLimitExceededException(resetEpochSeconds > 0 ? Instant.ofEpochSecond(resetEpochSeconds) : null,
				cause);
	}

	/**
	 * When the quota resets, if GitHub told us.
	 * @return reset instant, or null when unknown
	 */
	public @Nullable Instant getResetTime() {
		return resetTime;
	}

	private static String describe(@Nullable Instant resetTime) {
		if (resetTime == null) {
			return "GitHub API rate limit exceeded";
		}
		long minutes = Math.max(0, Duration.between(Instant.now(), resetTime).toMinutes());
		return "GitHub API rate limit exceeded. Resets at " + RESET_FORMAT.format(resetTime) + " (in " + minutes
				+ " minutes)";
	}

}
