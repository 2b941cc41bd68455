package org.springaicommunity.github.chronicle;

/**
 * Classification of a failed GitHub request. Drives what {@link RetryingGitHubClient}
 * does with the failure.
 */
public enum FailureClass {

	/**
	 * Server errors (5xx), network failures and timeouts. Retried with backoff, then
	 * tolerated as missing data.
	 */
	TRANSIENT,

	/**
	 * Quota exhausted (429, 403 with no remaining requests, GraphQL RATE_LIMITED). Fatal
	 * for the run.
	 */
	RATE_LIMITED,

	/**
	 * Missing, forbidden, blocked or empty resources. Treated as an empty result.
	 */
	NOT_FOUND,

	/**
	 * Any other client error (bad credentials, invalid query). Fatal.
	 */
	OTHER;

	/**
	 * Classify an HTTP status code.
	 * @param statusCode HTTP status, or -1 when no response was received
	 * @param rateLimitRemaining value of {@code X-RateLimit-Remaining}, or -1 if absent
	 * @return the failure class
	 */
	public static FailureClass fromStatus(int statusCode, int rateLimitRemaining) {
		if (statusCode < 0 || statusCode == 408 || statusCode >= 500) {
			return TRANSIENT;
		}
		if (statusCode == 429 || (statusCode == 403 && rateLimitRemaining == 0)) {
			return RATE_LIMITED;
		}
		return switch (statusCode) {
			case 403, 404, 409, 410, 451 -> NOT_FOUND;
			default -> OTHER;
		};
	}

}
