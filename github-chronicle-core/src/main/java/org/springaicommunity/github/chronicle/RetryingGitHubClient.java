package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Decorator that applies the failure policy of a run to a {@link GitHubClient}.
 *
 * <p>
 * Behavior per {@link FailureClass}:
 * <ul>
 * <li>{@code TRANSIENT}: retried with exponential backoff (1s, 2s, 4s by default). Once
 * retries are exhausted the call returns {@code null} so one failed request never aborts
 * a multi-subject report</li>
 * <li>{@code RATE_LIMITED}: rethrown as {@link RateLimitExceededException} carrying the
 * reset time</li>
 * <li>{@code NOT_FOUND}: returns {@code null} (private profile, deleted repository)</li>
 * <li>{@code OTHER}: rethrown unchanged</li>
 * </ul>
 *
 * <p>
 * Successful responses are also paced: when the remaining quota drops below a threshold
 * the client spreads the remaining requests over the time left until reset.
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(3)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final int pacingThreshold;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.pacingThreshold = builder.pacingThreshold;
	}

	/**
	 * Create a new builder for RetryingGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public @Nullable String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path, GitHubClient.resourceFor(path));
	}

	@Override
	public @Nullable String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc,
				GitHubClient.resourceFor(path));
	}

	@Override
	public @Nullable String postGraphQL(String body) {
		return executeWithRetry(() -> delegate.postGraphQL(body), "POST GraphQL", "graphql");
	}

	@Override
	public @Nullable String getPage(String url) {
		return executeWithRetry(() -> delegate.getPage(url), "GET page " + url, null);
	}

	@Override
	public @Nullable RateLimitInfo getRateLimitInfo(String resource) {
		return delegate.getRateLimitInfo(resource);
	}

	private @Nullable String executeWithRetry(RequestSupplier supplier, String description,
			@Nullable String resource) {
		RuntimeException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				String result = supplier.get();
				paceIfNeeded(description, resource);
				return result;
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				switch (e.getFailureClass()) {
					case RATE_LIMITED:
						throw RateLimitExceededException.fromEpochSeconds(e.getResetEpochSeconds(), e);
					case NOT_FOUND:
						logger.debug("{} returned no data ({})", description, e.getStatusCode());
						return null;
					case OTHER:
						logger.debug("{} failed with status {}: {}", description, e.getStatusCode(),
								e.getResponseBody());
						throw e;
					default:
						lastException = e;
				}
			}
			catch (RateLimitExceededException | MalformedResponseException e) {
				throw e;
			}
			catch (RuntimeException e) {
				// Anything the transport did not classify is treated as infrastructure
				lastException = e;
			}

			if (attempt < maxRetries) {
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
						maxRetries + 1, lastException.getMessage(), delay);
				sleep(delay);
				delay *= 2;
			}
		}

		logger.warn("{} failed after {} attempts, continuing without data: {}", description, maxRetries + 1,
				lastException != null ? lastException.getMessage() : "unknown error");
		return null;
	}

	/**
	 * After a successful request, slow down when little quota is left in the pool the
	 * request drew from so the remaining requests spread evenly until reset.
	 */
	private void paceIfNeeded(String description, @Nullable String resource) {
		if (resource == null) {
			return;
		}
		RateLimitInfo info = delegate.getRateLimitInfo(resource);
		if (info == null || info.isExceeded() || info.remaining() >= pacingThreshold) {
			return;
		}

		long secondsUntilReset = info.reset() - Instant.now().getEpochSecond();
		if (secondsUntilReset > 0) {
			long paceMs = (secondsUntilReset * 1000) / info.remaining();
			paceMs = Math.min(paceMs, 10_000);
			paceMs = Math.max(paceMs, 100);

			logger.debug("Pacing: {}/{} remaining in {}, sleeping {}ms ({})", info.remaining(), info.limit(),
					info.resource(), paceMs, description);
			sleep(paceMs);
		}
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		@Nullable
		String get();

	}

	/**
	 * Builder for {@link RetryingGitHubClient}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay, pacing below 100 remaining requests.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private int pacingThreshold = 100;

		private Builder() {
		}

		/**
		 * Set the client to wrap.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the number of retries after the first attempt.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the delay before the first retry. Doubles on each further retry.
		 * @param delay initial delay (default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the delay before the first retry in milliseconds.
		 * @param delayMs initial delay in milliseconds (default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the remaining request count below which successful requests are paced.
		 * @param threshold remaining request threshold (default: 100)
		 * @return this builder
		 */
		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
