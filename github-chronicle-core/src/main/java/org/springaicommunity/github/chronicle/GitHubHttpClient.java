package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP transport for GitHub built on the JDK {@link HttpClient}.
 *
 * <p>
 * Every non-2xx response becomes a {@link GitHubApiException} classified by
 * {@link FailureClass}. Rate limit headers are captured from all API responses and
 * exposed per pool via {@link #getRateLimitInfo(String)}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String GITHUB_API_BASE = "https://api.github.com";

	private static final String GITHUB_GRAPHQL_ENDPOINT = "https://api.github.com/graphql";

	private static final String USER_AGENT = "github-chronicle";

	private static final String GRAPHQL_RATE_LIMITED = "\"type\":\"RATE_LIMITED\"";

	private final HttpClient httpClient;

	private final String token;

	private final Duration requestTimeout;

	private final Map<String, RateLimitInfo> rateLimitByResource = new ConcurrentHashMap<>();

	public GitHubHttpClient(String token) {
		this(token, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(String token, Duration requestTimeout) {
		this.token = token;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getRateLimitInfo(String resource) {
		return rateLimitByResource.get(resource);
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : GITHUB_API_BASE + path;
		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Authorization", "token " + token)
			.header("Accept", "application/vnd.github+json")
			.header("User-Agent", USER_AGENT)
			.GET()
			.build();
		return timed("GET " + url, request, GitHubClient.resourceFor(path));
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = GITHUB_API_BASE + path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	@Override
	public String postGraphQL(String body) {
		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(GITHUB_GRAPHQL_ENDPOINT))
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		String response = timed("POST GraphQL (" + body.length() + " bytes)", request, "graphql");
		// GraphQL reports quota exhaustion with a 200 and an error entry
		if (response.contains(GRAPHQL_RATE_LIMITED)) {
			RateLimitInfo info = rateLimitByResource.get("graphql");
			throw new GitHubApiException("GraphQL rate limit exceeded", 200, response,
					info != null ? info.reset() : -1, FailureClass.RATE_LIMITED);
		}
		return response;
	}

	@Override
	public String getPage(String url) {
		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("Accept", "text/html")
			.header("User-Agent", USER_AGENT)
			.GET()
			.build();
		try {
			return timed("GET page " + url, request, null);
		}
		catch (GitHubApiException e) {
			// Page throttling is not API quota, the probe is simply retried or abandoned
			if (e.getFailureClass() == FailureClass.RATE_LIMITED) {
				throw new GitHubApiException("Page request throttled: " + url, e.getStatusCode(), null, -1,
						FailureClass.TRANSIENT);
			}
			throw e;
		}
	}

	private String timed(String description, HttpRequest request, @Nullable String resource) {
		logger.debug("{}", description);
		long start = System.currentTimeMillis();
		try {
			String response = executeRequest(request, resource);
			logger.debug("{} completed in {}ms ({} bytes)", description, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("{} failed after {}ms: {}", description, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request, @Nullable String resource) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (resource != null && remaining >= 0) {
				String pool = response.headers().firstValue("X-RateLimit-Resource").orElse(resource);
				rateLimitByResource.put(pool, new RateLimitInfo(limit, remaining, reset, used, pool));
				if (remaining < 100) {
					logger.info("Rate limit low: {}/{} remaining in {}, resets at epoch {}", remaining, limit, pool,
							reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining in {}, resets at epoch {}", remaining, limit, pool,
							reset);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			throw new GitHubApiException(describe(statusCode, remaining, reset, request), statusCode, response.body(),
					remaining, reset);
		}
		catch (IOException e) {
			logger.warn("HTTP request to {} failed: {}", request.uri(), e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static String describe(int statusCode, int remaining, long reset, HttpRequest request) {
		if (statusCode == 401) {
			return "Unauthorized: Bad credentials. Check your GITHUB_TOKEN.";
		}
		if (statusCode == 429 || (statusCode == 403 && remaining == 0)) {
			return "Rate limit exceeded (" + statusCode + "). Resets at epoch: " + reset;
		}
		if (statusCode == 403) {
			return "Forbidden: " + request.uri();
		}
		if (statusCode == 404) {
			return "Not found: " + request.uri();
		}
		return "GitHub API error " + statusCode + ": " + request.uri();
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when a GitHub request fails.
	 *
	 * <p>
	 * Carries the {@link FailureClass} and, when available, rate limit information so
	 * that {@link RetryingGitHubClient} can decide between retrying, returning no data
	 * and failing the run.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final long resetEpochSeconds;

		private final FailureClass failureClass;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			this(message, statusCode, responseBody, resetEpochSeconds,
					FailureClass.fromStatus(statusCode, rateLimitRemaining));
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				long resetEpochSeconds, FailureClass failureClass) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.resetEpochSeconds = resetEpochSeconds;
			this.failureClass = failureClass;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.resetEpochSeconds = -1;
			this.failureClass = FailureClass.TRANSIENT;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		public FailureClass getFailureClass() {
			return failureClass;
		}

	}

}
