package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub HTTP operations.
 *
 * <p>
 * A request goes in as (protocol, endpoint, parameters) and comes back as a body or a
 * {@link GitHubHttpClient.GitHubApiException} carrying a {@link FailureClass}. How the
 * transport authenticates is up to the implementation.
 *
 * <p>
 * Decorators such as {@link RetryingGitHubClient} may turn empty-result failures into a
 * {@code null} body, so callers must treat {@code null} as "no data".
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return response body, or null if no data is available
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	@Nullable
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString query string (without leading ?)
	 * @return response body, or null if no data is available
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	@Nullable
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Execute a POST request to the GitHub GraphQL API.
	 * @param body request body (JSON)
	 * @return response body, or null if no data is available
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	@Nullable
	String postGraphQL(String body);

	/**
	 * Fetch a public HTML page from github.com without authentication. Does not consume
	 * API quota.
	 * @param url absolute page URL
	 * @return page body, or null if no data is available
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	@Nullable
	String getPage(String url);

	/**
	 * Get the rate limit information from the most recent API response of one pool.
	 * Returns null if no rate limit headers have been observed for that pool yet.
	 * @param resource pool name ({@code core}, {@code search}, {@code graphql})
	 * @return last observed RateLimitInfo of the pool, or null
	 */
	default @Nullable RateLimitInfo getRateLimitInfo(String resource) {
		return null;
	}

	/**
	 * The rate limit pool a REST path draws from.
	 * @param path API path or full URL
	 * @return {@code search} for search endpoints, otherwise {@code core}
	 */
	static String resourceFor(String path) {
		return path.contains("/search/") ? "search" : "core";
	}

}
