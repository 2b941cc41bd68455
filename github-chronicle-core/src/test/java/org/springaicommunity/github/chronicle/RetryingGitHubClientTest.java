package org.springaicommunity.github.chronicle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingGitHubClient}.
 *
 * Tests the failure policy: retry with backoff, empty results and fatal errors.
 */
@DisplayName("RetryingGitHubClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingGitHubClientTest {

	@Mock
	private GitHubClient mockDelegate;

	private RetryingGitHubClient retryingClient;

	@BeforeEach
	void setUp() {
		// Use minimal delay for fast tests
		retryingClient = RetryingGitHubClient.builder().wrapping(mockDelegate).maxRetries(3).initialDelayMs(1).build();
	}

	private static GitHubHttpClient.GitHubApiException apiError(int status) {
		return new GitHubHttpClient.GitHubApiException("HTTP " + status, status, "body");
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate get() to wrapped client")
		void shouldDelegateGet() {
			when(mockDelegate.get("/repos/owner/repo")).thenReturn("{\"name\":\"repo\"}");

			String result = retryingClient.get("/repos/owner/repo");

			assertThat(result).isEqualTo("{\"name\":\"repo\"}");
			verify(mockDelegate, times(1)).get("/repos/owner/repo");
		}

		@Test
		@DisplayName("Should delegate postGraphQL() to wrapped client")
		void shouldDelegatePostGraphQL() {
			when(mockDelegate.postGraphQL("{\"query\":\"{ viewer { login } }\"}"))
				.thenReturn("{\"data\":{\"viewer\":{\"login\":\"user\"}}}");

			String result = retryingClient.postGraphQL("{\"query\":\"{ viewer { login } }\"}");

			assertThat(result).isEqualTo("{\"data\":{\"viewer\":{\"login\":\"user\"}}}");
		}

		@Test
		@DisplayName("Should delegate getPage() to wrapped client")
		void shouldDelegateGetPage() {
			when(mockDelegate.getPage("https://github.com/users/alice/contributions")).thenReturn("<html></html>");

			assertThat(retryingClient.getPage("https://github.com/users/alice/contributions"))
				.isEqualTo("<html></html>");
		}

		@Test
		@DisplayName("Should handle null query string in getWithQuery()")
		void shouldHandleNullQueryString() {
			when(mockDelegate.getWithQuery("/path", null)).thenReturn("response");

			assertThat(retryingClient.getWithQuery("/path", null)).isEqualTo("response");
			verify(mockDelegate).getWithQuery("/path", null);
		}

	}

	@Nested
	@DisplayName("Transient Failure Tests")
	class TransientFailureTest {

		@ParameterizedTest
		@ValueSource(ints = { 500, 502, 503, 504 })
		@DisplayName("Should retry on server errors")
		void shouldRetryOnServerError(int status) {
			when(mockDelegate.get("/path")).thenThrow(apiError(status)).thenThrow(apiError(status)).thenReturn("ok");

			assertThat(retryingClient.get("/path")).isEqualTo("ok");
			verify(mockDelegate, times(3)).get("/path");
		}

		@Test
		@DisplayName("Should retry on network failure")
		void shouldRetryOnNetworkFailure() {
			when(mockDelegate.get("/path"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Connection reset", new java.io.IOException()))
				.thenReturn("ok");

			assertThat(retryingClient.get("/path")).isEqualTo("ok");
			verify(mockDelegate, times(2)).get("/path");
		}

		@Test
		@DisplayName("Should retry on unclassified runtime exception")
		void shouldRetryOnGenericException() {
			when(mockDelegate.get("/path")).thenThrow(new RuntimeException("Network error")).thenReturn("ok");

			assertThat(retryingClient.get("/path")).isEqualTo("ok");
			verify(mockDelegate, times(2)).get("/path");
		}

		@Test
		@DisplayName("Should return null after exhausting retries")
		void shouldReturnNullAfterMaxRetries() {
			when(mockDelegate.get("/path")).thenThrow(apiError(503));

			assertThat(retryingClient.get("/path")).isNull();
			verify(mockDelegate, times(4)).get("/path");
		}

		@Test
		@DisplayName("Should respect custom max retries")
		void shouldRespectCustomMaxRetries() {
			RetryingGitHubClient client = RetryingGitHubClient.builder()
				.wrapping(mockDelegate)
				.maxRetries(1)
				.initialDelayMs(1)
				.build();
			when(mockDelegate.get("/path")).thenThrow(apiError(500));

			assertThat(client.get("/path")).isNull();
			verify(mockDelegate, times(2)).get("/path");
		}

	}

	@Nested
	@DisplayName("Not Found Tests")
	class NotFoundTest {

		@ParameterizedTest
		@ValueSource(ints = { 403, 404, 409, 451 })
		@DisplayName("Should return null without retrying")
		void shouldReturnNullForMissingResources(int status) {
			when(mockDelegate.get("/path")).thenThrow(apiError(status));

			assertThat(retryingClient.get("/path")).isNull();
			verify(mockDelegate, times(1)).get("/path");
		}

	}

	@Nested
	@DisplayName("Fatal Failure Tests")
	class FatalFailureTest {

		@ParameterizedTest
		@ValueSource(ints = { 400, 401, 422 })
		@DisplayName("Should rethrow other client errors without retrying")
		void shouldRethrowClientErrors(int status) {
			when(mockDelegate.get("/path")).thenThrow(apiError(status));

			assertThatThrownBy(() -> retryingClient.get("/path"))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should surface 429 as rate limit exhaustion")
		void shouldSurfaceTooManyRequests() {
			long reset = Instant.now().plusSeconds(600).getEpochSecond();
			when(mockDelegate.get("/path"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Too Many Requests", 429, "", 0, reset));

			assertThatThrownBy(() -> retryingClient.get("/path")).isInstanceOf(RateLimitExceededException.class)
				.hasMessageContaining("Resets at")
				.satisfies(e -> assertThat(((RateLimitExceededException) e).getResetTime())
					.isEqualTo(Instant.ofEpochSecond(reset)));
			verify(mockDelegate, times(1)).get("/path");
		}

		@Test
		@DisplayName("Should surface 403 with zero remaining as rate limit exhaustion")
		void shouldSurfaceForbiddenWithZeroRemaining() {
			when(mockDelegate.postGraphQL("q"))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Forbidden", 403, "", 0, -1));

			assertThatThrownBy(() -> retryingClient.postGraphQL("q")).isInstanceOf(RateLimitExceededException.class);
		}

		@Test
		@DisplayName("Should not retry malformed responses")
		void shouldNotRetryMalformedResponses() {
			when(mockDelegate.postGraphQL("q")).thenThrow(new MalformedResponseException("bad json"));

			assertThatThrownBy(() -> retryingClient.postGraphQL("q")).isInstanceOf(MalformedResponseException.class);
			verify(mockDelegate, times(1)).postGraphQL("q");
		}

	}

	@Nested
	@DisplayName("Pacing Tests")
	class PacingTest {

		private RateLimitInfo pool(String resource, int remaining, long secondsUntilReset) {
			return new RateLimitInfo(5000, remaining, Instant.now().getEpochSecond() + secondsUntilReset,
					5000 - remaining, resource);
		}

		@Test
		@DisplayName("Should pace GraphQL calls on the graphql pool only")
		void shouldPaceGraphQLOnItsOwnPool() {
			when(mockDelegate.postGraphQL("q")).thenReturn("{}");
			when(mockDelegate.getRateLimitInfo("graphql")).thenReturn(pool("graphql", 4000, 3600));

			long start = System.nanoTime();
			retryingClient.postGraphQL("q");

			assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(100);
			verify(mockDelegate).getRateLimitInfo("graphql");
			verify(mockDelegate, never()).getRateLimitInfo("core");
		}

		@Test
		@DisplayName("Should pace search requests on the search pool")
		void shouldPaceSearchOnSearchPool() {
			when(mockDelegate.getWithQuery("/search/commits", "q=author:alice")).thenReturn("{}");

			retryingClient.getWithQuery("/search/commits", "q=author:alice");

			verify(mockDelegate).getRateLimitInfo("search");
			verify(mockDelegate, never()).getRateLimitInfo("core");
		}

		@Test
		@DisplayName("Should slow down when the pool of the request is nearly empty")
		void shouldSlowDownOnLowPool() {
			when(mockDelegate.get("/repos/w3c/csswg-drafts")).thenReturn("{}");
			when(mockDelegate.getRateLimitInfo("core")).thenReturn(pool("core", 50, 2));

			long start = System.nanoTime();
			retryingClient.get("/repos/w3c/csswg-drafts");

			assertThat((System.nanoTime() - start) / 1_000_000).isGreaterThanOrEqualTo(90);
		}

		@Test
		@DisplayName("Should not pace unauthenticated page requests")
		void shouldNotPacePages() {
			when(mockDelegate.getPage("https://github.com/alice")).thenReturn("<html></html>");

			retryingClient.getPage("https://github.com/alice");

			verify(mockDelegate, never()).getRateLimitInfo(anyString());
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should require a wrapped client")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().build()).isInstanceOf(IllegalStateException.class);
		}

	}

}
