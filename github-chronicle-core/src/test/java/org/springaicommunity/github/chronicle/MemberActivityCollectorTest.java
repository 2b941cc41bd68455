package org.springaicommunity.github.chronicle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("MemberActivityCollector Tests")
@ExtendWith(MockitoExtension.class)
class MemberActivityCollectorTest {

	private static final LocalDate FROM = LocalDate.of(2024, 6, 1);

	private static final LocalDate TO = LocalDate.of(2024, 6, 7);

	private static final String CSSWG = "w3c/csswg-drafts";

	private static final String FXTF = "w3c/fxtf-drafts";

	private static final String FORK = "alice/ladybird";

	private static final String LADYBIRD = "ladybirdbrowser/ladybird";

	@Mock
	private GraphQLService graphQLService;

	@Mock
	private RestService restService;

	@Mock
	private CommitAggregator commitAggregator;

	@Mock
	private ReviewAggregator reviewAggregator;

	private WorkerPool statsPool;

	private MemberActivityCollector collector;

	@BeforeEach
	void setUp() {
		statsPool = new WorkerPool("stats", 2);
		collector = new MemberActivityCollector(graphQLService, restService, commitAggregator, reviewAggregator,
				new CategoryClassifier(CategoryRules.defaults()), new RepositoryFilter(MirrorRules.defaults()),
				statsPool);
	}

	@AfterEach
	void tearDown() {
		statsPool.close();
	}

	private static PullRequestRecord pr(String repository, int number, int reviewCount) {
		return new PullRequestRecord("https://github.com/" + repository + "/pull/" + number, "PR " + number,
				repository, "alice", 3, 1, reviewCount, PullRequestState.OPEN, null);
	}

	@Nested
	@DisplayName("Full Mode Tests")
	class FullModeTest {

		private CommitCollection commits() {
			List<Commit> commits = List.of(Commit.discovered("c1", CSSWG, "alice", null, null).withStats(10, 2),
					Commit.discovered("c2", CSSWG, "alice", null, null).withStats(10, 2),
					Commit.discovered("l1", FORK, "alice", null, "main").creditedTo(LADYBIRD).withStats(0, 0));
			Map<String, RepositoryInfo> infos = Map.of(CSSWG,
					new RepositoryInfo(CSSWG, "CSS drafts", false, false, null, "CSS", "main"), FORK,
					RepositoryInfo.forkOf(FORK, LADYBIRD));
			return new CommitCollection(commits, CommitAggregator.tally(commits), infos);
		}

		@Test
		@DisplayName("Should combine commits, pull requests and reviews into annotated repositories")
		void shouldCollectFullActivity() {
			when(graphQLService.getContributionSummary("alice", FROM, TO)).thenReturn(new ContributionSummary("alice",
					"Alice", "@w3c", 2, 2, 2, 5, 1, Map.of(), Map.of()));
			when(commitAggregator.collect("alice", FROM, TO)).thenReturn(commits());
			when(reviewAggregator.collectCreated("alice", FROM, TO)).thenReturn(List.of(pr(CSSWG, 1, 0), pr(FXTF, 2, 0)));
			when(reviewAggregator.collectReviewed("alice", FROM, TO)).thenReturn(List.of(pr(CSSWG, 9, 2)));
			when(graphQLService.getRepositories(anyList())).thenReturn(Map.of(LADYBIRD,
					new RepositoryInfo(LADYBIRD, "Truly independent web browser", false, false, null, "C++", "master")));
			when(restService.getLanguages(anyString())).thenAnswer(invocation -> {
				String name = invocation.getArgument(0);
				if (CSSWG.equals(name)) {
					return Map.of("HTML", 100L);
				}
				if (LADYBIRD.equals(name)) {
					Map<String, Long> bytes = new LinkedHashMap<>();
					bytes.put("JavaScript", 400L);
					bytes.put("C++", 50L);
					return bytes;
				}
				return Map.of();
			});

			MemberActivity activity = collector.collect("alice", FROM, TO);

			assertThat(activity.repositories().keySet()).containsExactly(CSSWG, LADYBIRD, FXTF);
			RepoActivity csswg = activity.repositories().get(CSSWG);
			assertThat(csswg.getCommits()).isEqualTo(2);
			assertThat(csswg.getPullRequests()).isEqualTo(1);
			assertThat(csswg.getCategory()).isEqualTo(CategoryRules.WEB_STANDARDS);
			assertThat(csswg.getLanguage()).isEqualTo("HTML");
			assertThat(csswg.getDescription()).isEqualTo("CSS drafts");
			assertThat(activity.repositories().get(LADYBIRD).getLanguage()).isEqualTo("C++");
			assertThat(activity.repositories().get(LADYBIRD).getCategory()).isEqualTo(CategoryRules.BROWSER_ENGINES);
			assertThat(activity.repositories().get(FXTF).getLanguage()).isNull();
			assertThat(activity.repositories().values()).allMatch(RepoActivity::isFrozen);

			assertThat(activity.totals()).isEqualTo(new ActivityTotals(2, 3, 2, 5, 2, 1, 20, 4));
			assertThat(activity.realName()).isEqualTo("Alice");
			assertThat(activity.company()).isEqualTo("@w3c");
			assertThat(activity.complete()).isTrue();
			assertThat(activity.lightMode()).isFalse();
			assertThat(activity.reviewedPullRequests()).hasSize(1);
		}

		@Test
		@DisplayName("Should keep the category and repository language when the language lookup fails")
		void shouldClassifyWhenLanguageLookupFails() {
			when(graphQLService.getContributionSummary("alice", FROM, TO)).thenReturn(new ContributionSummary("alice",
					"Alice", null, 2, 2, 0, 0, 0, Map.of(), Map.of()));
			List<Commit> commits = List.of(Commit.discovered("c1", CSSWG, "alice", null, null).withStats(10, 2));
			when(commitAggregator.collect("alice", FROM, TO)).thenReturn(new CommitCollection(commits,
					CommitAggregator.tally(commits),
					Map.of(CSSWG, new RepositoryInfo(CSSWG, "CSS drafts", false, false, null, "CSS", "main"))));
			when(reviewAggregator.collectCreated("alice", FROM, TO)).thenReturn(List.of());
			when(reviewAggregator.collectReviewed("alice", FROM, TO)).thenReturn(List.of());
			when(restService.getLanguages(CSSWG)).thenThrow(new MalformedResponseException("Unexpected languages body"));

			MemberActivity activity = collector.collect("alice", FROM, TO);

			RepoActivity csswg = activity.repositories().get(CSSWG);
			assertThat(csswg.getCategory()).isEqualTo(CategoryRules.WEB_STANDARDS);
			assertThat(csswg.getLanguage()).isEqualTo("CSS");
			assertThat(activity.complete()).isTrue();
		}

		@Test
		@DisplayName("Should stop on rate limit during the language lookup")
		void shouldPropagateRateLimitFromLanguageLookup() {
			when(graphQLService.getContributionSummary("alice", FROM, TO)).thenReturn(null);
			List<Commit> commits = List.of(Commit.discovered("c1", CSSWG, "alice", null, null).withStats(10, 2));
			when(commitAggregator.collect("alice", FROM, TO))
				.thenReturn(new CommitCollection(commits, CommitAggregator.tally(commits), Map.of()));
			when(reviewAggregator.collectCreated("alice", FROM, TO)).thenReturn(List.of());
			when(restService.getLanguages(CSSWG)).thenThrow(new RateLimitExceededException(null));

			assertThatThrownBy(() -> collector.collect("alice", FROM, TO))
				.isInstanceOf(RateLimitExceededException.class);
		}

		@Test
		@DisplayName("Should count reviews from pull requests when there is no summary")
		void shouldFallBackToReviewCounts() {
			when(graphQLService.getContributionSummary("alice", FROM, TO)).thenReturn(null);
			when(commitAggregator.collect("alice", FROM, TO)).thenReturn(new CommitCollection(List.of(), Map.of(), Map.of()));
			when(reviewAggregator.collectCreated("alice", FROM, TO)).thenReturn(List.of());
			when(reviewAggregator.collectReviewed("alice", FROM, TO))
				.thenReturn(List.of(pr(CSSWG, 1, 2), pr(CSSWG, 2, 1)));

			MemberActivity activity = collector.collect("alice", FROM, TO);

			assertThat(activity.totals().reviews()).isEqualTo(3);
			assertThat(activity.totals().issues()).isZero();
			assertThat(activity.repositories()).isEmpty();
			assertThat(activity.realName()).isNull();
		}

	}

	@Nested
	@DisplayName("Light Mode Tests")
	class LightModeTest {

		@Test
		@DisplayName("Should read repository counts from the summary and fold forks into parents")
		void shouldCollectLightActivity() {
			Map<String, Integer> repositoryCommits = new LinkedHashMap<>();
			repositoryCommits.put(CSSWG, 3);
			repositoryCommits.put(FORK, 2);
			repositoryCommits.put("alice/alice", 1);
			repositoryCommits.put("someone/serenity-mirror", 4);
			Map<String, RepositoryInfo> repositories = Map.of(CSSWG,
					new RepositoryInfo(CSSWG, "CSS drafts", false, false, null, "HTML", "main"), FORK,
					RepositoryInfo.forkOf(FORK, LADYBIRD));
			when(graphQLService.getContributionSummary("alice", FROM, TO)).thenReturn(new ContributionSummary("alice",
					"Alice", null, 10, 1, 0, 2, 0, repositoryCommits, repositories));
			when(reviewAggregator.collectReviewed("alice", FROM, TO)).thenReturn(List.of(pr(CSSWG, 4, 2)));

			MemberActivity activity = collector.collectLight("alice", FROM, TO);

			assertThat(activity.repositories().keySet()).containsExactly(CSSWG, LADYBIRD);
			assertThat(activity.repositories().get(LADYBIRD).getCommits()).isEqualTo(2);
			assertThat(activity.repositories().get(LADYBIRD).getParent()).isNull();
			assertThat(activity.repositories().get(CSSWG).getLanguage()).isEqualTo("HTML");
			assertThat(activity.totals()).isEqualTo(new ActivityTotals(10, 10, 1, 2, 0, 0, 0, 0));
			assertThat(activity.lightMode()).isTrue();
			assertThat(activity.createdPullRequests()).isEmpty();
			assertThat(activity.reviewedPullRequests()).hasSize(1);
			verifyNoInteractions(commitAggregator, restService);
			verify(reviewAggregator, never()).collectCreated(anyString(), any(), any());
		}

		@Test
		@DisplayName("Should produce an empty result when there is no summary")
		void shouldHandleMissingSummary() {
			when(graphQLService.getContributionSummary("alice", FROM, TO)).thenReturn(null);
			when(reviewAggregator.collectReviewed("alice", FROM, TO)).thenReturn(List.of());

			MemberActivity activity = collector.collectLight("alice", FROM, TO);

			assertThat(activity.repositories()).isEmpty();
			assertThat(activity.totals()).isEqualTo(ActivityTotals.ZERO);
		}

	}

}
