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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("CommitAggregator Tests")
@ExtendWith(MockitoExtension.class)
class CommitAggregatorTest {

	private static final LocalDate FROM = LocalDate.of(2024, 6, 1);

	private static final LocalDate TO = LocalDate.of(2024, 6, 7);

	private static final String CSSWG = "w3c/csswg-drafts";

	private static final String MIRROR = "someone/serenity-mirror";

	private static final String FORK = "alice/ladybird";

	private static final String LADYBIRD = "ladybirdbrowser/ladybird";

	@Mock
	private RestService restService;

	@Mock
	private GraphQLService graphQLService;

	private WorkerPool statsPool;

	private CommitAggregator aggregator;

	@BeforeEach
	void setUp() {
		statsPool = new WorkerPool("stats", 4);
		aggregator = new CommitAggregator(restService, graphQLService, new CategoryClassifier(CategoryRules.defaults()),
				new RepositoryFilter(MirrorRules.defaults()), statsPool);
	}

	@AfterEach
	void tearDown() {
		statsPool.close();
	}

	private static Commit commit(String sha, String repository) {
		return Commit.discovered(sha, repository, "alice", null, null);
	}

	private static Commit branchCommit(String sha, String repository, String branch) {
		return Commit.discovered(sha, repository, "alice", null, branch);
	}

	@Nested
	@DisplayName("Collect Tests")
	class CollectTest {

		@Test
		@DisplayName("Should reduce three repositories and ten commits to two credited repositories")
		void shouldCollectEndToEnd() {
			List<Commit> searched = List.of(commit("c1", CSSWG), commit("c2", CSSWG), commit("c3", CSSWG),
					commit("s1", MIRROR), commit("s2", MIRROR), commit("s3", MIRROR), commit("l1", FORK));
			when(restService.searchCommits("alice", FROM, TO, 1))
				.thenReturn(new SearchResult<>(searched, null, false, searched.size()));
			when(graphQLService.getUserForks("alice", null))
				.thenReturn(new SearchResult<>(List.of(RepositoryInfo.forkOf(FORK, LADYBIRD)), null, false, 1));
			when(restService.getBranches(FORK))
				.thenReturn(List.of(new Branch("main", "head-main"), new Branch("alice/fix", "head-fix")));
			when(restService.getBranchCommits(FORK, "main", "alice", FROM, TO))
				.thenReturn(List.of(branchCommit("l1", FORK, "main"), branchCommit("l2", FORK, "main")));
			when(restService.getBranchCommits(FORK, "alice/fix", "alice", FROM, TO))
				.thenReturn(List.of(branchCommit("l3", FORK, "alice/fix")));
			when(graphQLService.getRepositories(anyList())).thenReturn(Map.of(CSSWG, RepositoryInfo.of(CSSWG)));
			when(restService.getCommitStats(anyString(), anyString()))
				.thenAnswer(invocation -> "l3".equals(invocation.getArgument(1)) ? null : new CommitStats(10, 2));

			CommitCollection collection = aggregator.collect("alice", FROM, TO);

			assertThat(collection.repositories().keySet()).containsExactly(LADYBIRD, CSSWG);
			assertThat(collection.commits()).extracting(Commit::sha)
				.containsExactly("c1", "c2", "c3", "l1", "l2", "l3");
			assertThat(collection.repositories().get(LADYBIRD).getCommits()).isEqualTo(3);
			assertThat(collection.repositories().get(LADYBIRD).getAdditions()).isEqualTo(20);
			assertThat(collection.defaultBranchCommits()).isEqualTo(4);
			assertThat(collection.additions()).isEqualTo(50);
			assertThat(collection.deletions()).isEqualTo(10);
			assertThat(collection.repositoryInfos()).containsKeys(FORK, CSSWG);
			verify(restService, times(6)).getCommitStats(anyString(), anyString());
			verify(restService, never()).getCommitStats(eq(MIRROR), anyString());
		}

		@Test
		@DisplayName("Should look up stats in the repository a commit lives in")
		void shouldFetchStatsFromOrigin() {
			when(restService.searchCommits("alice", FROM, TO, 1))
				.thenReturn(new SearchResult<>(List.of(commit("l1", FORK)), null, false, 1));
			when(graphQLService.getUserForks("alice", null)).thenReturn(SearchResult.empty());
			when(graphQLService.getRepositories(List.of(FORK)))
				.thenReturn(Map.of(FORK, RepositoryInfo.forkOf(FORK, LADYBIRD)));
			when(restService.getCommitStats(FORK, "l1")).thenReturn(new CommitStats(3, 1));

			CommitCollection collection = aggregator.collect("alice", FROM, TO);

			assertThat(collection.commits()).singleElement().satisfies(c -> {
				assertThat(c.repository()).isEqualTo(LADYBIRD);
				assertThat(c.originRepository()).isEqualTo(FORK);
				assertThat(c.additions()).isEqualTo(3);
			});
		}

		@Test
		@DisplayName("Should follow search pages until no more results")
		void shouldPaginateSearch() {
			when(restService.searchCommits("alice", FROM, TO, 1))
				.thenReturn(new SearchResult<>(List.of(commit("c1", CSSWG)), "2", true, 2));
			when(restService.searchCommits("alice", FROM, TO, 2))
				.thenReturn(new SearchResult<>(List.of(commit("c2", CSSWG)), null, false, 2));

			assertThat(aggregator.searchCommits("alice", FROM, TO)).extracting(Commit::sha).containsExactly("c1", "c2");
		}

		@Test
		@DisplayName("Should propagate a rate limit from the stats pool")
		void shouldPropagateRateLimit() {
			when(restService.getCommitStats(CSSWG, "c1")).thenThrow(new RateLimitExceededException(null));

			assertThatThrownBy(() -> aggregator.enrichStats(List.of(commit("c1", CSSWG))))
				.isInstanceOf(RateLimitExceededException.class);
		}

	}

	@Nested
	@DisplayName("Fork Scan Tests")
	class ForkScanTest {

		@Test
		@DisplayName("Should skip forks of repositories outside every category")
		void shouldSkipUninterestingForks() {
			when(graphQLService.getUserForks("alice", null)).thenReturn(
					new SearchResult<>(List.of(RepositoryInfo.forkOf("alice/dotfiles", "someone/dotfiles")), null,
							false, 1));

			Map<String, RepositoryInfo> infos = new HashMap<>();
			assertThat(aggregator.scanForks("alice", FROM, TO, infos)).isEmpty();
			assertThat(infos).containsKey("alice/dotfiles");
			verify(restService, never()).getBranches(anyString());
		}

		@Test
		@DisplayName("Should skip forks the repository filter rejects")
		void shouldSkipFilteredForks() {
			when(graphQLService.getUserForks("alice", null)).thenReturn(
					new SearchResult<>(List.of(RepositoryInfo.forkOf("alice/lady-copy", LADYBIRD)), null, false, 1));

			assertThat(aggregator.scanForks("alice", FROM, TO, new HashMap<>())).isEmpty();
			verify(restService, never()).getBranches(anyString());
		}

		@Test
		@DisplayName("Should follow fork pages")
		void shouldPaginateForks() {
			when(graphQLService.getUserForks("alice", null)).thenReturn(
					new SearchResult<>(List.of(RepositoryInfo.forkOf("alice/dotfiles", "someone/dotfiles")), "c1",
							true, 2));
			when(graphQLService.getUserForks("alice", "c1"))
				.thenReturn(new SearchResult<>(List.of(RepositoryInfo.forkOf(FORK, LADYBIRD)), null, false, 2));
			when(restService.getBranches(FORK)).thenReturn(List.of(new Branch("main", "h")));
			when(restService.getBranchCommits(FORK, "main", "alice", FROM, TO))
				.thenReturn(List.of(branchCommit("l1", FORK, "main")));

			assertThat(aggregator.scanForks("alice", FROM, TO, new HashMap<>())).extracting(Commit::sha)
				.containsExactly("l1");
		}

	}

	@Nested
	@DisplayName("Aggregate Tests")
	class AggregateTest {

		@Test
		@DisplayName("Should keep the first discovery of a SHA")
		void shouldKeepFirstDiscovery() {
			List<Commit> credited = aggregator.aggregate(
					List.of(commit("x", CSSWG), branchCommit("x", FORK, "main")), Map.of(), "alice");

			assertThat(credited).singleElement().extracting(Commit::repository).isEqualTo(CSSWG);
		}

		@Test
		@DisplayName("Should drop private and profile repositories")
		void shouldDropPrivateAndProfileRepositories() {
			RepositoryInfo secret = new RepositoryInfo("alice/secret", null, true, false, null, null, null);

			List<Commit> credited = aggregator.aggregate(
					List.of(commit("a", "alice/secret"), commit("b", "alice/alice"), commit("c", CSSWG)),
					Map.of("alice/secret", secret), "alice");

			assertThat(credited).extracting(Commit::sha).containsExactly("c");
		}

		@Test
		@DisplayName("Should leave commits in repositories without metadata where they were found")
		void shouldKeepUnknownRepositories() {
			List<Commit> credited = aggregator.aggregate(List.of(commit("a", FORK)), Map.of(), "alice");

			assertThat(credited).singleElement().extracting(Commit::repository).isEqualTo(FORK);
		}

		@Test
		@DisplayName("Should tally commits per repository, most commits first")
		void shouldTally() {
			Map<String, RepoActivity> tally = CommitAggregator.tally(List.of(commit("a", "b/two"),
					commit("b", "a/one"), commit("c", "b/two")));

			assertThat(tally.keySet()).containsExactly("b/two", "a/one");
			assertThat(tally.get("b/two").getCommits()).isEqualTo(2);
		}

	}

}
