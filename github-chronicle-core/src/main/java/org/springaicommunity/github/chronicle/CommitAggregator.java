package org.springaicommunity.github.chronicle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gathers the commits one subject authored in a window and credits them to repositories.
 *
 * <p>
 * Commits are discovered through the commit search index and through the branches of
 * the subject's forks of interesting repositories, which the index does not cover. The
 * same SHA found twice is kept once, first discovery wins. Noise repositories are dropped
 * before commits in forks are credited to the fork's parent. Line stats are fetched per
 * commit on the stats pool; a failed fetch leaves the commit with zero lines.
 */
public class CommitAggregator {

	private static final Logger logger = LoggerFactory.getLogger(CommitAggregator.class);

	private final RestService restService;

	private final GraphQLService graphQLService;

	private final CategoryClassifier classifier;

	private final RepositoryFilter filter;

	private final WorkerPool statsPool;

	public CommitAggregator(RestService restService, GraphQLService graphQLService, CategoryClassifier classifier,
			RepositoryFilter filter, WorkerPool statsPool) {
		this.restService = restService;
		this.graphQLService = graphQLService;
		this.classifier = classifier;
		this.filter = filter;
		this.statsPool = statsPool;
	}

	/**
	 * Gather, filter, credit and enrich a subject's commits.
	 * @param login subject login
	 * @param from first day of the window
	 * @param to last day of the window
	 * @return the commit collection
	 * @throws RateLimitExceededException if the quota ran out
	 */
	public CommitCollection collect(String login, LocalDate from, LocalDate to) {
		Map<String, RepositoryInfo> infos = new HashMap<>();
		List<Commit> discovered = new ArrayList<>(searchCommits(login, from, to));
		discovered.addAll(scanForks(login, from, to, infos));

		Set<String> unknown = new LinkedHashSet<>();
		for (Commit commit : discovered) {
			if (!infos.containsKey(commit.originRepository())) {
				unknown.add(commit.originRepository());
			}
		}
		if (!unknown.isEmpty()) {
			infos.putAll(graphQLService.getRepositories(new ArrayList<>(unknown)));
		}

		List<Commit> credited = aggregate(discovered, infos, login);
		List<Commit> enriched = enrichStats(credited);
		Map<String, RepoActivity> repositories = tally(enriched);
		logger.info("{}: {} commits in {} repositories ({} discovered)", login, enriched.size(), repositories.size(),
				discovered.size());
		return new CommitCollection(enriched, repositories, Map.copyOf(infos));
	}

	/**
	 * Read every page of the commit search for a subject.
	 */
	List<Commit> searchCommits(String login, LocalDate from, LocalDate to) {
		List<Commit> commits = new ArrayList<>();
		int page = 1;
		while (true) {
			SearchResult<Commit> result = restService.searchCommits(login, from, to, page);
			commits.addAll(result.items());
			if (!result.hasMore() || result.items().isEmpty()) {
				break;
			}
			page++;
		}
		logger.debug("{}: commit search returned {} commits in {} page(s)", login, commits.size(), page);
		return commits;
	}

	/**
	 * Scan selected branches of the subject's forks whose parent is interesting.
	 * @param infos receives the metadata of every fork seen
	 */
	List<Commit> scanForks(String login, LocalDate from, LocalDate to, Map<String, RepositoryInfo> infos) {
		List<Commit> commits = new ArrayList<>();
		String cursor = null;
		do {
			SearchResult<RepositoryInfo> forks = graphQLService.getUserForks(login, cursor);
			for (RepositoryInfo fork : forks.items()) {
				infos.put(fork.nameWithOwner(), fork);
				String parent = fork.parent();
				if (parent == null || !classifier.isInteresting(parent)
						|| filter.shouldSkip(fork.nameWithOwner(), fork, login)) {
					continue;
				}
				commits.addAll(scanBranches(fork.nameWithOwner(), login, from, to));
			}
			cursor = forks.hasMore() ? forks.nextCursor() : null;
		}
		while (cursor != null);
		return commits;
	}

	private List<Commit> scanBranches(String fork, String login, LocalDate from, LocalDate to) {
		List<Branch> selected = BranchHeuristics.select(restService.getBranches(fork), login);
		logger.debug("{}: scanning {} branch(es) of {}", login, selected.size(), fork);
		List<Commit> commits = new ArrayList<>();
		for (Branch branch : selected) {
			commits.addAll(restService.getBranchCommits(fork, branch.name(), login, from, to));
		}
		return commits;
	}

	/**
	 * Deduplicate by SHA, drop noise repositories and credit fork commits to the parent.
	 * @param discovered commits in discovery order
	 * @param infos repository metadata by identity
	 * @param login subject login
	 * @return credited commits, unique by SHA
	 */
	public List<Commit> aggregate(Collection<Commit> discovered, Map<String, RepositoryInfo> infos, String login) {
		Map<String, Commit> bySha = new LinkedHashMap<>();
		for (Commit commit : discovered) {
			bySha.putIfAbsent(commit.sha(), commit);
		}
		List<Commit> credited = new ArrayList<>();
		for (Commit commit : bySha.values()) {
			RepositoryInfo info = infos.get(commit.originRepository());
			if (filter.shouldSkip(commit.originRepository(), info, login)) {
				continue;
			}
			if (info != null && info.isFork() && info.parent() != null) {
				credited.add(commit.creditedTo(info.parent()));
			}
			else {
				credited.add(commit);
			}
		}
		return credited;
	}

	/**
	 * Fetch line stats for every commit on the stats pool.
	 */
	List<Commit> enrichStats(List<Commit> commits) {
		List<TaskOutcome<Commit, CommitStats>> outcomes = statsPool.execute(commits,
				commit -> restService.getCommitStats(commit.originRepository(), commit.sha()));
		Map<String, Commit> enriched = new HashMap<>();
		int failed = 0;
		for (TaskOutcome<Commit, CommitStats> outcome : outcomes) {
			CommitStats stats = outcome.value();
			if (stats == null) {
				failed++;
				stats = CommitStats.ZERO;
			}
			enriched.put(outcome.input().sha(), outcome.input().withStats(stats.additions(), stats.deletions()));
		}
		if (failed > 0) {
			logger.debug("No stats for {} of {} commits", failed, commits.size());
		}
		List<Commit> ordered = new ArrayList<>(commits.size());
		for (Commit commit : commits) {
			ordered.add(enriched.get(commit.sha()));
		}
		return ordered;
	}

	/**
	 * Count commits per credited repository.
	 * @param commits credited commits
	 * @return activity per repository, most commits first
	 */
	static Map<String, RepoActivity> tally(List<Commit> commits) {
		Map<String, RepoActivity> byRepository = new HashMap<>();
		for (Commit commit : commits) {
			byRepository.computeIfAbsent(commit.repository(), RepoActivity::new).addCommit(commit);
		}
		return sortByCommits(byRepository.values());
	}

	static Map<String, RepoActivity> sortByCommits(Collection<RepoActivity> repositories) {
		List<RepoActivity> sorted = new ArrayList<>(repositories);
		sorted.sort(Comparator.comparingInt(RepoActivity::getCommits).reversed().thenComparing(RepoActivity::getName));
		Map<String, RepoActivity> ordered = new LinkedHashMap<>();
		for (RepoActivity repo : sorted) {
			ordered.put(repo.getName(), repo);
		}
		return ordered;
	}

}
