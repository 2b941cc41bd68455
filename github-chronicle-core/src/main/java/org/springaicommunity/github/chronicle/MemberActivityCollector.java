package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the complete {@link MemberActivity} of one subject.
 *
 * <p>
 * Full mode gathers every commit with line stats, created and reviewed pull requests,
 * and annotates each repository with category, language, description and fork parent.
 * Light mode reads per-repository commit counts from the contribution summary instead,
 * folding forks into their parents, and skips commit search, branch scans and stats.
 * Review contributions are fetched in both modes.
 */
public class MemberActivityCollector {

	private static final Logger logger = LoggerFactory.getLogger(MemberActivityCollector.class);

	private final GraphQLService graphQLService;

	private final RestService restService;

	private final CommitAggregator commitAggregator;

	private final ReviewAggregator reviewAggregator;

	private final CategoryClassifier classifier;

	private final RepositoryFilter filter;

	private final WorkerPool statsPool;

	public MemberActivityCollector(GraphQLService graphQLService, RestService restService,
			CommitAggregator commitAggregator, ReviewAggregator reviewAggregator, CategoryClassifier classifier,
			RepositoryFilter filter, WorkerPool statsPool) {
		this.graphQLService = graphQLService;
		this.restService = restService;
		this.commitAggregator = commitAggregator;
		this.reviewAggregator = reviewAggregator;
		this.classifier = classifier;
		this.filter = filter;
		this.statsPool = statsPool;
	}

	/**
	 * Gather everything a subject did in the window.
	 * @param login subject login
	 * @param from first day of the window
	 * @param to last day of the window
	 * @return the frozen result
	 * @throws RateLimitExceededException if the quota ran out
	 */
	public MemberActivity collect(String login, LocalDate from, LocalDate to) {
		logger.debug("Collecting full activity for {}", login);
		ContributionSummary summary = graphQLService.getContributionSummary(login, from, to);
		CommitCollection commits = commitAggregator.collect(login, from, to);
		List<PullRequestRecord> created = reviewAggregator.collectCreated(login, from, to);
		List<PullRequestRecord> reviewed = reviewAggregator.collectReviewed(login, from, to);

		Map<String, RepoActivity> repositories = new HashMap<>(commits.repositories());
		for (PullRequestRecord pr : created) {
			if (!filter.shouldSkip(pr.repository(), commits.repositoryInfos().get(pr.repository()), login)) {
				repositories.computeIfAbsent(pr.repository(), RepoActivity::new).addPullRequest();
			}
		}

		Map<String, RepositoryInfo> infos = new HashMap<>(commits.repositoryInfos());
		List<String> missing = new ArrayList<>();
		for (String name : repositories.keySet()) {
			if (!infos.containsKey(name)) {
				missing.add(name);
			}
		}
		if (!missing.isEmpty()) {
			infos.putAll(graphQLService.getRepositories(missing));
		}
		annotate(repositories, infos, true);

		int reviews = summary != null ? summary.reviews()
				: reviewed.stream().mapToInt(PullRequestRecord::reviewCount).sum();
		ActivityTotals totals = new ActivityTotals(commits.defaultBranchCommits(), commits.commits().size(),
				created.size(), reviews, summary != null ? summary.issues() : 0,
				summary != null ? summary.restricted() : 0, commits.additions(), commits.deletions());
		return freeze(login, summary, repositories, created, reviewed, totals, false);
	}

	/**
	 * Gather a reduced profile from the contribution summary.
	 * @param login subject login
	 * @param from first day of the window
	 * @param to last day of the window
	 * @return the frozen light-mode result
	 * @throws RateLimitExceededException if the quota ran out
	 */
	public MemberActivity collectLight(String login, LocalDate from, LocalDate to) {
		logger.debug("Collecting light activity for {}", login);
		ContributionSummary summary = graphQLService.getContributionSummary(login, from, to);
		if (summary == null) {
			summary = ContributionSummary.empty(login);
		}

		Map<String, RepoActivity> repositories = new HashMap<>();
		Map<String, RepositoryInfo> infos = new HashMap<>();
		for (Map.Entry<String, Integer> entry : summary.repositoryCommits().entrySet()) {
			RepositoryInfo info = summary.repositories().get(entry.getKey());
			if (filter.shouldSkip(entry.getKey(), info, login)) {
				continue;
			}
			String parent = info != null && info.isFork() ? info.parent() : null;
			String credited = parent != null ? parent : entry.getKey();
			repositories.computeIfAbsent(credited, RepoActivity::new).addCommits(entry.getValue());
			if (info != null && parent == null) {
				infos.put(credited, info);
			}
		}
		annotate(repositories, infos, false);

		List<PullRequestRecord> reviewed = reviewAggregator.collectReviewed(login, from, to);
		ActivityTotals totals = new ActivityTotals(summary.commits(), summary.commits(), summary.pullRequests(),
				summary.reviews(), summary.issues(), summary.restricted(), 0, 0);
		return freeze(login, summary, repositories, List.of(), reviewed, totals, true);
	}

	/**
	 * Set category, language, description and parent on every repository.
	 * @param fetchLanguages whether to resolve languages from byte counts, which costs
	 * one request per repository
	 */
	private void annotate(Map<String, RepoActivity> repositories, Map<String, RepositoryInfo> infos,
			boolean fetchLanguages) {
		List<TaskOutcome<String, Annotation>> outcomes = statsPool.execute(repositories.keySet(), name -> {
			String category = classifier.classify(name);
			return new Annotation(category, fetchLanguages ? fetchLanguage(name) : null);
		});
		for (TaskOutcome<String, Annotation> outcome : outcomes) {
			RepoActivity repo = repositories.get(outcome.input());
			RepositoryInfo info = infos.get(outcome.input());
			Annotation annotation = outcome.value();
			repo.setCategory(annotation != null ? annotation.category() : CategoryRules.OTHER);
			String language = annotation != null ? annotation.language() : null;
			repo.setLanguage(language != null ? language : info != null ? info.primaryLanguage() : null);
			if (info != null) {
				repo.setDescription(info.description());
				repo.setParent(info.isFork() ? info.parent() : null);
			}
		}
	}

	private @Nullable String fetchLanguage(String repository) {
		try {
			return LanguageResolver.effectiveLanguage(restService.getLanguages(repository));
		}
		catch (RateLimitExceededException e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.warn("Language lookup failed for {}: {}", repository, e.getMessage());
			return null;
		}
	}

	private static MemberActivity freeze(String login, @Nullable ContributionSummary summary,
			Map<String, RepoActivity> repositories, List<PullRequestRecord> created, List<PullRequestRecord> reviewed,
			ActivityTotals totals, boolean lightMode) {
		Map<String, RepoActivity> sorted = CommitAggregator.sortByCommits(repositories.values());
		sorted.values().forEach(RepoActivity::freeze);
		return new MemberActivity(login, summary != null ? summary.name() : null,
				summary != null ? summary.company() : null, Collections.unmodifiableMap(sorted),
				List.copyOf(created), List.copyOf(reviewed), totals, lightMode, true);
	}

	private record Annotation(String category, @Nullable String language) {
	}

}
