package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds per-member results into one organization result.
 *
 * <p>
 * Runs once, after every member task has finished. Members are folded in login order so
 * the output does not depend on which task completed first.
 */
public class OrgAggregator {

	private static final Logger logger = LoggerFactory.getLogger(OrgAggregator.class);

	/**
	 * Aggregate member results.
	 * @param organization organization login, or {@code org/team}
	 * @param memberCount members considered, including inactive ones
	 * @param members results of the gathered members
	 * @return the aggregate
	 */
	public OrgAggregateResult aggregate(String organization, int memberCount, List<MemberActivity> members) {
		if (members.isEmpty()) {
			return OrgAggregateResult.empty(organization);
		}
		List<MemberActivity> ordered = new ArrayList<>(members);
		ordered.sort(Comparator.comparing(MemberActivity::login));

		ActivityTotals totals = ActivityTotals.ZERO;
		Map<String, RepoActivity> repositories = new HashMap<>();
		Map<String, Map<String, Integer>> repoMemberCommits = new TreeMap<>();
		Map<String, Map<String, Integer>> languageMemberCommits = new TreeMap<>();
		Map<String, PullRequestRecord> created = new LinkedHashMap<>();
		Map<String, PullRequestRecord> reviewed = new LinkedHashMap<>();
		Map<String, String> realNames = new LinkedHashMap<>();
		Map<String, @Nullable String> companies = new LinkedHashMap<>();
		int active = 0;
		boolean lightMode = false;

		for (MemberActivity member : ordered) {
			String login = member.login();
			totals = totals.plus(member.totals());
			lightMode |= member.lightMode();
			if (isActive(member)) {
				active++;
			}
			if (member.realName() != null) {
				realNames.put(login, member.realName());
			}
			companies.put(login, member.company());

			for (RepoActivity repo : member.repositories().values()) {
				repositories.computeIfAbsent(repo.getName(), RepoActivity::new).absorb(repo);
				if (repo.getCommits() > 0) {
					repoMemberCommits.computeIfAbsent(repo.getName(), k -> new TreeMap<>())
						.merge(login, repo.getCommits(), Integer::sum);
					if (repo.getLanguage() != null) {
						languageMemberCommits.computeIfAbsent(repo.getLanguage(), k -> new TreeMap<>())
							.merge(login, repo.getCommits(), Integer::sum);
					}
				}
			}
			for (PullRequestRecord pr : member.createdPullRequests()) {
				created.putIfAbsent(pr.url(), pr);
			}
			for (PullRequestRecord pr : member.reviewedPullRequests()) {
				reviewed.merge(pr.url(), pr,
						(first, next) -> first.withReviewCount(first.reviewCount() + next.reviewCount()));
			}
		}

		Map<String, RepoActivity> sortedRepositories = CommitAggregator.sortByCommits(repositories.values());
		sortedRepositories.values().forEach(RepoActivity::freeze);
		CompanyNormalizer.CompanyGroups groups = CompanyNormalizer.group(companies);

		logger.info("Aggregated {} members of {}: {} active, {} repositories, {} companies", ordered.size(),
				organization, active, sortedRepositories.size(), groups.groups().size());
		return new OrgAggregateResult(organization, memberCount, active, totals, sortedRepositories,
				repoMemberCommits, languageMemberCommits, groups.groups(), realNames, groups.memberCompanies(),
				List.copyOf(created.values()), List.copyOf(reviewed.values()), lightMode, null);
	}

	private static boolean isActive(MemberActivity member) {
		ActivityTotals totals = member.totals();
		return member.complete() && (totals.allBranchCommits() > 0 || totals.pullRequestsCreated() > 0
				|| totals.reviews() > 0 || totals.issues() > 0 || totals.restricted() > 0);
	}

}
