package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Aggregate of all member results of an organization or team.
 *
 * @param organization organization (or {@code org/team}) name
 * @param memberCount members considered, including inactive ones
 * @param activeMemberCount members with activity in range
 * @param totals summed scalar counts
 * @param repositories union of member repositories, commit and line counts summed
 * @param repoMemberCommits repository &rarr; member &rarr; commits
 * @param languageMemberCommits language &rarr; member &rarr; commits
 * @param companyGroups normalized company &rarr; member logins
 * @param memberRealNames member login &rarr; display name
 * @param memberCompanies member login &rarr; normalized company
 * @param createdPullRequests pull requests opened by members, unique by URL
 * @param reviewedPullRequests pull requests reviewed by members, unique by URL
 * @param lightMode whether any member result was gathered in light mode
 * @param profile public profile of the organization, null if it could not be read
 */
public record OrgAggregateResult(String organization, int memberCount, int activeMemberCount, ActivityTotals totals,
		Map<String, RepoActivity> repositories, Map<String, Map<String, Integer>> repoMemberCommits,
		Map<String, Map<String, Integer>> languageMemberCommits, Map<String, List<String>> companyGroups,
		Map<String, String> memberRealNames, Map<String, String> memberCompanies,
		List<PullRequestRecord> createdPullRequests, List<PullRequestRecord> reviewedPullRequests, boolean lightMode,
		@Nullable OrganizationProfile profile) {

	public static OrgAggregateResult empty(String organization) {
		return new OrgAggregateResult(organization, 0, 0, ActivityTotals.ZERO, Map.of(), Map.of(), Map.of(), Map.of(),
				Map.of(), Map.of(), List.of(), List.of(), false, null);
	}

	public OrgAggregateResult withProfile(@Nullable OrganizationProfile profile) {
		return new OrgAggregateResult(organization, memberCount, activeMemberCount, totals, repositories,
				repoMemberCommits, languageMemberCommits, companyGroups, memberRealNames, memberCompanies,
				createdPullRequests, reviewedPullRequests, lightMode, profile);
	}

	public List<LanguageStat> languageBreakdown() {
		return LanguageStat.breakdown(repositories.values());
	}

}
