package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * One subject's complete result. Produced by a single task and never mutated after it is
 * returned: repositories are frozen and collections are unmodifiable.
 *
 * @param login subject login
 * @param realName display name
 * @param company raw company field from the profile
 * @param repositories activity per credited repository, ordered by commits descending
 * @param createdPullRequests pull requests opened by the subject, unique by URL
 * @param reviewedPullRequests pull requests reviewed by the subject, unique by URL
 * @param totals scalar counts
 * @param lightMode whether the reduced light-mode profile produced this result
 * @param complete false when gathering failed and the result degraded to zero
 */
public record MemberActivity(String login, @Nullable String realName, @Nullable String company,
		Map<String, RepoActivity> repositories, List<PullRequestRecord> createdPullRequests,
		List<PullRequestRecord> reviewedPullRequests, ActivityTotals totals, boolean lightMode, boolean complete) {

	/**
	 * A zero contribution for a subject whose gathering failed.
	 * @param login subject login
	 * @return empty, incomplete MemberActivity
	 */
	public static MemberActivity failed(String login) {
		return new MemberActivity(login, null, null, Map.of(), List.of(), List.of(), ActivityTotals.ZERO, false,
				false);
	}

	public List<LanguageStat> languageBreakdown() {
		return LanguageStat.breakdown(repositories.values());
	}

}
