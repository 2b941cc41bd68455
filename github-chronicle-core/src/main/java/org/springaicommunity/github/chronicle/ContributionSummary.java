package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * A user's contribution summary for a date range of at most one year, as reported by the
 * GraphQL {@code contributionsCollection}.
 *
 * @param login user login
 * @param name display name
 * @param company company field from the profile
 * @param commits commit contributions on default branches
 * @param pullRequests pull requests opened
 * @param issues issues opened
 * @param reviews pull request reviews submitted
 * @param restricted contributions to private repositories
 * @param repositoryCommits commit count per repository
 * @param repositories metadata of the repositories in {@code repositoryCommits}
 */
public record ContributionSummary(String login, @Nullable String name, @Nullable String company, int commits,
		int pullRequests, int issues, int reviews, int restricted, Map<String, Integer> repositoryCommits,
		Map<String, RepositoryInfo> repositories) {

	public static ContributionSummary empty(String login) {
		return new ContributionSummary(login, null, null, 0, 0, 0, 0, 0, Map.of(), Map.of());
	}

	/**
	 * Whether the user did anything measurable in the range.
	 * @return true if any contribution count is nonzero
	 */
	public boolean hasActivity() {
		return commits > 0 || pullRequests > 0 || issues > 0 || reviews > 0 || restricted > 0;
	}

}
