package org.springaicommunity.github.chronicle;

/**
 * Scalar activity counts of a subject or an organization.
 *
 * @param defaultBranchCommits commits on default branches, as counted by GitHub
 * @param allBranchCommits distinct commits found on any branch
 * @param pullRequestsCreated pull requests opened
 * @param reviews review contributions (submitted reviews, several per pull request possible)
 * @param issues issues opened
 * @param restricted contributions to private repositories
 * @param additions lines added
 * @param deletions lines deleted
 */
public record ActivityTotals(int defaultBranchCommits, int allBranchCommits, int pullRequestsCreated, int reviews,
		int issues, int restricted, long additions, long deletions) {

	public static final ActivityTotals ZERO = new ActivityTotals(0, 0, 0, 0, 0, 0, 0, 0);

	public ActivityTotals plus(ActivityTotals other) {
		return new ActivityTotals(defaultBranchCommits + other.defaultBranchCommits,
				allBranchCommits + other.allBranchCommits, pullRequestsCreated + other.pullRequestsCreated,
				reviews + other.reviews, issues + other.issues, restricted + other.restricted,
				additions + other.additions, deletions + other.deletions);
	}

}
