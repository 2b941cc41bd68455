package org.springaicommunity.github.chronicle;

import java.util.List;
import java.util.Map;

/**
 * Commits gathered for one subject.
 *
 * @param commits credited commits, unique by SHA, with stats
 * @param repositories activity per credited repository, ordered by commits descending
 * @param repositoryInfos metadata of every repository the commits were found in
 */
public record CommitCollection(List<Commit> commits, Map<String, RepoActivity> repositories,
		Map<String, RepositoryInfo> repositoryInfos) {

	public int defaultBranchCommits() {
		return (int) commits.stream().filter(Commit::isOnDefaultBranch).count();
	}

	public long additions() {
		return commits.stream().mapToLong(Commit::additionsOrZero).sum();
	}

	public long deletions() {
		return commits.stream().mapToLong(Commit::deletionsOrZero).sum();
	}

}
