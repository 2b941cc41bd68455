package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A commit attributed to a subject. Uniquely keyed by {@code sha} within one subject's
 * result.
 *
 * @param sha commit hash
 * @param repository credited repository ({@code owner/name}); the parent when the commit
 * was found in a fork
 * @param originRepository repository the commit physically lives in, used for stat
 * lookups
 * @param author author login
 * @param committedAt commit timestamp
 * @param additions lines added, null until stats are fetched
 * @param deletions lines deleted, null until stats are fetched
 * @param branch named branch the commit was found on, null for the default branch
 */
public record Commit(String sha, String repository, String originRepository, String author,
		@Nullable Instant committedAt, @Nullable Integer additions, @Nullable Integer deletions,
		@Nullable String branch) {

	/**
	 * Create a commit as found in its origin repository, before attribution and stats.
	 */
	public static Commit discovered(String sha, String repository, String author, @Nullable Instant committedAt,
			@Nullable String branch) {
		return new Commit(sha, repository, repository, author, committedAt, null, null, branch);
	}

	public Commit creditedTo(String parentRepository) {
		return new Commit(sha, parentRepository, originRepository, author, committedAt, additions, deletions, branch);
	}

	public Commit withStats(int additions, int deletions) {
		return new Commit(sha, repository, originRepository, author, committedAt, additions, deletions, branch);
	}

	public boolean isOnDefaultBranch() {
		return branch == null;
	}

	public int additionsOrZero() {
		return additions != null ? additions : 0;
	}

	public int deletionsOrZero() {
		return deletions != null ? deletions : 0;
	}

}
