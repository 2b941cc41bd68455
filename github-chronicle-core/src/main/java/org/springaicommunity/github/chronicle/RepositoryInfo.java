package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

/**
 * Repository metadata used for filtering, attribution and annotation.
 *
 * @param nameWithOwner repository identity in {@code owner/name} format
 * @param description repository description
 * @param isPrivate whether the repository is private
 * @param isFork whether the repository is a fork
 * @param parent parent identity when the repository is a fork
 * @param primaryLanguage primary language as reported by GitHub
 * @param defaultBranch name of the default branch
 */
public record RepositoryInfo(String nameWithOwner, @Nullable String description, boolean isPrivate, boolean isFork,
		@Nullable String parent, @Nullable String primaryLanguage, @Nullable String defaultBranch) {

	/**
	 * Metadata for a public, non-fork repository with nothing else known.
	 * @param nameWithOwner repository identity
	 * @return minimal RepositoryInfo
	 */
	public static RepositoryInfo of(String nameWithOwner) {
		return new RepositoryInfo(nameWithOwner, null, false, false, null, null, null);
	}

	/**
	 * Metadata for a public fork.
	 * @param nameWithOwner fork identity
	 * @param parent parent identity
	 * @return fork RepositoryInfo
	 */
	public static RepositoryInfo forkOf(String nameWithOwner, String parent) {
		return new RepositoryInfo(nameWithOwner, null, false, true, parent, null, null);
	}

}
