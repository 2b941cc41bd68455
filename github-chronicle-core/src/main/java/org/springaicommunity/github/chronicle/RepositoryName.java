package org.springaicommunity.github.chronicle;

import java.util.Locale;

/**
 * An {@code owner/name} repository identity split into its parts. Names without a slash
 * have an empty owner.
 *
 * @param owner the owning user or organization, lowercased
 * @param name the repository name, lowercased
 */
public record RepositoryName(String owner, String name) {

	/**
	 * Parse a repository identity.
	 * @param fullName {@code owner/name} or a bare name
	 * @return the parsed name
	 */
	public static RepositoryName parse(String fullName) {
		String lower = fullName.trim().toLowerCase(Locale.ROOT);
		int slash = lower.indexOf('/');
		if (slash < 0) {
			return new RepositoryName("", lower);
		}
		return new RepositoryName(lower.substring(0, slash), lower.substring(slash + 1));
	}

	public String fullName() {
		return owner.isEmpty() ? name : owner + "/" + name;
	}

	/**
	 * Whether this is the special {@code login/login} profile repository of a user.
	 * @param login user login
	 * @return true for the profile repository
	 */
	public boolean isProfileRepositoryOf(String login) {
		String lower = login.toLowerCase(Locale.ROOT);
		return owner.equals(lower) && name.equals(lower);
	}

}
