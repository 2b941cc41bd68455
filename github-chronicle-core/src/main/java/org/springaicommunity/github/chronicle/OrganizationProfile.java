package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

/**
 * Public profile of an organization.
 *
 * @param login organization login
 * @param name display name, if set
 * @param description profile description, if set
 * @param blog website, if set
 */
public record OrganizationProfile(String login, @Nullable String name, @Nullable String description,
		@Nullable String blog) {

	/**
	 * The name to show for the organization: the display name, else the login.
	 */
	public String displayName() {
		return name != null ? name : login;
	}

}
