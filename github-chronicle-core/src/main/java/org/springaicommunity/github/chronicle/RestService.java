package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Interface for GitHub REST API operations.
 *
 * <p>
 * Returns strongly-typed DTOs instead of raw JSON. Resources that do not exist or are
 * not visible come back as empty results rather than errors.
 */
public interface RestService {

	/**
	 * Get the quota status of one rate limit pool.
	 * @param resource pool name ({@code graphql}, {@code core}, {@code search})
	 * @return rate limit information
	 * @throws MalformedResponseException if the status cannot be read
	 */
	RateLimitInfo getRateLimit(String resource);

	/**
	 * Get one page of commits authored by a user within the range from the commit search
	 * index. The index never returns more than 1000 results.
	 * @param login author login
	 * @param from first day of the range
	 * @param to last day of the range
	 * @param page page number, starting at 1
	 * @return one page of commits, each credited to the repository it was found in
	 */
	SearchResult<Commit> searchCommits(String login, LocalDate from, LocalDate to, int page);

	/**
	 * Get line totals of one commit.
	 * @param repository repository the commit lives in
	 * @param sha commit hash
	 * @return the stats, or null if unavailable
	 */
	@Nullable
	CommitStats getCommitStats(String repository, String sha);

	/**
	 * List the branches of a repository.
	 * @param repository {@code owner/name}
	 * @return branches, empty if the repository is not found
	 */
	List<Branch> getBranches(String repository);

	/**
	 * List commits by a user on one branch within the range.
	 * @param repository {@code owner/name}
	 * @param branch branch name
	 * @param login author login
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return commits tagged with the branch name
	 */
	List<Commit> getBranchCommits(String repository, String branch, String login, LocalDate from, LocalDate to);

	/**
	 * Get the language byte counts of a repository.
	 * @param repository {@code owner/name}
	 * @return bytes per language, largest first
	 */
	Map<String, Long> getLanguages(String repository);

	/**
	 * Get the topic tags of a repository.
	 * @param repository {@code owner/name}
	 * @return topics
	 */
	List<String> getTopics(String repository);

	/**
	 * Get the public profile of an organization.
	 * @param organization organization login
	 * @return the profile, or null if the organization is not found
	 */
	@Nullable
	OrganizationProfile getOrganization(String organization);

	/**
	 * List the members of an organization.
	 * @param organization organization login
	 * @return member logins
	 */
	List<String> getOrganizationMembers(String organization);

	/**
	 * List the members of a team.
	 * @param organization organization login
	 * @param teamSlug team slug
	 * @return member logins
	 */
	List<String> getTeamMembers(String organization, String teamSlug);

	/**
	 * Read the public contribution calendar of a user. Uses the unauthenticated web page,
	 * so it does not consume API quota.
	 * @param login user login
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return activity level (0-4) per day, or null if the calendar could not be read
	 */
	@Nullable
	Map<LocalDate, Integer> getContributionCalendar(String login, LocalDate from, LocalDate to);

}
