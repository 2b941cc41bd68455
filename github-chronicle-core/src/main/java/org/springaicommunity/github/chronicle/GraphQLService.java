package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Interface for GitHub GraphQL API operations.
 *
 * <p>
 * Date ranges longer than one year are clamped to the last year before
 * {@code to}, the longest span {@code contributionsCollection} accepts.
 */
public interface GraphQLService {

	/**
	 * Get a user's contribution summary, including per-repository commit counts.
	 * @param login user login
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return the summary, or null if the user does not exist or no data is available
	 */
	@Nullable
	ContributionSummary getContributionSummary(String login, LocalDate from, LocalDate to);

	/**
	 * Get contribution summaries for several users in one query. Users missing from the
	 * response are absent from the returned map.
	 * @param logins user logins, at most the configured user batch size
	 * @param from first day of the range
	 * @param to last day of the range
	 * @return summaries keyed by login
	 */
	Map<String, ContributionSummary> getContributionSummaries(List<String> logins, LocalDate from, LocalDate to);

	/**
	 * Get one page of the pull request reviews a user submitted within the range. Each
	 * review is returned as the reviewed pull request, so a pull request reviewed twice
	 * appears twice.
	 * @param login reviewer login
	 * @param from first day of the range
	 * @param to last day of the range
	 * @param after cursor of the previous page, null for the first page
	 * @return one page of reviewed pull requests
	 */
	SearchResult<PullRequestRecord> getReviewContributions(String login, LocalDate from, LocalDate to,
			@Nullable String after);

	/**
	 * Get one page of pull requests a user created within the range.
	 * @param login author login
	 * @param from first day of the range
	 * @param to last day of the range
	 * @param after cursor of the previous page, null for the first page
	 * @return one page of pull requests
	 */
	SearchResult<PullRequestRecord> searchPullRequestsCreated(String login, LocalDate from, LocalDate to,
			@Nullable String after);

	/**
	 * Look up metadata for several repositories in one query. Repositories that do not
	 * exist or are not visible are absent from the returned map.
	 * @param names {@code owner/name} identities, at most the configured repository batch
	 * size
	 * @return metadata keyed by the requested identity
	 */
	Map<String, RepositoryInfo> getRepositories(List<String> names);

	/**
	 * Get one page of the forks a user owns.
	 * @param login user login
	 * @param after cursor of the previous page, null for the first page
	 * @return one page of forks
	 */
	SearchResult<RepositoryInfo> getUserForks(String login, @Nullable String after);

}
