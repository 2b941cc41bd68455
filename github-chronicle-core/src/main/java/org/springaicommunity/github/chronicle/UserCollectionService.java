package org.springaicommunity.github.chronicle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the activity report of a single user.
 */
public class UserCollectionService implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(UserCollectionService.class);

	private final MemberActivityCollector collector;

	private final WorkerPools pools;

	public UserCollectionService(MemberActivityCollector collector, WorkerPools pools) {
		this.collector = collector;
		this.pools = pools;
	}

	/**
	 * Gather the user's activity in the requested window.
	 * @param request a single-user request
	 * @return the user's activity
	 * @throws IllegalArgumentException if the request is for an organization
	 * @throws RateLimitExceededException if the quota ran out
	 */
	public MemberActivity collect(ChronicleRequest request) {
		String login = request.user();
		if (login == null) {
			throw new IllegalArgumentException("A user is required for a single-user report");
		}
		logger.info("Collecting activity of {} from {} to {}{}", login, request.from(), request.to(),
				request.lightMode() ? " (light mode)" : "");
		MemberActivity activity = request.lightMode() ? collector.collectLight(login, request.from(), request.to())
				: collector.collect(login, request.from(), request.to());
		logger.info("{}: {} commits, {} pull requests, {} reviews in {} repositories", login,
				activity.totals().allBranchCommits(), activity.totals().pullRequestsCreated(),
				activity.totals().reviews(), activity.repositories().size());
		return activity;
	}

	@Override
	public void close() {
		pools.close();
	}

}
