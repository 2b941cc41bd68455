package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Produces the aggregate activity report of an organization or team.
 *
 * <p>
 * The run is gated on the GraphQL quota: it aborts when too little is left (optionally
 * after waiting for a reset), and asks for confirmation when the projected cost is high.
 * Inactive members are filtered out before full gathering. Each active member is
 * gathered on the member pool; a member whose gathering fails contributes zero and the
 * run goes on. Quota exhaustion stops the run.
 */
public class OrgCollectionService implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(OrgCollectionService.class);

	private final RestService restService;

	private final RateLimitBudget budget;

	private final ActivityScanner scanner;

	private final MemberActivityCollector collector;

	private final OrgAggregator aggregator;

	private final WorkerPools pools;

	private final RunConfirmation confirmation;

	public OrgCollectionService(RestService restService, RateLimitBudget budget, ActivityScanner scanner,
			MemberActivityCollector collector, OrgAggregator aggregator, WorkerPools pools,
			RunConfirmation confirmation) {
		this.restService = restService;
		this.budget = budget;
		this.scanner = scanner;
		this.collector = collector;
		this.aggregator = aggregator;
		this.pools = pools;
		this.confirmation = confirmation;
	}

	/**
	 * Gather and aggregate the activity of every active member.
	 * @param request an organization request
	 * @return the aggregate
	 * @throws IllegalArgumentException if the request is for a single user
	 * @throws RateLimitExceededException if the quota is too low or ran out
	 * @throws RunCancelledException if an expensive run was declined
	 */
	public OrgAggregateResult collect(ChronicleRequest request) {
		String organization = request.organization();
		if (organization == null) {
			throw new IllegalArgumentException("An organization is required for an aggregate report");
		}
		String label = request.team() != null ? organization + "/" + request.team() : organization;

		OrganizationProfile profile = fetchProfile(organization);
		List<String> members = listMembers(organization, request.team());
		logger.info("{}: {} members (bots excluded)", label, members.size());
		if (members.isEmpty()) {
			return OrgAggregateResult.empty(label).withProfile(profile);
		}

		checkBudget(request, members.size());

		ActivityScan scan = scanner.scan(members, request.from(), request.to());
		List<String> active = new ArrayList<>(new TreeSet<>(scan.active()));
		if (!scan.unknown().isEmpty()) {
			logger.warn("{}: activity of {} member(s) could not be determined, skipping them", label,
					scan.unknown().size());
		}
		logger.info("{}: gathering {} active members, about {} API calls", label, active.size(),
				budget.estimate(active.size(), request.days(), true));

		List<MemberActivity> results = new ArrayList<>();
		List<TaskOutcome<String, MemberActivity>> outcomes = pools.member()
			.execute(active, login -> gather(login, request), (outcome, completed, total) -> {
				if (outcome.isSuccess()) {
					logger.info("[{}/{}] {} done", completed, total, outcome.input());
				}
				else {
					logger.warn("[{}/{}] {} failed: {}", completed, total, outcome.input(),
							outcome.failure() != null ? outcome.failure().getMessage() : "no result");
				}
			});
		for (TaskOutcome<String, MemberActivity> outcome : outcomes) {
			MemberActivity activity = outcome.value();
			results.add(activity != null ? activity : MemberActivity.failed(outcome.input()));
		}
		return aggregator.aggregate(label, members.size(), results).withProfile(profile);
	}

	private @Nullable OrganizationProfile fetchProfile(String organization) {
		try {
			OrganizationProfile profile = restService.getOrganization(organization);
			if (profile == null) {
				logger.warn("Organization {} has no readable profile", organization);
			}
			return profile;
		}
		catch (RateLimitExceededException e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.warn("Failed to read the profile of {}: {}", organization, e.getMessage());
			return null;
		}
	}

	private MemberActivity gather(String login, ChronicleRequest request) {
		return request.lightMode() ? collector.collectLight(login, request.from(), request.to())
				: collector.collect(login, request.from(), request.to());
	}

	private List<String> listMembers(String organization, @Nullable String team) {
		List<String> all = team != null ? restService.getTeamMembers(organization, team)
				: restService.getOrganizationMembers(organization);
		TreeSet<String> humans = new TreeSet<>();
		for (String login : all) {
			if (!BotAccounts.isBot(login)) {
				humans.add(login);
			}
		}
		return new ArrayList<>(humans);
	}

	private void checkBudget(ChronicleRequest request, int memberCount) {
		RateLimitInfo info = budget.refresh();
		if (budget.shouldAbort(info.remaining())) {
			Duration maxWait = request.waitForReset();
			if (maxWait == null || !budget.waitForReset(maxWait)) {
				throw budget.exhausted();
			}
			info = budget.refresh();
			if (budget.shouldAbort(info.remaining())) {
				throw budget.exhausted();
			}
		}

		long estimate = budget.estimate(memberCount, request.days());
		if (budget.shouldWarn(estimate, info.remaining())) {
			String warning = budget.warningMessage(estimate, info.remaining());
			logger.warn(warning);
			if (!request.assumeYes() && !confirmation.confirm(warning)) {
				throw new RunCancelledException("Run cancelled: " + warning);
			}
		}
	}

	@Override
	public void close() {
		pools.close();
	}

}
