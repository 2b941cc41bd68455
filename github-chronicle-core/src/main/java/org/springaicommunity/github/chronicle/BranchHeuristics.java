package org.springaicommunity.github.chronicle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the branches of a fork worth scanning for a user's own commits.
 *
 * <p>
 * Prefix matching is best effort: it can miss a user branch with an unusual name and
 * include an upstream branch that happens to match. Small forks have every branch
 * scanned except upstream-looking ones.
 */
public final class BranchHeuristics {

	/**
	 * Forks with at most this many branches have every branch scanned.
	 */
	static final int SCAN_ALL_THRESHOLD = 20;

	private static final List<String> DEFAULT_BRANCHES = List.of("main", "master");

	private static final List<String> USER_PREFIXES = List.of("eng/", "fix/", "fix-", "feature/", "feat/",
			"bugfix/", "dev/", "patch-", "wip/");

	private static final List<String> UPSTREAM_PREFIXES = List.of("dependabot/", "renovate/", "release", "gh-pages",
			"upstream");

	private BranchHeuristics() {
	}

	/**
	 * Select branches to scan, unique by head commit.
	 * @param branches all branches of the fork
	 * @param login fork owner
	 * @return selected branches in listing order
	 */
	public static List<Branch> select(List<Branch> branches, String login) {
		String userPrefix = login.toLowerCase(Locale.ROOT) + "/";
		List<Branch> selected = new ArrayList<>();
		Set<String> seenHeads = new LinkedHashSet<>();
		boolean scanAll = branches.size() <= SCAN_ALL_THRESHOLD;
		for (Branch branch : branches) {
			String name = branch.name().toLowerCase(Locale.ROOT);
			boolean wanted = DEFAULT_BRANCHES.contains(name)
					|| (!looksUpstream(name) && (scanAll || name.startsWith(userPrefix) || hasUserPrefix(name)));
			if (wanted && (branch.sha().isEmpty() || seenHeads.add(branch.sha()))) {
				selected.add(branch);
			}
		}
		return selected;
	}

	static boolean looksUpstream(String branchName) {
		String name = branchName.toLowerCase(Locale.ROOT);
		return UPSTREAM_PREFIXES.stream().anyMatch(name::startsWith);
	}

	private static boolean hasUserPrefix(String name) {
		return USER_PREFIXES.stream().anyMatch(name::startsWith);
	}

}
