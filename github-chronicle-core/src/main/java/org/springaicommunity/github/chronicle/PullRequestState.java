package org.springaicommunity.github.chronicle;

/**
 * Merge status of a pull request.
 */
public enum PullRequestState {

	OPEN, MERGED, CLOSED;

	/**
	 * Map a GitHub state string to a PullRequestState.
	 * @param state GitHub state (OPEN, CLOSED, MERGED, any case)
	 * @param merged merged flag reported alongside the state
	 * @return the state, CLOSED meaning closed without merging
	 */
	public static PullRequestState from(String state, boolean merged) {
		if (merged || "merged".equalsIgnoreCase(state)) {
			return MERGED;
		}
		return "open".equalsIgnoreCase(state) ? OPEN : CLOSED;
	}

}
