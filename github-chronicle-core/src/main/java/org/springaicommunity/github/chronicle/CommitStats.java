package org.springaicommunity.github.chronicle;

/**
 * Line totals of a single commit.
 *
 * @param additions lines added
 * @param deletions lines deleted
 */
public record CommitStats(int additions, int deletions) {

	public static final CommitStats ZERO = new CommitStats(0, 0);

}
