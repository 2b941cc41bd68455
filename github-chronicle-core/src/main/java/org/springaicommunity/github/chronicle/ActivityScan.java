package org.springaicommunity.github.chronicle;

import java.util.Set;

/**
 * Outcome of the membership activity scan. The three sets are disjoint.
 *
 * @param active members with activity in range
 * @param inactive members confirmed to have no activity in range
 * @param unknown members whose activity could not be determined
 */
public record ActivityScan(Set<String> active, Set<String> inactive, Set<String> unknown) {
}
