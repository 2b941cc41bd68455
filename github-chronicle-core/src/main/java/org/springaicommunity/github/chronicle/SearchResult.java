package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated GitHub listing.
 *
 * @param <T> the type of items in the result
 * @param items the items on this page
 * @param nextCursor cursor (GraphQL) or page number (REST) of the next page, null if none
 * @param hasMore whether there are more items available
 * @param totalCount total number of matches reported by GitHub
 */
public record SearchResult<T>(List<T> items, @Nullable String nextCursor, boolean hasMore, int totalCount) {

	/**
	 * Create an empty result with no more pages.
	 * @param <T> the item type
	 * @return empty SearchResult
	 */
	public static <T> SearchResult<T> empty() {
		return new SearchResult<>(List.of(), null, false, 0);
	}

}
