package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A pull request created or reviewed by a subject. The URL is the de-duplication key.
 *
 * @param url pull request URL
 * @param title pull request title
 * @param repository repository identity in {@code owner/name} format
 * @param author author login
 * @param additions lines added
 * @param deletions lines deleted
 * @param reviewCount reviews the subject submitted on it (reviewed pool only)
 * @param state merge status
 * @param createdAt creation timestamp
 */
public record PullRequestRecord(String url, String title, String repository, String author, int additions,
		int deletions, int reviewCount, PullRequestState state, @Nullable Instant createdAt) {

	public PullRequestRecord withReviewCount(int reviewCount) {
		return new PullRequestRecord(url, title, repository, author, additions, deletions, reviewCount, state,
				createdAt);
	}

}
