package org.springaicommunity.github.chronicle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

/**
 * Activity of one subject (or of an organization) in one repository.
 *
 * <p>
 * Mutated while commits stream in and frozen once every fetch task for the subject has
 * completed. Any mutation after {@link #freeze()} throws {@link IllegalStateException}.
 * Not thread-safe: owned by a single task.
 */
public class RepoActivity {

	private final String name;

	private int commits;

	private long additions;

	private long deletions;

	private int pullRequests;

	private @Nullable String category;

	private @Nullable String language;

	private @Nullable String description;

	private @Nullable String parent;

	private boolean frozen;

	public RepoActivity(String name) {
		this.name = name;
	}

	/**
	 * Count one commit and its line stats.
	 * @param commit commit credited to this repository
	 */
	public void addCommit(Commit commit) {
		checkMutable();
		commits++;
		additions += commit.additionsOrZero();
		deletions += commit.deletionsOrZero();
	}

	/**
	 * Count commits known only by number, as reported by contribution summaries.
	 * @param count number of commits
	 */
	public void addCommits(int count) {
		checkMutable();
		commits += count;
	}

	public void addPullRequest() {
		checkMutable();
		pullRequests++;
	}

	/**
	 * Fold another activity for the same repository into this one. Counts are summed;
	 * annotations keep the first non-null value.
	 * @param other activity to absorb
	 */
	public void absorb(RepoActivity other) {
		checkMutable();
		commits += other.commits;
		additions += other.additions;
		deletions += other.deletions;
		pullRequests += other.pullRequests;
		if (category == null) {
			category = other.category;
		}
		if (language == null) {
			language = other.language;
		}
		if (description == null) {
			description = other.description;
		}
		if (parent == null) {
			parent = other.parent;
		}
	}

	public void freeze() {
		this.frozen = true;
	}

	@JsonIgnore
	public boolean isFrozen() {
		return frozen;
	}

	private void checkMutable() {
		if (frozen) {
			throw new IllegalStateException("Repository activity for " + name + " is frozen");
		}
	}

	public String getName() {
		return name;
	}

	public int getCommits() {
		return commits;
	}

	public long getAdditions() {
		return additions;
	}

	public long getDeletions() {
		return deletions;
	}

	public int getPullRequests() {
		return pullRequests;
	}

	public @Nullable String getCategory() {
		return category;
	}

	public void setCategory(@Nullable String category) {
		checkMutable();
		this.category = category;
	}

	public @Nullable String getLanguage() {
		return language;
	}

	public void setLanguage(@Nullable String language) {
		checkMutable();
		this.language = language;
	}

	public @Nullable String getDescription() {
		return description;
	}

	public void setDescription(@Nullable String description) {
		checkMutable();
		this.description = description;
	}

	public @Nullable String getParent() {
		return parent;
	}

	public void setParent(@Nullable String parent) {
		checkMutable();
		this.parent = parent;
	}

	@Override
	public String toString() {
		return "RepoActivity{name='" + name + "', commits=" + commits + ", additions=" + additions + ", deletions="
				+ deletions + ", pullRequests=" + pullRequests + ", category='" + category + "'}";
	}

}
