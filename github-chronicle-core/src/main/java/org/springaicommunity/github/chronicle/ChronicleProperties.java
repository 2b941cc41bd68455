package org.springaicommunity.github.chronicle;

/**
 * Configuration properties for activity collection.
 *
 * <p>
 * Properties can be set directly via setters and passed to
 * {@link GitHubChronicleBuilder}. The defaults are the values the engine is tuned for;
 * pool sizes in particular sit below the level at which GitHub's secondary abuse
 * throttle starts failing requests silently, so raising them is not recommended outside
 * of tests.
 */
public class ChronicleProperties {

	/**
	 * Concurrent per-commit stat and language fetches.
	 */
	private int statsConcurrency = 10;

	/**
	 * Concurrent per-member gathering tasks and batched summary fallbacks.
	 */
	private int memberConcurrency = 5;

	/**
	 * Concurrent contribution calendar probes.
	 */
	private int scrapeConcurrency = 20;

	/**
	 * Retries after the first attempt for transient failures.
	 */
	private int maxRetries = 3;

	/**
	 * Delay in milliseconds before the first retry. Doubles on each further retry.
	 */
	private long initialRetryDelayMs = 1000;

	/**
	 * Per-request timeout in seconds.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Remaining quota below which successful requests are paced.
	 */
	private int pacingThreshold = 100;

	/**
	 * Total GraphQL quota per hour, used when judging whether a run is expensive.
	 */
	private int rateLimitTotal = 5000;

	/**
	 * Remaining quota below which a run is aborted without asking.
	 */
	private int abortFloor = 50;

	/**
	 * Users per batched contribution summary query.
	 */
	private int userBatchSize = 10;

	/**
	 * Repositories per batched metadata query.
	 */
	private int repositoryBatchSize = 50;

	/**
	 * Maximum commits fetched from the commit search index.
	 */
	private int searchResultCap = 1000;

	/**
	 * Maximum repositories whose topic-based category is remembered.
	 */
	private int topicCacheSize = 2000;

	public int getStatsConcurrency() {
		return statsConcurrency;
	}

	public void setStatsConcurrency(int statsConcurrency) {
		this.statsConcurrency = statsConcurrency;
	}

	public int getMemberConcurrency() {
		return memberConcurrency;
	}

	public void setMemberConcurrency(int memberConcurrency) {
		this.memberConcurrency = memberConcurrency;
	}

	public int getScrapeConcurrency() {
		return scrapeConcurrency;
	}

	public void setScrapeConcurrency(int scrapeConcurrency) {
		this.scrapeConcurrency = scrapeConcurrency;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getInitialRetryDelayMs() {
		return initialRetryDelayMs;
	}

	public void setInitialRetryDelayMs(long initialRetryDelayMs) {
		this.initialRetryDelayMs = initialRetryDelayMs;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public int getPacingThreshold() {
		return pacingThreshold;
	}

	public void setPacingThreshold(int pacingThreshold) {
		this.pacingThreshold = pacingThreshold;
	}

	public int getRateLimitTotal() {
		return rateLimitTotal;
	}

	public void setRateLimitTotal(int rateLimitTotal) {
		this.rateLimitTotal = rateLimitTotal;
	}

	public int getAbortFloor() {
		return abortFloor;
	}

	public void setAbortFloor(int abortFloor) {
		this.abortFloor = abortFloor;
	}

	public int getUserBatchSize() {
		return userBatchSize;
	}

	public void setUserBatchSize(int userBatchSize) {
		this.userBatchSize = userBatchSize;
	}

	public int getRepositoryBatchSize() {
		return repositoryBatchSize;
	}

	public void setRepositoryBatchSize(int repositoryBatchSize) {
		this.repositoryBatchSize = repositoryBatchSize;
	}

	public int getSearchResultCap() {
		return searchResultCap;
	}

	public void setSearchResultCap(int searchResultCap) {
		this.searchResultCap = searchResultCap;
	}

	public int getTopicCacheSize() {
		return topicCacheSize;
	}

	public void setTopicCacheSize(int topicCacheSize) {
		this.topicCacheSize = topicCacheSize;
	}

}
