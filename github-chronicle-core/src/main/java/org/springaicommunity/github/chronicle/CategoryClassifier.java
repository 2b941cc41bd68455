package org.springaicommunity.github.chronicle;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Assigns a category label to a repository.
 *
 * <p>
 * Rules are evaluated in order: explicit mapping, standards organizations (with their
 * organization-scoped name patterns first), ecosystem organizations, then general name
 * patterns. Repositories no rule matches fall back to their topic tags, looked up once
 * per repository and memoized in a bounded cache. Anything left is {@code Other}.
 *
 * <p>
 * Thread-safe: the topic cache is the only mutable state and loads each key once.
 */
public class CategoryClassifier {

	private static final Logger logger = LoggerFactory.getLogger(CategoryClassifier.class);

	private final CategoryRules rules;

	private final @Nullable RestService restService;

	private final Cache<String, String> topicCategories;

	/**
	 * Create a classifier.
	 * @param rules rule tables
	 * @param restService topic source, or null to skip the topic fallback
	 * @param cacheSize maximum number of memoized topic lookups
	 */
	public CategoryClassifier(CategoryRules rules, @Nullable RestService restService, int cacheSize) {
		this.rules = rules;
		this.restService = restService;
		this.topicCategories = Caffeine.newBuilder().maximumSize(cacheSize).build();
	}

	/**
	 * Rules-only classifier without topic lookups.
	 */
	public CategoryClassifier(CategoryRules rules) {
		this(rules, null, 1);
	}

	/**
	 * Classify a repository.
	 * @param repository {@code owner/name} or a bare name
	 * @return category label, {@link CategoryRules#OTHER} if nothing matches
	 */
	public String classify(String repository) {
		String byRules = classifyByRules(repository);
		if (byRules != null) {
			return byRules;
		}
		RepositoryName name = RepositoryName.parse(repository);
		if (restService == null || name.owner().isEmpty()) {
			return CategoryRules.OTHER;
		}
		return topicCategories.get(name.fullName(), this::classifyByTopics);
	}

	/**
	 * Classify by the rule cascade alone.
	 * @param repository {@code owner/name} or a bare name
	 * @return category label, or null if no rule matches
	 */
	public @Nullable String classifyByRules(String repository) {
		RepositoryName name = RepositoryName.parse(repository);
		for (CategoryRule rule : rules.rules()) {
			if (rule.matches(name)) {
				return rule.label();
			}
		}
		return null;
	}

	/**
	 * Whether a repository belongs to a known category. Forks of such repositories get
	 * their branches scanned.
	 * @param repository {@code owner/name}
	 * @return true if a rule matches
	 */
	public boolean isInteresting(String repository) {
		return classifyByRules(repository) != null;
	}

	/**
	 * Map topic tags to a category; the first topic with a mapping wins.
	 * @param topics topic tags, possibly null
	 * @return category label, or null if no topic maps
	 */
	public @Nullable String categoryFromTopics(@Nullable List<String> topics) {
		if (topics == null) {
			return null;
		}
		for (String topic : topics) {
			String category = rules.topicCategories().get(topic.toLowerCase(Locale.ROOT));
			if (category != null) {
				return category;
			}
		}
		return null;
	}

	/**
	 * Order category labels for display.
	 * @param categories labels, duplicates allowed
	 * @return unique labels by priority, then alphabetically, with Other last
	 */
	public List<String> orderedCategories(Collection<String> categories) {
		List<String> ordered = new ArrayList<>(new LinkedHashSet<>(categories));
		ordered.sort(Comparator.comparingInt(this::rank).thenComparing(Comparator.naturalOrder()));
		return ordered;
	}

	private int rank(String category) {
		if (CategoryRules.OTHER.equals(category)) {
			return Integer.MAX_VALUE;
		}
		int index = rules.priority().indexOf(category);
		return index >= 0 ? index : rules.priority().size();
	}

	private String classifyByTopics(String repository) {
		RestService topics = restService;
		if (topics == null) {
			return CategoryRules.OTHER;
		}
		try {
			String category = categoryFromTopics(topics.getTopics(repository));
			logger.debug("Topic category for {}: {}", repository, category);
			return category != null ? category : CategoryRules.OTHER;
		}
		catch (RateLimitExceededException e) {
			throw e;
		}
		catch (RuntimeException e) {
			logger.debug("Topic lookup failed for {}: {}", repository, e.getMessage());
			return CategoryRules.OTHER;
		}
	}

}
