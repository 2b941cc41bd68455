package org.springaicommunity.github.chronicle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * One entry of the classification cascade: a predicate over a repository identity and
 * the label it assigns.
 *
 * @param name rule name, for logging
 * @param predicate match condition
 * @param label category assigned on match
 */
public record CategoryRule(String name, Predicate<RepositoryName> predicate, String label) {

	public boolean matches(RepositoryName repository) {
		return predicate.test(repository);
	}

	/**
	 * Matches explicitly listed repositories by full identity.
	 * @param mapping lowercased {@code owner/name} to category
	 * @param label category of this rule
	 * @return the rule
	 */
	static CategoryRule explicit(Map<String, String> mapping, String label) {
		Set<String> keys = keysFor(mapping, label);
		return new CategoryRule("explicit:" + label, repository -> keys.contains(repository.fullName()), label);
	}

	/**
	 * Matches explicitly listed repositories by repository name for any owner, so that
	 * forks share the category of the original. Must follow every {@link #explicit} rule
	 * of the same mapping.
	 * @param mapping lowercased {@code owner/name} (or bare name) to category
	 * @param label category of this rule
	 * @return the rule
	 */
	static CategoryRule explicitByName(Map<String, String> mapping, String label) {
		Set<String> names = keysFor(mapping, label).stream()
			.map(CategoryRule::baseName)
			.collect(Collectors.toUnmodifiableSet());
		return new CategoryRule("explicit-name:" + label, repository -> names.contains(repository.name()), label);
	}

	/**
	 * The explicit rules of a mapping: all full-identity matches before any name match.
	 * @param mapping lowercased {@code owner/name} (or bare name) to category
	 * @return rules in cascade order
	 */
	static List<CategoryRule> explicitRules(Map<String, String> mapping) {
		Set<String> labels = new LinkedHashSet<>(mapping.values());
		List<CategoryRule> rules = new ArrayList<>();
		for (String label : labels) {
			rules.add(explicit(mapping, label));
		}
		for (String label : labels) {
			rules.add(explicitByName(mapping, label));
		}
		return rules;
	}

	private static Set<String> keysFor(Map<String, String> mapping, String label) {
		return mapping.entrySet()
			.stream()
			.filter(e -> e.getValue().equals(label))
			.map(Map.Entry::getKey)
			.collect(Collectors.toUnmodifiableSet());
	}

	static CategoryRule organization(Set<String> owners, String label) {
		return new CategoryRule("org:" + owners, repository -> owners.contains(repository.owner()), label);
	}

	static CategoryRule organizationPrefix(String ownerPrefix, String label) {
		return new CategoryRule("org-prefix:" + ownerPrefix, repository -> repository.owner().startsWith(ownerPrefix),
				label);
	}

	static CategoryRule scopedPattern(Set<String> owners, NamePattern pattern, String label) {
		return new CategoryRule("scoped:" + owners,
				repository -> owners.contains(repository.owner()) && pattern.matches(repository.name()), label);
	}

	static CategoryRule pattern(NamePattern pattern, String label) {
		return new CategoryRule("pattern:" + label, repository -> pattern.matches(repository.name()), label);
	}

	private static String baseName(String key) {
		int slash = key.indexOf('/');
		return slash < 0 ? key : key.substring(slash + 1);
	}

}
