package org.springaicommunity.github.chronicle;

import java.util.List;
import java.util.Locale;

/**
 * Match rules for a repository name. The name is lowercased before matching, so patterns
 * must be lowercase. An exclusion beats any inclusion.
 *
 * @param exact names matched in full
 * @param prefix name prefixes
 * @param suffix name suffixes
 * @param contains name substrings
 * @param excludePrefix prefixes that prevent a match
 * @param excludeContains substrings that prevent a match
 */
public record NamePattern(List<String> exact, List<String> prefix, List<String> suffix, List<String> contains,
		List<String> excludePrefix, List<String> excludeContains) {

	public static Builder builder() {
		return new Builder();
	}

	public static NamePattern prefix(String... prefixes) {
		return builder().prefix(prefixes).build();
	}

	public static NamePattern contains(String... substrings) {
		return builder().contains(substrings).build();
	}

	public boolean matches(String name) {
		String lower = name.toLowerCase(Locale.ROOT);
		if (excludePrefix.stream().anyMatch(lower::startsWith) || excludeContains.stream().anyMatch(lower::contains)) {
			return false;
		}
		return exact.contains(lower) || prefix.stream().anyMatch(lower::startsWith)
				|| suffix.stream().anyMatch(lower::endsWith) || contains.stream().anyMatch(lower::contains);
	}

	/**
	 * Builder for {@link NamePattern}.
	 */
	public static class Builder {

		private List<String> exact = List.of();

		private List<String> prefix = List.of();

		private List<String> suffix = List.of();

		private List<String> contains = List.of();

		private List<String> excludePrefix = List.of();

		private List<String> excludeContains = List.of();

		private Builder() {
		}

		public Builder exact(String... values) {
			this.exact = List.of(values);
			return this;
		}

		public Builder prefix(String... values) {
			this.prefix = List.of(values);
			return this;
		}

		public Builder suffix(String... values) {
			this.suffix = List.of(values);
			return this;
		}

		public Builder contains(String... values) {
			this.contains = List.of(values);
			return this;
		}

		public Builder excludePrefix(String... values) {
			this.excludePrefix = List.of(values);
			return this;
		}

		public Builder excludeContains(String... values) {
			this.excludeContains = List.of(values);
			return this;
		}

		public NamePattern build() {
			return new NamePattern(exact, prefix, suffix, contains, excludePrefix, excludeContains);
		}

	}

}
