package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Picks the language a repository is reported under.
 *
 * <p>
 * GitHub's primary language is the one with the most bytes, which hides C++ engines
 * behind large amounts of JavaScript test fixtures. C++ therefore wins whenever it holds
 * at least a tenth of the code.
 */
public final class LanguageResolver {

	static final String CPP = "C++";

	static final double CPP_SHARE_THRESHOLD = 0.10;

	private LanguageResolver() {
	}

	/**
	 * Resolve the effective language from byte counts.
	 * @param bytesByLanguage bytes per language
	 * @return the effective language, or null when there is no code
	 */
	public static @Nullable String effectiveLanguage(@Nullable Map<String, Long> bytesByLanguage) {
		if (bytesByLanguage == null || bytesByLanguage.isEmpty()) {
			return null;
		}
		long total = 0;
		String top = null;
		long topBytes = 0;
		for (Map.Entry<String, Long> entry : bytesByLanguage.entrySet()) {
			long bytes = entry.getValue() != null ? entry.getValue() : 0;
			total += bytes;
			if (top == null || bytes > topBytes) {
				top = entry.getKey();
				topBytes = bytes;
			}
		}
		if (total == 0) {
			return null;
		}
		Long cpp = bytesByLanguage.get(CPP);
		if (cpp != null && cpp >= total * CPP_SHARE_THRESHOLD) {
			return CPP;
		}
		return top;
	}

}
