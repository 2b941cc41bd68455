package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups members by the company field of their profiles.
 *
 * <p>
 * {@code @org} mentions are the group keys, lowercased. A company without mentions is
 * title-cased, unless its lowercase form is an organization some member mentions, in
 * which case it joins that group: {@code W3C} and {@code @w3c} end up together. Blank
 * companies go to {@value #UNAFFILIATED}.
 */
public final class CompanyNormalizer {

	public static final String UNAFFILIATED = "Unaffiliated";

	private static final Pattern MENTION = Pattern.compile("@([\\w.-]+)");

	private CompanyNormalizer() {
	}

	/**
	 * Company groups and the normalized company of each member.
	 *
	 * @param groups company to member logins, largest group first, members sorted
	 * @param memberCompanies member login to normalized company
	 */
	public record CompanyGroups(Map<String, List<String>> groups, Map<String, String> memberCompanies) {
	}

	/**
	 * Group members by company.
	 * @param companies raw company field per member login
	 * @return the groups
	 */
	public static CompanyGroups group(Map<String, @Nullable String> companies) {
		Set<String> mentioned = new HashSet<>();
		for (String company : companies.values()) {
			mentioned.addAll(mentions(company));
		}

		Map<String, Set<String>> members = new LinkedHashMap<>();
		Map<String, String> memberCompanies = new LinkedHashMap<>();
		for (Map.Entry<String, @Nullable String> entry : companies.entrySet()) {
			Set<String> keys = keys(entry.getValue(), mentioned);
			for (String key : keys) {
				members.computeIfAbsent(key, k -> new TreeSet<>()).add(entry.getKey());
			}
			memberCompanies.put(entry.getKey(), String.join(", ", keys));
		}

		List<Map.Entry<String, Set<String>>> sorted = new ArrayList<>(members.entrySet());
		sorted.sort(Comparator.<Map.Entry<String, Set<String>>>comparingInt(e -> UNAFFILIATED.equals(e.getKey()) ? 1 : 0)
			.thenComparingInt(e -> -e.getValue().size())
			.thenComparing(e -> e.getKey().toLowerCase(Locale.ROOT)));
		Map<String, List<String>> groups = new LinkedHashMap<>();
		for (Map.Entry<String, Set<String>> entry : sorted) {
			groups.put(entry.getKey(), List.copyOf(entry.getValue()));
		}
		return new CompanyGroups(groups, memberCompanies);
	}

	/**
	 * Group keys for one company field.
	 * @param company raw company field
	 * @param mentioned lowercase organization names any member mentions, without the
	 * {@code @}
	 * @return group keys, never empty
	 */
	static Set<String> keys(@Nullable String company, Set<String> mentioned) {
		if (company == null || company.isBlank()) {
			return Set.of(UNAFFILIATED);
		}
		Set<String> mentions = mentions(company);
		Set<String> keys = new LinkedHashSet<>();
		if (!mentions.isEmpty()) {
			for (String mention : mentions) {
				keys.add("@" + mention);
			}
			return keys;
		}
		String plain = company.trim();
		String lower = plain.toLowerCase(Locale.ROOT);
		keys.add(mentioned.contains(lower) ? "@" + lower : titleCase(plain));
		return keys;
	}

	/**
	 * Organization mentions in a company field.
	 * @param company raw company field
	 * @return lowercase names without the {@code @}, in order of appearance
	 */
	static Set<String> mentions(@Nullable String company) {
		Set<String> mentions = new LinkedHashSet<>();
		if (company == null) {
			return mentions;
		}
		Matcher matcher = MENTION.matcher(company);
		while (matcher.find()) {
			mentions.add(matcher.group(1).toLowerCase(Locale.ROOT));
		}
		return mentions;
	}

	/**
	 * Uppercase the first letter of every word and lowercase the rest. A word starts after
	 * any character that is not a letter.
	 */
	static String titleCase(String text) {
		StringBuilder result = new StringBuilder(text.length());
		boolean previousLetter = false;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (Character.isLetter(c)) {
				result.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
				previousLetter = true;
			}
			else {
				result.append(c);
				previousLetter = false;
			}
		}
		return result.toString();
	}

}
