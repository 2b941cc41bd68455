package org.springaicommunity.github.chronicle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable rule tables for {@link CategoryClassifier}.
 *
 * @param rules the ordered cascade; the first matching rule wins
 * @param topicCategories topic to category, in lookup order
 * @param priority display order of categories; unlisted ones follow alphabetically and
 * {@link #OTHER} comes last
 */
public record CategoryRules(List<CategoryRule> rules, Map<String, String> topicCategories, List<String> priority) {

	public static final String OTHER = "Other";

	public static final String BROWSER_ENGINES = "Browser engines";

	public static final String JS_ENGINES = "JavaScript engines and runtimes";

	public static final String WEB_STANDARDS = "Web standards and specifications";

	public static final String STANDARDS_POSITIONS = "Standards positions";

	public static final String WEB_PLATFORM_TESTS = "Web platform tests";

	public static final String VALIDATION = "HTML/CSS checking/validation";

	public static final String ACCESSIBILITY = "Accessibility";

	public static final String I18N = "Internationalization";

	public static final String DEVELOPER_TOOLS = "Developer tools";

	public static final String DOCUMENTATION = "Documentation";

	public static final String ML_FRAMEWORKS = "ML frameworks";

	public static final String DEVOPS = "DevOps";

	public CategoryRules {
		rules = List.copyOf(rules);
		topicCategories = Collections.unmodifiableMap(new LinkedHashMap<>(topicCategories));
		priority = List.copyOf(priority);
	}

	/**
	 * The built-in tables, tuned for web platform and browser work.
	 */
	public static CategoryRules defaults() {
		Map<String, String> explicit = new LinkedHashMap<>();
		explicit.put("validator/validator", VALIDATION);
		explicit.put("ladybirdbrowser/ladybird", BROWSER_ENGINES);
		explicit.put("mozilla-firefox/firefox", BROWSER_ENGINES);
		explicit.put("servo/servo", BROWSER_ENGINES);
		explicit.put("webkit/webkit", BROWSER_ENGINES);
		explicit.put("mozilla/standards-positions", STANDARDS_POSITIONS);
		explicit.put("web-platform-tests/wpt", WEB_PLATFORM_TESTS);
		explicit.put("mdn/content", DOCUMENTATION);
		explicit.put("w3c/webref", DEVELOPER_TOOLS);

		List<CategoryRule> rules = new ArrayList<>(CategoryRule.explicitRules(explicit));

		Set<String> w3c = Set.of("w3c");
		rules.add(CategoryRule.scopedPattern(w3c, NamePattern.prefix("wai-", "wcag"), ACCESSIBILITY));
		rules.add(CategoryRule.scopedPattern(w3c, NamePattern.prefix("i18n-"), I18N));
		rules.add(CategoryRule.organization(Set.of("w3c", "whatwg", "tc39", "wicg", "khronosgroup", "webassembly"),
				WEB_STANDARDS));
		rules.add(CategoryRule.organizationPrefix("ietf-wg-", WEB_STANDARDS));

		rules.add(CategoryRule.organization(Set.of("mozilla", "chromium", "webkit", "ladybirdbrowser", "servo"),
				BROWSER_ENGINES));
		rules.add(CategoryRule.organization(Set.of("nodejs", "denoland", "oven-sh"), JS_ENGINES));
		rules.add(CategoryRule.organization(Set.of("pytorch", "tensorflow", "huggingface"), ML_FRAMEWORKS));
		rules.add(CategoryRule.organization(Set.of("kubernetes", "docker", "helm"), DEVOPS));
		rules.add(CategoryRule.organization(Set.of("mdn"), DOCUMENTATION));
		rules.add(CategoryRule.organization(Set.of("web-platform-tests"), WEB_PLATFORM_TESTS));

		rules.add(CategoryRule.pattern(NamePattern.contains("validator"), VALIDATION));
		rules.add(CategoryRule.pattern(NamePattern.builder().contains("a11y", "accessibility", "aria").build(),
				ACCESSIBILITY));
		rules.add(CategoryRule.pattern(NamePattern.contains("i18n"), I18N));
		rules.add(CategoryRule.pattern(NamePattern.builder().suffix("-spec").excludePrefix("test-").build(),
				WEB_STANDARDS));

		Map<String, String> topics = new LinkedHashMap<>();
		topics.put("machine-learning", ML_FRAMEWORKS);
		topics.put("deep-learning", ML_FRAMEWORKS);
		topics.put("pytorch", ML_FRAMEWORKS);
		topics.put("tensorflow", ML_FRAMEWORKS);
		topics.put("kubernetes", DEVOPS);
		topics.put("docker", DEVOPS);
		topics.put("devops", DEVOPS);
		topics.put("accessibility", ACCESSIBILITY);
		topics.put("a11y", ACCESSIBILITY);
		topics.put("wcag", ACCESSIBILITY);
		topics.put("i18n", I18N);
		topics.put("browser", BROWSER_ENGINES);
		topics.put("w3c", WEB_STANDARDS);
		topics.put("web-standards", WEB_STANDARDS);

		List<String> priority = List.of(BROWSER_ENGINES, JS_ENGINES, WEB_STANDARDS, STANDARDS_POSITIONS,
				WEB_PLATFORM_TESTS, VALIDATION, ACCESSIBILITY, I18N, DEVELOPER_TOOLS, DOCUMENTATION, ML_FRAMEWORKS,
				DEVOPS);
		return new CategoryRules(rules, topics, priority);
	}

}
