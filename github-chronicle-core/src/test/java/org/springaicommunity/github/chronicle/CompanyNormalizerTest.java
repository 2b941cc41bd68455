package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CompanyNormalizer Tests")
class CompanyNormalizerTest {

	@Test
	@DisplayName("Should group members by normalized company")
	void shouldGroupMembers() {
		Map<String, @Nullable String> companies = new LinkedHashMap<>();
		companies.put("alice", "@w3c");
		companies.put("bob", "W3C");
		companies.put("carol", "@mesur.io");
		companies.put("dave", "@google Google");
		companies.put("erin", "  ");
		companies.put("frank", null);
		companies.put("gina", "acme corp");

		CompanyNormalizer.CompanyGroups result = CompanyNormalizer.group(companies);

		assertThat(result.groups().keySet()).containsExactly("@w3c", "@google", "@mesur.io", "Acme Corp",
				CompanyNormalizer.UNAFFILIATED);
		assertThat(result.groups().get("@w3c")).containsExactly("alice", "bob");
		assertThat(result.groups().get(CompanyNormalizer.UNAFFILIATED)).containsExactly("erin", "frank");
		assertThat(result.memberCompanies()).containsEntry("bob", "@w3c")
			.containsEntry("dave", "@google")
			.containsEntry("frank", CompanyNormalizer.UNAFFILIATED);
	}

	@Test
	@DisplayName("Should put a member with several mentions in every group")
	void shouldHandleSeveralMentions() {
		CompanyNormalizer.CompanyGroups result = CompanyNormalizer.group(Map.of("alice", "@igalia @w3c"));

		assertThat(result.groups()).containsEntry("@igalia", List.of("alice")).containsEntry("@w3c", List.of("alice"));
		assertThat(result.memberCompanies()).containsEntry("alice", "@igalia, @w3c");
	}

	@Test
	@DisplayName("Should extract lowercase mentions once each")
	void shouldExtractMentions() {
		assertThat(CompanyNormalizer.mentions("@Mozilla and @mozilla, @mesur.io")).containsExactly("mozilla",
				"mesur.io");
		assertThat(CompanyNormalizer.mentions(null)).isEmpty();
		assertThat(CompanyNormalizer.keys("Igalia", Set.of("igalia"))).containsExactly("@igalia");
	}

	@Test
	@DisplayName("Should title-case words")
	void shouldTitleCase() {
		assertThat(CompanyNormalizer.titleCase("ACME corp-labs")).isEqualTo("Acme Corp-Labs");
	}

}
