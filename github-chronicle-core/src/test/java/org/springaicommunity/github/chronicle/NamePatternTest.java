package org.springaicommunity.github.chronicle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NamePattern Tests")
class NamePatternTest {

	@Test
	@DisplayName("Should match exact names case-insensitively")
	void shouldMatchExact() {
		NamePattern pattern = NamePattern.builder().exact("webkit").build();

		assertThat(pattern.matches("WebKit")).isTrue();
		assertThat(pattern.matches("webkit-tools")).isFalse();
	}

	@Test
	@DisplayName("Should never match uppercase patterns")
	void shouldRequireLowercasePatterns() {
		assertThat(NamePattern.builder().exact("WebKit").build().matches("WebKit")).isFalse();
	}

	@Test
	@DisplayName("Should match prefixes, suffixes and substrings")
	void shouldMatchPartialNames() {
		assertThat(NamePattern.prefix("wai-").matches("wai-aria")).isTrue();
		assertThat(NamePattern.builder().suffix("-spec").build().matches("css-spec")).isTrue();
		assertThat(NamePattern.contains("i18n").matches("my-i18n-tool")).isTrue();
	}

	@Test
	@DisplayName("Should let exclusions win")
	void shouldApplyExclusions() {
		NamePattern pattern = NamePattern.builder().contains("validator").excludeContains("invalidator").build();

		assertThat(pattern.matches("html-validator")).isTrue();
		assertThat(pattern.matches("cache-invalidator")).isFalse();
	}

	@Test
	@DisplayName("Should match nothing when empty")
	void shouldMatchNothingWhenEmpty() {
		assertThat(NamePattern.builder().build().matches("anything")).isFalse();
	}

}
