package org.springaicommunity.github.chronicle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RepositoryFilter Tests")
class RepositoryFilterTest {

	private final RepositoryFilter filter = new RepositoryFilter(MirrorRules.defaults());

	private static RepositoryInfo described(String name, String description) {
		return new RepositoryInfo(name, description, false, false, null, null, null);
	}

	@Nested
	@DisplayName("Basic Rules")
	class BasicRulesTest {

		@Test
		@DisplayName("Should skip empty and missing names")
		void shouldSkipEmptyNames() {
			assertThat(filter.shouldSkip("")).isTrue();
			assertThat(filter.shouldSkip(null)).isTrue();
		}

		@Test
		@DisplayName("Should skip private repositories")
		void shouldSkipPrivate() {
			RepositoryInfo info = new RepositoryInfo("acme/secret", null, true, false, null, null, null);

			assertThat(filter.shouldSkip("acme/secret", info, "alice")).isTrue();
		}

		@Test
		@DisplayName("Should skip the subject's profile repository")
		void shouldSkipProfileRepository() {
			assertThat(filter.shouldSkip("alice/alice", null, "alice")).isTrue();
			assertThat(filter.shouldSkip("Alice/alice", null, "ALICE")).isTrue();
			assertThat(filter.shouldSkip("alice/alice", null, "bob")).isFalse();
		}

		@Test
		@DisplayName("Should keep ordinary repositories")
		void shouldKeepOrdinary() {
			assertThat(filter.shouldSkip("w3c/csswg-drafts")).isFalse();
		}

	}

	@Nested
	@DisplayName("Mirror Rules")
	class MirrorRulesTest {

		@ParameterizedTest
		@ValueSource(strings = { "zechy0055/qosta-broswer", "mozilla/gecko-dev", "serenityos/serenity" })
		@DisplayName("Should skip blocklisted copies")
		void shouldSkipBlocklisted(String repository) {
			assertThat(filter.shouldSkip(repository)).isTrue();
		}

		@Test
		@DisplayName("Should skip names resembling a flagship")
		void shouldSkipLookalikeNames() {
			assertThat(filter.shouldSkip("random/ladybird-fork")).isTrue();
			assertThat(filter.shouldSkip("someone/serenity-os-mirror")).isTrue();
		}

		@Test
		@DisplayName("Should keep the canonical flagship repositories")
		void shouldKeepCanonical() {
			assertThat(filter.shouldSkip("ladybirdbrowser/ladybird")).isFalse();
			assertThat(filter.shouldSkip("mozilla-firefox/firefox")).isFalse();
		}

		@Test
		@DisplayName("Should keep the subject's own fork under the canonical name")
		void shouldKeepOwnFork() {
			assertThat(filter.shouldSkip("myuser/ladybird", null, "myuser")).isFalse();
			assertThat(filter.shouldSkip("myuser/firefox", null, "myuser")).isFalse();
			assertThat(filter.shouldSkip("otheruser/ladybird", null, "myuser")).isTrue();
		}

		@Test
		@DisplayName("Should skip renamed forks of a flagship")
		void shouldSkipForksOfFlagship() {
			RepositoryInfo ladybird = RepositoryInfo.forkOf("someuser/renamed-browser", "ladybirdbrowser/ladybird");
			RepositoryInfo firefox = RepositoryInfo.forkOf("someuser/renamed-fox", "mozilla-firefox/firefox");

			assertThat(filter.shouldSkip("someuser/renamed-browser", ladybird, null)).isTrue();
			assertThat(filter.shouldSkip("someuser/renamed-fox", firefox, null)).isTrue();
		}

		@Test
		@DisplayName("Should skip repositories carrying a flagship description")
		void shouldSkipFlagshipDescriptions() {
			assertThat(filter.shouldSkip("someuser/my-browser",
					described("someuser/my-browser", "A fork of the Ladybird browser engine"), null))
				.isTrue();
			assertThat(filter.shouldSkip("someuser/my-project",
					described("someuser/my-project", "Truly independent web browser"), null))
				.isTrue();
			assertThat(filter.shouldSkip("someuser/my-fox",
					described("someuser/my-fox", "The official repository of Mozilla's Firefox web browser"), null))
				.isTrue();
		}

		@Test
		@DisplayName("Should keep repositories with unrelated descriptions")
		void shouldKeepUnrelatedDescriptions() {
			assertThat(filter.shouldSkip("someuser/tool", described("someuser/tool", "A CSS linter"), null)).isFalse();
		}

	}

}
