package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Data describing repositories that copy the history of heavily mirrored flagship
 * projects. Copies pollute commit search with commits their owners never wrote.
 *
 * @param blocklist repositories always skipped, lowercased {@code owner/name}
 * @param skippedNameMarkers substrings that get any repository skipped
 * @param flagships flagship projects and how their copies are recognized
 */
public record MirrorRules(Set<String> blocklist, List<String> skippedNameMarkers, List<Flagship> flagships) {

	/**
	 * A heavily mirrored project.
	 *
	 * @param canonical the real repository, lowercased {@code owner/name}
	 * @param forkName repository name under which users legitimately fork it
	 * @param nameMarkers substrings of a repository name that indicate a copy
	 * @param descriptions exact descriptions of the project, compared ignoring case
	 * @param descriptionMarkers substrings of a description that indicate a copy
	 */
	public record Flagship(String canonical, String forkName, List<String> nameMarkers, List<String> descriptions,
			List<String> descriptionMarkers) {

		boolean isAllowed(RepositoryName repository, @Nullable String login) {
			if (repository.fullName().equals(canonical)) {
				return true;
			}
			return login != null && repository.owner().equals(login.toLowerCase(Locale.ROOT))
					&& repository.name().equals(forkName);
		}

		boolean nameLooksCopied(RepositoryName repository) {
			return nameMarkers.stream().anyMatch(repository.name()::contains);
		}

		boolean descriptionLooksCopied(@Nullable String description) {
			if (description == null) {
				return false;
			}
			String lower = description.trim().toLowerCase(Locale.ROOT);
			return descriptions.stream().anyMatch(d -> d.equalsIgnoreCase(lower))
					|| descriptionMarkers.stream().anyMatch(lower::contains);
		}

	}

	/**
	 * The rules for Ladybird, Firefox and SerenityOS.
	 * @return default mirror rules
	 */
	public static MirrorRules defaults() {
		return new MirrorRules(
				Set.of("zechy0055/qosta-broswer", "mozilla/gecko-dev", "mozilla/gecko", "serenityos/serenity"),
				List.of("serenity"),
				List.of(new Flagship("ladybirdbrowser/ladybird", "ladybird", List.of("lady"),
						List.of("Truly independent web browser"), List.of("ladybird")),
						new Flagship("mozilla-firefox/firefox", "firefox", List.of(),
								List.of("The official repository of Mozilla's Firefox web browser"), List.of())));
	}

}
