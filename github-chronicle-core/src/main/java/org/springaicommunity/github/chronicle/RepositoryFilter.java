package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Decides which repositories never reach an aggregate: private repositories, profile
 * repositories and copies of flagship projects. Runs before fork attribution.
 */
public class RepositoryFilter {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryFilter.class);

	private final MirrorRules rules;

	public RepositoryFilter(MirrorRules rules) {
		this.rules = rules;
	}

	/**
	 * Whether commits in a repository must be ignored.
	 * @param repository {@code owner/name}
	 * @param info repository metadata, when known
	 * @param login the subject, when known
	 * @return true to skip the repository
	 */
	public boolean shouldSkip(@Nullable String repository, @Nullable RepositoryInfo info, @Nullable String login) {
		if (repository == null || repository.isBlank()) {
			return true;
		}
		if (info != null && info.isPrivate()) {
			return true;
		}
		RepositoryName name = RepositoryName.parse(repository);
		if (login != null && name.isProfileRepositoryOf(login)) {
			return true;
		}
		for (MirrorRules.Flagship flagship : rules.flagships()) {
			if (flagship.isAllowed(name, login)) {
				return false;
			}
		}

		String reason = skipReason(name, info);
		if (reason != null) {
			logger.debug("Skipping {}: {}", repository, reason);
			return true;
		}
		return false;
	}

	public boolean shouldSkip(@Nullable String repository) {
		return shouldSkip(repository, null, null);
	}

	private @Nullable String skipReason(RepositoryName name, @Nullable RepositoryInfo info) {
		if (rules.blocklist().contains(name.fullName())) {
			return "blocklisted copy";
		}
		for (String marker : rules.skippedNameMarkers()) {
			if (name.fullName().contains(marker)) {
				return "name contains '" + marker + "'";
			}
		}
		String parent = info != null && info.parent() != null ? info.parent().toLowerCase(Locale.ROOT) : null;
		for (MirrorRules.Flagship flagship : rules.flagships()) {
			if (flagship.nameLooksCopied(name)) {
				return "name resembles " + flagship.canonical();
			}
			if (flagship.canonical().equals(parent)) {
				return "fork of " + flagship.canonical();
			}
			if (info != null && flagship.descriptionLooksCopied(info.description())) {
				return "description of " + flagship.canonical();
			}
		}
		return null;
	}

}
