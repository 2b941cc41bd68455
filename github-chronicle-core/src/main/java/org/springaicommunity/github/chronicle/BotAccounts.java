package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Recognizes automation accounts by login.
 */
public final class BotAccounts {

	private BotAccounts() {
	}

	/**
	 * A login is a bot if it ends with {@code bot} or {@code [bot]}, ignoring case.
	 * @param login account login
	 * @return true for bot accounts
	 */
	public static boolean isBot(@Nullable String login) {
		if (login == null) {
			return false;
		}
		String lower = login.toLowerCase(Locale.ROOT);
		return lower.endsWith("bot") || lower.endsWith("[bot]");
	}

}
