package org.springaicommunity.github.chronicle;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration values from {@code .env} files and the process environment. The
 * files are loaded once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/**
	 * Name of the variable holding the GitHub personal access token.
	 */
	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get a configuration value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found or blank
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (isBlank(value)) {
			value = HOME_DOTENV.get(name);
		}
		return isBlank(value) ? null : value;
	}

	/**
	 * Get the GitHub token.
	 * @return the token
	 * @throws IllegalStateException if no token is configured
	 */
	public static String requireGitHubToken() {
		String token = get(GITHUB_TOKEN);
		if (token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN is required. Export it or add it to a .env file: GITHUB_TOKEN=your_token_here");
		}
		return token.trim();
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.trim().isEmpty();
	}

}
