package org.springaicommunity.github.chronicle;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the activity report application. Plain Java with no
 * framework dependencies for testability.
 */
public class ArgumentParser {

	private static final String LOGIN_PATTERN = "^[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?$";

	private static final String DATE_PATTERN = "\\d{4}-\\d{2}-\\d{2}";

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-u", "--user":
					config.user = getRequiredValue(args, i, "user");
					i++; // Skip next argument since we consumed it
					break;

				case "--org":
					config.organization = getRequiredValue(args, i, "org");
					i++;
					break;

				case "--team":
					config.team = getRequiredValue(args, i, "team");
					i++;
					break;

				case "--since":
					config.since = getRequiredDate(args, i, "since");
					i++;
					break;

				case "--until":
					config.until = getRequiredDate(args, i, "until");
					i++;
					break;

				case "-d", "--days":
					config.days = getRequiredPositiveInt(args, i, "days");
					i++;
					break;

				case "--light":
					config.light = true;
					break;

				case "-y", "--yes":
					config.yes = true;
					break;

				case "--wait-for-reset":
					config.waitForResetMinutes = getRequiredPositiveInt(args, i, "wait-for-reset");
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-chronicle (--user LOGIN | --org ORG [--team TEAM]) [OPTIONS]\n");
		help.append("\n");
		help.append("Report the GitHub activity of a user, or of every member of an organization.\n");
		help.append("\n");
		help.append("SUBJECT:\n");
		help.append("    -u, --user LOGIN          Report on a single user\n");
		help.append("    --org ORG                 Report on the members of an organization\n");
		help.append("    --team TEAM               Narrow an organization report to one team\n");
		help.append("\n");
		help.append("WINDOW:\n");
		help.append("    --since DATE              First day of the window (YYYY-MM-DD)\n");
		help.append("    --until DATE              Last day of the window (YYYY-MM-DD, default: today)\n");
		help.append("    -d, --days N              Window of N days ending at --until (default: ")
			.append(ChronicleRequest.DEFAULT_DAYS)
			.append(")\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    --light                   Per-repository commit counts only, no line stats\n");
		help.append("    -y, --yes                 Do not ask before expensive organization runs\n");
		help.append("    --wait-for-reset MINUTES  Wait up to MINUTES for a quota reset instead of aborting\n");
		help.append("    -o, --output FILE         Write the JSON report to FILE instead of standard output\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN              GitHub personal access token (required, also read from .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-chronicle --user octocat --days 30\n");
		help.append("    github-chronicle --org w3c --since 2024-01-01 --until 2024-03-31 --light\n");
		help.append("    github-chronicle --org w3c --team editors --yes -o report.json\n");
		help.append("\n");
		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		String githubToken = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private String getRequiredDate(String[] args, int currentIndex, String optionName) {
		String value = getRequiredValue(args, currentIndex, optionName);
		if (!value.matches(DATE_PATTERN)) {
			throw new IllegalArgumentException("Invalid date '" + value + "': must be YYYY-MM-DD format");
		}
		try {
			LocalDate.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + value + "': " + e.getMessage(), e);
		}
		return value;
	}

	private int getRequiredPositiveInt(String[] args, int currentIndex, String optionName) {
		String value = getRequiredValue(args, currentIndex, optionName);
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException("Value for " + optionName + " must be positive: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(
					"Invalid " + optionName + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		// Exactly one subject
		if (config.user == null && config.organization == null) {
			errors.add("One of --user or --org is required");
		}
		else if (config.user != null && config.organization != null) {
			errors.add("--user and --org are mutually exclusive");
		}
		if (config.user != null && !config.user.matches(LOGIN_PATTERN)) {
			errors.add("Invalid user login: " + config.user);
		}
		if (config.organization != null && !config.organization.matches(LOGIN_PATTERN)) {
			errors.add("Invalid organization login: " + config.organization);
		}
		if (config.team != null && config.organization == null) {
			errors.add("--team requires --org");
		}

		// Window
		if (config.since != null && config.days != null) {
			errors.add("--since and --days are mutually exclusive");
		}
		if (config.since != null && config.until != null
				&& LocalDate.parse(config.since).isAfter(LocalDate.parse(config.until))) {
			errors.add("--since " + config.since + " is after --until " + config.until);
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
