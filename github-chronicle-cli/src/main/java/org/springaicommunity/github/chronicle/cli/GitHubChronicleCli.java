package org.springaicommunity.github.chronicle.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.chronicle.ArgumentParser;
import org.springaicommunity.github.chronicle.ChronicleRequest;
import org.springaicommunity.github.chronicle.GitHubChronicleBuilder;
import org.springaicommunity.github.chronicle.LanguageStat;
import org.springaicommunity.github.chronicle.MemberActivity;
import org.springaicommunity.github.chronicle.ObjectMapperFactory;
import org.springaicommunity.github.chronicle.OrgAggregateResult;
import org.springaicommunity.github.chronicle.OrgCollectionService;
import org.springaicommunity.github.chronicle.OrganizationProfile;
import org.springaicommunity.github.chronicle.ParsedConfiguration;
import org.springaicommunity.github.chronicle.RateLimitExceededException;
import org.springaicommunity.github.chronicle.RunCancelledException;
import org.springaicommunity.github.chronicle.RunConfirmation;
import org.springaicommunity.github.chronicle.UserCollectionService;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * GitHub Chronicle CLI Application
 *
 * Plain Java command-line application that reports the GitHub activity of a user or of
 * the members of an organization as JSON. Uses GitHubChronicleBuilder for service wiring.
 *
 * Usage: java -jar github-chronicle-cli.jar (--user LOGIN | --org ORG) [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication
 *
 * Examples: java -jar github-chronicle-cli.jar --user octocat --days 30 java -jar
 * github-chronicle-cli.jar --org w3c --light --yes -o w3c.json
 */
public class GitHubChronicleCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubChronicleCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Report failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		ArgumentParser argumentParser = new ArgumentParser();
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment();
		GitHubChronicleBuilder builder = GitHubChronicleBuilder.create()
			.tokenFromEnv()
			.confirmation(GitHubChronicleCli::askOnConsole);
		return run(config, builder, System.out);
	}

	/**
	 * Run a parsed configuration against a prepared builder.
	 * @param config parsed options
	 * @param builder service builder, with credentials or a custom client
	 * @param out destination of the report when no output file is given
	 * @return process exit code
	 * @throws IOException if the report cannot be written
	 */
	static int run(ParsedConfiguration config, GitHubChronicleBuilder builder, PrintStream out) throws IOException {
		if (config.verbose) {
			enableDebugLogging();
		}
		logConfiguration(config);
		ChronicleRequest request = config.toRequest();

		Object report;
		try {
			if (request.isOrganizationReport()) {
				try (OrgCollectionService service = builder.buildOrgCollector()) {
					OrgAggregateResult result = service.collect(request);
					logResults(result);
					report = result;
				}
			}
			else {
				try (UserCollectionService service = builder.buildUserCollector()) {
					MemberActivity activity = service.collect(request);
					logResults(activity);
					report = activity;
				}
			}
		}
		catch (RateLimitExceededException e) {
			logger.error(e.getMessage());
			logger.error("Re-run after the reset, or pass --wait-for-reset MINUTES");
			return 1;
		}
		catch (RunCancelledException e) {
			logger.warn(e.getMessage());
			return 1;
		}

		writeReport(report, config.outputFile, out);
		return 0;
	}

	private static void writeReport(Object report, String outputFile, PrintStream out) throws IOException {
		ObjectMapper mapper = ObjectMapperFactory.create();
		if (outputFile != null) {
			Path path = Paths.get(outputFile);
			Path parent = path.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
			logger.info("Report written to {}", path.toAbsolutePath());
		}
		else {
			out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
		}
	}

	private static boolean askOnConsole(String warning) {
		System.err.println(warning);
		System.err.print("Proceed? [y/N] ");
		System.err.flush();
		try {
			BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
			String answer = reader.readLine();
			return answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
		}
		catch (IOException e) {
			logger.warn("Could not read confirmation: {}", e.getMessage());
			return false;
		}
	}

	private static void enableDebugLogging() {
		Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Subject: {}", config.user != null ? "user " + config.user
				: "organization " + config.organization + (config.team != null ? " team " + config.team : ""));
		logger.info("  Since: {}", config.since != null ? config.since : "(derived)");
		logger.info("  Until: {}", config.until != null ? config.until : "(today)");
		logger.info("  Days: {}", config.days != null ? config.days : "(default)");
		logger.info("  Light mode: {}", config.light);
		logger.info("  Assume yes: {}", config.yes);
		logger.info("  Wait for reset: {}",
				config.waitForResetMinutes != null ? config.waitForResetMinutes + " minutes" : "(no)");
		logger.info("  Output file: {}", config.outputFile != null ? config.outputFile : "(stdout)");
	}

	private static void logResults(MemberActivity activity) {
		logger.info("Report completed for {}", activity.login());
		logger.info("  Commits (default branches): {}", activity.totals().defaultBranchCommits());
		logger.info("  Commits (all branches): {}", activity.totals().allBranchCommits());
		logger.info("  Pull requests created: {}", activity.createdPullRequests().size());
		logger.info("  Pull requests reviewed: {}", activity.reviewedPullRequests().size());
		logger.info("  Repositories: {}", activity.repositories().size());
		logLanguages(activity.languageBreakdown());
	}

	private static void logResults(OrgAggregateResult result) {
		logger.info("Report completed for {}", result.organization());
		OrganizationProfile profile = result.profile();
		if (profile != null) {
			logger.info("  Organization: {}", profile.displayName());
		}
		logger.info("  Members: {} ({} active)", result.memberCount(), result.activeMemberCount());
		logger.info("  Commits (all branches): {}", result.totals().allBranchCommits());
		logger.info("  Pull requests created: {}", result.createdPullRequests().size());
		logger.info("  Pull requests reviewed: {}", result.reviewedPullRequests().size());
		logger.info("  Repositories: {}", result.repositories().size());
		logger.info("  Companies: {}", result.companyGroups().size());
		logLanguages(result.languageBreakdown());
	}

	private static void logLanguages(List<LanguageStat> languages) {
		for (LanguageStat stat : languages) {
			logger.info("  {}: {} commits in {} repositories", stat.language(), stat.commits(), stat.repositories());
		}
	}

}
