package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Subject
	public @Nullable String user;

	public @Nullable String organization;

	public @Nullable String team;

	// Window (ISO date format: YYYY-MM-DD)
	public @Nullable String since;

	public @Nullable String until;

	public @Nullable Integer days;

	// Mode flags
	public boolean light = false;

	public boolean yes = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public @Nullable Integer waitForResetMinutes;

	// Output
	public @Nullable String outputFile;

	/**
	 * Turn the parsed options into a request.
	 * @return the request
	 * @throws IllegalStateException if the options do not form a valid request
	 */
	public ChronicleRequest toRequest() {
		return ChronicleRequest.builder()
			.user(user)
			.organization(organization)
			.team(team)
			.since(since != null ? LocalDate.parse(since) : null)
			.until(until != null ? LocalDate.parse(until) : null)
			.days(days)
			.lightMode(light)
			.assumeYes(yes)
			.waitForReset(waitForResetMinutes != null ? Duration.ofMinutes(waitForResetMinutes) : null)
			.build();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "user='" + user + '\'' + ", organization='" + organization + '\'' + ", team='"
				+ team + '\'' + ", since='" + since + '\'' + ", until='" + until + '\'' + ", days=" + days
				+ ", light=" + light + ", yes=" + yes + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ ", waitForResetMinutes=" + waitForResetMinutes + ", outputFile='" + outputFile + '\'' + '}';
	}

}
