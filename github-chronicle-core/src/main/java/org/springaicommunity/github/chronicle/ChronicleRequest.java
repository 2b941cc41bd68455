package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Parameters of one report run: a single user or an organization (optionally narrowed to
 * a team), over an inclusive date window.
 *
 * @param user subject login for a single-user report
 * @param organization organization login for an aggregate report
 * @param team team slug within the organization
 * @param from first day of the window
 * @param to last day of the window
 * @param lightMode gather the reduced light-mode profile per member
 * @param assumeYes proceed with expensive runs without asking
 * @param waitForReset longest wait for a quota reset when the budget is too low, null
 * to abort instead
 */
public record ChronicleRequest(@Nullable String user, @Nullable String organization, @Nullable String team,
		LocalDate from, LocalDate to, boolean lightMode, boolean assumeYes, @Nullable Duration waitForReset) {

	/**
	 * Default window length in days when neither a start date nor a day count is given.
	 */
	public static final int DEFAULT_DAYS = 7;

	public static Builder builder() {
		return new Builder();
	}

	public boolean isOrganizationReport() {
		return organization != null;
	}

	/**
	 * Window length in days, at least 1.
	 */
	public int days() {
		return (int) Math.max(1, ChronoUnit.DAYS.between(from, to));
	}

	/**
	 * Builder for {@link ChronicleRequest}.
	 */
	public static class Builder {

		private @Nullable String user;

		private @Nullable String organization;

		private @Nullable String team;

		private @Nullable LocalDate since;

		private @Nullable LocalDate until;

		private @Nullable Integer days;

		private boolean lightMode;

		private boolean assumeYes;

		private @Nullable Duration waitForReset;

		private Builder() {
		}

		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		public Builder organization(@Nullable String organization) {
			this.organization = organization;
			return this;
		}

		public Builder team(@Nullable String team) {
			this.team = team;
			return this;
		}

		public Builder since(@Nullable LocalDate since) {
			this.since = since;
			return this;
		}

		public Builder until(@Nullable LocalDate until) {
			this.until = until;
			return this;
		}

		public Builder days(@Nullable Integer days) {
			this.days = days;
			return this;
		}

		public Builder lightMode(boolean lightMode) {
			this.lightMode = lightMode;
			return this;
		}

		public Builder assumeYes(boolean assumeYes) {
			this.assumeYes = assumeYes;
			return this;
		}

		public Builder waitForReset(@Nullable Duration waitForReset) {
			this.waitForReset = waitForReset;
			return this;
		}

		/**
		 * Build the request. The window ends today when no end date is given and spans
		 * {@value #DEFAULT_DAYS} days when neither a start date nor a day count is given.
		 * @return the request
		 * @throws IllegalStateException if the subject or window is invalid
		 */
		public ChronicleRequest build() {
			boolean hasUser = user != null && !user.isBlank();
			boolean hasOrganization = organization != null && !organization.isBlank();
			if (hasUser == hasOrganization) {
				throw new IllegalStateException("Exactly one of user or organization is required");
			}
			if (team != null && !hasOrganization) {
				throw new IllegalStateException("A team requires an organization");
			}
			if (days != null && days <= 0) {
				throw new IllegalStateException("Days must be positive: " + days);
			}
			if (days != null && since != null) {
				throw new IllegalStateException("Specify either a start date or a number of days, not both");
			}
			LocalDate to = until != null ? until : LocalDate.now();
			LocalDate from = since != null ? since : to.minusDays(days != null ? days : DEFAULT_DAYS);
			if (from.isAfter(to)) {
				throw new IllegalStateException("Start date " + from + " is after end date " + to);
			}
			return new ChronicleRequest(hasUser ? user : null, hasOrganization ? organization : null, team, from, to,
					lightMode, assumeYes, waitForReset);
		}

	}

}
