package org.springaicommunity.github.chronicle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Activity totals for one programming language.
 *
 * @param language language name
 * @param commits commits in repositories with this primary language
 * @param additions lines added
 * @param deletions lines deleted
 * @param repositories number of repositories
 */
public record LanguageStat(String language, int commits, long additions, long deletions, int repositories) {

	/**
	 * Build a language breakdown from repository activity, sorted by commits descending.
	 * Repositories without a language are skipped.
	 * @param repositories repository activity
	 * @return breakdown, largest first
	 */
	public static List<LanguageStat> breakdown(Collection<RepoActivity> repositories) {
		Map<String, LanguageStat> byLanguage = new LinkedHashMap<>();
		for (RepoActivity repo : repositories) {
			String language = repo.getLanguage();
			if (language == null || repo.getCommits() == 0) {
				continue;
			}
			LanguageStat repoStat = new LanguageStat(language, repo.getCommits(), repo.getAdditions(),
					repo.getDeletions(), 1);
			byLanguage.merge(language, repoStat, LanguageStat::plus);
		}
		List<LanguageStat> stats = new ArrayList<>(byLanguage.values());
		stats.sort(Comparator.comparingInt(LanguageStat::commits).reversed().thenComparing(LanguageStat::language));
		return stats;
	}

	private LanguageStat plus(LanguageStat other) {
		return new LanguageStat(language, commits + other.commits, additions + other.additions,
				deletions + other.deletions, repositories + other.repositories);
	}

}
