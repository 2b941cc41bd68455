package org.springaicommunity.github.chronicle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The three standing pools of a run. They are never shared across tiers because the cost
 * of a call to GitHub differs by orders of magnitude between them.
 *
 * @param stats per-commit stat and language fetches
 * @param member per-member gathering and batched summary fallbacks
 * @param scrape contribution calendar probes
 */
public record WorkerPools(WorkerPool stats, WorkerPool member, WorkerPool scrape) implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(WorkerPools.class);

	public static WorkerPools create(ChronicleProperties properties) {
		WorkerPools pools = new WorkerPools(new WorkerPool("stats", properties.getStatsConcurrency()),
				new WorkerPool("member", properties.getMemberConcurrency()),
				new WorkerPool("scrape", properties.getScrapeConcurrency()));
		for (WorkerPool pool : List.of(pools.stats(), pools.member(), pools.scrape())) {
			logger.debug("Worker pool {}: {} threads", pool.getName(), pool.getConcurrency());
		}
		return pools;
	}

	@Override
	public void close() {
		stats.close();
		member.close();
		scrape.close();
	}

}
