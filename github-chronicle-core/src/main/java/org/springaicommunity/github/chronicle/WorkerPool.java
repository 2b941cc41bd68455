package org.springaicommunity.github.chronicle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded-concurrency executor for independent fetch tasks.
 *
 * <p>
 * At most {@code concurrency} tasks of one {@link #execute} call are in flight. Outcomes
 * are handed to the caller in completion order through a single completion queue, so
 * progress listeners run on the calling thread and never race each other. A task that
 * throws produces a failed {@link TaskOutcome}; its siblings keep running.
 *
 * <p>
 * When a task fails with {@link RateLimitExceededException} no further tasks are
 * submitted, in-flight tasks are allowed to finish, and the exception is rethrown once
 * they have drained.
 *
 * <p>
 * A pool is safe to use from several threads at once; each call gets its own completion
 * queue over the shared threads.
 */
public class WorkerPool implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

	private final String name;

	private final int concurrency;

	private final ExecutorService executor;

	public WorkerPool(String name, int concurrency) {
		if (concurrency <= 0) {
			throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
		}
		this.name = name;
		this.concurrency = concurrency;
		this.executor = Executors.newFixedThreadPool(concurrency, threadFactory(name));
	}

	public String getName() {
		return name;
	}

	public int getConcurrency() {
		return concurrency;
	}

	/**
	 * Run {@code work} for every input.
	 * @param inputs task inputs
	 * @param work the task body
	 * @param listener progress callback, invoked on the calling thread
	 * @param <K> input type
	 * @param <T> result type
	 * @return outcomes in completion order
	 * @throws RateLimitExceededException if any task exhausted the quota
	 */
	public <K, T> List<TaskOutcome<K, T>> execute(Collection<K> inputs, Function<? super K, ? extends T> work,
			CompletionListener<K, T> listener) {
		CompletionService<TaskOutcome<K, T>> completions = new ExecutorCompletionService<>(executor);
		Iterator<K> pending = inputs.iterator();
		int total = inputs.size();
		int inFlight = 0;
		while (inFlight < concurrency && pending.hasNext()) {
			submit(completions, pending.next(), work);
			inFlight++;
		}

		List<TaskOutcome<K, T>> outcomes = new ArrayList<>(total);
		RateLimitExceededException rateLimited = null;
		while (inFlight > 0) {
			TaskOutcome<K, T> outcome = take(completions);
			inFlight--;
			outcomes.add(outcome);

			if (rateLimited == null && outcome.failure() instanceof RateLimitExceededException) {
				rateLimited = (RateLimitExceededException) outcome.failure();
				logger.warn("[{}] Rate limit exceeded, draining {} in-flight task(s) and skipping {} pending", name,
						inFlight, total - outcomes.size() - inFlight);
			}
			listener.onComplete(outcome, outcomes.size(), total);

			if (rateLimited == null && pending.hasNext()) {
				submit(completions, pending.next(), work);
				inFlight++;
			}
		}

		if (rateLimited != null) {
			throw rateLimited;
		}
		return outcomes;
	}

	/**
	 * Run {@code work} for every input without progress reporting.
	 */
	public <K, T> List<TaskOutcome<K, T>> execute(Collection<K> inputs, Function<? super K, ? extends T> work) {
		return execute(inputs, work, CompletionListener.none());
	}

	private <K, T> void submit(CompletionService<TaskOutcome<K, T>> completions, K input,
			Function<? super K, ? extends T> work) {
		completions.submit(() -> {
			try {
				return TaskOutcome.<K, T>success(input, work.apply(input));
			}
			catch (RuntimeException e) {
				if (!(e instanceof RateLimitExceededException)) {
					logger.debug("[{}] Task for {} failed: {}", name, input, e.getMessage());
				}
				return TaskOutcome.<K, T>failed(input, e);
			}
		});
	}

	private static <K, T> TaskOutcome<K, T> take(CompletionService<TaskOutcome<K, T>> completions) {
		try {
			return completions.take().get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for tasks", e);
		}
		catch (ExecutionException e) {
			throw new IllegalStateException("Task failed unexpectedly", e.getCause());
		}
	}

	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	private static ThreadFactory threadFactory(String name) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "chronicle-" + name + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
