package org.springaicommunity.github.chronicle;

/**
 * Receives {@link WorkerPool} outcomes in completion order, always on the thread that
 * called {@link WorkerPool#execute}.
 *
 * @param <K> task input type
 * @param <T> task result type
 */
@FunctionalInterface
public interface CompletionListener<K, T> {

	/**
	 * Called once per finished task.
	 * @param outcome the task outcome
	 * @param completed tasks finished so far, including this one
	 * @param total tasks in the batch
	 */
	void onComplete(TaskOutcome<K, T> outcome, int completed, int total);

	static <K, T> CompletionListener<K, T> none() {
		return (outcome, completed, total) -> {
		};
	}

}
