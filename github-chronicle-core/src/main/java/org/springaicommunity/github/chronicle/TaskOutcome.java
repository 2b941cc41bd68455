package org.springaicommunity.github.chronicle;

import org.jspecify.annotations.Nullable;

/**
 * Result of one {@link WorkerPool} task.
 *
 * @param <K> task input type
 * @param <T> task result type
 * @param input the input the task ran for
 * @param value the result, null if the task failed or produced nothing
 * @param failure the exception the task threw, null on success
 */
public record TaskOutcome<K, T>(K input, @Nullable T value, @Nullable Throwable failure) {

	public static <K, T> TaskOutcome<K, T> success(K input, @Nullable T value) {
		return new TaskOutcome<>(input, value, null);
	}

	public static <K, T> TaskOutcome<K, T> failed(K input, Throwable failure) {
		return new TaskOutcome<>(input, null, failure);
	}

	public boolean isSuccess() {
		return failure == null;
	}

}
