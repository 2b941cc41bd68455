package org.springaicommunity.github.chronicle;

/**
 * A GitHub response that could not be understood: invalid JSON, or a GraphQL payload with
 * errors and no data. Fails the task that received it without affecting sibling tasks.
 */
public class MalformedResponseException extends RuntimeException {

	public MalformedResponseException(String message) {
		super(message);
	}

	public MalformedResponseException(String message, Throwable cause) {
		super(message, cause);
	}

}
