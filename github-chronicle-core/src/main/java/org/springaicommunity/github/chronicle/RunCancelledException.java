package org.springaicommunity.github.chronicle;

/**
 * Thrown when an expensive run was declined.
 */
public class RunCancelledException extends RuntimeException {

	public RunCancelledException(String message) {
		super(message);
	}

}
