package org.springaicommunity.github.chronicle;

/**
 * Asks whether an expensive organization run should go ahead.
 */
@FunctionalInterface
public interface RunConfirmation {

	/**
	 * @param warning description of the projected cost
	 * @return true to proceed
	 */
	boolean confirm(String warning);

	static RunConfirmation always() {
		return warning -> true;
	}

	static RunConfirmation never() {
		return warning -> false;
	}

}
