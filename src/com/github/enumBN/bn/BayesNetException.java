package com.github.enumBN.bn;

/**
 * Root of the errors raised while building a network or running a query on
 * it. All of them are unchecked: they describe an invalid model or request,
 * and retrying the same call reproduces them.
 */
public class BayesNetException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public BayesNetException(String message) {
		super(message);
	}

}
