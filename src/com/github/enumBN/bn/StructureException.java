package com.github.enumBN.bn;

/**
 * The network definition is invalid; no inference may run on it.
 */
public class StructureException extends BayesNetException {

	private static final long serialVersionUID = 1L;

	public StructureException(String message) {
		super(message);
	}

}
