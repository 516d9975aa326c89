package com.github.enumBN.bn;

/**
 * Malformed inference request against an otherwise valid network.
 */
public class QueryException extends BayesNetException {

	private static final long serialVersionUID = 1L;

	public QueryException(String message) {
		super(message);
	}

}
