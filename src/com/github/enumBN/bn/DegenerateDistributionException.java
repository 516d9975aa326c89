package com.github.enumBN.bn;

import java.util.Map;

/**
 * The evidence has zero probability under the network, so the posterior is
 * undefined. This is a legitimate outcome of a query, not a bug.
 */
public class DegenerateDistributionException extends BayesNetException {

	private static final long serialVersionUID = 1L;

	public DegenerateDistributionException(String query, Map<String, String> evidence) {
		super("Total probability is 0 for query " + query + " given " + evidence
				+ ". The evidence is inconsistent with the network.");
	}

}
