package com.github.enumBN.bn;

import java.util.List;
import java.util.Map;

public interface Inference {

	/**
	 * Computes P(query | evidence) over the network's own topological order.
	 * 
	 * @param evidence
	 *            observed values, variable name to value label
	 * @return the posterior of the query variable, in domain order
	 */
	public abstract Distribution ask(BayesNet net, String query, Map<String, String> evidence);

	/**
	 * Computes P(query | evidence) enumerating variables in the given order,
	 * which must list every node after its parents.
	 */
	public abstract Distribution ask(BayesNet net, String query, Map<String, String> evidence, List<String> order);

}
