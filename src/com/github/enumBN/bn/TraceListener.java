package com.github.enumBN.bn;

import java.util.List;
import java.util.Map;

/**
 * Receives the steps of an enumeration as it runs. Listeners only observe:
 * nothing they do affects the order of the recursion or its result. The
 * {@code depth} argument is the recursion level, 0 for the first variable
 * of the order.
 */
public interface TraceListener {

	public void queryStarted(String query, Map<String, String> evidence);

	public void queryValueStarted(String query, String value);

	/**
	 * A variable with a fixed value (evidence, query value or an enclosing
	 * summation) contributes its conditional probability as a factor.
	 */
	public void variableBound(int depth, String variable, String value, double probability);

	public void summationStarted(int depth, String variable, List<String> values);

	/**
	 * One term of a summation over a hidden variable.
	 * 
	 * @param subtotal
	 *            probability times the enumeration of the remaining variables
	 */
	public void summationBranch(int depth, String variable, String value, double probability, double subtotal);

	public void summationFinished(int depth, String variable, double total);

	public void queryValueFinished(String query, String value, double weight);

	public void queryFinished(Distribution distribution);

}
