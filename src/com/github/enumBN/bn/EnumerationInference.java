package com.github.enumBN.bn;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact inference by enumeration (enumeration-ask). For every value of the
 * query variable, the joint probability of that value and the evidence is
 * obtained by summing the product of CPT entries over all hidden variables,
 * taken in topological order; the resulting vector is then normalized.
 * <p>
 * The cost is exponential in the number of hidden variables. The network is
 * only read, so one instance can serve concurrent queries as long as its
 * trace settings are not changed meanwhile.
 */
public class EnumerationInference implements Inference {

	private static final Logger logger = LoggerFactory.getLogger(EnumerationInference.class);

	private TraceListener traceListener;

	private boolean traceEnabled = false;

	/**
	 * State of one enumeration, i.e. of the computation for a single value of
	 * the query variable.
	 */
	protected static class Enumeration {

		protected final BayesNet net;

		protected final List<String> order;

		protected final MutableConfiguration assignment;

		protected final TraceListener trace;

		protected Enumeration(BayesNet net, List<String> order, MutableConfiguration assignment,
				TraceListener trace) {
			this.net = net;
			this.order = order;
			this.assignment = assignment;
			this.trace = trace;
		}
	}

	public EnumerationInference setTraceListener(TraceListener traceListener) {
		this.traceListener = traceListener;
		return this;
	}

	public EnumerationInference setTraceEnabled(boolean traceEnabled) {
		this.traceEnabled = traceEnabled;
		return this;
	}

	public boolean isTraceEnabled() {
		return traceEnabled;
	}

	@Override
	public Distribution ask(BayesNet net, String query, Map<String, String> evidence) {
		checkRequest(net, query, evidence);
		return enumerationAsk(net, query, evidence, net.topologicalOrder());
	}

	@Override
	public Distribution ask(BayesNet net, String query, Map<String, String> evidence, List<String> order) {
		checkRequest(net, query, evidence);
		if (!net.isTopologicalOrder(order))
			throw new IllegalArgumentException(order + " is not a topological order of the network");
		return enumerationAsk(net, query, evidence, order);
	}

	/**
	 * @throws IllegalStateException
	 *             if the network was not validated
	 * @throws UnknownVariableException
	 * @throws InvalidValueException
	 * @throws InvalidQueryException
	 */
	protected void checkRequest(BayesNet net, String query, Map<String, String> evidence) {
		if (!net.isValidated())
			throw new IllegalStateException("Network must be validated before running inference");
		if (query == null)
			throw new IllegalArgumentException("Query variable must not be null");
		net.getNode(query);

		for (String variable : evidence.keySet())
			net.getNode(variable);
		for (Map.Entry<String, String> e : evidence.entrySet()) {
			Node node = net.getNode(e.getKey());
			if (!node.getDomain().contains(e.getValue()))
				throw new InvalidValueException(e.getKey(), e.getValue(), node.getDomain());
		}

		if (evidence.containsKey(query))
			throw new InvalidQueryException("Query variable " + query
					+ " is part of the evidence, its value is already known");
	}

	private Distribution enumerationAsk(BayesNet net, String query, Map<String, String> evidence,
			List<String> order) {

		logger.debug("Enumerating {} given {} over {}", query, evidence, order);

		TraceListener trace = traceEnabled ? traceListener : null;
		VariableDomain domain = net.getNode(query).getDomain();
		double[] weights = new double[domain.size()];

		if (trace != null)
			trace.queryStarted(query, evidence);

		for (int i = 0; i < domain.size(); i++) {
			String value = domain.get(i);
			MutableConfiguration extended = new MutableConfiguration(evidence);
			extended.update(query, value);

			if (trace != null)
				trace.queryValueStarted(query, value);

			weights[i] = enumerateAll(newEnumeration(net, order, extended, trace), 0);

			if (trace != null)
				trace.queryValueFinished(query, value, weights[i]);
		}

		Distribution distribution = Distribution.normalize(query, domain, weights, evidence);

		if (trace != null)
			trace.queryFinished(distribution);

		return distribution;
	}

	protected Enumeration newEnumeration(BayesNet net, List<String> order, MutableConfiguration assignment,
			TraceListener trace) {
		return new Enumeration(net, order, assignment, trace);
	}

	/**
	 * Sum over all values of the unbound variables in
	 * {@code order[position..]} of the product of their conditional
	 * probabilities, the bound ones contributing a single factor. Parents
	 * always precede their children in the order, so they are bound by the
	 * time a variable is reached.
	 */
	protected double enumerateAll(Enumeration run, int position) {

		if (position == run.order.size())
			return 1.0;

		String variable = run.order.get(position);
		Node node = run.net.getNode(variable);
		VariableDomain domain = node.getDomain();
		Configuration parentValues = run.assignment.applyMask(node.getParents());
		List<Double> probabilities = run.net.lookupCPT(variable, parentValues);

		if (run.assignment.isBound(variable)) {
			String value = run.assignment.get(variable);
			double p = probabilities.get(domain.getIndex(value));
			if (run.trace != null)
				run.trace.variableBound(position, variable, value, p);
			return p * enumerateAll(run, position + 1);
		}

		if (run.trace != null)
			run.trace.summationStarted(position, variable, domain.getValues());

		double total = 0;
		for (int k = 0; k < domain.size(); k++) {
			String value = domain.get(k);
			double p = probabilities.get(k);

			run.assignment.update(variable, value);
			double subtotal = p * enumerateAll(run, position + 1);
			run.assignment.remove(variable);

			total += subtotal;
			if (run.trace != null)
				run.trace.summationBranch(position, variable, value, p, subtotal);
		}

		if (run.trace != null)
			run.trace.summationFinished(position, variable, total);

		return total;
	}

}
