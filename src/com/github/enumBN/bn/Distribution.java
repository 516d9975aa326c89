package com.github.enumBN.bn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posterior distribution of a query variable: one probability per value, in
 * the order of the variable's domain.
 */
public class Distribution {

	private final String variable;

	private final VariableDomain domain;

	private final double[] probabilities;

	public Distribution(String variable, VariableDomain domain, double[] probabilities) {
		if (probabilities.length != domain.size())
			throw new IllegalArgumentException("Expected " + domain.size() + " probabilities for " + variable
					+ ", got " + probabilities.length);
		this.variable = variable;
		this.domain = domain;
		this.probabilities = probabilities.clone();
	}

	/**
	 * Scales an unnormalized weight vector so that it sums to 1.
	 *
	 * @throws DegenerateDistributionException
	 *             if the weights sum to zero, i.e. the evidence is
	 *             impossible
	 */
	public static Distribution normalize(String variable, VariableDomain domain, double[] weights,
			Map<String, String> evidence) {
		double sum = 0;
		for (double w : weights)
			sum += w;
		if (!(sum > 0) || Double.isInfinite(sum))
			throw new DegenerateDistributionException(variable, evidence);

		double[] normalized = new double[weights.length];
		for (int i = 0; i < weights.length; i++)
			normalized[i] = weights[i] / sum;
		return new Distribution(variable, domain, normalized);
	}

	public String getVariable() {
		return variable;
	}

	public VariableDomain getDomain() {
		return domain;
	}

	public int size() {
		return probabilities.length;
	}

	public String getLabel(int index) {
		return domain.get(index);
	}

	public double getProbability(int index) {
		return probabilities[index];
	}

	/**
	 * @throws InvalidValueException
	 *             if the label is not in the variable's domain
	 */
	public double getProbability(String label) {
		int index = domain.getIndex(label);
		if (index < 0)
			throw new InvalidValueException(variable, label, domain);
		return probabilities[index];
	}

	/**
	 * @return the value with the highest probability, the first one in domain
	 *         order on ties
	 */
	public String getMostProbable() {
		int maxIndex = 0;
		for (int i = 1; i < probabilities.length; i++)
			if (probabilities[i] > probabilities[maxIndex])
				maxIndex = i;
		return domain.get(maxIndex);
	}

	public double[] toArray() {
		return probabilities.clone();
	}

	/**
	 * @return value to probability, in domain order
	 */
	public Map<String, Double> toMap() {
		Map<String, Double> map = new LinkedHashMap<String, Double>((int) Math.ceil(probabilities.length / 0.75));
		for (int i = 0; i < probabilities.length; i++)
			map.put(domain.get(i), probabilities[i]);
		return Collections.unmodifiableMap(map);
	}

	public List<String> getLabels() {
		return new ArrayList<String>(domain.getValues());
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < probabilities.length; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(String.format("%s=%.6f", domain.get(i), probabilities[i]));
		}
		return sb.append("}").toString();
	}

}
