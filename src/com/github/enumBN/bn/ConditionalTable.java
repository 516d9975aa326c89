package com.github.enumBN.bn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conditional probability table of one node. Each row maps a configuration
 * of the parents to a probability vector aligned with the node's domain.
 * Tables are immutable; use {@link Builder} to create them.
 */
public class ConditionalTable {

	private final Map<Configuration, List<Double>> parameters;

	private ConditionalTable(Map<Configuration, List<Double>> parameters) {
		this.parameters = Collections.unmodifiableMap(parameters);
	}

	public static class Builder {

		private final Map<Configuration, List<Double>> parameters = new LinkedHashMap<Configuration, List<Double>>();

		/**
		 * @throws RowCountMismatchException
		 *             if a row for the same parent values was already added
		 */
		public Builder addRow(Configuration parentValues, List<Double> probabilities) {
			if (parameters.containsKey(parentValues))
				throw new RowCountMismatchException("Duplicate CPT row for parents " + parentValues);
			for (Double p : probabilities)
				if (p == null)
					throw new IllegalArgumentException("Null probability in row " + parentValues);
			parameters.put(parentValues, Collections.unmodifiableList(new ArrayList<Double>(probabilities)));
			return this;
		}

		public Builder addRow(List<String> parentValues, double... probabilities) {
			List<Double> row = new ArrayList<Double>(probabilities.length);
			for (double p : probabilities)
				row.add(p);
			return addRow(new Configuration(parentValues), row);
		}

		/**
		 * Row of a node without parents.
		 */
		public Builder addPrior(double... probabilities) {
			return addRow(Collections.<String> emptyList(), probabilities);
		}

		public ConditionalTable build() {
			return new ConditionalTable(new LinkedHashMap<Configuration, List<Double>>(parameters));
		}
	}

	/**
	 * @return the probability vector for the given parent values, or null if
	 *         the table has no such row
	 */
	public List<Double> get(Configuration parentValues) {
		return parameters.get(parentValues);
	}

	public boolean contains(Configuration parentValues) {
		return parameters.containsKey(parentValues);
	}

	public int numRows() {
		return parameters.size();
	}

	public Map<Configuration, List<Double>> getRows() {
		return parameters;
	}

	/**
	 * Checks that the rows are exactly the cartesian product of the parents'
	 * domains and that each row is a probability vector over the node's
	 * domain.
	 *
	 * @param parentDomains
	 *            in parent declaration order
	 * @throws RowCountMismatchException
	 * @throws ProbabilityNormalizationException
	 */
	public void validate(String node, VariableDomain domain, List<VariableDomain> parentDomains, double tolerance) {

		List<Configuration> expected = allConfigurations(parentDomains);

		for (Configuration row : expected)
			if (!parameters.containsKey(row))
				throw new RowCountMismatchException("CPT of node " + node + " has no entry for parents " + row
						+ " (" + parameters.size() + " rows given, " + expected.size() + " expected)");

		// all expected rows are present, anything else is outside the product
		if (parameters.size() != expected.size()) {
			for (Configuration row : parameters.keySet())
				if (!isWithin(row, parentDomains))
					throw new RowCountMismatchException("CPT of node " + node + " has an entry for parents "
							+ row + " which is not a combination of the parents' values");
		}

		for (Map.Entry<Configuration, List<Double>> entry : parameters.entrySet()) {
			List<Double> probabilities = entry.getValue();
			if (probabilities.size() != domain.size())
				throw new RowCountMismatchException("CPT of node " + node + " for parents " + entry.getKey()
						+ " has " + probabilities.size() + " probabilities, expected " + domain.size());

			double sum = 0;
			for (double p : probabilities) {
				if (p < -tolerance || p > 1 + tolerance || Double.isNaN(p))
					throw new ProbabilityNormalizationException(node, entry.getKey(), p);
				sum += p;
			}
			if (Math.abs(sum - 1.0) > tolerance)
				throw new ProbabilityNormalizationException(node, entry.getKey(), probabilities, sum);
		}
	}

	private static boolean isWithin(Configuration row, List<VariableDomain> parentDomains) {
		if (row.size() != parentDomains.size())
			return false;
		for (int i = 0; i < row.size(); i++)
			if (!parentDomains.get(i).contains(row.get(i)))
				return false;
		return true;
	}

	/**
	 * Enumerates every combination of parent values, the last parent varying
	 * fastest. A node without parents has exactly one, empty, configuration.
	 */
	public static List<Configuration> allConfigurations(List<VariableDomain> parentDomains) {
		int numParents = parentDomains.size();
		int total = 1;
		for (VariableDomain d : parentDomains)
			total *= d.size();

		List<Configuration> configurations = new ArrayList<Configuration>(total);
		int[] index = new int[numParents];

		for (int k = 0; k < total; k++) {
			String[] values = new String[numParents];
			for (int i = 0; i < numParents; i++)
				values[i] = parentDomains.get(i).get(index[i]);
			configurations.add(new Configuration(values));

			// odometer increment
			for (int i = numParents; i-- > 0;) {
				if (++index[i] < parentDomains.get(i).size())
					break;
				index[i] = 0;
			}
		}

		return configurations;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		String ls = System.getProperty("line.separator");
		for (Map.Entry<Configuration, List<Double>> entry : parameters.entrySet())
			sb.append(entry.getKey() + " " + Arrays.toString(entry.getValue().toArray()) + ls);
		return sb.toString();
	}

}
