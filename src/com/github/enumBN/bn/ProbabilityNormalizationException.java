package com.github.enumBN.bn;

import java.util.List;

public class ProbabilityNormalizationException extends StructureException {

	private static final long serialVersionUID = 1L;

	public ProbabilityNormalizationException(String node, Configuration row, List<Double> probabilities,
			double sum) {
		super(String.format("CPT of node %s for parents %s does not sum to 1 (sum=%.6f): %s", node, row, sum,
				probabilities));
	}

	public ProbabilityNormalizationException(String node, Configuration row, double probability) {
		super("CPT of node " + node + " for parents " + row + " has a value outside [0,1]: " + probability);
	}

}
