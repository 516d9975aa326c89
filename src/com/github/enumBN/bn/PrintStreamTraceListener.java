package com.github.enumBN.bn;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Writes an indented, human-readable trace of the enumeration.
 */
public class PrintStreamTraceListener implements TraceListener {

	private final PrintStream out;

	public PrintStreamTraceListener(PrintStream out) {
		this.out = out;
	}

	private static String indent(int depth) {
		StringBuilder sb = new StringBuilder();
		for (int i = depth; i-- > 0;)
			sb.append("  ");
		return sb.toString();
	}

	static String formatEvidence(Map<String, String> evidence) {
		if (evidence.isEmpty())
			return "no evidence";
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, String> e : evidence.entrySet()) {
			if (sb.length() > 0)
				sb.append(", ");
			sb.append(e.getKey() + "=" + e.getValue());
		}
		return sb.toString();
	}

	@Override
	public void queryStarted(String query, Map<String, String> evidence) {
		out.println("Inference for " + query + " given " + formatEvidence(evidence));
	}

	@Override
	public void queryValueStarted(String query, String value) {
		out.println();
		out.println("--- " + query + "=" + value + " ---");
	}

	@Override
	public void variableBound(int depth, String variable, String value, double probability) {
		out.println(String.format("%s%s = %s, P(%s=%s | parents) = %.6f", indent(depth), variable, value, variable,
				value, probability));
	}

	@Override
	public void summationStarted(int depth, String variable, List<String> values) {
		out.println(indent(depth) + variable + " hidden, summing over " + values);
	}

	@Override
	public void summationBranch(int depth, String variable, String value, double probability, double subtotal) {
		out.println(String.format("%s  %s=%s: P = %.6f, subtotal = %.6f", indent(depth), variable, value,
				probability, subtotal));
	}

	@Override
	public void summationFinished(int depth, String variable, double total) {
		out.println(String.format("%sTotal for %s: %.6f", indent(depth), variable, total));
	}

	@Override
	public void queryValueFinished(String query, String value, double weight) {
		out.println(String.format("Unnormalized P(%s=%s, evidence) = %.6f", query, value, weight));
	}

	@Override
	public void queryFinished(Distribution distribution) {
		out.println();
		out.println("Normalized: " + distribution);
	}

}
