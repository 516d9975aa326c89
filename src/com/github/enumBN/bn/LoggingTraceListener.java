package com.github.enumBN.bn;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the enumeration trace to the log at DEBUG level.
 */
public class LoggingTraceListener implements TraceListener {

	private static final Logger logger = LoggerFactory.getLogger(LoggingTraceListener.class);

	@Override
	public void queryStarted(String query, Map<String, String> evidence) {
		logger.debug("Inference for {} given {}", query, evidence);
	}

	@Override
	public void queryValueStarted(String query, String value) {
		logger.debug("Enumerating {}={}", query, value);
	}

	@Override
	public void variableBound(int depth, String variable, String value, double probability) {
		logger.debug("[{}] {}={} bound, P={}", depth, variable, value, probability);
	}

	@Override
	public void summationStarted(int depth, String variable, List<String> values) {
		logger.debug("[{}] {} hidden, summing over {}", depth, variable, values);
	}

	@Override
	public void summationBranch(int depth, String variable, String value, double probability, double subtotal) {
		logger.debug("[{}] {}={} P={} subtotal={}", depth, variable, value, probability, subtotal);
	}

	@Override
	public void summationFinished(int depth, String variable, double total) {
		logger.debug("[{}] total for {}: {}", depth, variable, total);
	}

	@Override
	public void queryValueFinished(String query, String value, double weight) {
		logger.debug("Unnormalized weight of {}={}: {}", query, value, weight);
	}

	@Override
	public void queryFinished(Distribution distribution) {
		logger.debug("Posterior of {}: {}", distribution.getVariable(), distribution);
	}

}
