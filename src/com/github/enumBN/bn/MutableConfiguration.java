package com.github.enumBN.bn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assignment of values to variables built up during enumeration. Starts from
 * the evidence of a query and grows as hidden variables are fixed by the
 * enclosing summations.
 */
public class MutableConfiguration {

	private final Map<String, String> values;

	public MutableConfiguration(Map<String, String> evidence) {
		this.values = new LinkedHashMap<String, String>(evidence);
	}

	/**
	 * Extracts the parent values of a node from this assignment.
	 * 
	 * @param parentNodes
	 *            in declaration order, all of them must be bound
	 */
	public Configuration applyMask(List<String> parentNodes) {
		String[] newConfiguration = new String[parentNodes.size()];
		int i = 0;
		for (String parent : parentNodes) {
			String value = values.get(parent);
			if (value == null)
				throw new IllegalStateException("Parent " + parent + " is not bound in " + values);
			newConfiguration[i++] = value;
		}
		return new Configuration(newConfiguration);
	}

	public void update(String node, String value) {
		values.put(node, value);
	}

	public void remove(String node) {
		values.remove(node);
	}

	public boolean isBound(String node) {
		return values.containsKey(node);
	}

	public String get(String node) {
		return values.get(node);
	}

	public Map<String, String> toMap() {
		return Collections.unmodifiableMap(new LinkedHashMap<String, String>(values));
	}

	@Override
	public String toString() {
		return values.toString();
	}

}
