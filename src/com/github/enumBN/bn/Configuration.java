package com.github.enumBN.bn;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Values of the parents of a node, in the order the parents were declared.
 * Used as the key of a CPT row; a node without parents has a single row
 * keyed by {@link #EMPTY}.
 */
public class Configuration {

	public static final Configuration EMPTY = new Configuration(new String[0]);

	protected final String[] configuration;

	public Configuration(List<String> values) {
		this(values.toArray(new String[0]));
	}

	protected Configuration(String[] configuration) {
		for (String value : configuration)
			if (value == null)
				throw new IllegalArgumentException("Configuration values must not be null");
		this.configuration = configuration;
	}

	public static Configuration of(String... values) {
		return new Configuration(values.clone());
	}

	public int size() {
		return configuration.length;
	}

	public String get(int index) {
		return configuration[index];
	}

	public List<String> toList() {
		return Collections.unmodifiableList(Arrays.asList(configuration));
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < configuration.length; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(configuration[i]);
		}
		return sb.append(")").toString();
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(configuration);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (!(obj instanceof Configuration))
			return false;
		Configuration other = (Configuration) obj;
		if (!Arrays.equals(configuration, other.configuration))
			return false;
		return true;
	}

}
