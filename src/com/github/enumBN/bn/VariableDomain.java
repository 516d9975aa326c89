package com.github.enumBN.bn;

import java.util.Arrays;
import java.util.List;

import com.github.enumBN.utils.BidirectionalArray;

/**
 * The values a random variable can take. Values are kept in the order they
 * were given, which is the order of the probabilities in every CPT row of
 * the variable, and are indexed by sequential integers.
 */
public class VariableDomain {

	private final BidirectionalArray<String> values = new BidirectionalArray<String>();

	public VariableDomain(List<String> values) {
		if (values == null || values.isEmpty())
			throw new IllegalArgumentException("A domain needs at least one value");
		for (String value : values) {
			if (value == null || value.isEmpty())
				throw new IllegalArgumentException("Domain values must be non-empty: " + values);
			if (!this.values.add(value))
				throw new IllegalArgumentException("Duplicate value " + value + " in domain " + values);
		}
	}

	public static VariableDomain of(String... values) {
		return new VariableDomain(Arrays.asList(values));
	}

	public int size() {
		return values.size();
	}

	public String get(int index) {
		return values.get(index);
	}

	/**
	 * @return position of the value in this domain, or -1 if it does not
	 *         belong to it
	 */
	public int getIndex(String value) {
		return values.getIndex(value);
	}

	public boolean contains(String value) {
		return values.contains(value);
	}

	public List<String> getValues() {
		return values.toList();
	}

	@Override
	public int hashCode() {
		return values.toList().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (!(obj instanceof VariableDomain))
			return false;
		VariableDomain other = (VariableDomain) obj;
		return values.toList().equals(other.values.toList());
	}

	@Override
	public String toString() {
		return "" + values;
	}

}
