package com.github.enumBN.bn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumeration that remembers the value of each sub-enumeration. The sum over
 * {@code order[position..]} depends only on the values of the earlier
 * variables that are parents of some later one, so it is computed once per
 * distinct combination of those values. Results are the same as plain
 * enumeration. Sub-enumerations served from the cache are not traced.
 */
public class MemoizedEnumerationInference extends EnumerationInference {

	private static final class Key {

		private final int position;

		private final Configuration values;

		private Key(int position, Configuration values) {
			this.position = position;
			this.values = values;
		}

		@Override
		public int hashCode() {
			return 31 * position + values.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (!(obj instanceof Key))
				return false;
			Key other = (Key) obj;
			return position == other.position && values.equals(other.values);
		}
	}

	private static class MemoEnumeration extends Enumeration {

		private final Map<Key, Double> cache = new HashMap<Key, Double>();

		/**
		 * frontier.get(i) lists the variables before position i that some
		 * variable at or after position i has as parent.
		 */
		private final List<List<String>> frontier;

		private MemoEnumeration(BayesNet net, List<String> order, MutableConfiguration assignment,
				TraceListener trace) {
			super(net, order, assignment, trace);

			int n = order.size();
			frontier = new ArrayList<List<String>>(n + 1);
			for (int i = 0; i <= n; i++)
				frontier.add(null);

			// walk backwards accumulating the parents needed downstream
			Set<String> needed = new HashSet<String>();
			for (int i = n; i >= 0; i--) {
				if (i < n) {
					needed.remove(order.get(i));
					needed.addAll(net.getNode(order.get(i)).getParents());
				}
				List<String> f = new ArrayList<String>();
				for (int j = 0; j < i; j++)
					if (needed.contains(order.get(j)))
						f.add(order.get(j));
				frontier.set(i, f);
			}
		}
	}

	@Override
	protected Enumeration newEnumeration(BayesNet net, List<String> order, MutableConfiguration assignment,
			TraceListener trace) {
		return new MemoEnumeration(net, order, assignment, trace);
	}

	@Override
	protected double enumerateAll(Enumeration run, int position) {
		MemoEnumeration memo = (MemoEnumeration) run;

		Key key = new Key(position, run.assignment.applyMask(memo.frontier.get(position)));
		Double cached = memo.cache.get(key);
		if (cached != null)
			return cached;

		double result = super.enumerateAll(run, position);
		memo.cache.put(key, result);
		return result;
	}

}
