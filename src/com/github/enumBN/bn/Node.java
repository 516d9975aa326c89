package com.github.enumBN.bn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named random variable of a {@link BayesNet}: its domain, its parents in
 * declaration order and, once attached, its conditional probability table.
 */
public class Node {

	private final String name;

	private final VariableDomain domain;

	private final List<String> parents;

	private ConditionalTable table;

	Node(String name, VariableDomain domain, List<String> parents) {
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("Node name must be non-empty");
		if (domain == null)
			throw new IllegalArgumentException("Node " + name + " has no domain");

		Set<String> seen = new HashSet<String>();
		for (String parent : parents) {
			if (parent == null)
				throw new IllegalArgumentException("Node " + name + " has a null parent");
			if (parent.equals(name))
				throw new IllegalArgumentException("Node " + name + " cannot be its own parent");
			if (!seen.add(parent))
				throw new IllegalArgumentException("Node " + name + " lists parent " + parent + " twice");
		}

		this.name = name;
		this.domain = domain;
		this.parents = Collections.unmodifiableList(new ArrayList<String>(parents));
	}

	public String getName() {
		return name;
	}

	public VariableDomain getDomain() {
		return domain;
	}

	public List<String> getParents() {
		return parents;
	}

	public boolean isRoot() {
		return parents.isEmpty();
	}

	/**
	 * @return the attached table, or null if none was attached yet
	 */
	public ConditionalTable getTable() {
		return table;
	}

	void setTable(ConditionalTable table) {
		this.table = table;
	}

	@Override
	public String toString() {
		return "Node(" + name + ", values=" + domain + ", parents=" + parents + ")";
	}

}
