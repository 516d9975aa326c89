package com.github.enumBN.bn;

import java.util.Collections;
import java.util.List;

public class CycleException extends StructureException {

	private static final long serialVersionUID = 1L;

	private final List<String> nodes;

	/**
	 * @param nodes
	 *            nodes that could not be ordered, i.e. those on a cycle or
	 *            downstream of one
	 */
	public CycleException(List<String> nodes) {
		super("The network has cycles, it is not a directed acyclic graph. Unordered nodes: " + nodes);
		this.nodes = Collections.unmodifiableList(nodes);
	}

	public List<String> getNodes() {
		return nodes;
	}

}
