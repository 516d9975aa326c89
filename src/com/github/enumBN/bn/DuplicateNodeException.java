package com.github.enumBN.bn;

public class DuplicateNodeException extends StructureException {

	private static final long serialVersionUID = 1L;

	public DuplicateNodeException(String node) {
		super("Node " + node + " is already defined.");
	}

}
