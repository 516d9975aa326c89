package com.github.enumBN.bn;

public class UnknownParentException extends StructureException {

	private static final long serialVersionUID = 1L;

	public UnknownParentException(String node, String parent) {
		super("Node " + node + " declares parent " + parent + ", which is not in the network.");
	}

}
