package com.github.enumBN.bn;

public class UndefinedRowException extends StructureException {

	private static final long serialVersionUID = 1L;

	private final String node;

	private final Configuration row;

	public UndefinedRowException(String node, Configuration row) {
		super("CPT of node " + node + " has no entry for parents " + row);
		this.node = node;
		this.row = row;
	}

	public String getNode() {
		return node;
	}

	public Configuration getRow() {
		return row;
	}

}
