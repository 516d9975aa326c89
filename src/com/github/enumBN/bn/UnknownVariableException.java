package com.github.enumBN.bn;

public class UnknownVariableException extends QueryException {

	private static final long serialVersionUID = 1L;

	private final String variable;

	public UnknownVariableException(String variable) {
		super("Variable " + variable + " does not exist in the network.");
		this.variable = variable;
	}

	public String getVariable() {
		return variable;
	}

}
