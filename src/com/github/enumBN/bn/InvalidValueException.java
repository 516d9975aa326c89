package com.github.enumBN.bn;

public class InvalidValueException extends QueryException {

	private static final long serialVersionUID = 1L;

	public InvalidValueException(String variable, String value, VariableDomain domain) {
		super("Value " + value + " is not in the domain of " + variable + " " + domain);
	}

}
