package com.github.enumBN.bn;

public class InvalidQueryException extends QueryException {

	private static final long serialVersionUID = 1L;

	public InvalidQueryException(String message) {
		super(message);
	}

}
