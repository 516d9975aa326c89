package com.github.enumBN.bn;

/**
 * The rows of a conditional table do not match the cartesian product of the
 * parents' domains, or a row has the wrong number of probabilities.
 */
public class RowCountMismatchException extends StructureException {

	private static final long serialVersionUID = 1L;

	public RowCountMismatchException(String message) {
		super(message);
	}

}
