package com.github.enumBN.bn;

/**
 * An input file does not follow the structure or CPT format.
 */
public class NetworkFormatException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String source;

	private final int lineNumber;

	public NetworkFormatException(String source, int lineNumber, String message) {
		super(source + (lineNumber > 0 ? ":" + lineNumber : "") + ": " + message);
		this.source = source;
		this.lineNumber = lineNumber;
	}

	public String getSource() {
		return source;
	}

	/**
	 * @return 1-based line number, or 0 if the problem is not tied to a line
	 */
	public int getLineNumber() {
		return lineNumber;
	}

}
