package com.github.enumBN.utils;

/**
 * A directed arc between two named nodes, {@code tail -> head}.
 */
public class Edge {

	private final String tail;

	private final String head;

	public Edge(String tail, String head) {
		if (tail == null || head == null)
			throw new IllegalArgumentException("Edge endpoints must not be null");
		this.tail = tail;
		this.head = head;
	}

	public String getTail() {
		return tail;
	}

	public String getHead() {
		return head;
	}

	@Override
	public int hashCode() {
		return 31 * tail.hashCode() + head.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (!(obj instanceof Edge))
			return false;
		Edge other = (Edge) obj;
		return tail.equals(other.tail) && head.equals(other.head);
	}

	@Override
	public String toString() {
		return tail + " -> " + head;
	}

}
