package com.github.enumBN.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Array of distinct elements that can be indexed both ways: position to
 * element and element to position. Elements are never removed, so positions
 * are stable.
 */
public class BidirectionalArray<T> {

	private List<T> indexToElement = new ArrayList<T>();

	private Map<T, Integer> elementToIndex = new HashMap<T, Integer>();

	/**
	 * Appends an element.
	 * 
	 * @return false if the element was already present, in which case the
	 *         array is left unchanged
	 */
	public boolean add(T element) {
		if (elementToIndex.containsKey(element))
			return false;
		elementToIndex.put(element, indexToElement.size());
		indexToElement.add(element);
		return true;
	}

	public T get(int index) {
		return indexToElement.get(index);
	}

	/**
	 * @return position of the element, or -1 if absent
	 */
	public int getIndex(T element) {
		Integer index = elementToIndex.get(element);
		return index != null ? index : -1;
	}

	public boolean contains(T element) {
		return elementToIndex.containsKey(element);
	}

	public int size() {
		return indexToElement.size();
	}

	public List<T> toList() {
		return Collections.unmodifiableList(indexToElement);
	}

	@Override
	public String toString() {
		return indexToElement.toString();
	}

}
