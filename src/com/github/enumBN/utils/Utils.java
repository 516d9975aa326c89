package com.github.enumBN.utils;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

public class Utils {

	/**
	 * Kahn's algorithm. Among the nodes whose parents have all been emitted,
	 * the lexicographically smallest name goes first, so the order is fully
	 * determined by the graph.
	 * 
	 * @param childNodes
	 *            adjacency list, every node must be a key (possibly with an
	 *            empty list)
	 * @return nodes in topological order; if the graph has a cycle, the nodes
	 *         on or downstream of it are missing from the result
	 */
	public static List<String> topologicalSort(Map<String, List<String>> childNodes) {

		Map<String, Integer> inDegree = new HashMap<String, Integer>((int) Math.ceil(childNodes.size() / 0.75));
		for (String node : childNodes.keySet())
			inDegree.put(node, 0);
		for (List<String> children : childNodes.values())
			for (String child : children)
				inDegree.put(child, inDegree.get(child) + 1);

		TreeSet<String> ready = new TreeSet<String>();
		for (Map.Entry<String, Integer> entry : inDegree.entrySet())
			if (entry.getValue() == 0)
				ready.add(entry.getKey());

		List<String> order = new ArrayList<String>(childNodes.size());
		while (!ready.isEmpty()) {
			String node = ready.pollFirst();
			order.add(node);
			for (String child : childNodes.get(node)) {
				int remaining = inDegree.get(child) - 1;
				inDegree.put(child, remaining);
				if (remaining == 0)
					ready.add(child);
			}
		}

		return order;
	}

	/**
	 * @throws IOException
	 *             if the file cannot be opened or the text was not completely
	 *             written
	 */
	public static void writeToFile(String fileName, String text) throws IOException {
		PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(fileName),
				StandardCharsets.UTF_8));
		writer.print(text);
		// PrintWriter does not throw, errors are only reported by checkError
		boolean failed = writer.checkError();
		writer.close();
		if (failed)
			throw new IOException("Error writing to " + fileName);
	}

}
