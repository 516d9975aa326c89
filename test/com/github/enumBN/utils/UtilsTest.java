package com.github.enumBN.utils;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class UtilsTest {

	private static Map<String, List<String>> graph(String... nodes) {
		Map<String, List<String>> g = new LinkedHashMap<String, List<String>>();
		for (String n : nodes)
			g.put(n, new ArrayList<String>());
		return g;
	}

	@Test
	public void testReadyNodesAreTakenInLexicographicOrder() {
		Map<String, List<String>> g = graph("Zeta", "Alpha", "Mid");
		assertEquals(Arrays.asList("Alpha", "Mid", "Zeta"), Utils.topologicalSort(g));
	}

	@Test
	public void testParentsBeforeChildren() {
		Map<String, List<String>> g = graph("c", "b", "a");
		// c -> a, b -> a, c -> b
		g.get("c").add("a");
		g.get("b").add("a");
		g.get("c").add("b");
		assertEquals(Arrays.asList("c", "b", "a"), Utils.topologicalSort(g));
	}

	@Test
	public void testNewlyReadyNodeCompetesWithOlderOnes() {
		Map<String, List<String>> g = graph("a", "z", "b");
		// a -> b; once a is emitted, b is ready and beats z
		g.get("a").add("b");
		assertEquals(Arrays.asList("a", "b", "z"), Utils.topologicalSort(g));
	}

	@Test
	public void testCycleLeavesNodesOut() {
		Map<String, List<String>> g = graph("a", "b", "root");
		g.get("a").add("b");
		g.get("b").add("a");
		List<String> order = Utils.topologicalSort(g);
		assertEquals(Arrays.asList("root"), order);
	}

	@Test
	public void testBidirectionalArray() {
		BidirectionalArray<String> array = new BidirectionalArray<String>();
		assertTrue(array.add("x"));
		assertTrue(array.add("y"));
		assertFalse(array.add("x"));
		assertEquals(2, array.size());
		assertEquals(1, array.getIndex("y"));
		assertEquals(-1, array.getIndex("z"));
		assertEquals("x", array.get(0));
		assertEquals(Arrays.asList("x", "y"), array.toList());
	}

	@Test
	public void testEdge() {
		Edge e = new Edge("Rain", "Train");
		assertEquals("Rain", e.getTail());
		assertEquals("Train", e.getHead());
		assertEquals(new Edge("Rain", "Train"), e);
		assertNotEquals(new Edge("Train", "Rain"), e);
		assertEquals("Rain -> Train", e.toString());
	}

	@Test
	public void testWriteToFile(@TempDir File dir) throws Exception {
		File file = new File(dir, "out.dot");
		Utils.writeToFile(file.getPath(), "digraph bn{\n\"Ç\";\n}\n");
		assertEquals("digraph bn{\n\"Ç\";\n}\n", new String(Files.readAllBytes(file.toPath()),
				StandardCharsets.UTF_8));
	}

	@Test
	public void testWriteToDirectoryFails(@TempDir File dir) {
		assertThrows(IOException.class, () -> Utils.writeToFile(dir.getPath(), "text"));
	}

	@Test
	public void testWriteToFullDeviceFails() {
		File full = new File("/dev/full");
		assumeTrue(full.exists() && full.canWrite());
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 10000; i++)
			sb.append("\"Rain\" -> \"Train\";\n");
		assertThrows(IOException.class, () -> Utils.writeToFile(full.getPath(), sb.toString()));
	}
}
