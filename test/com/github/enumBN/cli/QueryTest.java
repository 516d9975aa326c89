package com.github.enumBN.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import au.com.bytecode.opencsv.CSVReader;

public class QueryTest {

	private String structureFile;

	private String cptFile;

	private ByteArrayOutputStream out;

	private ByteArrayOutputStream err;

	@BeforeEach
	public void setUp() throws Exception {
		structureFile = new File(getClass().getResource("/rain-structure.txt").toURI()).getPath();
		cptFile = new File(getClass().getResource("/rain-cpt.txt").toURI()).getPath();
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private int run(String... args) throws Exception {
		PrintStream o = new PrintStream(out, true, "UTF-8");
		PrintStream e = new PrintStream(err, true, "UTF-8");
		return Query.run(args, o, e);
	}

	private String output() throws Exception {
		return out.toString("UTF-8");
	}

	@Test
	public void testQueryWithEvidence() throws Exception {
		assertEquals(0, run("-s", structureFile, "-c", cptFile, "-q", "Train", "-e", "Rain=heavy"));
		String output = output();
		assertTrue(output.contains("Distribution of Train given Rain=heavy:"), output);
		assertTrue(output.contains("P(Train=on_time | Rain=heavy) = 0.490000"), output);
		assertTrue(output.contains("P(Train=delayed | Rain=heavy) = 0.510000"), output);
		assertTrue(output.contains("Most probable value: Train=delayed with probability 0.510000"), output);
	}

	@Test
	public void testCommaSeparatedEvidence() throws Exception {
		assertEquals(0, run("-s", structureFile, "-c", cptFile, "-q", "Appointment", "-m", "-e",
				"Rain=light,Maintenance=no"));
		assertTrue(output().contains("P(Appointment=attend | Rain=light, Maintenance=no) = 0.810000"), output());
	}

	@Test
	public void testNoEvidence() throws Exception {
		assertEquals(0, run("--structureFile", structureFile, "--cptFile", cptFile, "--query", "Rain"));
		String output = output();
		assertTrue(output.contains("Distribution of Rain given no evidence:"), output);
		assertTrue(output.contains("P(Rain=none) = 0.700000"), output);
	}

	@Test
	public void testVerbosePrintsTrace() throws Exception {
		assertEquals(0, run("-s", structureFile, "-c", cptFile, "-q", "Train", "-e", "Rain=heavy", "-v"));
		String output = output();
		assertTrue(output.contains("Maintenance hidden, summing over [yes, no]"), output);
		assertTrue(output.indexOf("Normalized:") < output.indexOf("Most probable value"));
	}

	@Test
	public void testCsvOutput(@TempDir File dir) throws Exception {
		File csv = new File(dir, "posterior.csv");
		assertEquals(0, run("-s", structureFile, "-c", cptFile, "-q", "Train", "-e", "Rain=heavy", "-o",
				csv.getPath()));

		CSVReader reader = new CSVReader(new InputStreamReader(new FileInputStream(csv), StandardCharsets.UTF_8));
		List<String[]> rows;
		try {
			rows = reader.readAll();
		} finally {
			reader.close();
		}
		assertEquals(3, rows.size());
		assertArrayEquals(new String[] { "value", "probability" }, rows.get(0));
		assertEquals("on_time", rows.get(1)[0]);
		assertEquals(0.49, Double.parseDouble(rows.get(1)[1]), 1e-9);
		assertEquals("delayed", rows.get(2)[0]);
	}

	@Test
	public void testUsageErrors() throws Exception {
		assertEquals(2, run("-s", structureFile, "-c", cptFile));
		assertEquals(2, run("-s", structureFile, "-c", cptFile, "-q", "Train", "-e", "Rain"));
		assertTrue(err.toString("UTF-8").contains("node=value"));
	}

	@Test
	public void testQueryErrors() throws Exception {
		assertEquals(1, run("-s", structureFile, "-c", cptFile, "-q", "Train", "-e", "Rain=stormy"));
		assertTrue(err.toString("UTF-8").startsWith("Error: "));
		assertEquals(1, run("-s", structureFile, "-c", cptFile, "-q", "Rain", "-e", "Rain=light"));
		assertEquals(1, run("-s", structureFile, "-c", cptFile, "-q", "Snow"));
		assertEquals(1, run("-s", "missing.txt", "-c", cptFile, "-q", "Rain"));
	}

	@Test
	public void testMalformedParentsLine(@TempDir File dir) throws Exception {
		File structure = new File(dir, "structure.txt");
		File cpt = new File(dir, "cpt.txt");
		Files.write(structure.toPath(), new byte[0]);
		Files.write(cpt.toPath(), "NODE A\nVALUES t f\nPARENTS A\nTABLE\nt 0.5 0.5\nf 0.5 0.5\nENDNODE\n"
				.getBytes(StandardCharsets.UTF_8));

		assertEquals(1, run("-s", structure.getPath(), "-c", cpt.getPath(), "-q", "A"));
		assertTrue(err.toString("UTF-8").startsWith("Could not load network: "), err.toString("UTF-8"));
	}

	@Test
	public void testParseEvidence() throws Exception {
		Map<String, String> evidence = Query.parseEvidence(new String[] { "Rain=heavy", " Maintenance = no ", "",
				"Rain=heavy" });
		assertEquals(2, evidence.size());
		assertEquals("heavy", evidence.get("Rain"));
		assertEquals("no", evidence.get("Maintenance"));
		assertTrue(Query.parseEvidence(null).isEmpty());

		assertThrows(ParseException.class, () -> Query.parseEvidence(new String[] { "=heavy" }));
		assertThrows(ParseException.class, () -> Query.parseEvidence(new String[] { "Rain=" }));
		assertThrows(ParseException.class, () -> Query.parseEvidence(new String[] { "Rain=heavy", "Rain=light" }));
	}
}
