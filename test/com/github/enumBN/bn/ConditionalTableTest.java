package com.github.enumBN.bn;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ConditionalTableTest {

	private static final double TOLERANCE = BayesNet.DEFAULT_TOLERANCE;

	private static final VariableDomain YES_NO = VariableDomain.of("yes", "no");

	private static final VariableDomain RAIN = VariableDomain.of("none", "light", "heavy");

	@Test
	public void testAllConfigurationsLastParentFastest() {
		List<Configuration> all = ConditionalTable.allConfigurations(Arrays.asList(RAIN, YES_NO));
		assertEquals(6, all.size());
		assertEquals(Configuration.of("none", "yes"), all.get(0));
		assertEquals(Configuration.of("none", "no"), all.get(1));
		assertEquals(Configuration.of("light", "yes"), all.get(2));
		assertEquals(Configuration.of("heavy", "no"), all.get(5));
	}

	@Test
	public void testRootHasSingleEmptyConfiguration() {
		List<Configuration> all = ConditionalTable.allConfigurations(Collections.<VariableDomain> emptyList());
		assertEquals(Arrays.asList(Configuration.EMPTY), all);
	}

	@Test
	public void testCompleteTableValidates() {
		ConditionalTable t = new ConditionalTable.Builder()
				.addRow(Arrays.asList("none"), 0.4, 0.6)
				.addRow(Arrays.asList("light"), 0.2, 0.8)
				.addRow(Arrays.asList("heavy"), 0.1, 0.9)
				.build();
		t.validate("Maintenance", YES_NO, Arrays.asList(RAIN), TOLERANCE);
		assertEquals(3, t.numRows());
		assertEquals(Arrays.asList(0.2, 0.8), t.get(Configuration.of("light")));
		assertNull(t.get(Configuration.of("stormy")));
	}

	@Test
	public void testMissingRow() {
		ConditionalTable t = new ConditionalTable.Builder()
				.addRow(Arrays.asList("none"), 0.4, 0.6)
				.addRow(Arrays.asList("light"), 0.2, 0.8)
				.build();
		RowCountMismatchException e = assertThrows(RowCountMismatchException.class,
				() -> t.validate("Maintenance", YES_NO, Arrays.asList(RAIN), TOLERANCE));
		assertTrue(e.getMessage().contains("(heavy)"), e.getMessage());
	}

	@Test
	public void testRowOutsideParentDomains() {
		ConditionalTable t = new ConditionalTable.Builder()
				.addRow(Arrays.asList("none"), 0.4, 0.6)
				.addRow(Arrays.asList("light"), 0.2, 0.8)
				.addRow(Arrays.asList("heavy"), 0.1, 0.9)
				.addRow(Arrays.asList("stormy"), 0.1, 0.9)
				.build();
		assertThrows(RowCountMismatchException.class,
				() -> t.validate("Maintenance", YES_NO, Arrays.asList(RAIN), TOLERANCE));
	}

	@Test
	public void testWrongNumberOfProbabilities() {
		ConditionalTable t = new ConditionalTable.Builder().addPrior(0.5, 0.3, 0.2).build();
		assertThrows(RowCountMismatchException.class,
				() -> t.validate("Root", YES_NO, Collections.<VariableDomain> emptyList(), TOLERANCE));
	}

	@Test
	public void testDuplicateRowRejectedByBuilder() {
		ConditionalTable.Builder builder = new ConditionalTable.Builder().addRow(Arrays.asList("none"), 0.4, 0.6);
		assertThrows(RowCountMismatchException.class, () -> builder.addRow(Arrays.asList("none"), 0.5, 0.5));
	}

	@Test
	public void testRowNotSummingToOne() {
		ConditionalTable low = new ConditionalTable.Builder().addPrior(0.5, 0.49).build();
		assertThrows(ProbabilityNormalizationException.class,
				() -> low.validate("Root", YES_NO, Collections.<VariableDomain> emptyList(), TOLERANCE));

		ConditionalTable high = new ConditionalTable.Builder().addPrior(0.52, 0.5).build();
		assertThrows(ProbabilityNormalizationException.class,
				() -> high.validate("Root", YES_NO, Collections.<VariableDomain> emptyList(), TOLERANCE));
	}

	@Test
	public void testSumWithinToleranceAccepted() {
		ConditionalTable t = new ConditionalTable.Builder().addPrior(0.3333333, 0.6666667).build();
		t.validate("Root", YES_NO, Collections.<VariableDomain> emptyList(), TOLERANCE);
	}

	@Test
	public void testNegativeProbability() {
		ConditionalTable t = new ConditionalTable.Builder().addPrior(1.5, -0.5).build();
		assertThrows(ProbabilityNormalizationException.class,
				() -> t.validate("Root", YES_NO, Collections.<VariableDomain> emptyList(), TOLERANCE));
	}
}
