package com.github.enumBN.bn;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class DistributionTest {

	private static final VariableDomain RAIN = VariableDomain.of("none", "light", "heavy");

	@Test
	public void testNormalize() {
		Distribution d = Distribution.normalize("Rain", RAIN, new double[] { 0.2, 0.1, 0.1 },
				Collections.<String, String> emptyMap());
		assertEquals(0.5, d.getProbability("none"), 1e-12);
		assertEquals(0.25, d.getProbability(2), 1e-12);
		assertEquals("heavy", d.getLabel(2));
		assertEquals("{none=0.500000, light=0.250000, heavy=0.250000}", d.toString());
	}

	@Test
	public void testZeroWeights() {
		assertThrows(DegenerateDistributionException.class, () -> Distribution.normalize("Rain", RAIN,
				new double[] { 0, 0, 0 }, Collections.singletonMap("Train", "delayed")));
	}

	@Test
	public void testTinyWeightsAreNotDegenerate() {
		Distribution d = Distribution.normalize("Rain", RAIN, new double[] { 3e-300, 1e-300, 0 },
				Collections.<String, String> emptyMap());
		assertEquals(0.75, d.getProbability("none"), 1e-12);
		assertEquals(0.0, d.getProbability("heavy"), 0);
	}

	@Test
	public void testMostProbableTakesFirstOnTie() {
		Distribution d = new Distribution("Rain", RAIN, new double[] { 0.2, 0.4, 0.4 });
		assertEquals("light", d.getMostProbable());
	}

	@Test
	public void testMapAndUnknownLabel() {
		Distribution d = new Distribution("Rain", RAIN, new double[] { 0.7, 0.2, 0.1 });
		Map<String, Double> map = d.toMap();
		assertEquals(RAIN.getValues(), new java.util.ArrayList<String>(map.keySet()));
		assertEquals(0.2, map.get("light"), 0);
		assertThrows(InvalidValueException.class, () -> d.getProbability("stormy"));
	}

	@Test
	public void testWrongSize() {
		assertThrows(IllegalArgumentException.class, () -> new Distribution("Rain", RAIN, new double[] { 1.0 }));
	}
}
