package com.github.micycle1.fiberfusing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

public class FiberLayoutsTest {

	private static final double EPS = 1e-12;

	@Test
	void ringNeighboursTouch() {
		for (int n = 2; n <= 7; n++) {
			List<FiberCircle> ring = FiberLayouts.ring(n, 62.5, 15);
			assertEquals(n, ring.size());
			for (int i = 0; i < n; i++) {
				Coordinate a = ring.get(i).getCenter();
				Coordinate b = ring.get((i + 1) % n).getCenter();
				assertEquals(125, a.distance(b), 1e-9);
			}
		}
	}

	@Test
	void ringStartsOnPositiveYAxis() {
		List<FiberCircle> ring = FiberLayouts.ring(4, 1, 0);
		double d = Math.sqrt(2);
		assertEquals(0, ring.get(0).getCenter().x, EPS);
		assertEquals(d, ring.get(0).getCenter().y, EPS);
		// counter-clockwise
		assertEquals(-d, ring.get(1).getCenter().x, EPS);

		List<FiberCircle> turned = FiberLayouts.ring(4, 1, 90);
		assertEquals(-d, turned.get(0).getCenter().x, EPS);
		assertEquals(0, turned.get(0).getCenter().y, EPS);
	}

	@Test
	void singleFiberRingSitsAtOrigin() {
		List<FiberCircle> ring = FiberLayouts.ring(1, 3, 45);
		assertEquals(1, ring.size());
		assertEquals(0, ring.get(0).getCenter().distance(new Coordinate(0, 0)), 0);
		assertEquals(3, ring.get(0).getRadius(), 0);
	}

	@Test
	void lineIsCenteredOnOrigin() {
		List<FiberCircle> line = FiberLayouts.line(3, 1, 0);
		assertEquals(-2, line.get(0).getCenter().x, EPS);
		assertEquals(0, line.get(1).getCenter().x, EPS);
		assertEquals(2, line.get(2).getCenter().x, EPS);

		List<FiberCircle> vertical = FiberLayouts.line(2, 1, 90);
		assertEquals(-1, vertical.get(0).getCenter().y, EPS);
		assertEquals(1, vertical.get(1).getCenter().y, EPS);
		assertEquals(0, vertical.get(1).getCenter().x, EPS);
	}

	@Test
	void layoutsUseSettingsResolution() {
		FusionSettings settings = FusionSettings.builder().circleSegments(32).build();
		assertEquals(32, FiberLayouts.ring(3, 1, 0, settings).get(0).getSegments());
		assertEquals(32, FiberLayouts.line(3, 1, 0, settings).get(2).getSegments());
	}

	@Test
	void fusedLineConnectsNeighboursOnly() {
		FiberAssembly assembly = new FiberAssembly();
		FiberLayouts.line(3, 1, 30).forEach(assembly::addFiber);
		assembly.applyFusionDegree(0.3);
		List<PairConnection> connections = ConnectionGraph.build(assembly.getFibers());
		assertEquals(2, connections.size());
		for (PairConnection c : connections) {
			assertEquals(2 * FiberAssembly.scalingFactor(0.3), c.getDistanceBetweenCores(), 1e-9);
		}
	}

	@Test
	void invalidCount() {
		assertThrows(IllegalArgumentException.class, () -> FiberLayouts.ring(0, 1, 0));
		assertThrows(IllegalArgumentException.class, () -> FiberLayouts.line(-1, 1, 0));
	}
}
