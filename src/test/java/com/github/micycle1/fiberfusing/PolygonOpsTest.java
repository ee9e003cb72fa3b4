package com.github.micycle1.fiberfusing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;

public class PolygonOpsTest {

	private static final GeometryFactory GF = PolygonOps.FACTORY;
	private static final double EPS = 1e-12;

	private static Coordinate c(double x, double y) {
		return new Coordinate(x, y);
	}

	private static Polygon box(double x0, double y0, double x1, double y1) {
		return PolygonOps.polygon(c(x0, y0), c(x1, y0), c(x1, y1), c(x0, y1));
	}

	@Test
	void polygonalDropsPointsAndLines() {
		Geometry mixed = GF.createGeometryCollection(new Geometry[] { box(0, 0, 1, 1), GF.createLineString(new Coordinate[] { c(5, 5), c(6, 6) }),
				GF.createPoint(c(9, 9)) });
		Geometry result = PolygonOps.polygonal(mixed);
		assertTrue(result instanceof Polygon);
		assertEquals(1, result.getArea(), EPS);
		assertEquals(1, result.getNumGeometries());
	}

	@Test
	void polygonalOfLineOnlyIsEmptyPolygon() {
		Geometry line = GF.createLineString(new Coordinate[] { c(0, 0), c(1, 1) });
		Geometry result = PolygonOps.polygonal(line);
		assertTrue(result.isEmpty());
		assertTrue(result instanceof Polygonal);
	}

	@Test
	void tangentIntersectionIsEmptySection() {
		// boxes sharing an edge intersect in a line only
		Geometry result = PolygonOps.intersection(box(0, 0, 1, 1), box(1, 0, 2, 1));
		assertTrue(result.isEmpty());
		assertEquals(0, result.getArea(), 0);
	}

	@Test
	void largestComponentOfMultiPolygon() {
		Geometry multi = GF.createMultiPolygon(new Polygon[] { box(0, 0, 1, 1), box(5, 5, 7, 7), box(10, 10, 11, 12) });
		Geometry largest = PolygonOps.largestComponent(multi);
		assertEquals(4, largest.getArea(), EPS);
		assertTrue(PolygonOps.largestComponent(PolygonOps.empty()).isEmpty());
	}

	@Test
	void splitReturnsRequestedFragment() {
		Geometry square = box(0, 0, 2, 2);
		Geometry small = PolygonOps.split(square, c(0.5, -1), c(0.5, 3), false);
		Geometry large = PolygonOps.split(square, c(0.5, -1), c(0.5, 3), true);
		assertEquals(1, small.getArea(), 1e-9);
		assertEquals(3, large.getArea(), 1e-9);
		assertTrue(small.getEnvelopeInternal().getMaxX() <= 0.5 + 1e-9);
	}

	@Test
	void splitLineIsUnbounded() {
		// the given points lie well outside the square; the line still cuts it
		Geometry square = box(0, 0, 2, 2);
		Geometry small = PolygonOps.split(square, c(-10, 1.5), c(-9, 1.5), false);
		assertEquals(1, small.getArea(), 1e-9);
	}

	@Test
	void splitMissingLineReturnsWhole() {
		Geometry square = box(0, 0, 1, 1);
		assertEquals(1, PolygonOps.split(square, c(5, 0), c(5, 1), false).getArea(), 1e-9);
		assertEquals(1, PolygonOps.split(square, c(5, 0), c(5, 1), true).getArea(), 1e-9);
		assertTrue(PolygonOps.split(PolygonOps.empty(), c(0, 0), c(0, 1), true).isEmpty());
		assertThrows(IllegalArgumentException.class, () -> PolygonOps.split(square, c(0, 0), c(0, 0), true));
	}

	@Test
	void unionOfMany() {
		Geometry union = PolygonOps.union(List.of(box(0, 0, 2, 2), box(1, 0, 3, 2), box(10, 10, 11, 11), PolygonOps.empty()));
		assertEquals(7, union.getArea(), 1e-9);
		assertEquals(2, union.getNumGeometries());
		assertTrue(PolygonOps.union(List.of()).isEmpty());
	}

	@Test
	void unionIgnoresInputOrder() {
		List<Geometry> boxes = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			for (int j = 0; j < 5; j++) {
				boxes.add(box(3 * i, 3 * j, 3 * i + 2, 3 * j + 2));
			}
		}
		List<Geometry> shuffled = new ArrayList<>(boxes);
		Collections.shuffle(shuffled, new Random(42));
		List<Geometry> before = new ArrayList<>(shuffled);
		Geometry ordered = PolygonOps.union(boxes);
		Geometry mixed = PolygonOps.union(shuffled);
		assertEquals(25, mixed.getNumGeometries());
		assertEquals(100, mixed.getArea(), 1e-9);
		assertTrue(ordered.symDifference(mixed).isEmpty());
		// the caller's list keeps its order
		for (int i = 0; i < before.size(); i++) {
			assertSame(before.get(i), shuffled.get(i));
		}
	}

	@Test
	void differenceSubtractsInTurn() {
		Geometry result = PolygonOps.difference(box(0, 0, 4, 1), box(0, 0, 1, 1), box(3, 0, 4, 1));
		assertEquals(2, result.getArea(), 1e-9);
		assertTrue(PolygonOps.difference(box(0, 0, 1, 1), box(-1, -1, 2, 2), box(0, 0, 1, 1)).isEmpty());
	}

	@Test
	void collinearRingIsEmpty() {
		assertTrue(PolygonOps.polygon(c(0, 0), c(1, 1), c(2, 2)).isEmpty());
		assertTrue(PolygonOps.polygon(c(0, 0), c(1, 1)).isEmpty());
		assertEquals(0.5, PolygonOps.polygon(c(0, 0), c(1, 0), c(0, 1)).getArea(), EPS);
	}
}
