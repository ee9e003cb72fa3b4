package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;

/**
 * Unfused arrangements of identical fibers, centred on the origin, in which
 * neighbouring fibers just touch. Apply a fusion degree to bring them into
 * contact.
 */
public final class FiberLayouts {

	private FiberLayouts() {
	}

	public static List<FiberCircle> ring(int count, double radius, double angleShiftDegrees) {
		return ring(count, radius, angleShiftDegrees, FusionSettings.defaults());
	}

	/**
	 * Fibers evenly spaced on a circle about the origin. The first fiber sits on
	 * the positive y axis before the whole ring is turned counter-clockwise by
	 * {@code angleShiftDegrees}. A single fiber is placed at the origin.
	 */
	public static List<FiberCircle> ring(int count, double radius, double angleShiftDegrees, FusionSettings settings) {
		requireCount(count);
		List<FiberCircle> fibers = new ArrayList<>(count);
		if (count == 1) {
			fibers.add(new FiberCircle(new Coordinate(0, 0), radius, settings.getCircleSegments()));
			return fibers;
		}
		double delta = 2 * Math.PI / count;
		double distance = Math.sqrt(2 / (1 - FastMath.cos(delta))) * radius;
		for (int i = 0; i < count; i++) {
			double angle = i * delta + Math.toRadians(angleShiftDegrees);
			// (0, distance) turned by angle
			Coordinate c = new Coordinate(-distance * FastMath.sin(angle), distance * FastMath.cos(angle));
			fibers.add(new FiberCircle(c, radius, settings.getCircleSegments()));
		}
		return fibers;
	}

	public static List<FiberCircle> line(int count, double radius, double rotationDegrees) {
		return line(count, radius, rotationDegrees, FusionSettings.defaults());
	}

	/**
	 * Fibers in a row through the origin, along the x axis turned by
	 * {@code rotationDegrees}.
	 */
	public static List<FiberCircle> line(int count, double radius, double rotationDegrees, FusionSettings settings) {
		requireCount(count);
		double theta = Math.toRadians(rotationDegrees);
		double mean = (count - 1) / 2.0;
		List<FiberCircle> fibers = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			double position = (i - mean) * 2 * radius;
			Coordinate c = new Coordinate(FastMath.cos(theta) * position, FastMath.sin(theta) * position);
			fibers.add(new FiberCircle(c, radius, settings.getCircleSegments()));
		}
		return fibers;
	}

	private static void requireCount(int count) {
		if (count < 1) {
			throw new IllegalArgumentException("count must be positive: " + count);
		}
	}
}
