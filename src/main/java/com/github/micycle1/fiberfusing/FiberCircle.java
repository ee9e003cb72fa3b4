package com.github.micycle1.fiberfusing;

import java.util.Objects;

import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.math.Vector2D;
import org.locationtech.jts.operation.distance.DistanceOp;
import org.locationtech.jts.util.GeometricShapeFactory;

/**
 * A fiber cladding cross-section: a disk with a separately tracked core point.
 * <p>
 * The disk (centre, radius) is immutable. Its polygon is a regular polygon with
 * {@link #getSegments()} vertices, built on construction; every area the library reasons
 * about is an area of such polygons, never {@code πr²}, so that the overlap and
 * neck accounting stay consistent with the boolean operations.
 * <p>
 * The core starts at the centre and is moved only by accumulating shifts
 * ({@link #shiftCore(Vector2D)}) or reset with {@link #resetCore()}.
 *
 * @author Michael Carleton
 */
public class FiberCircle {

	static final int MIN_SEGMENTS = 8;

	private final Coordinate center;
	private final double radius;
	private final int segments;
	private final Coordinate core;
	private final Polygon polygon;

	public FiberCircle(double x, double y, double radius) {
		this(new Coordinate(x, y), radius, FusionSettings.DEFAULT_CIRCLE_SEGMENTS);
	}

	/**
	 * @param center   disk centre
	 * @param radius   disk radius, strictly positive
	 * @param segments number of vertices of the polygonal disk (at least 8)
	 */
	public FiberCircle(Coordinate center, double radius, int segments) {
		Objects.requireNonNull(center, "center");
		if (!Double.isFinite(center.x) || !Double.isFinite(center.y)) {
			throw new IllegalArgumentException("center must be finite: " + center);
		}
		if (!(radius > 0) || Double.isInfinite(radius)) {
			throw new IllegalArgumentException("radius must be positive and finite: " + radius);
		}
		if (segments < MIN_SEGMENTS) {
			throw new IllegalArgumentException("segments must be >= " + MIN_SEGMENTS + ": " + segments);
		}
		this.center = new Coordinate(center.x, center.y);
		this.radius = radius;
		this.segments = segments;
		this.core = new Coordinate(center.x, center.y);

		GeometricShapeFactory shapeFactory = new GeometricShapeFactory(PolygonOps.FACTORY);
		shapeFactory.setCentre(this.center);
		shapeFactory.setSize(2 * radius);
		shapeFactory.setNumPoints(segments);
		this.polygon = shapeFactory.createCircle();
	}

	private FiberCircle(Coordinate center, double radius, int segments, Coordinate core) {
		this(center, radius, segments);
		this.core.setCoordinate(core);
	}

	/**
	 * Number of polygon vertices needed so that the chord of a circle of the given
	 * radius deviates from the arc by at most {@code maxDeviation}. The result is
	 * even, so the polygon is symmetric under a half turn about its centre.
	 */
	static int segmentsFor(double radius, double maxDeviation, int minSegments, int maxSegments) {
		int n;
		if (maxDeviation >= radius) {
			n = minSegments;
		} else {
			double halfAngle = FastMath.acos(1 - maxDeviation / radius);
			n = (int) Math.min(maxSegments, Math.ceil(Math.PI / halfAngle));
		}
		n = Math.max(minSegments, Math.min(maxSegments, n));
		return (n % 2 == 0) ? n : n + 1;
	}

	public Coordinate getCenter() {
		return new Coordinate(center);
	}

	public double getRadius() {
		return radius;
	}

	public int getSegments() {
		return segments;
	}

	/**
	 * @return a copy of the current core position
	 */
	public synchronized Coordinate getCore() {
		return new Coordinate(core);
	}

	/**
	 * Displaces the core by {@code shift}. Shifts from several connections
	 * sharing this fiber accumulate.
	 */
	public synchronized void shiftCore(Vector2D shift) {
		core.x += shift.getX();
		core.y += shift.getY();
	}

	/** Moves the core back onto the disk centre. */
	public synchronized void resetCore() {
		core.setCoordinate(center);
	}

	public Polygon getPolygon() {
		return polygon;
	}

	/**
	 * @return the area of the polygonal disk
	 */
	public double area() {
		return getPolygon().getArea();
	}

	/**
	 * Whether the two disks share interior area; tangent disks do not overlap.
	 */
	public boolean overlaps(FiberCircle other) {
		return center.distance(other.center) < radius + other.radius;
	}

	/**
	 * Returns the point of this circle's boundary closest to the boundary of
	 * {@code other}.
	 * <p>
	 * For non-concentric circles this point lies on the ray from this centre
	 * through the other centre, whether the circles are disjoint, tangent, or one
	 * encloses the other. Concentric circles have no preferred direction, so the
	 * polygon boundaries are measured instead.
	 */
	public Coordinate nearestBoundaryPoint(FiberCircle other) {
		double dx = other.center.x - center.x;
		double dy = other.center.y - center.y;
		double d = Math.hypot(dx, dy);
		if (d == 0) {
			return DistanceOp.nearestPoints(getPolygon().getExteriorRing(), other.getPolygon().getExteriorRing())[0];
		}
		return new Coordinate(center.x + radius * dx / d, center.y + radius * dy / d);
	}

	/**
	 * Returns a copy moved by {@code t}. The centre and the core are transformed;
	 * the radius is preserved.
	 */
	public FiberCircle transformed(AffineTransformation t) {
		Coordinate c = new Coordinate();
		t.transform(center, c);
		Coordinate k = new Coordinate();
		t.transform(getCore(), k);
		return new FiberCircle(c, radius, segments, k);
	}

	/**
	 * Returns a copy rotated by {@code angle} radians about {@code origin}.
	 */
	public FiberCircle rotated(double angle, Coordinate origin) {
		return transformed(AffineTransformation.rotationInstance(angle, origin.x, origin.y));
	}

	@Override
	public String toString() {
		return "FiberCircle{center=(" + center.x + ", " + center.y + "), radius=" + radius + ", core=" + getCore() + "}";
	}
}
