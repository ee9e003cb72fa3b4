package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.math.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The fusion geometry between two overlapping fibers.
 * <p>
 * A connection owns no fibers; it reads their disks and, once its core split
 * has been optimized, hands back a shift for each core. Its neck geometry is
 * parameterized by a single scalar, the <em>shift</em>: two mirrored "virtual"
 * circles tangent to both fibers approximate the meniscus between them, their
 * centres displaced by {@code shift} along the normal of the centre line. A
 * larger shift gives a wider, shallower meniscus.
 * <p>
 * Call {@link #configure(double, Topology)} to derive the virtual circles, mask
 * and added section. The removed section (the lens where the disks overlap) and
 * its area depend on the disks alone and are computed on construction.
 *
 * @author Michael Carleton
 */
public class PairConnection {

	private static final Logger log = LoggerFactory.getLogger(PairConnection.class);

	/** Scale applied to the convex mask triangles to make them act as wedges. */
	static final double MASK_SCALE = 1000;
	/** Contact distance between a neck and a fiber, relative to the smaller radius. */
	private static final double CONTACT_TOLERANCE = 1e-9;

	private final FiberCircle fiberA;
	private final FiberCircle fiberB;
	private final FusionSettings settings;

	private final Geometry removedSection;
	private final double removedArea;
	private Geometry limitAddedSection;

	private Topology topology = Topology.UNDEFINED;
	private double shift;
	private List<FiberCircle> virtualCircles;
	private Geometry mask;
	private Geometry addedSection = PolygonOps.empty();
	private CoreShift coreShift;

	public PairConnection(FiberCircle fiberA, FiberCircle fiberB) {
		this(fiberA, fiberB, FusionSettings.defaults());
	}

	/**
	 * @throws IllegalArgumentException if the fibers share a centre, which leaves
	 *                                  the centre line (and every direction
	 *                                  derived from it) undefined
	 */
	public PairConnection(FiberCircle fiberA, FiberCircle fiberB, FusionSettings settings) {
		this.fiberA = Objects.requireNonNull(fiberA, "fiberA");
		this.fiberB = Objects.requireNonNull(fiberB, "fiberB");
		this.settings = Objects.requireNonNull(settings, "settings");
		if (fiberA.getCenter().distance(fiberB.getCenter()) == 0) {
			throw new IllegalArgumentException("Cannot connect fibers with coincident centers: " + fiberA.getCenter());
		}

		Geometry a = fiberA.getPolygon();
		Geometry b = fiberB.getPolygon();
		removedSection = PolygonOps.intersection(a, b);
		removedArea = fiberA.area() + fiberB.area() - PolygonOps.union(a, b).getArea();

		log.debug("Created connection between fibers at {} and {}", fiberA.getCenter(), fiberB.getCenter());
	}

	/**
	 * Classifies this pair from its disks alone: {@link Topology#CONVEX} when the
	 * overlap removes more glass than the pair's convex envelope could add back,
	 * {@link Topology#CONCAVE} otherwise. The result does not depend on the shift
	 * or on the order of the two fibers.
	 */
	public Topology determineTopology() {
		return Topology.classify(removedArea, getLimitAddedSection().getArea());
	}

	/**
	 * The largest neck this pair could form: the convex hull of both disks minus
	 * the disks.
	 */
	public Geometry getLimitAddedSection() {
		if (limitAddedSection == null) {
			Geometry a = fiberA.getPolygon();
			Geometry b = fiberB.getPolygon();
			Geometry hull = PolygonOps.union(a, b).convexHull();
			limitAddedSection = PolygonOps.difference(hull, a, b);
		}
		return limitAddedSection;
	}

	/**
	 * Sets the shift and topology and recomputes the neck geometry. Repeating a
	 * call with the same arguments reproduces the same sections.
	 * <p>
	 * When a concave meniscus cannot exist at {@code shift} (its virtual circles
	 * would have no positive radius) the neck is collapsed: the virtual circles
	 * and mask are cleared and the added section is empty.
	 *
	 * @param shift    displacement of the virtual circles, finite and
	 *                 non-negative
	 * @param topology {@link Topology#CONVEX} or {@link Topology#CONCAVE}
	 * @throws IllegalArgumentException if {@code topology} is
	 *                                  {@link Topology#UNDEFINED} or the shift is
	 *                                  invalid
	 * @throws IllegalStateException    if this connection was already configured
	 *                                  with the other topology
	 */
	public void configure(double shift, Topology topology) {
		Objects.requireNonNull(topology, "topology");
		if (topology == Topology.UNDEFINED) {
			throw new IllegalArgumentException("Cannot configure a connection with an undefined topology; classify it first");
		}
		if (!Double.isFinite(shift) || shift < 0) {
			throw new IllegalArgumentException("shift must be finite and non-negative: " + shift);
		}
		if (this.topology != Topology.UNDEFINED && this.topology != topology) {
			throw new IllegalStateException("Connection topology is fixed at " + this.topology + "; create a new connection to use " + topology);
		}
		this.topology = topology;
		this.shift = shift;
		computeGeometry();
	}

	private void computeGeometry() {
		LineSegment line = getCenterLine();
		Coordinate mid = line.midPoint();
		double half = line.getLength() / 2;
		double baseRadius = Math.sqrt(shift * shift + half * half);
		double radius = topology == Topology.CONCAVE ? baseRadius - fiberA.getRadius() : baseRadius + fiberA.getRadius();

		if (!(radius > 0)) {
			virtualCircles = null;
			mask = null;
			addedSection = PolygonOps.empty();
			return;
		}

		Vector2D perp = perpendicular();
		Coordinate center = new Coordinate(mid.x + perp.getX() * shift, mid.y + perp.getY() * shift);
		double deviation = settings.getVirtualCircleDeviation() * Math.min(fiberA.getRadius(), fiberB.getRadius());
		int segments = FiberCircle.segmentsFor(radius, deviation, settings.getCircleSegments(), settings.getMaxVirtualCircleSegments());
		FiberCircle primary = new FiberCircle(center, radius, segments);
		FiberCircle secondary = primary.rotated(Math.PI, mid);
		virtualCircles = List.of(primary, secondary);

		// contact points, always taken on the virtual circle
		Coordinate pa = primary.nearestBoundaryPoint(fiberA);
		Coordinate sa = secondary.nearestBoundaryPoint(fiberA);
		Coordinate pb = primary.nearestBoundaryPoint(fiberB);
		Coordinate sb = secondary.nearestBoundaryPoint(fiberB);

		Geometry v0 = primary.getPolygon();
		Geometry v1 = secondary.getPolygon();
		Geometry a = fiberA.getPolygon();
		Geometry b = fiberB.getPolygon();

		if (topology == Topology.CONCAVE) {
			mask = PolygonOps.difference(PolygonOps.polygon(pa, sa, sb, pb), v0, v1);
			addedSection = bridging(PolygonOps.difference(mask, a, b, PolygonOps.union(v0, v1)));
		} else {
			Geometry wedges = PolygonOps.union(wedge(mid, pa, pb), wedge(mid, sa, sb));
			mask = PolygonOps.intersection(wedges, PolygonOps.union(v0, v1));
			addedSection = bridging(PolygonOps.intersection(PolygonOps.difference(mask, a, b), PolygonOps.intersection(v0, v1)));
		}
	}

	/**
	 * Keeps the components of {@code added} that reach both fibers. The finer
	 * virtual circle polygons poke past the fiber chords near their tangency
	 * points, leaving slivers that touch one fiber only.
	 */
	@SuppressWarnings("unchecked")
	private Geometry bridging(Geometry added) {
		if (added.isEmpty()) {
			return added;
		}
		Geometry a = fiberA.getPolygon();
		Geometry b = fiberB.getPolygon();
		double tolerance = CONTACT_TOLERANCE * Math.min(fiberA.getRadius(), fiberB.getRadius());
		List<Polygon> kept = new ArrayList<>();
		for (Polygon p : (List<Polygon>) PolygonExtracter.getPolygons(added)) {
			if (p.isWithinDistance(a, tolerance) && p.isWithinDistance(b, tolerance)) {
				kept.add(p);
			}
		}
		if (kept.size() == added.getNumGeometries()) {
			return added;
		}
		log.trace("Dropped {} sliver(s) from the neck of {}", added.getNumGeometries() - kept.size(), this);
		return PolygonOps.polygonal(PolygonOps.FACTORY.buildGeometry(kept));
	}

	/**
	 * Triangle (apex, p, q) scaled about its apex so that, near the fibers, it
	 * behaves as the unbounded wedge between the rays apex→p and apex→q.
	 */
	private static Geometry wedge(Coordinate apex, Coordinate p, Coordinate q) {
		Geometry triangle = PolygonOps.polygon(apex, p, q);
		if (triangle.isEmpty()) {
			return triangle;
		}
		return AffineTransformation.scaleInstance(MASK_SCALE, MASK_SCALE, apex.x, apex.y).transform(triangle);
	}

	/** Unit normal of the (extended) centre line, oriented as (dy, -dx). */
	private Vector2D perpendicular() {
		LineSegment ext = getExtendedCenterLine();
		return new Vector2D(ext.p1.y - ext.p0.y, ext.p0.x - ext.p1.x).normalize();
	}

	public LineSegment getCenterLine() {
		return new LineSegment(fiberA.getCenter(), fiberB.getCenter());
	}

	/**
	 * The centre line scaled about its midpoint to length
	 * {@code d + rA + rB}.
	 */
	public LineSegment getExtendedCenterLine() {
		LineSegment line = getCenterLine();
		double length = line.getLength();
		double factor = (length + fiberA.getRadius() + fiberB.getRadius()) / length;
		Coordinate mid = line.midPoint();
		Coordinate p0 = new Coordinate(mid.x + (line.p0.x - mid.x) * factor, mid.y + (line.p0.y - mid.y) * factor);
		Coordinate p1 = new Coordinate(mid.x + (line.p1.x - mid.x) * factor, mid.y + (line.p1.y - mid.y) * factor);
		return new LineSegment(p0, p1);
	}

	public double getDistanceBetweenCores() {
		return fiberA.getCenter().distance(fiberB.getCenter());
	}

	/**
	 * Both disks plus the added section, keeping the largest polygon.
	 */
	public Geometry getTotalArea() {
		Geometry total = PolygonOps.union(List.of(fiberA.getPolygon(), fiberB.getPolygon(), addedSection));
		return PolygonOps.largestComponent(total);
	}

	/**
	 * Splits {@code geometry} with the line through {@code position} that is
	 * perpendicular to the centre line.
	 *
	 * @param returnLargest whether to return the largest fragment (else the
	 *                      smallest)
	 */
	public Geometry split(Geometry geometry, Coordinate position, boolean returnLargest) {
		LineSegment line = getCenterLine();
		// centre line re-centred on position, turned a quarter and doubled
		double dx = line.p1.x - line.p0.x;
		double dy = line.p1.y - line.p0.y;
		Coordinate s0 = new Coordinate(position.x + dy, position.y - dx);
		Coordinate s1 = new Coordinate(position.x - dy, position.y + dx);
		return PolygonOps.split(PolygonOps.largestComponent(geometry), s0, s1, returnLargest);
	}

	void recordCoreShift(Vector2D shiftA, Vector2D shiftB) {
		coreShift = new CoreShift(shiftA, shiftB);
	}

	public FiberCircle getFiberA() {
		return fiberA;
	}

	public FiberCircle getFiberB() {
		return fiberB;
	}

	public Topology getTopology() {
		return topology;
	}

	public double getShift() {
		return shift;
	}

	/**
	 * @return the primary and secondary virtual circles, or {@code null} before a
	 *         successful configuration or when the neck is collapsed
	 */
	public List<FiberCircle> getVirtualCircles() {
		return virtualCircles;
	}

	/**
	 * @return the mask of the last configuration, or {@code null}
	 */
	public Geometry getMask() {
		return mask;
	}

	public Geometry getAddedSection() {
		return addedSection;
	}

	/**
	 * The intersection polygon of the two disks. Its own area may be imprecise
	 * near tangency; {@link #getRemovedArea()} is the value used for balancing.
	 */
	public Geometry getRemovedSection() {
		return removedSection;
	}

	/**
	 * {@code area(A) + area(B) - area(A ∪ B)}.
	 */
	public double getRemovedArea() {
		return removedArea;
	}

	/**
	 * @return the core shifts of the latest split evaluation, or {@code null}
	 *         before any
	 */
	public CoreShift getCoreShift() {
		return coreShift;
	}

	public ConnectionSummary summary() {
		return new ConnectionSummary(getDistanceBetweenCores(), topology, shift, addedSection.getArea(), removedArea, getTotalArea().getArea(),
				fiberA.getCenter(), fiberB.getCenter());
	}

	@Override
	public String toString() {
		Coordinate a = fiberA.getCenter();
		Coordinate b = fiberB.getCenter();
		return String.format("PairConnection{A=(%.3f, %.3f), B=(%.3f, %.3f), topology=%s, shift=%.4g}", a.x, a.y, b.x, b.y, topology, shift);
	}

	/**
	 * Displacements of both cores, from their disk centres to the split points.
	 */
	public static final class CoreShift {
		public final Vector2D a;
		public final Vector2D b;

		CoreShift(Vector2D a, Vector2D b) {
			this.a = a;
			this.b = b;
		}

		@Override
		public String toString() {
			return "CoreShift{a=" + a + ", b=" + b + "}";
		}
	}
}
