package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.index.hprtree.HilbertEncoder;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;
import org.locationtech.jts.shape.fractal.HilbertCode;

/**
 * Polygonal boolean operations used by the fusion geometry.
 * <p>
 * Every operation returns a <em>polygonal</em> geometry: a {@code Polygon}
 * (possibly empty) or a {@code MultiPolygon}. Points and lines that an overlay
 * chain can produce at tangencies are discarded, so an empty result is simply a
 * zero-area section. Overlays run through {@link OverlayNGRobust}, which falls
 * back to snapping when floating-point noding fails.
 *
 * @author Michael Carleton
 */
public final class PolygonOps {

	/** Factory shared by every geometry the library creates. */
	public static final GeometryFactory FACTORY = new GeometryFactory();

	/** Rings whose area is below this fraction of their squared extent are collapsed. */
	private static final double COLLAPSE_TOLERANCE = 1e-14;

	private PolygonOps() {
	}

	/**
	 * @return an empty polygon
	 */
	public static Polygon empty() {
		return FACTORY.createPolygon();
	}

	public static Geometry union(Geometry a, Geometry b) {
		return overlay(a, b, OverlayNG.UNION);
	}

	public static Geometry difference(Geometry a, Geometry b) {
		return overlay(a, b, OverlayNG.DIFFERENCE);
	}

	/**
	 * Subtracts each of {@code others} from {@code a} in turn.
	 */
	public static Geometry difference(Geometry a, Geometry... others) {
		Geometry result = a;
		for (Geometry o : others) {
			if (result.isEmpty()) {
				break;
			}
			result = difference(result, o);
		}
		return polygonal(result);
	}

	public static Geometry intersection(Geometry a, Geometry b) {
		return overlay(a, b, OverlayNG.INTERSECTION);
	}

	private static Geometry overlay(Geometry a, Geometry b, int opCode) {
		return polygonal(OverlayNGRobust.overlay(a, b, opCode));
	}

	/**
	 * Computes the union of many geometries.
	 * <p>
	 * The inputs are ordered by the Hilbert key of their envelope centres so that
	 * neighbouring pieces are merged first, then reduced pairwise. Intermediate
	 * results are kept polygonal.
	 *
	 * @param geoms geometries to merge; the list itself is not modified
	 * @return the polygonal union (empty polygon for an empty input)
	 */
	public static Geometry union(List<? extends Geometry> geoms) {
		List<Geometry> sorted = new ArrayList<>(geoms.size());
		for (Geometry g : geoms) {
			if (!g.isEmpty()) {
				sorted.add(g);
			}
		}
		if (sorted.isEmpty()) {
			return empty();
		}
		if (sorted.size() == 1) {
			return polygonal(sorted.get(0));
		}
		hilbertOrder(sorted);
		return sorted.parallelStream().reduce(PolygonOps::union).orElse(empty());
	}

	/**
	 * Keeps only the polygonal components of a geometry.
	 *
	 * @return a {@code Polygon} if one component remains, a {@code MultiPolygon}
	 *         if several remain, or an empty polygon
	 */
	@SuppressWarnings("unchecked")
	public static Geometry polygonal(Geometry geom) {
		if (geom instanceof Polygon) {
			return geom;
		}
		List<Polygon> polygons = PolygonExtracter.getPolygons(geom);
		polygons.removeIf(Geometry::isEmpty);
		if (polygons.isEmpty()) {
			return empty();
		}
		if (polygons.size() == 1) {
			return polygons.get(0);
		}
		return FACTORY.createMultiPolygon(polygons.toArray(new Polygon[0]));
	}

	/**
	 * @return the polygonal component of {@code geom} with the largest area, or an
	 *         empty polygon
	 */
	@SuppressWarnings("unchecked")
	public static Geometry largestComponent(Geometry geom) {
		List<Polygon> polygons = PolygonExtracter.getPolygons(geom);
		return polygons.stream().max(Comparator.comparingDouble(Geometry::getArea)).map(p -> (Geometry) p).orElse(empty());
	}

	/**
	 * Splits a polygonal geometry with the unbounded line through {@code p0} and
	 * {@code p1}.
	 * <p>
	 * The fragments are the polygon components lying on either side of the line.
	 * When the line misses a single polygon, that polygon is the only fragment and
	 * is returned whatever {@code returnLargest} is.
	 *
	 * @param geom          polygonal geometry to split
	 * @param p0            a point on the line
	 * @param p1            another point on the line
	 * @param returnLargest whether to return the largest fragment (else the
	 *                      smallest)
	 * @return the selected fragment, or an empty polygon for an empty input
	 */
	@SuppressWarnings("unchecked")
	public static Geometry split(Geometry geom, Coordinate p0, Coordinate p1, boolean returnLargest) {
		if (geom.isEmpty()) {
			return empty();
		}
		double dx = p1.x - p0.x;
		double dy = p1.y - p0.y;
		double len = Math.hypot(dx, dy);
		if (len == 0) {
			throw new IllegalArgumentException("Split line endpoints coincide: " + p0);
		}
		double ux = dx / len, uy = dy / len;

		Envelope env = geom.getEnvelopeInternal();
		double diag = Math.hypot(env.getWidth(), env.getHeight());
		double reach = 2 * (diag + env.centre().distance(p0)) + 1;

		List<Polygon> fragments = new ArrayList<>();
		for (int side : new int[] { 1, -1 }) {
			double nx = -uy * side * reach, ny = ux * side * reach;
			Coordinate a = new Coordinate(p0.x - ux * reach, p0.y - uy * reach);
			Coordinate b = new Coordinate(p0.x + ux * reach, p0.y + uy * reach);
			Polygon halfPlane = FACTORY.createPolygon(new Coordinate[] { a, b, new Coordinate(b.x + nx, b.y + ny), new Coordinate(a.x + nx, a.y + ny),
					new Coordinate(a) });
			fragments.addAll(PolygonExtracter.getPolygons(intersection(geom, halfPlane)));
		}
		fragments.removeIf(Geometry::isEmpty);
		Comparator<Polygon> byArea = Comparator.comparingDouble(Geometry::getArea);
		return fragments.stream().max(returnLargest ? byArea : byArea.reversed()).map(p -> (Geometry) p).orElse(empty());
	}

	/**
	 * Creates a polygon from an (unclosed) ring of coordinates. Rings that
	 * enclose no area, such as three collinear points, produce an empty polygon.
	 */
	public static Polygon polygon(Coordinate... ring) {
		if (ring.length < 3) {
			return empty();
		}
		Coordinate[] closed = Arrays.copyOf(ring, ring.length + 1);
		closed[ring.length] = new Coordinate(ring[0]);
		Envelope env = new Envelope();
		for (Coordinate c : ring) {
			env.expandToInclude(c);
		}
		double scale = Math.max(env.getWidth(), env.getHeight());
		if (Math.abs(Area.ofRingSigned(closed)) <= COLLAPSE_TOLERANCE * scale * scale) {
			return empty();
		}
		return FACTORY.createPolygon(closed);
	}

	/**
	 * Orders geometries along a Hilbert curve laid over their combined extent,
	 * keyed by each envelope's centre cell.
	 */
	private static void hilbertOrder(List<Geometry> geoms) {
		Envelope extent = new Envelope();
		geoms.forEach(g -> extent.expandToInclude(g.getEnvelopeInternal()));
		HilbertEncoder encoder = new HilbertEncoder(HilbertCode.level(geoms.size()), extent);
		Map<Geometry, Integer> keys = new IdentityHashMap<>();
		geoms.forEach(g -> keys.put(g, encoder.encode(g.getEnvelopeInternal())));
		geoms.sort(Comparator.comparingInt(keys::get));
	}
}
