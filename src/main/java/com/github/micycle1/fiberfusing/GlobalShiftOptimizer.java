package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the single virtual shift that conserves glass area over a whole fiber
 * cluster.
 * <p>
 * Every neck in a cluster forms during the same draw, so all connections share
 * one shift and one topology. The search minimizes
 * {@code |addedArea(shift) - removedArea|} over {@code [0, upperBound]} with a
 * bounded Brent search, where {@code addedArea} is the area of the union of all
 * added sections outside the fibers and {@code removedArea} is the overlap
 * lost when the disks merge.
 * <p>
 * The optimizer holds no state between calls; it configures the connections it
 * is given and leaves them configured at the returned shift.
 *
 * @author Michael Carleton
 */
public class GlobalShiftOptimizer {

	private static final Logger log = LoggerFactory.getLogger(GlobalShiftOptimizer.class);

	/** Default upper search bound, as a multiple of the smallest centre distance. */
	static final double UPPER_BOUND_FACTOR = 1e3;
	private static final double RELATIVE_TOLERANCE = 1e-12;

	private final FusionSettings settings;
	private final FusionListener listener;

	public GlobalShiftOptimizer() {
		this(FusionSettings.defaults(), FusionListener.NONE);
	}

	public GlobalShiftOptimizer(FusionSettings settings, FusionListener listener) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.listener = Objects.requireNonNull(listener, "listener");
	}

	public ShiftSolution findShift(List<PairConnection> connections) {
		return findShift(connections, settings.getToleranceFactor());
	}

	/**
	 * Searches for the area-conserving shift.
	 *
	 * @param connections     the connections of one cluster
	 * @param toleranceFactor absolute shift tolerance, as a fraction of the
	 *                        smallest centre distance
	 * @return the solution; shift {@code 0} when there are no connections
	 */
	public ShiftSolution findShift(List<PairConnection> connections, double toleranceFactor) {
		if (!(toleranceFactor > 0) || Double.isInfinite(toleranceFactor)) {
			throw new IllegalArgumentException("toleranceFactor must be positive and finite: " + toleranceFactor);
		}
		if (connections.isEmpty()) {
			log.info("No connected fibers; nothing to fuse");
			return new ShiftSolution(0, Topology.UNDEFINED, 0, 0, 0, 0, true);
		}

		List<FiberCircle> fibers = distinctFibers(connections);
		List<Geometry> disks = new ArrayList<>(fibers.size());
		double diskArea = 0;
		for (FiberCircle f : fibers) {
			disks.add(f.getPolygon());
			diskArea += f.area();
		}
		final Geometry fiberUnion = PolygonOps.union(disks);
		final double removedArea = diskArea - fiberUnion.getArea();
		final Topology topology = assemblyTopology(connections);

		double minDistance = Double.POSITIVE_INFINITY;
		for (PairConnection c : connections) {
			minDistance = Math.min(minDistance, c.getDistanceBetweenCores());
		}
		double upperBound = Double.isNaN(settings.getShiftUpperBound()) ? minDistance * UPPER_BOUND_FACTOR : settings.getShiftUpperBound();

		// Brent reports only its final point; keep the best trial for the fallback
		final double[] best = { Double.NaN, Double.POSITIVE_INFINITY };
		BrentOptimizer optimizer = new BrentOptimizer(RELATIVE_TOLERANCE, minDistance * toleranceFactor);
		double shift;
		boolean converged;
		try {
			UnivariatePointValuePair result = optimizer.optimize(new MaxEval(settings.getMaxEvaluations()), GoalType.MINIMIZE,
					new SearchInterval(0, upperBound), new UnivariateObjectiveFunction(s -> {
						double added = addedArea(connections, s, topology, fiberUnion);
						double cost = Math.abs(added - removedArea);
						listener.shiftEvaluated(s, added, removedArea, cost);
						if (cost < best[1]) {
							best[0] = s;
							best[1] = cost;
						}
						return cost;
					}));
			shift = result.getPoint();
			converged = true;
		} catch (TooManyEvaluationsException e) {
			log.warn("Virtual shift search did not converge within {} evaluations; using best trial shift {}", settings.getMaxEvaluations(), best[0]);
			shift = best[0];
			converged = false;
		}

		double added = addedArea(connections, shift, topology, fiberUnion);
		ShiftSolution solution = new ShiftSolution(shift, topology, added, removedArea, Math.abs(added - removedArea), optimizer.getEvaluations(),
				converged);
		log.debug("Virtual shift search finished: {}", solution);
		return solution;
	}

	/**
	 * Classifies a whole cluster with the pairwise rule applied to area sums:
	 * convex when the summed overlap of all pairs exceeds the summed neck capacity
	 * of their convex envelopes.
	 */
	public static Topology assemblyTopology(List<PairConnection> connections) {
		if (connections.isEmpty()) {
			return Topology.UNDEFINED;
		}
		double removed = 0;
		double limit = 0;
		for (PairConnection c : connections) {
			removed += c.getRemovedArea();
			limit += c.getLimitAddedSection().getArea();
		}
		return Topology.classify(removed, limit);
	}

	/**
	 * Configures every connection at {@code shift} and returns the union of their
	 * added sections outside the fibers.
	 */
	static Geometry addedSection(List<PairConnection> connections, double shift, Topology topology, Geometry fiberUnion) {
		List<Geometry> sections = new ArrayList<>(connections.size());
		for (PairConnection c : connections) {
			c.configure(shift, topology);
			sections.add(c.getAddedSection());
		}
		return PolygonOps.difference(PolygonOps.union(sections), fiberUnion);
	}

	private static double addedArea(List<PairConnection> connections, double shift, Topology topology, Geometry fiberUnion) {
		return addedSection(connections, shift, topology, fiberUnion).getArea();
	}

	private static List<FiberCircle> distinctFibers(List<PairConnection> connections) {
		Set<FiberCircle> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		List<FiberCircle> fibers = new ArrayList<>();
		for (PairConnection c : connections) {
			if (seen.add(c.getFiberA())) {
				fibers.add(c.getFiberA());
			}
			if (seen.add(c.getFiberB())) {
				fibers.add(c.getFiberB());
			}
		}
		return fibers;
	}

	/**
	 * Outcome of a shift search.
	 */
	public static final class ShiftSolution {
		public final double shift;
		/** Topology applied to every connection during the search. */
		public final Topology topology;
		public final double addedArea;
		public final double removedArea;
		/** {@code |addedArea - removedArea|} at {@link #shift}. */
		public final double cost;
		public final int evaluations;
		/** False when the search ran out of evaluations. */
		public final boolean converged;

		ShiftSolution(double shift, Topology topology, double addedArea, double removedArea, double cost, int evaluations, boolean converged) {
			this.shift = shift;
			this.topology = topology;
			this.addedArea = addedArea;
			this.removedArea = removedArea;
			this.cost = cost;
			this.evaluations = evaluations;
			this.converged = converged;
		}

		@Override
		public String toString() {
			return "ShiftSolution{shift=" + shift + ", topology=" + topology + ", addedArea=" + addedArea + ", removedArea=" + removedArea + ", cost="
					+ cost + ", evaluations=" + evaluations + ", converged=" + converged + "}";
		}
	}
}
