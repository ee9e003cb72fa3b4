package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.math.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the cores of a fused pair towards the split that gives each fiber half
 * of the pair's fused footprint.
 * <p>
 * For a split parameter {@code x}, two points symmetric about the midpoint of
 * the extended centre line are taken at {@code 1 - x} and {@code x}. The fused
 * pair is cut by the line through the first point perpendicular to the centre
 * line, and the cost is how far the smaller fragment is from half of fiber A's
 * area. Once the search converges, both cores are shifted onto the split
 * points.
 *
 * @author Michael Carleton
 */
public class CorePositionOptimizer {

	private static final Logger log = LoggerFactory.getLogger(CorePositionOptimizer.class);

	/** Lower bound of the split search; exactly 0.5 would put both points on the midpoint. */
	static final double LOWER_BOUND = 0.50001;
	static final double UPPER_BOUND = 0.99;
	private static final double RELATIVE_TOLERANCE = 1e-12;

	private final FusionSettings settings;
	private final FusionListener listener;

	public CorePositionOptimizer() {
		this(FusionSettings.defaults(), FusionListener.NONE);
	}

	public CorePositionOptimizer(FusionSettings settings, FusionListener listener) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.listener = Objects.requireNonNull(listener, "listener");
	}

	public List<CoreSolution> optimizeAll(List<PairConnection> connections) {
		return optimizeAll(connections, settings.getCoreTolerance());
	}

	public List<CoreSolution> optimizeAll(List<PairConnection> connections, double tolerance) {
		List<CoreSolution> solutions = new ArrayList<>(connections.size());
		for (PairConnection c : connections) {
			solutions.add(optimize(c, tolerance));
		}
		return solutions;
	}

	/**
	 * Optimizes the split of one connection and, on success, adds the resulting
	 * core shifts to both fibers. On failure the cores keep their prior position.
	 *
	 * @param connection a configured connection
	 * @param tolerance  absolute tolerance on the split parameter
	 */
	public CoreSolution optimize(PairConnection connection, double tolerance) {
		if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
			throw new IllegalArgumentException("tolerance must be positive and finite: " + tolerance);
		}
		final Geometry total = connection.getTotalArea();
		final double target = connection.getFiberA().area() / 2;

		BrentOptimizer optimizer = new BrentOptimizer(RELATIVE_TOLERANCE, tolerance);
		UnivariatePointValuePair result;
		try {
			result = optimizer.optimize(new MaxEval(settings.getMaxEvaluations()), GoalType.MINIMIZE, new SearchInterval(LOWER_BOUND, UPPER_BOUND),
					new UnivariateObjectiveFunction(x -> {
						double cost = cost(connection, total, target, x);
						listener.coreEvaluated(connection, x, cost);
						return cost;
					}));
		} catch (TooManyEvaluationsException e) {
			log.warn("Core position search did not converge for {} within {} evaluations; cores left in place", connection, settings.getMaxEvaluations());
			return new CoreSolution(Double.NaN, Double.NaN, optimizer.getEvaluations(), false);
		}

		// the last evaluation need not be at the accepted point
		double cost = cost(connection, total, target, result.getPoint());
		PairConnection.CoreShift shift = connection.getCoreShift();
		connection.getFiberA().shiftCore(shift.a);
		connection.getFiberB().shiftCore(shift.b);

		CoreSolution solution = new CoreSolution(result.getPoint(), cost, optimizer.getEvaluations(), true);
		log.debug("Core positions of {} optimized: {}", connection, solution);
		return solution;
	}

	/**
	 * Area mismatch at split parameter {@code x}; records the matching core
	 * shifts on the connection.
	 */
	private static double cost(PairConnection connection, Geometry total, double target, double x) {
		LineSegment line = connection.getExtendedCenterLine();
		Coordinate position0 = line.pointAlong(1 - x);
		Coordinate position1 = line.pointAlong(x);

		Geometry smallSection = connection.split(total, position0, false);
		connection.recordCoreShift(new Vector2D(connection.getFiberA().getCenter(), position0),
				new Vector2D(connection.getFiberB().getCenter(), position1));
		return Math.abs(smallSection.getArea() - target);
	}

	/**
	 * Outcome of one connection's split search.
	 */
	public static final class CoreSolution {
		/** Accepted split parameter, {@code NaN} when not converged. */
		public final double x;
		public final double cost;
		public final int evaluations;
		public final boolean converged;

		CoreSolution(double x, double cost, int evaluations, boolean converged) {
			this.x = x;
			this.cost = cost;
			this.evaluations = evaluations;
			this.converged = converged;
		}

		@Override
		public String toString() {
			return "CoreSolution{x=" + x + ", cost=" + cost + ", evaluations=" + evaluations + ", converged=" + converged + "}";
		}
	}
}
