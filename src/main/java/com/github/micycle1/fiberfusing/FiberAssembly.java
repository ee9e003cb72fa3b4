package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.fiberfusing.GlobalShiftOptimizer.ShiftSolution;

/**
 * A cluster of fibers fused into one cross-section.
 * <p>
 * Fibers are appended, then {@link #build()} connects overlapping pairs, finds
 * the area-conserving virtual shift, displaces the cores and merges everything
 * into the fused polygon. Build results are cached until the fibers change:
 * appending or transforming fibers in place bumps a version counter, after
 * which the results must be rebuilt before they can be read again.
 *
 * <pre>{@code
 * FiberAssembly assembly = new FiberAssembly();
 * FiberLayouts.ring(3, 62.5, 0).forEach(assembly::addFiber);
 * assembly.applyFusionDegree(0.6);
 * Geometry fused = assembly.build().getFusedPolygon();
 * }</pre>
 *
 * @author Michael Carleton
 */
public class FiberAssembly {

	private static final Logger log = LoggerFactory.getLogger(FiberAssembly.class);

	private static final double NECK_FACTOR = 2 - Math.sqrt(2);

	private final FusionSettings settings;
	private final FusionListener listener;
	private final List<FiberCircle> fibers = new ArrayList<>();

	private long version;
	private long builtVersion = -1;
	private List<PairConnection> connections = List.of();
	private ShiftSolution shiftSolution;
	private Geometry addedSection;
	private Geometry fusedPolygon;

	public FiberAssembly() {
		this(FusionSettings.defaults(), FusionListener.NONE);
	}

	public FiberAssembly(FusionSettings settings) {
		this(settings, FusionListener.NONE);
	}

	public FiberAssembly(FusionSettings settings, FusionListener listener) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.listener = Objects.requireNonNull(listener, "listener");
	}

	/**
	 * Scaling of fiber centres towards the origin for a fusion degree, following
	 * Lacroix's model of symmetric 2x2 fused couplers:
	 * {@code 1 - fusionDegree * (2 - sqrt(2))}.
	 *
	 * @param fusionDegree 0 (touching fibers) to 1 (fully fused)
	 */
	public static double scalingFactor(double fusionDegree) {
		if (!(fusionDegree >= 0 && fusionDegree <= 1)) {
			throw new IllegalArgumentException("fusionDegree must be within [0, 1]: " + fusionDegree);
		}
		return 1 - fusionDegree * NECK_FACTOR;
	}

	public FiberAssembly addFiber(FiberCircle fiber) {
		fibers.add(Objects.requireNonNull(fiber, "fiber"));
		invalidate();
		return this;
	}

	/**
	 * Appends a fiber whose disk uses this assembly's circle resolution.
	 */
	public FiberAssembly addFiber(double x, double y, double radius) {
		return addFiber(new FiberCircle(new Coordinate(x, y), radius, settings.getCircleSegments()));
	}

	/**
	 * Moves the fiber centres towards the origin according to the fusion degree.
	 */
	public FiberAssembly applyFusionDegree(double fusionDegree) {
		double factor = scalingFactor(fusionDegree);
		return transformInPlace(AffineTransformation.scaleInstance(factor, factor));
	}

	/**
	 * Returns a new, unbuilt assembly with the same settings whose fibers are
	 * copies of this assembly's fibers moved by {@code t}. This assembly is left
	 * unchanged.
	 */
	public FiberAssembly transformed(AffineTransformation t) {
		FiberAssembly copy = new FiberAssembly(settings, listener);
		for (FiberCircle f : fibers) {
			copy.fibers.add(f.transformed(t));
		}
		return copy;
	}

	/**
	 * Replaces every fiber with a copy moved by {@code t} and invalidates build
	 * results. Fiber instances previously obtained from {@link #getFibers()} are
	 * no longer part of the assembly.
	 */
	public FiberAssembly transformInPlace(AffineTransformation t) {
		for (int i = 0; i < fibers.size(); i++) {
			fibers.set(i, fibers.get(i).transformed(t));
		}
		invalidate();
		return this;
	}

	private void invalidate() {
		version++;
		connections = List.of();
		shiftSolution = null;
		addedSection = null;
		fusedPolygon = null;
	}

	/**
	 * Computes the fused structure. Cores are reset to their disk centres first,
	 * so repeated builds give the same result.
	 */
	public FiberAssembly build() {
		log.info("Fusing {} fibers", fibers.size());
		for (FiberCircle f : fibers) {
			f.resetCore();
		}

		List<PairConnection> built = ConnectionGraph.build(fibers, settings);
		ShiftSolution solution = new GlobalShiftOptimizer(settings, listener).findShift(built);

		Geometry fiberUnion = getUnfusedPolygon();
		Geometry added = built.isEmpty() ? PolygonOps.empty()
				: GlobalShiftOptimizer.addedSection(built, solution.shift, solution.topology, fiberUnion);

		new CorePositionOptimizer(settings, listener).optimizeAll(built);

		connections = Collections.unmodifiableList(built);
		shiftSolution = solution;
		addedSection = added;
		fusedPolygon = PolygonOps.union(fiberUnion, added);
		builtVersion = version;
		log.info("Fused structure built: shift={}, topology={}, area={}", solution.shift, solution.topology, fusedPolygon.getArea());
		return this;
	}

	public boolean isBuilt() {
		return builtVersion == version;
	}

	private void requireBuilt() {
		if (!isBuilt()) {
			throw new IllegalStateException("Assembly has not been built since its fibers last changed; call build()");
		}
	}

	/**
	 * @return the union of all fiber disks and necks
	 */
	public Geometry getFusedPolygon() {
		requireBuilt();
		return fusedPolygon;
	}

	/**
	 * @return the union of all fiber disks, without any neck
	 */
	public Geometry getUnfusedPolygon() {
		List<Geometry> disks = new ArrayList<>(fibers.size());
		for (FiberCircle f : fibers) {
			disks.add(f.getPolygon());
		}
		return PolygonOps.union(disks);
	}

	/**
	 * @return the union of all necks, outside the fibers
	 */
	public Geometry getAddedSection() {
		requireBuilt();
		return addedSection;
	}

	public List<PairConnection> getConnections() {
		requireBuilt();
		return connections;
	}

	public ShiftSolution getShiftSolution() {
		requireBuilt();
		return shiftSolution;
	}

	public double getShift() {
		return getShiftSolution().shift;
	}

	public List<ConnectionSummary> getConnectionSummaries() {
		requireBuilt();
		List<ConnectionSummary> summaries = new ArrayList<>(connections.size());
		for (PairConnection c : connections) {
			summaries.add(c.summary());
		}
		return summaries;
	}

	public List<FiberCircle> getFibers() {
		return Collections.unmodifiableList(fibers);
	}

	public FusionSettings getSettings() {
		return settings;
	}
}
