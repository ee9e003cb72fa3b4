package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the fiber pairs that fuse.
 * <p>
 * Only fibers whose disks share interior area are connected; tangent or
 * disjoint fibers never exchange glass, and no chains are formed through
 * intermediate fibers.
 */
public final class ConnectionGraph {

	private static final Logger log = LoggerFactory.getLogger(ConnectionGraph.class);

	private ConnectionGraph() {
	}

	public static List<PairConnection> build(List<FiberCircle> fibers) {
		return build(fibers, FusionSettings.defaults());
	}

	/**
	 * Creates a connection for every unordered pair of overlapping fibers, in
	 * input order (i &lt; j).
	 */
	public static List<PairConnection> build(List<FiberCircle> fibers, FusionSettings settings) {
		List<PairConnection> connections = new ArrayList<>();
		for (int i = 0; i < fibers.size(); i++) {
			FiberCircle fi = fibers.get(i);
			for (int j = i + 1; j < fibers.size(); j++) {
				FiberCircle fj = fibers.get(j);
				if (fi.overlaps(fj)) {
					connections.add(new PairConnection(fi, fj, settings));
				}
			}
		}
		log.debug("Connected {} fiber pairs among {} fibers", connections.size(), fibers.size());
		return connections;
	}
}
