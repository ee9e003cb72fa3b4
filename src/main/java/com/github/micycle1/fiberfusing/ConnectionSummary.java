package com.github.micycle1.fiberfusing;

import org.locationtech.jts.geom.Coordinate;

/**
 * Diagnostic snapshot of a {@link PairConnection}.
 */
public final class ConnectionSummary {

	public final double distanceBetweenCores;
	public final Topology topology;
	public final double shift;
	/** Area of the connection's own added (neck) section. */
	public final double addedArea;
	/** Overlap area of the two disks. */
	public final double removedArea;
	/** Area of both disks plus the added section. */
	public final double totalArea;
	public final Coordinate centerA;
	public final Coordinate centerB;

	ConnectionSummary(double distanceBetweenCores, Topology topology, double shift, double addedArea, double removedArea, double totalArea,
			Coordinate centerA, Coordinate centerB) {
		this.distanceBetweenCores = distanceBetweenCores;
		this.topology = topology;
		this.shift = shift;
		this.addedArea = addedArea;
		this.removedArea = removedArea;
		this.totalArea = totalArea;
		this.centerA = centerA;
		this.centerB = centerB;
	}

	@Override
	public String toString() {
		return "ConnectionSummary{distanceBetweenCores=" + distanceBetweenCores + ", topology=" + topology + ", shift=" + shift + ", addedArea="
				+ addedArea + ", removedArea=" + removedArea + ", totalArea=" + totalArea + ", centerA=" + centerA + ", centerB=" + centerB + "}";
	}
}
