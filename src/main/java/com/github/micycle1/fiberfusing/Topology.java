package com.github.micycle1.fiberfusing;

/**
 * Shape of the neck formed between fusing fibers.
 */
public enum Topology {
	/** Not yet classified; no neck geometry can be derived. */
	UNDEFINED,
	/**
	 * The overlap removes more glass than the pair's convex envelope could give
	 * back, so the neck bulges outward past the envelope.
	 */
	CONVEX,
	/** The neck curves inward and stays within the pair's convex envelope. */
	CONCAVE;

	/**
	 * Classifies glass that was removed against the most glass a neck confined to
	 * the convex envelope could add.
	 */
	static Topology classify(double removedArea, double limitAddedArea) {
		return removedArea > limitAddedArea ? CONVEX : CONCAVE;
	}
}
