package com.github.micycle1.fiberfusing;

/**
 * Observer of optimizer evaluations, for diagnostics and tracing.
 * <p>
 * Both callbacks run synchronously inside the optimizers' cost functions, so
 * implementations should be cheap. All methods default to doing nothing.
 */
public interface FusionListener {

	/** A listener that ignores every event. */
	FusionListener NONE = new FusionListener() {
	};

	/**
	 * Called after each trial of the global shift search.
	 *
	 * @param shift       trial virtual shift
	 * @param addedArea   total neck area at that shift
	 * @param removedArea total overlap area (constant over the search)
	 * @param cost        absolute area imbalance
	 */
	default void shiftEvaluated(double shift, double addedArea, double removedArea, double cost) {
	}

	/**
	 * Called after each trial of a connection's core split search.
	 *
	 * @param connection the connection being optimized
	 * @param x          trial split parameter
	 * @param cost       absolute area mismatch of the smaller fragment
	 */
	default void coreEvaluated(PairConnection connection, double x, double cost) {
	}
}
