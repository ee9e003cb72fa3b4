package com.github.micycle1.fiberfusing;

/**
 * Immutable tuning knobs for fusion geometry and its two optimizers.
 * <p>
 * Instances are obtained from {@link #defaults()} or assembled with
 * {@link #builder()}; every value is validated when the builder is built.
 *
 * @author Michael Carleton
 */
public final class FusionSettings {

	public static final int DEFAULT_CIRCLE_SEGMENTS = 256;
	public static final double DEFAULT_VIRTUAL_CIRCLE_DEVIATION = 1e-4;
	public static final int DEFAULT_MAX_VIRTUAL_CIRCLE_SEGMENTS = 8192;
	public static final double DEFAULT_TOLERANCE_FACTOR = 1e-2;
	public static final double DEFAULT_CORE_TOLERANCE = 1e-10;
	public static final int DEFAULT_MAX_EVALUATIONS = 500;

	private static final FusionSettings DEFAULTS = builder().build();

	private final int circleSegments;
	private final double virtualCircleDeviation;
	private final int maxVirtualCircleSegments;
	private final double toleranceFactor;
	private final double coreTolerance;
	private final double shiftUpperBound;
	private final int maxEvaluations;

	private FusionSettings(Builder b) {
		this.circleSegments = b.circleSegments;
		this.virtualCircleDeviation = b.virtualCircleDeviation;
		this.maxVirtualCircleSegments = b.maxVirtualCircleSegments;
		this.toleranceFactor = b.toleranceFactor;
		this.coreTolerance = b.coreTolerance;
		this.shiftUpperBound = b.shiftUpperBound;
		this.maxEvaluations = b.maxEvaluations;
	}

	public static FusionSettings defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Number of vertices of each fiber's polygonal disk. */
	public int getCircleSegments() {
		return circleSegments;
	}

	/**
	 * Maximum chord deviation of a virtual circle, relative to the smaller fiber
	 * radius of its connection.
	 */
	public double getVirtualCircleDeviation() {
		return virtualCircleDeviation;
	}

	public int getMaxVirtualCircleSegments() {
		return maxVirtualCircleSegments;
	}

	/**
	 * Absolute tolerance of the global shift search, as a fraction of the smallest
	 * center distance.
	 */
	public double getToleranceFactor() {
		return toleranceFactor;
	}

	/** Absolute tolerance on the split parameter of the core optimizer. */
	public double getCoreTolerance() {
		return coreTolerance;
	}

	/**
	 * Upper bound of the global shift search, or {@code NaN} to derive it from the
	 * smallest center distance.
	 */
	public double getShiftUpperBound() {
		return shiftUpperBound;
	}

	public int getMaxEvaluations() {
		return maxEvaluations;
	}

	public Builder toBuilder() {
		return new Builder().circleSegments(circleSegments).virtualCircleDeviation(virtualCircleDeviation)
				.maxVirtualCircleSegments(maxVirtualCircleSegments).toleranceFactor(toleranceFactor).coreTolerance(coreTolerance)
				.shiftUpperBound(shiftUpperBound).maxEvaluations(maxEvaluations);
	}

	@Override
	public String toString() {
		return "FusionSettings{circleSegments=" + circleSegments + ", virtualCircleDeviation=" + virtualCircleDeviation + ", maxVirtualCircleSegments="
				+ maxVirtualCircleSegments + ", toleranceFactor=" + toleranceFactor + ", coreTolerance=" + coreTolerance + ", shiftUpperBound="
				+ shiftUpperBound + ", maxEvaluations=" + maxEvaluations + "}";
	}

	public static final class Builder {

		private int circleSegments = DEFAULT_CIRCLE_SEGMENTS;
		private double virtualCircleDeviation = DEFAULT_VIRTUAL_CIRCLE_DEVIATION;
		private int maxVirtualCircleSegments = DEFAULT_MAX_VIRTUAL_CIRCLE_SEGMENTS;
		private double toleranceFactor = DEFAULT_TOLERANCE_FACTOR;
		private double coreTolerance = DEFAULT_CORE_TOLERANCE;
		private double shiftUpperBound = Double.NaN;
		private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;

		private Builder() {
		}

		public Builder circleSegments(int circleSegments) {
			this.circleSegments = circleSegments;
			return this;
		}

		public Builder virtualCircleDeviation(double virtualCircleDeviation) {
			this.virtualCircleDeviation = virtualCircleDeviation;
			return this;
		}

		public Builder maxVirtualCircleSegments(int maxVirtualCircleSegments) {
			this.maxVirtualCircleSegments = maxVirtualCircleSegments;
			return this;
		}

		public Builder toleranceFactor(double toleranceFactor) {
			this.toleranceFactor = toleranceFactor;
			return this;
		}

		public Builder coreTolerance(double coreTolerance) {
			this.coreTolerance = coreTolerance;
			return this;
		}

		public Builder shiftUpperBound(double shiftUpperBound) {
			this.shiftUpperBound = shiftUpperBound;
			return this;
		}

		public Builder maxEvaluations(int maxEvaluations) {
			this.maxEvaluations = maxEvaluations;
			return this;
		}

		public FusionSettings build() {
			if (circleSegments < FiberCircle.MIN_SEGMENTS) {
				throw new IllegalArgumentException("circleSegments must be >= " + FiberCircle.MIN_SEGMENTS + ": " + circleSegments);
			}
			if (maxVirtualCircleSegments < circleSegments) {
				throw new IllegalArgumentException("maxVirtualCircleSegments must be >= circleSegments: " + maxVirtualCircleSegments);
			}
			requirePositive("virtualCircleDeviation", virtualCircleDeviation);
			requirePositive("toleranceFactor", toleranceFactor);
			requirePositive("coreTolerance", coreTolerance);
			if (!Double.isNaN(shiftUpperBound)) {
				requirePositive("shiftUpperBound", shiftUpperBound);
			}
			if (maxEvaluations < 1) {
				throw new IllegalArgumentException("maxEvaluations must be positive: " + maxEvaluations);
			}
			return new FusionSettings(this);
		}

		private static void requirePositive(String name, double value) {
			if (!(value > 0) || Double.isInfinite(value)) {
				throw new IllegalArgumentException(name + " must be positive and finite: " + value);
			}
		}
	}
}
