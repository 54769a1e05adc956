package com.github.micycle1.collapsej.solver;

import java.util.Objects;

/**
 * Log entry for one member failure.
 */
public final class FailureEvent {

	private final int memberId;
	private final int step;
	private final double stressRatio;
	private final double loadFactor;
	private final int failureOrder;

	public FailureEvent(int memberId, int step, double stressRatio, double loadFactor, int failureOrder) {
		this.memberId = memberId;
		this.step = step;
		this.stressRatio = stressRatio;
		this.loadFactor = loadFactor;
		this.failureOrder = failureOrder;
	}

	public int getMemberId() {
		return memberId;
	}

	public int getStep() {
		return step;
	}

	/**
	 * σ_max / σ_lim at the moment of failure, always greater than 1.
	 */
	public double getStressRatio() {
		return stressRatio;
	}

	public double getLoadFactor() {
		return loadFactor;
	}

	public int getFailureOrder() {
		return failureOrder;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FailureEvent)) {
			return false;
		}
		FailureEvent other = (FailureEvent) o;
		return memberId == other.memberId && step == other.step && failureOrder == other.failureOrder
				&& Double.compare(stressRatio, other.stressRatio) == 0 && Double.compare(loadFactor, other.loadFactor) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(memberId, step, stressRatio, loadFactor, failureOrder);
	}

	@Override
	public String toString() {
		return String.format("FailureEvent{member=%d, step=%d, ratio=%.4f, λ=%.4f, order=%d}", memberId, step, stressRatio, loadFactor,
				failureOrder);
	}
}
