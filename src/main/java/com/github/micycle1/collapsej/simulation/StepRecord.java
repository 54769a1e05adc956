package com.github.micycle1.collapsej.simulation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.github.micycle1.collapsej.entropy.EntropyMetrics;
import com.github.micycle1.collapsej.solver.EnergyField;

/**
 * Output of one analysis step.
 */
public final class StepRecord {

	private final int step;
	private final double loadFactor;
	private final double[] displacements;
	private final EnergyField energy;
	private final EntropyMetrics metrics;
	private final List<Integer> newlyFailed;

	public StepRecord(int step, double loadFactor, double[] displacements, EnergyField energy, EntropyMetrics metrics, List<Integer> newlyFailed) {
		this.step = step;
		this.loadFactor = loadFactor;
		this.displacements = displacements.clone();
		this.energy = Objects.requireNonNull(energy);
		this.metrics = Objects.requireNonNull(metrics);
		this.newlyFailed = List.copyOf(newlyFailed);
	}

	public int getStep() {
		return step;
	}

	public double getLoadFactor() {
		return loadFactor;
	}

	public double[] getDisplacements() {
		return displacements.clone();
	}

	/**
	 * Per-member strain energy after any redistribution in this step; failed
	 * members carry zero.
	 */
	public EnergyField getEnergy() {
		return energy;
	}

	public EntropyMetrics getMetrics() {
		return metrics;
	}

	public double getEntropy() {
		return metrics.getEntropy();
	}

	public double getEntropyRate() {
		return metrics.getEntropyRate();
	}

	public double getNormalizedEntropy() {
		return metrics.getNormalizedEntropy();
	}

	public double getGini() {
		return metrics.getGini();
	}

	public List<Integer> getNewlyFailed() {
		return newlyFailed;
	}

	public double getTotalEnergy() {
		return energy.total();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StepRecord)) {
			return false;
		}
		StepRecord other = (StepRecord) o;
		return step == other.step && Double.compare(loadFactor, other.loadFactor) == 0 && Arrays.equals(displacements, other.displacements)
				&& energy.equals(other.energy) && metrics.equals(other.metrics) && newlyFailed.equals(other.newlyFailed);
	}

	@Override
	public int hashCode() {
		return Objects.hash(step, loadFactor, Arrays.hashCode(displacements), energy, metrics, newlyFailed);
	}

	@Override
	public String toString() {
		return String.format("StepRecord{step=%d, λ=%.4f, U=%.6g, %s, failed=%s}", step, loadFactor, getTotalEnergy(), metrics, newlyFailed);
	}
}
