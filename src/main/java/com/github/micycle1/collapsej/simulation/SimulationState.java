package com.github.micycle1.collapsej.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import com.github.micycle1.collapsej.entropy.EntropyMetrics;
import com.github.micycle1.collapsej.solver.EnergyField;
import com.github.micycle1.collapsej.solver.FailureEvent;

/**
 * Mutable record of a run in progress. Owned by a single
 * {@link SimulationRunner} invocation.
 */
public class SimulationState {

	private double loadFactor;
	private Set<Integer> activeMemberIds = Collections.emptySet();
	private final List<EnergyField> energyHistory = new ArrayList<>();
	private final List<EntropyMetrics> entropyHistory = new ArrayList<>();
	private final List<FailureEvent> failureLog = new ArrayList<>();
	private Integer collapseStep;
	private int numericAnomalyCount;

	public double getLoadFactor() {
		return loadFactor;
	}

	void setLoadFactor(double loadFactor) {
		this.loadFactor = loadFactor;
	}

	public Set<Integer> getActiveMemberIds() {
		return activeMemberIds;
	}

	void setActiveMemberIds(Set<Integer> activeMemberIds) {
		this.activeMemberIds = Set.copyOf(activeMemberIds);
	}

	public List<EnergyField> getEnergyHistory() {
		return Collections.unmodifiableList(energyHistory);
	}

	public List<EntropyMetrics> getEntropyHistory() {
		return Collections.unmodifiableList(entropyHistory);
	}

	/**
	 * @return the latest entropy measurement, or null before the first step
	 */
	public EntropyMetrics lastEntropy() {
		return entropyHistory.isEmpty() ? null : entropyHistory.get(entropyHistory.size() - 1);
	}

	public List<FailureEvent> getFailureLog() {
		return Collections.unmodifiableList(failureLog);
	}

	public OptionalInt getCollapseStep() {
		return collapseStep == null ? OptionalInt.empty() : OptionalInt.of(collapseStep);
	}

	/**
	 * Number of member energies that came out negative beyond round-off and were
	 * clamped to zero.
	 */
	public int getNumericAnomalyCount() {
		return numericAnomalyCount;
	}

	void record(EnergyField energy, EntropyMetrics metrics, List<FailureEvent> failures) {
		energyHistory.add(energy);
		entropyHistory.add(metrics);
		failureLog.addAll(failures);
	}

	void markCollapsed(int step) {
		if (collapseStep != null) {
			throw new IllegalStateException("Collapse already recorded at step " + collapseStep);
		}
		collapseStep = step;
	}

	void addNumericAnomalies(int count) {
		numericAnomalyCount += count;
	}
}
