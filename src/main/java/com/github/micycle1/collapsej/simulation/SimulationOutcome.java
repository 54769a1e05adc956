package com.github.micycle1.collapsej.simulation;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.github.micycle1.collapsej.collapse.CollapseMethod;
import com.github.micycle1.collapsej.solver.StructureCollapsedException;

/**
 * Terminal state of a run: either {@code Collapsed(step, cause)} or
 * {@code CompletedWithoutCollapse(finalStep)}.
 */
public final class SimulationOutcome {

	public enum Type {
		COLLAPSED, COMPLETED_WITHOUT_COLLAPSE
	}

	private final Type type;
	private final int step;
	private final CollapseCause cause;
	private final double loadFactor;
	private final Set<Integer> activeMemberIds;

	private SimulationOutcome(Type type, int step, CollapseCause cause, double loadFactor, Set<Integer> activeMemberIds) {
		this.type = type;
		this.step = step;
		this.cause = cause;
		this.loadFactor = loadFactor;
		this.activeMemberIds = Set.copyOf(activeMemberIds);
	}

	public static SimulationOutcome collapsed(int step, CollapseCause cause, double loadFactor, Set<Integer> activeMemberIds) {
		return new SimulationOutcome(Type.COLLAPSED, step, Objects.requireNonNull(cause), loadFactor, activeMemberIds);
	}

	public static SimulationOutcome singular(int step, StructureCollapsedException e) {
		return collapsed(step, CollapseCause.STRUCTURE_SINGULAR, e.getLoadFactor(), e.getActiveMemberIds());
	}

	public static SimulationOutcome detected(int step, CollapseMethod method, double loadFactor, Set<Integer> activeMemberIds) {
		CollapseCause cause = method == CollapseMethod.ZSCORE ? CollapseCause.ENTROPY_ZSCORE : CollapseCause.ENTROPY_THRESHOLD;
		return collapsed(step, cause, loadFactor, activeMemberIds);
	}

	public static SimulationOutcome completed(int finalStep, double loadFactor, Set<Integer> activeMemberIds) {
		return new SimulationOutcome(Type.COMPLETED_WITHOUT_COLLAPSE, finalStep, null, loadFactor, activeMemberIds);
	}

	public Type getType() {
		return type;
	}

	public boolean isCollapsed() {
		return type == Type.COLLAPSED;
	}

	/**
	 * Collapse step, or the final step for a run that completed.
	 */
	public int getStep() {
		return step;
	}

	public Optional<CollapseCause> getCause() {
		return Optional.ofNullable(cause);
	}

	public double getLoadFactor() {
		return loadFactor;
	}

	/**
	 * @return members still active when the run ended
	 */
	public Set<Integer> getActiveMemberIds() {
		return activeMemberIds;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SimulationOutcome)) {
			return false;
		}
		SimulationOutcome other = (SimulationOutcome) o;
		return type == other.type && step == other.step && cause == other.cause && Double.compare(loadFactor, other.loadFactor) == 0
				&& activeMemberIds.equals(other.activeMemberIds);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, step, cause, loadFactor, activeMemberIds);
	}

	@Override
	public String toString() {
		return isCollapsed() ? "Collapsed(" + step + ", " + cause + ", λ=" + loadFactor + ")" : "CompletedWithoutCollapse(" + step + ")";
	}
}
