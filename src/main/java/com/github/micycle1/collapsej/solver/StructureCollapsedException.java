package com.github.micycle1.collapsej.solver;

import java.util.Set;
import java.util.TreeSet;

/**
 * Signals that the constrained stiffness matrix is singular or too
 * ill-conditioned to solve: the remaining members no longer form a stable
 * structure. This is an expected terminal outcome of a progressive collapse
 * run, not a defect.
 */
public class StructureCollapsedException extends Exception {

	private static final long serialVersionUID = 1L;

	private final double loadFactor;
	private final Set<Integer> activeMemberIds;
	private final int dofIndex;

	/**
	 * @param loadFactor      load factor of the failed solve
	 * @param activeMemberIds members still active when the matrix became singular
	 * @param dofIndex        global DOF whose pivot vanished, or -1 if unknown
	 * @param reason          short description of the failed check
	 */
	public StructureCollapsedException(double loadFactor, Set<Integer> activeMemberIds, int dofIndex, String reason) {
		super("Structure collapsed at load factor " + loadFactor + " (" + reason + ", " + activeMemberIds.size() + " active members)");
		this.loadFactor = loadFactor;
		this.activeMemberIds = Set.copyOf(new TreeSet<>(activeMemberIds));
		this.dofIndex = dofIndex;
	}

	public double getLoadFactor() {
		return loadFactor;
	}

	public Set<Integer> getActiveMemberIds() {
		return activeMemberIds;
	}

	public int getDofIndex() {
		return dofIndex;
	}
}
