package com.github.micycle1.collapsej.stiffness;

import java.util.Set;

import org.ejml.data.DMatrixRMaj;

/**
 * Constrained global system {@code K·u = F} for one load step, together with
 * the context it was assembled for (load factor, contributing members).
 */
public final class GlobalStiffness {

	private final DMatrixRMaj matrix;
	private final double[] loads;
	private final double loadFactor;
	private final Set<Integer> activeMemberIds;

	GlobalStiffness(DMatrixRMaj matrix, double[] loads, double loadFactor, Set<Integer> activeMemberIds) {
		this.matrix = matrix;
		this.loads = loads;
		this.loadFactor = loadFactor;
		this.activeMemberIds = Set.copyOf(activeMemberIds);
	}

	/**
	 * @return the N×N stiffness matrix with boundary conditions applied. Callers
	 *         must not modify it.
	 */
	public DMatrixRMaj getMatrix() {
		return matrix;
	}

	/**
	 * @return the load vector with entries at fixed DOFs zeroed (copy)
	 */
	public double[] getLoads() {
		return loads.clone();
	}

	public double getLoadFactor() {
		return loadFactor;
	}

	public Set<Integer> getActiveMemberIds() {
		return activeMemberIds;
	}

	public int size() {
		return matrix.getNumRows();
	}
}
