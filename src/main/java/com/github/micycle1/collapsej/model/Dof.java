package com.github.micycle1.collapsej.model;

/**
 * Nodal degrees of freedom, in the order they occupy within a node's block of
 * the global system.
 */
public enum Dof {

	/** Translation along global X. */
	UX,
	/** Translation along global Y. */
	UY,
	/** Translation along global Z. */
	UZ,
	/** Rotation about global X. */
	RX,
	/** Rotation about global Y. */
	RY,
	/** Rotation about global Z. */
	RZ;

	public int index() {
		return ordinal();
	}

	public static Dof fromIndex(int index) {
		if (index < 0 || index >= values().length) {
			throw new ConfigurationException("DOF index must be in [0, 5], got " + index);
		}
		return values()[index];
	}
}
