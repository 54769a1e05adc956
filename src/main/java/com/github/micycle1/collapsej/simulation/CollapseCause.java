package com.github.micycle1.collapsej.simulation;

public enum CollapseCause {

	/**
	 * The stiffness matrix became singular: the remaining members form a
	 * mechanism.
	 */
	STRUCTURE_SINGULAR,

	/**
	 * Every member has failed.
	 */
	ALL_MEMBERS_FAILED,

	/**
	 * The z-score detector flagged an outlying entropy drop.
	 */
	ENTROPY_ZSCORE,

	/**
	 * dS/dt fell below the fixed threshold.
	 */
	ENTROPY_THRESHOLD
}
