package com.github.micycle1.collapsej;

public class CollapseConstants {

	/** Number of degrees of freedom carried by every node (3 translations, 3 rotations). */
	public static final int DOF_PER_NODE = 6;
	/** Number of degrees of freedom of a two-node beam element. */
	public static final int DOF_PER_MEMBER = 2 * DOF_PER_NODE;

	public static final double ZERO_LENGTH = 1e-12;
	public static final double SYMMETRY_TOL = 1e-9; // relative to the largest entry
	/**
	 * Smallest ratio of a Cholesky pivot to its original diagonal entry before the
	 * stiffness matrix is treated as singular. Mechanisms produce ratios around
	 * machine epsilon.
	 */
	public static final double PIVOT_RATIO_TOL = 1e-10;
	public static final double NEGATIVE_ENERGY_TOL = 1e-9; // Joules
	public static final double CONSERVATION_TOL = 1e-9; // relative to total energy
	public static final double STRESS_RATIO_TIE_TOL = 1e-9;
	public static final double MIN_SIGMA = 1e-9;
	// vertical test for choosing the local reference axis
	public static final double PARALLEL_AXIS_TOL = 1e-9;
}
