package com.github.micycle1.collapsej.collapse;

import java.util.OptionalInt;

/**
 * Consumes the dS/dt series of one run, one value per step, and flags the step
 * at which collapse is judged to occur. Detection is terminal: after the first
 * flag the detector neither re-arms nor un-flags.
 */
public interface CollapseDetector {

	/**
	 * Feeds the entropy rate of {@code step}.
	 *
	 * @return true if collapse has been flagged at this or an earlier step
	 */
	boolean update(int step, double entropyRate);

	boolean isCollapsed();

	/**
	 * @return the flagged step, empty until detection
	 */
	OptionalInt getCollapseStep();

	CollapseMethod getMethod();
}
