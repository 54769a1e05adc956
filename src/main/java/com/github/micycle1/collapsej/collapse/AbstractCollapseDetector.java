package com.github.micycle1.collapsej.collapse;

import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the terminal detection state shared by the strategies.
 */
public abstract class AbstractCollapseDetector implements CollapseDetector {

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractCollapseDetector.class);

	private int collapseStep = -1;
	private int lastStep = Integer.MIN_VALUE;

	@Override
	public final boolean update(int step, double entropyRate) {
		if (isCollapsed()) {
			return true;
		}
		if (step <= lastStep) {
			throw new IllegalArgumentException("Steps must increase: got " + step + " after " + lastStep);
		}
		if (!Double.isFinite(entropyRate)) {
			throw new IllegalArgumentException("Entropy rate at step " + step + " is not finite: " + entropyRate);
		}
		lastStep = step;
		if (detect(step, entropyRate)) {
			collapseStep = step;
			LOGGER.info("{} detector flagged collapse at step {} (dS/dt = {})", getMethod().getConfigName(), step, entropyRate);
			return true;
		}
		return false;
	}

	/**
	 * Strategy test for one new value; only called while not yet collapsed.
	 */
	protected abstract boolean detect(int step, double entropyRate);

	@Override
	public final boolean isCollapsed() {
		return collapseStep >= 0;
	}

	@Override
	public final OptionalInt getCollapseStep() {
		return isCollapsed() ? OptionalInt.of(collapseStep) : OptionalInt.empty();
	}
}
