package com.github.micycle1.collapsej.collapse;

/**
 * Flags the first step with dS/dt &lt; −threshold. Needs calibrating for each
 * structure.
 */
public class ThresholdCollapseDetector extends AbstractCollapseDetector {

	private final double threshold;

	public ThresholdCollapseDetector(double threshold) {
		new DetectorParams().setThreshold(threshold).validate(CollapseMethod.THRESHOLD);
		this.threshold = threshold;
	}

	@Override
	protected boolean detect(int step, double entropyRate) {
		return entropyRate < -threshold;
	}

	public double getThreshold() {
		return threshold;
	}

	@Override
	public CollapseMethod getMethod() {
		return CollapseMethod.THRESHOLD;
	}
}
