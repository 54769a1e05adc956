package com.github.micycle1.collapsej.collapse;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.model.ConfigurationException;

/**
 * Parameters of the collapse detectors. Each strategy reads only its own
 * fields.
 */
public final class DetectorParams {

	/** Number of previous dS/dt values in the z-score window (default 10). */
	private int windowSize = 10;
	/** Z-score cutoff N (default 3). */
	private double nSigma = 3.0;
	/** Threshold strategy flags dS/dt &lt; −threshold (default 0.5 nats/step). */
	private double threshold = 0.5;
	/** Floor on the rolling standard deviation. */
	private double minSigma = CollapseConstants.MIN_SIGMA;

	public int getWindowSize() {
		return windowSize;
	}

	public DetectorParams setWindowSize(int windowSize) {
		this.windowSize = windowSize;
		return this;
	}

	public double getNSigma() {
		return nSigma;
	}

	public DetectorParams setNSigma(double nSigma) {
		this.nSigma = nSigma;
		return this;
	}

	public double getThreshold() {
		return threshold;
	}

	public DetectorParams setThreshold(double threshold) {
		this.threshold = threshold;
		return this;
	}

	public double getMinSigma() {
		return minSigma;
	}

	public DetectorParams setMinSigma(double minSigma) {
		this.minSigma = minSigma;
		return this;
	}

	/**
	 * @throws ConfigurationException if a parameter used by {@code method} is out
	 *                                of range
	 */
	public void validate(CollapseMethod method) {
		switch (method) {
			case ZSCORE:
				if (windowSize < 2) {
					throw new ConfigurationException("z-score window must hold at least 2 values, got " + windowSize);
				}
				if (!(nSigma > 0)) {
					throw new ConfigurationException("z-score cutoff must be positive, got " + nSigma);
				}
				if (!(minSigma >= 0)) {
					throw new ConfigurationException("minimum sigma cannot be negative, got " + minSigma);
				}
				break;
			case THRESHOLD:
				if (!(threshold >= 0) || Double.isInfinite(threshold)) {
					throw new ConfigurationException("threshold must be a finite non-negative value, got " + threshold);
				}
				break;
			default:
				throw new ConfigurationException("Unsupported collapse method " + method);
		}
	}

	@Override
	public String toString() {
		return "DetectorParams{window=" + windowSize + ", nSigma=" + nSigma + ", threshold=" + threshold + ", minSigma=" + minSigma + "}";
	}
}
