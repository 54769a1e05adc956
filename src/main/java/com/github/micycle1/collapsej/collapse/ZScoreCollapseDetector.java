package com.github.micycle1.collapsej.collapse;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive detector. Keeps the last {@code windowSize} dS/dt values and flags
 * the first value below μ − N·σ of that window (population σ, floored at
 * {@code minSigma}). The current value joins the window only after it has been
 * tested, and nothing is flagged until the window is full.
 */
public class ZScoreCollapseDetector extends AbstractCollapseDetector {

	private static final Logger LOGGER = LoggerFactory.getLogger(ZScoreCollapseDetector.class);

	private final int windowSize;
	private final double nSigma;
	private final double minSigma;
	private final Deque<Double> window;

	public ZScoreCollapseDetector(int windowSize, double nSigma, double minSigma) {
		new DetectorParams().setWindowSize(windowSize).setNSigma(nSigma).setMinSigma(minSigma).validate(CollapseMethod.ZSCORE);
		this.windowSize = windowSize;
		this.nSigma = nSigma;
		this.minSigma = minSigma;
		this.window = new ArrayDeque<>(windowSize);
	}

	public ZScoreCollapseDetector(DetectorParams params) {
		this(params.getWindowSize(), params.getNSigma(), params.getMinSigma());
	}

	@Override
	protected boolean detect(int step, double entropyRate) {
		boolean flagged = false;
		if (window.size() == windowSize) {
			double mean = 0;
			for (double v : window) {
				mean += v;
			}
			mean /= windowSize;
			double var = 0;
			for (double v : window) {
				var += (v - mean) * (v - mean);
			}
			double sigma = Math.max(Math.sqrt(var / windowSize), minSigma);
			double z = (entropyRate - mean) / sigma;
			LOGGER.debug("Step {}: dS/dt={}, μ={}, σ={}, z={}", step, entropyRate, mean, sigma, z);
			flagged = z < -nSigma;
		}
		window.addLast(entropyRate);
		if (window.size() > windowSize) {
			window.removeFirst();
		}
		return flagged;
	}

	public int getWindowSize() {
		return windowSize;
	}

	public double getNSigma() {
		return nSigma;
	}

	@Override
	public CollapseMethod getMethod() {
		return CollapseMethod.ZSCORE;
	}
}
