package com.github.micycle1.collapsej.simulation;

import java.util.Objects;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.collapse.CollapseMethod;
import com.github.micycle1.collapsej.collapse.DetectorParams;
import com.github.micycle1.collapsej.model.ConfigurationException;

/**
 * Run configuration. Defaults: z-score detection, 100 steps, load factor
 * starting at 1.0 and growing by 0.1 per step, no dissipation at failure.
 */
public final class SimulationParams {

	private CollapseMethod collapseMethod = CollapseMethod.ZSCORE;
	private DetectorParams detectorParams = new DetectorParams();
	private int maxSteps = 100;
	/** Load factor increment per step; 0 holds the design load. */
	private double loadStep = 0.1;
	private double initialLoadFactor = 1.0;
	/** Fraction of a failed member's energy lost instead of redistributed. */
	private double dissipation = 0.0;
	private double pivotTolerance = CollapseConstants.PIVOT_RATIO_TOL;

	public CollapseMethod getCollapseMethod() {
		return collapseMethod;
	}

	public SimulationParams setCollapseMethod(CollapseMethod collapseMethod) {
		this.collapseMethod = Objects.requireNonNull(collapseMethod);
		return this;
	}

	/**
	 * @param name "zscore" or "threshold"
	 * @throws ConfigurationException for any other name
	 */
	public SimulationParams setCollapseMethod(String name) {
		this.collapseMethod = CollapseMethod.fromName(name);
		return this;
	}

	public DetectorParams getDetectorParams() {
		return detectorParams;
	}

	public SimulationParams setDetectorParams(DetectorParams detectorParams) {
		this.detectorParams = Objects.requireNonNull(detectorParams);
		return this;
	}

	public int getMaxSteps() {
		return maxSteps;
	}

	public SimulationParams setMaxSteps(int maxSteps) {
		this.maxSteps = maxSteps;
		return this;
	}

	public double getLoadStep() {
		return loadStep;
	}

	public SimulationParams setLoadStep(double loadStep) {
		this.loadStep = loadStep;
		return this;
	}

	public double getInitialLoadFactor() {
		return initialLoadFactor;
	}

	public SimulationParams setInitialLoadFactor(double initialLoadFactor) {
		this.initialLoadFactor = initialLoadFactor;
		return this;
	}

	public double getDissipation() {
		return dissipation;
	}

	public SimulationParams setDissipation(double dissipation) {
		this.dissipation = dissipation;
		return this;
	}

	public double getPivotTolerance() {
		return pivotTolerance;
	}

	public SimulationParams setPivotTolerance(double pivotTolerance) {
		this.pivotTolerance = pivotTolerance;
		return this;
	}

	/**
	 * Load factor applied at {@code step}.
	 */
	public double loadFactorAt(int step) {
		return initialLoadFactor + step * loadStep;
	}

	/**
	 * @throws ConfigurationException on the first out-of-range value
	 */
	public void validate() {
		if (maxSteps <= 0) {
			throw new ConfigurationException("maxSteps must be positive, got " + maxSteps);
		}
		if (!(loadStep >= 0) || Double.isInfinite(loadStep)) {
			throw new ConfigurationException("loadStep must be finite and non-negative, got " + loadStep);
		}
		if (!(initialLoadFactor >= 0) || Double.isInfinite(initialLoadFactor)) {
			throw new ConfigurationException("initialLoadFactor must be finite and non-negative, got " + initialLoadFactor);
		}
		if (!(dissipation >= 0 && dissipation <= 1)) {
			throw new ConfigurationException("dissipation must be in [0, 1], got " + dissipation);
		}
		if (!(pivotTolerance > 0 && pivotTolerance < 1)) {
			throw new ConfigurationException("pivotTolerance must be in (0, 1), got " + pivotTolerance);
		}
		detectorParams.validate(collapseMethod);
	}

	@Override
	public String toString() {
		return "SimulationParams{" + collapseMethod.getConfigName() + ", " + detectorParams + ", maxSteps=" + maxSteps + ", λ0=" + initialLoadFactor
				+ ", Δλ=" + loadStep + ", dissipation=" + dissipation + "}";
	}
}
