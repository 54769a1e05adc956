package com.github.micycle1.collapsej.entropy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-step observables of the strain-energy distribution.
 */
public final class EntropyMetrics {

	private final int step;
	private final double entropy;
	private final double entropyRate;
	private final double maxEntropy;
	private final double normalizedEntropy;
	private final double gini;
	private final Map<Integer, Double> distribution;

	EntropyMetrics(int step, double entropy, double entropyRate, double maxEntropy, double normalizedEntropy, double gini,
			Map<Integer, Double> distribution) {
		this.step = step;
		this.entropy = entropy;
		this.entropyRate = entropyRate;
		this.maxEntropy = maxEntropy;
		this.normalizedEntropy = normalizedEntropy;
		this.gini = gini;
		this.distribution = Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
	}

	public int getStep() {
		return step;
	}

	/** Shannon entropy S (nats). */
	public double getEntropy() {
		return entropy;
	}

	/** Backward difference dS/dt per step; 0 on the first step. */
	public double getEntropyRate() {
		return entropyRate;
	}

	/** ln(n) for the n members measured. */
	public double getMaxEntropy() {
		return maxEntropy;
	}

	public double getNormalizedEntropy() {
		return normalizedEntropy;
	}

	public double getGini() {
		return gini;
	}

	/**
	 * @return energy share p_i per member id
	 */
	public Map<Integer, Double> getDistribution() {
		return distribution;
	}

	public int getMemberCount() {
		return distribution.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof EntropyMetrics)) {
			return false;
		}
		EntropyMetrics other = (EntropyMetrics) o;
		return step == other.step && Double.compare(entropy, other.entropy) == 0 && Double.compare(entropyRate, other.entropyRate) == 0
				&& Double.compare(maxEntropy, other.maxEntropy) == 0 && Double.compare(normalizedEntropy, other.normalizedEntropy) == 0
				&& Double.compare(gini, other.gini) == 0 && distribution.equals(other.distribution);
	}

	@Override
	public int hashCode() {
		return Objects.hash(step, entropy, entropyRate, maxEntropy, normalizedEntropy, gini, distribution);
	}

	@Override
	public String toString() {
		return String.format("EntropyMetrics{step=%d, S=%.6f, dS=%.6f, S/Smax=%.4f, gini=%.4f, n=%d}", step, entropy, entropyRate,
				normalizedEntropy, gini, distribution.size());
	}
}
