package com.github.micycle1.collapsej.entropy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.collapsej.solver.EnergyField;

/**
 * Shannon entropy and Gini concentration of a strain-energy field.
 * <p>
 * With p_i = U_i / ΣU:
 * <ul>
 * <li>S = −Σ p_i ln p_i, where zero shares contribute nothing;</li>
 * <li>S_max = ln n, and S/S_max is reported as 0 when n ≤ 1;</li>
 * <li>Gini = 2·Σ i·p_(i) / n − (n+1)/n over ascending shares, in [0, 1 − 1/n].
 * A single-member field has no concentration to measure and reports 0.</li>
 * </ul>
 * A field with zero total energy has all p_i = 0 and S = 0.
 */
public class EntropyEvaluator {

	private static final Logger LOGGER = LoggerFactory.getLogger(EntropyEvaluator.class);

	/**
	 * Metrics of a field with no predecessor: the rate is reported as 0.
	 */
	public EntropyMetrics evaluate(EnergyField field, int step) {
		return evaluate(field, step, null);
	}

	/**
	 * @param field    energies of the members being measured
	 * @param step     step index of this measurement
	 * @param previous metrics of the preceding measurement, or null on the first
	 *                 step
	 */
	public EntropyMetrics evaluate(EnergyField field, int step, EntropyMetrics previous) {
		Objects.requireNonNull(field);
		Map<Integer, Double> p = shares(field);
		if (field.size() > 0 && field.total() == 0) {
			LOGGER.warn("Step {}: zero total strain energy over {} members; entropy defined as 0", step, field.size());
		}

		double s = shannonEntropy(p.values().stream().mapToDouble(Double::doubleValue).toArray());
		double sMax = maxEntropy(p.size());
		double normalized = sMax == 0 ? 0 : Math.min(1, s / sMax);
		double rate = 0;
		if (previous != null) {
			int dt = step - previous.getStep();
			if (dt <= 0) {
				throw new IllegalArgumentException("Step " + step + " does not follow previous step " + previous.getStep());
			}
			rate = (s - previous.getEntropy()) / dt;
		}
		double gini = gini(p.values().stream().mapToDouble(Double::doubleValue).toArray());
		return new EntropyMetrics(step, s, rate, sMax, normalized, gini, p);
	}

	/**
	 * Normalised energy shares p_i, all zero when the total is zero.
	 */
	public static Map<Integer, Double> shares(EnergyField field) {
		double total = field.total();
		Map<Integer, Double> p = new LinkedHashMap<>();
		field.asMap().forEach((id, u) -> p.put(id, total > 0 ? u / total : 0.0));
		return p;
	}

	public static double shannonEntropy(double[] p) {
		double s = 0;
		for (double pi : p) {
			if (pi > 0) {
				s -= pi * Math.log(pi);
			}
		}
		return Math.max(0, s);
	}

	public static double maxEntropy(int n) {
		return n <= 1 ? 0 : Math.log(n);
	}

	public static double gini(double[] p) {
		int n = p.length;
		if (n <= 1) {
			return 0;
		}
		double[] sorted = p.clone();
		Arrays.sort(sorted);
		double sum = 0;
		double weighted = 0;
		for (int i = 0; i < n; i++) {
			sum += sorted[i];
			weighted += (i + 1) * sorted[i];
		}
		if (sum == 0) {
			return 0;
		}
		double g = 2 * weighted / (n * sum) - (n + 1.0) / n;
		return Math.min(Math.max(g, 0), 1 - 1.0 / n);
	}

	/**
	 * Members holding the largest energy shares, most loaded first; equal shares
	 * keep member order. These are the likely next failures.
	 *
	 * @param field energy field
	 * @param topN  maximum number of entries
	 * @return (member id, p_i) pairs
	 */
	public static List<Pair<Integer, Double>> mostLocalizedMembers(EnergyField field, int topN) {
		if (topN < 0) {
			throw new IllegalArgumentException("topN cannot be negative: " + topN);
		}
		List<Pair<Integer, Double>> ranked = new ArrayList<>();
		shares(field).forEach((id, pi) -> ranked.add(Pair.of(id, pi)));
		ranked.sort(Comparator.comparing((Pair<Integer, Double> e) -> e.getRight()).reversed());
		return new ArrayList<>(ranked.subList(0, Math.min(topN, ranked.size())));
	}
}
