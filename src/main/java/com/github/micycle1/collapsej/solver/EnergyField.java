package com.github.micycle1.collapsej.solver;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Strain energy per member (J), keyed by member id in member order. Immutable.
 */
public final class EnergyField {

	private final Map<Integer, Double> energies;

	public EnergyField(Map<Integer, Double> energies) {
		Objects.requireNonNull(energies, "energies cannot be null");
		LinkedHashMap<Integer, Double> copy = new LinkedHashMap<>(energies);
		copy.forEach((id, u) -> {
			if (u == null || !(u >= 0) || Double.isInfinite(u)) {
				throw new IllegalArgumentException("Energy of member " + id + " must be finite and non-negative, got " + u);
			}
		});
		this.energies = Collections.unmodifiableMap(copy);
	}

	public double get(int memberId) {
		Double u = energies.get(memberId);
		if (u == null) {
			throw new IllegalArgumentException("No energy recorded for member " + memberId);
		}
		return u;
	}

	public boolean contains(int memberId) {
		return energies.containsKey(memberId);
	}

	public Set<Integer> memberIds() {
		return energies.keySet();
	}

	public Map<Integer, Double> asMap() {
		return energies;
	}

	public int size() {
		return energies.size();
	}

	public double total() {
		double sum = 0;
		for (double u : energies.values()) {
			sum += u;
		}
		return sum;
	}

	/**
	 * Sub-field over the given members, keeping this field's order.
	 */
	public EnergyField restrictTo(Collection<Integer> memberIds) {
		Map<Integer, Double> sub = new LinkedHashMap<>();
		energies.forEach((id, u) -> {
			if (memberIds.contains(id)) {
				sub.put(id, u);
			}
		});
		return new EnergyField(sub);
	}

	/**
	 * @return energies in member order
	 */
	public double[] values() {
		return energies.values().stream().mapToDouble(Double::doubleValue).toArray();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof EnergyField)) {
			return false;
		}
		return energies.equals(((EnergyField) o).energies);
	}

	@Override
	public int hashCode() {
		return energies.hashCode();
	}

	@Override
	public String toString() {
		return "EnergyField" + energies;
	}
}
