package com.github.micycle1.collapsej.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Member;

/**
 * Result of one static solve: global displacements and the response of every
 * member that contributed stiffness.
 */
public final class EquilibriumSolution {

	private final double loadFactor;
	private final double[] displacements;
	private final Map<Integer, MemberResponse> responses;
	private final int clampedEnergyCount;

	EquilibriumSolution(double loadFactor, double[] displacements, Map<Integer, MemberResponse> responses, int clampedEnergyCount) {
		this.loadFactor = loadFactor;
		this.displacements = displacements;
		this.responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
		this.clampedEnergyCount = clampedEnergyCount;
	}

	public double getLoadFactor() {
		return loadFactor;
	}

	public double[] getDisplacements() {
		return displacements.clone();
	}

	/**
	 * @return responses keyed by member id, in member order; failed members are
	 *         absent
	 */
	public Map<Integer, MemberResponse> getResponses() {
		return responses;
	}

	public MemberResponse getResponse(int memberId) {
		return responses.get(memberId);
	}

	/**
	 * Number of members whose strain energy came out negative beyond tolerance
	 * and was clamped to zero.
	 */
	public int getClampedEnergyCount() {
		return clampedEnergyCount;
	}

	/**
	 * Strain energy of every member of the frame; members without a response
	 * (failed) carry zero.
	 */
	public EnergyField energyField(FrameData frame) {
		Map<Integer, Double> energies = new LinkedHashMap<>();
		for (Member m : frame.getMembers()) {
			MemberResponse r = responses.get(m.getId());
			energies.put(m.getId(), r == null ? 0.0 : r.getStrainEnergy());
		}
		return new EnergyField(energies);
	}

	public double totalEnergy() {
		return responses.values().stream().mapToDouble(MemberResponse::getStrainEnergy).sum();
	}
}
