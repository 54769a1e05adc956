package com.github.micycle1.collapsej.solver;

import java.util.Arrays;

import com.github.micycle1.collapsej.stiffness.BeamElement;

/**
 * Internal state of one active member recovered from the global displacement
 * solution: local end displacements and forces, and the strain energy split
 * into its axial and bending parts.
 */
public final class MemberResponse {

	private final int memberId;
	private final double[] localDisplacements;
	private final double[] localForces;
	private final double axialEnergy;
	private final double bendingEnergy;

	MemberResponse(int memberId, double[] localDisplacements, double[] localForces, double axialEnergy, double bendingEnergy) {
		this.memberId = memberId;
		this.localDisplacements = localDisplacements;
		this.localForces = localForces;
		this.axialEnergy = axialEnergy;
		this.bendingEnergy = bendingEnergy;
	}

	public int getMemberId() {
		return memberId;
	}

	public double[] getLocalDisplacements() {
		return localDisplacements.clone();
	}

	/**
	 * @return the 12 member-end forces {@code k_local · u_local}
	 */
	public double[] getLocalForces() {
		return localForces.clone();
	}

	/**
	 * Axial force N, positive in tension.
	 */
	public double getAxialForce() {
		return localForces[BeamElement.U2];
	}

	public double getStartMoment() {
		return localForces[BeamElement.THETA_Z1];
	}

	public double getEndMoment() {
		return localForces[BeamElement.THETA_Z2];
	}

	/**
	 * Larger-magnitude end moment, as an absolute value.
	 */
	public double getMaxMoment() {
		return Math.max(Math.abs(getStartMoment()), Math.abs(getEndMoment()));
	}

	/**
	 * Change in member length, positive when elongated.
	 */
	public double getAxialDeformation() {
		return localDisplacements[BeamElement.U2] - localDisplacements[BeamElement.U1];
	}

	public double getAxialEnergy() {
		return axialEnergy;
	}

	public double getBendingEnergy() {
		return bendingEnergy;
	}

	/**
	 * Total strain energy, never negative (numerical noise is clamped by the
	 * solver).
	 */
	public double getStrainEnergy() {
		return axialEnergy + bendingEnergy;
	}

	@Override
	public String toString() {
		return "MemberResponse{" + memberId + ", N=" + getAxialForce() + ", Mmax=" + getMaxMoment() + ", U=" + getStrainEnergy() + ", f="
				+ Arrays.toString(localForces) + "}";
	}
}
