package com.github.micycle1.collapsej.stiffness;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.model.Member;
import com.github.micycle1.collapsej.util.Vectors;

/**
 * Element matrices of the 3D two-node Euler-Bernoulli beam.
 * <p>
 * Local DOF order per end node is (u, v, w, θx, θy, θz); indices 0-5 belong to
 * the start node and 6-11 to the end node. The element carries axial stiffness
 * EA/L on u and strong-axis bending (about local z, coupling v and θz). Torsion
 * and weak-axis bending are not modelled: the rows and columns of w, θx and θy
 * stay zero.
 */
public final class BeamElement {

	public static final int U1 = 0, V1 = 1, THETA_Z1 = 5;
	public static final int U2 = 6, V2 = 7, THETA_Z2 = 11;

	private static final int N = CollapseConstants.DOF_PER_MEMBER;

	private BeamElement() {
	}

	/**
	 * 12x12 stiffness matrix in member (local) coordinates.
	 */
	public static DMatrixRMaj localStiffness(Member member) {
		double L = member.getLength();
		double E = member.getMaterial().getElasticModulus();
		double EA = E * member.getArea();
		double EI = E * member.getInertia();

		DMatrixRMaj k = new DMatrixRMaj(N, N);

		// axial
		setSym(k, U1, U1, EA / L);
		setSym(k, U2, U2, EA / L);
		setSym(k, U1, U2, -EA / L);

		// bending in the local x-y plane
		double k12 = 12 * EI / (L * L * L);
		double k6 = 6 * EI / (L * L);
		setSym(k, V1, V1, k12);
		setSym(k, V2, V2, k12);
		setSym(k, V1, V2, -k12);
		setSym(k, V1, THETA_Z1, k6);
		setSym(k, V1, THETA_Z2, k6);
		setSym(k, V2, THETA_Z1, -k6);
		setSym(k, V2, THETA_Z2, -k6);
		setSym(k, THETA_Z1, THETA_Z1, 4 * EI / L);
		setSym(k, THETA_Z2, THETA_Z2, 4 * EI / L);
		setSym(k, THETA_Z1, THETA_Z2, 2 * EI / L);

		return k;
	}

	/**
	 * 12x12 block-diagonal rotation T with {@code u_local = T · u_global}. T is
	 * orthogonal, so its inverse is its transpose.
	 */
	public static DMatrixRMaj transformation(Member member) {
		double[][] r = Vectors.directionCosines(member.getAxis());
		DMatrixRMaj t = new DMatrixRMaj(N, N);
		for (int block = 0; block < 4; block++) {
			int o = 3 * block;
			for (int i = 0; i < 3; i++) {
				for (int j = 0; j < 3; j++) {
					t.set(o + i, o + j, r[i][j]);
				}
			}
		}
		return t;
	}

	/**
	 * Element stiffness in global coordinates, {@code Tᵀ · k · T}.
	 */
	public static DMatrixRMaj globalStiffness(Member member) {
		DMatrixRMaj t = transformation(member);
		DMatrixRMaj k = localStiffness(member);
		DMatrixRMaj tk = new DMatrixRMaj(N, N);
		CommonOps_DDRM.multTransA(t, k, tk);
		DMatrixRMaj kg = new DMatrixRMaj(N, N);
		CommonOps_DDRM.mult(tk, t, kg);
		return kg;
	}

	private static void setSym(DMatrixRMaj k, int i, int j, double v) {
		k.set(i, j, v);
		k.set(j, i, v);
	}
}
