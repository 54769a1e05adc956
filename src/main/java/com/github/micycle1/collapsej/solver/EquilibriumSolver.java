package com.github.micycle1.collapsej.solver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.decomposition.chol.CholeskyDecompositionInner_DDRM;
import org.ejml.dense.row.linsol.chol.LinearSolverChol_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Member;
import com.github.micycle1.collapsej.stiffness.BeamElement;
import com.github.micycle1.collapsej.stiffness.GlobalStiffness;

/**
 * Solves {@code K·u = F} by Cholesky factorisation and recovers the internal
 * state of each member.
 * <p>
 * A constrained stiffness matrix of a stable structure is symmetric positive
 * definite. The solve is refused, with a {@link StructureCollapsedException},
 * when the factorisation breaks down or when some pivot retains less than
 * {@code pivotTolerance} of its original diagonal stiffness, i.e. the DOF is
 * only held by round-off.
 */
public class EquilibriumSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(EquilibriumSolver.class);

	private static final int[] AXIAL_DOFS = { BeamElement.U1, BeamElement.U2 };
	private static final int[] BENDING_DOFS = { BeamElement.V1, BeamElement.THETA_Z1, BeamElement.V2, BeamElement.THETA_Z2 };

	private final double pivotTolerance;

	public EquilibriumSolver() {
		this(CollapseConstants.PIVOT_RATIO_TOL);
	}

	public EquilibriumSolver(double pivotTolerance) {
		if (!(pivotTolerance > 0 && pivotTolerance < 1)) {
			throw new IllegalArgumentException("pivotTolerance must be in (0, 1), got " + pivotTolerance);
		}
		this.pivotTolerance = pivotTolerance;
	}

	/**
	 * Solves the constrained system and evaluates every member that contributed to
	 * it.
	 *
	 * @param system assembled, constrained system
	 * @param frame  the frame the system was assembled from
	 * @return displacements and member responses
	 * @throws StructureCollapsedException if the system is singular or
	 *                                     ill-conditioned beyond tolerance
	 */
	public EquilibriumSolution solve(GlobalStiffness system, FrameData frame) throws StructureCollapsedException {
		Objects.requireNonNull(system);
		Objects.requireNonNull(frame);
		double[] u = solveDisplacements(system);

		Map<Integer, MemberResponse> responses = new LinkedHashMap<>();
		int clamped = 0;
		for (Member member : frame.getMembers()) {
			if (!system.getActiveMemberIds().contains(member.getId())) {
				continue;
			}
			MemberResponse r = recover(member, frame.memberDofs(member), u);
			if (isNumericAnomaly(r)) {
				LOGGER.warn("Member {} has negative strain energy {} J at load factor {}; clamped to zero", member.getId(),
						r.getStrainEnergy(), system.getLoadFactor());
				clamped++;
			}
			responses.put(member.getId(), clampNegativeEnergy(r));
		}
		return new EquilibriumSolution(system.getLoadFactor(), u, responses, clamped);
	}

	/**
	 * Solves {@code K·u = F} for the global displacement vector.
	 *
	 * @throws StructureCollapsedException if {@code K} is not safely positive
	 *                                     definite
	 */
	public double[] solveDisplacements(GlobalStiffness system) throws StructureCollapsedException {
		DMatrixRMaj k = system.getMatrix();
		int n = system.size();

		CholeskyDecompositionInner_DDRM cholesky = new CholeskyDecompositionInner_DDRM(true);
		LinearSolverChol_DDRM solver = new LinearSolverChol_DDRM(cholesky);
		if (!solver.setA(k.copy())) {
			throw collapsed(system, -1, "stiffness matrix is not positive definite");
		}

		DMatrixRMaj l = cholesky.getT(null);
		for (int i = 0; i < n; i++) {
			double pivot = l.get(i, i) * l.get(i, i);
			double ratio = pivot / k.get(i, i);
			if (!(ratio >= pivotTolerance)) {
				throw collapsed(system, i, "pivot ratio " + ratio + " at DOF " + i + " below " + pivotTolerance);
			}
		}

		DMatrixRMaj f = new DMatrixRMaj(n, 1, true, system.getLoads());
		DMatrixRMaj x = new DMatrixRMaj(n, 1);
		solver.solve(f, x);
		double[] u = x.getData().clone();
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(u[i])) {
				throw collapsed(system, i, "non-finite displacement at DOF " + i);
			}
		}
		return u;
	}

	/**
	 * Transforms a member's share of the global displacements to local axes and
	 * evaluates end forces and energy. The ½·uᵀ·k·u quadratic form is split over
	 * the uncoupled axial and bending DOF groups.
	 */
	static MemberResponse recover(Member member, int[] dofs, double[] u) {
		DMatrixRMaj uGlobal = new DMatrixRMaj(dofs.length, 1);
		for (int i = 0; i < dofs.length; i++) {
			uGlobal.set(i, 0, u[dofs[i]]);
		}
		DMatrixRMaj uLocal = new DMatrixRMaj(dofs.length, 1);
		CommonOps_DDRM.mult(BeamElement.transformation(member), uGlobal, uLocal);
		DMatrixRMaj fLocal = new DMatrixRMaj(dofs.length, 1);
		CommonOps_DDRM.mult(BeamElement.localStiffness(member), uLocal, fLocal);

		double[] ul = uLocal.getData();
		double[] fl = fLocal.getData();
		return new MemberResponse(member.getId(), ul.clone(), fl.clone(), halfWork(ul, fl, AXIAL_DOFS), halfWork(ul, fl, BENDING_DOFS));
	}

	/**
	 * True when the response's energy is negative by more than round-off.
	 */
	static boolean isNumericAnomaly(MemberResponse r) {
		return r.getStrainEnergy() < -CollapseConstants.NEGATIVE_ENERGY_TOL;
	}

	/**
	 * Same response with negative axial and bending energies raised to zero.
	 */
	static MemberResponse clampNegativeEnergy(MemberResponse r) {
		if (r.getAxialEnergy() >= 0 && r.getBendingEnergy() >= 0) {
			return r;
		}
		return new MemberResponse(r.getMemberId(), r.getLocalDisplacements(), r.getLocalForces(), Math.max(0, r.getAxialEnergy()),
				Math.max(0, r.getBendingEnergy()));
	}

	private static double halfWork(double[] u, double[] f, int[] dofs) {
		double w = 0;
		for (int d : dofs) {
			w += u[d] * f[d];
		}
		return 0.5 * w;
	}

	private static StructureCollapsedException collapsed(GlobalStiffness system, int dof, String reason) {
		LOGGER.debug("Singular system at load factor {}: {}", system.getLoadFactor(), reason);
		return new StructureCollapsedException(system.getLoadFactor(), system.getActiveMemberIds(), dof, reason);
	}
}
