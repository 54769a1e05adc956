package com.github.micycle1.collapsej.stiffness;

import java.util.Objects;
import java.util.Set;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Member;

/**
 * Builds the global stiffness matrix of a frame from the active members'
 * element matrices and applies the support conditions.
 * <p>
 * Failed members are skipped. This can leave DOFs without any stiffness path;
 * the resulting singular matrix is reported by the solver, not here.
 */
public class StiffnessAssembler {

	private static final Logger LOGGER = LoggerFactory.getLogger(StiffnessAssembler.class);

	/**
	 * Assembles the constrained system for the frame's currently active members.
	 */
	public GlobalStiffness assemble(FrameData frame, double loadFactor) {
		return assemble(frame, frame.getActiveMemberIds(), loadFactor);
	}

	/**
	 * Assembles {@code K} from the given members, builds {@code F} at
	 * {@code loadFactor} times the design loads and applies boundary conditions to
	 * both.
	 *
	 * @param frame           structural model
	 * @param activeMemberIds members contributing stiffness
	 * @param loadFactor      multiplier on the design loads
	 */
	public GlobalStiffness assemble(FrameData frame, Set<Integer> activeMemberIds, double loadFactor) {
		DMatrixRMaj k = assembleUnconstrained(frame, activeMemberIds);
		double[] f = frame.loadVector(loadFactor);
		applyBoundaryConditions(k, f, frame);
		return new GlobalStiffness(k, f, loadFactor, activeMemberIds);
	}

	/**
	 * Sum of the active members' global element matrices, before any support
	 * condition. Symmetric and positive semi-definite.
	 */
	public DMatrixRMaj assembleUnconstrained(FrameData frame, Set<Integer> activeMemberIds) {
		Objects.requireNonNull(frame);
		Objects.requireNonNull(activeMemberIds);
		int n = frame.dofCount();
		DMatrixRMaj k = new DMatrixRMaj(n, n);
		int contributing = 0;
		for (Member member : frame.getMembers()) {
			if (!activeMemberIds.contains(member.getId())) {
				continue;
			}
			DMatrixRMaj ke = BeamElement.globalStiffness(member);
			int[] dofs = frame.memberDofs(member);
			for (int i = 0; i < dofs.length; i++) {
				for (int j = 0; j < dofs.length; j++) {
					k.add(dofs[i], dofs[j], ke.get(i, j));
				}
			}
			contributing++;
		}
		LOGGER.debug("Assembled {}x{} stiffness from {} of {} members", n, n, contributing, frame.getMembers().size());
		if (contributing > 0 && !MatrixFeatures_DDRM.isSymmetric(k, CollapseConstants.SYMMETRY_TOL)) {
			throw new IllegalStateException("Assembled stiffness matrix of " + frame.getName() + " is not symmetric");
		}
		return k;
	}

	/**
	 * For every fixed DOF, zeroes its row and column, puts 1 on the diagonal and
	 * zeroes the load entry. A load given at a restrained DOF is discarded.
	 *
	 * @param k     global stiffness, modified in place
	 * @param f     global load vector, modified in place
	 * @param frame model providing the support conditions
	 */
	public static void applyBoundaryConditions(DMatrixRMaj k, double[] f, FrameData frame) {
		int n = k.getNumRows();
		if (k.getNumCols() != n || f.length != n || n != frame.dofCount()) {
			throw new IllegalArgumentException("System size mismatch: K is " + k.getNumRows() + "x" + k.getNumCols() + ", F has " + f.length
					+ " entries, frame has " + frame.dofCount() + " DOFs");
		}
		for (int dof : frame.fixedDofIndices()) {
			for (int i = 0; i < n; i++) {
				k.set(dof, i, 0);
				k.set(i, dof, 0);
			}
			k.set(dof, dof, 1);
			f[dof] = 0;
		}
	}
}
