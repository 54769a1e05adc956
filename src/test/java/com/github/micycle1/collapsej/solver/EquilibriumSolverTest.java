package com.github.micycle1.collapsej.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.github.micycle1.collapsej.frames.PrattBridgeFrame;
import com.github.micycle1.collapsej.frames.RedundantSpaceFrame;
import com.github.micycle1.collapsej.frames.SimpleBeamFrame;
import com.github.micycle1.collapsej.model.Dof;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.stiffness.GlobalStiffness;
import com.github.micycle1.collapsej.stiffness.StiffnessAssembler;

class EquilibriumSolverTest {

	private final StiffnessAssembler assembler = new StiffnessAssembler();
	private final EquilibriumSolver solver = new EquilibriumSolver();

	private EquilibriumSolution solve(FrameData frame, double loadFactor) throws StructureCollapsedException {
		return solver.solve(assembler.assemble(frame, loadFactor), frame);
	}

	/**
	 * External work ½·Fᵀu, which equals the summed member strain energy.
	 */
	private static double externalWork(GlobalStiffness system, double[] u) {
		double w = 0;
		double[] f = system.getLoads();
		for (int i = 0; i < u.length; i++) {
			w += f[i] * u[i];
		}
		return 0.5 * w;
	}

	@Test
	void testSimpleBeam_MidspanDeflectionAndSymmetricEnergy() throws StructureCollapsedException {
		FrameData frame = new SimpleBeamFrame().build();
		EquilibriumSolution solution = solve(frame, 1.0);

		// δ = PL³ / 48EI for a simply supported beam
		double expected = -50_000 * Math.pow(10, 3) / (48 * 200e9 * 1e-4);
		double deflection = solution.getDisplacements()[frame.dofIndex(1, Dof.UY)];
		assertEquals(expected, deflection, Math.abs(expected) * 1e-9);

		MemberResponse left = solution.getResponse(0);
		MemberResponse right = solution.getResponse(1);
		assertEquals(left.getStrainEnergy(), right.getStrainEnergy(), left.getStrainEnergy() * 1e-9);
		assertEquals(0.0, left.getAxialForce(), 1e-6);
		// M = PL/4 at midspan
		assertEquals(125_000, left.getMaxMoment(), 1e-3);
		assertEquals(125_000, right.getMaxMoment(), 1e-3);
		assertEquals(0, solution.getClampedEnergyCount());
	}

	@Test
	void testEnergyBalance_OnAllBundledFrames() throws StructureCollapsedException {
		for (FrameData frame : new FrameData[] { new SimpleBeamFrame().build(), new RedundantSpaceFrame().build(),
				new PrattBridgeFrame().build() }) {
			GlobalStiffness system = assembler.assemble(frame, 1.0);
			EquilibriumSolution solution = solver.solve(system, frame);
			double work = externalWork(system, solution.getDisplacements());
			assertTrue(work > 0, frame.getName());
			assertEquals(work, solution.totalEnergy(), work * 1e-8, frame.getName() + ": strain energy should equal external work");
			assertEquals(work, solution.energyField(frame).total(), work * 1e-8);
		}
	}

	@Test
	void testRedundantFrame_LegsShareEnergyEqually() throws StructureCollapsedException {
		FrameData frame = new RedundantSpaceFrame().build();
		EnergyField energy = solve(frame, 1.0).energyField(frame);
		for (int ring = 0; ring < 4; ring++) {
			assertEquals(0.0, energy.get(ring), 1e-9, "Ring members between clamped nodes carry no energy");
		}
		double leg = energy.get(4);
		assertTrue(leg > 0);
		for (int id = 5; id < 8; id++) {
			assertEquals(leg, energy.get(id), leg * 1e-8);
		}
	}

	@Test
	void testResponse_LinearInLoadFactor() throws StructureCollapsedException {
		FrameData frame = new PrattBridgeFrame().build();
		EquilibriumSolution one = solve(frame, 1.0);
		EquilibriumSolution two = solve(frame, 2.0);
		double n1 = one.getResponse(0).getAxialForce();
		assertTrue(n1 > 0, "Bottom chord should be in tension");
		assertEquals(2 * n1, two.getResponse(0).getAxialForce(), Math.abs(n1) * 1e-9);
		assertEquals(4 * one.totalEnergy(), two.totalEnergy(), one.totalEnergy() * 1e-8);
	}

	@Test
	void testAxialDeformation_MatchesChordForce() throws StructureCollapsedException {
		FrameData frame = new PrattBridgeFrame().build();
		MemberResponse chord = solve(frame, 1.0).getResponse(0);
		// δ = N·L / EA
		double expected = chord.getAxialForce() * 5.0 / (200e9 * 0.0155);
		assertTrue(chord.getAxialDeformation() > 0, "Bottom chord should lengthen");
		assertEquals(expected, chord.getAxialDeformation(), Math.abs(expected) * 1e-9);
	}

	@Test
	void testNegativeEnergy_ClampedAndFlagged() {
		double[] zeros = new double[12];
		MemberResponse negative = new MemberResponse(3, zeros, zeros, -2e-3, 1e-3);
		assertTrue(EquilibriumSolver.isNumericAnomaly(negative));

		MemberResponse clamped = EquilibriumSolver.clampNegativeEnergy(negative);
		assertEquals(3, clamped.getMemberId());
		assertEquals(0.0, clamped.getAxialEnergy(), 0.0);
		assertEquals(1e-3, clamped.getBendingEnergy(), 0.0);
		assertFalse(EquilibriumSolver.isNumericAnomaly(clamped));
	}

	@Test
	void testRoundOffEnergy_ClampedWithoutFlag() {
		double[] zeros = new double[12];
		MemberResponse noise = new MemberResponse(4, zeros, zeros, 0, -1e-15);
		assertFalse(EquilibriumSolver.isNumericAnomaly(noise));
		assertEquals(0.0, EquilibriumSolver.clampNegativeEnergy(noise).getStrainEnergy(), 0.0);

		MemberResponse healthy = new MemberResponse(5, zeros, zeros, 1, 2);
		assertTrue(healthy == EquilibriumSolver.clampNegativeEnergy(healthy), "Non-negative responses pass through");
	}

	@Test
	void testSingular_AfterHalfSpanRemoved() {
		FrameData frame = new SimpleBeamFrame().build();
		frame.getMember(0).deactivate(0);
		GlobalStiffness system = assembler.assemble(frame, 1.3);

		StructureCollapsedException e = assertThrows(StructureCollapsedException.class, () -> solver.solve(system, frame));
		assertEquals(1.3, e.getLoadFactor(), 0.0);
		assertEquals(Set.of(1), e.getActiveMemberIds());
	}

	@Test
	void testSingular_NoMembers() {
		FrameData frame = new RedundantSpaceFrame().build();
		GlobalStiffness system = assembler.assemble(frame, Set.of(), 1.0);
		assertThrows(StructureCollapsedException.class, () -> solver.solveDisplacements(system));
	}

	@Test
	void testSolution_OmitsFailedMembers() throws StructureCollapsedException {
		FrameData frame = new PrattBridgeFrame().build();
		frame.getMember(19).deactivate(0);
		EquilibriumSolution solution = solve(frame, 1.0);
		assertFalse(solution.getResponses().containsKey(19));
		assertEquals(0.0, solution.energyField(frame).get(19), 0.0);
	}

	@Test
	void testPivotTolerance_Validated() {
		assertThrows(IllegalArgumentException.class, () -> new EquilibriumSolver(0));
		assertThrows(IllegalArgumentException.class, () -> new EquilibriumSolver(1));
	}
}
