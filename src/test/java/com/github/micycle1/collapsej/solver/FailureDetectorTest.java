package com.github.micycle1.collapsej.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.github.micycle1.collapsej.frames.PrattBridgeFrame;
import com.github.micycle1.collapsej.frames.SimpleBeamFrame;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Member;
import com.github.micycle1.collapsej.stiffness.StiffnessAssembler;

class FailureDetectorTest {

	private static final double DELTA = 1e-12;

	private final FailureDetector detector = new FailureDetector();

	/**
	 * Response with the same end moment at both ends and the given axial force.
	 */
	private static MemberResponse response(int id, double axialForce, double moment) {
		double[] f = new double[12];
		f[0] = -axialForce;
		f[6] = axialForce;
		f[5] = moment;
		f[11] = -moment;
		return new MemberResponse(id, new double[12], f, 0, 0);
	}

	private static EquilibriumSolution solution(double loadFactor, MemberResponse... responses) {
		Map<Integer, MemberResponse> map = new LinkedHashMap<>();
		for (MemberResponse r : responses) {
			map.put(r.getMemberId(), r);
		}
		return new EquilibriumSolution(loadFactor, new double[0], map, 0);
	}

	@Test
	void testCombinedStress_AxialPlusBending() {
		FrameData frame = new SimpleBeamFrame().build();
		Member m = frame.getMember(0);
		// |N|/A + |M|·c/I with A = 0.01, I = 1e-4, c = 0.1
		double sigma = FailureDetector.combinedStress(m, response(0, -1e5, 2e5));
		assertEquals(1e7 + 2e8, sigma, 1e-3);
		assertEquals((1e7 + 2e8) / 275e6, FailureDetector.stressRatio(m, response(0, -1e5, 2e5)), DELTA);
	}

	@Test
	void testNoFailure_WhenAllWithinCapacity() {
		FrameData frame = new SimpleBeamFrame().build();
		List<FailureEvent> events = detector.evaluate(frame, solution(1.0, response(0, 0, 270_000), response(1, 0, 100_000)), 3);
		assertTrue(events.isEmpty());
		assertEquals(Set.of(0, 1), frame.getActiveMemberIds());
	}

	@Test
	void testTie_LowestIdFails() {
		FrameData frame = new SimpleBeamFrame().build();
		List<FailureEvent> events = detector.evaluate(frame, solution(2.0, response(1, 0, 550_000), response(0, 0, 550_000)), 7);
		assertEquals(1, events.size());
		FailureEvent e = events.get(0);
		assertEquals(0, e.getMemberId());
		assertEquals(7, e.getStep());
		assertEquals(2.0, e.getStressRatio(), 1e-9);
		assertEquals(2.0, e.getLoadFactor(), 0.0);
		assertEquals(0, e.getFailureOrder());
		assertFalse(frame.getMember(0).isActive());
		assertTrue(frame.getMember(1).isActive(), "Only one member fails per step");
	}

	@Test
	void testWorstMemberFailsAndOrderAdvances() {
		FrameData frame = new PrattBridgeFrame().build();
		frame.getMember(3).deactivate(0);
		EquilibriumSolution s = solution(1.5, response(0, 8e6, 0), response(5, 1e7, 0), response(12, 0, 1e3));
		List<FailureEvent> events = detector.evaluate(frame, s, 4);
		assertEquals(1, events.size());
		assertEquals(5, events.get(0).getMemberId());
		assertEquals(1, events.get(0).getFailureOrder());
		assertEquals(1, frame.getMember(5).getFailureOrder());
		assertTrue(frame.getMember(0).isActive());
	}

	@Test
	void testFailedMembersAreIgnored() {
		FrameData frame = new SimpleBeamFrame().build();
		frame.getMember(0).deactivate(0);
		List<FailureEvent> events = detector.evaluate(frame, solution(1.0, response(0, 0, 1e7), response(1, 0, 1e3)), 1);
		assertTrue(events.isEmpty());
	}

	@Test
	void testRealSolution_SimpleBeamOverloadFailsMemberZero() throws StructureCollapsedException {
		FrameData frame = new SimpleBeamFrame().build();
		// midspan σ = 125 MPa per unit load factor, so λ = 3 overloads both halves equally
		EquilibriumSolution s = new EquilibriumSolver().solve(new StiffnessAssembler().assemble(frame, 3.0), frame);
		List<FailureEvent> events = detector.evaluate(frame, s, 0);
		assertEquals(1, events.size());
		assertEquals(0, events.get(0).getMemberId());
		assertEquals(375.0 / 275.0, events.get(0).getStressRatio(), 1e-6);
	}
}
