package com.github.micycle1.collapsej.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Material;
import com.github.micycle1.collapsej.model.Member;
import com.github.micycle1.collapsej.model.Node;

class EnergyRedistributorTest {

	private static final double DELTA = 1e-9;

	private FrameData frame;

	/**
	 * Chain 0-1-2 plus a detached member 3.
	 */
	@BeforeEach
	void setUp() {
		Node a = new Node(0, 0, 0, 0);
		Node b = new Node(1, 1, 0, 0);
		Node c = new Node(2, 2, 0, 0);
		Node d = new Node(3, 3, 0, 0);
		Node e = new Node(4, 0, 5, 0);
		Node f = new Node(5, 1, 5, 0);
		List<Member> members = List.of( //
				new Member(0, a, b, Material.STEEL_S275, 0.01, 1e-4), //
				new Member(1, b, c, Material.STEEL_S275, 0.01, 1e-4), //
				new Member(2, c, d, Material.STEEL_S275, 0.01, 1e-4), //
				new Member(3, e, f, Material.STEEL_S275, 0.01, 1e-4));
		frame = new FrameData("chain", List.of(a, b, c, d, e, f), members, List.of());
	}

	private static EnergyField field(double u0, double u1, double u2, double u3) {
		return new EnergyField(Map.of(0, u0, 1, u1, 2, u2, 3, u3));
	}

	@Test
	void testAdjacentSurvivorReceivesAll() {
		frame.getMember(0).deactivate(0);
		EnergyField before = field(10, 20, 30, 40);
		EnergyField after = new EnergyRedistributor().redistribute(before, List.of(0), frame);

		assertEquals(0.0, after.get(0), 0.0);
		assertEquals(30.0, after.get(1), DELTA);
		assertEquals(30.0, after.get(2), DELTA);
		assertEquals(40.0, after.get(3), DELTA);
		assertEquals(before.total(), after.total(), DELTA);
		assertEquals(before.memberIds(), after.memberIds(), "Failed members stay in the field with zero energy");
	}

	@Test
	void testSharesProportionalToReceiverEnergy() {
		frame.getMember(1).deactivate(0);
		EnergyField after = new EnergyRedistributor().redistribute(field(10, 40, 30, 1), List.of(1), frame);
		// neighbours 0 and 2 hold 10 and 30 of the 40 J pool
		assertEquals(20.0, after.get(0), DELTA);
		assertEquals(60.0, after.get(2), DELTA);
		assertEquals(1.0, after.get(3), DELTA);
	}

	@Test
	void testEqualSharesWhenReceiversUnloaded() {
		frame.getMember(1).deactivate(0);
		EnergyField after = new EnergyRedistributor().redistribute(field(0, 12, 0, 5), List.of(1), frame);
		assertEquals(6.0, after.get(0), DELTA);
		assertEquals(6.0, after.get(2), DELTA);
		assertEquals(17.0, after.total(), DELTA);
	}

	@Test
	void testIsolatedMemberSpreadsOverAllSurvivors() {
		frame.getMember(3).deactivate(0);
		EnergyField after = new EnergyRedistributor().redistribute(field(10, 20, 30, 40), List.of(3), frame);
		assertEquals(10 + 40.0 / 6, after.get(0), DELTA);
		assertEquals(20 + 80.0 / 6, after.get(1), DELTA);
		assertEquals(50.0, after.get(2), DELTA);
		assertEquals(100.0, after.total(), DELTA);
	}

	@Test
	void testDissipationRemovedBeforeTransfer() {
		frame.getMember(0).deactivate(0);
		EnergyRedistributor redistributor = new EnergyRedistributor(0.25);
		EnergyField after = redistributor.redistribute(field(10, 20, 30, 40), List.of(0), frame);
		assertEquals(27.5, after.get(1), DELTA);
		assertEquals(2.5, redistributor.getLastDissipated(), DELTA);
		assertEquals(97.5, after.total(), DELTA);
	}

	@Test
	void testNoSurvivors_EnergyDissipated() {
		for (int id = 0; id < 4; id++) {
			frame.getMember(id).deactivate(id);
		}
		EnergyRedistributor redistributor = new EnergyRedistributor();
		EnergyField after = redistributor.redistribute(field(0, 0, 0, 8), List.of(3), frame);
		assertEquals(0.0, after.total(), 0.0);
		assertEquals(8.0, redistributor.getLastDissipated(), DELTA);
	}

	@Test
	void testInvalidDissipationRejected() {
		assertThrows(IllegalArgumentException.class, () -> new EnergyRedistributor(-0.1));
		assertThrows(IllegalArgumentException.class, () -> new EnergyRedistributor(1.5));
	}

	@Test
	void testEnergyField_RejectsNegativeEnergy() {
		assertThrows(IllegalArgumentException.class, () -> field(1, -1, 0, 0));
	}
}
