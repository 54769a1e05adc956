package com.github.micycle1.collapsej.frames;

import static com.github.micycle1.collapsej.model.Dof.RX;
import static com.github.micycle1.collapsej.model.Dof.RY;
import static com.github.micycle1.collapsej.model.Dof.UX;
import static com.github.micycle1.collapsej.model.Dof.UY;
import static com.github.micycle1.collapsej.model.Dof.UZ;

import java.util.List;

import com.github.micycle1.collapsej.model.FrameBuilder;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Load;
import com.github.micycle1.collapsej.model.Material;
import com.github.micycle1.collapsej.model.Member;
import com.github.micycle1.collapsej.model.Node;

/**
 * Simply supported 10 m beam in the XY plane, split into two equal members
 * with a 50 kN point load at midspan. Both members carry the same energy, so
 * the first failure goes to member 0 by the lowest-id rule and the remaining
 * half-span is a mechanism.
 */
public class SimpleBeamFrame implements FrameBuilder {

	public static final String NAME = "2d_simple";

	static final double SPAN = 10.0;
	static final double AREA = 0.01;
	static final double INERTIA = 1e-4;
	static final double MIDSPAN_LOAD = -50_000;

	@Override
	public FrameData build() {
		Node left = new Node(0, 0, 0, 0, UX, UY, UZ, RX, RY);
		Node mid = new Node(1, SPAN / 2, 0, 0, UZ, RX, RY);
		Node right = new Node(2, SPAN, 0, 0, UX, UY, UZ, RX, RY);

		List<Member> members = List.of( //
				new Member(0, left, mid, Material.STEEL_S275, AREA, INERTIA), //
				new Member(1, mid, right, Material.STEEL_S275, AREA, INERTIA));
		return new FrameData(NAME, List.of(left, mid, right), members, List.of(new Load(1, UY, MIDSPAN_LOAD)));
	}
}
