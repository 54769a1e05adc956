package com.github.micycle1.collapsej.frames;

import java.util.ArrayList;
import java.util.List;

import com.github.micycle1.collapsej.model.Dof;
import com.github.micycle1.collapsej.model.FrameBuilder;
import com.github.micycle1.collapsej.model.FrameData;
import com.github.micycle1.collapsej.model.Load;
import com.github.micycle1.collapsej.model.Material;
import com.github.micycle1.collapsej.model.Member;
import com.github.micycle1.collapsej.model.Node;

/**
 * Square pyramid: four clamped base nodes on a 5 m square, tied by a base ring,
 * and four legs meeting at an apex 4 m up that carries 200 kN downwards.
 */
public class RedundantSpaceFrame implements FrameBuilder {

	public static final String NAME = "3d_redundant";

	static final double BASE = 5.0;
	static final double HEIGHT = 4.0;
	static final double AREA = 0.02;
	static final double INERTIA = 2e-4;
	static final double APEX_LOAD = -200_000;

	@Override
	public FrameData build() {
		Dof[] clamped = Dof.values();
		List<Node> nodes = new ArrayList<>();
		nodes.add(new Node(0, 0, 0, 0, clamped));
		nodes.add(new Node(1, BASE, 0, 0, clamped));
		nodes.add(new Node(2, BASE, BASE, 0, clamped));
		nodes.add(new Node(3, 0, BASE, 0, clamped));
		Node apex = new Node(4, BASE / 2, BASE / 2, HEIGHT);
		nodes.add(apex);

		List<Member> members = new ArrayList<>();
		int id = 0;
		for (int i = 0; i < 4; i++) {
			members.add(new Member(id++, nodes.get(i), nodes.get((i + 1) % 4), Material.STEEL_S275, AREA, INERTIA));
		}
		for (int i = 0; i < 4; i++) {
			members.add(new Member(id++, nodes.get(i), apex, Material.STEEL_S275, AREA, INERTIA));
		}
		return new FrameData(NAME, nodes, members, List.of(new Load(apex.getId(), Dof.UZ, APEX_LOAD)));
	}
}
