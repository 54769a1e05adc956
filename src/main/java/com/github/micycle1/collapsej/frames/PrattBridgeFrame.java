package com.github.micycle1.collapsej.frames;

import static com.github.micycle1.collapsej.model.Dof.RX;
import static com.github.micycle1.collapsej.model.Dof.RY;
import static com.github.micycle1.collapsej.model.Dof.UX;
import static com.github.micycle1.collapsej.model.Dof.UY;
import static com.github.micycle1.collapsej.model.Dof.UZ;

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
 * Six-panel Pratt truss bridge, 30 m long and 4 m deep, modelled as a rigid
 * jointed plane frame. Pinned at the left end, roller at the right; the five
 * interior bottom-chord nodes each carry 100 kN.
 * <p>
 * Member ids: bottom chords 0-5, top chords 6-11, verticals 12-18, diagonals
 * 19-24 (each running from bottom node i+1 up to top node i).
 */
public class PrattBridgeFrame implements FrameBuilder {

	public static final String NAME = "pratt_bridge";

	static final int PANELS = 6;
	static final double PANEL_LENGTH = 5.0;
	static final double DEPTH = 4.0;
	static final double PANEL_LOAD = -100_000;

	@Override
	public FrameData build() {
		List<Node> bottom = new ArrayList<>();
		List<Node> top = new ArrayList<>();
		for (int i = 0; i <= PANELS; i++) {
			bottom.add(new Node(i, i * PANEL_LENGTH, 0, 0, supportDofs(i)));
		}
		for (int i = 0; i <= PANELS; i++) {
			top.add(new Node(PANELS + 1 + i, i * PANEL_LENGTH, DEPTH, 0, UZ, RX, RY));
		}

		List<Member> members = new ArrayList<>();
		int id = 0;
		for (int i = 0; i < PANELS; i++) {
			members.add(new Member(id++, bottom.get(i), bottom.get(i + 1), Material.STEEL_S355, 0.0155, 3.65e-4));
		}
		for (int i = 0; i < PANELS; i++) {
			members.add(new Member(id++, top.get(i), top.get(i + 1), Material.STEEL_S355, 0.0123, 2.22e-4));
		}
		for (int i = 0; i <= PANELS; i++) {
			members.add(new Member(id++, bottom.get(i), top.get(i), Material.STEEL_S275, 0.0066, 5.27e-5));
		}
		for (int i = 0; i < PANELS; i++) {
			members.add(new Member(id++, bottom.get(i + 1), top.get(i), Material.STEEL_S355, 0.0114, 1.42e-4));
		}

		List<Load> loads = new ArrayList<>();
		for (int i = 1; i < PANELS; i++) {
			loads.add(new Load(i, UY, PANEL_LOAD));
		}

		List<Node> nodes = new ArrayList<>(bottom);
		nodes.addAll(top);
		return new FrameData(NAME, nodes, members, loads);
	}

	private static Dof[] supportDofs(int bottomIndex) {
		if (bottomIndex == 0) {
			return new Dof[] { UX, UY, UZ, RX, RY };
		}
		if (bottomIndex == PANELS) {
			return new Dof[] { UY, UZ, RX, RY };
		}
		return new Dof[] { UZ, RX, RY };
	}
}
