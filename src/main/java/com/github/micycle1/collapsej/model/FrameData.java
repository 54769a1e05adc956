package com.github.micycle1.collapsej.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.github.micycle1.collapsej.CollapseConstants;

/**
 * The complete structural model of one scenario: nodes, members and design
 * loads. Read-only after construction apart from each member's monotonic active
 * flag.
 * <p>
 * Node ids are arbitrary; global DOF numbering follows node order, so the DOFs
 * of the node at position {@code k} occupy indices {@code 6k .. 6k+5}.
 */
public final class FrameData {

	private final String name;
	private final List<Node> nodes;
	private final List<Member> members;
	private final List<Load> loads;
	private final Map<Integer, Integer> nodeIndex; // node id -> position
	private final Map<Integer, Member> memberById;

	/**
	 * @throws ConfigurationException if ids are duplicated, a member or load
	 *                                references a node that is not part of the
	 *                                frame, or a non-zero load acts on a fixed DOF
	 */
	public FrameData(String name, List<Node> nodes, List<Member> members, List<Load> loads) {
		this.name = Objects.requireNonNull(name, "Frame name cannot be null");
		this.nodes = List.copyOf(nodes);
		this.members = List.copyOf(members);
		this.loads = List.copyOf(loads);

		if (this.nodes.isEmpty()) {
			throw new ConfigurationException("Frame " + name + " has no nodes");
		}
		this.nodeIndex = new LinkedHashMap<>();
		for (int i = 0; i < this.nodes.size(); i++) {
			Node n = this.nodes.get(i);
			if (nodeIndex.put(n.getId(), i) != null) {
				throw new ConfigurationException("Frame " + name + ": duplicate node id " + n.getId());
			}
		}

		this.memberById = new LinkedHashMap<>();
		for (Member m : this.members) {
			if (memberById.put(m.getId(), m) != null) {
				throw new ConfigurationException("Frame " + name + ": duplicate member id " + m.getId());
			}
			requireOwnNode(m, m.getStart());
			requireOwnNode(m, m.getEnd());
		}

		for (Load load : this.loads) {
			Integer idx = nodeIndex.get(load.getNodeId());
			if (idx == null) {
				throw new ConfigurationException("Frame " + name + ": load references unknown node " + load.getNodeId());
			}
			if (load.getMagnitude() != 0 && this.nodes.get(idx).isFixed(load.getDof())) {
				throw new ConfigurationException("Frame " + name + ": load " + load + " acts on a fixed DOF");
			}
		}
	}

	private void requireOwnNode(Member m, Node n) {
		Integer idx = nodeIndex.get(n.getId());
		if (idx == null || nodes.get(idx) != n) {
			throw new ConfigurationException("Frame " + name + ": member " + m.getId() + " references node " + n.getId() + " which is not in the frame");
		}
	}

	public String getName() {
		return name;
	}

	public List<Node> getNodes() {
		return nodes;
	}

	public List<Member> getMembers() {
		return members;
	}

	public List<Load> getLoads() {
		return loads;
	}

	public int dofCount() {
		return CollapseConstants.DOF_PER_NODE * nodes.size();
	}

	public Member getMember(int memberId) {
		Member m = memberById.get(memberId);
		if (m == null) {
			throw new IllegalArgumentException("Member " + memberId + " not found in frame " + name);
		}
		return m;
	}

	/**
	 * Global index of one nodal degree of freedom.
	 */
	public int dofIndex(int nodeId, Dof dof) {
		Integer idx = nodeIndex.get(nodeId);
		if (idx == null) {
			throw new IllegalArgumentException("Node " + nodeId + " not found in frame " + name);
		}
		return CollapseConstants.DOF_PER_NODE * idx + dof.index();
	}

	/**
	 * The 12 global DOF indices of a member, start node block first.
	 */
	public int[] memberDofs(Member member) {
		int[] dofs = new int[CollapseConstants.DOF_PER_MEMBER];
		int s = dofIndex(member.getStart().getId(), Dof.UX);
		int e = dofIndex(member.getEnd().getId(), Dof.UX);
		for (int k = 0; k < CollapseConstants.DOF_PER_NODE; k++) {
			dofs[k] = s + k;
			dofs[k + CollapseConstants.DOF_PER_NODE] = e + k;
		}
		return dofs;
	}

	/**
	 * Global indices of every restrained DOF, ascending.
	 */
	public int[] fixedDofIndices() {
		List<Integer> fixed = new ArrayList<>();
		for (Node n : nodes) {
			for (Dof d : n.getFixedDofs()) {
				fixed.add(dofIndex(n.getId(), d));
			}
		}
		return fixed.stream().mapToInt(Integer::intValue).sorted().toArray();
	}

	/**
	 * Assembles the global load vector scaled by {@code loadFactor}. Loads on the
	 * same DOF accumulate.
	 */
	public double[] loadVector(double loadFactor) {
		double[] f = new double[dofCount()];
		for (Load load : loads) {
			f[dofIndex(load.getNodeId(), load.getDof())] += load.getMagnitude() * loadFactor;
		}
		return f;
	}

	/**
	 * @return ids of the members that have not failed, in member order
	 */
	public Set<Integer> getActiveMemberIds() {
		Set<Integer> ids = new LinkedHashSet<>();
		for (Member m : members) {
			if (m.isActive()) {
				ids.add(m.getId());
			}
		}
		return Collections.unmodifiableSet(ids);
	}

	public boolean allMembersFailed() {
		return members.stream().noneMatch(Member::isActive);
	}

	/**
	 * Members sharing at least one end node with the given member, restricted to
	 * {@code candidates}, in member order.
	 */
	public List<Member> adjacentMembers(int memberId, Set<Integer> candidates) {
		Member m = getMember(memberId);
		List<Member> adjacent = new ArrayList<>();
		for (Member other : members) {
			if (candidates.contains(other.getId()) && m.sharesNodeWith(other)) {
				adjacent.add(other);
			}
		}
		return adjacent;
	}

	/**
	 * Independent working copy: new node and member instances carrying the current
	 * active flags. Analysis runs mutate the copy, never the caller's frame.
	 */
	public FrameData copy() {
		Map<Integer, Node> nodeCopies = new LinkedHashMap<>();
		for (Node n : nodes) {
			nodeCopies.put(n.getId(), new Node(n.getId(), n.getPosition(), n.getFixedDofs()));
		}
		List<Member> memberCopies = new ArrayList<>(members.size());
		for (Member m : members) {
			memberCopies.add(new Member(m, nodeCopies.get(m.getStart().getId()), nodeCopies.get(m.getEnd().getId())));
		}
		return new FrameData(name, new ArrayList<>(nodeCopies.values()), memberCopies, loads);
	}

	@Override
	public String toString() {
		return "FrameData{" + name + ", nodes=" + nodes.size() + ", members=" + members.size() + ", loads=" + loads.size() + "}";
	}
}
