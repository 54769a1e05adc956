package com.github.micycle1.collapsej.model;

import java.util.Objects;

/**
 * External nodal force (N) or moment (N·m) at design level (load factor 1).
 */
public final class Load {

	private final int nodeId;
	private final Dof dof;
	private final double magnitude;

	public Load(int nodeId, Dof dof, double magnitude) {
		this.nodeId = nodeId;
		this.dof = Objects.requireNonNull(dof, "Load dof cannot be null");
		if (!Double.isFinite(magnitude)) {
			throw new ConfigurationException("Load magnitude must be finite, got " + magnitude);
		}
		this.magnitude = magnitude;
	}

	public int getNodeId() {
		return nodeId;
	}

	public Dof getDof() {
		return dof;
	}

	public double getMagnitude() {
		return magnitude;
	}

	@Override
	public String toString() {
		return "Load{node=" + nodeId + ", " + dof + ", " + magnitude + "}";
	}
}
