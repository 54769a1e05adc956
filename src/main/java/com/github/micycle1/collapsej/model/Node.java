package com.github.micycle1.collapsej.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;

/**
 * A frame joint: position in 3D plus the set of restrained degrees of freedom.
 * Immutable.
 */
public final class Node {

	private final int id;
	private final Coordinate position;
	private final Set<Dof> fixedDofs;

	public Node(int id, Coordinate position, Set<Dof> fixedDofs) {
		this.id = id;
		Objects.requireNonNull(position, "Node position cannot be null");
		this.position = new Coordinate(position.getX(), position.getY(), Double.isNaN(position.getZ()) ? 0 : position.getZ());
		EnumSet<Dof> dofs = EnumSet.noneOf(Dof.class);
		dofs.addAll(Objects.requireNonNull(fixedDofs, "fixedDofs cannot be null"));
		this.fixedDofs = Collections.unmodifiableSet(dofs);
	}

	public Node(int id, double x, double y, double z, Dof... fixedDofs) {
		this(id, new Coordinate(x, y, z), fixedDofs.length == 0 ? EnumSet.noneOf(Dof.class) : EnumSet.of(fixedDofs[0], fixedDofs));
	}

	public int getId() {
		return id;
	}

	/**
	 * @return a copy of the node position (x, y, z)
	 */
	public Coordinate getPosition() {
		return position.copy();
	}

	public Set<Dof> getFixedDofs() {
		return fixedDofs;
	}

	public boolean isFixed(Dof dof) {
		return fixedDofs.contains(dof);
	}

	@Override
	public String toString() {
		return "Node{" + id + " " + position + ", fixed=" + fixedDofs + "}";
	}
}
