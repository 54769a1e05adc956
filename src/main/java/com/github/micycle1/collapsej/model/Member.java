package com.github.micycle1.collapsej.model;

import java.util.Objects;

import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.collapsej.CollapseConstants;
import com.github.micycle1.collapsej.util.Vectors;

/**
 * A two-node Euler-Bernoulli beam member. Every member has the same shape;
 * behaviour differences come only from field values (material, section).
 * <p>
 * The only mutable state is the active flag, which is monotonic: once
 * {@link #deactivate(int)} has been called the member stays failed.
 */
public final class Member {

	private final int id;
	private final Node start;
	private final Node end;
	private final Material material;
	private final double area;
	private final double inertia;
	private final double extremeFiber;
	private final double length;
	private final Vector3D axis; // unit, start -> end

	private boolean active = true;
	private int failureOrder = -1;

	/**
	 * Creates a member whose extreme-fiber distance is approximated by √(I/A), the
	 * radius of gyration of a compact section.
	 */
	public Member(int id, Node start, Node end, Material material, double area, double inertia) {
		this(id, start, end, material, area, inertia, area > 0 && inertia > 0 ? Math.sqrt(inertia / area) : Double.NaN);
	}

	/**
	 * @param id           unique member id
	 * @param start        start node
	 * @param end          end node
	 * @param material     material (shared)
	 * @param area         cross-sectional area A (m²)
	 * @param inertia      second moment of area I about the bending axis (m⁴)
	 * @param extremeFiber distance c from the neutral axis to the extreme fiber (m)
	 * @throws ConfigurationException if a section property is not positive or the
	 *                                member has zero length
	 */
	public Member(int id, Node start, Node end, Material material, double area, double inertia, double extremeFiber) {
		this.id = id;
		this.start = Objects.requireNonNull(start, "Member start node cannot be null");
		this.end = Objects.requireNonNull(end, "Member end node cannot be null");
		this.material = Objects.requireNonNull(material, "Member material cannot be null");
		if (!(area > 0)) {
			throw new ConfigurationException("Member " + id + ": area must be positive, got " + area);
		}
		if (!(inertia > 0)) {
			throw new ConfigurationException("Member " + id + ": second moment of area must be positive, got " + inertia);
		}
		if (!(extremeFiber > 0)) {
			throw new ConfigurationException("Member " + id + ": extreme fiber distance must be positive, got " + extremeFiber);
		}
		this.area = area;
		this.inertia = inertia;
		this.extremeFiber = extremeFiber;

		Vector3D span = Vectors.between(start.getPosition(), end.getPosition());
		this.length = span.length();
		if (length <= CollapseConstants.ZERO_LENGTH) {
			throw new ConfigurationException("Member " + id + " has zero length (nodes " + start.getId() + ", " + end.getId() + ")");
		}
		this.axis = span.divide(length);
	}

	/**
	 * Copy constructor for working copies of a frame. Node references are supplied
	 * by the caller so that the copy points at the copied frame's nodes.
	 */
	Member(Member other, Node start, Node end) {
		this(other.id, start, end, other.material, other.area, other.inertia, other.extremeFiber);
		this.active = other.active;
		this.failureOrder = other.failureOrder;
	}

	public int getId() {
		return id;
	}

	public Node getStart() {
		return start;
	}

	public Node getEnd() {
		return end;
	}

	public Material getMaterial() {
		return material;
	}

	public double getArea() {
		return area;
	}

	public double getInertia() {
		return inertia;
	}

	public double getExtremeFiber() {
		return extremeFiber;
	}

	public double getLength() {
		return length;
	}

	/**
	 * @return unit vector from the start node to the end node
	 */
	public Vector3D getAxis() {
		return axis;
	}

	/**
	 * Axial stiffness EA/L.
	 */
	public double getAxialStiffness() {
		return material.getElasticModulus() * area / length;
	}

	public boolean isActive() {
		return active;
	}

	/**
	 * @return position of this member in the failure sequence (0-based), or -1
	 *         while it is still active
	 */
	public int getFailureOrder() {
		return failureOrder;
	}

	public boolean sharesNodeWith(Member other) {
		return other.id != id && (touches(other.start) || touches(other.end));
	}

	public boolean touches(Node node) {
		return start.getId() == node.getId() || end.getId() == node.getId();
	}

	/**
	 * Marks this member as failed. It contributes no stiffness from now on.
	 *
	 * @param order position of this failure in the run's failure sequence
	 * @throws IllegalStateException if the member has already failed
	 */
	public void deactivate(int order) {
		if (!active) {
			throw new IllegalStateException("Member " + id + " has already failed (order " + failureOrder + ")");
		}
		active = false;
		failureOrder = order;
	}

	@Override
	public String toString() {
		return "Member{" + id + " " + start.getId() + "->" + end.getId() + (active ? "" : ", failed#" + failureOrder) + "}";
	}
}
