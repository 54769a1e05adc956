package com.github.micycle1.collapsej.util;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.collapsej.CollapseConstants;

/**
 * Small 3D vector helpers on top of JTS {@link Vector3D}, which lacks a cross
 * product.
 */
public final class Vectors {

	public static final Vector3D UNIT_Y = Vector3D.create(0, 1, 0);
	public static final Vector3D UNIT_Z = Vector3D.create(0, 0, 1);

	private Vectors() {
	}

	/**
	 * Vector pointing from {@code from} to {@code to}, including the z ordinate.
	 */
	public static Vector3D between(Coordinate from, Coordinate to) {
		return Vector3D.create(to.getX() - from.getX(), to.getY() - from.getY(), z(to) - z(from));
	}

	public static Vector3D cross(Vector3D a, Vector3D b) {
		return Vector3D.create(a.getY() * b.getZ() - a.getZ() * b.getY(), a.getZ() * b.getX() - a.getX() * b.getZ(),
				a.getX() * b.getY() - a.getY() * b.getX());
	}

	/**
	 * Builds the 3x3 rotation (rows are the local x, y, z axes in global
	 * coordinates) for a member whose unit axis is {@code axis}.
	 * <p>
	 * Local y is Z × x so that members lying in the XY plane bend within that plane
	 * about global Z. Members parallel to Z use global Y as the reference instead.
	 *
	 * @param axis unit vector along the member (start to end)
	 * @return row-major 3x3 direction cosine matrix
	 */
	public static double[][] directionCosines(Vector3D axis) {
		Vector3D x = axis.normalize();
		Vector3D reference = cross(UNIT_Z, x).length() > CollapseConstants.PARALLEL_AXIS_TOL ? UNIT_Z : UNIT_Y;
		Vector3D y = cross(reference, x).normalize();
		Vector3D z = cross(x, y);
		return new double[][] { //
				{ x.getX(), x.getY(), x.getZ() }, //
				{ y.getX(), y.getY(), y.getZ() }, //
				{ z.getX(), z.getY(), z.getZ() } };
	}

	private static double z(Coordinate c) {
		// JTS leaves z as NaN for 2D coordinates
		return Double.isNaN(c.getZ()) ? 0 : c.getZ();
	}
}
