package com.github.micycle1.collapsej.model;

import java.util.Objects;

/**
 * Elastic material shared by reference between members of the same grade.
 */
public final class Material {

	/** Structural steel S275: E = 200 GPa, yield 275 MPa. */
	public static final Material STEEL_S275 = new Material("S275 Steel", 200e9, 275e6, 7850.0);
	/** Structural steel S355: E = 200 GPa, yield 355 MPa. */
	public static final Material STEEL_S355 = new Material("S355 Steel", 200e9, 355e6, 7850.0);

	private final String name;
	private final double elasticModulus;
	private final double stressLimit;
	private final double density; // kept for completeness; statics ignore it

	/**
	 * @param name           human-readable grade name
	 * @param elasticModulus Young's modulus E (Pa), must be positive
	 * @param stressLimit    yield / ultimate stress σ_lim (Pa), must be positive
	 * @param density        density (kg/m³), must not be negative
	 * @throws ConfigurationException if a property is out of range
	 */
	public Material(String name, double elasticModulus, double stressLimit, double density) {
		this.name = Objects.requireNonNull(name, "Material name cannot be null");
		if (!(elasticModulus > 0)) {
			throw new ConfigurationException("Material " + name + ": elastic modulus must be positive, got " + elasticModulus);
		}
		if (!(stressLimit > 0)) {
			throw new ConfigurationException("Material " + name + ": stress limit must be positive, got " + stressLimit);
		}
		if (!(density >= 0)) {
			throw new ConfigurationException("Material " + name + ": density cannot be negative, got " + density);
		}
		this.elasticModulus = elasticModulus;
		this.stressLimit = stressLimit;
		this.density = density;
	}

	public String getName() {
		return name;
	}

	public double getElasticModulus() {
		return elasticModulus;
	}

	public double getStressLimit() {
		return stressLimit;
	}

	public double getDensity() {
		return density;
	}

	/**
	 * Same material under another name with a different stress limit.
	 */
	public Material withStressLimit(String newName, double newStressLimit) {
		return new Material(newName, elasticModulus, newStressLimit, density);
	}

	@Override
	public String toString() {
		return "Material{" + name + ", E=" + elasticModulus + ", σlim=" + stressLimit + "}";
	}
}
