package com.github.micycle1.collapsej.model;

/**
 * Produces the structural model of one scenario. Implementations compile their
 * geometry, materials and loads in; the returned frame must satisfy the
 * node/member reference invariant.
 */
@FunctionalInterface
public interface FrameBuilder {

	FrameData build();
}
