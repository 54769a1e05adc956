package com.github.micycle1.collapsej.model;

/**
 * Thrown when a frame definition or a run parameter is malformed. Raised at
 * build / validation time, before any analysis step executes, and never
 * silently corrected.
 */
public class ConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}
}
