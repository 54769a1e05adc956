package com.github.micycle1.collapsej.collapse;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.github.micycle1.collapsej.model.ConfigurationException;

/**
 * Available collapse detection strategies and their configuration names.
 */
public enum CollapseMethod {

	/**
	 * Adaptive: flags a dS/dt far below the rolling mean of recent values.
	 */
	ZSCORE("zscore"),

	/**
	 * Fixed: flags dS/dt below a calibrated negative threshold.
	 */
	THRESHOLD("threshold");

	private final String configName;

	CollapseMethod(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	/**
	 * @throws ConfigurationException for an unknown name; there is no fallback
	 */
	public static CollapseMethod fromName(String name) {
		if (name != null) {
			String key = name.trim().toLowerCase(Locale.ROOT);
			for (CollapseMethod m : values()) {
				if (m.configName.equals(key)) {
					return m;
				}
			}
		}
		String known = Arrays.stream(values()).map(CollapseMethod::getConfigName).collect(Collectors.joining(", "));
		throw new ConfigurationException("Unknown collapse detection method '" + name + "'. Use one of: " + known);
	}
}
