package com.github.micycle1.collapsej.collapse;

import java.util.Objects;

/**
 * Creates a fresh detector for one run.
 */
public final class CollapseDetectors {

	private CollapseDetectors() {
	}

	public static CollapseDetector create(String methodName, DetectorParams params) {
		return create(CollapseMethod.fromName(methodName), params);
	}

	public static CollapseDetector create(CollapseMethod method, DetectorParams params) {
		Objects.requireNonNull(method, "method cannot be null");
		Objects.requireNonNull(params, "params cannot be null");
		params.validate(method);
		switch (method) {
			case ZSCORE:
				return new ZScoreCollapseDetector(params);
			case THRESHOLD:
				return new ThresholdCollapseDetector(params.getThreshold());
			default:
				throw new IllegalStateException("Unhandled collapse method " + method);
		}
	}
}
