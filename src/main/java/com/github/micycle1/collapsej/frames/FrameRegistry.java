package com.github.micycle1.collapsej.frames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.github.micycle1.collapsej.model.ConfigurationException;
import com.github.micycle1.collapsej.model.FrameBuilder;
import com.github.micycle1.collapsej.model.FrameData;

/**
 * Named frame builders. Comes pre-populated with the bundled example frames.
 */
public class FrameRegistry {

	private final Map<String, FrameBuilder> builders = new LinkedHashMap<>();

	public FrameRegistry() {
		register(SimpleBeamFrame.NAME, new SimpleBeamFrame());
		register(RedundantSpaceFrame.NAME, new RedundantSpaceFrame());
		register(PrattBridgeFrame.NAME, new PrattBridgeFrame());
	}

	/**
	 * @throws ConfigurationException if the name is already taken
	 */
	public void register(String name, FrameBuilder builder) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(builder);
		if (builders.putIfAbsent(name, builder) != null) {
			throw new ConfigurationException("Frame '" + name + "' is already registered");
		}
	}

	public Set<String> names() {
		return Collections.unmodifiableSet(builders.keySet());
	}

	/**
	 * Builds a fresh instance of the named frame.
	 *
	 * @throws ConfigurationException for an unknown name
	 */
	public FrameData build(String name) {
		FrameBuilder builder = builders.get(name);
		if (builder == null) {
			throw new ConfigurationException("Unknown frame '" + name + "'; known frames: " + builders.keySet());
		}
		return builder.build();
	}
}
