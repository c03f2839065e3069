package com.astrocal.backend.enums;

import java.util.Locale;

public enum FrameType {
	BIAS,
	DARK,
	FLAT,
	LIGHT,
	UNKNOWN;

	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Lenient parse used for user supplied hints; anything unrecognised is UNKNOWN.
	 */
	public static FrameType fromName(String name) {
		if (name == null || name.isBlank()) {
			return UNKNOWN;
		}
		for (FrameType type : values()) {
			if (type.name().equalsIgnoreCase(name.trim())) {
				return type;
			}
		}
		return UNKNOWN;
	}

	/**
	 * Looks for a frame type keyword inside a file name or storage path.
	 */
	public static FrameType fromPath(String path) {
		if (path == null) {
			return UNKNOWN;
		}
		String lower = path.toLowerCase(Locale.ROOT);
		if (lower.contains("bias")) {
			return BIAS;
		}
		if (lower.contains("dark")) {
			return DARK;
		}
		if (lower.contains("flat")) {
			return FLAT;
		}
		if (lower.contains("light")) {
			return LIGHT;
		}
		return UNKNOWN;
	}
}
