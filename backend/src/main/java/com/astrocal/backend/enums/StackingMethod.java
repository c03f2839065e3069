package com.astrocal.backend.enums;

import com.astrocal.backend.exception.UnsupportedMethodException;

import java.util.Locale;

public enum StackingMethod {
	MEAN("mean"),
	MEDIAN("median"),
	SIGMA("sigma"),
	WINSORIZED("winsorized"),
	MINMAX("minmax"),
	LINEAR_FIT("linear_fit"),
	PERCENTILE_CLIP("percentile_clip"),
	ENTROPY_WEIGHTED("entropy_weighted"),
	SUPERBIAS("superbias"),
	ADAPTIVE("adaptive");

	private final String wireName;

	StackingMethod(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}

	/** Adaptive only selects another method, it never combines pixels itself. */
	public boolean isConcrete() {
		return this != ADAPTIVE;
	}

	public static StackingMethod fromName(String name) throws UnsupportedMethodException {
		if (name != null) {
			String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (StackingMethod method : values()) {
				if (method.wireName.equals(normalized)) {
					return method;
				}
			}
		}
		throw new UnsupportedMethodException("stacking", name);
	}
}
