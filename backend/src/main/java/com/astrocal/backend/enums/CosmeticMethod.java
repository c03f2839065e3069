package com.astrocal.backend.enums;

import com.astrocal.backend.exception.UnsupportedMethodException;

import java.util.Locale;

public enum CosmeticMethod {
	HOT_PIXEL_MAP("hot_pixel_map"),
	LA_COSMIC("la_cosmic");

	private final String wireName;

	CosmeticMethod(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}

	public static CosmeticMethod fromName(String name) throws UnsupportedMethodException {
		if (name != null) {
			String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (CosmeticMethod method : values()) {
				if (method.wireName.equals(normalized)) {
					return method;
				}
			}
		}
		throw new UnsupportedMethodException("cosmetic", name);
	}
}
