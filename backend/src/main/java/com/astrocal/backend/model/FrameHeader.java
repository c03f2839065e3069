package com.astrocal.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view of the primary header keywords of one exposure. Values are kept as the raw
 * card text and converted on access, the way header consumers usually ask for them.
 */
public final class FrameHeader {

	private static final FrameHeader EMPTY = new FrameHeader(Map.of());

	private final Map<String, String> cards;

	private FrameHeader(Map<String, String> cards) {
		this.cards = cards;
	}

	public static FrameHeader empty() {
		return EMPTY;
	}

	public static FrameHeader of(Map<String, ?> values) {
		Map<String, String> copy = new LinkedHashMap<>();
		values.forEach((key, value) -> {
			if (value != null) {
				copy.put(key.toUpperCase(Locale.ROOT), String.valueOf(value));
			}
		});
		return new FrameHeader(Collections.unmodifiableMap(copy));
	}

	public boolean contains(String key) {
		String value = cards.get(key.toUpperCase(Locale.ROOT));
		return value != null && !value.isBlank();
	}

	public String getString(String key) {
		String value = cards.get(key.toUpperCase(Locale.ROOT));
		return value == null || value.isBlank() ? null : value.trim();
	}

	/**
	 * @return the numeric value of {@code key}, or {@code null} when absent or not a number
	 */
	public Double getDouble(String key) {
		String value = getString(key);
		if (value == null) {
			return null;
		}
		try {
			return Double.parseDouble(value.replace('D', 'E'));
		} catch (NumberFormatException e) {
			return null;
		}
	}

	public double getDouble(String key, double defaultValue) {
		Double value = getDouble(key);
		return value == null ? defaultValue : value;
	}

	public Map<String, String> asMap() {
		return cards;
	}

	@Override
	public String toString() {
		return "FrameHeader" + cards;
	}
}
