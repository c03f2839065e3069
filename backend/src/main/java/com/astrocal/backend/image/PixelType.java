package com.astrocal.backend.image;

/**
 * Sample type an image was stored with on disk. Pixels are always held as doubles in memory;
 * this only records where they came from and how a master gets written back.
 */
public enum PixelType {
	UINT8(8),
	INT16(16),
	INT32(32),
	INT64(64),
	FLOAT32(-32),
	FLOAT64(-64);

	private final int bitpix;

	PixelType(int bitpix) {
		this.bitpix = bitpix;
	}

	public int bitpix() {
		return bitpix;
	}

	public static PixelType fromBitpix(int bitpix) {
		for (PixelType type : values()) {
			if (type.bitpix == bitpix) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unsupported BITPIX value: " + bitpix);
	}
}
