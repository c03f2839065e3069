package com.astrocal.backend.correction;

import com.astrocal.backend.image.ImageBuffer;
import lombok.Value;

@Value
public class CosmicRayResult {
	ImageBuffer cleaned;
	/** Non-zero where a cosmic ray hit was detected. */
	ImageBuffer mask;

	public long flaggedPixels() {
		long count = 0;
		for (int i = 0; i < mask.pixelCount(); i++) {
			if (mask.get(i) != 0) {
				count++;
			}
		}
		return count;
	}
}
