package com.astrocal.backend.model;

import com.astrocal.backend.enums.FrameType;
import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.image.ImageBuffer;
import lombok.Builder;
import lombok.Value;

import java.util.function.Function;

@Value
@Builder(toBuilder = true)
public class MasterFrame {
	ImageBuffer image;
	FrameType frameType;
	StackingMethod stackingMethod;
	int framesUsed;
	MasterFrameStats stats;
	@Builder.Default
	double darkScaleFactor = 1.0;

	/**
	 * Returns a new master with every pixel multiplied by {@code factor}. Statistics are
	 * recomputed by {@code statsFunction} on the scaled image.
	 */
	public MasterFrame scaled(double factor, Function<ImageBuffer, MasterFrameStats> statsFunction) {
		ImageBuffer scaledImage = image.multiply(factor);
		return toBuilder()
				.image(scaledImage)
				.stats(statsFunction.apply(scaledImage))
				.darkScaleFactor(darkScaleFactor * factor)
				.build();
	}
}
