package com.astrocal.backend.stacking;

import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.model.StackingRecommendation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Output of one stacking run. {@code method} is always the concrete method that combined the
 * pixels, {@code requestedMethod} what the caller asked for.
 */
@Value
@Builder
public class StackResult {
	ImageBuffer image;
	StackingMethod method;
	StackingMethod requestedMethod;
	Double threshold;
	StackingRecommendation recommendation;
	@Singular
	List<String> warnings;
	@Singular("diagnostic")
	Map<String, Object> diagnostics;
}
