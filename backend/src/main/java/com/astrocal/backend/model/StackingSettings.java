package com.astrocal.backend.model;

import com.astrocal.backend.enums.StackingMethod;
import lombok.Builder;
import lombok.Value;

/**
 * Stacking configuration of a single job, fixed at submission time.
 * {@code sigmaThreshold} is optional: each method falls back to its own default.
 */
@Value
@Builder
public class StackingSettings {
	@Builder.Default
	StackingMethod method = StackingMethod.SIGMA;
	Double sigmaThreshold;
	@Builder.Default
	CosmeticSettings cosmetic = CosmeticSettings.disabled();
	String badPixelMapPath;
	boolean autoAcceptRecommendation;
}
