package com.astrocal.backend.model;

import com.astrocal.backend.enums.StackingMethod;
import lombok.Value;

@Value
public class StackingRecommendation {
	StackingMethod method;
	double sigma;
	String reason;
}
