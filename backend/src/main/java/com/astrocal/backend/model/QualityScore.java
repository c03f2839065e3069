package com.astrocal.backend.model;

import lombok.Value;

import java.util.List;

@Value
public class QualityScore {
	/** Between 0 and 10 inclusive. */
	double score;
	List<String> recommendations;
}
