package com.astrocal.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FrameSetStatistics {
	@JsonProperty("n_frames")
	int nFrames;
	double globalVariance;
	/** Share of all samples farther than 5 per-pixel standard deviations from the per-pixel mean. */
	double outlierRatio;
	double mean;
	/** Mean of the per-pixel standard deviations. */
	double std;
}
