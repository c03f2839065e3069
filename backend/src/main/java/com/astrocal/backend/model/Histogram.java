package com.astrocal.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Histogram {
	long[] counts;
	/** {@code counts.length + 1} bin edges, the last bin closed on the right. */
	double[] binEdges;
}
