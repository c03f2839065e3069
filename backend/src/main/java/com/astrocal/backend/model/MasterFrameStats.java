package com.astrocal.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MasterFrameStats {
	double mean;
	double median;
	double std;
	double min;
	double max;
	double outlierRatio;
	Histogram histogram;
}
