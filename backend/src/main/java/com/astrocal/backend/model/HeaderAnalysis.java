package com.astrocal.backend.model;

import com.astrocal.backend.enums.FrameType;
import lombok.Value;

import java.util.List;

@Value
public class HeaderAnalysis {
	FrameType frameType;
	double confidence;
	List<String> warnings;
}
