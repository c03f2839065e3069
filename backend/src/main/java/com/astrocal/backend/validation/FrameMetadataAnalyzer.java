package com.astrocal.backend.validation;

import com.astrocal.backend.model.FrameHeader;
import com.astrocal.backend.model.HeaderAnalysis;

/**
 * Classifies an exposure from its header and reports how much the header can be trusted.
 */
public interface FrameMetadataAnalyzer {

	HeaderAnalysis analyze(FrameHeader header);
}
