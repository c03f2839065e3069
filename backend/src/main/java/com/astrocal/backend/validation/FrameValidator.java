package com.astrocal.backend.validation;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.model.FrameRecord;
import com.astrocal.backend.model.HeaderAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Quality gate in front of stacking. A frame passes when the header analysis is confident
 * enough and none of its warnings reports missing or mandatory metadata.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FrameValidator {

	private final FrameMetadataAnalyzer frameMetadataAnalyzer;
	private final CalibrationProperties properties;

	public FrameRecord validate(FrameRecord frame) {
		HeaderAnalysis analysis = frameMetadataAnalyzer.analyze(frame.getHeader());
		boolean blocking = analysis.getWarnings().stream()
				.anyMatch(warning -> warning.contains("Missing") || warning.contains("must"));
		if (analysis.getConfidence() >= properties.getValidationConfidenceThreshold() && !blocking) {
			return frame.accepted();
		}
		log.info("Rejected {} (type {}, confidence {}): {}", frame.fileName(),
				analysis.getFrameType().label(), analysis.getConfidence(), analysis.getWarnings());
		return frame.rejected(analysis.getWarnings());
	}
}
