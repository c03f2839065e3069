package com.astrocal.backend.validation;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.enums.FrameType;
import com.astrocal.backend.model.FrameHeader;
import com.astrocal.backend.model.HeaderAnalysis;
import com.astrocal.backend.support.TestFrames;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderFrameMetadataAnalyzerTest {

	private final HeaderFrameMetadataAnalyzer analyzer = new HeaderFrameMetadataAnalyzer(new CalibrationProperties());

	@Test
	void completeDarkHeaderIsConfident() {
		HeaderAnalysis analysis = analyzer.analyze(TestFrames.darkHeader(-10, 300));

		assertThat(analysis.getFrameType()).isEqualTo(FrameType.DARK);
		assertThat(analysis.getConfidence()).isEqualTo(1.0);
		assertThat(analysis.getWarnings()).containsExactly("Color camera detected but no filter information found");
	}

	@Test
	void colorCameraWithFilterOrUnknownCameraGetsNoFilterWarning() {
		HeaderAnalysis filtered = analyzer.analyze(FrameHeader.of(Map.of(
				"IMAGETYP", "Dark Frame", "EXPTIME", 300, "GAIN", 100, "CCD-TEMP", -10,
				"INSTRUME", "ZWO ASI2600MC Pro", "FILTER", "Optolong L-Pro")));
		HeaderAnalysis unknownCamera = analyzer.analyze(FrameHeader.of(Map.of(
				"IMAGETYP", "Dark Frame", "EXPTIME", 300, "GAIN", 100, "CCD-TEMP", -10,
				"INSTRUME", "Homemade CMOS")));

		assertThat(filtered.getWarnings()).isEmpty();
		assertThat(unknownCamera.getWarnings()).isEmpty();
	}

	@Test
	void completeLightHeaderHasNoWarnings() {
		HeaderAnalysis analysis = analyzer.analyze(TestFrames.lightHeader(-10, 120));

		assertThat(analysis.getFrameType()).isEqualTo(FrameType.LIGHT);
		assertThat(analysis.getConfidence()).isEqualTo(1.0);
		assertThat(analysis.getWarnings()).isEmpty();
	}

	@Test
	void missingMetadataIsListedByField() {
		HeaderAnalysis analysis = analyzer.analyze(FrameHeader.of(Map.of("IMAGETYP", "Bias Frame")));

		assertThat(analysis.getFrameType()).isEqualTo(FrameType.BIAS);
		assertThat(analysis.getConfidence()).isEqualTo(0.6);
		assertThat(analysis.getWarnings()).containsExactly(
				"Missing exposure_time: Exposure time in seconds",
				"Missing gain: Camera gain setting",
				"Missing temperature: CCD temperature in Celsius");
	}

	@Test
	void flatFramesGetFilterReminder() {
		HeaderAnalysis analysis = analyzer.analyze(FrameHeader.of(Map.of(
				"IMAGETYP", "FLAT", "EXPTIME", 2.5, "GAIN", 100, "CCD-TEMP", -10, "FILTER", "Baader L")));

		assertThat(analysis.getFrameType()).isEqualTo(FrameType.FLAT);
		assertThat(analysis.getWarnings()).containsExactly(
				"Ensure flat frame filter exactly matches light frame filter (including bandwidth)");
		assertThat(analysis.getConfidence()).isEqualTo(1.0);
	}

	@Test
	void lightWithZeroExposureLosesConfidence() {
		HeaderAnalysis analysis = analyzer.analyze(FrameHeader.of(Map.of(
				"IMAGETYP", "Light", "EXPTIME", 0, "GAIN", 100, "CCD-TEMP", -10,
				"OBJECT", "M42", "FILTER", "UV/IR", "FOCALLEN", 400)));

		assertThat(analysis.getConfidence()).isEqualTo(0.5);
		assertThat(analysis.getWarnings()).contains("Exposure time is zero or negative for light frame");
	}

	@Test
	void typeIsInferredWithoutTypeKeyword() {
		assertThat(analyzer.inferFrameType(FrameHeader.of(Map.of("EXPTIME", 0.001)))).isEqualTo(FrameType.BIAS);
		assertThat(analyzer.inferFrameType(FrameHeader.of(Map.of("EXPTIME", 2, "OBJECT", "flat panel")))).isEqualTo(FrameType.FLAT);
		assertThat(analyzer.inferFrameType(FrameHeader.of(Map.of("EXPTIME", 300, "OBJECT", "M31")))).isEqualTo(FrameType.LIGHT);
		assertThat(analyzer.inferFrameType(FrameHeader.of(Map.of("EXPTIME", 300)))).isEqualTo(FrameType.DARK);
		assertThat(analyzer.inferFrameType(FrameHeader.of(Map.of("EXPTIME", 300, "FILTER", "Ha")))).isEqualTo(FrameType.UNKNOWN);
	}
}
