package com.astrocal.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "calibration")
public class CalibrationProperties {

	private int maxInputFrames = 10;
	private int maxLightFrames = 10;
	private int jobThreads = 2;
	private int downloadThreads = 8;
	private List<String> acceptedExtensions = new ArrayList<>(List.of("fit", "fits", "fts"));

	private double validationConfidenceThreshold = 0.7;
	private double temperatureTolerance = 1.0;
	private double exposureTolerance = 0.1;
	private double darkScaleMin = 0.5;
	private double darkScaleMax = 2.0;

	private int superbiasMaxComponents = 8;
	private int histogramBins = 64;
	private double previewLowPercentile = 1.0;
	private double previewHighPercentile = 99.0;

	private List<String> knownCameras = new ArrayList<>(List.of(
			"ZWO ASI294MC Pro", "ZWO ASI533MC Pro", "ZWO ASI2600MC Pro"));
	private List<String> colorCameras = new ArrayList<>(List.of(
			"ZWO ASI294MC Pro", "ZWO ASI533MC Pro", "ZWO ASI2600MC Pro"));
	private List<String> knownFilterManufacturers = new ArrayList<>(List.of(
			"Optolong", "Astronomik", "ZWO", "Baader", "Chroma", "Antlia", "Astrodon"));

	private String workDir = System.getProperty("java.io.tmpdir");

	private CosmicRay cosmicRay = new CosmicRay();
	private Retention retention = new Retention();

	@Data
	public static class CosmicRay {
		/** Command line of the external detector; empty disables {@code la_cosmic}. */
		private List<String> command = new ArrayList<>();
		private long timeoutSeconds = 300;
	}

	@Data
	public static class Retention {
		private boolean enabled = false;
		private int days = 14;
		private long cleanupDelayMs = 3_600_000;
	}
}
