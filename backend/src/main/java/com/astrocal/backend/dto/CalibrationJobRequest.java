package com.astrocal.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
public class CalibrationJobRequest {
	@NotBlank
	private String inputBucket;
	@NotEmpty
	private List<String> inputPaths = new ArrayList<>();
	/** Reference light frames for dark matching and scaling. */
	private List<String> lightInputPaths = new ArrayList<>();

	@NotBlank
	private String outputBucket;
	@NotBlank
	private String outputBase;

	private String userId;
	private String projectId;
	/** Frame type hint, used when file names do not tell. */
	private String frameType;

	@Valid
	private Settings settings = new Settings();

	@Data
	public static class Settings {
		private String stackingMethod = "sigma";
		@DecimalMin(value = "0", inclusive = false)
		private Double sigmaThreshold;
		private boolean autoAcceptRecommendation;

		private boolean biasSubtraction;
		private String masterBiasPath;
		private boolean tempMatching;
		private boolean exposureMatching;
		private boolean darkScaling;

		private boolean cosmeticCorrection;
		private String cosmeticMethod = "hot_pixel_map";
		@DecimalMin(value = "0", inclusive = false)
		private Double cosmeticThreshold;
		private Map<String, Object> cosmeticParams = new HashMap<>();

		private String badPixelMapPath;
		/** Pre-built master that replaces stacking when it can be loaded. */
		private String superdarkPath;
	}
}
