package com.astrocal.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a calibration run as stored on the job record. Failed jobs carry only the frame
 * counts; successful jobs carry the artefact paths and master statistics as well.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobResult {
	private Integer used;
	private Integer rejected;
	@Builder.Default
	private List<RejectedFrame> rejectedDetails = new ArrayList<>();

	private String frameType;
	private String requestedMethod;
	private String stackingMethod;
	private String recommendedMethod;
	private Double recommendedSigma;
	private String recommendationReason;

	private MasterFrameStats stats;
	private Double qualityScore;
	private List<String> qualityRecommendations;
	private Double darkScaleFactor;

	private String previewPath;
	private String previewUrl;
	private String diagnosticsPath;
	/** Filled in after the job already succeeded, once the raw master upload finishes. */
	private String fitsPath;
	private String fitsUploadError;

	@Builder.Default
	private List<String> warnings = new ArrayList<>();

	public static JobResult counts(int used, List<RejectedFrame> rejected) {
		return JobResult.builder()
				.used(used)
				.rejected(rejected.size())
				.rejectedDetails(new ArrayList<>(rejected))
				.build();
	}
}
