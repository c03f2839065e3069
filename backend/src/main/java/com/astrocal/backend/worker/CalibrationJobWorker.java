package com.astrocal.backend.worker;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.correction.CalibrationCorrector;
import com.astrocal.backend.correction.CalibrationCorrector.MatchResult;
import com.astrocal.backend.correction.CosmeticCorrector;
import com.astrocal.backend.dto.CalibrationJobRequest;
import com.astrocal.backend.enums.FrameType;
import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.exception.CalibrationException;
import com.astrocal.backend.exception.DownloadException;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.exception.JobCancelledException;
import com.astrocal.backend.exception.NoValidFramesException;
import com.astrocal.backend.exception.StorageException;
import com.astrocal.backend.image.FitsImage;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.image.MasterFrameWriter;
import com.astrocal.backend.model.CosmeticSettings;
import com.astrocal.backend.model.FrameRecord;
import com.astrocal.backend.model.FrameSetStatistics;
import com.astrocal.backend.model.JobResult;
import com.astrocal.backend.model.MasterFrame;
import com.astrocal.backend.model.QualityScore;
import com.astrocal.backend.model.RejectedFrame;
import com.astrocal.backend.model.StackingRecommendation;
import com.astrocal.backend.model.StackingSettings;
import com.astrocal.backend.model.ValidationStatus;
import com.astrocal.backend.quality.MasterStatisticsCalculator;
import com.astrocal.backend.quality.QualityScorer;
import com.astrocal.backend.repository.JobStore;
import com.astrocal.backend.service.CancellationRegistry;
import com.astrocal.backend.service.CancellationToken;
import com.astrocal.backend.stacking.FrameAnalyzer;
import com.astrocal.backend.stacking.StackResult;
import com.astrocal.backend.stacking.StackingEngine;
import com.astrocal.backend.storage.ObjectStorage;
import com.astrocal.backend.validation.FrameMetadataAnalyzer;
import com.astrocal.backend.validation.FrameValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs one calibration job from raw frame paths to a stored master frame. Every outcome ends in
 * the job store; nothing is thrown back to the executor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CalibrationJobWorker {

	static final int PROGRESS_STARTED = 5;
	static final int PROGRESS_DOWNLOADED = 30;
	static final int PROGRESS_CORRECTED = 45;
	static final int PROGRESS_VALIDATED = 60;
	static final int PROGRESS_STACKING = 70;
	static final int PROGRESS_STACKED = 85;
	static final int PROGRESS_PREVIEW = 95;
	static final int PROGRESS_DONE = 100;

	private static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

	private final JobStore jobStore;
	private final ObjectStorage objectStorage;
	private final FrameDownloader frameDownloader;
	private final CalibrationCorrector calibrationCorrector;
	private final FrameMetadataAnalyzer frameMetadataAnalyzer;
	private final FrameValidator frameValidator;
	private final FrameAnalyzer frameAnalyzer;
	private final StackingEngine stackingEngine;
	private final CosmeticCorrector cosmeticCorrector;
	private final MasterStatisticsCalculator masterStatisticsCalculator;
	private final QualityScorer qualityScorer;
	private final MasterFrameWriter masterFrameWriter;
	private final CancellationRegistry cancellationRegistry;
	private final CalibrationProperties properties;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	@Qualifier("uploadExecutor")
	private final Executor uploadExecutor;

	@Async("calibrationExecutor")
	public void runJob(UUID jobId, CalibrationJobRequest request, StackingSettings settings) {
		log.info("STARTING calibration job: {}", jobId);
		JobRun run = new JobRun(jobId, cancellationRegistry.register(jobId));

		try {
			if (!jobStore.upsert(jobId, JobStatus.RUNNING, PROGRESS_STARTED, null, null, null)) {
				log.info("Job {} is no longer runnable, skipping", jobId);
				return;
			}
			run.progress = PROGRESS_STARTED;
			execute(run, request, settings);
		} catch (JobCancelledException e) {
			jobStore.setStatus(jobId, JobStatus.CANCELLED);
			log.info("Job {} cancelled at progress {}", jobId, run.progress);
		} catch (NoValidFramesException e) {
			log.warn("Job {} has no valid frames, {} rejected", jobId, e.getRejectedFrames().size());
			run.diagnostics.put("warnings", run.warnings);
			jobStore.upsert(jobId, JobStatus.FAILED, PROGRESS_DONE, "No valid frames for stacking",
					JobResult.counts(0, e.getRejectedFrames()), run.diagnostics);
		} catch (CalibrationException e) {
			fail(run, e.getMessage());
		} catch (Exception e) {
			log.error("Unexpected failure in job {}", jobId, e);
			fail(run, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
		} finally {
			cancellationRegistry.release(jobId);
		}
	}

	private void execute(JobRun run, CalibrationJobRequest request, StackingSettings settings) throws Exception {
		CalibrationJobRequest.Settings options = request.getSettings() != null ? request.getSettings() : new CalibrationJobRequest.Settings();
		String bucket = request.getInputBucket();

		List<String> inputPaths = selectPaths(request.getInputPaths(), properties.getMaxInputFrames(), run, "input");
		try (JobWorkspace workspace = JobWorkspace.create(properties.getWorkDir(), run.jobId)) {

			// 1. download
			DownloadBatch inputs = frameDownloader.downloadAll(bucket, inputPaths, workspace, "input");
			run.warnings.addAll(inputs.getWarnings());
			run.rejected.addAll(inputs.getUnreadable());
			if (inputs.getFrames().isEmpty() && inputs.getUnreadable().isEmpty()) {
				throw new DownloadException("No files downloaded");
			}
			List<FrameRecord> lights = new ArrayList<>();
			List<String> lightPaths = selectPaths(request.getLightInputPaths(), properties.getMaxLightFrames(), run, "light");
			if (!lightPaths.isEmpty()) {
				DownloadBatch lightBatch = frameDownloader.downloadAll(bucket, lightPaths, workspace, "light");
				run.warnings.addAll(lightBatch.getWarnings());
				lightBatch.getUnreadable().forEach(r -> run.warnings.add("Light frame " + r.getFile() + " unusable: " + r.getReason()));
				lights.addAll(lightBatch.getFrames());
			}
			progress(run, PROGRESS_DOWNLOADED);
			checkpoint(run);

			// 2. pre-stack corrections
			List<FrameRecord> frames = new ArrayList<>(inputs.getFrames());
			FrameType frameType = resolveFrameType(frames, inputPaths, request.getFrameType());
			run.frameType = frameType;
			log.info("Job {} frame type {} with {} frames", run.jobId, frameType.label(), frames.size());
			if (frameType == FrameType.DARK && options.isBiasSubtraction()) {
				frames = subtractBias(run, request, frames, workspace);
			}
			if (frameType == FrameType.DARK && (options.isTempMatching() || options.isExposureMatching()) && !lights.isEmpty()) {
				MatchResult match = calibrationCorrector.matchTemperatureAndExposure(frames, lights.get(0).getHeader(),
						options.isTempMatching(), options.isExposureMatching());
				if (match.getWarning() != null) {
					run.warnings.add(match.getWarning());
				}
				frames = new ArrayList<>(match.getFrames());
			}
			progress(run, PROGRESS_CORRECTED);

			// 3. validation
			List<FrameRecord> valid = new ArrayList<>();
			for (FrameRecord frame : frames) {
				checkpoint(run);
				FrameRecord validated = frameValidator.validate(frame);
				if (validated.getValidationStatus() == ValidationStatus.VALID) {
					valid.add(validated);
				} else {
					run.rejected.add(RejectedFrame.withWarnings(frame.fileName(), validated.getRejectionReasons()));
				}
			}
			if (valid.isEmpty()) {
				throw new NoValidFramesException(run.rejected);
			}
			run.used = valid.size();
			progress(run, PROGRESS_VALIDATED);

			// 4. optional inputs
			ImageBuffer badPixelMap = loadOptional(run, bucket, settings.getBadPixelMapPath(), workspace, "bad_pixel_map", "Bad pixel map");
			ImageBuffer superdark = loadOptional(run, bucket, options.getSuperdarkPath(), workspace, "superdark", "Superdark");

			// 5. stacking
			checkpoint(run);
			progress(run, PROGRESS_STACKING);
			List<ImageBuffer> images = valid.stream().map(FrameRecord::getImage).collect(Collectors.toList());
			FrameSetStatistics frameStats = frameAnalyzer.analyze(images);
			StackingRecommendation recommendation = frameAnalyzer.recommend(frameStats, settings.getMethod(), settings.getSigmaThreshold());
			run.diagnostics.put("frame_statistics", frameStats);
			run.diagnostics.put("recommendation", recommendation);

			StackingMethod method = settings.getMethod();
			Double threshold = settings.getSigmaThreshold();
			if (method == StackingMethod.ADAPTIVE || settings.isAutoAcceptRecommendation()) {
				if (recommendation.getMethod() != method) {
					threshold = recommendation.getSigma();
				}
				method = recommendation.getMethod();
				log.info("Job {} applying recommended method {}: {}", run.jobId, method.wireName(), recommendation.getReason());
			}

			ImageBuffer masterImage;
			StackingMethod usedMethod;
			if (superdark != null) {
				log.info("Job {} using superdark {} instead of stacking", run.jobId, options.getSuperdarkPath());
				run.diagnostics.put("superdark_path", options.getSuperdarkPath());
				masterImage = superdark;
				usedMethod = null;
			} else {
				StackResult stacked = stackingEngine.combine(images, method, threshold);
				run.warnings.addAll(stacked.getWarnings());
				run.diagnostics.put("stacking", stacked.getDiagnostics());
				masterImage = stacked.getImage();
				usedMethod = stacked.getMethod();
			}
			checkpoint(run);
			progress(run, PROGRESS_STACKED);

			// 6. cosmetic correction
			masterImage = applyCosmetics(run, masterImage, settings.getCosmetic(), badPixelMap);

			// 7. statistics and quality
			MasterFrame master = MasterFrame.builder()
					.image(masterImage)
					.frameType(frameType)
					.stackingMethod(usedMethod)
					.framesUsed(valid.size())
					.stats(masterStatisticsCalculator.compute(masterImage))
					.build();
			QualityScore quality = qualityScorer.score(master, frameType);

			// 8. dark scaling
			if (options.isDarkScaling() && frameType == FrameType.DARK) {
				double factor = calibrationCorrector.darkScaleFactor(
						lights.stream().map(FrameRecord::getImage).collect(Collectors.toList()), images);
				master = master.scaled(factor, masterStatisticsCalculator::compute);
			}
			run.diagnostics.put("master_stats", master.getStats());
			run.diagnostics.put("quality", quality);

			// 9. persistence
			checkpoint(run);
			String outputBase = request.getOutputBase() + "_" + LocalDateTime.now(clock).format(OUTPUT_TIMESTAMP);
			String previewPath = outputBase + ".png";
			String previewUrl = objectStorage.upload(request.getOutputBucket(), previewPath,
					masterFrameWriter.renderPreview(master.getImage()), true);
			progress(run, PROGRESS_PREVIEW);

			byte[] fitsBytes = masterFrameWriter.writeFits(master, workspace.file("master.fits"));

			JobResult result = JobResult.builder()
					.used(valid.size())
					.rejected(run.rejected.size())
					.rejectedDetails(new ArrayList<>(run.rejected))
					.frameType(frameType.label())
					.requestedMethod(settings.getMethod().wireName())
					.stackingMethod(usedMethod != null ? usedMethod.wireName() : "superdark")
					.recommendedMethod(recommendation.getMethod().wireName())
					.recommendedSigma(recommendation.getSigma())
					.recommendationReason(recommendation.getReason())
					.stats(master.getStats())
					.qualityScore(quality.getScore())
					.qualityRecommendations(quality.getRecommendations())
					.darkScaleFactor(master.getDarkScaleFactor())
					.previewPath(previewPath)
					.previewUrl(previewUrl)
					.warnings(run.warnings)
					.build();
			run.diagnostics.put("warnings", run.warnings);

			String diagnosticsPath = outputBase + "_diagnostics.json";
			try {
				objectStorage.upload(request.getOutputBucket(), diagnosticsPath, diagnosticsJson(run, result), false);
				result.setDiagnosticsPath(diagnosticsPath);
			} catch (StorageException | JsonProcessingException e) {
				log.warn("Job {} could not store diagnostics: {}", run.jobId, e.getMessage());
				run.warnings.add("Diagnostics upload failed: " + e.getMessage());
			}

			if (!jobStore.upsert(run.jobId, JobStatus.SUCCESS, PROGRESS_DONE, null, result, run.diagnostics)) {
				log.info("Job {} finished after it was cancelled, master frame discarded", run.jobId);
				objectStorage.delete(request.getOutputBucket(), previewPath);
				if (result.getDiagnosticsPath() != null) {
					objectStorage.delete(request.getOutputBucket(), result.getDiagnosticsPath());
				}
				return;
			}
			log.info("SUCCESSFULLY calibrated job: {} ({} used, {} rejected)", run.jobId, valid.size(), run.rejected.size());
			uploadFitsLater(run.jobId, request.getOutputBucket(), outputBase + ".fits", fitsBytes);
		}
	}

	private List<FrameRecord> subtractBias(JobRun run, CalibrationJobRequest request, List<FrameRecord> darks,
										   JobWorkspace workspace) throws CalibrationException {
		CalibrationJobRequest.Settings options = request.getSettings();
		String biasPath = calibrationCorrector.selectMasterBias(request.getInputBucket(), request.getUserId(),
				request.getProjectId(), options.getMasterBiasPath());
		ImageBuffer masterBias;
		try {
			masterBias = frameDownloader.download(request.getInputBucket(), biasPath, workspace, "master_bias.fits").getImage();
		} catch (DownloadException | IOException e) {
			throw new CalibrationException("Master bias download failed: " + e.getMessage(), e);
		}
		run.diagnostics.put("master_bias_path", biasPath);

		List<FrameRecord> corrected = new ArrayList<>();
		for (FrameRecord dark : darks) {
			checkpoint(run);
			corrected.add(calibrationCorrector.subtractBias(dark, masterBias));
		}
		log.info("Job {} subtracted master bias {} from {} darks", run.jobId, biasPath, corrected.size());
		return corrected;
	}

	private ImageBuffer applyCosmetics(JobRun run, ImageBuffer master, CosmeticSettings cosmetic, ImageBuffer badPixelMap)
			throws CalibrationException {
		ImageBuffer corrected = master;
		if (badPixelMap != null) {
			corrected = cosmeticCorrector.replaceBadPixels(corrected, badPixelMap);
		}
		if (cosmetic != null && cosmetic.isEnabled()) {
			try {
				corrected = cosmeticCorrector.applyMethod(corrected, cosmetic.getMethod(), cosmetic.getThreshold(), cosmetic.getParams());
				run.diagnostics.put("cosmetic_method", cosmetic.getMethod().wireName());
			} catch (ExternalToolException e) {
				log.warn("Job {} cosmetic correction {} failed: {}", run.jobId, cosmetic.getMethod().wireName(), e.getMessage());
				run.warnings.add("Cosmetic correction " + cosmetic.getMethod().wireName() + " failed, master left uncorrected: " + e.getMessage());
			}
		}
		return corrected;
	}

	private ImageBuffer loadOptional(JobRun run, String bucket, String path, JobWorkspace workspace, String localName, String what) {
		if (path == null || path.isBlank()) {
			return null;
		}
		try {
			FitsImage fits = frameDownloader.download(bucket, path, workspace, localName + ".fits");
			log.info("Job {} loaded {} from {}", run.jobId, what.toLowerCase(Locale.ROOT), path);
			return fits.getImage();
		} catch (DownloadException | IOException e) {
			log.warn("Job {} failed to load {} {}: {}", run.jobId, what.toLowerCase(Locale.ROOT), path, e.getMessage());
			run.warnings.add(what + " could not be loaded: " + e.getMessage());
			return null;
		}
	}

	private void uploadFitsLater(UUID jobId, String bucket, String fitsPath, byte[] fitsBytes) {
		uploadExecutor.execute(() -> {
			try {
				objectStorage.upload(bucket, fitsPath, fitsBytes, false);
				jobStore.enrichResult(jobId, result -> result.setFitsPath(fitsPath));
				log.info("Job {} master FITS stored at {}", jobId, fitsPath);
			} catch (StorageException e) {
				log.error("Job {} master FITS upload failed: {}", jobId, e.getMessage());
				jobStore.enrichResult(jobId, result -> result.setFitsUploadError(e.getMessage()));
			}
		});
	}

	private byte[] diagnosticsJson(JobRun run, JobResult result) throws JsonProcessingException {
		Map<String, Object> document = new LinkedHashMap<>(run.diagnostics);
		document.put("job_id", run.jobId);
		document.put("result", result);
		return objectMapper.writeValueAsString(document).getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * File name keywords first (the most common one wins), then the caller's hint, then the
	 * header classification of the downloaded frames.
	 */
	private FrameType resolveFrameType(List<FrameRecord> frames, List<String> paths, String hint) {
		FrameType fromPaths = mostCommon(paths.stream().map(FrameType::fromPath).collect(Collectors.toList()));
		if (fromPaths != FrameType.UNKNOWN) {
			return fromPaths;
		}
		FrameType fromHint = FrameType.fromName(hint);
		if (fromHint != FrameType.UNKNOWN) {
			return fromHint;
		}
		return mostCommon(frames.stream()
				.map(frame -> frameMetadataAnalyzer.analyze(frame.getHeader()).getFrameType())
				.collect(Collectors.toList()));
	}

	private static FrameType mostCommon(List<FrameType> types) {
		Map<FrameType, Integer> counts = new EnumMap<>(FrameType.class);
		for (FrameType type : types) {
			if (type != FrameType.UNKNOWN) {
				counts.merge(type, 1, Integer::sum);
			}
		}
		FrameType best = FrameType.UNKNOWN;
		int bestCount = 0;
		for (FrameType type : types) {
			Integer count = counts.get(type);
			if (count != null && count > bestCount) {
				best = type;
				bestCount = count;
			}
		}
		return best;
	}

	private List<String> selectPaths(List<String> paths, int limit, JobRun run, String what) {
		if (paths == null) {
			return List.of();
		}
		List<String> accepted = paths.stream()
				.filter(path -> properties.getAcceptedExtensions().contains(FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT)))
				.collect(Collectors.toList());
		if (accepted.size() < paths.size()) {
			log.info("Job {} ignoring {} {} paths without a FITS extension", run.jobId, paths.size() - accepted.size(), what);
		}
		if (accepted.size() > limit) {
			run.warnings.add("Only the first " + limit + " of " + accepted.size() + " " + what + " frames are processed");
			accepted = new ArrayList<>(accepted.subList(0, limit));
		}
		return accepted;
	}

	private void checkpoint(JobRun run) throws JobCancelledException {
		run.token.throwIfCancelled();
		boolean cancelledInStore = jobStore.get(run.jobId)
				.map(state -> state.getStatus() == JobStatus.CANCELLED)
				.orElse(false);
		if (cancelledInStore) {
			throw new JobCancelledException(run.jobId);
		}
	}

	private void progress(JobRun run, int progress) {
		run.progress = progress;
		jobStore.updateProgress(run.jobId, progress);
	}

	private void fail(JobRun run, String error) {
		log.error("FAILED calibration job: {}. Reason: {}", run.jobId, error);
		run.diagnostics.put("warnings", run.warnings);
		JobResult counts = JobResult.counts(run.used, run.rejected);
		if (run.frameType != null) {
			counts.setFrameType(run.frameType.label());
		}
		jobStore.upsert(run.jobId, JobStatus.FAILED, run.progress, error, counts, run.diagnostics);
	}

	/** Mutable state of one run, confined to the worker thread. */
	private static final class JobRun {
		private final UUID jobId;
		private final CancellationToken token;
		private final List<String> warnings = new ArrayList<>();
		private final List<RejectedFrame> rejected = new ArrayList<>();
		private final Map<String, Object> diagnostics = new LinkedHashMap<>();
		private int progress;
		private int used;
		private FrameType frameType;

		private JobRun(UUID jobId, CancellationToken token) {
			this.jobId = jobId;
			this.token = token;
		}
	}
}
