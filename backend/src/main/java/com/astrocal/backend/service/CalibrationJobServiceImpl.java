package com.astrocal.backend.service;

import com.astrocal.backend.dto.CalibrationJobRequest;
import com.astrocal.backend.enums.CosmeticMethod;
import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.exception.JobNotFoundException;
import com.astrocal.backend.exception.UnsupportedMethodException;
import com.astrocal.backend.model.CosmeticSettings;
import com.astrocal.backend.model.JobState;
import com.astrocal.backend.model.StackingSettings;
import com.astrocal.backend.repository.JobStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationJobServiceImpl implements CalibrationJobService {

	private final JobStore jobStore;
	private final JobEventPublisher jobEventPublisher;
	private final CancellationRegistry cancellationRegistry;
	private final ObjectMapper objectMapper;

	@Override
	@Transactional
	public UUID submitJob(CalibrationJobRequest request) throws UnsupportedMethodException {
		StackingSettings settings = toStackingSettings(request.getSettings());
		String paramsJson;

		try {
			paramsJson = objectMapper.writeValueAsString(request);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Could not serialize job parameters", e);
		}

		UUID jobId = UUID.randomUUID();
		jobStore.create(jobId, paramsJson);
		cancellationRegistry.register(jobId);
		jobEventPublisher.publishJobSubmitted(new CalibrationJobSubmittedEvent(jobId, request, settings));
		log.info("Queued calibration job {} with {} input paths, method {}", jobId,
				request.getInputPaths().size(), settings.getMethod().wireName());
		return jobId;
	}

	@Override
	public JobState getJob(UUID jobId) {
		return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
	}

	@Override
	public JobState cancelJob(UUID jobId) {
		JobState current = getJob(jobId);
		if (current.getStatus().isTerminal()) {
			log.info("Job {} is already {}, nothing to cancel", jobId, current.getStatus());
			return current;
		}
		if (jobStore.setStatus(jobId, JobStatus.CANCELLED)) {
			log.info("Cancelled calibration job {}", jobId);
		}
		cancellationRegistry.cancel(jobId);
		return getJob(jobId);
	}

	/**
	 * Resolves method names once, at submission, so a running job never meets an unknown name.
	 */
	static StackingSettings toStackingSettings(CalibrationJobRequest.Settings settings) throws UnsupportedMethodException {
		CalibrationJobRequest.Settings source = settings != null ? settings : new CalibrationJobRequest.Settings();
		CosmeticSettings cosmetic = CosmeticSettings.disabled();
		if (source.isCosmeticCorrection()) {
			CosmeticSettings.CosmeticSettingsBuilder builder = CosmeticSettings.builder()
					.enabled(true)
					.method(source.getCosmeticMethod() == null ? CosmeticMethod.HOT_PIXEL_MAP : CosmeticMethod.fromName(source.getCosmeticMethod()))
					.params(source.getCosmeticParams() != null ? source.getCosmeticParams() : Map.of());
			if (source.getCosmeticThreshold() != null) {
				builder.threshold(source.getCosmeticThreshold());
			}
			cosmetic = builder.build();
		}
		return StackingSettings.builder()
				.method(source.getStackingMethod() == null ? StackingMethod.SIGMA : StackingMethod.fromName(source.getStackingMethod()))
				.sigmaThreshold(source.getSigmaThreshold())
				.autoAcceptRecommendation(source.isAutoAcceptRecommendation())
				.cosmetic(cosmetic)
				.badPixelMapPath(source.getBadPixelMapPath())
				.build();
	}
}
