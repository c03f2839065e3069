package com.astrocal.backend.repository;

import com.astrocal.backend.entity.CalibrationJobEntity;
import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.model.JobResult;
import com.astrocal.backend.model.JobState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link JobStore} on the {@code calibration_jobs} table. Result and diagnostics are stored as
 * JSON documents.
 * <p>
 * Status and progress changes are conditional updates on the row, so they only apply while the
 * committed status still allows them. A job that reached a terminal state in another transaction
 * is never moved again, whatever order the transactions commit in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaJobStore implements JobStore {

	private static final TypeReference<Map<String, Object>> DIAGNOSTICS_TYPE = new TypeReference<>() {
	};

	private final CalibrationJobRepository calibrationJobRepository;
	private final ObjectMapper objectMapper;

	@Override
	@Transactional
	public JobState create(UUID jobId, String parametersJson) {
		CalibrationJobEntity job = new CalibrationJobEntity();
		job.setId(jobId);
		job.setStatus(JobStatus.QUEUED);
		job.setProgress(0);
		job.setJobParameters(parametersJson);
		return toState(calibrationJobRepository.save(job));
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<JobState> get(UUID jobId) {
		return calibrationJobRepository.findById(jobId).map(this::toState);
	}

	@Override
	@Transactional
	public boolean upsert(UUID jobId, JobStatus status, int progress, String error,
						  JobResult result, Map<String, Object> diagnostics) {
		CalibrationJobEntity job;
		if (calibrationJobRepository.existsById(jobId)) {
			if (!transition(jobId, status)) {
				log.info("Ignoring {} for job {}, it already left the states that allow it", status, jobId);
				return false;
			}
			job = calibrationJobRepository.findById(jobId)
					.orElseThrow(() -> new IllegalStateException("Job " + jobId + " vanished during update"));
		} else {
			job = new CalibrationJobEntity();
			job.setId(jobId);
			job.moveTo(status);
		}
		job.setProgress(clamp(progress));
		job.setError(error);
		if (result != null) {
			job.setResult(write(result));
		}
		if (diagnostics != null) {
			job.setDiagnostics(write(diagnostics));
		}
		calibrationJobRepository.save(job);
		return true;
	}

	@Override
	@Transactional
	public boolean setStatus(UUID jobId, JobStatus status) {
		return transition(jobId, status);
	}

	@Override
	@Transactional
	public void updateProgress(UUID jobId, int progress) {
		calibrationJobRepository.updateProgress(jobId, JobStatus.active(), clamp(progress), Instant.now());
	}

	@Override
	@Transactional
	public boolean enrichResult(UUID jobId, Consumer<JobResult> enricher) {
		Optional<CalibrationJobEntity> found = calibrationJobRepository.findById(jobId);
		if (found.isEmpty() || found.get().getResult() == null) {
			return false;
		}
		CalibrationJobEntity job = found.get();
		JobResult result = read(job.getResult(), JobResult.class);
		enricher.accept(result);
		job.setResult(write(result));
		calibrationJobRepository.save(job);
		return true;
	}

	@Override
	@Transactional
	public long purgeTerminalBefore(Instant cutoff) {
		return calibrationJobRepository.deleteByStatusInAndCompletedAtBefore(
				EnumSet.of(JobStatus.CANCELLED, JobStatus.FAILED, JobStatus.SUCCESS), cutoff);
	}

	@Override
	public long count() {
		return calibrationJobRepository.count();
	}

	private boolean transition(UUID jobId, JobStatus next) {
		Instant now = Instant.now();
		return calibrationJobRepository.transition(jobId, JobStatus.sourcesOf(next), next,
				next.isTerminal() ? now : null, now) > 0;
	}

	private JobState toState(CalibrationJobEntity job) {
		return JobState.builder()
				.jobId(job.getId())
				.status(job.getStatus())
				.progress(job.getProgress())
				.error(job.getError())
				.result(job.getResult() == null ? null : read(job.getResult(), JobResult.class))
				.diagnostics(job.getDiagnostics() == null ? Map.of() : read(job.getDiagnostics(), DIAGNOSTICS_TYPE))
				.createdAt(job.getCreatedAt())
				.completedAt(job.getCompletedAt())
				.build();
	}

	private String write(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Could not serialize job record", e);
		}
	}

	private <T> T read(String json, Class<T> type) {
		try {
			return objectMapper.readValue(json, type);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Could not read stored job record", e);
		}
	}

	private <T> T read(String json, TypeReference<T> type) {
		try {
			return objectMapper.readValue(json, type);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Could not read stored job record", e);
		}
	}

	private static int clamp(int progress) {
		return Math.max(0, Math.min(100, progress));
	}
}
