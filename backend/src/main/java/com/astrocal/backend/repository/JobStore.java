package com.astrocal.backend.repository;

import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.model.JobResult;
import com.astrocal.backend.model.JobState;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Status record of every calibration job. Writes for one job are applied one at a time, and a
 * job in a terminal state only ever accepts {@link #enrichResult} afterwards.
 */
public interface JobStore {

	JobState create(UUID jobId, String parametersJson);

	Optional<JobState> get(UUID jobId);

	/**
	 * Writes the full record, creating it when absent. {@code result} and {@code diagnostics}
	 * replace the stored values only when non-null.
	 *
	 * @return {@code false} when the job is already terminal and nothing was written
	 */
	boolean upsert(UUID jobId, JobStatus status, int progress, String error, JobResult result, Map<String, Object> diagnostics);

	/**
	 * @return {@code false} when the transition is not allowed from the current state
	 */
	boolean setStatus(UUID jobId, JobStatus status);

	/** Ignored for unknown or terminal jobs. */
	void updateProgress(UUID jobId, int progress);

	/**
	 * Applies {@code enricher} to the stored result without touching the status.
	 *
	 * @return {@code false} when the job or its result does not exist
	 */
	boolean enrichResult(UUID jobId, Consumer<JobResult> enricher);

	long purgeTerminalBefore(Instant cutoff);

	long count();
}
