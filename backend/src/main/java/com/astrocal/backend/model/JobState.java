package com.astrocal.backend.model;

import com.astrocal.backend.enums.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of a job record as held by the job store.
 */
@Value
@Builder
public class JobState {
	UUID jobId;
	JobStatus status;
	int progress;
	String error;
	JobResult result;
	@Builder.Default
	Map<String, Object> diagnostics = Map.of();
	Instant createdAt;
	Instant completedAt;
}
