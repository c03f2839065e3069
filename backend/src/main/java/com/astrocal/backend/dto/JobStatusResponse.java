package com.astrocal.backend.dto;

import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.model.JobResult;
import com.astrocal.backend.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class JobStatusResponse {
	private UUID jobId;
	private JobStatus status;
	private int progress;
	private String error;
	private JobResult result;
	private Map<String, Object> diagnostics;
	private Instant createdAt;
	private Instant completedAt;

	public static JobStatusResponse from(JobState state) {
		return JobStatusResponse.builder()
				.jobId(state.getJobId())
				.status(state.getStatus())
				.progress(state.getProgress())
				.error(state.getError())
				.result(state.getResult())
				.diagnostics(state.getDiagnostics())
				.createdAt(state.getCreatedAt())
				.completedAt(state.getCompletedAt())
				.build();
	}
}
