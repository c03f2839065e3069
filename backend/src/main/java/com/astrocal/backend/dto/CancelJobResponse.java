package com.astrocal.backend.dto;

import com.astrocal.backend.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

@Data
@AllArgsConstructor
public class CancelJobResponse {
	private UUID jobId;
	private boolean cancelled;
	private JobStatus status;
}
