package com.astrocal.backend.dto;

import com.astrocal.backend.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

@Data
@AllArgsConstructor
public class JobProgressResponse {
	private UUID jobId;
	private JobStatus status;
	private int progress;
}
