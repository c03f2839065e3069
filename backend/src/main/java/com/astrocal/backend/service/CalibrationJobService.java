package com.astrocal.backend.service;

import com.astrocal.backend.dto.CalibrationJobRequest;
import com.astrocal.backend.exception.UnsupportedMethodException;
import com.astrocal.backend.model.JobState;

import java.util.UUID;

public interface CalibrationJobService {
	UUID submitJob(CalibrationJobRequest request) throws UnsupportedMethodException;

	JobState getJob(UUID jobId);

	/**
	 * Requests cancellation. Jobs that already finished are returned unchanged.
	 */
	JobState cancelJob(UUID jobId);
}
