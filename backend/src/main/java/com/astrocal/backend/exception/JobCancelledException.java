package com.astrocal.backend.exception;

import java.util.UUID;

public class JobCancelledException extends CalibrationException {
	public JobCancelledException(UUID jobId) {
		super("Job " + jobId + " was cancelled");
	}
}
