package com.astrocal.backend.service;

import com.astrocal.backend.exception.JobCancelledException;

import java.util.UUID;

/**
 * Cooperative cancellation flag of one job. The running job polls it at its checkpoints.
 */
public class CancellationToken {

	private final UUID jobId;
	private volatile boolean cancelled;

	public CancellationToken(UUID jobId) {
		this.jobId = jobId;
	}

	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public void throwIfCancelled() throws JobCancelledException {
		if (cancelled) {
			throw new JobCancelledException(jobId);
		}
	}
}
