package com.astrocal.backend.enums;

import java.util.EnumSet;

/**
 * Lifecycle of a calibration job.
 * <p>
 * QUEUED moves to RUNNING, which ends in exactly one of CANCELLED, FAILED or SUCCESS.
 * A job may also be cancelled straight from QUEUED. Terminal states never change again.
 */
public enum JobStatus {
	QUEUED,
	RUNNING,
	CANCELLED,
	FAILED,
	SUCCESS;

	public boolean isTerminal() {
		return this == CANCELLED || this == FAILED || this == SUCCESS;
	}

	public boolean canTransitionTo(JobStatus next) {
		if (isTerminal()) {
			return false;
		}
		if (this == QUEUED) {
			return next != QUEUED;
		}
		return next.isTerminal() || next == RUNNING;
	}

	/**
	 * Statuses a stored job may be in for a move to {@code next} to succeed, including staying
	 * in a non-terminal {@code next}.
	 */
	public static EnumSet<JobStatus> sourcesOf(JobStatus next) {
		EnumSet<JobStatus> sources = EnumSet.noneOf(JobStatus.class);
		for (JobStatus status : values()) {
			if (status.canTransitionTo(next) || (status == next && !next.isTerminal())) {
				sources.add(status);
			}
		}
		return sources;
	}

	public static EnumSet<JobStatus> active() {
		return EnumSet.of(QUEUED, RUNNING);
	}
}
