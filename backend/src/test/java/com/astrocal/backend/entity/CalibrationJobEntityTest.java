package com.astrocal.backend.entity;

import com.astrocal.backend.enums.JobStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalibrationJobEntityTest {

	@Test
	void followsLifecycleAndStampsCompletion() {
		CalibrationJobEntity job = new CalibrationJobEntity();

		assertThat(job.moveTo(JobStatus.QUEUED)).isTrue();
		assertThat(job.moveTo(JobStatus.RUNNING)).isTrue();
		assertThat(job.moveTo(JobStatus.RUNNING)).isTrue();
		assertThat(job.getCompletedAt()).isNull();
		assertThat(job.moveTo(JobStatus.SUCCESS)).isTrue();
		assertThat(job.getCompletedAt()).isNotNull();
	}

	@Test
	void terminalStatusIsFinal() {
		CalibrationJobEntity job = new CalibrationJobEntity();
		job.moveTo(JobStatus.QUEUED);
		job.moveTo(JobStatus.CANCELLED);

		assertThat(job.moveTo(JobStatus.SUCCESS)).isFalse();
		assertThat(job.moveTo(JobStatus.RUNNING)).isFalse();
		assertThat(job.moveTo(JobStatus.CANCELLED)).isFalse();
		assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
	}
}
