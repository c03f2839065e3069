package com.astrocal.backend.service;

import com.astrocal.backend.exception.JobCancelledException;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationRegistryTest {

	private final CancellationRegistry registry = new CancellationRegistry();

	@Test
	void cancelReachesRegisteredToken() {
		UUID jobId = UUID.randomUUID();
		CancellationToken token = registry.register(jobId);

		assertThat(registry.register(jobId)).isSameAs(token);
		assertThat(registry.cancel(jobId)).isTrue();
		assertThatThrownBy(token::throwIfCancelled).isInstanceOf(JobCancelledException.class);
	}

	@Test
	void releasedJobsCannotBeSignalled() {
		UUID jobId = UUID.randomUUID();
		registry.register(jobId);
		registry.release(jobId);

		assertThat(registry.cancel(jobId)).isFalse();
	}
}
