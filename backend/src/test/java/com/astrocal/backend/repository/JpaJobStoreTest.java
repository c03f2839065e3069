package com.astrocal.backend.repository;

import com.astrocal.backend.entity.CalibrationJobEntity;
import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.model.JobResult;
import com.astrocal.backend.model.JobState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaJobStoreTest {

	@Mock
	private CalibrationJobRepository calibrationJobRepository;

	private JpaJobStore jobStore;
	private final UUID jobId = UUID.randomUUID();

	@BeforeEach
	void setUp() {
		jobStore = new JpaJobStore(calibrationJobRepository, new ObjectMapper());
	}

	@Test
	void upsertCreatesMissingJobAndStoresJson() {
		when(calibrationJobRepository.existsById(jobId)).thenReturn(false);

		boolean written = jobStore.upsert(jobId, JobStatus.FAILED, 140, "No files downloaded",
				JobResult.counts(0, List.of()), Map.of("warnings", List.of("w")));

		assertThat(written).isTrue();
		verify(calibrationJobRepository, never()).transition(any(), any(), any(), any(), any());
		verify(calibrationJobRepository).save(argThat(job ->
				job.getProgress() == 100
						&& job.getStatus() == JobStatus.FAILED
						&& job.getCompletedAt() != null
						&& job.getResult().contains("\"used\":0")
						&& job.getDiagnostics().contains("\"warnings\"")));
	}

	@Test
	void upsertWritesFieldsOnlyAfterTheConditionalTransition() {
		CalibrationJobEntity job = entity(JobStatus.SUCCESS);
		when(calibrationJobRepository.existsById(jobId)).thenReturn(true);
		when(calibrationJobRepository.transition(eq(jobId), eq(EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING)),
				eq(JobStatus.SUCCESS), notNull(), notNull())).thenReturn(1);
		when(calibrationJobRepository.findById(jobId)).thenReturn(Optional.of(job));

		assertThat(jobStore.upsert(jobId, JobStatus.SUCCESS, 100, null, JobResult.counts(4, List.of()), null)).isTrue();

		verify(calibrationJobRepository).save(argThat(saved -> saved.getResult().contains("\"used\":4")));
	}

	@Test
	void successIsRefusedWhenTheRowWasCancelledMeanwhile() {
		// another transaction committed CANCELLED, the conditional update matches no row
		when(calibrationJobRepository.existsById(jobId)).thenReturn(true);
		when(calibrationJobRepository.transition(eq(jobId), any(), eq(JobStatus.SUCCESS), notNull(), notNull())).thenReturn(0);

		assertThat(jobStore.upsert(jobId, JobStatus.SUCCESS, 100, null, JobResult.counts(4, List.of()), null)).isFalse();

		verify(calibrationJobRepository, never()).findById(any());
		verify(calibrationJobRepository, never()).save(any());
	}

	@Test
	void cancelOnlyMatchesJobsThatAreStillActive() {
		when(calibrationJobRepository.transition(eq(jobId), eq(EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING)),
				eq(JobStatus.CANCELLED), notNull(), notNull())).thenReturn(0);

		assertThat(jobStore.setStatus(jobId, JobStatus.CANCELLED)).isFalse();
	}

	@Test
	void runningTransitionLeavesCompletionEmpty() {
		when(calibrationJobRepository.transition(eq(jobId), eq(EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING)),
				eq(JobStatus.RUNNING), isNull(), notNull())).thenReturn(1);

		assertThat(jobStore.setStatus(jobId, JobStatus.RUNNING)).isTrue();
	}

	@Test
	void progressOnlyTouchesActiveJobs() {
		jobStore.updateProgress(jobId, 130);

		verify(calibrationJobRepository).updateProgress(eq(jobId), eq(EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING)), eq(100), notNull());
	}

	@Test
	void enrichResultRewritesStoredDocument() {
		CalibrationJobEntity job = entity(JobStatus.SUCCESS);
		job.setResult("{\"used\":3,\"rejected\":0,\"preview_path\":\"m.png\"}");
		when(calibrationJobRepository.findById(jobId)).thenReturn(Optional.of(job));

		assertThat(jobStore.enrichResult(jobId, result -> result.setFitsPath("m.fits"))).isTrue();

		JobState state = jobStore.get(jobId).orElseThrow();
		assertThat(state.getResult().getFitsPath()).isEqualTo("m.fits");
		assertThat(state.getResult().getPreviewPath()).isEqualTo("m.png");
		assertThat(state.getStatus()).isEqualTo(JobStatus.SUCCESS);
	}

	private CalibrationJobEntity entity(JobStatus status) {
		CalibrationJobEntity job = new CalibrationJobEntity();
		job.setId(jobId);
		job.setStatus(status);
		job.setProgress(100);
		return job;
	}
}
