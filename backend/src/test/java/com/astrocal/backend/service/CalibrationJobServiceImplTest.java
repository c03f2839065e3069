package com.astrocal.backend.service;

import com.astrocal.backend.dto.CalibrationJobRequest;
import com.astrocal.backend.enums.CosmeticMethod;
import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.exception.JobNotFoundException;
import com.astrocal.backend.exception.UnsupportedMethodException;
import com.astrocal.backend.model.JobState;
import com.astrocal.backend.model.StackingSettings;
import com.astrocal.backend.support.InMemoryJobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CalibrationJobServiceImplTest {

	@Mock
	private JobEventPublisher jobEventPublisher;

	private InMemoryJobStore jobStore;
	private CancellationRegistry cancellationRegistry;
	private CalibrationJobServiceImpl service;

	@BeforeEach
	void setUp() {
		jobStore = new InMemoryJobStore();
		cancellationRegistry = new CancellationRegistry();
		service = new CalibrationJobServiceImpl(jobStore, jobEventPublisher, cancellationRegistry, new ObjectMapper());
	}

	@Test
	void submitQueuesJobAndPublishesParsedSettings() throws Exception {
		CalibrationJobRequest request = request();
		request.getSettings().setStackingMethod("Winsorized");
		request.getSettings().setSigmaThreshold(2.0);
		request.getSettings().setCosmeticCorrection(true);
		request.getSettings().setCosmeticMethod("la_cosmic");

		UUID jobId = service.submitJob(request);

		assertThat(jobStore.get(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
		ArgumentCaptor<CalibrationJobSubmittedEvent> event = ArgumentCaptor.forClass(CalibrationJobSubmittedEvent.class);
		verify(jobEventPublisher).publishJobSubmitted(event.capture());
		StackingSettings settings = event.getValue().getSettings();
		assertThat(event.getValue().getJobId()).isEqualTo(jobId);
		assertThat(settings.getMethod()).isEqualTo(StackingMethod.WINSORIZED);
		assertThat(settings.getSigmaThreshold()).isEqualTo(2.0);
		assertThat(settings.getCosmetic().isEnabled()).isTrue();
		assertThat(settings.getCosmetic().getMethod()).isEqualTo(CosmeticMethod.LA_COSMIC);
		assertThat(settings.getCosmetic().getThreshold()).isEqualTo(5.0);
	}

	@Test
	void unknownMethodIsRejectedBeforeAnythingIsStored() {
		CalibrationJobRequest request = request();
		request.getSettings().setStackingMethod("kappa");

		assertThatThrownBy(() -> service.submitJob(request))
				.isInstanceOf(UnsupportedMethodException.class)
				.hasMessage("Unknown stacking method: kappa");
		assertThat(jobStore.count()).isZero();
		verifyNoInteractions(jobEventPublisher);
	}

	@Test
	void cancellingQueuedJobSignalsWorker() throws Exception {
		UUID jobId = service.submitJob(request());
		CancellationToken token = cancellationRegistry.register(jobId);

		JobState state = service.cancelJob(jobId);

		assertThat(state.getStatus()).isEqualTo(JobStatus.CANCELLED);
		assertThat(token.isCancelled()).isTrue();
	}

	@Test
	void cancellingFinishedJobChangesNothing() throws Exception {
		UUID jobId = service.submitJob(request());
		jobStore.upsert(jobId, JobStatus.RUNNING, 50, null, null, null);
		jobStore.upsert(jobId, JobStatus.SUCCESS, 100, null, null, null);

		JobState state = service.cancelJob(jobId);

		assertThat(state.getStatus()).isEqualTo(JobStatus.SUCCESS);
	}

	@Test
	void unknownJobIsNotFound() {
		assertThatThrownBy(() -> service.getJob(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
	}

	private static CalibrationJobRequest request() {
		CalibrationJobRequest request = new CalibrationJobRequest();
		request.setInputBucket("raw");
		request.setInputPaths(List.of("darks/dark_1.fits", "darks/dark_2.fits"));
		request.setOutputBucket("masters");
		request.setOutputBase("u1/p1/master_dark");
		return request;
	}
}
