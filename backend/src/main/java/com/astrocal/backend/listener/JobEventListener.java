package com.astrocal.backend.listener;

import com.astrocal.backend.service.CalibrationJobSubmittedEvent;
import com.astrocal.backend.worker.CalibrationJobWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class JobEventListener {

	private final CalibrationJobWorker calibrationJobWorker;

	@TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
	public void onJobSubmitted(CalibrationJobSubmittedEvent event) {
		log.info("Transaction committed for job: {}. Triggering async worker.", event.getJobId());
		calibrationJobWorker.runJob(event.getJobId(), event.getRequest(), event.getSettings());
	}
}
