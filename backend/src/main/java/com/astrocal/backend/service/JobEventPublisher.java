package com.astrocal.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class JobEventPublisher {

	private final ApplicationEventPublisher applicationEventPublisher;

	public void publishJobSubmitted(final CalibrationJobSubmittedEvent event) {
		log.info("Publishing job submitted event for jobId: {}", event.getJobId());
		applicationEventPublisher.publishEvent(event);
	}
}
