package com.astrocal.backend.batch;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.repository.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes finished job records older than the configured retention window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobRetentionScheduler {

	private final CalibrationProperties properties;
	private final JobStore jobStore;
	private final Clock clock;

	@Scheduled(fixedDelayString = "${calibration.retention.cleanup-delay-ms:3600000}")
	public void purgeExpiredJobs() {
		CalibrationProperties.Retention retention = properties.getRetention();
		if (!retention.isEnabled()) {
			return;
		}
		Instant cutoff = Instant.now(clock).minus(Duration.ofDays(retention.getDays()));
		long removed = jobStore.purgeTerminalBefore(cutoff);
		if (removed > 0) {
			log.info("Purged {} finished jobs completed before {}", removed, cutoff);
		}
	}
}
