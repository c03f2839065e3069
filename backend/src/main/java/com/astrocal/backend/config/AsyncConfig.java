package com.astrocal.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Thread pools for the job pipeline. Each job runs on one {@code calibrationExecutor} thread;
 * downloads and the deferred FITS upload use their own pools.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

	@Bean(name = "calibrationExecutor")
	public Executor calibrationExecutor(CalibrationProperties properties) {
		return executor("calibration-", properties.getJobThreads(), 100);
	}

	@Bean(name = "downloadExecutor")
	public Executor downloadExecutor(CalibrationProperties properties) {
		return executor("download-", properties.getDownloadThreads(), 500);
	}

	@Bean(name = "uploadExecutor")
	public Executor uploadExecutor() {
		return executor("upload-", 2, 100);
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	private static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueCapacity) {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setThreadNamePrefix(prefix);
		executor.setCorePoolSize(threads);
		executor.setMaxPoolSize(threads);
		executor.setQueueCapacity(queueCapacity);
		executor.setWaitForTasksToCompleteOnShutdown(true);
		executor.initialize();
		return executor;
	}
}
