package com.astrocal.backend.controller;

import com.astrocal.backend.repository.JobStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthCheckController {

	private final JobStore jobStore;

	@GetMapping
	public ResponseEntity<Map<String, String>> checkHealth() {
		try {
			long jobCount = jobStore.count();
			return ResponseEntity.ok(Map.of(
				"status", "UP",
				"job_store", "OK",
				"jobs_tracked", String.valueOf(jobCount)
			));
		} catch (Exception e) {
			return ResponseEntity.status(503).body(Map.of(
				"status", "DOWN",
				"job_store", "Error: " + e.getMessage()
			));
		}
	}
}
