package com.astrocal.backend.controller;

import com.astrocal.backend.dto.CalibrationJobRequest;
import com.astrocal.backend.dto.CancelJobResponse;
import com.astrocal.backend.dto.JobProgressResponse;
import com.astrocal.backend.dto.JobStatusResponse;
import com.astrocal.backend.dto.JobSubmissionResponse;
import com.astrocal.backend.enums.JobStatus;
import com.astrocal.backend.exception.UnsupportedMethodException;
import com.astrocal.backend.model.JobState;
import com.astrocal.backend.service.CalibrationJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/calibration-jobs")
@RequiredArgsConstructor
public class CalibrationJobController {

	private final CalibrationJobService calibrationJobService;

	@PostMapping
	public ResponseEntity<JobSubmissionResponse> submitJob(@Valid @RequestBody CalibrationJobRequest request)
			throws UnsupportedMethodException {
		UUID jobId = calibrationJobService.submitJob(request);
		return new ResponseEntity<>(new JobSubmissionResponse(jobId), HttpStatus.ACCEPTED);
	}

	@GetMapping("/{jobId}")
	public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable UUID jobId) {
		return ResponseEntity.ok(JobStatusResponse.from(calibrationJobService.getJob(jobId)));
	}

	@GetMapping("/{jobId}/progress")
	public ResponseEntity<JobProgressResponse> getJobProgress(@PathVariable UUID jobId) {
		JobState job = calibrationJobService.getJob(jobId);
		return ResponseEntity.ok(new JobProgressResponse(jobId, job.getStatus(), job.getProgress()));
	}

	@PostMapping("/{jobId}/cancel")
	public ResponseEntity<CancelJobResponse> cancelJob(@PathVariable UUID jobId) {
		JobState job = calibrationJobService.cancelJob(jobId);
		return ResponseEntity.ok(new CancelJobResponse(jobId, job.getStatus() == JobStatus.CANCELLED, job.getStatus()));
	}
}
