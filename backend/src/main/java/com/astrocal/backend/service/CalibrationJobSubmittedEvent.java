package com.astrocal.backend.service;

import com.astrocal.backend.dto.CalibrationJobRequest;
import com.astrocal.backend.model.StackingSettings;
import lombok.Value;

import java.util.UUID;

@Value
public class CalibrationJobSubmittedEvent {
	UUID jobId;
	CalibrationJobRequest request;
	StackingSettings settings;
}
