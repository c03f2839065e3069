package com.astrocal.backend.exception;

/**
 * Base type for every condition the calibration pipeline can report. The message is meant
 * to end up verbatim in the job record, so it must read as plain language.
 */
public class CalibrationException extends Exception {
	public CalibrationException(String message) {
		super(message);
	}

	public CalibrationException(String message, Throwable cause) {
		super(message, cause);
	}
}
