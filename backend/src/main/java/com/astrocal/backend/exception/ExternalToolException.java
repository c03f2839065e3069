package com.astrocal.backend.exception;

public class ExternalToolException extends CalibrationException {
	public ExternalToolException(String message) {
		super(message);
	}

	public ExternalToolException(String message, Throwable cause) {
		super(message, cause);
	}
}
