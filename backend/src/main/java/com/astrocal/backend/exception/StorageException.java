package com.astrocal.backend.exception;

public class StorageException extends CalibrationException {
	public StorageException(String message, Throwable cause) {
		super(message, cause);
	}
}
