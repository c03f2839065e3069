package com.astrocal.backend.exception;

public class UnsupportedMethodException extends CalibrationException {
	public UnsupportedMethodException(String kind, String name) {
		super(String.format("Unknown %s method: %s", kind, name));
	}
}
