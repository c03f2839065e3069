package com.astrocal.backend.exception;

public class ShapeMismatchException extends CalibrationException {
	public ShapeMismatchException(String what, int expectedWidth, int expectedHeight, int actualWidth, int actualHeight) {
		super(String.format("%s shape mismatch: expected %dx%d but got %dx%d",
				what, expectedWidth, expectedHeight, actualWidth, actualHeight));
	}
}
