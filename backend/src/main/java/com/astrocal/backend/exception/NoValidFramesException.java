package com.astrocal.backend.exception;

import com.astrocal.backend.model.RejectedFrame;

import java.util.List;

public class NoValidFramesException extends CalibrationException {

	private final List<RejectedFrame> rejectedFrames;

	public NoValidFramesException(List<RejectedFrame> rejectedFrames) {
		super(String.format("No valid frames for stacking: all %d frames were rejected", rejectedFrames.size()));
		this.rejectedFrames = List.copyOf(rejectedFrames);
	}

	public List<RejectedFrame> getRejectedFrames() {
		return rejectedFrames;
	}
}
