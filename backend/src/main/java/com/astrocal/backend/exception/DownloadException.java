package com.astrocal.backend.exception;

public class DownloadException extends CalibrationException {
	public DownloadException(String bucket, String path, Throwable cause) {
		super(String.format("Download of %s/%s failed: %s", bucket, path, cause.getMessage()), cause);
	}

	public DownloadException(String message) {
		super(message);
	}
}
