package com.astrocal.backend.controller;

import com.astrocal.backend.exception.JobNotFoundException;
import com.astrocal.backend.exception.UnsupportedMethodException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

	@ExceptionHandler({UnsupportedMethodException.class, IllegalArgumentException.class})
	public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
		return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
		return body(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request body");
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
		String message = ex.getBindingResult().getFieldErrors().stream()
				.findFirst()
				.map(err -> err.getField() + " " + err.getDefaultMessage())
				.orElse("validation failed");
		return body(HttpStatus.BAD_REQUEST, "validation_error", message);
	}

	@ExceptionHandler(JobNotFoundException.class)
	public ResponseEntity<Map<String, Object>> handleNotFound(JobNotFoundException ex) {
		return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
		log.error("Unhandled API error", ex);
		return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
				ex.getMessage() == null ? "unexpected error" : ex.getMessage());
	}

	private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
		return ResponseEntity.status(status).body(Map.of(
				"timestamp", Instant.now().toString(),
				"error", error,
				"message", message == null ? error : message
		));
	}
}
