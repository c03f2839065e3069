package com.astrocal.backend.model;

public enum ValidationStatus {
	PENDING,
	VALID,
	REJECTED
}
