package com.astrocal.backend.entity;

import com.astrocal.backend.enums.JobStatus;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "calibration_jobs")
@Data
public class CalibrationJobEntity {
	@Id
	private UUID id;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false)
	private JobStatus status;

	@Column(nullable = false)
	private int progress;

	@Column(columnDefinition = "text")
	private String error;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "job_parameters", columnDefinition = "jsonb")
	private String jobParameters;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "result", columnDefinition = "jsonb")
	private String result;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "diagnostics", columnDefinition = "jsonb")
	private String diagnostics;

	@CreationTimestamp
	@Column(name = "created_at", updatable = false)
	private Instant createdAt;

	@UpdateTimestamp
	@Column(name = "updated_at")
	private Instant updatedAt;

	@Column(name = "completed_at")
	private Instant completedAt;

	/**
	 * Moves the job to {@code next} unless it already reached a terminal state. Staying in the
	 * current non-terminal state is allowed.
	 *
	 * @return whether the job now has status {@code next}
	 */
	public boolean moveTo(JobStatus next) {
		if (status == next && !status.isTerminal()) {
			return true;
		}
		if (status != null && !status.canTransitionTo(next)) {
			return false;
		}
		status = next;
		if (next.isTerminal()) {
			completedAt = Instant.now();
		}
		return true;
	}
}
