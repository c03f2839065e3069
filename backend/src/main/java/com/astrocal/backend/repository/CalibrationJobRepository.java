package com.astrocal.backend.repository;

import com.astrocal.backend.entity.CalibrationJobEntity;
import com.astrocal.backend.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

@Repository
public interface CalibrationJobRepository extends JpaRepository<CalibrationJobEntity, UUID> {

	/**
	 * Sets the status only while the stored row is still in one of {@code from}.
	 *
	 * @return number of rows changed, 0 when the job is gone or already moved elsewhere
	 */
	@Modifying(flushAutomatically = true, clearAutomatically = true)
	@Query("update CalibrationJobEntity j set j.status = :next, j.completedAt = :completedAt, j.updatedAt = :updatedAt "
			+ "where j.id = :id and j.status in :from")
	int transition(@Param("id") UUID id, @Param("from") Collection<JobStatus> from, @Param("next") JobStatus next,
				   @Param("completedAt") Instant completedAt, @Param("updatedAt") Instant updatedAt);

	@Modifying(flushAutomatically = true, clearAutomatically = true)
	@Query("update CalibrationJobEntity j set j.progress = :progress, j.updatedAt = :updatedAt "
			+ "where j.id = :id and j.status in :from")
	int updateProgress(@Param("id") UUID id, @Param("from") Collection<JobStatus> from, @Param("progress") int progress,
					   @Param("updatedAt") Instant updatedAt);

	long deleteByStatusInAndCompletedAtBefore(Collection<JobStatus> statuses, Instant cutoff);
}
