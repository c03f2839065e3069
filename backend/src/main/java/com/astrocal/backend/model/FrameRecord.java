package com.astrocal.backend.model;

import com.astrocal.backend.image.ImageBuffer;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * One input exposure. Records are immutable: validation and corrections hand back new
 * instances, so the frame as read from storage is always still available.
 */
@Value
@Builder(toBuilder = true)
public class FrameRecord {
	/** Storage path the frame was downloaded from. */
	String path;
	FrameHeader header;
	@With
	ImageBuffer image;
	@With
	@Builder.Default
	ValidationStatus validationStatus = ValidationStatus.PENDING;
	@Singular
	List<String> rejectionReasons;

	public static FrameRecord of(String path, FrameHeader header, ImageBuffer image) {
		return FrameRecord.builder().path(path).header(header).image(image).build();
	}

	public String fileName() {
		int slash = path.lastIndexOf('/');
		return slash >= 0 ? path.substring(slash + 1) : path;
	}

	public FrameRecord accepted() {
		return toBuilder().validationStatus(ValidationStatus.VALID).clearRejectionReasons().build();
	}

	public FrameRecord rejected(List<String> reasons) {
		return toBuilder().validationStatus(ValidationStatus.REJECTED).clearRejectionReasons().rejectionReasons(reasons).build();
	}
}
