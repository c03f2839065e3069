package com.astrocal.backend.correction;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.exception.CalibrationException;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.exception.StorageException;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.image.SampleMath;
import com.astrocal.backend.model.FrameHeader;
import com.astrocal.backend.model.FrameRecord;
import com.astrocal.backend.storage.ObjectStorage;
import com.astrocal.backend.storage.StoredObject;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pre-stack corrections for dark frames: bias subtraction, temperature and exposure matching
 * against the light frames, and the light/dark scale factor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CalibrationCorrector {

	static final String MASTER_BIAS_FOLDER = "master-bias";
	static final String CCD_TEMP = "CCD-TEMP";
	static final String EXPTIME = "EXPTIME";

	private final ObjectStorage objectStorage;
	private final CalibrationProperties properties;

	/**
	 * Storage path of the master bias to subtract: the manual selection when given, otherwise the
	 * lexicographically latest FITS file in the project's master bias folder.
	 */
	public String selectMasterBias(String bucket, String userId, String projectId, String manualPath) throws CalibrationException {
		if (manualPath != null && !manualPath.isBlank()) {
			log.info("Using manually selected master bias: {}", manualPath);
			return manualPath;
		}
		String prefix = userId + "/" + projectId + "/" + MASTER_BIAS_FOLDER + "/";
		List<StoredObject> candidates;
		try {
			candidates = objectStorage.list(bucket, prefix);
		} catch (StorageException e) {
			throw new CalibrationException("Master bias auto-selection failed: " + e.getMessage(), e);
		}
		Optional<String> latest = candidates.stream()
				.map(StoredObject::getName)
				.filter(name -> {
					String extension = FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
					return extension.equals("fit") || extension.equals("fits");
				})
				.max(Comparator.naturalOrder());
		if (latest.isEmpty()) {
			throw new CalibrationException("No master bias found for project " + projectId);
		}
		log.info("Auto-selected master bias: {}{}", prefix, latest.get());
		return prefix + latest.get();
	}

	/**
	 * Returns {@code dark − bias} as a new record; the dark's header is kept as it was.
	 */
	public FrameRecord subtractBias(FrameRecord dark, ImageBuffer masterBias) throws ShapeMismatchException {
		if (!masterBias.sameShape(dark.getImage())) {
			throw new ShapeMismatchException("Master bias for " + dark.fileName(),
					dark.getImage().getWidth(), dark.getImage().getHeight(),
					masterBias.getWidth(), masterBias.getHeight());
		}
		return dark.withImage(dark.getImage().subtract(masterBias));
	}

	/**
	 * Keeps the darks whose {@code CCD-TEMP} and {@code EXPTIME} are within tolerance of the
	 * reference light. A missing value on either side never excludes a frame. When nothing
	 * matches, every dark is kept and a warning is returned.
	 */
	public MatchResult matchTemperatureAndExposure(List<FrameRecord> darks, FrameHeader referenceLight,
												   boolean matchTemperature, boolean matchExposure) {
		if (referenceLight == null || (!matchTemperature && !matchExposure)) {
			return new MatchResult(darks, null);
		}
		Double referenceTemp = referenceLight.getDouble(CCD_TEMP);
		Double referenceExposure = referenceLight.getDouble(EXPTIME);

		List<FrameRecord> matched = new ArrayList<>();
		for (FrameRecord dark : darks) {
			boolean tempOk = !matchTemperature
					|| within(dark.getHeader().getDouble(CCD_TEMP), referenceTemp, properties.getTemperatureTolerance());
			boolean exposureOk = !matchExposure
					|| within(dark.getHeader().getDouble(EXPTIME), referenceExposure, properties.getExposureTolerance());
			if (tempOk && exposureOk) {
				matched.add(dark);
			}
		}
		if (matched.isEmpty()) {
			String warning = "No darks matched temperature/exposure criteria; using all " + darks.size() + " darks";
			log.warn(warning);
			return new MatchResult(darks, warning);
		}
		log.info("Using {} darks after temperature/exposure matching (of {})", matched.size(), darks.size());
		return new MatchResult(matched, null);
	}

	/**
	 * {@code median(lights) / median(darks)} over all samples of each set, clamped to the
	 * configured range. 1.0 without lights or when the dark median is zero.
	 */
	public double darkScaleFactor(List<ImageBuffer> lights, List<ImageBuffer> darks) {
		if (lights == null || lights.isEmpty() || darks == null || darks.isEmpty()) {
			return 1.0;
		}
		double darkMedian = pooledMedian(darks);
		if (darkMedian == 0) {
			return 1.0;
		}
		double factor = pooledMedian(lights) / darkMedian;
		double clamped = Math.max(properties.getDarkScaleMin(), Math.min(properties.getDarkScaleMax(), factor));
		log.info("Dark scale factor {} (raw {})", clamped, factor);
		return clamped;
	}

	private static boolean within(Double value, Double reference, double tolerance) {
		if (value == null || reference == null) {
			return true;
		}
		return Math.abs(value - reference) <= tolerance;
	}

	private static double pooledMedian(List<ImageBuffer> images) {
		int total = 0;
		for (ImageBuffer image : images) {
			total += image.pixelCount();
		}
		double[] pooled = new double[total];
		int offset = 0;
		for (ImageBuffer image : images) {
			for (int i = 0; i < image.pixelCount(); i++) {
				pooled[offset++] = image.get(i);
			}
		}
		Arrays.sort(pooled);
		return SampleMath.medianOfSorted(pooled, total);
	}

	@Value
	public static class MatchResult {
		List<FrameRecord> frames;
		/** Set when the matching fell back to the unfiltered set. */
		String warning;
	}
}
