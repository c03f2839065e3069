package com.astrocal.backend.validation;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.enums.FrameType;
import com.astrocal.backend.model.FrameHeader;
import com.astrocal.backend.model.HeaderAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header based frame classification.
 *
 * <p>The frame type comes from {@code IMAGETYP}, {@code FRAME} or {@code OBSTYPE}; without any
 * of those it is guessed from the exposure time and the presence of {@code OBJECT} and
 * {@code FILTER}. Confidence adds up from the available evidence:
 * <ul>
 *     <li>0.6 for an explicit {@code IMAGETYP}</li>
 *     <li>0.2 for an exposure time</li>
 *     <li>0.2 for a known camera</li>
 *     <li>0.2 for an object name on a light frame</li>
 *     <li>0.2 for filter information, plus 0.1 for a known filter manufacturer</li>
 * </ul>
 * capped at 1 and reduced by 0.5 for a light frame with a non-positive exposure.
 */
@Component
@RequiredArgsConstructor
public class HeaderFrameMetadataAnalyzer implements FrameMetadataAnalyzer {

	private static final String[] TYPE_KEYS = {"IMAGETYP", "FRAME", "OBSTYPE"};
	private static final String[] CAMERA_KEYS = {"INSTRUME", "CAMERA", "DETECTOR"};
	private static final String[] FILTER_KEYS = {"FILTER", "FILT", "FILTER1", "FILTER2"};

	private static final String LIGHT_FILTER_DESCRIPTION = "Filter used - Color Camera: None (OSC only), UV/IR Cut, "
			+ "Light Pollution, Duo-Band Ha/OIII (6nm/7nm), Duo-Band Ha/OIII (12nm), Tri-Band Ha/OIII/SII (6nm/7nm), "
			+ "UV/IR Cut + Duo-Band, UV/IR Cut + Light Pollution | Mono: LRGB Set, Narrowband Set Ha/OIII/SII, "
			+ "Ha (3nm), Ha (6nm/7nm), OIII (3nm), OIII (6nm/7nm), SII (3nm), SII (6nm/7nm)";

	private final CalibrationProperties properties;

	@Override
	public HeaderAnalysis analyze(FrameHeader header) {
		List<String> warnings = new ArrayList<>();
		FrameType frameType = inferFrameType(header);
		String camera = detectCamera(header);
		String filter = firstValue(header, FILTER_KEYS);
		String manufacturer = filter != null ? identifyManufacturer(filter) : null;
		Double exposure = header.getDouble("EXPTIME");

		if (frameType == FrameType.FLAT) {
			warnings.add("Ensure flat frame filter exactly matches light frame filter (including bandwidth)");
		}

		double confidence = 0;
		if (header.contains("IMAGETYP")) {
			confidence += 0.6;
		}
		if (exposure != null) {
			confidence += 0.2;
		}
		if (camera != null) {
			confidence += 0.2;
		}
		if (frameType == FrameType.LIGHT && header.contains("OBJECT")) {
			confidence += 0.2;
		}
		if (filter != null) {
			confidence += 0.2;
			if (manufacturer != null) {
				confidence += 0.1;
			}
		}
		confidence = Math.min(1.0, confidence);
		if (frameType == FrameType.LIGHT && exposure != null && exposure <= 0) {
			confidence = Math.max(0.0, confidence - 0.5);
			warnings.add("Exposure time is zero or negative for light frame");
		}

		Map<String, Boolean> present = new LinkedHashMap<>();
		present.put("exposure_time", exposure != null);
		present.put("gain", header.contains("GAIN"));
		present.put("temperature", header.contains("CCD-TEMP") || header.contains("CCDTEMP"));
		present.put("object", header.contains("OBJECT"));
		present.put("filter", filter != null);
		present.put("focal_length", header.contains("FOCALLEN"));
		requiredMetadata(frameType).forEach((field, description) -> {
			if (!present.getOrDefault(field, false)) {
				warnings.add("Missing " + field + ": " + description);
			}
		});
		if (camera != null && filter == null && properties.getColorCameras().contains(camera)) {
			warnings.add("Color camera detected but no filter information found");
		}

		return new HeaderAnalysis(frameType, Math.round(confidence * 1e9) / 1e9, warnings);
	}

	FrameType inferFrameType(FrameHeader header) {
		for (String key : TYPE_KEYS) {
			String value = header.getString(key);
			if (value == null) {
				continue;
			}
			String type = value.toLowerCase(Locale.ROOT);
			if (type.contains("light") || type.contains("object")) {
				return FrameType.LIGHT;
			}
			if (type.contains("dark")) {
				return FrameType.DARK;
			}
			if (type.contains("flat")) {
				return FrameType.FLAT;
			}
			if (type.contains("bias") || type.contains("zero")) {
				return FrameType.BIAS;
			}
		}

		double exposure = header.getDouble("EXPTIME", 0.0);
		String object = header.getString("OBJECT");
		if (exposure < 0.01) {
			return FrameType.BIAS;
		}
		if (exposure < 5.0 && object != null && object.toLowerCase(Locale.ROOT).contains("flat")) {
			return FrameType.FLAT;
		}
		if (exposure > 10 && object != null) {
			return FrameType.LIGHT;
		}
		if (!header.contains("FILTER") && object == null) {
			return FrameType.DARK;
		}
		return FrameType.UNKNOWN;
	}

	private String detectCamera(FrameHeader header) {
		String cameraName = null;
		for (String key : CAMERA_KEYS) {
			String value = header.getString(key);
			if (value == null) {
				continue;
			}
			cameraName = value;
			for (String known : properties.getKnownCameras()) {
				if (known.equals(value)) {
					return known;
				}
			}
		}
		if (cameraName != null) {
			String lower = cameraName.toLowerCase(Locale.ROOT);
			for (String known : properties.getKnownCameras()) {
				if (lower.contains(known.toLowerCase(Locale.ROOT))) {
					return known;
				}
			}
		}
		return null;
	}

	private String identifyManufacturer(String filter) {
		String lower = filter.toLowerCase(Locale.ROOT);
		for (String manufacturer : properties.getKnownFilterManufacturers()) {
			if (lower.contains(manufacturer.toLowerCase(Locale.ROOT))) {
				return manufacturer;
			}
		}
		return null;
	}

	private static String firstValue(FrameHeader header, String[] keys) {
		for (String key : keys) {
			String value = header.getString(key);
			if (value != null) {
				return value;
			}
		}
		return null;
	}

	private static Map<String, String> requiredMetadata(FrameType frameType) {
		Map<String, String> fields = new LinkedHashMap<>();
		fields.put("exposure_time", "Exposure time in seconds");
		fields.put("gain", "Camera gain setting");
		fields.put("temperature", "CCD temperature in Celsius");
		if (frameType == FrameType.LIGHT) {
			fields.put("object", "Name of the target object");
			fields.put("filter", LIGHT_FILTER_DESCRIPTION);
			fields.put("focal_length", "Telescope focal length in mm");
		} else if (frameType == FrameType.FLAT) {
			fields.put("filter", "Filter used (must exactly match light frames)");
		}
		return fields;
	}
}
