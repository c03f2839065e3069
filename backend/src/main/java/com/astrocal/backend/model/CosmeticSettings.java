package com.astrocal.backend.model;

import com.astrocal.backend.enums.CosmeticMethod;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CosmeticSettings {
	public static final double DEFAULT_THRESHOLD = 5.0;

	boolean enabled;
	@Builder.Default
	CosmeticMethod method = CosmeticMethod.HOT_PIXEL_MAP;
	@Builder.Default
	double threshold = DEFAULT_THRESHOLD;
	@Builder.Default
	Map<String, Object> params = Map.of();

	public static CosmeticSettings disabled() {
		return CosmeticSettings.builder().enabled(false).build();
	}
}
