package com.astrocal.backend.correction;

import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.image.ImageBuffer;

import java.util.Map;

/**
 * Cosmic ray detection and cleaning for the {@code la_cosmic} cosmetic method.
 */
public interface CosmicRayDetector {

	/**
	 * @param sigmaClip detection threshold in standard deviations
	 * @param params    extra detector options, passed through as given
	 * @throws ExternalToolException when no detector is available or it fails
	 */
	CosmicRayResult detect(ImageBuffer image, double sigmaClip, Map<String, Object> params) throws ExternalToolException;
}
