package com.astrocal.backend.correction;

import com.astrocal.backend.enums.CosmeticMethod;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.image.ImageBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Map;

/**
 * Post-stack pixel repair. Bad pixel map entries are fixed first, then the statistical or
 * external method runs on the result. Inputs are never modified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CosmeticCorrector {

	private final CosmicRayDetector cosmicRayDetector;

	/**
	 * Replaces every pixel flagged (non-zero) in {@code badPixelMap} with the median of its
	 * 3×3 neighbourhood.
	 */
	public ImageBuffer replaceBadPixels(ImageBuffer image, ImageBuffer badPixelMap) throws ShapeMismatchException {
		image.requireSameShape(badPixelMap, "Bad pixel map");
		boolean[] mask = new boolean[image.pixelCount()];
		int flagged = 0;
		for (int i = 0; i < mask.length; i++) {
			if (badPixelMap.get(i) != 0) {
				mask[i] = true;
				flagged++;
			}
		}
		log.info("Replacing {} pixels flagged by the bad pixel map", flagged);
		return flagged == 0 ? image : replaceWithNeighbourhoodMedian(image, mask);
	}

	public ImageBuffer applyMethod(ImageBuffer image, CosmeticMethod method, double threshold,
								   Map<String, Object> params) throws ExternalToolException {
		switch (method) {
			case HOT_PIXEL_MAP:
				return hotPixelMap(image, threshold);
			case LA_COSMIC:
				CosmicRayResult result = cosmicRayDetector.detect(image, threshold, params == null ? Map.of() : params);
				log.info("Cosmic ray detector flagged {} pixels", result.flaggedPixels());
				return result.getCleaned();
			default:
				throw new IllegalStateException("No cosmetic correction for " + method);
		}
	}

	private ImageBuffer hotPixelMap(ImageBuffer image, double threshold) {
		double mean = image.mean();
		double limit = threshold * image.std();
		boolean[] mask = new boolean[image.pixelCount()];
		int flagged = 0;
		for (int i = 0; i < mask.length; i++) {
			if (image.get(i) > mean + limit || image.get(i) < mean - limit) {
				mask[i] = true;
				flagged++;
			}
		}
		log.info("Hot pixel map flagged {} pixels beyond {} sigma", flagged, threshold);
		return flagged == 0 ? image : replaceWithNeighbourhoodMedian(image, mask);
	}

	/** Neighbourhood medians always come from the uncorrected {@code image}. */
	private static ImageBuffer replaceWithNeighbourhoodMedian(ImageBuffer image, boolean[] mask) {
		int width = image.getWidth();
		int height = image.getHeight();
		double[] out = image.toArray();
		double[] window = new double[9];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (!mask[y * width + x]) {
					continue;
				}
				int k = 0;
				for (int dy = -1; dy <= 1; dy++) {
					for (int dx = -1; dx <= 1; dx++) {
						window[k++] = image.get(reflect(x + dx, width), reflect(y + dy, height));
					}
				}
				Arrays.sort(window);
				out[y * width + x] = window[4];
			}
		}
		return ImageBuffer.wrap(width, height, out);
	}

	/** Mirror index without repeating the edge sample. */
	static int reflect(int index, int size) {
		if (size == 1) {
			return 0;
		}
		if (index < 0) {
			return -index;
		}
		if (index >= size) {
			return 2 * size - 2 - index;
		}
		return index;
	}
}
