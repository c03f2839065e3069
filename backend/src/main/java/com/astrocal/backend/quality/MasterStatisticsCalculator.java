package com.astrocal.backend.quality;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.model.Histogram;
import com.astrocal.backend.model.MasterFrameStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MasterStatisticsCalculator {

	static final double OUTLIER_SIGMA = 5.0;

	private final CalibrationProperties properties;

	public MasterFrameStats compute(ImageBuffer image) {
		double mean = image.mean();
		double std = image.std();
		double min = image.min();
		double max = image.max();

		long outliers = 0;
		double limit = OUTLIER_SIGMA * std;
		for (int i = 0; i < image.pixelCount(); i++) {
			if (Math.abs(image.get(i) - mean) > limit) {
				outliers++;
			}
		}
		return new MasterFrameStats(mean, image.median(), std, min, max,
				(double) outliers / image.pixelCount(), histogram(image, min, max));
	}

	/**
	 * Equal width bins spanning [min, max]; the last bin includes the maximum. A constant image
	 * puts everything into the first bin of a unit-wide range.
	 */
	public Histogram histogram(ImageBuffer image, double min, double max) {
		int bins = Math.max(1, properties.getHistogramBins());
		double upper = max > min ? max : min + 1.0;
		double width = (upper - min) / bins;
		double[] edges = new double[bins + 1];
		for (int i = 0; i <= bins; i++) {
			edges[i] = min + i * width;
		}
		edges[bins] = upper;

		long[] counts = new long[bins];
		for (int i = 0; i < image.pixelCount(); i++) {
			int bin = (int) ((image.get(i) - min) / width);
			counts[Math.max(0, Math.min(bin, bins - 1))]++;
		}
		return new Histogram(counts, edges);
	}
}
