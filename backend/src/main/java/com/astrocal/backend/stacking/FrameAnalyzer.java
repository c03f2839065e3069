package com.astrocal.backend.stacking;

import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.model.FrameSetStatistics;
import com.astrocal.backend.model.StackingRecommendation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

/**
 * Set-level statistics of a frame stack and the stacking method recommendation built on them.
 */
@Component
@Slf4j
public class FrameAnalyzer {

	static final double OUTLIER_SIGMA = 5.0;
	static final double HIGH_OUTLIER_RATIO = 0.001;
	static final int FEW_FRAMES_FOR_CLIPPING = 10;
	static final double LOW_VARIANCE = 10.0;
	static final int FEW_FRAMES = 5;
	static final double ROBUST_SIGMA = 2.5;
	static final double DEFAULT_SIGMA = 3.0;

	public FrameSetStatistics analyze(List<ImageBuffer> frames) throws ShapeMismatchException {
		if (frames.isEmpty()) {
			throw new IllegalArgumentException("At least one frame is required for analysis");
		}
		ImageBuffer first = frames.get(0);
		for (int i = 1; i < frames.size(); i++) {
			first.requireSameShape(frames.get(i), "Frame " + i);
		}
		int n = frames.size();
		int width = first.getWidth();
		int height = first.getHeight();

		double[] rowSum = new double[height];
		double[] rowStdSum = new double[height];
		long[] rowOutliers = new long[height];

		IntStream.range(0, height).parallel().forEach(y -> {
			double[] samples = new double[n];
			double sum = 0;
			double stdSum = 0;
			long outliers = 0;
			for (int x = 0; x < width; x++) {
				int index = y * width + x;
				for (int k = 0; k < n; k++) {
					samples[k] = frames.get(k).get(index);
					sum += samples[k];
				}
				double mean = mean(samples);
				double std = std(samples, mean);
				stdSum += std;
				double limit = OUTLIER_SIGMA * std;
				for (double v : samples) {
					if (Math.abs(v - mean) > limit) {
						outliers++;
					}
				}
			}
			rowSum[y] = sum;
			rowStdSum[y] = stdSum;
			rowOutliers[y] = outliers;
		});

		long totalSamples = (long) n * width * height;
		double globalMean = sum(rowSum) / totalSamples;

		double[] rowSq = new double[height];
		IntStream.range(0, height).parallel().forEach(y -> {
			double sq = 0;
			for (int x = 0; x < width; x++) {
				int index = y * width + x;
				for (ImageBuffer frame : frames) {
					double d = frame.get(index) - globalMean;
					sq += d * d;
				}
			}
			rowSq[y] = sq;
		});

		long outlierCount = 0;
		for (long count : rowOutliers) {
			outlierCount += count;
		}
		return new FrameSetStatistics(
				n,
				sum(rowSq) / totalSamples,
				(double) outlierCount / totalSamples,
				globalMean,
				sum(rowStdSum) / ((long) width * height));
	}

	/**
	 * Picks a concrete stacking method for the given statistics. Rules are checked in order:
	 * many outliers with few frames, many outliers, low variance, few frames; otherwise the
	 * requested method stands. Never throws and never answers {@link StackingMethod#ADAPTIVE}.
	 */
	public StackingRecommendation recommend(FrameSetStatistics stats, StackingMethod requested, Double requestedSigma) {
		double sigma = requestedSigma != null && requestedSigma > 0 ? requestedSigma : DEFAULT_SIGMA;
		if (stats == null) {
			return new StackingRecommendation(StackingMethod.MEDIAN, sigma, "No frame statistics available, median is the safe default.");
		}
		double outlierRatio = stats.getOutlierRatio();
		if (outlierRatio > HIGH_OUTLIER_RATIO) {
			if (stats.getNFrames() < FEW_FRAMES_FOR_CLIPPING) {
				return new StackingRecommendation(StackingMethod.MEDIAN, sigma, String.format(Locale.ROOT,
						"High outlier ratio (%.2f%%) with few frames, median is robust against outliers with few frames.",
						outlierRatio * 100));
			}
			return new StackingRecommendation(StackingMethod.SIGMA, ROBUST_SIGMA, String.format(Locale.ROOT,
					"High outlier ratio (%.2f%%), sigma clipping at 2.5 rejects them.", outlierRatio * 100));
		}
		if (stats.getGlobalVariance() < LOW_VARIANCE) {
			return new StackingRecommendation(StackingMethod.MEAN, sigma, String.format(Locale.ROOT,
					"Very low variance (%.2f), low variance, mean is efficient.", stats.getGlobalVariance()));
		}
		if (stats.getNFrames() < FEW_FRAMES) {
			return new StackingRecommendation(StackingMethod.MEDIAN, sigma, String.format(Locale.ROOT,
					"Only %d frames, too few frames for aggressive rejection.", stats.getNFrames()));
		}
		if (requested == null || !requested.isConcrete()) {
			return new StackingRecommendation(StackingMethod.MEDIAN, sigma,
					"No strong outlier or variance signal, median stacking.");
		}
		return new StackingRecommendation(requested, sigma,
				"No strong outlier or variance signal, the requested method is reasonable.");
	}

	private static double mean(double[] samples) {
		double sum = 0;
		for (double v : samples) {
			sum += v;
		}
		return sum / samples.length;
	}

	private static double std(double[] samples, double mean) {
		double sq = 0;
		for (double v : samples) {
			double d = v - mean;
			sq += d * d;
		}
		return Math.sqrt(sq / samples.length);
	}

	private static double sum(double[] values) {
		double total = 0;
		for (double v : values) {
			total += v;
		}
		return total;
	}
}
