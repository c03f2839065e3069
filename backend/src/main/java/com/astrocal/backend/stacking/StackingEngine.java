package com.astrocal.backend.stacking;

import com.astrocal.backend.enums.StackingMethod;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.image.SampleMath;
import com.astrocal.backend.model.FrameSetStatistics;
import com.astrocal.backend.model.StackingRecommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

/**
 * Combines N equally shaped frames into one image, pixel by pixel. Rows are reduced in
 * parallel; every pixel only ever looks at its own N samples.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StackingEngine {

	public static final double DEFAULT_SIGMA = 3.0;
	static final int SIGMA_MAX_ITERATIONS = 5;
	static final double DEFAULT_PERCENTILE_LOW = 20.0;
	static final double DEFAULT_PERCENTILE_HIGH = 80.0;
	static final int ENTROPY_MAX_BINS = 16;
	static final double MIN_ENTROPY_WEIGHT = 0.001;

	private final FrameAnalyzer frameAnalyzer;
	private final SuperbiasDecomposer superbiasDecomposer;

	/**
	 * Stacks {@code frames} with {@code method}. {@link StackingMethod#ADAPTIVE} analyzes the set
	 * first and dispatches to the recommended method exactly once.
	 *
	 * @param threshold sigma multiplier for the clipping methods, keep-percentage for
	 *                  {@code percentile_clip}; {@code null} selects the method default
	 */
	public StackResult combine(List<ImageBuffer> frames, StackingMethod method, Double threshold)
			throws ShapeMismatchException, ExternalToolException {
		if (frames == null || frames.isEmpty()) {
			throw new IllegalArgumentException("At least one frame is required for stacking");
		}
		ImageBuffer first = frames.get(0);
		for (int i = 1; i < frames.size(); i++) {
			first.requireSameShape(frames.get(i), "Frame " + i);
		}

		StackResult.StackResultBuilder result = StackResult.builder()
				.requestedMethod(method)
				.diagnostic("frames", frames.size());

		StackingMethod concrete = method;
		Double effectiveThreshold = threshold;
		if (method == StackingMethod.ADAPTIVE) {
			FrameSetStatistics stats = frameAnalyzer.analyze(frames);
			StackingRecommendation recommendation = frameAnalyzer.recommend(stats, method, threshold);
			log.info("Adaptive stacking selected {} (sigma {}): {}",
					recommendation.getMethod().wireName(), recommendation.getSigma(), recommendation.getReason());
			concrete = recommendation.getMethod();
			effectiveThreshold = recommendation.getSigma();
			result.recommendation(recommendation)
					.diagnostic("adaptive_reason", recommendation.getReason())
					.diagnostic("analysis", stats);
		}

		ImageBuffer image;
		switch (concrete) {
			case MEAN:
				image = reduce(frames, (samples, n, work, sorted) -> SampleMath.mean(samples, n));
				break;
			case MEDIAN:
				image = reduce(frames, (samples, n, work, sorted) -> SampleMath.median(samples, n, sorted));
				break;
			case SIGMA:
				image = sigmaClip(frames, sigmaFor(effectiveThreshold, result), result);
				break;
			case WINSORIZED:
				image = winsorize(frames, sigmaFor(effectiveThreshold, result));
				break;
			case MINMAX:
				image = minMax(frames, result);
				break;
			case LINEAR_FIT:
				image = linearFit(frames, sigmaFor(effectiveThreshold, result), result);
				break;
			case PERCENTILE_CLIP:
				image = percentileClip(frames, effectiveThreshold, result);
				break;
			case ENTROPY_WEIGHTED:
				image = entropyWeighted(frames);
				break;
			case SUPERBIAS:
				image = superbias(frames, result);
				break;
			default:
				throw new IllegalStateException("No pixel combiner for " + concrete);
		}

		log.debug("Stacked {} frames of {}x{} with {}", frames.size(), first.getWidth(), first.getHeight(), concrete.wireName());
		return result
				.image(image)
				.method(concrete)
				.threshold(effectiveThreshold)
				.diagnostic("method", concrete.wireName())
				.build();
	}

	private ImageBuffer sigmaClip(List<ImageBuffer> frames, double k, StackResult.StackResultBuilder result) {
		AtomicLong fallbacks = new AtomicLong();
		ImageBuffer image = reduce(frames, (samples, n, work, sorted) -> {
			System.arraycopy(samples, 0, work, 0, n);
			int count = n;
			for (int iteration = 0; iteration < SIGMA_MAX_ITERATIONS; iteration++) {
				double mean = SampleMath.mean(work, count);
				double limit = k * SampleMath.std(work, count);
				int kept = 0;
				for (int i = 0; i < count; i++) {
					if (Math.abs(work[i] - mean) <= limit) {
						work[kept++] = work[i];
					}
				}
				if (kept == 0) {
					fallbacks.incrementAndGet();
					return SampleMath.mean(samples, n);
				}
				if (kept == count) {
					break;
				}
				count = kept;
			}
			return SampleMath.mean(work, count);
		});
		if (fallbacks.get() > 0) {
			result.warning(fallbacks.get() + " pixels had every sample clipped, used the unclipped mean");
		}
		return image;
	}

	/**
	 * Clamps every sample into {@code median ± k·std} of its pixel, then averages the clamped values.
	 */
	private ImageBuffer winsorize(List<ImageBuffer> frames, double k) {
		return reduce(frames, (samples, n, work, sorted) -> {
			double median = SampleMath.median(samples, n, sorted);
			double spread = k * SampleMath.std(samples, n);
			double low = median - spread;
			double high = median + spread;
			double sum = 0;
			for (int i = 0; i < n; i++) {
				sum += Math.max(low, Math.min(high, samples[i]));
			}
			return sum / n;
		});
	}

	private ImageBuffer minMax(List<ImageBuffer> frames, StackResult.StackResultBuilder result) {
		if (frames.size() <= 2) {
			result.warning("minmax needs more than 2 frames, used the mean of " + frames.size());
			return reduce(frames, (samples, n, work, sorted) -> SampleMath.mean(samples, n));
		}
		return reduce(frames, (samples, n, work, sorted) -> {
			System.arraycopy(samples, 0, sorted, 0, n);
			Arrays.sort(sorted, 0, n);
			double sum = 0;
			for (int i = 1; i < n - 1; i++) {
				sum += sorted[i];
			}
			return sum / (n - 2);
		});
	}

	private ImageBuffer linearFit(List<ImageBuffer> frames, double k, StackResult.StackResultBuilder result) {
		AtomicLong fallbacks = new AtomicLong();
		ImageBuffer image = reduce(frames, (samples, n, work, sorted) -> {
			if (n == 1) {
				return samples[0];
			}
			double xMean = (n - 1) / 2.0;
			double yMean = SampleMath.mean(samples, n);
			double sxx = 0;
			double sxy = 0;
			for (int i = 0; i < n; i++) {
				double dx = i - xMean;
				sxx += dx * dx;
				sxy += dx * (samples[i] - yMean);
			}
			double slope = sxy / sxx;
			double intercept = yMean - slope * xMean;
			for (int i = 0; i < n; i++) {
				work[i] = samples[i] - (intercept + slope * i);
			}
			double limit = k * SampleMath.std(work, n);
			double sum = 0;
			int kept = 0;
			for (int i = 0; i < n; i++) {
				if (Math.abs(work[i]) < limit) {
					sum += samples[i];
					kept++;
				}
			}
			if (kept == 0) {
				fallbacks.incrementAndGet();
				return yMean;
			}
			return sum / kept;
		});
		if (fallbacks.get() > 0) {
			result.warning(fallbacks.get() + " pixels kept no sample after the linear fit, used the raw mean");
		}
		return image;
	}

	private ImageBuffer percentileClip(List<ImageBuffer> frames, Double keepPercent, StackResult.StackResultBuilder result) {
		double low = DEFAULT_PERCENTILE_LOW;
		double high = DEFAULT_PERCENTILE_HIGH;
		if (keepPercent != null) {
			if (keepPercent > 0 && keepPercent <= 100) {
				double tail = (100.0 - keepPercent) / 2.0;
				low = tail;
				high = 100.0 - tail;
			} else {
				result.warning(String.format(Locale.ROOT,
						"Percentile threshold %.2f outside (0, 100], used the default %.0f-%.0f range",
						keepPercent, DEFAULT_PERCENTILE_LOW, DEFAULT_PERCENTILE_HIGH));
			}
		}
		double lowPercent = low;
		double highPercent = high;
		result.diagnostic("percentile_low", lowPercent).diagnostic("percentile_high", highPercent);

		AtomicLong fallbacks = new AtomicLong();
		ImageBuffer image = reduce(frames, (samples, n, work, sorted) -> {
			System.arraycopy(samples, 0, sorted, 0, n);
			Arrays.sort(sorted, 0, n);
			double lower = SampleMath.percentileOfSorted(sorted, n, lowPercent);
			double upper = SampleMath.percentileOfSorted(sorted, n, highPercent);
			double sum = 0;
			int kept = 0;
			for (int i = 0; i < n; i++) {
				if (samples[i] >= lower && samples[i] <= upper) {
					sum += samples[i];
					kept++;
				}
			}
			if (kept == 0) {
				fallbacks.incrementAndGet();
				return SampleMath.medianOfSorted(sorted, n);
			}
			return sum / kept;
		});
		if (fallbacks.get() > 0) {
			result.warning(fallbacks.get() + " pixels had no sample inside the percentile range, used the median");
		}
		return image;
	}

	private ImageBuffer entropyWeighted(List<ImageBuffer> frames) {
		return reduce(frames, (samples, n, work, sorted) -> {
			System.arraycopy(samples, 0, sorted, 0, n);
			Arrays.sort(sorted, 0, n);
			double min = sorted[0];
			double max = sorted[n - 1];
			if (max == min) {
				return min;
			}
			int distinct = 1;
			for (int i = 1; i < n; i++) {
				if (sorted[i] != sorted[i - 1]) {
					distinct++;
				}
			}
			int bins = Math.min(ENTROPY_MAX_BINS, distinct);
			int[] counts = new int[bins];
			double width = max - min;
			for (int i = 0; i < n; i++) {
				int bin = (int) ((samples[i] - min) / width * bins);
				counts[Math.min(bin, bins - 1)]++;
			}
			double entropy = 0;
			for (int count : counts) {
				if (count > 0) {
					double p = (double) count / n;
					entropy -= p * Math.log(p);
				}
			}
			double maxEntropy = Math.log(bins);
			double consistency = maxEntropy > 0 ? 1.0 - entropy / maxEntropy : 1.0;

			double median = SampleMath.medianOfSorted(sorted, n);
			double maxDeviation = Math.max(Math.abs(max - median), Math.abs(min - median));
			double weightedSum = 0;
			double weightTotal = 0;
			for (int i = 0; i < n; i++) {
				double sampleWeight = maxDeviation > 0 ? 1.0 - Math.abs(samples[i] - median) / maxDeviation : 1.0;
				double weight = Math.max(consistency * sampleWeight, MIN_ENTROPY_WEIGHT);
				weightedSum += weight * samples[i];
				weightTotal += weight;
			}
			return weightedSum / weightTotal;
		});
	}

	private ImageBuffer superbias(List<ImageBuffer> frames, StackResult.StackResultBuilder result) throws ExternalToolException {
		ImageBuffer center = reduce(frames, (samples, n, work, sorted) -> SampleMath.mean(samples, n));
		if (frames.size() < 2) {
			result.warning("superbias needs at least 2 frames for a decomposition, used the single frame");
			return center;
		}
		double[] explained = superbiasDecomposer.explainedVarianceRatios(frames, center);
		result.diagnostic("superbias_components", explained.length)
				.diagnostic("explained_variance_ratio", explained);
		return center;
	}

	private static double sigmaFor(Double threshold, StackResult.StackResultBuilder result) {
		if (threshold == null) {
			return DEFAULT_SIGMA;
		}
		if (threshold <= 0) {
			result.warning("Sigma threshold must be positive, used " + DEFAULT_SIGMA);
			return DEFAULT_SIGMA;
		}
		return threshold;
	}

	private static ImageBuffer reduce(List<ImageBuffer> frames, PixelReducer reducer) {
		ImageBuffer first = frames.get(0);
		int width = first.getWidth();
		int height = first.getHeight();
		int n = frames.size();
		double[] out = new double[width * height];
		IntStream.range(0, height).parallel().forEach(y -> {
			double[] samples = new double[n];
			double[] work = new double[n];
			double[] sorted = new double[n];
			for (int x = 0; x < width; x++) {
				int index = y * width + x;
				for (int k = 0; k < n; k++) {
					samples[k] = frames.get(k).get(index);
				}
				out[index] = reducer.reduce(samples, n, work, sorted);
			}
		});
		return ImageBuffer.wrap(width, height, out);
	}

	/**
	 * Reduces the N samples of one pixel. {@code work} and {@code sorted} are per-row scratch
	 * arrays of length N; {@code samples} must not be modified.
	 */
	@FunctionalInterface
	interface PixelReducer {
		double reduce(double[] samples, int n, double[] work, double[] sorted);
	}
}
