package com.astrocal.backend.image;

import java.util.Arrays;

/**
 * Reductions over plain sample arrays. Standard deviations are population (ddof = 0)
 * and percentiles interpolate linearly between closest ranks.
 */
public final class SampleMath {

	private SampleMath() {
	}

	public static double mean(double[] values, int count) {
		double sum = 0;
		for (int i = 0; i < count; i++) {
			sum += values[i];
		}
		return sum / count;
	}

	public static double std(double[] values, int count) {
		return Math.sqrt(variance(values, count));
	}

	public static double variance(double[] values, int count) {
		double mean = mean(values, count);
		double sumSq = 0;
		for (int i = 0; i < count; i++) {
			double d = values[i] - mean;
			sumSq += d * d;
		}
		return sumSq / count;
	}

	/**
	 * Median of an already sorted prefix; even counts average the two middle values.
	 */
	public static double medianOfSorted(double[] sorted, int count) {
		int mid = count / 2;
		if (count % 2 == 0) {
			return (sorted[mid - 1] + sorted[mid]) / 2.0;
		}
		return sorted[mid];
	}

	/**
	 * Median of the first {@code count} values. {@code scratch} receives a sorted copy and must
	 * be at least {@code count} long; the input is left untouched.
	 */
	public static double median(double[] values, int count, double[] scratch) {
		System.arraycopy(values, 0, scratch, 0, count);
		Arrays.sort(scratch, 0, count);
		return medianOfSorted(scratch, count);
	}

	/**
	 * Linear interpolation percentile of a sorted prefix, {@code percent} in [0, 100].
	 */
	public static double percentileOfSorted(double[] sorted, int count, double percent) {
		if (count == 1) {
			return sorted[0];
		}
		double rank = percent / 100.0 * (count - 1);
		int lower = (int) Math.floor(rank);
		if (lower >= count - 1) {
			return sorted[count - 1];
		}
		double fraction = rank - lower;
		return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
	}
}
