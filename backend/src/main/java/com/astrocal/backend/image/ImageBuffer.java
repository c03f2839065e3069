package com.astrocal.backend.image;

import com.astrocal.backend.exception.ShapeMismatchException;

import java.util.Arrays;

/**
 * Dense two dimensional grid of samples, stored row major. Instances are never modified after
 * construction; every operation returns a new buffer.
 */
public final class ImageBuffer {

	private final int width;
	private final int height;
	private final PixelType dtype;
	private final double[] data;

	private ImageBuffer(int width, int height, PixelType dtype, double[] data) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Image dimensions must be positive, got " + width + "x" + height);
		}
		if (data.length != width * height) {
			throw new IllegalArgumentException(String.format(
					"Pixel count %d does not match %dx%d", data.length, width, height));
		}
		this.width = width;
		this.height = height;
		this.dtype = dtype;
		this.data = data;
	}

	/**
	 * Takes ownership of {@code data}; callers must not touch the array afterwards.
	 */
	public static ImageBuffer wrap(int width, int height, PixelType dtype, double[] data) {
		return new ImageBuffer(width, height, dtype, data);
	}

	public static ImageBuffer wrap(int width, int height, double[] data) {
		return new ImageBuffer(width, height, PixelType.FLOAT64, data);
	}

	public static ImageBuffer filled(int width, int height, double value) {
		double[] data = new double[width * height];
		Arrays.fill(data, value);
		return new ImageBuffer(width, height, PixelType.FLOAT64, data);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public PixelType getDtype() {
		return dtype;
	}

	public int pixelCount() {
		return data.length;
	}

	public double get(int index) {
		return data[index];
	}

	public double get(int x, int y) {
		return data[y * width + x];
	}

	public double[] toArray() {
		return data.clone();
	}

	public boolean sameShape(ImageBuffer other) {
		return width == other.width && height == other.height;
	}

	public void requireSameShape(ImageBuffer other, String what) throws ShapeMismatchException {
		if (!sameShape(other)) {
			throw new ShapeMismatchException(what, width, height, other.width, other.height);
		}
	}

	public ImageBuffer subtract(ImageBuffer other) throws ShapeMismatchException {
		requireSameShape(other, "Subtrahend");
		double[] out = new double[data.length];
		for (int i = 0; i < data.length; i++) {
			out[i] = data[i] - other.data[i];
		}
		return new ImageBuffer(width, height, PixelType.FLOAT64, out);
	}

	public ImageBuffer multiply(double factor) {
		double[] out = new double[data.length];
		for (int i = 0; i < data.length; i++) {
			out[i] = data[i] * factor;
		}
		return new ImageBuffer(width, height, PixelType.FLOAT64, out);
	}

	public double mean() {
		return SampleMath.mean(data, data.length);
	}

	public double std() {
		return SampleMath.std(data, data.length);
	}

	public double min() {
		double min = Double.POSITIVE_INFINITY;
		for (double v : data) {
			if (v < min) {
				min = v;
			}
		}
		return min;
	}

	public double max() {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : data) {
			if (v > max) {
				max = v;
			}
		}
		return max;
	}

	public double median() {
		double[] sorted = sortedCopy();
		return SampleMath.medianOfSorted(sorted, sorted.length);
	}

	public double percentile(double percent) {
		double[] sorted = sortedCopy();
		return SampleMath.percentileOfSorted(sorted, sorted.length, percent);
	}

	public double[] percentiles(double... percents) {
		double[] sorted = sortedCopy();
		double[] result = new double[percents.length];
		for (int i = 0; i < percents.length; i++) {
			result[i] = SampleMath.percentileOfSorted(sorted, sorted.length, percents[i]);
		}
		return result;
	}

	private double[] sortedCopy() {
		double[] sorted = data.clone();
		Arrays.sort(sorted);
		return sorted;
	}

	@Override
	public String toString() {
		return "ImageBuffer[" + width + "x" + height + ", " + dtype + "]";
	}
}
