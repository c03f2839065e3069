package com.astrocal.backend.quality;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.model.Histogram;
import com.astrocal.backend.model.MasterFrameStats;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class MasterStatisticsCalculatorTest {

	private final MasterStatisticsCalculator calculator = new MasterStatisticsCalculator(new CalibrationProperties());

	@Test
	void computesSummaryAndOutlierShare() {
		double[] data = new double[100];
		Arrays.fill(data, 10);
		data[42] = 10_000;

		MasterFrameStats stats = calculator.compute(ImageBuffer.wrap(10, 10, data));

		assertThat(stats.getMin()).isEqualTo(10.0);
		assertThat(stats.getMax()).isEqualTo(10_000.0);
		assertThat(stats.getMedian()).isEqualTo(10.0);
		assertThat(stats.getOutlierRatio()).isEqualTo(0.01);
		assertThat(stats.getHistogram().getCounts()).hasSize(64);
		assertThat(Arrays.stream(stats.getHistogram().getCounts()).sum()).isEqualTo(100);
	}

	@Test
	void maximumLandsInLastBin() {
		CalibrationProperties properties = new CalibrationProperties();
		properties.setHistogramBins(4);
		MasterStatisticsCalculator small = new MasterStatisticsCalculator(properties);

		Histogram histogram = small.histogram(ImageBuffer.wrap(4, 1, new double[]{0, 1, 2, 4}), 0, 4);

		assertThat(histogram.getCounts()).containsExactly(1, 1, 1, 1);
		assertThat(histogram.getBinEdges()).containsExactly(0, 1, 2, 3, 4);
	}

	@Test
	void constantImageFillsFirstBin() {
		MasterFrameStats stats = calculator.compute(ImageBuffer.filled(3, 3, 500));

		assertThat(stats.getStd()).isZero();
		assertThat(stats.getOutlierRatio()).isZero();
		assertThat(stats.getHistogram().getCounts()[0]).isEqualTo(9);
		assertThat(stats.getHistogram().getBinEdges()[64]).isEqualTo(501.0);
	}
}
