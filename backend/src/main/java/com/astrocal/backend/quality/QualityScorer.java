package com.astrocal.backend.quality;

import com.astrocal.backend.enums.FrameType;
import com.astrocal.backend.model.MasterFrame;
import com.astrocal.backend.model.MasterFrameStats;
import com.astrocal.backend.model.QualityScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a master frame from 10 down, one deduction and one recommendation per failed check.
 * Light and unknown masters share the generic checks.
 */
@Component
public class QualityScorer {

	static final double SATURATION_LEVEL = 60000;

	public QualityScore score(MasterFrame master, FrameType frameType) {
		MasterFrameStats stats = master.getStats();
		int frames = master.getFramesUsed();
		Deductions deductions = new Deductions();

		switch (frameType == null ? FrameType.UNKNOWN : frameType) {
			case BIAS:
				deductions.apply(stats.getStd() > 15, 2, "High noise in master bias; check the camera temperature and readout mode.");
				deductions.apply(stats.getMin() < 0, 1, "Negative pixel values in master bias; check the camera offset.");
				deductions.apply(frames < 20, 2, "Use at least 20 bias frames for a cleaner master bias.");
				deductions.apply(stats.getMax() > SATURATION_LEVEL, 1, "Saturated pixels in master bias; check for light leaks.");
				break;
			case DARK:
				deductions.apply(stats.getOutlierRatio() > 0.005, 3, "Many hot pixels or outliers in master dark; consider a bad pixel map or cosmetic correction.");
				deductions.apply(stats.getStd() > 30, 2, "High noise in master dark; check the sensor cooling.");
				deductions.apply(stats.getMin() < 0, 1, "Negative pixel values in master dark; check the bias subtraction.");
				deductions.apply(frames < 15, 2, "Use at least 15 dark frames for a cleaner master dark.");
				break;
			case FLAT:
				deductions.apply(stats.getMin() < 1000, 1, "Flat signal is low; increase the flat exposure.");
				deductions.apply(stats.getMax() > SATURATION_LEVEL, 2, "Flat is saturated; reduce the flat exposure or light source brightness.");
				deductions.apply(stats.getStd() < 100, 1, "Flat has very little variation; check the illumination of the light source.");
				deductions.apply(frames < 10, 2, "Use at least 10 flat frames for a cleaner master flat.");
				break;
			default:
				deductions.apply(stats.getOutlierRatio() > 0.01, 3, "Many outliers in the master frame; try a rejection stacking method.");
				deductions.apply(stats.getStd() > 500, 2, "High noise in the master frame.");
				deductions.apply(stats.getMin() < 0, 1, "Negative pixel values in the master frame.");
				deductions.apply(stats.getMax() > SATURATION_LEVEL, 1, "Saturated pixels in the master frame.");
				deductions.apply(frames < 10, 2, "Use at least 10 frames for a cleaner master frame.");
				break;
		}
		return new QualityScore(Math.max(0, Math.min(10, 10 - deductions.total)), List.copyOf(deductions.recommendations));
	}

	private static final class Deductions {
		private double total;
		private final List<String> recommendations = new ArrayList<>();

		void apply(boolean failed, double amount, String recommendation) {
			if (failed) {
				total += amount;
				recommendations.add(recommendation);
			}
		}
	}
}
