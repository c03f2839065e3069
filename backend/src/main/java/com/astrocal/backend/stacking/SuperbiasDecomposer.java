package com.astrocal.backend.stacking;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.image.ImageBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Principal component fit of a bias stack. The N frames are flattened into an N×(H·W) matrix and
 * centred on the per-pixel mean; the eigenvalues of the N×N Gram matrix of that centred matrix
 * are the component variances.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SuperbiasDecomposer {

	private final CalibrationProperties properties;

	/**
	 * Explained variance ratio of the leading {@code min(maxComponents, N)} components, largest
	 * first. A stack without any variance yields all zeros.
	 */
	public double[] explainedVarianceRatios(List<ImageBuffer> frames, ImageBuffer center) throws ExternalToolException {
		int n = frames.size();
		int pixels = center.pixelCount();
		double[][] gram = new double[n][n];
		IntStream.range(0, n).parallel().forEach(i -> {
			ImageBuffer a = frames.get(i);
			for (int j = i; j < n; j++) {
				ImageBuffer b = frames.get(j);
				double dot = 0;
				for (int p = 0; p < pixels; p++) {
					double c = center.get(p);
					dot += (a.get(p) - c) * (b.get(p) - c);
				}
				gram[i][j] = dot;
				gram[j][i] = dot;
			}
		});

		double[] eigenvalues;
		try {
			eigenvalues = new EigenDecomposition(new Array2DRowRealMatrix(gram, false)).getRealEigenvalues();
		} catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException e) {
			throw new ExternalToolException("Principal component decomposition failed for the superbias stack", e);
		}

		double[] sorted = eigenvalues.clone();
		Arrays.sort(sorted);
		double total = 0;
		for (double value : sorted) {
			total += Math.max(value, 0);
		}
		int components = Math.min(Math.max(properties.getSuperbiasMaxComponents(), 1), n);
		double[] ratios = new double[components];
		for (int k = 0; k < components; k++) {
			double value = Math.max(sorted[sorted.length - 1 - k], 0);
			ratios[k] = total > 0 ? value / total : 0;
		}
		log.debug("Superbias decomposition of {} frames, leading ratio {}", n, ratios[0]);
		return ratios;
	}
}
