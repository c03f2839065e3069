package com.astrocal.backend.image;

import com.astrocal.backend.exception.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ImageBufferTest {

	@Test
	void statisticsUsePopulationStdAndLinearPercentiles() {
		ImageBuffer image = ImageBuffer.wrap(2, 2, new double[]{1, 2, 3, 4});

		assertThat(image.mean()).isEqualTo(2.5);
		assertThat(image.std()).isCloseTo(Math.sqrt(1.25), within(1e-12));
		assertThat(image.median()).isEqualTo(2.5);
		assertThat(image.percentile(25)).isCloseTo(1.75, within(1e-12));
		assertThat(image.min()).isEqualTo(1);
		assertThat(image.max()).isEqualTo(4);
	}

	@Test
	void subtractRequiresSameShape() {
		ImageBuffer a = ImageBuffer.filled(3, 2, 5);
		ImageBuffer b = ImageBuffer.filled(2, 3, 1);

		assertThatThrownBy(() -> a.subtract(b))
				.isInstanceOf(ShapeMismatchException.class)
				.hasMessageContaining("3x2");
	}

	@Test
	void operationsLeaveInputsUntouched() throws Exception {
		double[] source = {10, 20, 30, 40};
		ImageBuffer image = ImageBuffer.wrap(2, 2, source.clone());

		ImageBuffer difference = image.subtract(ImageBuffer.filled(2, 2, 10));
		ImageBuffer scaled = image.multiply(0.5);

		assertThat(difference.toArray()).containsExactly(0, 10, 20, 30);
		assertThat(scaled.toArray()).containsExactly(5, 10, 15, 20);
		assertThat(image.toArray()).containsExactly(10, 20, 30, 40);
	}

	@Test
	void rejectsDataOfTheWrongLength() {
		assertThatThrownBy(() -> ImageBuffer.wrap(3, 3, new double[4]))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
