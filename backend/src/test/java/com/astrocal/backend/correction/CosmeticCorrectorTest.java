package com.astrocal.backend.correction;

import com.astrocal.backend.enums.CosmeticMethod;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.image.ImageBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CosmeticCorrectorTest {

	@Mock
	private CosmicRayDetector cosmicRayDetector;

	@InjectMocks
	private CosmeticCorrector cosmeticCorrector;

	@Test
	void reflectMirrorsWithoutRepeatingTheEdge() {
		assertThat(CosmeticCorrector.reflect(-1, 5)).isEqualTo(1);
		assertThat(CosmeticCorrector.reflect(5, 5)).isEqualTo(3);
		assertThat(CosmeticCorrector.reflect(2, 5)).isEqualTo(2);
		assertThat(CosmeticCorrector.reflect(-1, 1)).isZero();
	}

	@Test
	void hotPixelIsReplacedByNeighbourhoodMedian() throws Exception {
		double[] data = new double[25];
		Arrays.fill(data, 100);
		data[12] = 10_000;
		ImageBuffer image = ImageBuffer.wrap(5, 5, data);

		ImageBuffer corrected = cosmeticCorrector.applyMethod(image, CosmeticMethod.HOT_PIXEL_MAP, 3.0, Map.of());

		assertThat(corrected.get(2, 2)).isEqualTo(100.0);
		assertThat(image.get(2, 2)).isEqualTo(10_000.0);
		verifyNoInteractions(cosmicRayDetector);
	}

	@Test
	void cleanImageIsLeftAlone() throws Exception {
		ImageBuffer image = ImageBuffer.filled(4, 4, 7);

		assertThat(cosmeticCorrector.applyMethod(image, CosmeticMethod.HOT_PIXEL_MAP, 5.0, Map.of())).isSameAs(image);
	}

	@Test
	void badPixelMapFlagsAreRepairedAtTheBorder() throws Exception {
		double[] data = new double[9];
		Arrays.fill(data, 50);
		data[0] = -999;
		double[] bpm = new double[9];
		bpm[0] = 1;

		ImageBuffer corrected = cosmeticCorrector.replaceBadPixels(ImageBuffer.wrap(3, 3, data), ImageBuffer.wrap(3, 3, bpm));

		assertThat(corrected.get(0, 0)).isEqualTo(50.0);
	}

	@Test
	void badPixelMapMustMatchImageShape() {
		assertThatThrownBy(() -> cosmeticCorrector.replaceBadPixels(ImageBuffer.filled(3, 3, 1), ImageBuffer.filled(4, 4, 0)))
				.isInstanceOf(ShapeMismatchException.class);
	}

	@Test
	void laCosmicDelegatesToDetector() throws Exception {
		ImageBuffer image = ImageBuffer.filled(3, 3, 20);
		ImageBuffer cleaned = ImageBuffer.filled(3, 3, 19);
		when(cosmicRayDetector.detect(eq(image), eq(4.5), anyMap()))
				.thenReturn(new CosmicRayResult(cleaned, ImageBuffer.filled(3, 3, 0)));

		assertThat(cosmeticCorrector.applyMethod(image, CosmeticMethod.LA_COSMIC, 4.5, null)).isSameAs(cleaned);
	}

	@Test
	void detectorFailurePropagates() throws Exception {
		when(cosmicRayDetector.detect(any(), anyDouble(), anyMap())).thenThrow(new ExternalToolException("not configured"));

		assertThatThrownBy(() -> cosmeticCorrector.applyMethod(ImageBuffer.filled(2, 2, 1), CosmeticMethod.LA_COSMIC, 5, Map.of()))
				.isInstanceOf(ExternalToolException.class);
	}
}
