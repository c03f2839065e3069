package com.astrocal.backend.correction;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.exception.CalibrationException;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.exception.StorageException;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.model.FrameHeader;
import com.astrocal.backend.model.FrameRecord;
import com.astrocal.backend.storage.ObjectStorage;
import com.astrocal.backend.storage.StoredObject;
import com.astrocal.backend.support.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CalibrationCorrectorTest {

	@Mock
	private ObjectStorage objectStorage;

	private CalibrationCorrector corrector;

	@BeforeEach
	void setUp() {
		corrector = new CalibrationCorrector(objectStorage, new CalibrationProperties());
	}

	@Test
	void manualMasterBiasWinsWithoutListing() throws Exception {
		assertThat(corrector.selectMasterBias("bucket", "u1", "p1", "u1/p1/master-bias/manual.fits"))
				.isEqualTo("u1/p1/master-bias/manual.fits");
		verifyNoInteractions(objectStorage);
	}

	@Test
	void autoSelectionPicksLatestFitsFile() throws Exception {
		when(objectStorage.list("bucket", "u1/p1/master-bias/")).thenReturn(List.of(
				new StoredObject("2024-01-01_bias.fits", 10),
				new StoredObject("2024-03-01_bias.fit", 10),
				new StoredObject("2024-05-01_notes.txt", 10)));

		assertThat(corrector.selectMasterBias("bucket", "u1", "p1", null)).isEqualTo("u1/p1/master-bias/2024-03-01_bias.fit");
	}

	@Test
	void emptyFolderFailsWithProjectName() throws Exception {
		when(objectStorage.list("bucket", "u1/p1/master-bias/")).thenReturn(List.of());

		assertThatThrownBy(() -> corrector.selectMasterBias("bucket", "u1", "p1", " "))
				.isInstanceOf(CalibrationException.class)
				.hasMessage("No master bias found for project p1");
	}

	@Test
	void listingFailureIsReported() throws Exception {
		when(objectStorage.list("bucket", "u1/p1/master-bias/")).thenThrow(new StorageException("access denied", null));

		assertThatThrownBy(() -> corrector.selectMasterBias("bucket", "u1", "p1", null))
				.hasMessageStartingWith("Master bias auto-selection failed");
	}

	@Test
	void biasSubtractionKeepsHeader() throws Exception {
		FrameRecord dark = TestFrames.frame("darks/d1.fits", TestFrames.darkHeader(-10, 300), ImageBuffer.filled(2, 2, 600));

		FrameRecord corrected = corrector.subtractBias(dark, ImageBuffer.filled(2, 2, 500));

		assertThat(corrected.getImage().toArray()).containsOnly(100.0);
		assertThat(corrected.getHeader()).isSameAs(dark.getHeader());
		assertThat(dark.getImage().get(0)).isEqualTo(600.0);
	}

	@Test
	void biasOfWrongShapeIsRejected() {
		FrameRecord dark = TestFrames.frame("d1.fits", FrameHeader.empty(), ImageBuffer.filled(2, 2, 600));

		assertThatThrownBy(() -> corrector.subtractBias(dark, ImageBuffer.filled(3, 2, 500)))
				.isInstanceOf(ShapeMismatchException.class);
	}

	@Test
	void darksAreMatchedOnTemperatureAndExposure() {
		FrameRecord match = TestFrames.frame("a.fits", TestFrames.darkHeader(-10.5, 300), ImageBuffer.filled(1, 1, 1));
		FrameRecord tooWarm = TestFrames.frame("b.fits", TestFrames.darkHeader(-5, 300), ImageBuffer.filled(1, 1, 1));
		FrameRecord tooShort = TestFrames.frame("c.fits", TestFrames.darkHeader(-10, 120), ImageBuffer.filled(1, 1, 1));
		FrameRecord unknown = TestFrames.frame("d.fits", FrameHeader.empty(), ImageBuffer.filled(1, 1, 1));

		CalibrationCorrector.MatchResult result = corrector.matchTemperatureAndExposure(
				List.of(match, tooWarm, tooShort, unknown), TestFrames.lightHeader(-10, 300), true, true);

		assertThat(result.getFrames()).containsExactly(match, unknown);
		assertThat(result.getWarning()).isNull();
	}

	@Test
	void noMatchKeepsAllDarksWithWarning() {
		FrameRecord tooWarm = TestFrames.frame("b.fits", TestFrames.darkHeader(5, 300), ImageBuffer.filled(1, 1, 1));

		CalibrationCorrector.MatchResult result = corrector.matchTemperatureAndExposure(
				List.of(tooWarm), TestFrames.lightHeader(-10, 300), true, false);

		assertThat(result.getFrames()).containsExactly(tooWarm);
		assertThat(result.getWarning()).isEqualTo("No darks matched temperature/exposure criteria; using all 1 darks");
	}

	@Test
	void darkScaleIsMedianRatioClampedToRange() {
		List<ImageBuffer> darks = List.of(ImageBuffer.filled(2, 2, 100));

		assertThat(corrector.darkScaleFactor(List.of(ImageBuffer.filled(2, 2, 150)), darks)).isEqualTo(1.5);
		assertThat(corrector.darkScaleFactor(List.of(ImageBuffer.filled(2, 2, 1000)), darks)).isEqualTo(2.0);
		assertThat(corrector.darkScaleFactor(List.of(ImageBuffer.filled(2, 2, 10)), darks)).isEqualTo(0.5);
	}

	@Test
	void darkScaleDefaultsToOne() {
		assertThat(corrector.darkScaleFactor(List.of(), List.of(ImageBuffer.filled(1, 1, 5)))).isEqualTo(1.0);
		assertThat(corrector.darkScaleFactor(List.of(ImageBuffer.filled(1, 1, 5)), List.of(ImageBuffer.filled(1, 1, 0)))).isEqualTo(1.0);
	}
}
