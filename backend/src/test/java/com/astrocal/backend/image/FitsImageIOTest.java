package com.astrocal.backend.image;

import com.astrocal.backend.model.FrameHeader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FitsImageIOTest {

	private final FitsImageIO fitsImageIO = new FitsImageIO();

	@TempDir
	Path tempDir;

	@Test
	void writtenFrameReadsBackWithPixelsAndHeader() throws Exception {
		ImageBuffer image = ImageBuffer.wrap(3, 2, new double[]{1.5, 2, 3, 4, 5, 6.25});
		Map<String, Object> cards = new LinkedHashMap<>();
		cards.put("IMAGETYP", "Dark Frame");
		cards.put("EXPTIME", 300);
		cards.put("CCD-TEMP", -10.5);
		File target = tempDir.resolve("dark.fits").toFile();

		fitsImageIO.write(image, FrameHeader.of(cards), target);
		FitsImage read = fitsImageIO.read(target);

		assertThat(read.getImage().getWidth()).isEqualTo(3);
		assertThat(read.getImage().getHeight()).isEqualTo(2);
		assertThat(read.getImage().get(0, 0)).isCloseTo(1.5, within(1e-6));
		assertThat(read.getImage().get(2, 1)).isCloseTo(6.25, within(1e-6));
		assertThat(read.getHeader().getString("IMAGETYP")).isEqualTo("Dark Frame");
		assertThat(read.getHeader().getDouble("EXPTIME")).isEqualTo(300.0);
		assertThat(read.getHeader().getDouble("CCD-TEMP")).isEqualTo(-10.5);
		assertThat(read.getHeader().contains("BITPIX")).isFalse();
	}

	@Test
	void garbageFileIsReportedAsIoError() throws Exception {
		Path garbage = tempDir.resolve("broken.fits");
		Files.writeString(garbage, "this is not a FITS file");

		assertThatThrownBy(() -> fitsImageIO.read(garbage.toFile()))
				.isInstanceOf(java.io.IOException.class);
	}
}
