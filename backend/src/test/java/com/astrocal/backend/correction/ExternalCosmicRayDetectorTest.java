package com.astrocal.backend.correction;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.image.FitsImageIO;
import com.astrocal.backend.image.ImageBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class ExternalCosmicRayDetectorTest {

	@TempDir
	Path tempDir;

	@Test
	void unconfiguredDetectorFails() {
		ExternalCosmicRayDetector detector = new ExternalCosmicRayDetector(new CalibrationProperties(), new FitsImageIO());

		assertThatThrownBy(() -> detector.detect(ImageBuffer.filled(2, 2, 1), 4.5, Map.of()))
				.isInstanceOf(ExternalToolException.class)
				.hasMessageContaining("calibration.cosmic-ray.command");
	}

	@Test
	void missingExecutableIsReported() {
		CalibrationProperties properties = new CalibrationProperties();
		properties.setWorkDir(tempDir.toString());
		properties.getCosmicRay().setCommand(List.of(tempDir.resolve("no-such-detector").toString()));
		ExternalCosmicRayDetector detector = new ExternalCosmicRayDetector(properties, new FitsImageIO());

		assertThatThrownBy(() -> detector.detect(ImageBuffer.filled(2, 2, 1), 4.5, Map.of("objlim", 5)))
				.isInstanceOf(ExternalToolException.class);
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void hangingDetectorIsStoppedAtTheTimeout() {
		CalibrationProperties properties = new CalibrationProperties();
		properties.setWorkDir(tempDir.toString());
		properties.getCosmicRay().setCommand(List.of("sh", "-c", "echo started; sleep 60"));
		properties.getCosmicRay().setTimeoutSeconds(1);
		ExternalCosmicRayDetector detector = new ExternalCosmicRayDetector(properties, new FitsImageIO());

		assertTimeoutPreemptively(Duration.ofSeconds(20), () ->
				assertThatThrownBy(() -> detector.detect(ImageBuffer.filled(2, 2, 1), 4.5, Map.of()))
						.isInstanceOf(ExternalToolException.class)
						.hasMessageContaining("timed out"));
	}
}
