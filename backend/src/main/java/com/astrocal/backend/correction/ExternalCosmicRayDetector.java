package com.astrocal.backend.correction;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.exception.ExternalToolException;
import com.astrocal.backend.exception.ShapeMismatchException;
import com.astrocal.backend.image.FitsImageIO;
import com.astrocal.backend.image.ImageBuffer;
import com.astrocal.backend.model.FrameHeader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a configured command line detector on a temporary FITS copy of the image. The command
 * gets {@code --input}, {@code --output}, {@code --mask} and {@code --sigclip}, followed by one
 * {@code --name value} pair per extra parameter, and must write the cleaned image and the mask.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalCosmicRayDetector implements CosmicRayDetector {

	private final CalibrationProperties properties;
	private final FitsImageIO fitsImageIO;

	@Override
	public CosmicRayResult detect(ImageBuffer image, double sigmaClip, Map<String, Object> params) throws ExternalToolException {
		List<String> baseCommand = properties.getCosmicRay().getCommand();
		if (baseCommand == null || baseCommand.isEmpty()) {
			throw new ExternalToolException("No cosmic ray detector is configured (calibration.cosmic-ray.command)");
		}

		Path workDir = null;
		try {
			workDir = Files.createTempDirectory(Path.of(properties.getWorkDir()), "astrocal-lacosmic-");
			File input = workDir.resolve("input.fits").toFile();
			File output = workDir.resolve("cleaned.fits").toFile();
			File mask = workDir.resolve("mask.fits").toFile();
			fitsImageIO.write(image, FrameHeader.empty(), input);

			List<String> command = new ArrayList<>(baseCommand);
			command.add("--input");
			command.add(input.getAbsolutePath());
			command.add("--output");
			command.add(output.getAbsolutePath());
			command.add("--mask");
			command.add(mask.getAbsolutePath());
			command.add("--sigclip");
			command.add(String.format(Locale.ROOT, "%s", sigmaClip));
			if (params != null) {
				params.forEach((name, value) -> {
					command.add("--" + name);
					command.add(String.valueOf(value));
				});
			}
			executeCommand(command, workDir.resolve("detector.log").toFile());

			ImageBuffer cleaned = fitsImageIO.read(output).getImage();
			ImageBuffer maskImage = fitsImageIO.read(mask).getImage();
			image.requireSameShape(cleaned, "Cleaned image");
			image.requireSameShape(maskImage, "Cosmic ray mask");
			return new CosmicRayResult(cleaned, maskImage);
		} catch (IOException | ShapeMismatchException e) {
			throw new ExternalToolException("Cosmic ray detection failed: " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExternalToolException("Cosmic ray detection was interrupted", e);
		} finally {
			if (workDir != null) {
				FileUtils.deleteQuietly(workDir.toFile());
			}
		}
	}

	private void executeCommand(List<String> command, File logFile) throws IOException, InterruptedException, ExternalToolException {
		log.info("Cosmic ray command to be executed: {}", String.join(" ", command));

		ProcessBuilder processBuilder = new ProcessBuilder(command);
		processBuilder.redirectErrorStream(true);
		processBuilder.redirectOutput(logFile);
		Process process = processBuilder.start();

		boolean finished = process.waitFor(properties.getCosmicRay().getTimeoutSeconds(), TimeUnit.SECONDS);
		if (!finished) {
			process.destroyForcibly();
			throw new ExternalToolException("Cosmic ray detector timed out");
		}
		if (log.isDebugEnabled() && logFile.exists()) {
			for (String line : FileUtils.readLines(logFile, StandardCharsets.UTF_8)) {
				log.debug("Cosmic ray detector output: {}", line);
			}
		}
		if (process.exitValue() != 0) {
			throw new ExternalToolException("Cosmic ray detector failed with exit code " + process.exitValue());
		}
	}
}
