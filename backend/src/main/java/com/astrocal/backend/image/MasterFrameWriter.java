package com.astrocal.backend.image;

import com.astrocal.backend.config.CalibrationProperties;
import com.astrocal.backend.model.FrameHeader;
import com.astrocal.backend.model.MasterFrame;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes master frames for storage: the full FITS image and an 8-bit preview.
 */
@Component
@RequiredArgsConstructor
public class MasterFrameWriter {

	private final FitsImageIO fitsImageIO;
	private final CalibrationProperties properties;

	/**
	 * Grayscale PNG stretched linearly between the configured low and high percentiles.
	 */
	public byte[] renderPreview(ImageBuffer image) throws IOException {
		double[] bounds = image.percentiles(properties.getPreviewLowPercentile(), properties.getPreviewHighPercentile());
		double low = bounds[0];
		double range = bounds[1] - bounds[0];

		BufferedImage preview = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
		WritableRaster raster = preview.getRaster();
		for (int y = 0; y < image.getHeight(); y++) {
			for (int x = 0; x < image.getWidth(); x++) {
				double scaled = range > 0 ? (image.get(x, y) - low) / range : 0;
				int level = (int) Math.round(Math.max(0, Math.min(1, scaled)) * 255);
				raster.setSample(x, y, 0, level);
			}
		}
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		if (!ImageIO.write(preview, "png", out)) {
			throw new IOException("No PNG writer available");
		}
		return out.toByteArray();
	}

	/**
	 * Writes the master as a 32-bit float FITS file to {@code target} and returns its bytes.
	 */
	public byte[] writeFits(MasterFrame master, File target) throws IOException {
		Map<String, Object> cards = new LinkedHashMap<>();
		cards.put("IMAGETYP", "Master " + master.getFrameType().label());
		cards.put("NCOMBINE", master.getFramesUsed());
		if (master.getStackingMethod() != null) {
			cards.put("STACKMTH", master.getStackingMethod().wireName());
		}
		cards.put("DARKSCL", master.getDarkScaleFactor());
		fitsImageIO.write(master.getImage(), FrameHeader.of(cards), target);
		return Files.readAllBytes(target.toPath());
	}
}
