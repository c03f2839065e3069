package com.astrocal.backend.image;

import com.astrocal.backend.model.FrameHeader;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads the primary image HDU of FITS files into {@link ImageBuffer}s and writes buffers back
 * as 32-bit float images. BZERO/BSCALE are applied on read.
 */
@Component
@Slf4j
public class FitsImageIO {

	private static final Set<String> STRUCTURAL_KEYS = Set.of(
			"SIMPLE", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3", "EXTEND",
			"BZERO", "BSCALE", "END", "COMMENT", "HISTORY", "");

	public FitsImage read(File file) throws IOException {
		try (Fits fits = new Fits(file)) {
			BasicHDU<?> hdu = fits.getHDU(0);
			if (hdu == null) {
				throw new IOException("No primary HDU in " + file.getName());
			}
			Header header = hdu.getHeader();
			Object kernel = hdu.getKernel();
			if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
				// Cube: use the first plane.
				kernel = ((Object[]) kernel)[0];
			}
			int bitpix = header.getIntValue("BITPIX");
			double bzero = header.getDoubleValue("BZERO", 0.0);
			double bscale = header.getDoubleValue("BSCALE", 1.0);
			ImageBuffer image = toBuffer(kernel, PixelType.fromBitpix(bitpix), bzero, bscale, file.getName());
			return new FitsImage(toFrameHeader(header), image);
		} catch (FitsException e) {
			throw new IOException("Error reading FITS " + file.getName() + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Writes {@code image} as a float32 primary HDU. Numeric header values are written as
	 * numbers, everything else as strings.
	 */
	public void write(ImageBuffer image, FrameHeader header, File target) throws IOException {
		float[][] rows = new float[image.getHeight()][image.getWidth()];
		for (int y = 0; y < image.getHeight(); y++) {
			for (int x = 0; x < image.getWidth(); x++) {
				rows[y][x] = (float) image.get(x, y);
			}
		}
		try (Fits fits = new Fits()) {
			BasicHDU<?> hdu = Fits.makeHDU(rows);
			Header out = hdu.getHeader();
			for (Map.Entry<String, String> card : header.asMap().entrySet()) {
				if (STRUCTURAL_KEYS.contains(card.getKey()) || card.getKey().length() > 8) {
					continue;
				}
				addCard(out, card.getKey(), card.getValue());
			}
			fits.addHDU(hdu);
			fits.write(target);
		} catch (FitsException e) {
			throw new IOException("Error writing FITS " + target.getName() + ": " + e.getMessage(), e);
		}
	}

	private void addCard(Header header, String key, String value) throws FitsException {
		if ("T".equals(value) || "F".equals(value)) {
			header.addValue(key, "T".equals(value), null);
			return;
		}
		try {
			header.addValue(key, Double.parseDouble(value), null);
		} catch (NumberFormatException e) {
			header.addValue(key, value, null);
		}
	}

	private FrameHeader toFrameHeader(Header header) {
		Map<String, String> values = new LinkedHashMap<>();
		Cursor<String, HeaderCard> cursor = header.iterator();
		while (cursor.hasNext()) {
			HeaderCard card = cursor.next();
			String key = card.getKey();
			if (key == null || STRUCTURAL_KEYS.contains(key) || card.getValue() == null) {
				continue;
			}
			values.put(key, card.getValue());
		}
		return FrameHeader.of(values);
	}

	private ImageBuffer toBuffer(Object kernel, PixelType dtype, double bzero, double bscale, String name) throws IOException {
		if (kernel instanceof short[][]) {
			short[][] s = (short[][]) kernel;
			double[] d = allocate(s.length, s[0].length);
			for (int y = 0; y < s.length; y++) {
				for (int x = 0; x < s[0].length; x++) {
					d[y * s[0].length + x] = bzero + bscale * s[y][x];
				}
			}
			return ImageBuffer.wrap(s[0].length, s.length, dtype, d);
		}
		if (kernel instanceof int[][]) {
			int[][] s = (int[][]) kernel;
			double[] d = allocate(s.length, s[0].length);
			for (int y = 0; y < s.length; y++) {
				for (int x = 0; x < s[0].length; x++) {
					d[y * s[0].length + x] = bzero + bscale * s[y][x];
				}
			}
			return ImageBuffer.wrap(s[0].length, s.length, dtype, d);
		}
		if (kernel instanceof long[][]) {
			long[][] s = (long[][]) kernel;
			double[] d = allocate(s.length, s[0].length);
			for (int y = 0; y < s.length; y++) {
				for (int x = 0; x < s[0].length; x++) {
					d[y * s[0].length + x] = bzero + bscale * s[y][x];
				}
			}
			return ImageBuffer.wrap(s[0].length, s.length, dtype, d);
		}
		if (kernel instanceof byte[][]) {
			byte[][] s = (byte[][]) kernel;
			double[] d = allocate(s.length, s[0].length);
			for (int y = 0; y < s.length; y++) {
				for (int x = 0; x < s[0].length; x++) {
					d[y * s[0].length + x] = bzero + bscale * (s[y][x] & 0xFF);
				}
			}
			return ImageBuffer.wrap(s[0].length, s.length, dtype, d);
		}
		if (kernel instanceof float[][]) {
			float[][] s = (float[][]) kernel;
			double[] d = allocate(s.length, s[0].length);
			for (int y = 0; y < s.length; y++) {
				for (int x = 0; x < s[0].length; x++) {
					d[y * s[0].length + x] = bzero + bscale * s[y][x];
				}
			}
			return ImageBuffer.wrap(s[0].length, s.length, dtype, d);
		}
		if (kernel instanceof double[][]) {
			double[][] s = (double[][]) kernel;
			double[] d = allocate(s.length, s[0].length);
			for (int y = 0; y < s.length; y++) {
				for (int x = 0; x < s[0].length; x++) {
					d[y * s[0].length + x] = bzero + bscale * s[y][x];
				}
			}
			return ImageBuffer.wrap(s[0].length, s.length, dtype, d);
		}
		throw new IOException("Unsupported image data in " + name + ": "
				+ (kernel == null ? "no data" : kernel.getClass().getSimpleName()));
	}

	private double[] allocate(int rows, int cols) {
		return new double[rows * cols];
	}
}
