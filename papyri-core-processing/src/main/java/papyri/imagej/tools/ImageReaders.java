/*-
 * #%L
 * This file is part of Papyri.
 * %%
 * Copyright (C) 2023 - 2024 Papyri developers
 * %%
 * Papyri is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Papyri is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Papyri.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package papyri.imagej.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import javax.imageio.ImageIO;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import ij.io.Opener;
import ij.process.ImageProcessor;
import papyri.lib.common.GeneralTools;
import papyri.opencv.tools.OpenCVTools;

/**
 * Read input images as 8-bit Mats.
 * <p>
 * TIFF files are read with ImageJ, so that multichannel stacks keep all their channels; other formats are read with
 * ImageIO, falling back to ImageJ for formats ImageIO cannot decode.
 * Images with more than 8 bits per sample are scaled to 8 bits.
 *
 * @author Papyri developers
 */
public class ImageReaders {

	private final static Logger logger = LoggerFactory.getLogger(ImageReaders.class);

	/**
	 * Extensions (lowercase, without dot) that may be read with ImageJ if ImageIO fails.
	 */
	private static final Set<String> IMAGEJ_EXTENSIONS = Set.of("tif", "tiff", "pgm", "fits", "fit", "dcm");

	private ImageReaders() {
		throw new AssertionError();
	}

	/**
	 * Read an image.
	 * @param path
	 * @return an 8-bit Mat with channels in RGB order (where applicable)
	 * @throws IOException if the image cannot be read
	 */
	public static Mat readMat(Path path) throws IOException {
		if (!Files.isRegularFile(path))
			throw new IOException("No image file found at " + path);

		// TIFF stacks are read as a single plane by ImageIO
		if (isTiff(path)) {
			var mat = readWithImageJ(path);
			if (mat != null)
				return mat;
		}

		IOException imageIOException = null;
		try {
			var img = ImageIO.read(path.toFile());
			if (img != null)
				return OpenCVTools.imageToMat(img);
			logger.debug("No ImageIO reader found for {}", path);
		} catch (IOException e) {
			logger.debug("ImageIO unable to read {}: {}", path, e.getLocalizedMessage());
			imageIOException = e;
		}

		if (supportsImageJ(path) && !isTiff(path)) {
			var mat = readWithImageJ(path);
			if (mat != null)
				return mat;
		}
		if (imageIOException != null)
			throw imageIOException;
		throw new IOException("Unable to read image " + path);
	}

	private static Mat readWithImageJ(Path path) {
		var imp = new Opener().openImage(path.toString());
		if (imp == null) {
			logger.debug("ImageJ unable to read {}", path);
			return null;
		}
		logger.debug("Read {} with ImageJ", path);
		return imagePlusToMat(imp);
	}

	private static boolean isTiff(Path path) {
		var ext = GeneralTools.getExtension(path.getFileName().toString()).orElse("").toLowerCase();
		return ext.endsWith(".tif") || ext.endsWith(".tiff");
	}

	static boolean supportsImageJ(Path path) {
		var ext = GeneralTools.getExtension(path.getFileName().toString()).orElse(null);
		return ext != null && IMAGEJ_EXTENSIONS.contains(ext.substring(1).toLowerCase());
	}

	/**
	 * Convert the current z-slice and timepoint of an ImagePlus to an 8-bit Mat.
	 * RGB images give 3 channels; otherwise each channel is scaled to 8 bits using its full range.
	 * The planes of a stack with a single channel and a single timepoint are treated as channels.
	 * @param imp
	 * @return
	 */
	public static Mat imagePlusToMat(ImagePlus imp) {
		if (imp.getBitDepth() == 24)
			return OpenCVTools.imageToMat(imp.getBufferedImage());

		var stack = imp.getStack();
		List<Mat> channels = new ArrayList<>();
		if (imp.getNChannels() == 1 && imp.getNFrames() == 1) {
			for (int i = 1; i <= stack.getSize(); i++)
				channels.add(toMat(stack.getProcessor(i)));
		} else {
			for (int c = 1; c <= imp.getNChannels(); c++) {
				int ind = imp.getStackIndex(c, imp.getZ(), imp.getT());
				channels.add(toMat(stack.getProcessor(ind)));
			}
		}
		if (channels.size() == 1)
			return channels.get(0);
		var mat = OpenCVTools.mergeChannels(channels, null);
		channels.forEach(Mat::close);
		return mat;
	}

	private static Mat toMat(ImageProcessor ip) {
		var bp = ip.getBitDepth() == 8 ? ip : ip.convertToByteProcessor(true);
		var mat = new Mat(bp.getHeight(), bp.getWidth(), opencv_core.CV_8UC1);
		OpenCVTools.putPixelsUnsigned(mat, (byte[])bp.getPixels());
		return mat;
	}

}
