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

package papyri.opencv.tools;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collection of static methods to help with using OpenCV from Java.
 * <p>
 * Images handled by Papyri are 8-bit with 1 or 3 channels in RGB order, or 32-bit float fields
 * computed from them.
 *
 * @author Papyri developers
 */
public class OpenCVTools {

	private static Logger logger = LoggerFactory.getLogger(OpenCVTools.class);

	/**
	 * Default border type for filtering.
	 */
	public static final int DEFAULT_BORDER_TYPE = opencv_core.BORDER_REFLECT;

	/**
	 * Convert a BufferedImage to an 8-bit OpenCV Mat.
	 * <p>
	 * Samples are taken from the raster bands, so that the channel order follows the ColorModel (i.e. RGB or RGBA),
	 * regardless of how the pixels are stored.
	 * Images with more than 8 bits per sample are scaled to 8 bits.
	 * Images with an indexed color model are expanded to RGB.
	 *
	 * @param img
	 * @return
	 */
	public static Mat imageToMat(BufferedImage img) {
		if (img.getColorModel() instanceof java.awt.image.IndexColorModel)
			return imageToMatRGB(img, img.getColorModel().hasAlpha());

		int width = img.getWidth();
		int height = img.getHeight();
		WritableRaster raster = img.getRaster();
		int nChannels = raster.getNumBands();
		int bits = img.getColorModel().getComponentSize(0);
		if (bits > 8)
			logger.warn("Scaling {}-bit image to 8 bits", bits);
		double scale = bits > 8 ? 255.0 / (Math.pow(2, bits) - 1) : 1.0;

		Mat mat = new Mat(height, width, opencv_core.CV_8UC(nChannels), Scalar.ZERO);
		byte[] bytes = new byte[width * height * nChannels];
		int[] pixels = null;
		for (int b = 0; b < nChannels; b++) {
			pixels = raster.getSamples(0, 0, width, height, b, pixels);
			for (int i = 0; i < pixels.length; i++) {
				int val = scale == 1.0 ? pixels[i] : (int)Math.round(pixels[i] * scale);
				bytes[i * nChannels + b] = (byte)clip8(val);
			}
		}
		putPixelsUnsigned(mat, bytes);
		return mat;
	}

	/**
	 * Extract 8-bit unsigned pixels from a BufferedImage as a multichannel RGB(A) Mat, using the
	 * RGB values of the ColorModel.
	 *
	 * @param img input image
	 * @param includeAlpha if true, return any available alpha data as a 4th channel.
	 * @return
	 */
	public static Mat imageToMatRGB(final BufferedImage img, final boolean includeAlpha) {
		int width = img.getWidth();
		int height = img.getHeight();
		int[] data = img.getRGB(0, 0, width, height, null, 0, width);

		int nChannels = includeAlpha ? 4 : 3;
		Mat mat = new Mat(height, width, opencv_core.CV_8UC(nChannels));
		byte[] bytes = new byte[width * height * nChannels];
		for (int i = 0; i < data.length; i++) {
			int val = data[i];
			int ind = i * nChannels;
			bytes[ind] = (byte)((val >> 16) & 0xFF);
			bytes[ind+1] = (byte)((val >> 8) & 0xFF);
			bytes[ind+2] = (byte)(val & 0xFF);
			if (includeAlpha)
				bytes[ind+3] = (byte)((val >> 24) & 0xFF);
		}
		putPixelsUnsigned(mat, bytes);
		return mat;
	}

	/**
	 * Convert an 8-bit Mat with 1 or 3 channels to a BufferedImage.
	 * <p>
	 * Single-channel images become {@code TYPE_BYTE_GRAY}, 3-channel (RGB) images {@code TYPE_INT_RGB}.
	 *
	 * @param mat
	 * @return
	 * @throws IllegalArgumentException if the Mat is not 8-bit with 1 or 3 channels
	 */
	public static BufferedImage matToBufferedImage(final Mat mat) throws IllegalArgumentException {
		if (mat.depth() != opencv_core.CV_8U)
			throw new IllegalArgumentException("Expected an 8-bit Mat, but depth is " + mat.depth());
		int width = mat.cols();
		int height = mat.rows();
		int channels = mat.channels();
		BufferedImage img;
		if (channels == 1)
			img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
		else if (channels == 3)
			img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		else
			throw new IllegalArgumentException("Expected 1 or 3 channels, but Mat has " + channels);

		byte[] bytes = extractBytes(mat);
		WritableRaster raster = img.getRaster();
		int[] pixels = new int[width * height];
		for (int b = 0; b < channels; b++) {
			for (int i = 0; i < pixels.length; i++)
				pixels[i] = bytes[i * channels + b] & 0xFF;
			raster.setSamples(0, 0, width, height, b, pixels);
		}
		return img;
	}

	/**
	 * Split channels from a {@link Mat}.
	 * May be more convenient than OpenCV's built-in approach.
	 *
	 * @param mat
	 * @return a list of {@link Mat}, containing each split channel in order
	 */
	public static List<Mat> splitChannels(Mat mat) {
		var list = new ArrayList<Mat>();
		var channels = mat.channels();
		for (int c = 0; c < channels; c++) {
			var temp = new Mat();
			opencv_core.extractChannel(mat, temp, c);
			list.add(temp);
		}
		return list;
	}

	/**
	 * Merge single-channel Mats into a multichannel {@link Mat}.
	 *
	 * @param channels separate channels
	 * @param dest optional destination (may be null)
	 * @return merged {@link Mat}, which will be the same as dest if provided
	 * @throws IllegalArgumentException if the channels differ in size or depth, or are not single-channel
	 */
	public static Mat mergeChannels(Collection<? extends Mat> channels, Mat dest) throws IllegalArgumentException {
		if (dest == null)
			dest = new Mat();

		int rows = -1;
		int cols = -1;
		int depth = -1;
		for (var m : channels) {
			if (depth < 0) {
				rows = m.rows();
				cols = m.cols();
				depth = m.depth();
			}
			if (m.channels() != 1)
				throw new IllegalArgumentException("mergeChannels() requires single-channel Mats");
			if (depth != m.depth() || rows != m.rows() || cols != m.cols())
				throw new IllegalArgumentException("mergeChannels() requires all Mats to have the same dimensions and depth!");
		}

		try (var scope = new PointerScope()) {
			opencv_core.merge(new MatVector(channels.toArray(Mat[]::new)), dest);
		}
		return dest;
	}

	/**
	 * Ensure that a {@link Mat} is continuous, cloning the data if necessary.
	 *
	 * @param mat input Mat, which may or may not be continuous
	 * @param inPlace if true, set {@code mat} to contain the cloned data if required
	 * @return the original mat unchanged if it is already continuous, or cloned data that is continuous if required
	 * @see Mat#isContinuous()
	 */
	public static Mat ensureContinuous(Mat mat, boolean inPlace) {
		if (!mat.isContinuous()) {
			var mat2 = mat.clone();
			if (!inPlace) {
				return mat2;
			}
			mat.put(mat2);
		}
		return mat;
	}

	/**
	 * Return the total number of pixels in an image, counting each channel separately.
	 * This is similar to Mat.total(), except that Mat.total() ignores multiple channels.
	 * @param mat
	 * @return
	 */
	public static long totalPixels(Mat mat) {
		int nChannels = mat.channels();
		if (nChannels > 0)
			return mat.total() * nChannels;
		return mat.total();
	}

	/**
	 * Extract pixels as a float array, with channels interleaved.
	 * @param mat
	 * @return
	 */
	public static float[] extractFloats(Mat mat) {
		float[] pixels = new float[(int)totalPixels(mat)];
		Mat mat2 = null;
		if (mat.depth() != opencv_core.CV_32F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_32F);
			ensureContinuous(mat2, true);
		} else
			mat2 = ensureContinuous(mat, false);

		FloatIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();

		if (mat2 != mat)
			mat2.close();
		return pixels;
	}

	/**
	 * Extract the pixels of an 8-bit image as a byte array, with channels interleaved.
	 * Values should be interpreted as unsigned.
	 * @param mat
	 * @return
	 * @throws IllegalArgumentException if the Mat is not 8-bit
	 */
	public static byte[] extractBytes(Mat mat) throws IllegalArgumentException {
		if (mat.depth() != opencv_core.CV_8U)
			throw new IllegalArgumentException("Expected an 8-bit Mat, but depth is " + mat.depth());
		var mat2 = ensureContinuous(mat, false);
		byte[] bytes = new byte[(int)totalPixels(mat2)];
		BytePointer data = mat2.data();
		data.get(bytes);
		if (mat2 != mat)
			mat2.close();
		return bytes;
	}

	/**
	 * Set pixels of a continuous 8-bit Mat from a byte array, with channels interleaved.
	 *
	 * @param mat
	 * @param pixels
	 * @throws IllegalArgumentException if the Mat is not a continuous 8-bit Mat of the right size
	 */
	public static void putPixelsUnsigned(Mat mat, byte[] pixels) throws IllegalArgumentException {
		if (mat.depth() != opencv_core.CV_8U || !mat.isContinuous())
			throw new IllegalArgumentException("Expected a continuous 8-bit Mat");
		if (totalPixels(mat) != pixels.length)
			throw new IllegalArgumentException("Expected " + totalPixels(mat) + " pixels, but array length is " + pixels.length);
		mat.data().put(pixels);
	}

	/**
	 * Set pixels from a float array.
	 *
	 * @param mat
	 * @param pixels
	 * @throws IllegalArgumentException if the Mat is not 32-bit float
	 */
	public static void putPixelsFloat(Mat mat, float[] pixels) throws IllegalArgumentException {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof FloatIndexer) {
			((FloatIndexer) indexer).put(0L, pixels);
			indexer.release();
		} else
			throw new IllegalArgumentException("Expected a FloatIndexer, but instead got " + indexer.getClass());
	}

	/**
	 * Create a single-channel 32-bit float Mat from pixel values.
	 * @param width
	 * @param height
	 * @param pixels row-major pixel values; length must be width * height
	 * @return
	 */
	public static Mat createFloatMat(int width, int height, float[] pixels) {
		if (pixels.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " pixels, but array length is " + pixels.length);
		var mat = new Mat(height, width, opencv_core.CV_32FC1);
		putPixelsFloat(mat, pixels);
		return mat;
	}

	/**
	 * Create a 1x1 single-channel Mat with a specific value.
	 *
	 * @param value the value to include in the Mat
	 * @param depth depth of the image
	 * @return
	 */
	public static Mat scalarMat(double value, int depth) {
		return new Mat(1, 1, depth, Scalar.all(value));
	}

	/**
	 * Fill the pixels of an image with a specific value, corresponding to a mask.
	 * @param mat input image
	 * @param mask binary mask; nonzero pixels are filled. If null, all pixels are filled.
	 * @param value replacement value
	 */
	public static void fill(Mat mat, Mat mask, double value) {
		var val = scalarMat(value, opencv_core.CV_64F);
		if (mask == null)
			mat.setTo(val);
		else
			mat.setTo(val, mask);
		val.close();
	}

	/**
	 * Count the pixels of a single-channel image that are nonzero.
	 * @param mat
	 * @return
	 */
	public static int countNonZero(Mat mat) {
		return opencv_core.countNonZero(mat);
	}

	/**
	 * Apply a 2D filter to a single-channel image, returning a 32-bit float result.
	 * @param mat input image
	 * @param kernel filter kernel
	 * @param borderType OpenCV border type for boundary padding
	 * @return
	 */
	public static Mat filter2D(Mat mat, Mat kernel, int borderType) {
		var result = new Mat();
		try (var anchor = new Point(-1, -1)) {
			opencv_imgproc.filter2D(mat, result, opencv_core.CV_32F, kernel, anchor, 0, borderType);
		}
		return result;
	}

	private static int clip8(int value) {
		return value < 0 ? 0 : (value > 255 ? 255 : value);
	}

}
