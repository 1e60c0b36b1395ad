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

package papyri.opencv.segment;

import java.awt.image.BufferedImage;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import papyri.opencv.tools.OpenCVTools;

/**
 * Binary mask with the size of an image: 1 marks background, 0 marks foreground (papyrus and ink).
 * <p>
 * Instances are immutable.
 *
 * @author Papyri developers
 */
public class BackgroundMask {

	private final Mat mask;
	private final byte[] values;

	/**
	 * Create a mask from an 8-bit single-channel Mat, in which nonzero pixels are background.
	 * @param mat
	 * @return
	 */
	public static BackgroundMask fromMat(Mat mat) {
		if (mat.type() != opencv_core.CV_8UC1)
			throw new IllegalArgumentException("Mask must be single-channel 8-bit");
		byte[] bytes = OpenCVTools.extractBytes(mat);
		for (int i = 0; i < bytes.length; i++)
			bytes[i] = bytes[i] == 0 ? 0 : (byte)1;
		return new BackgroundMask(mat.cols(), mat.rows(), bytes);
	}

	private BackgroundMask(int width, int height, byte[] values) {
		this.values = values;
		this.mask = new Mat(height, width, opencv_core.CV_8UC1);
		OpenCVTools.putPixelsUnsigned(mask, values);
	}

	/**
	 * Returns true if the pixel is background.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isBackground(int x, int y) {
		return values[y * getWidth() + x] != 0;
	}

	/**
	 * Proportion of pixels that are background.
	 * @return
	 */
	public double backgroundFraction() {
		int count = 0;
		for (byte v : values) {
			if (v != 0)
				count++;
		}
		return count / (double)values.length;
	}

	/**
	 * Get a mask with foreground and background swapped.
	 * @return
	 */
	public BackgroundMask invert() {
		byte[] inverted = new byte[values.length];
		for (int i = 0; i < values.length; i++)
			inverted[i] = values[i] == 0 ? (byte)1 : 0;
		return new BackgroundMask(getWidth(), getHeight(), inverted);
	}

	/**
	 * Mask width.
	 * @return
	 */
	public int getWidth() {
		return mask.cols();
	}

	/**
	 * Mask height.
	 * @return
	 */
	public int getHeight() {
		return mask.rows();
	}

	/**
	 * Get the mask as an 8-bit Mat, with 1 for background and 0 for foreground.
	 * This is suitable as the mask argument of OpenCV functions.
	 * @return a copy of the mask
	 */
	public Mat getMat() {
		return mask.clone();
	}

	/**
	 * Get a binary image (0 and 255) suitable for writing, with background white.
	 * @return
	 */
	public BufferedImage toBinaryImage() {
		var img = new BufferedImage(getWidth(), getHeight(), BufferedImage.TYPE_BYTE_GRAY);
		int[] pixels = new int[values.length];
		for (int i = 0; i < values.length; i++)
			pixels[i] = values[i] == 0 ? 0 : 255;
		img.getRaster().setSamples(0, 0, getWidth(), getHeight(), 0, pixels);
		return img;
	}

}
