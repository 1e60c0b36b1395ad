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

package papyri.opencv.classify;

import java.util.Objects;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * An 8-bit image with 1 (grayscale) or 3 (RGB) channels, together with its {@link ImageClass}.
 * <p>
 * Instances are immutable: {@link #getImage()} returns a copy of the pixels.
 *
 * @author Papyri developers
 */
public class ClassifiedImage {

	private final Mat mat;
	private final ImageClass imageClass;

	ClassifiedImage(Mat mat, ImageClass imageClass) {
		this.mat = Objects.requireNonNull(mat);
		this.imageClass = Objects.requireNonNull(imageClass);
		int expected = imageClass.isGrayscale() ? 1 : 3;
		if (mat.channels() != expected)
			throw new IllegalArgumentException("Expected " + expected + " channels for " + imageClass + ", but image has " + mat.channels());
	}

	/**
	 * Get a copy of the pixels.
	 * @return
	 */
	public Mat getImage() {
		return mat.clone();
	}

	/**
	 * Get the image class.
	 * @return
	 */
	public ImageClass getImageClass() {
		return imageClass;
	}

	/**
	 * Returns true if the image is grayscale, whatever the reason.
	 * @return
	 */
	public boolean isGrayscale() {
		return imageClass.isGrayscale();
	}

	/**
	 * Returns true if the image was reduced to its red channel.
	 * @return
	 */
	public boolean isRedChannel() {
		return imageClass == ImageClass.GRAYSCALE_FROM_RED_CHANNEL;
	}

	/**
	 * Number of channels (1 or 3).
	 * @return
	 */
	public int nChannels() {
		return mat.channels();
	}

	/**
	 * Image width.
	 * @return
	 */
	public int getWidth() {
		return mat.cols();
	}

	/**
	 * Image height.
	 * @return
	 */
	public int getHeight() {
		return mat.rows();
	}

	@Override
	public String toString() {
		return "ClassifiedImage [" + getWidth() + "x" + getHeight() + ", " + imageClass + "]";
	}

}
