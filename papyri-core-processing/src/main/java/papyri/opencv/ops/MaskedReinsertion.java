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

package papyri.opencv.ops;

import org.bytedeco.opencv.opencv_core.Mat;

import papyri.opencv.segment.BackgroundMask;

/**
 * Restore the background of an enhanced image from the original.
 * <p>
 * Foreground pixels keep their enhanced values, background pixels take the original values.
 *
 * @author Papyri developers
 */
public class MaskedReinsertion {

	private MaskedReinsertion() {
		throw new AssertionError();
	}

	/**
	 * Combine an enhanced image with the original using a background mask.
	 * @param enhanced enhanced image
	 * @param original original image, with the same size and type
	 * @param mask background mask
	 * @return a new image
	 * @throws IllegalArgumentException if the images or mask differ in size, or the images differ in type
	 */
	public static Mat apply(Mat enhanced, Mat original, BackgroundMask mask) throws IllegalArgumentException {
		if (enhanced.type() != original.type())
			throw new IllegalArgumentException("Enhanced and original images must have the same type");
		if (enhanced.cols() != original.cols() || enhanced.rows() != original.rows()
				|| enhanced.cols() != mask.getWidth() || enhanced.rows() != mask.getHeight())
			throw new IllegalArgumentException("Enhanced image, original image and mask must have the same size");
		var result = enhanced.clone();
		var maskMat = mask.getMat();
		original.copyTo(result, maskMat);
		maskMat.close();
		return result;
	}

}
