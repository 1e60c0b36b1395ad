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

package papyri.opencv.color;

import java.util.Objects;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * CIELAB decomposition of an RGB image: L in [0, 100], with a and b roughly in [-128, 127].
 * <p>
 * All planes are single-channel 32-bit float and have the same size.
 * The planes are shared rather than copied, and must not be modified.
 *
 * @author Papyri developers
 */
public class LabImage {

	private final Mat l;
	private final Mat a;
	private final Mat b;

	LabImage(Mat l, Mat a, Mat b) {
		this.l = Objects.requireNonNull(l);
		this.a = Objects.requireNonNull(a);
		this.b = Objects.requireNonNull(b);
		for (var mat : new Mat[] {l, a, b}) {
			if (mat.type() != opencv_core.CV_32FC1)
				throw new IllegalArgumentException("LAB planes must be single-channel 32-bit float");
			if (mat.rows() != l.rows() || mat.cols() != l.cols())
				throw new IllegalArgumentException("LAB planes must have the same size");
		}
	}

	/**
	 * Lightness plane, in the range [0, 100].
	 * @return
	 */
	public Mat getL() {
		return l;
	}

	/**
	 * Green-red plane.
	 * @return
	 */
	public Mat getA() {
		return a;
	}

	/**
	 * Blue-yellow plane.
	 * @return
	 */
	public Mat getB() {
		return b;
	}

	/**
	 * Image width.
	 * @return
	 */
	public int getWidth() {
		return l.cols();
	}

	/**
	 * Image height.
	 * @return
	 */
	public int getHeight() {
		return l.rows();
	}

}
