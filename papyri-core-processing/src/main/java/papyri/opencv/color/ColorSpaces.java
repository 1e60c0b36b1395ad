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

import java.util.Arrays;
import java.util.List;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;

import papyri.lib.common.GeneralTools;
import papyri.opencv.tools.OpenCVTools;

/**
 * Static methods for color space conversions and the normalization of scalar fields.
 * <p>
 * RGB values are interpreted as sRGB, and CIELAB uses the D65 white point.
 * Fields used for enhancement are single-channel 32-bit float, normally in the range [0, 1].
 *
 * @author Papyri developers
 */
public class ColorSpaces {

	private ColorSpaces() {
		throw new AssertionError();
	}

	/**
	 * Convert an 8-bit RGB image to CIELAB.
	 * @param rgb 3-channel 8-bit image
	 * @return
	 */
	public static LabImage rgbToLab(Mat rgb) {
		checkRGB(rgb);
		var rgbFloat = toFloat(rgb);
		var lab = new Mat();
		opencv_imgproc.cvtColor(rgbFloat, lab, opencv_imgproc.COLOR_RGB2Lab);
		rgbFloat.close();
		var channels = OpenCVTools.splitChannels(lab);
		lab.close();
		return new LabImage(channels.get(0), channels.get(1), channels.get(2));
	}

	/**
	 * Get the lightness plane rescaled to the range [0, 1].
	 * @param lab
	 * @return
	 */
	public static Mat normalizedLightness(LabImage lab) {
		return rescale(lab.getL(), null);
	}

	/**
	 * Reconstruct an 8-bit RGB image from a normalized lightness field and chromatic planes.
	 * <p>
	 * The lightness is scaled to [0, 100] before conversion. RGB values outside [0, 1] are clipped
	 * (not remapped) before quantization.
	 *
	 * @param lightness lightness field, normally in [0, 1]
	 * @param a green-red plane
	 * @param b blue-yellow plane
	 * @return 3-channel 8-bit RGB image
	 */
	public static Mat labToRgb(Mat lightness, Mat a, Mat b) {
		var l100 = new Mat();
		lightness.convertTo(l100, opencv_core.CV_32F, 100.0, 0.0);
		var lab = OpenCVTools.mergeChannels(Arrays.asList(l100, a, b), null);
		var rgbFloat = new Mat();
		opencv_imgproc.cvtColor(lab, rgbFloat, opencv_imgproc.COLOR_Lab2RGB);
		var rgb = quantize(rgbFloat);
		l100.close();
		lab.close();
		rgbFloat.close();
		return rgb;
	}

	/**
	 * Convert an 8-bit RGB image to HSV.
	 * @param rgb 3-channel 8-bit image
	 * @return hue, saturation and value planes, each in the range [0, 1]
	 */
	public static List<Mat> rgbToHsv(Mat rgb) {
		checkRGB(rgb);
		var rgbFloat = toFloat(rgb);
		var hsv = new Mat();
		opencv_imgproc.cvtColor(rgbFloat, hsv, opencv_imgproc.COLOR_RGB2HSV);
		rgbFloat.close();
		var channels = OpenCVTools.splitChannels(hsv);
		hsv.close();
		// Hue is returned in degrees for float input
		var hue = channels.get(0);
		hue.convertTo(hue, opencv_core.CV_32F, 1.0/360.0, 0.0);
		return channels;
	}

	/**
	 * Convert an 8-bit image to 32-bit float, scaled to [0, 1].
	 * @param mat
	 * @return
	 */
	public static Mat toFloat(Mat mat) {
		var result = new Mat();
		mat.convertTo(result, opencv_core.CV_32F, 1.0/255.0, 0.0);
		return result;
	}

	/**
	 * Clip a field to [0, 1] and quantize it to 8 bits, rounding half up.
	 * NaNs become 0. Any number of channels is supported.
	 * @param field 32-bit float field
	 * @return
	 */
	public static Mat quantize(Mat field) {
		float[] pixels = OpenCVTools.extractFloats(field);
		byte[] bytes = new byte[pixels.length];
		for (int i = 0; i < pixels.length; i++) {
			float v = pixels[i];
			if (Float.isNaN(v))
				continue;
			bytes[i] = (byte)Math.round(GeneralTools.clipValue(v, 0.0, 1.0) * 255.0);
		}
		var mat = new Mat(field.rows(), field.cols(), opencv_core.CV_8UC(field.channels()));
		OpenCVTools.putPixelsUnsigned(mat, bytes);
		return mat;
	}

	/**
	 * Rescale a single-channel field linearly so that its minimum becomes 0 and its maximum 1.
	 * <p>
	 * NaNs are ignored when computing the minimum and maximum, and remain NaN.
	 * If the field is constant, all finite values become 0.
	 *
	 * @param field single-channel field
	 * @param excluded optional 8-bit mask; pixels where it is nonzero are ignored when computing the minimum
	 *                 and maximum, although they are still rescaled. May be null.
	 * @return a new 32-bit float field
	 */
	public static Mat rescale(Mat field, Mat excluded) {
		float[] pixels = OpenCVTools.extractFloats(field);
		byte[] mask = excluded == null ? null : OpenCVTools.extractBytes(excluded);
		if (mask != null && mask.length != pixels.length)
			throw new IllegalArgumentException("Mask size does not match field size");
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < pixels.length; i++) {
			float v = pixels[i];
			if (Float.isNaN(v) || (mask != null && mask[i] != 0))
				continue;
			if (v < min)
				min = v;
			if (v > max)
				max = v;
		}
		double range = max - min;
		for (int i = 0; i < pixels.length; i++) {
			float v = pixels[i];
			if (Float.isNaN(v))
				continue;
			if (range > 0 && Double.isFinite(range))
				pixels[i] = (float)((v - min) / range);
			else
				pixels[i] = 0f;
		}
		return OpenCVTools.createFloatMat(field.cols(), field.rows(), pixels);
	}

	/**
	 * Negative of a normalized field, i.e. 1 - value.
	 * @param field single-channel 32-bit float field
	 * @return a new field
	 */
	public static Mat negate(Mat field) {
		var result = new Mat();
		field.convertTo(result, opencv_core.CV_32F, -1.0, 1.0);
		return result;
	}

	/**
	 * Negate a chromatic plane, i.e. -value.
	 * @param plane single-channel 32-bit float plane
	 * @return a new plane
	 */
	public static Mat negateChroma(Mat plane) {
		var result = new Mat();
		plane.convertTo(result, opencv_core.CV_32F, -1.0, 0.0);
		return result;
	}

	private static void checkRGB(Mat rgb) {
		if (rgb.type() != opencv_core.CV_8UC3)
			throw new IllegalArgumentException("Expected an 8-bit RGB image");
	}

}
