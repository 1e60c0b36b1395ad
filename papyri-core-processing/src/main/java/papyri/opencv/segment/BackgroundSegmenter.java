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

import java.util.List;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import papyri.lib.enhance.MaskBackground;
import papyri.lib.enhance.MaskParameters;
import papyri.opencv.color.ColorSpaces;
import papyri.opencv.tools.OpenCVTools;

/**
 * Unsupervised segmentation of the background of an image, using a Gabor filter bank and a global Otsu threshold.
 * <ol>
 * <li>The lightness field is inverted if the background is dark.</li>
 * <li>Optionally, shadows are removed by using the lightness of the chromaticity image instead.</li>
 * <li>The field is filtered by a {@link GaborFilterBank}; the per-pixel maximum response across orientations is rescaled to [0, 1].</li>
 * <li>The response is binarized with Otsu's method.</li>
 * <li>The binary image is inverted unless shadows were removed, so that 1 marks background.</li>
 * </ol>
 *
 * @author Papyri developers
 */
public class BackgroundSegmenter {

	private final static Logger logger = LoggerFactory.getLogger(BackgroundSegmenter.class);

	private final MaskParameters params;
	private final GaborFilterBank bank;

	/**
	 * Create a segmenter.
	 * @param params
	 */
	public BackgroundSegmenter(MaskParameters params) {
		this.params = params;
		this.bank = GaborFilterBank.create(params);
	}

	/**
	 * Get the parameters.
	 * @return
	 */
	public MaskParameters getParameters() {
		return params;
	}

	/**
	 * Segment the background of an image.
	 * @param lightness normalized lightness (color images) or intensity (grayscale images), in [0, 1]
	 * @param rgb the 8-bit RGB image, used only for shadow removal; may be null for grayscale images
	 * @return
	 */
	public BackgroundMask segment(Mat lightness, Mat rgb) {
		Mat field;
		if (params.getBackground() == MaskBackground.DARK)
			field = ColorSpaces.negate(lightness);
		else
			field = lightness.clone();

		boolean deshadowed = false;
		if (params.doDeshadow()) {
			if (rgb != null && rgb.channels() == 3) {
				field.close();
				field = deshadowedLightness(rgb);
				deshadowed = true;
			} else
				logger.warn("Shadow removal requires a color image, and will be skipped");
		}

		var response = bank.maxResponse(field);
		field.close();
		var responseNormalized = ColorSpaces.rescale(response, null);
		response.close();

		var binary = threshold(responseNormalized);
		responseNormalized.close();
		var mask = BackgroundMask.fromMat(binary);
		binary.close();

		if (!deshadowed)
			mask = mask.invert();
		logger.debug("Background fraction: {}", mask.backgroundFraction());
		return mask;
	}

	/**
	 * Binarize a field in [0, 1] with Otsu's threshold, computed on its 8-bit quantization.
	 * @param field
	 * @return 8-bit image with values 0 and 1
	 */
	static Mat threshold(Mat field) {
		var field8 = ColorSpaces.quantize(field);
		var binary = new Mat();
		double threshold = opencv_imgproc.threshold(field8, binary, 0, 1, opencv_imgproc.THRESH_BINARY | opencv_imgproc.THRESH_OTSU);
		logger.trace("Otsu threshold: {}", threshold);
		field8.close();
		return binary;
	}

	/**
	 * Compute a shadow-invariant lightness: each channel is divided by the per-pixel channel sum,
	 * and the CIELAB lightness of the resulting chromaticity image is rescaled to [0, 1].
	 * @param rgb 8-bit RGB image
	 * @return
	 */
	public static Mat deshadowedLightness(Mat rgb) {
		var rgbFloat = ColorSpaces.toFloat(rgb);
		List<Mat> channels = OpenCVTools.splitChannels(rgbFloat);
		rgbFloat.close();
		var sum = new Mat();
		opencv_core.add(channels.get(0), channels.get(1), sum);
		opencv_core.add(sum, channels.get(2), sum);
		float[] sumValues = OpenCVTools.extractFloats(sum);
		sum.close();

		float[][] normalized = new float[3][];
		for (int c = 0; c < 3; c++) {
			float[] values = OpenCVTools.extractFloats(channels.get(c));
			for (int i = 0; i < values.length; i++)
				values[i] = (float)(values[i] / (sumValues[i] + Math.ulp(1.0)));
			normalized[c] = values;
			channels.get(c).close();
		}
		int width = rgb.cols();
		int height = rgb.rows();
		var chromaticity = OpenCVTools.mergeChannels(List.of(
				OpenCVTools.createFloatMat(width, height, normalized[0]),
				OpenCVTools.createFloatMat(width, height, normalized[1]),
				OpenCVTools.createFloatMat(width, height, normalized[2])), null);
		var lab = new Mat();
		opencv_imgproc.cvtColor(chromaticity, lab, opencv_imgproc.COLOR_RGB2Lab);
		chromaticity.close();
		var lightness = new Mat();
		opencv_core.extractChannel(lab, lightness, 0);
		lab.close();
		var result = ColorSpaces.rescale(lightness, null);
		lightness.close();
		return result;
	}

}
