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

import java.util.ArrayList;
import java.util.Arrays;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import papyri.opencv.tools.OpenCVTools;

/**
 * Determine whether an image is grayscale or color, normalizing its channels accordingly.
 * <ul>
 * <li>Channels beyond the third are discarded (assumed to be alpha).</li>
 * <li>A single channel is grayscale.</li>
 * <li>Two channels are padded with a zero third channel, and treated as color.</li>
 * <li>Three identical channels are collapsed to one, and treated as grayscale.</li>
 * <li>Otherwise, the image is color, unless the red channel alone is requested.</li>
 * </ul>
 *
 * @author Papyri developers
 */
public class ImageClassifier {

	private final static Logger logger = LoggerFactory.getLogger(ImageClassifier.class);

	private ImageClassifier() {
		throw new AssertionError();
	}

	/**
	 * Classify an image.
	 * @param image 8-bit image with at least one channel; this is not modified
	 * @param redChannelOnly if true, color images are reduced to their first (red) channel
	 * @return
	 * @throws IllegalArgumentException if the image is not 8-bit, or has no channels
	 */
	public static ClassifiedImage classify(Mat image, boolean redChannelOnly) throws IllegalArgumentException {
		if (image.depth() != opencv_core.CV_8U)
			throw new IllegalArgumentException("Only 8-bit unsigned images are supported");
		int nChannels = image.channels();
		if (nChannels < 1 || image.empty())
			throw new IllegalArgumentException("Image has no pixels");

		if (nChannels == 1)
			return new ClassifiedImage(image.clone(), ImageClass.GRAYSCALE);

		var channels = OpenCVTools.splitChannels(image);
		if (nChannels == 2) {
			logger.debug("Padding 2-channel image with an empty third channel");
			channels = new ArrayList<>(channels);
			channels.add(new Mat(image.rows(), image.cols(), opencv_core.CV_8UC1, Scalar.ZERO));
		} else {
			if (nChannels > 3) {
				logger.debug("Discarding {} extra channel(s)", nChannels - 3);
				channels = new ArrayList<>(channels.subList(0, 3));
			}
			if (channelsIdentical(channels.get(0), channels.get(1), channels.get(2)))
				return new ClassifiedImage(channels.get(0), ImageClass.GRAYSCALE_FROM_IDENTICAL_CHANNELS);
		}

		if (redChannelOnly)
			return new ClassifiedImage(channels.get(0), ImageClass.GRAYSCALE_FROM_RED_CHANNEL);

		var mat = OpenCVTools.mergeChannels(channels, null);
		return new ClassifiedImage(mat, ImageClass.COLOR);
	}

	static boolean channelsIdentical(Mat first, Mat... others) {
		byte[] bytes = OpenCVTools.extractBytes(first);
		for (var other : others) {
			if (!Arrays.equals(bytes, OpenCVTools.extractBytes(other)))
				return false;
		}
		return true;
	}

}
