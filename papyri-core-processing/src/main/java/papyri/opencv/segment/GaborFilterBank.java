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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import papyri.lib.enhance.MaskParameters;
import papyri.opencv.tools.OpenCVTools;

/**
 * A bank of even-symmetric Gabor filters at a single wavelength and several orientations.
 * <p>
 * Each kernel has its mean subtracted, so that flat regions give no response and thin,
 * elongated structures at the kernel orientation respond strongly.
 *
 * @author Papyri developers
 */
public class GaborFilterBank {

	private final double wavelength;
	private final double sigma;
	private final double aspectRatio;
	private final double[] orientations;
	private final List<Mat> kernels;

	private GaborFilterBank(double wavelength, double bandwidth, double aspectRatio, double[] orientations) {
		this.wavelength = wavelength;
		this.sigma = sigmaFor(wavelength, bandwidth);
		this.aspectRatio = aspectRatio;
		this.orientations = orientations.clone();
		List<Mat> list = new ArrayList<>();
		for (double theta : orientations)
			list.add(createKernel(sigma, Math.toRadians(theta), wavelength, aspectRatio));
		this.kernels = Collections.unmodifiableList(list);
	}

	/**
	 * Create a filter bank from mask parameters.
	 * @param params
	 * @return
	 */
	public static GaborFilterBank create(MaskParameters params) {
		return new GaborFilterBank(params.getWavelength(), params.getBandwidth(), params.getAspectRatio(), params.getOrientations());
	}

	/**
	 * Standard deviation of the Gaussian envelope for a wavelength and spatial-frequency bandwidth.
	 * @param wavelength wavelength in pixels
	 * @param bandwidth bandwidth in octaves
	 * @return
	 */
	public static double sigmaFor(double wavelength, double bandwidth) {
		double b = Math.pow(2, bandwidth);
		return wavelength / Math.PI * Math.sqrt(Math.log(2) / 2) * (b + 1) / (b - 1);
	}

	/**
	 * Half-width of the kernels, large enough to cover 3 standard deviations along the elongated axis.
	 * @param sigma
	 * @param aspectRatio
	 * @return
	 */
	static int kernelRadius(double sigma, double aspectRatio) {
		return (int)Math.ceil(3 * sigma / Math.min(aspectRatio, 1.0));
	}

	private static Mat createKernel(double sigma, double theta, double wavelength, double aspectRatio) {
		int size = kernelRadius(sigma, aspectRatio) * 2 + 1;
		Mat kernel;
		try (var ksize = new Size(size, size)) {
			kernel = opencv_imgproc.getGaborKernel(ksize, sigma, theta, wavelength, aspectRatio, 0, opencv_core.CV_32F);
		}
		float[] values = OpenCVTools.extractFloats(kernel);
		double mean = 0;
		for (float v : values)
			mean += v;
		mean /= values.length;
		for (int i = 0; i < values.length; i++)
			values[i] -= mean;
		OpenCVTools.putPixelsFloat(kernel, values);
		return kernel;
	}

	/**
	 * Filter a single-channel field with every kernel, returning the per-pixel maximum of the absolute responses.
	 * @param field single-channel field
	 * @return 32-bit float response
	 */
	public Mat maxResponse(Mat field) {
		float[] max = null;
		for (var kernel : kernels) {
			var response = OpenCVTools.filter2D(field, kernel, OpenCVTools.DEFAULT_BORDER_TYPE);
			float[] values = OpenCVTools.extractFloats(response);
			response.close();
			if (max == null) {
				max = new float[values.length];
			}
			for (int i = 0; i < values.length; i++) {
				float v = Math.abs(values[i]);
				if (v > max[i])
					max[i] = v;
			}
		}
		return OpenCVTools.createFloatMat(field.cols(), field.rows(), max);
	}

	/**
	 * Number of orientations.
	 * @return
	 */
	public int size() {
		return kernels.size();
	}

	/**
	 * Get a copy of the kernel at the specified index.
	 * @param ind
	 * @return
	 */
	public Mat getKernel(int ind) {
		return kernels.get(ind).clone();
	}

	/**
	 * Filter orientations, in degrees.
	 * @return
	 */
	public double[] getOrientations() {
		return orientations.clone();
	}

	/**
	 * Standard deviation of the Gaussian envelope, in pixels.
	 * @return
	 */
	public double getSigma() {
		return sigma;
	}

	/**
	 * Wavelength, in pixels.
	 * @return
	 */
	public double getWavelength() {
		return wavelength;
	}

	/**
	 * Spatial aspect ratio.
	 * @return
	 */
	public double getAspectRatio() {
		return aspectRatio;
	}

}
