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

import papyri.opencv.tools.OpenCVTools;

/**
 * Contrast-limited adaptive histogram equalization with a Rayleigh target distribution.
 * <p>
 * The image is divided into tiles. Each tile gets a contrast-limited histogram mapping, and pixels are mapped
 * by interpolating bilinearly between the mappings of the four nearest tile centers.
 * Input values are expected to be in the range [0, 1].
 *
 * @author Papyri developers
 */
public class AdaptiveHistogramEqualization {

	private final int tilesX;
	private final int tilesY;
	private final double clipLimit;
	private final int nBins;
	private final double alpha;

	/**
	 * Create a new instance.
	 * @param tilesX number of tiles horizontally
	 * @param tilesY number of tiles vertically
	 * @param clipLimit normalized clip limit, in the range [0, 1]
	 * @param nBins number of histogram bins
	 * @param alpha Rayleigh distribution parameter
	 */
	public AdaptiveHistogramEqualization(int tilesX, int tilesY, double clipLimit, int nBins, double alpha) {
		if (tilesX < 2 || tilesY < 2)
			throw new IllegalArgumentException("At least 2 tiles are needed in each dimension");
		if (!(clipLimit >= 0 && clipLimit <= 1))
			throw new IllegalArgumentException("Clip limit must be in the range [0, 1]");
		if (nBins < 2)
			throw new IllegalArgumentException("At least 2 bins are needed");
		if (!(alpha > 0))
			throw new IllegalArgumentException("Alpha must be > 0");
		this.tilesX = tilesX;
		this.tilesY = tilesY;
		this.clipLimit = clipLimit;
		this.nBins = nBins;
		this.alpha = alpha;
	}

	/**
	 * Default settings: 8x8 tiles, clip limit 0.01, 256 bins, alpha 0.4.
	 * @return
	 */
	public static AdaptiveHistogramEqualization createDefault() {
		return new AdaptiveHistogramEqualization(8, 8, 0.01, 256, 0.4);
	}

	/**
	 * Equalize a single-channel field.
	 * @param field field with values in [0, 1]
	 * @return a new 32-bit float field
	 */
	public Mat apply(Mat field) {
		float[] pixels = OpenCVTools.extractFloats(field);
		float[] result = apply(pixels, field.cols(), field.rows());
		return OpenCVTools.createFloatMat(field.cols(), field.rows(), result);
	}

	/**
	 * Equalize pixel values.
	 * @param pixels row-major values in [0, 1]
	 * @param width
	 * @param height
	 * @return equalized values in [0, 1]
	 */
	public float[] apply(float[] pixels, int width, int height) {
		int[] padY = padding(height, tilesY);
		int[] padX = padding(width, tilesX);
		int paddedHeight = height + padY[0] + padY[1];
		int paddedWidth = width + padX[0] + padX[1];
		int tileHeight = paddedHeight / tilesY;
		int tileWidth = paddedWidth / tilesX;

		// Bin index for every padded pixel
		int[] bins = new int[paddedWidth * paddedHeight];
		for (int y = 0; y < paddedHeight; y++) {
			int yy = reflect(y - padY[0], height);
			for (int x = 0; x < paddedWidth; x++) {
				int xx = reflect(x - padX[0], width);
				bins[y * paddedWidth + x] = toBin(pixels[yy * width + xx]);
			}
		}

		int numPixInTile = tileWidth * tileHeight;
		int minClip = (int)Math.ceil(numPixInTile / (double)nBins);
		int limit = minClip + (int)Math.round(clipLimit * (numPixInTile - minClip));

		double[][][] mappings = new double[tilesY][tilesX][];
		for (int ty = 0; ty < tilesY; ty++) {
			for (int tx = 0; tx < tilesX; tx++) {
				int[] hist = new int[nBins];
				for (int y = ty * tileHeight; y < (ty + 1) * tileHeight; y++) {
					for (int x = tx * tileWidth; x < (tx + 1) * tileWidth; x++)
						hist[bins[y * paddedWidth + x]]++;
				}
				clipHistogram(hist, limit);
				mappings[ty][tx] = rayleighMapping(hist, numPixInTile, alpha);
			}
		}

		float[] output = new float[width * height];
		int imgRow = 0;
		for (int k = 0; k <= tilesY; k++) {
			int subRows;
			int top;
			int bottom;
			if (k == 0) {
				subRows = tileHeight / 2;
				top = 0;
				bottom = 0;
			} else if (k == tilesY) {
				subRows = tileHeight / 2;
				top = tilesY - 1;
				bottom = tilesY - 1;
			} else {
				subRows = tileHeight;
				top = k - 1;
				bottom = k;
			}
			int imgCol = 0;
			for (int j = 0; j <= tilesX; j++) {
				int subCols;
				int left;
				int right;
				if (j == 0) {
					subCols = tileWidth / 2;
					left = 0;
					right = 0;
				} else if (j == tilesX) {
					subCols = tileWidth / 2;
					left = tilesX - 1;
					right = tilesX - 1;
				} else {
					subCols = tileWidth;
					left = j - 1;
					right = j;
				}
				double[] ul = mappings[top][left];
				double[] ur = mappings[top][right];
				double[] bl = mappings[bottom][left];
				double[] br = mappings[bottom][right];
				double norm = subRows * (double)subCols;
				for (int r = 0; r < subRows; r++) {
					int y = imgRow + r - padY[0];
					if (y < 0 || y >= height)
						continue;
					for (int c = 0; c < subCols; c++) {
						int x = imgCol + c - padX[0];
						if (x < 0 || x >= width)
							continue;
						int bin = bins[(imgRow + r) * paddedWidth + imgCol + c];
						double val = ((subRows - r) * ((subCols - c) * ul[bin] + c * ur[bin])
								+ r * ((subCols - c) * bl[bin] + c * br[bin])) / norm;
						output[y * width + x] = (float)val;
					}
				}
				imgCol += subCols;
			}
			imgRow += subRows;
		}
		return output;
	}

	int toBin(float value) {
		if (Float.isNaN(value) || value <= 0)
			return 0;
		if (value >= 1)
			return nBins - 1;
		return (int)Math.round(value * (nBins - 1));
	}

	/**
	 * Compute padding before and after a dimension, so that it divides evenly into tiles of even size.
	 * @param length
	 * @param nTiles
	 * @return two values, the padding before and after
	 */
	static int[] padding(int length, int nTiles) {
		int tileLength;
		int pad = 0;
		if (length % nTiles == 0)
			tileLength = length / nTiles;
		else {
			tileLength = length / nTiles + 1;
			pad = tileLength * nTiles - length;
		}
		if (tileLength % 2 != 0)
			pad += nTiles;
		return new int[] {pad / 2, pad - pad / 2};
	}

	/**
	 * Reflect an index into [0, length), repeating the edge pixel.
	 */
	static int reflect(int ind, int length) {
		if (length == 1)
			return 0;
		int period = 2 * length;
		ind = ind % period;
		if (ind < 0)
			ind += period;
		return ind < length ? ind : period - ind - 1;
	}

	/**
	 * Clip a histogram in place, redistributing the excess counts across all bins.
	 * @param hist
	 * @param limit
	 */
	static void clipHistogram(int[] hist, int limit) {
		int nBins = hist.length;
		long totalExcess = 0;
		for (int h : hist)
			totalExcess += Math.max(h - limit, 0);

		int avgBinIncr = (int)(totalExcess / nBins);
		int upperLimit = limit - avgBinIncr;
		for (int k = 0; k < nBins; k++) {
			if (hist[k] > limit)
				hist[k] = limit;
			else if (hist[k] > upperLimit) {
				totalExcess -= limit - hist[k];
				hist[k] = limit;
			} else {
				totalExcess -= avgBinIncr;
				hist[k] += avgBinIncr;
			}
		}

		int k = 0;
		while (totalExcess > 0) {
			boolean changed = false;
			int stepSize = (int)Math.max(nBins / totalExcess, 1);
			for (int m = k; m < nBins; m += stepSize) {
				if (hist[m] < limit) {
					hist[m]++;
					totalExcess--;
					changed = true;
					if (totalExcess == 0)
						break;
				}
			}
			if (!changed && allAtLimit(hist, limit))
				break;
			k++;
			if (k >= nBins)
				k = 0;
		}
	}

	private static boolean allAtLimit(int[] hist, int limit) {
		for (int h : hist) {
			if (h < limit)
				return false;
		}
		return true;
	}

	/**
	 * Create a mapping from histogram bins to output values so that the output follows a Rayleigh distribution.
	 * @param hist
	 * @param nPixels
	 * @param alpha
	 * @return
	 */
	static double[] rayleighMapping(int[] hist, int nPixels, double alpha) {
		double hconst = 2 * alpha * alpha;
		double vmax = 1 - Math.exp(-1 / hconst);
		double[] mapping = new double[hist.length];
		long sum = 0;
		for (int i = 0; i < hist.length; i++) {
			sum += hist[i];
			double val = vmax * (sum / (double)nPixels);
			if (val >= 1)
				val = 1 - Math.ulp(1.0);
			double temp = Math.sqrt(-hconst * Math.log(1 - val));
			mapping[i] = Math.min(temp, 1.0);
		}
		return mapping;
	}

}
