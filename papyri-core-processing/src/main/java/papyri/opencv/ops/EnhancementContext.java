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

import java.util.Objects;

import org.bytedeco.opencv.opencv_core.Mat;

import papyri.opencv.classify.ClassifiedImage;
import papyri.opencv.classify.ImageClass;
import papyri.opencv.color.ColorSpaces;
import papyri.opencv.color.GamutExpansion;
import papyri.opencv.color.LabImage;
import papyri.opencv.segment.BackgroundMask;

/**
 * Everything an {@link EnhancementOperator} needs to know about one image.
 * <p>
 * For color images this holds the gamut-expanded RGB image, its CIELAB planes and the normalized lightness.
 * For grayscale images it holds the single channel and its intensity scaled to [0, 1]; there are no CIELAB planes.
 * <p>
 * The Mats are shared between contexts created with {@link #withMask(BackgroundMask)} and must not be modified.
 *
 * @author Papyri developers
 */
public class EnhancementContext {

	private final ImageClass imageClass;
	private final Mat rgb;
	private final LabImage lab;
	private final Mat lightness;
	private final BackgroundMask mask;
	private final RetinexProvider retinexProvider;

	private EnhancementContext(ImageClass imageClass, Mat rgb, LabImage lab, Mat lightness, BackgroundMask mask, RetinexProvider retinexProvider) {
		this.imageClass = imageClass;
		this.rgb = rgb;
		this.lab = lab;
		this.lightness = lightness;
		this.mask = mask;
		this.retinexProvider = retinexProvider;
	}

	/**
	 * Create a context for a classified image, without a mask.
	 * @param image the classified image
	 * @param gamut gamut expansion to apply to color images
	 * @param retinexProvider retinex implementation; may be null
	 * @return
	 */
	public static EnhancementContext create(ClassifiedImage image, GamutExpansion gamut, RetinexProvider retinexProvider) {
		var mat = image.getImage();
		if (image.isGrayscale())
			return new EnhancementContext(image.getImageClass(), mat, null, ColorSpaces.toFloat(mat), null, retinexProvider);
		var expanded = gamut.apply(mat);
		mat.close();
		var lab = ColorSpaces.rgbToLab(expanded);
		var lightness = ColorSpaces.normalizedLightness(lab);
		return new EnhancementContext(image.getImageClass(), expanded, lab, lightness, null, retinexProvider);
	}

	/**
	 * Get a context for the same image with a background mask.
	 * @param mask the mask, or null to remove the mask
	 * @return
	 */
	public EnhancementContext withMask(BackgroundMask mask) {
		if (mask != null && (mask.getWidth() != getWidth() || mask.getHeight() != getHeight()))
			throw new IllegalArgumentException("Mask size does not match image size");
		return new EnhancementContext(imageClass, rgb, lab, lightness, mask, retinexProvider);
	}

	/**
	 * Image class.
	 * @return
	 */
	public ImageClass getImageClass() {
		return imageClass;
	}

	/**
	 * Returns true if the image is grayscale.
	 * @return
	 */
	public boolean isGrayscale() {
		return imageClass.isGrayscale();
	}

	/**
	 * The 8-bit image to enhance: gamut-expanded RGB for color images, the single channel for grayscale images.
	 * @return
	 */
	public Mat getRgb() {
		return rgb;
	}

	/**
	 * CIELAB planes of a color image.
	 * @return the planes, or null for grayscale images
	 */
	public LabImage getLab() {
		return lab;
	}

	/**
	 * Normalized lightness (color images) or intensity (grayscale images), in [0, 1].
	 * @return
	 */
	public Mat getLightness() {
		return lightness;
	}

	/**
	 * Background mask.
	 * @return the mask, or null if the image is not masked
	 */
	public BackgroundMask getMask() {
		return mask;
	}

	/**
	 * Returns true if there is a background mask.
	 * @return
	 */
	public boolean isMasked() {
		return mask != null;
	}

	/**
	 * Retinex implementation.
	 * @return the provider, or null if none is available
	 */
	public RetinexProvider getRetinexProvider() {
		return retinexProvider;
	}

	/**
	 * Image width.
	 * @return
	 */
	public int getWidth() {
		return rgb.cols();
	}

	/**
	 * Image height.
	 * @return
	 */
	public int getHeight() {
		return rgb.rows();
	}

	@Override
	public String toString() {
		return "EnhancementContext [" + imageClass + ", " + getWidth() + "x" + getHeight() + (isMasked() ? ", masked" : "") + "]";
	}

	static <T> T require(T value, String name) {
		return Objects.requireNonNull(value, name + " is required");
	}

}
