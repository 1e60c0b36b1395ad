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

import java.awt.color.ICC_Profile;
import java.awt.image.ColorConvertOp;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import papyri.opencv.tools.OpenCVTools;

/**
 * Gamut expansion of color images by an ICC transform between an ordered pair of profiles.
 * <p>
 * Pixel values are interpreted in the space of the source profile and rendered into the target space,
 * using the perceptual rendering intent. With the default profiles, values are interpreted as Adobe RGB (1998)
 * and rendered to sRGB, which stretches the chroma of the image.
 * <p>
 * If the profiles cannot be loaded, the expansion is disabled and {@link #apply(Mat)} returns an unchanged copy;
 * the reason is available from {@link #getWarning()}.
 *
 * @author Papyri developers
 */
public class GamutExpansion {

	private final static Logger logger = LoggerFactory.getLogger(GamutExpansion.class);

	private final ColorConvertOp op;
	private final String warning;

	private GamutExpansion(ColorConvertOp op, String warning) {
		this.op = op;
		this.warning = warning;
	}

	/**
	 * Create an expansion interpreting pixels using the source profile, and rendering to the target profile.
	 * @param source
	 * @param target
	 * @return
	 */
	public static GamutExpansion create(ICC_Profile source, ICC_Profile target) {
		Objects.requireNonNull(source);
		Objects.requireNonNull(target);
		var op = new ColorConvertOp(
				new ICC_Profile[] {
						IccProfiles.withPerceptualIntent(source),
						IccProfiles.withPerceptualIntent(target)
				},
				null);
		return new GamutExpansion(op, null);
	}

	/**
	 * Create a disabled expansion.
	 * @param warning the reason the expansion is disabled
	 * @return
	 */
	public static GamutExpansion disabled(String warning) {
		return new GamutExpansion(null, warning);
	}

	/**
	 * Create the default expansion from Adobe RGB (1998) to sRGB.
	 * If the Adobe RGB profile cannot be read, a disabled expansion is returned.
	 * @param adobeProfilePath optional path to an Adobe RGB (1998) profile; may be null
	 * @return
	 * @see IccProfiles#getAdobeRGB(Path)
	 */
	public static GamutExpansion load(Path adobeProfilePath) {
		try {
			return create(IccProfiles.getAdobeRGB(adobeProfilePath), IccProfiles.getSRGB());
		} catch (IOException | IllegalArgumentException e) {
			logger.warn("Unable to load ICC profiles, gamut expansion will be skipped: {}", e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return disabled("Unable to load ICC color profiles, gamut expansion skipped");
		}
	}

	/**
	 * Returns true if the expansion will be applied.
	 * @return
	 */
	public boolean isEnabled() {
		return op != null;
	}

	/**
	 * Get the reason the expansion is disabled, if it is.
	 * @return
	 */
	public Optional<String> getWarning() {
		return Optional.ofNullable(warning);
	}

	/**
	 * Apply the expansion to an 8-bit RGB image.
	 * @param rgb 3-channel 8-bit image
	 * @return a new image
	 * @throws IllegalArgumentException if the image is not 8-bit RGB
	 */
	public Mat apply(Mat rgb) throws IllegalArgumentException {
		if (rgb.type() != opencv_core.CV_8UC3)
			throw new IllegalArgumentException("Gamut expansion requires an 8-bit RGB image");
		if (op == null)
			return rgb.clone();
		var img = OpenCVTools.matToBufferedImage(rgb);
		applyInPlace(op, img.getRaster());
		return OpenCVTools.imageToMat(img);
	}

	private static void applyInPlace(ColorConvertOp op, WritableRaster raster) {
		op.filter(raster, raster);
	}

}
