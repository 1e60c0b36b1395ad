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

package papyri.lib.images.writers;

import java.awt.Graphics2D;
import java.awt.Transparency;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Collection;

import javax.imageio.ImageWriteParam;

/**
 * Write images as JPEG with a specified quality.
 *
 * @author Papyri developers
 */
public class JpegWriter extends AbstractImageIOWriter {

	private final int quality;

	/**
	 * Create a JPEG writer.
	 * @param quality quality, in the range 0 to 100
	 * @throws IllegalArgumentException if the quality is out of range
	 */
	public JpegWriter(int quality) throws IllegalArgumentException {
		if (quality < 0 || quality > 100)
			throw new IllegalArgumentException("JPEG quality must be between 0 and 100, but was " + quality);
		this.quality = quality;
	}

	/**
	 * JPEG quality, in the range 0 to 100.
	 * @return
	 */
	public int getQuality() {
		return quality;
	}

	@Override
	public String getName() {
		return "JPEG";
	}

	@Override
	public String getDetails() {
		return "Write image as JPEG using ImageIO (lossy compression). Only supports 8-bit single-channel or RGB images.";
	}

	@Override
	protected BufferedImage prepareImage(BufferedImage img) {
		// If the image isn't opaque, make it so
		if (img.getTransparency() != Transparency.OPAQUE) {
			BufferedImage img2 = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
			Graphics2D g2d = img2.createGraphics();
			g2d.drawImage(img, 0, 0, null);
			g2d.dispose();
			return img2;
		}
		return img;
	}

	@Override
	protected ImageWriteParam createWriteParam(javax.imageio.ImageWriter writer) {
		var param = writer.getDefaultWriteParam();
		param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
		param.setCompressionQuality(quality / 100f);
		return param;
	}

	@Override
	public Collection<String> getExtensions() {
		return Arrays.asList("jpg", "jpeg");
	}

}
