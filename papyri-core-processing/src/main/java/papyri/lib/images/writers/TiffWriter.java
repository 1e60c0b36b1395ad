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

import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;

import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;

/**
 * Write images as uncompressed TIFF, optionally with an embedded ICC profile.
 * <p>
 * The profile is written as the private TIFF tag 34675 (InterColorProfile).
 *
 * @author Papyri developers
 */
public class TiffWriter extends AbstractImageIOWriter {

	/**
	 * TIFF tag number used to store an ICC profile.
	 */
	public static final int TAG_ICC_PROFILE = 34675;

	private final ICC_Profile profile;

	/**
	 * Create a TIFF writer that does not embed a profile.
	 */
	public TiffWriter() {
		this(null);
	}

	/**
	 * Create a TIFF writer.
	 * @param profile ICC profile to embed in RGB images; may be null
	 */
	public TiffWriter(ICC_Profile profile) {
		this.profile = profile;
	}

	@Override
	public String getName() {
		return "TIFF";
	}

	@Override
	public String getDetails() {
		return "Write image as TIFF using ImageIO. Only supports 8-bit single-channel or RGB images.";
	}

	@Override
	protected IIOMetadata createMetadata(javax.imageio.ImageWriter writer, BufferedImage img, ImageWriteParam param) throws IOException {
		if (profile == null || img.getRaster().getNumBands() == 1)
			return null;
		var metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(img), param);
		var dir = TIFFDirectory.createFromMetadata(metadata);
		byte[] bytes = profile.getData();
		var tag = new TIFFTag("ICCProfile", TAG_ICC_PROFILE, 1 << TIFFTag.TIFF_UNDEFINED);
		dir.addTIFFField(new TIFFField(tag, TIFFTag.TIFF_UNDEFINED, bytes.length, bytes));
		return dir.getAsMetadata();
	}

	@Override
	public Collection<String> getExtensions() {
		return Arrays.asList("tif", "tiff");
	}

}
