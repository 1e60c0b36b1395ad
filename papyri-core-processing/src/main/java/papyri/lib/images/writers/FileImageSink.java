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
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import papyri.lib.enhance.OutputFormat;

/**
 * Default {@link ImageSink}, writing files with ImageIO.
 * <p>
 * TIFF files receive the profile as a tag when written. JPEG files are written first, and then updated
 * by an {@link IccProfileEmbedder}.
 *
 * @author Papyri developers
 */
public class FileImageSink implements ImageSink {

	private final static Logger logger = LoggerFactory.getLogger(FileImageSink.class);

	private final ICC_Profile profile;
	private final IccProfileEmbedder embedder;

	/**
	 * Create a sink.
	 * @param profile profile to embed
	 * @param embedder embedder used for JPEG files
	 */
	public FileImageSink(ICC_Profile profile, IccProfileEmbedder embedder) {
		this.profile = Objects.requireNonNull(profile);
		this.embedder = Objects.requireNonNull(embedder);
	}

	@Override
	public boolean write(BufferedImage img, Path base, OutputFormat format, int quality, boolean embedProfile) throws IOException {
		var path = ImageSink.resolve(base, format);
		logger.debug("Writing {}", path);
		switch (format) {
		case TIFF:
			new TiffWriter(embedProfile ? profile : null).writeImage(img, path);
			return true;
		case JPEG:
			new JpegWriter(quality).writeImage(img, path);
			if (!embedProfile)
				return true;
			return embedder.embed(path, profile);
		default:
			throw new IllegalArgumentException("Unsupported output format " + format);
		}
	}

	@Override
	public void writeMask(BufferedImage img, Path path) throws IOException {
		logger.debug("Writing mask {}", path);
		new PngWriter().writeImage(img, path);
	}

}
