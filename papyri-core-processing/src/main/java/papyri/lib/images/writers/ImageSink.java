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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import papyri.lib.enhance.OutputFormat;

/**
 * Destination for enhanced images and masks.
 *
 * @author Papyri developers
 */
public interface ImageSink {

	/**
	 * Write an enhanced image.
	 * @param img the image (8-bit grayscale or RGB)
	 * @param base output path without extension; the extension of the format is appended
	 * @param format output format
	 * @param quality JPEG quality, in the range 0 to 100; ignored for other formats
	 * @param embedProfile if true, try to embed an sRGB ICC profile
	 * @return false if a profile was requested but could not be embedded, true otherwise
	 * @throws IOException if the image could not be written
	 */
	boolean write(BufferedImage img, Path base, OutputFormat format, int quality, boolean embedProfile) throws IOException;

	/**
	 * Write a binary mask image as PNG.
	 * @param img
	 * @param path full output path
	 * @throws IOException
	 */
	void writeMask(BufferedImage img, Path path) throws IOException;

	/**
	 * Get the path of the file written by {@link #write(BufferedImage, Path, OutputFormat, int, boolean)}.
	 * @param base
	 * @param format
	 * @return
	 */
	static Path resolve(Path base, OutputFormat format) {
		return base.resolveSibling(base.getFileName().toString() + "." + format.getExtension());
	}

}
