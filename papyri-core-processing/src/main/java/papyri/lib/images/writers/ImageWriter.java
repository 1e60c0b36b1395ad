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
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Interface for writing 8-bit grayscale or RGB images.
 *
 * @author Papyri developers
 */
public interface ImageWriter {

	/**
	 * Get the name of the writer.
	 * @return
	 */
	String getName();

	/**
	 * Get a short description of the writer.
	 * @return
	 */
	String getDetails();

	/**
	 * Get all the file extensions (without dot) supported by this writer.
	 * @return
	 */
	Collection<String> getExtensions();

	/**
	 * Get the default extension, i.e. the first of {@link #getExtensions()}.
	 * @return
	 */
	default String getDefaultExtension() {
		return getExtensions().iterator().next();
	}

	/**
	 * Returns true if the writer can write the image, i.e. it is 8-bit grayscale or RGB.
	 * @param img
	 * @return
	 */
	default boolean supportsImage(BufferedImage img) {
		var raster = img.getRaster();
		if (raster.getSampleModel().getSampleSize(0) > 8)
			return false;
		return raster.getNumBands() == 1 || img.getColorModel().getColorSpace().getNumComponents() == 3;
	}

	/**
	 * Write an image to a file.
	 * @param img
	 * @param path
	 * @throws IOException
	 */
	void writeImage(BufferedImage img, Path path) throws IOException;

	/**
	 * Write an image to an output stream.
	 * @param img
	 * @param stream
	 * @throws IOException
	 */
	void writeImage(BufferedImage img, OutputStream stream) throws IOException;

}
