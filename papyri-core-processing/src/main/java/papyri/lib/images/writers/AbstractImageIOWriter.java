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
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageOutputStream;

/**
 * Base class for writers that use ImageIO.
 * <p>
 * Subclasses may customize the write parameters and metadata; by default ImageIO's defaults are used.
 */
abstract class AbstractImageIOWriter implements ImageWriter {

	/**
	 * Prepare an image for writing, e.g. by removing transparency. The default returns the image unchanged.
	 * @param img
	 * @return
	 */
	protected BufferedImage prepareImage(BufferedImage img) {
		return img;
	}

	/**
	 * Create the write parameters. The default returns null, which means ImageIO's defaults.
	 * @param writer
	 * @return
	 */
	protected ImageWriteParam createWriteParam(javax.imageio.ImageWriter writer) {
		return null;
	}

	/**
	 * Create image metadata. The default returns null, which means no custom metadata.
	 * @param writer
	 * @param img
	 * @param param
	 * @return
	 * @throws IOException
	 */
	protected IIOMetadata createMetadata(javax.imageio.ImageWriter writer, BufferedImage img, ImageWriteParam param) throws IOException {
		return null;
	}

	@Override
	public void writeImage(BufferedImage img, Path path) throws IOException {
		try (var stream = Files.newOutputStream(path)) {
			writeImage(img, stream);
		}
	}

	@Override
	public void writeImage(BufferedImage img, OutputStream stream) throws IOException {
		if (!supportsImage(img))
			throw new IOException(getName() + " writer does not support the image type " + img.getType());
		img = prepareImage(img);
		String ext = getDefaultExtension();
		var writers = ImageIO.getImageWritersBySuffix(ext);
		if (!writers.hasNext())
			throw new IOException("Unable to write using ImageIO with extension " + ext);
		var writer = writers.next();
		try (ImageOutputStream ios = ImageIO.createImageOutputStream(stream)) {
			writer.setOutput(ios);
			var param = createWriteParam(writer);
			var metadata = createMetadata(writer, img, param);
			writer.write(null, new IIOImage(img, null, metadata), param);
			ios.flush();
		} finally {
			writer.dispose();
		}
	}

}
