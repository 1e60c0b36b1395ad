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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;
import javax.imageio.plugins.tiff.TIFFDirectory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import papyri.opencv.color.IccProfiles;
import papyri.opencv.tools.SyntheticImages;

@SuppressWarnings("javadoc")
public class TestImageWriters {

	@TempDir
	Path dir;

	private static byte[] toBytes(ImageWriter writer, BufferedImage img) throws IOException {
		var stream = new ByteArrayOutputStream();
		writer.writeImage(img, stream);
		return stream.toByteArray();
	}

	@Test
	public void test_extensions() {
		assertEquals("jpg", new JpegWriter(75).getDefaultExtension());
		assertEquals("png", new PngWriter().getDefaultExtension());
		assertEquals("tif", new TiffWriter().getDefaultExtension());
		assertTrue(new TiffWriter().getExtensions().contains("tiff"));
		assertTrue(new JpegWriter(75).getExtensions().contains("jpeg"));
	}

	@Test
	public void test_supportsImage() {
		var writer = new PngWriter();
		assertTrue(writer.supportsImage(new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY)));
		assertTrue(writer.supportsImage(new BufferedImage(2, 2, BufferedImage.TYPE_3BYTE_BGR)));
		assertFalse(writer.supportsImage(new BufferedImage(2, 2, BufferedImage.TYPE_USHORT_GRAY)));
	}

	@Test
	public void test_jpegQuality() throws IOException {
		assertThrows(IllegalArgumentException.class, () -> new JpegWriter(-1));
		assertThrows(IllegalArgumentException.class, () -> new JpegWriter(101));

		var img = SyntheticImages.papyrusImage(64, 64, 3L);
		byte[] low = toBytes(new JpegWriter(10), img);
		byte[] high = toBytes(new JpegWriter(95), img);
		assertTrue(low.length < high.length);

		var path = dir.resolve("papyrus.jpg");
		new JpegWriter(75).writeImage(img, path);
		var read = ImageIO.read(path.toFile());
		assertEquals(64, read.getWidth());
		assertEquals(64, read.getHeight());
	}

	@Test
	public void test_jpegWithAlpha() throws IOException {
		var img = new BufferedImage(8, 8, BufferedImage.TYPE_INT_ARGB);
		var path = dir.resolve("alpha.jpg");
		new JpegWriter(75).writeImage(img, path);
		assertEquals(3, ImageIO.read(path.toFile()).getRaster().getNumBands());
	}

	@Test
	public void test_pngIsLossless() throws IOException {
		var img = SyntheticImages.papyrusImage(16, 8, 4L);
		var path = dir.resolve("papyrus.png");
		new PngWriter().writeImage(img, path);
		var read = ImageIO.read(path.toFile());
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++)
				assertEquals(img.getRGB(x, y), read.getRGB(x, y));
		}
	}

	@Test
	public void test_tiffProfile() throws IOException {
		var profile = IccProfiles.getSRGB();
		var img = SyntheticImages.papyrusImage(16, 16, 5L);

		var withProfile = dir.resolve("profile.tif");
		new TiffWriter(profile).writeImage(img, withProfile);
		var field = readTiffField(withProfile, TiffWriter.TAG_ICC_PROFILE);
		assertNotNull(field);
		assertArrayEquals(profile.getData(), field);

		var withoutProfile = dir.resolve("no-profile.tif");
		new TiffWriter().writeImage(img, withoutProfile);
		assertNull(readTiffField(withoutProfile, TiffWriter.TAG_ICC_PROFILE));

		var gray = dir.resolve("gray.tif");
		new TiffWriter(profile).writeImage(new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_GRAY), gray);
		assertNull(readTiffField(gray, TiffWriter.TAG_ICC_PROFILE));
	}

	private static byte[] readTiffField(Path path, int tag) throws IOException {
		try (var stream = ImageIO.createImageInputStream(Files.newInputStream(path))) {
			var reader = ImageIO.getImageReadersBySuffix("tif").next();
			try {
				reader.setInput(stream);
				var metadata = reader.getImageMetadata(0);
				var field = TIFFDirectory.createFromMetadata(metadata).getTIFFField(tag);
				if (field == null)
					return null;
				byte[] bytes = new byte[field.getCount()];
				for (int i = 0; i < bytes.length; i++)
					bytes[i] = (byte)field.getAsInt(i);
				return bytes;
			} finally {
				reader.dispose();
			}
		}
	}

}
