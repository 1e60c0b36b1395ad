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

package papyri.imagej.tools;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.bytedeco.opencv.global.opencv_core;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ShortProcessor;
import papyri.opencv.tools.OpenCVTools;

@SuppressWarnings("javadoc")
public class TestImageReaders {

	@TempDir
	Path dir;

	@Test
	public void test_readRgbPng() throws IOException {
		var img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
		img.setRGB(0, 0, (200 << 16) | (100 << 8) | 50);
		img.setRGB(1, 0, 0xFFFFFF);
		var path = dir.resolve("rgb.png");
		ImageIO.write(img, "png", path.toFile());

		var mat = ImageReaders.readMat(path);
		assertEquals(opencv_core.CV_8UC3, mat.type());
		assertArrayEquals(new byte[] {(byte)200, 100, 50, (byte)255, (byte)255, (byte)255}, OpenCVTools.extractBytes(mat));
		mat.close();
	}

	@Test
	public void test_readGrayPng() throws IOException {
		var img = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
		img.getRaster().setSample(2, 1, 0, 77);
		var path = dir.resolve("gray.png");
		ImageIO.write(img, "png", path.toFile());

		var mat = ImageReaders.readMat(path);
		assertEquals(opencv_core.CV_8UC1, mat.type());
		assertEquals(77, OpenCVTools.extractBytes(mat)[5] & 0xFF);
		mat.close();
	}

	@Test
	public void test_unreadable() throws IOException {
		var garbage = dir.resolve("garbage.png");
		Files.write(garbage, new byte[] {1, 2, 3, 4, 5});
		assertThrows(IOException.class, () -> ImageReaders.readMat(garbage));
		assertThrows(IOException.class, () -> ImageReaders.readMat(dir.resolve("missing.png")));
		assertThrows(IOException.class, () -> ImageReaders.readMat(dir));
	}

	@Test
	public void test_supportsImageJ() {
		assertTrue(ImageReaders.supportsImageJ(Path.of("image.TIF")));
		assertTrue(ImageReaders.supportsImageJ(Path.of("image.pgm")));
		assertFalse(ImageReaders.supportsImageJ(Path.of("image.png")));
		assertFalse(ImageReaders.supportsImageJ(Path.of("image")));
	}

	@Test
	public void test_16bitScaled() {
		var ip = new ShortProcessor(2, 1, new short[] {0, 1000}, null);
		var mat = ImageReaders.imagePlusToMat(new ImagePlus("16-bit", ip));
		assertEquals(opencv_core.CV_8UC1, mat.type());
		assertArrayEquals(new byte[] {0, (byte)255}, OpenCVTools.extractBytes(mat));
		mat.close();
	}

	@Test
	public void test_stackPlanesAsChannels() {
		var stack = new ImageStack(2, 1);
		stack.addSlice(new ByteProcessor(2, 1, new byte[] {10, 11}));
		stack.addSlice(new ByteProcessor(2, 1, new byte[] {20, 21}));
		stack.addSlice(new ByteProcessor(2, 1, new byte[] {30, 31}));
		var mat = ImageReaders.imagePlusToMat(new ImagePlus("stack", stack));
		assertEquals(opencv_core.CV_8UC3, mat.type());
		assertArrayEquals(new byte[] {10, 20, 30, 11, 21, 31}, OpenCVTools.extractBytes(mat));
		mat.close();
	}

	@Test
	public void test_readTiffStack() throws IOException {
		var stack = new ImageStack(2, 2);
		stack.addSlice(new ByteProcessor(2, 2, new byte[] {1, 2, 3, 4}));
		stack.addSlice(new ByteProcessor(2, 2, new byte[] {5, 6, 7, 8}));
		var path = dir.resolve("stack.tif");
		assertTrue(new FileSaver(new ImagePlus("stack", stack)).saveAsTiff(path.toString()));

		var mat = ImageReaders.readMat(path);
		assertEquals(2, mat.channels());
		assertArrayEquals(new byte[] {1, 5, 2, 6, 3, 7, 4, 8}, OpenCVTools.extractBytes(mat));
		mat.close();
	}

}
