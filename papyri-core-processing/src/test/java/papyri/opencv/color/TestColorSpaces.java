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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import papyri.opencv.tools.OpenCVTools;
import papyri.opencv.tools.SyntheticImages;

@SuppressWarnings("javadoc")
public class TestColorSpaces {

	@Test
	public void test_labRoundTrip() {
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.randomMat(32, 32, 3, 10L);
			var lab = ColorSpaces.rgbToLab(rgb);
			assertEquals(32, lab.getWidth());
			assertEquals(32, lab.getHeight());
			var lightness = new Mat();
			lab.getL().convertTo(lightness, opencv_core.CV_32F, 0.01, 0.0);
			var rgb2 = ColorSpaces.labToRgb(lightness, lab.getA(), lab.getB());
			byte[] expected = OpenCVTools.extractBytes(rgb);
			byte[] actual = OpenCVTools.extractBytes(rgb2);
			assertEquals(expected.length, actual.length);
			for (int i = 0; i < expected.length; i++)
				assertEquals(expected[i] & 0xff, actual[i] & 0xff, 1.0);
		}
	}

	@Test
	public void test_labWhite() {
		try (var scope = new PointerScope()) {
			var lab = ColorSpaces.rgbToLab(SyntheticImages.constantMat(2, 2, 255, 255, 255));
			for (float v : OpenCVTools.extractFloats(lab.getL()))
				assertEquals(100.0, v, 0.1);
			for (float v : OpenCVTools.extractFloats(lab.getA()))
				assertEquals(0.0, v, 0.1);
			for (float v : OpenCVTools.extractFloats(lab.getB()))
				assertEquals(0.0, v, 0.1);
		}
	}

	@Test
	public void test_rgbToLabRequiresRGB() {
		try (var scope = new PointerScope()) {
			var gray = SyntheticImages.constantMat(2, 2, 100);
			assertThrows(IllegalArgumentException.class, () -> ColorSpaces.rgbToLab(gray));
		}
	}

	@Test
	public void test_negateTwice() {
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.randomMat(16, 16, 3, 11L);
			var lightness = ColorSpaces.normalizedLightness(ColorSpaces.rgbToLab(rgb));
			var twice = ColorSpaces.negate(ColorSpaces.negate(lightness));
			float[] expected = OpenCVTools.extractFloats(lightness);
			float[] actual = OpenCVTools.extractFloats(twice);
			for (int i = 0; i < expected.length; i++)
				assertEquals(expected[i], actual[i], 1e-6);
		}
	}

	@Test
	public void test_negate() {
		try (var scope = new PointerScope()) {
			var field = OpenCVTools.createFloatMat(3, 1, new float[] {0f, 0.25f, 1f});
			assertArrayEquals(new float[] {1f, 0.75f, 0f}, OpenCVTools.extractFloats(ColorSpaces.negate(field)), 1e-6f);
			assertArrayEquals(new float[] {-0f, -0.25f, -1f}, OpenCVTools.extractFloats(ColorSpaces.negateChroma(field)), 1e-6f);
		}
	}

	@Test
	public void test_normalizedLightness() {
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.papyrusMat(20, 20, 12L);
			var lightness = OpenCVTools.extractFloats(ColorSpaces.normalizedLightness(ColorSpaces.rgbToLab(rgb)));
			double min = Double.POSITIVE_INFINITY;
			double max = Double.NEGATIVE_INFINITY;
			for (float v : lightness) {
				min = Math.min(min, v);
				max = Math.max(max, v);
			}
			assertEquals(0.0, min, 1e-6);
			assertEquals(1.0, max, 1e-6);
		}
	}

	@Test
	public void test_rescale() {
		try (var scope = new PointerScope()) {
			var field = OpenCVTools.createFloatMat(4, 1, new float[] {0f, 5f, 10f, 100f});
			assertArrayEquals(new float[] {0f, 0.05f, 0.1f, 1f}, OpenCVTools.extractFloats(ColorSpaces.rescale(field, null)), 1e-6f);

			var excluded = SyntheticImages.createMat(4, 1, 1, new byte[] {0, 0, 0, 1});
			assertArrayEquals(new float[] {0f, 0.5f, 1f, 10f}, OpenCVTools.extractFloats(ColorSpaces.rescale(field, excluded)), 1e-6f);

			var constant = OpenCVTools.createFloatMat(2, 1, new float[] {3f, 3f});
			assertArrayEquals(new float[] {0f, 0f}, OpenCVTools.extractFloats(ColorSpaces.rescale(constant, null)));

			var withNaN = OpenCVTools.createFloatMat(3, 1, new float[] {2f, Float.NaN, 4f});
			var rescaled = OpenCVTools.extractFloats(ColorSpaces.rescale(withNaN, null));
			assertEquals(0f, rescaled[0]);
			assertTrue(Float.isNaN(rescaled[1]));
			assertEquals(1f, rescaled[2]);
		}
	}

	@Test
	public void test_quantize() {
		try (var scope = new PointerScope()) {
			var field = OpenCVTools.createFloatMat(5, 1, new float[] {-0.5f, 0f, 0.5f, 1.5f, Float.NaN});
			var quantized = ColorSpaces.quantize(field);
			assertEquals(opencv_core.CV_8UC1, quantized.type());
			byte[] bytes = OpenCVTools.extractBytes(quantized);
			assertEquals(0, bytes[0] & 0xff);
			assertEquals(0, bytes[1] & 0xff);
			assertEquals(128, bytes[2] & 0xff);
			assertEquals(255, bytes[3] & 0xff);
			assertEquals(0, bytes[4] & 0xff);
		}
	}

	@Test
	public void test_hsv() {
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.createMat(3, 1, 3, new byte[] {
					(byte)255, 0, 0,
					0, (byte)255, 0,
					(byte)128, (byte)128, (byte)128});
			var hsv = ColorSpaces.rgbToHsv(rgb);
			assertEquals(3, hsv.size());
			float[] h = OpenCVTools.extractFloats(hsv.get(0));
			float[] s = OpenCVTools.extractFloats(hsv.get(1));
			float[] v = OpenCVTools.extractFloats(hsv.get(2));
			assertEquals(0.0, h[0], 1e-4);
			assertEquals(1.0 / 3.0, h[1], 1e-4);
			assertEquals(1.0, s[0], 1e-6);
			assertEquals(0.0, s[2], 1e-6);
			assertEquals(1.0, v[1], 1e-6);
			assertEquals(128 / 255.0, v[2], 1e-6);
		}
	}

}
