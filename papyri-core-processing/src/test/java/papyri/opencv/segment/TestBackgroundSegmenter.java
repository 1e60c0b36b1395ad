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

package papyri.opencv.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import papyri.lib.enhance.MaskBackground;
import papyri.lib.enhance.MaskParameters;
import papyri.opencv.color.ColorSpaces;
import papyri.opencv.tools.OpenCVTools;
import papyri.opencv.tools.SyntheticImages;

@SuppressWarnings("javadoc")
public class TestBackgroundSegmenter {

	private static final int SIZE = 64;

	private static BackgroundMask segmentLines(MaskBackground background) {
		var params = MaskParameters.builder().background(background).build();
		var field = ColorSpaces.toFloat(SyntheticImages.linesMat(SIZE, SIZE));
		return new BackgroundSegmenter(params).segment(field, null);
	}

	@Test
	public void test_linesAreForeground() {
		try (var scope = new PointerScope()) {
			var mask = segmentLines(MaskBackground.LIGHT);
			assertEquals(SIZE, mask.getWidth());
			assertEquals(SIZE, mask.getHeight());

			// Flat region, away from the lines, is background
			for (int y = 0; y < SIZE; y++) {
				for (int x = SIZE * 3 / 4; x < SIZE; x++)
					assertTrue(mask.isBackground(x, y), "Expected background at " + x + ", " + y);
			}

			// Most line pixels are foreground
			int lineCount = 0;
			int foregroundCount = 0;
			for (int y = 0; y < SIZE; y++) {
				for (int x = 0; x < SIZE / 2; x += 4) {
					lineCount++;
					if (!mask.isBackground(x, y))
						foregroundCount++;
				}
			}
			assertTrue(foregroundCount >= lineCount * 0.9, "Only " + foregroundCount + "/" + lineCount + " line pixels are foreground");

			double fraction = mask.backgroundFraction();
			assertTrue(fraction > 0.5 && fraction < 1.0, "Unexpected background fraction " + fraction);
		}
	}

	/**
	 * RGB version of {@link SyntheticImages#linesMat(int, int)}, with one color for the lines and another elsewhere.
	 */
	private static Mat coloredLines(int[] line, int[] background) {
		byte[] pixels = new byte[SIZE * SIZE * 3];
		byte[] lines = OpenCVTools.extractBytes(SyntheticImages.linesMat(SIZE, SIZE));
		for (int i = 0; i < lines.length; i++) {
			int[] color = lines[i] == 0 ? line : background;
			for (int c = 0; c < 3; c++)
				pixels[i * 3 + c] = (byte)color[c];
		}
		return SyntheticImages.createMat(SIZE, SIZE, 3, pixels);
	}

	private static BackgroundMask segmentColor(Mat rgb, boolean deshadow) {
		var params = MaskParameters.builder().deshadow(deshadow).build();
		var lightness = ColorSpaces.normalizedLightness(ColorSpaces.rgbToLab(rgb));
		return new BackgroundSegmenter(params).segment(lightness, rgb);
	}

	@Test
	public void test_deshadowKeepsBinaryPolarity() {
		try (var scope = new PointerScope()) {
			// Ink and papyrus differ in both lightness and chromaticity
			var rgb = coloredLines(new int[] {40, 60, 120}, new int[] {200, 180, 150});
			var plain = segmentColor(rgb, false);
			var deshadowed = segmentColor(rgb, true);

			assertTrue(plain.isBackground(SIZE - 1, SIZE / 2));
			assertFalse(plain.isBackground(8, SIZE / 2));
			// Without shadow removal the binarized response is inverted, with it the response is used directly
			assertFalse(deshadowed.isBackground(SIZE - 1, SIZE / 2));
			assertTrue(deshadowed.isBackground(8, SIZE / 2));

			int complementary = 0;
			for (int y = 0; y < SIZE; y++) {
				for (int x = 0; x < SIZE; x++) {
					if (plain.isBackground(x, y) != deshadowed.isBackground(x, y))
						complementary++;
				}
			}
			assertTrue(complementary >= SIZE * SIZE * 0.99, "Masks agree at " + (SIZE * SIZE - complementary) + " pixels");
		}
	}

	@Test
	public void test_deshadowIgnoresShading() {
		try (var scope = new PointerScope()) {
			// Lines differ from their surroundings in intensity only
			var rgb = coloredLines(new int[] {100, 50, 20}, new int[] {200, 100, 40});
			var plain = segmentColor(rgb, false);
			double plainFraction = plain.backgroundFraction();
			assertTrue(plainFraction > 0.5 && plainFraction < 1.0, "Unexpected background fraction " + plainFraction);
			assertFalse(plain.isBackground(8, SIZE / 2));

			// The shadow-invariant lightness is flat, so there is no response anywhere
			var deshadowed = segmentColor(rgb, true);
			assertEquals(0.0, deshadowed.backgroundFraction(), 1e-12);
		}
	}

	@Test
	public void test_deshadowedLightnessIgnoresIntensity() {
		try (var scope = new PointerScope()) {
			// The same color at two intensities, plus a different color to define the range
			var rgb = SyntheticImages.createMat(3, 1, 3, new byte[] {
					100, 50, 20,
					(byte)200, 100, 40,
					50, 100, (byte)200});
			float[] lightness = OpenCVTools.extractFloats(BackgroundSegmenter.deshadowedLightness(rgb));
			assertEquals(lightness[0], lightness[1], 1e-3);
			assertEquals(1.0, Math.abs(lightness[0] - lightness[2]), 1e-6);
		}
	}

	@Test
	public void test_backgroundMask() {
		try (var scope = new PointerScope()) {
			var mat = SyntheticImages.createMat(2, 2, 1, new byte[] {0, 1, 5, 0});
			var mask = BackgroundMask.fromMat(mat);
			assertFalse(mask.isBackground(0, 0));
			assertTrue(mask.isBackground(1, 0));
			assertTrue(mask.isBackground(0, 1));
			assertEquals(0.5, mask.backgroundFraction(), 1e-12);

			// Nonzero values are normalized to 1
			byte[] bytes = OpenCVTools.extractBytes(mask.getMat());
			assertEquals(1, bytes[2]);

			var inverted = mask.invert();
			assertTrue(inverted.isBackground(0, 0));
			assertFalse(inverted.isBackground(1, 0));

			BufferedImage img = mask.toBinaryImage();
			assertEquals(BufferedImage.TYPE_BYTE_GRAY, img.getType());
			assertEquals(0, img.getRaster().getSample(0, 0, 0));
			assertEquals(255, img.getRaster().getSample(1, 0, 0));
		}
	}

}
