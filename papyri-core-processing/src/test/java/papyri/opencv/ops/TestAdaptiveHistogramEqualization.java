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

package papyri.opencv.ops;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings("javadoc")
public class TestAdaptiveHistogramEqualization {

	@ParameterizedTest
	@CsvSource({
		"64, 8, 0, 0",
		"40, 8, 4, 4",
		"60, 8, 2, 2",
		"10, 8, 3, 3",
		"4, 8, 6, 6"
	})
	public void test_padding(int length, int nTiles, int before, int after) {
		int[] padding = AdaptiveHistogramEqualization.padding(length, nTiles);
		assertArrayEquals(new int[] {before, after}, padding);
		int padded = length + padding[0] + padding[1];
		assertEquals(0, padded % nTiles);
		assertEquals(0, (padded / nTiles) % 2);
	}

	@Test
	public void test_reflect() {
		assertEquals(0, AdaptiveHistogramEqualization.reflect(-1, 5));
		assertEquals(1, AdaptiveHistogramEqualization.reflect(-2, 5));
		assertEquals(4, AdaptiveHistogramEqualization.reflect(5, 5));
		assertEquals(3, AdaptiveHistogramEqualization.reflect(6, 5));
		assertEquals(2, AdaptiveHistogramEqualization.reflect(2, 5));
		assertEquals(0, AdaptiveHistogramEqualization.reflect(7, 1));
		// Reflection may need to repeat for small images
		assertEquals(0, AdaptiveHistogramEqualization.reflect(-7, 3));
		assertEquals(2, AdaptiveHistogramEqualization.reflect(-4, 3));
	}

	@Test
	public void test_clipHistogram() {
		int[] hist = new int[256];
		hist[0] = 1000;
		AdaptiveHistogramEqualization.clipHistogram(hist, 10);
		assertEquals(1000, Arrays.stream(hist).sum());
		assertTrue(Arrays.stream(hist).allMatch(h -> h <= 10));
		assertEquals(10, hist[0]);
	}

	@Test
	public void test_clipHistogramRandom() {
		var rand = new Random(1L);
		int[] hist = new int[64];
		for (int i = 0; i < 2000; i++)
			hist[(int)Math.min(63, Math.abs(rand.nextGaussian() * 8))]++;
		AdaptiveHistogramEqualization.clipHistogram(hist, 50);
		assertEquals(2000, Arrays.stream(hist).sum());
		assertTrue(Arrays.stream(hist).allMatch(h -> h <= 50));
	}

	@Test
	public void test_rayleighMapping() {
		int[] hist = new int[16];
		Arrays.fill(hist, 4);
		double[] mapping = AdaptiveHistogramEqualization.rayleighMapping(hist, 64, 0.4);
		for (int i = 1; i < mapping.length; i++)
			assertTrue(mapping[i] > mapping[i - 1]);
		assertTrue(mapping[0] > 0);
		assertEquals(1.0, mapping[mapping.length - 1], 1e-9);
	}

	@Test
	public void test_constantImage() {
		var clahe = AdaptiveHistogramEqualization.createDefault();
		float[] pixels = new float[40 * 30];
		Arrays.fill(pixels, 0.5f);
		float[] result = clahe.apply(pixels, 40, 30);
		// Every tile has the same mapping
		assertTrue(result[0] > 0 && result[0] <= 1);
		for (float v : result)
			assertEquals(result[0], v, 1e-6);
	}

	@Test
	public void test_ramp() {
		var clahe = AdaptiveHistogramEqualization.createDefault();
		int width = 64;
		int height = 16;
		float[] pixels = new float[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				pixels[y * width + x] = x / (float)(width - 1);
		}
		float[] result = clahe.apply(pixels, width, height);
		for (float v : result)
			assertTrue(v >= 0 && v <= 1);
		// A horizontal ramp is equalized identically on every row
		for (int x = 0; x < width; x++)
			assertEquals(result[x], result[(height - 1) * width + x], 1e-6);
		assertTrue(result[width - 1] > result[0]);
	}

	@Test
	public void test_invalidParameters() {
		assertThrows(IllegalArgumentException.class, () -> new AdaptiveHistogramEqualization(1, 8, 0.01, 256, 0.4));
		assertThrows(IllegalArgumentException.class, () -> new AdaptiveHistogramEqualization(8, 8, 2, 256, 0.4));
		assertThrows(IllegalArgumentException.class, () -> new AdaptiveHistogramEqualization(8, 8, 0.01, 1, 0.4));
		assertThrows(IllegalArgumentException.class, () -> new AdaptiveHistogramEqualization(8, 8, 0.01, 256, 0));
	}

}
