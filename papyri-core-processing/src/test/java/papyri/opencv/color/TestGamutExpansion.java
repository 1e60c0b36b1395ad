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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.nio.file.Path;

import org.bytedeco.javacpp.PointerScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import papyri.opencv.tools.OpenCVTools;
import papyri.opencv.tools.SyntheticImages;

@SuppressWarnings("javadoc")
public class TestGamutExpansion {

	@Test
	public void test_identity() {
		var expansion = GamutExpansion.create(IccProfiles.getSRGB(), IccProfiles.getSRGB());
		assertTrue(expansion.isEnabled());
		assertFalse(expansion.getWarning().isPresent());
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.randomMat(16, 16, 3, 20L);
			var result = expansion.apply(rgb);
			byte[] expected = OpenCVTools.extractBytes(rgb);
			byte[] actual = OpenCVTools.extractBytes(result);
			for (int i = 0; i < expected.length; i++)
				assertEquals(expected[i] & 0xff, actual[i] & 0xff, 2.0);
		}
	}

	@Test
	public void test_linearToSRGB() {
		var expansion = GamutExpansion.create(ICC_Profile.getInstance(ColorSpace.CS_LINEAR_RGB), IccProfiles.getSRGB());
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.constantMat(4, 4, 128, 128, 128);
			var result = expansion.apply(rgb);
			for (byte b : OpenCVTools.extractBytes(result))
				assertTrue((b & 0xff) > 170);
		}
	}

	@Test
	public void test_adobeIncreasesSaturation() {
		var expansion = GamutExpansion.load(null);
		assertTrue(expansion.isEnabled());
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.constantMat(2, 2, 120, 160, 120);
			byte[] result = OpenCVTools.extractBytes(expansion.apply(rgb));
			int diff = (result[1] & 0xff) - (result[0] & 0xff);
			assertTrue(diff > 40, "Expected green-red difference > 40, but was " + diff);
		}
	}

	@Test
	public void test_disabled(@TempDir Path dir) {
		var expansion = GamutExpansion.load(dir.resolve("missing.icc"));
		assertFalse(expansion.isEnabled());
		assertEquals("Unable to load ICC color profiles, gamut expansion skipped", expansion.getWarning().orElse(null));
		try (var scope = new PointerScope()) {
			var rgb = SyntheticImages.randomMat(8, 8, 3, 21L);
			var result = expansion.apply(rgb);
			assertArrayEquals(OpenCVTools.extractBytes(rgb), OpenCVTools.extractBytes(result));
		}
	}

	@Test
	public void test_requiresRGB() {
		var expansion = GamutExpansion.disabled("Disabled");
		try (var scope = new PointerScope()) {
			var gray = SyntheticImages.constantMat(2, 2, 10);
			assertThrows(IllegalArgumentException.class, () -> expansion.apply(gray));
		}
	}

}
