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

package papyri.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {

	@Test
	public void test_fileExtensions() {
		File currentDir = new File(".");
		File noExt = new File("My file");

		assertNull(GeneralTools.getExtension(currentDir).orElse(null));
		assertNull(GeneralTools.getExtension(noExt).orElse(null));

		String baseName = "P.Mich. inv. 1234 recto";
		for (String ext : Arrays.asList(".ext", ".tif", ".ome.tiff", ".tar.gz", ".ome.tif")) {
			File file = new File(baseName + ext);
			assertEquals(ext, GeneralTools.getExtension(file).orElse(null));
			assertEquals(baseName, GeneralTools.getNameWithoutExtension(file));
			assertEquals(baseName, GeneralTools.getNameWithoutExtension(file.getPath()));

			// Case is preserved, since it becomes part of output names
			File fileUpper = new File(baseName + ext.toUpperCase());
			assertEquals(ext.toUpperCase(), GeneralTools.getExtension(fileUpper).orElse(null));
			assertEquals(baseName, GeneralTools.getNameWithoutExtension(fileUpper));
		}

		for (String ext : Arrays.asList(".ext (here)", ".tif-not-valid", ".tif?")) {
			File file = new File(baseName + ext);
			assertNull(GeneralTools.getExtension(file).orElse(null));
		}

		assertEquals(noExt.getPath(), GeneralTools.getNameWithoutExtension(noExt));
	}

	@Test
	public void test_filenameValid() {
		assertTrue(GeneralTools.isValidFilename("enhanced"));
		assertTrue(GeneralTools.isValidFilename("anything.else"));
		assertFalse(GeneralTools.isValidFilename("any<thing"));
		assertFalse(GeneralTools.isValidFilename("any/thing"));
		assertFalse(GeneralTools.isValidFilename("any\\thing"));
		assertFalse(GeneralTools.isValidFilename("any\nthing"));
		assertFalse(GeneralTools.isValidFilename(""));
		assertFalse(GeneralTools.isValidFilename("  "));
		assertFalse(GeneralTools.isValidFilename(null));
	}

	@Test
	public void test_clipValue() {
		assertEquals(0, GeneralTools.clipValue(-5, 0, 255));
		assertEquals(255, GeneralTools.clipValue(300, 0, 255));
		assertEquals(17, GeneralTools.clipValue(17, 0, 255));
		assertEquals(0.0, GeneralTools.clipValue(-0.1, 0.0, 1.0));
		assertEquals(1.0, GeneralTools.clipValue(1.5, 0.0, 1.0));
		assertEquals(0.25, GeneralTools.clipValue(0.25, 0.0, 1.0));
	}

	@Test
	public void test_joinNonBlank() {
		assertEquals("Vividness", GeneralTools.joinNonBlank("Vividness", "", ""));
		assertEquals("Vividness Negative Masked", GeneralTools.joinNonBlank("Vividness", "Negative", "Masked"));
		assertEquals("LSV Masked", GeneralTools.joinNonBlank("LSV", null, " Masked "));
		assertEquals("", GeneralTools.joinNonBlank("", " "));
	}

	@Test
	public void test_pluralSuffix() {
		assertEquals("", GeneralTools.pluralSuffix(1));
		assertEquals("s", GeneralTools.pluralSuffix(0));
		assertEquals("s", GeneralTools.pluralSuffix(2));
	}

}
