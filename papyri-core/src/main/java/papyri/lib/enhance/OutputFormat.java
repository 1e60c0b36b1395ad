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

package papyri.lib.enhance;

/**
 * Supported output file formats.
 *
 * @author Papyri developers
 */
public enum OutputFormat {

	/**
	 * TIFF, written losslessly.
	 */
	TIFF("tif"),

	/**
	 * JPEG, written with a configurable quality.
	 */
	JPEG("jpg");

	private final String extension;

	OutputFormat(String extension) {
		this.extension = extension;
	}

	/**
	 * Default file extension, without the leading dot.
	 * @return
	 */
	public String getExtension() {
		return extension;
	}

}
