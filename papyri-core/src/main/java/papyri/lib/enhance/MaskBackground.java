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
 * Background polarity used when segmenting the background.
 *
 * @author Papyri developers
 */
public enum MaskBackground {

	/**
	 * Light background (e.g. papyri photographed on white).
	 */
	LIGHT("lightBackground"),

	/**
	 * Dark background.
	 */
	DARK("darkBackground");

	private final String fileLabel;

	MaskBackground(String fileLabel) {
		this.fileLabel = fileLabel;
	}

	/**
	 * Label used within output file names.
	 * @return
	 */
	public String getFileLabel() {
		return fileLabel;
	}

}
