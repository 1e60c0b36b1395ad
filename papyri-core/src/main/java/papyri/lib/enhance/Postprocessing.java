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
 * Postprocessing applied to the primary result of a base method.
 *
 * @author Papyri developers
 */
public enum Postprocessing {

	/**
	 * Primary result, unchanged.
	 */
	NONE("", ""),

	/**
	 * Negative lightness.
	 */
	NEGATIVE("Negative", "neg"),

	/**
	 * Negative lightness, with both chromatic planes negated (color images only).
	 */
	BLUE_NEGATIVE("Blue Negative", "neg-blue");

	private final String label;
	private final String fileLabel;

	Postprocessing(String label, String fileLabel) {
		this.label = label;
		this.fileLabel = fileLabel;
	}

	/**
	 * Suffix used for display labels; empty for {@link #NONE}.
	 * @return
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Suffix used within output file names; empty for {@link #NONE}.
	 * @return
	 */
	public String getFileLabel() {
		return fileLabel;
	}

	/**
	 * Returns true if the postprocessing can be applied to grayscale images.
	 * @return
	 */
	public boolean supportsGrayscale() {
		return this != BLUE_NEGATIVE;
	}

}
