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

package papyri.opencv.classify;

/**
 * Classification of an input image.
 *
 * @author Papyri developers
 */
public enum ImageClass {

	/**
	 * Color image with three distinct channels (possibly after padding a two-channel image).
	 */
	COLOR,

	/**
	 * Single-channel input.
	 */
	GRAYSCALE,

	/**
	 * Three identical channels collapsed to one.
	 */
	GRAYSCALE_FROM_IDENTICAL_CHANNELS,

	/**
	 * Color image reduced to its red channel on request.
	 */
	GRAYSCALE_FROM_RED_CHANNEL;

	/**
	 * Returns true for all grayscale classes.
	 * @return
	 */
	public boolean isGrayscale() {
		return this != COLOR;
	}

}
