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

import papyri.lib.enhance.Postprocessing;

/**
 * Postprocessing directives passed to a {@link RetinexProvider}.
 *
 * @author Papyri developers
 */
public enum RetinexPostprocessing {

	/**
	 * Return the retinex output unchanged.
	 */
	NONE,

	/**
	 * Return the negative of the output.
	 */
	NEGATIVE,

	/**
	 * Return the negative of the output, with complementary hue.
	 */
	NEGATIVE_COMPLEMENT_HUE;

	/**
	 * Get the directive corresponding to a postprocessing option.
	 * @param postprocessing
	 * @return
	 */
	public static RetinexPostprocessing of(Postprocessing postprocessing) {
		switch (postprocessing) {
		case NEGATIVE:
			return NEGATIVE;
		case BLUE_NEGATIVE:
			return NEGATIVE_COMPLEMENT_HUE;
		case NONE:
		default:
			return NONE;
		}
	}

}
