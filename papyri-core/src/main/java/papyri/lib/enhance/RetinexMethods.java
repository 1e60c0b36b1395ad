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

import java.util.List;

/**
 * Names of the retinex methods that may be requested.
 *
 * @author Papyri developers
 */
public final class RetinexMethods {

	/**
	 * Multiscale retinex with color restoration, in RGB.
	 */
	public static final String MSRCR_RGB = "MSRCR-RGB";

	/**
	 * Multiscale retinex on the value channel of HSV.
	 */
	public static final String MSR_V = "MSR-V";

	/**
	 * Multiscale retinex applied to all channels of a grayscale image.
	 */
	public static final String MSR_A = "MSR-A";

	private static final List<String> COLOR_METHODS = List.of(
			MSRCR_RGB, "MSR-VAB", "MSR-LAB", MSR_V, "MSR-L", "MSRCP-I", "MSRCP-V", "MSRCP-L"
			);

	private static final List<String> DEFAULT_METHODS = List.of(MSRCR_RGB, MSR_V);

	private RetinexMethods() {
		throw new AssertionError();
	}

	/**
	 * All retinex methods that can be requested for color images, in display order.
	 * @return
	 */
	public static List<String> getColorMethods() {
		return COLOR_METHODS;
	}

	/**
	 * Retinex methods requested by default.
	 * @return
	 */
	public static List<String> getDefaultMethods() {
		return DEFAULT_METHODS;
	}

	/**
	 * The single method used for grayscale images.
	 * @return
	 */
	public static String getGrayscaleMethod() {
		return MSR_A;
	}

	/**
	 * Returns true if the name is a known color retinex method.
	 * @param name
	 * @return
	 */
	public static boolean isColorMethod(String name) {
		return COLOR_METHODS.contains(name);
	}

}
