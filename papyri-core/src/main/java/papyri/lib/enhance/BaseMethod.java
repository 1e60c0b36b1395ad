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
 * Base enhancement methods, in the order in which they are applied.
 *
 * @author Papyri developers
 */
public enum BaseMethod {

	/**
	 * Lightness replaced by the Euclidean norm of the CIELAB triple.
	 */
	VIVIDNESS("Vividness", "vividness", false),

	/**
	 * Lightness blended with a saturation/value contrast measure.
	 */
	LSV("LSV", "lsv", false),

	/**
	 * Contrast-limited adaptive histogram equalization with a Rayleigh target distribution.
	 */
	ADAPTHISTEQ("Adapthisteq", "adapthisteq", true),

	/**
	 * Retinex, provided by an external {@code RetinexProvider}.
	 */
	RETINEX("Retinex", "retinex", true);

	private final String label;
	private final String fileLabel;
	private final boolean supportsGrayscale;

	BaseMethod(String label, String fileLabel, boolean supportsGrayscale) {
		this.label = label;
		this.fileLabel = fileLabel;
		this.supportsGrayscale = supportsGrayscale;
	}

	/**
	 * Label used for display.
	 * @return
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Label used within output file names.
	 * @return
	 */
	public String getFileLabel() {
		return fileLabel;
	}

	/**
	 * Returns true if the method can be applied to grayscale images.
	 * @return
	 */
	public boolean supportsGrayscale() {
		return supportsGrayscale;
	}

	@Override
	public String toString() {
		return label;
	}

}
