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

package papyri.lib.images.writers;

import java.nio.file.Path;
import java.util.Objects;

import papyri.lib.common.GeneralTools;
import papyri.lib.enhance.MaskParameters;
import papyri.lib.labels.MethodLabel;

/**
 * Output file names for one input image.
 * <p>
 * Names take the form {@code <base>_<ext>[-red]-<method>[-masked-<background>][-deshadowed]}, where the
 * extension of the input keeps its case and omits the dot.
 *
 * @author Papyri developers
 */
public class OutputNaming {

	private final Path directory;
	private final String prefix;
	private final MaskParameters maskParameters;

	private OutputNaming(Path directory, String prefix, MaskParameters maskParameters) {
		this.directory = directory;
		this.prefix = prefix;
		this.maskParameters = maskParameters;
	}

	/**
	 * Create the naming for an input file.
	 * @param input the input image
	 * @param directory output directory
	 * @param redChannel true if only the red channel of the input was processed
	 * @param maskParameters parameters used for masked variants; may be null if masking is not used
	 * @return
	 */
	public static OutputNaming forImage(Path input, Path directory, boolean redChannel, MaskParameters maskParameters) {
		String name = input.getFileName().toString();
		String base = GeneralTools.getNameWithoutExtension(name);
		var ext = GeneralTools.getExtension(name).map(e -> e.substring(1)).orElse("");
		String prefix = ext.isEmpty() ? base : base + "_" + ext;
		if (redChannel)
			prefix += "-red";
		return new OutputNaming(Objects.requireNonNull(directory), prefix, maskParameters);
	}

	/**
	 * Output directory.
	 * @return
	 */
	public Path getDirectory() {
		return directory;
	}

	/**
	 * Prefix shared by all outputs for the image.
	 * @return
	 */
	public String getPrefix() {
		return prefix;
	}

	/**
	 * Get the output path, without extension, for a variant.
	 * @param label
	 * @return
	 */
	public Path variantBase(MethodLabel label) {
		var sb = new StringBuilder(prefix)
				.append("-")
				.append(label.getFileLabel());
		if (label.isMasked())
			sb.append(maskSuffix("-masked-"));
		return directory.resolve(sb.toString());
	}

	/**
	 * Get the output path for the mask PNG.
	 * @return
	 * @throws IllegalStateException if no mask parameters are available
	 */
	public Path maskFile() throws IllegalStateException {
		return directory.resolve(prefix + maskSuffix("-mask-") + ".png");
	}

	private String maskSuffix(String marker) {
		if (maskParameters == null)
			throw new IllegalStateException("No mask parameters available");
		String suffix = marker + maskParameters.getBackground().getFileLabel();
		if (maskParameters.doDeshadow())
			suffix += "-deshadowed";
		return suffix;
	}

}
