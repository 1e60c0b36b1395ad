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

import java.awt.color.ICC_Profile;
import java.nio.file.Path;

/**
 * Embed an ICC profile into an image file that has already been written.
 *
 * @author Papyri developers
 */
@FunctionalInterface
public interface IccProfileEmbedder {

	/**
	 * Embedder that never embeds anything.
	 * @return
	 */
	static IccProfileEmbedder none() {
		return (path, profile) -> false;
	}

	/**
	 * Embed a profile into a file.
	 * @param path the image file
	 * @param profile the profile
	 * @return true if the profile was embedded, false otherwise
	 */
	boolean embed(Path path, ICC_Profile profile);

}
