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

import java.util.Collections;
import java.util.Collection;

/**
 * Write images as PNG (lossless). Used for background masks.
 *
 * @author Papyri developers
 */
public class PngWriter extends AbstractImageIOWriter {

	@Override
	public String getName() {
		return "PNG";
	}

	@Override
	public String getDetails() {
		return "Write image as PNG using ImageIO (lossless compression).";
	}

	@Override
	public Collection<String> getExtensions() {
		return Collections.singletonList("png");
	}

}
