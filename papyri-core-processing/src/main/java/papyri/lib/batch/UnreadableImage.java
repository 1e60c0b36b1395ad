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

package papyri.lib.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An input image that could not be read.
 *
 * @author Papyri developers
 */
public class UnreadableImage {

	private final int position;
	private final Path path;

	/**
	 * Constructor.
	 * @param position 1-based position of the image in the batch
	 * @param path
	 */
	public UnreadableImage(int position, Path path) {
		this.position = position;
		this.path = Objects.requireNonNull(path);
	}

	/**
	 * 1-based position of the image in the batch.
	 * @return
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * Path of the image.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Line written to the error log.
	 * @return
	 */
	public String toLogLine() {
		return position + "\t" + path;
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, position);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof UnreadableImage))
			return false;
		UnreadableImage other = (UnreadableImage) obj;
		return position == other.position && path.equals(other.path);
	}

	@Override
	public String toString() {
		return "UnreadableImage [" + toLogLine() + "]";
	}

}
