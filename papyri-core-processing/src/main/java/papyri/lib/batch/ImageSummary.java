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
import java.util.List;

import papyri.opencv.classify.ImageClass;

/**
 * Summary of the outputs generated for one image of a batch.
 *
 * @author Papyri developers
 */
public class ImageSummary {

	private final int position;
	private final Path path;
	private final ImageClass imageClass;
	private final List<String> labels;

	ImageSummary(int position, Path path, ImageClass imageClass, List<String> labels) {
		this.position = position;
		this.path = path;
		this.imageClass = imageClass;
		this.labels = List.copyOf(labels);
	}

	/**
	 * 1-based position of the image in the batch.
	 * @return
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * Path of the input image.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Class of the image, after classification.
	 * @return
	 */
	public ImageClass getImageClass() {
		return imageClass;
	}

	/**
	 * Display labels of the variants generated, in generation order.
	 * @return
	 */
	public List<String> getLabels() {
		return labels;
	}

	/**
	 * Number of variants generated.
	 * @return
	 */
	public int getVariantCount() {
		return labels.size();
	}

	@Override
	public String toString() {
		return "ImageSummary [" + position + ": " + path.getFileName() + ", " + imageClass + ", " + labels.size() + " variants]";
	}

}
