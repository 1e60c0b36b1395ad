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

package papyri.lib.images;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import papyri.lib.labels.DisplayOrder;
import papyri.lib.labels.MethodLabel;
import papyri.lib.labels.MethodLists;

/**
 * The outputs generated for one image: parallel lists of display labels, indices and (optionally) images.
 * <p>
 * Indices are 1-based and record the order in which variants were generated; the unprocessed input,
 * if present, has index 0.
 * An output set may be 'storage only', in which case labels and indices are recorded but images are not kept.
 * <p>
 * Instances are immutable.
 *
 * @author Papyri developers
 */
public class OutputSet {

	private final boolean storageOnly;
	private final List<String> labels;
	private final List<Integer> indices;
	private final List<BufferedImage> images;

	private OutputSet(boolean storageOnly, List<String> labels, List<Integer> indices, List<BufferedImage> images) {
		this.storageOnly = storageOnly;
		this.labels = Collections.unmodifiableList(labels);
		this.indices = Collections.unmodifiableList(indices);
		this.images = Collections.unmodifiableList(images);
	}

	/**
	 * Create an empty output set that keeps images.
	 * @return
	 */
	public static OutputSet empty() {
		return new OutputSet(false, List.of(), List.of(), List.of());
	}

	/**
	 * Create an empty output set that records labels and indices only.
	 * @return
	 */
	public static OutputSet storageOnly() {
		return new OutputSet(true, List.of(), List.of(), List.of());
	}

	/**
	 * Returns true if images are not kept.
	 * @return
	 */
	public boolean isStorageOnly() {
		return storageOnly;
	}

	/**
	 * Get a new output set with an additional entry.
	 * @param label display label
	 * @param index generation index
	 * @param image the image; ignored if this set is storage only
	 * @return
	 */
	public OutputSet plus(String label, int index, BufferedImage image) {
		var newLabels = new ArrayList<>(labels);
		var newIndices = new ArrayList<>(indices);
		var newImages = new ArrayList<>(images);
		newLabels.add(label);
		newIndices.add(index);
		if (!storageOnly) {
			if (image == null)
				throw new IllegalArgumentException("Image is required unless the output set is storage only");
			newImages.add(image);
		}
		return new OutputSet(storageOnly, newLabels, newIndices, newImages);
	}

	/**
	 * Get a new output set with the unprocessed input prepended at index 0, labelled {@link MethodLabel#ORIGINAL}.
	 * @param original
	 * @return
	 */
	public OutputSet withOriginal(BufferedImage original) {
		var newLabels = new ArrayList<String>();
		var newIndices = new ArrayList<Integer>();
		var newImages = new ArrayList<BufferedImage>();
		newLabels.add(MethodLabel.ORIGINAL);
		newIndices.add(0);
		if (!storageOnly)
			newImages.add(original);
		newLabels.addAll(labels);
		newIndices.addAll(indices);
		newImages.addAll(images);
		return new OutputSet(storageOnly, newLabels, newIndices, newImages);
	}

	/**
	 * Get a new output set with the entries permuted to follow the order of a label universe.
	 * Entries whose labels are not in the universe are dropped.
	 * @param universe
	 * @return
	 * @see MethodLists#restrict(List, java.util.Collection)
	 */
	public OutputSet reorder(List<String> universe) {
		Map<String, Integer> positions = new HashMap<>();
		for (int i = 0; i < labels.size(); i++)
			positions.putIfAbsent(labels.get(i), i);
		var newLabels = new ArrayList<String>();
		var newIndices = new ArrayList<Integer>();
		var newImages = new ArrayList<BufferedImage>();
		for (var label : MethodLists.restrict(universe, labels)) {
			int i = positions.get(label);
			newLabels.add(label);
			newIndices.add(indices.get(i));
			if (!storageOnly)
				newImages.add(images.get(i));
		}
		return new OutputSet(storageOnly, newLabels, newIndices, newImages);
	}

	/**
	 * Get a new output set in one of the canonical display orders.
	 * @param grayscale true if the outputs were generated from a grayscale image
	 * @param order
	 * @return
	 */
	public OutputSet reorder(boolean grayscale, DisplayOrder order) {
		return reorder(MethodLists.getUniverse(grayscale, order));
	}

	/**
	 * Number of entries.
	 * @return
	 */
	public int size() {
		return labels.size();
	}

	/**
	 * Returns true if there are no entries.
	 * @return
	 */
	public boolean isEmpty() {
		return labels.isEmpty();
	}

	/**
	 * Display labels, in entry order.
	 * @return
	 */
	public List<String> getLabels() {
		return labels;
	}

	/**
	 * Generation indices, in entry order.
	 * @return
	 */
	public List<Integer> getIndices() {
		return indices;
	}

	/**
	 * Images, in entry order. Empty if the set is storage only.
	 * @return
	 */
	public List<BufferedImage> getImages() {
		return images;
	}

	/**
	 * Get the image with a specified label.
	 * @param label
	 * @return the image, or null if there is no such entry or images are not kept
	 */
	public BufferedImage getImage(String label) {
		int ind = labels.indexOf(label);
		if (ind < 0 || storageOnly)
			return null;
		return images.get(ind);
	}

	@Override
	public String toString() {
		return "OutputSet " + labels;
	}

}
