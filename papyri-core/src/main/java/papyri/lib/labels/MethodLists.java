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

package papyri.lib.labels;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import papyri.lib.common.GeneralTools;

/**
 * Static methods to generate the canonical orderings of a label universe, and to project
 * the labels of one run into either ordering.
 *
 * @author Papyri developers
 */
public final class MethodLists {

	private static final Map<DisplayOrder, List<String>> COLOR = new EnumMap<>(DisplayOrder.class);
	private static final Map<DisplayOrder, List<String>> GRAYSCALE = new EnumMap<>(DisplayOrder.class);

	static {
		for (var order : DisplayOrder.values()) {
			COLOR.put(order, universe(MethodLabelSet.color(), order));
			GRAYSCALE.put(order, universe(MethodLabelSet.grayscale(), order));
		}
	}

	private MethodLists() {
		throw new AssertionError();
	}

	/**
	 * Labels grouped by auxiliary, then postprocessing, with the operator varying fastest.
	 * The input label is first.
	 * @param set
	 * @return
	 */
	public static List<String> sequential(MethodLabelSet set) {
		List<String> labels = new ArrayList<>(set.size());
		labels.add(set.getInputLabel());
		for (var aux : set.getAuxiliaries()) {
			for (var post : set.getPostprocessing()) {
				for (var op : set.getProcessing())
					labels.add(GeneralTools.joinNonBlank(op, post, aux));
			}
		}
		return Collections.unmodifiableList(labels);
	}

	/**
	 * Labels grouped by operator, with postprocessing and then the auxiliary varying within each operator.
	 * The input label is first.
	 * @param set
	 * @return
	 */
	public static List<String> interleaved(MethodLabelSet set) {
		List<String> labels = new ArrayList<>(set.size());
		labels.add(set.getInputLabel());
		for (var op : set.getProcessing()) {
			for (var post : set.getPostprocessing()) {
				for (var aux : set.getAuxiliaries())
					labels.add(GeneralTools.joinNonBlank(op, post, aux));
			}
		}
		return Collections.unmodifiableList(labels);
	}

	/**
	 * Generate the label universe of a label set in the specified order.
	 * @param set
	 * @param order
	 * @return
	 */
	public static List<String> universe(MethodLabelSet set, DisplayOrder order) {
		switch (order) {
		case INTERLEAVED:
			return interleaved(set);
		case SEQUENTIAL:
			return sequential(set);
		default:
			throw new IllegalArgumentException("Unknown order " + order);
		}
	}

	/**
	 * Get the precomputed label universe for color or grayscale images.
	 * @param grayscale
	 * @param order
	 * @return
	 */
	public static List<String> getUniverse(boolean grayscale, DisplayOrder order) {
		return grayscale ? GRAYSCALE.get(order) : COLOR.get(order);
	}

	/**
	 * Precomputed label universe for color images.
	 * @param order
	 * @return
	 */
	public static List<String> forColor(DisplayOrder order) {
		return getUniverse(false, order);
	}

	/**
	 * Precomputed label universe for grayscale images.
	 * @param order
	 * @return
	 */
	public static List<String> forGrayscale(DisplayOrder order) {
		return getUniverse(true, order);
	}

	/**
	 * Restrict a universe to the labels of one run, preserving the order of the universe.
	 * Labels that are not part of the universe are ignored.
	 * @param universe
	 * @param labels
	 * @return
	 */
	public static List<String> restrict(List<String> universe, Collection<String> labels) {
		var set = new HashSet<>(labels);
		List<String> restricted = new ArrayList<>();
		for (var label : universe) {
			if (set.contains(label))
				restricted.add(label);
		}
		return Collections.unmodifiableList(restricted);
	}

}
