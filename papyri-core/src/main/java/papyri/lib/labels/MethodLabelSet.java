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
import java.util.Collections;
import java.util.List;

import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.Postprocessing;
import papyri.lib.enhance.RetinexMethods;

/**
 * The three ordered label axes for one image class: processing, postprocessing and auxiliaries.
 * <p>
 * Postprocessing and auxiliary axes include the empty label, representing 'no postprocessing'
 * and 'unmasked' respectively.
 *
 * @author Papyri developers
 */
public class MethodLabelSet {

	private static final MethodLabelSet COLOR = createColor();
	private static final MethodLabelSet GRAYSCALE = createGrayscale();

	private final String inputLabel;
	private final List<String> processing;
	private final List<String> postprocessing;
	private final List<String> auxiliaries;

	/**
	 * Create a label set.
	 * @param inputLabel label of the unprocessed input
	 * @param processing operator labels
	 * @param postprocessing postprocessing labels, normally including the empty label
	 * @param auxiliaries auxiliary labels, normally including the empty label
	 */
	public MethodLabelSet(String inputLabel, List<String> processing, List<String> postprocessing, List<String> auxiliaries) {
		this.inputLabel = inputLabel;
		this.processing = List.copyOf(processing);
		this.postprocessing = List.copyOf(postprocessing);
		this.auxiliaries = List.copyOf(auxiliaries);
	}

	private static MethodLabelSet createColor() {
		List<String> processing = new ArrayList<>();
		for (var method : BaseMethod.values()) {
			if (method == BaseMethod.RETINEX) {
				for (var name : RetinexMethods.getColorMethods())
					processing.add(MethodLabel.operatorLabel(method, name));
			} else
				processing.add(MethodLabel.operatorLabel(method, null));
		}
		List<String> post = new ArrayList<>();
		for (var p : Postprocessing.values())
			post.add(p.getLabel());
		return new MethodLabelSet(MethodLabel.ORIGINAL, processing, post, List.of("", MethodLabel.MASKED));
	}

	private static MethodLabelSet createGrayscale() {
		List<String> processing = new ArrayList<>();
		for (var method : BaseMethod.values()) {
			if (!method.supportsGrayscale())
				continue;
			processing.add(MethodLabel.operatorLabel(method, RetinexMethods.getGrayscaleMethod()));
		}
		List<String> post = new ArrayList<>();
		for (var p : Postprocessing.values()) {
			if (p.supportsGrayscale())
				post.add(p.getLabel());
		}
		return new MethodLabelSet(MethodLabel.ORIGINAL, processing, post, List.of("", MethodLabel.MASKED));
	}

	/**
	 * Label set for color images.
	 * @return
	 */
	public static MethodLabelSet color() {
		return COLOR;
	}

	/**
	 * Label set for grayscale images.
	 * @return
	 */
	public static MethodLabelSet grayscale() {
		return GRAYSCALE;
	}

	/**
	 * Label set for color or grayscale images.
	 * @param grayscale
	 * @return
	 */
	public static MethodLabelSet forImage(boolean grayscale) {
		return grayscale ? GRAYSCALE : COLOR;
	}

	/**
	 * Label of the unprocessed input.
	 * @return
	 */
	public String getInputLabel() {
		return inputLabel;
	}

	/**
	 * Operator labels.
	 * @return
	 */
	public List<String> getProcessing() {
		return Collections.unmodifiableList(processing);
	}

	/**
	 * Postprocessing labels.
	 * @return
	 */
	public List<String> getPostprocessing() {
		return Collections.unmodifiableList(postprocessing);
	}

	/**
	 * Auxiliary labels.
	 * @return
	 */
	public List<String> getAuxiliaries() {
		return Collections.unmodifiableList(auxiliaries);
	}

	/**
	 * Number of labels in the universe, including the input label.
	 * @return
	 */
	public int size() {
		return 1 + processing.size() * postprocessing.size() * auxiliaries.size();
	}

}
