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

import java.util.Objects;

import papyri.lib.common.GeneralTools;
import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.Postprocessing;

/**
 * Label identifying one enhanced variant of an image.
 * <p>
 * A label combines an operator name, an optional postprocessing suffix and an optional
 * "Masked" suffix, e.g. "Vividness", "Vividness Negative Masked" or "Retinex MSR-V Blue Negative".
 *
 * @author Papyri developers
 */
public class MethodLabel {

	/**
	 * Display label of the unprocessed input image.
	 */
	public static final String ORIGINAL = "Original";

	/**
	 * Display suffix of variants computed with a background mask.
	 */
	public static final String MASKED = "Masked";

	private final String operator;
	private final String operatorFileLabel;
	private final Postprocessing postprocessing;
	private final boolean masked;

	private MethodLabel(String operator, String operatorFileLabel, Postprocessing postprocessing, boolean masked) {
		this.operator = Objects.requireNonNull(operator);
		this.operatorFileLabel = Objects.requireNonNull(operatorFileLabel);
		this.postprocessing = Objects.requireNonNull(postprocessing);
		this.masked = masked;
	}

	/**
	 * Create a label for a base method.
	 * @param method the base method
	 * @param retinexMethod name of the retinex method; required for {@link BaseMethod#RETINEX}, ignored otherwise
	 * @param postprocessing
	 * @param masked
	 * @return
	 */
	public static MethodLabel of(BaseMethod method, String retinexMethod, Postprocessing postprocessing, boolean masked) {
		if (method == BaseMethod.RETINEX) {
			Objects.requireNonNull(retinexMethod, "Retinex method name is required");
			return new MethodLabel(operatorLabel(method, retinexMethod),
					method.getFileLabel() + "-" + retinexMethod, postprocessing, masked);
		}
		return new MethodLabel(method.getLabel(), method.getFileLabel(), postprocessing, masked);
	}

	/**
	 * Get the operator part of a display label.
	 * @param method
	 * @param retinexMethod
	 * @return
	 */
	static String operatorLabel(BaseMethod method, String retinexMethod) {
		if (method == BaseMethod.RETINEX)
			return method.getLabel() + " " + retinexMethod;
		return method.getLabel();
	}

	/**
	 * Operator part of the label, e.g. "Vividness" or "Retinex MSR-V".
	 * @return
	 */
	public String getOperator() {
		return operator;
	}

	/**
	 * Postprocessing applied.
	 * @return
	 */
	public Postprocessing getPostprocessing() {
		return postprocessing;
	}

	/**
	 * Returns true if the variant was computed with a background mask.
	 * @return
	 */
	public boolean isMasked() {
		return masked;
	}

	/**
	 * Label used for display, with absent parts omitted.
	 * @return
	 */
	public String getDisplayLabel() {
		return GeneralTools.joinNonBlank(operator, postprocessing.getLabel(), masked ? MASKED : "");
	}

	/**
	 * Label used within output file names, e.g. "vividness-neg-blue".
	 * Masking is not included, since its file label depends upon the mask parameters.
	 * @return
	 */
	public String getFileLabel() {
		var post = postprocessing.getFileLabel();
		return post.isEmpty() ? operatorFileLabel : operatorFileLabel + "-" + post;
	}

	@Override
	public int hashCode() {
		return Objects.hash(masked, operator, operatorFileLabel, postprocessing);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MethodLabel))
			return false;
		MethodLabel other = (MethodLabel) obj;
		return masked == other.masked && operator.equals(other.operator)
				&& operatorFileLabel.equals(other.operatorFileLabel) && postprocessing == other.postprocessing;
	}

	@Override
	public String toString() {
		return getDisplayLabel();
	}

}
