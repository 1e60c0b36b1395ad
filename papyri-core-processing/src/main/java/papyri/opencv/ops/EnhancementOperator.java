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

package papyri.opencv.ops;

import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.Postprocessing;
import papyri.lib.labels.MethodLabel;
import papyri.opencv.classify.ImageClass;

/**
 * A base enhancement method.
 *
 * @author Papyri developers
 * @see EnhancementOperators
 */
public interface EnhancementOperator {

	/**
	 * The base method implemented by the operator.
	 * @return
	 */
	BaseMethod getMethod();

	/**
	 * Name of the retinex method.
	 * @return the name, or null if this is not a retinex operator
	 */
	default String getRetinexMethod() {
		return null;
	}

	/**
	 * Returns true if the operator can be applied to an image class.
	 * @param imageClass
	 * @return
	 */
	boolean supports(ImageClass imageClass);

	/**
	 * Apply the operator.
	 * @param context
	 * @return
	 */
	EnhancedField apply(EnhancementContext context);

	/**
	 * Get the label of a variant produced by this operator.
	 * @param postprocessing
	 * @param masked
	 * @return
	 */
	default MethodLabel getLabel(Postprocessing postprocessing, boolean masked) {
		return MethodLabel.of(getMethod(), getRetinexMethod(), postprocessing, masked);
	}

}
