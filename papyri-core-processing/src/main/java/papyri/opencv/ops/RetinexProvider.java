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

import java.io.IOException;
import java.util.ServiceLoader;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Implementation of retinex algorithms.
 * <p>
 * Papyri does not include retinex itself; implementations are discovered using {@link ServiceLoader}.
 *
 * @author Papyri developers
 */
public interface RetinexProvider {

	/**
	 * Get a name for the implementation, for logging.
	 * @return
	 */
	String getName();

	/**
	 * Apply a retinex algorithm.
	 * @param image 8-bit RGB or single-channel image; this should not be modified
	 * @param method name of the method, e.g. "MSRCR-RGB" or "MSR-A"
	 * @param postprocessing postprocessing to apply to the output
	 * @return an 8-bit image with the same size and number of channels as the input
	 * @throws IOException if the algorithm could not be applied
	 */
	Mat retinex(Mat image, String method, RetinexPostprocessing postprocessing) throws IOException;

	/**
	 * Find the first provider registered with {@link ServiceLoader}.
	 * @return the provider, or null if none is available
	 */
	static RetinexProvider findProvider() {
		return ServiceLoader.load(RetinexProvider.class).findFirst().orElse(null);
	}

}
