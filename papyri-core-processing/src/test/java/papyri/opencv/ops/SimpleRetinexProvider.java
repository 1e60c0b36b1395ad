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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Stand-in retinex implementation for tests: returns the image or its inverse, and records each call.
 */
@SuppressWarnings("javadoc")
public class SimpleRetinexProvider implements RetinexProvider {

	private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
	private final boolean fail;

	public SimpleRetinexProvider() {
		this(false);
	}

	public SimpleRetinexProvider(boolean fail) {
		this.fail = fail;
	}

	@Override
	public String getName() {
		return "Simple retinex";
	}

	@Override
	public Mat retinex(Mat image, String method, RetinexPostprocessing postprocessing) throws IOException {
		calls.add(method + ":" + postprocessing);
		if (fail)
			throw new IOException("Retinex failed");
		if (postprocessing == RetinexPostprocessing.NONE)
			return image.clone();
		var result = new Mat();
		opencv_core.bitwise_not(image, result);
		return result;
	}

	public List<String> getCalls() {
		return calls;
	}

}
