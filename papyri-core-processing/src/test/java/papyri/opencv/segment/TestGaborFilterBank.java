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

package papyri.opencv.segment;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.bytedeco.javacpp.PointerScope;
import org.junit.jupiter.api.Test;

import papyri.lib.enhance.MaskParameters;
import papyri.opencv.tools.OpenCVTools;

@SuppressWarnings("javadoc")
public class TestGaborFilterBank {

	@Test
	public void test_sigma() {
		assertEquals(0.3748, GaborFilterBank.sigmaFor(2, 15), 1e-4);
		// One octave bandwidth gives sigma ~0.56 wavelengths
		assertEquals(0.5615 * 10, GaborFilterBank.sigmaFor(10, 1), 1e-2);
	}

	@Test
	public void test_defaultBank() {
		try (var scope = new PointerScope()) {
			var bank = GaborFilterBank.create(MaskParameters.getDefault());
			assertEquals(4, bank.size());
			assertArrayEquals(new double[] {0, 45, 90, 135}, bank.getOrientations());
			assertEquals(2.0, bank.getWavelength());
			assertEquals(0.05, bank.getAspectRatio());
			assertEquals(23, GaborFilterBank.kernelRadius(bank.getSigma(), bank.getAspectRatio()));
			for (int i = 0; i < bank.size(); i++) {
				var kernel = bank.getKernel(i);
				assertEquals(47, kernel.rows());
				assertEquals(47, kernel.cols());
				double sum = 0;
				for (float v : OpenCVTools.extractFloats(kernel))
					sum += v;
				assertEquals(0.0, sum, 1e-4);
			}
		}
	}

	@Test
	public void test_flatResponse() {
		try (var scope = new PointerScope()) {
			var bank = GaborFilterBank.create(MaskParameters.getDefault());
			float[] values = new float[32 * 32];
			java.util.Arrays.fill(values, 0.7f);
			var response = bank.maxResponse(OpenCVTools.createFloatMat(32, 32, values));
			for (float v : OpenCVTools.extractFloats(response))
				assertEquals(0.0, v, 1e-4);
		}
	}

	@Test
	public void test_orientationStep() {
		var params = MaskParameters.builder().orientationStep(30).build();
		try (var scope = new PointerScope()) {
			var bank = GaborFilterBank.create(params);
			assertEquals(6, bank.size());
		}
	}

}
