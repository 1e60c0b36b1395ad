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

package papyri.lib.enhance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestEnhancementRequest {

	@Test
	public void test_defaults() {
		var request = EnhancementRequest.getDefault();
		assertEquals(List.of(BaseMethod.values()), request.getEnabledMethods());
		assertEquals(List.of("MSRCR-RGB", "MSR-V"), request.getRetinexMethods());
		assertTrue(request.doNegative());
		assertTrue(request.doBlue());
		assertFalse(request.doMask());
		assertFalse(request.isRedChannelOnly());
		assertEquals(MaskBackground.LIGHT, request.getMaskParameters().getBackground());
		assertFalse(request.getMaskParameters().doDeshadow());
		assertEquals(Set.of(OutputFormat.JPEG), request.getOutputFormats());
		assertEquals(75, request.getJpegQuality());
		assertEquals("enhanced", request.getOutputDirectory());
		request.validate();
	}

	@Test
	public void test_postprocessing() {
		var request = EnhancementRequest.getDefault();
		assertEquals(List.of(Postprocessing.NONE, Postprocessing.NEGATIVE, Postprocessing.BLUE_NEGATIVE), request.getPostprocessing(false));
		assertEquals(List.of(Postprocessing.NONE, Postprocessing.NEGATIVE), request.getPostprocessing(true));

		request = EnhancementRequest.builder().negative(false).build();
		assertEquals(List.of(Postprocessing.NONE, Postprocessing.BLUE_NEGATIVE), request.getPostprocessing(false));
		assertEquals(List.of(Postprocessing.NONE), request.getPostprocessing(true));

		request = EnhancementRequest.builder().negative(false).blue(false).build();
		assertEquals(List.of(Postprocessing.NONE), request.getPostprocessing(false));

		request = EnhancementRequest.builder().blue(false).build();
		assertEquals(List.of(Postprocessing.NONE, Postprocessing.NEGATIVE), request.getPostprocessing(false));
	}

	@Test
	public void test_validation() {
		var e = assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().methods().build());
		assertEquals("Please select at least one enhancement method", e.getMessage());

		assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().retinexMethods(List.of()).build());
		assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().retinexMethods("MSR-X").build());
		assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().retinexMethods("MSR-V", "MSR-V").build());
		assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().jpegQuality(101).build());
		assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().jpegQuality(-1).build());
		assertThrows(IllegalArgumentException.class, () -> EnhancementRequest.builder().outputDirectory("a/b").build());
		assertThrows(IllegalArgumentException.class, () -> MaskParameters.builder().orientationStep(0).build());

		// Retinex methods are irrelevant when retinex is off
		var request = EnhancementRequest.builder()
				.methods(BaseMethod.VIVIDNESS)
				.retinexMethods(List.of())
				.build();
		assertEquals(List.of(BaseMethod.VIVIDNESS), request.getEnabledMethods());
	}

	@Test
	public void test_builderDoesNotChangeBuilt() {
		var builder = EnhancementRequest.builder().methods(BaseMethod.LSV);
		var request = builder.build();
		builder.method(BaseMethod.VIVIDNESS, true);
		assertEquals(List.of(BaseMethod.LSV), request.getEnabledMethods());
		assertEquals(List.of(BaseMethod.VIVIDNESS, BaseMethod.LSV), builder.build().getEnabledMethods());
		assertEquals(request, request.toBuilder().build());
	}

	@Test
	public void test_json() {
		var request = EnhancementRequest.builder()
				.methods(BaseMethod.ADAPTHISTEQ, BaseMethod.RETINEX)
				.retinexMethods("MSR-L", "MSRCP-I")
				.blue(false)
				.mask(true)
				.maskParameters(MaskParameters.builder().background(MaskBackground.DARK).deshadow(true).build())
				.tiff(true)
				.jpegQuality(90)
				.build();
		var json = request.toJson();
		assertEquals(request, EnhancementRequest.fromJson(json));

		// Missing values take defaults
		var partial = EnhancementRequest.fromJson("{\"lsv\": false, \"jpegQuality\": 50}");
		assertEquals(List.of(BaseMethod.VIVIDNESS, BaseMethod.ADAPTHISTEQ, BaseMethod.RETINEX), partial.getEnabledMethods());
		assertEquals(50, partial.getJpegQuality());
		assertEquals(List.of("MSRCR-RGB", "MSR-V"), partial.getRetinexMethods());
		assertEquals(MaskParameters.getDefault(), partial.getMaskParameters());

		var partialMask = EnhancementRequest.fromJson("{\"maskParameters\": {\"background\": \"DARK\"}}");
		assertEquals(MaskBackground.DARK, partialMask.getMaskParameters().getBackground());
		assertEquals(0.05, partialMask.getMaskParameters().getAspectRatio());
	}

	@Test
	public void test_readJson(@TempDir Path dir) throws Exception {
		var path = dir.resolve("settings.json");
		Files.writeString(path, "{\"vividness\": true, \"lsv\": false, \"adapthisteq\": false, \"retinex\": false, \"negative\": true, \"blue\": false, \"mask\": false}");
		var request = EnhancementRequest.readJson(path);
		request.validate();
		assertEquals(List.of(BaseMethod.VIVIDNESS), request.getEnabledMethods());
		assertEquals(List.of(Postprocessing.NONE, Postprocessing.NEGATIVE), request.getPostprocessing(false));
	}

	@Test
	public void test_maskOrientations() {
		var params = MaskParameters.getDefault();
		assertEquals(4, params.getOrientations().length);
		assertEquals(135.0, params.getOrientations()[3]);
		assertEquals(6, MaskParameters.builder().orientationStep(30).build().getOrientations().length);
	}

}
