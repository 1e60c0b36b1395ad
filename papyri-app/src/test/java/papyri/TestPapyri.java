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

package papyri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;
import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.EnhancementRequest;
import papyri.lib.enhance.MaskBackground;
import papyri.lib.enhance.OutputFormat;

@SuppressWarnings("javadoc")
public class TestPapyri {

	@TempDir
	Path dir;

	private static EnhancementRequest parse(String... args) throws IOException {
		var command = new EnhanceCommand();
		var cmd = new CommandLine(command);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.parseArgs(args);
		return command.buildRequest();
	}

	private Path writeImage(String name) throws IOException {
		var img = new BufferedImage(32, 24, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < img.getHeight(); y++) {
			for (int x = 0; x < img.getWidth(); x++)
				img.setRGB(x, y, x % 5 == 0 ? 0x403020 : 0xC09060 + y);
		}
		var path = dir.resolve(name);
		ImageIO.write(img, "png", path.toFile());
		return path;
	}

	@Test
	public void test_defaults() throws IOException {
		assertEquals(EnhancementRequest.getDefault(), parse("image.png"));
	}

	@Test
	public void test_options() throws IOException {
		var request = parse("--methods", "vividness,adapthisteq",
				"--no-negative",
				"--mask", "--background", "dark", "--deshadow",
				"--red",
				"--tiff", "--no-jpeg",
				"-q", "90",
				"-o", "output",
				"a.png", "b.tif");
		assertEquals(List.of(BaseMethod.VIVIDNESS, BaseMethod.ADAPTHISTEQ), request.getEnabledMethods());
		assertFalse(request.doNegative());
		assertTrue(request.doMask());
		assertEquals(MaskBackground.DARK, request.getMaskParameters().getBackground());
		assertTrue(request.getMaskParameters().doDeshadow());
		assertTrue(request.isRedChannelOnly());
		assertEquals(Set.of(OutputFormat.TIFF), request.getOutputFormats());
		assertEquals(90, request.getJpegQuality());
		assertEquals("output", request.getOutputDirectory());
	}

	@Test
	public void test_configOverridden() throws IOException {
		var config = dir.resolve("config.json");
		var saved = EnhancementRequest.builder()
				.methods(BaseMethod.RETINEX)
				.retinexMethods("MSR-L", "MSRCP-I")
				.jpegQuality(50)
				.build();
		Files.writeString(config, saved.toJson());

		var request = parse("--config", config.toString(), "--quality", "60", "image.png");
		assertEquals(List.of(BaseMethod.RETINEX), request.getEnabledMethods());
		assertEquals(List.of("MSR-L", "MSRCP-I"), request.getRetinexMethods());
		assertEquals(60, request.getJpegQuality());
	}

	@Test
	public void test_invalidOptions() {
		assertThrows(IllegalArgumentException.class, () -> parse("--quality", "101", "image.png"));
		assertThrows(IllegalArgumentException.class, () -> parse("--retinex", "MSR-X", "image.png"));
		assertEquals(2, Papyri.run("enhance", "--quality", "101", "image.png"));
		assertEquals(2, Papyri.run("--no-such-option"));
		assertEquals(2, Papyri.run("enhance"));
	}

	@Test
	public void test_help() {
		assertEquals(0, Papyri.run());
		assertEquals(0, Papyri.run("--help"));
		assertEquals(0, Papyri.run("--version"));
	}

	@Test
	public void test_version() throws Exception {
		var version = new Papyri.VersionProvider().getVersion();
		assertEquals(1, version.length);
	}

	@Test
	public void test_enhance() throws IOException {
		var image = writeImage("papyrus.png");
		var config = dir.resolve("saved.json");
		int exitCode = Papyri.run("--log", "warn", "enhance",
				"--methods", "adapthisteq",
				"--no-negative",
				"--tiff", "--no-jpeg",
				"--save-config", config.toString(),
				image.toString());
		assertEquals(0, exitCode);
		assertTrue(Files.isRegularFile(dir.resolve("enhanced").resolve("papyrus_png-adapthisteq.tif")));
		assertFalse(Files.exists(dir.resolve("enhanced").resolve("log unreadable images.txt")));

		var saved = EnhancementRequest.readJson(config);
		assertEquals(List.of(BaseMethod.ADAPTHISTEQ), saved.getEnabledMethods());
	}

	@Test
	public void test_allUnreadable() throws IOException {
		var garbage = dir.resolve("garbage.png");
		Files.write(garbage, new byte[] {1, 2, 3});
		assertEquals(1, Papyri.run("enhance", "--methods", "lsv", garbage.toString()));
		assertEquals(List.of("1\t" + garbage), Files.readAllLines(dir.resolve("enhanced").resolve("log unreadable images.txt")));
	}

}
