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

package papyri.lib.images.writers;

import java.awt.color.ICC_Profile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embed ICC profiles by calling ExifTool as an external process.
 * <p>
 * This is used for JPEG files, since ImageIO's JPEG writer does not support writing a custom profile.
 *
 * @author Papyri developers
 */
public class ExifToolIccEmbedder implements IccProfileEmbedder {

	private final static Logger logger = LoggerFactory.getLogger(ExifToolIccEmbedder.class);

	/**
	 * Default name of the ExifTool executable, expected on the PATH.
	 */
	public static final String DEFAULT_EXECUTABLE = "exiftool";

	private final String executable;

	/**
	 * Create an embedder that uses the default executable.
	 */
	public ExifToolIccEmbedder() {
		this(DEFAULT_EXECUTABLE);
	}

	/**
	 * Create an embedder with a specified executable.
	 * @param executable name or path of the ExifTool executable
	 */
	public ExifToolIccEmbedder(String executable) {
		this.executable = Objects.requireNonNull(executable);
	}

	/**
	 * Name or path of the executable.
	 * @return
	 */
	public String getExecutable() {
		return executable;
	}

	/**
	 * Build the command used to copy the profile from a file into an image.
	 * @param profileFile file containing the ICC profile
	 * @param imageFile image to update
	 * @return
	 */
	List<String> buildCommand(Path profileFile, Path imageFile) {
		return List.of(executable, "-q", "-tagsFromFile", profileFile.toString(), "-ICC_Profile", imageFile.toString());
	}

	@Override
	public boolean embed(Path path, ICC_Profile profile) {
		Path temp = null;
		try {
			temp = Files.createTempFile("papyri-", ".icc");
			Files.write(temp, profile.getData());
			var process = new ProcessBuilder()
					.command(buildCommand(temp, path))
					.redirectErrorStream(true)
					.start();
			String output;
			try (var reader = process.inputReader()) {
				output = reader.lines().collect(Collectors.joining(System.lineSeparator()));
			}
			int exitCode = process.waitFor();
			if (exitCode != 0) {
				logger.warn("ExifTool exited with code {} for {}: {}", exitCode, path, output);
				return false;
			}
			// ExifTool keeps a backup of the original
			Files.deleteIfExists(path.resolveSibling(path.getFileName().toString() + "_original"));
			return true;
		} catch (IOException e) {
			logger.warn("Unable to embed ICC profile in {}: {}", path, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return false;
		} catch (InterruptedException e) {
			logger.warn("Interrupted while embedding ICC profile in {}", path);
			Thread.currentThread().interrupt();
			return false;
		} finally {
			deleteTemp(temp);
		}
	}

	private static void deleteTemp(Path temp) {
		if (temp == null)
			return;
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			logger.debug("Unable to delete {}: {}", temp, e.getLocalizedMessage());
		}
	}

}
