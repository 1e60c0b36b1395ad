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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import papyri.lib.enhance.OutputFormat;

/**
 * Sink that records the files that would be written, without writing anything.
 */
@SuppressWarnings("javadoc")
public class RecordingImageSink implements ImageSink {

	private final List<Path> files = Collections.synchronizedList(new ArrayList<>());
	private final List<Path> masks = Collections.synchronizedList(new ArrayList<>());
	private final boolean canEmbed;
	private final boolean fail;

	public RecordingImageSink() {
		this(true, false);
	}

	public RecordingImageSink(boolean canEmbed, boolean fail) {
		this.canEmbed = canEmbed;
		this.fail = fail;
	}

	@Override
	public boolean write(BufferedImage img, Path base, OutputFormat format, int quality, boolean embedProfile) throws IOException {
		var path = ImageSink.resolve(base, format);
		if (fail)
			throw new IOException("Unable to write " + path);
		files.add(path);
		return canEmbed || !embedProfile;
	}

	@Override
	public void writeMask(BufferedImage img, Path path) throws IOException {
		if (fail)
			throw new IOException("Unable to write " + path);
		masks.add(path);
	}

	public List<Path> getFiles() {
		return files;
	}

	public List<String> getFileNames() {
		List<String> names = new ArrayList<>();
		for (var file : files)
			names.add(file.getFileName().toString());
		return names;
	}

	public List<Path> getMasks() {
		return masks;
	}

}
