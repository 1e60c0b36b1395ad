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

package papyri.lib.batch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log of the unreadable images of a batch, stored in an output directory.
 * <p>
 * The file is replaced by the first entry of a batch, and should be deleted at the end of a batch without entries.
 *
 * @author Papyri developers
 */
public class ErrorLog {

	private final static Logger logger = LoggerFactory.getLogger(ErrorLog.class);

	/**
	 * Name of the log file.
	 */
	public static final String FILE_NAME = "log unreadable images.txt";

	private final Path path;
	private int count = 0;

	/**
	 * Create a log in a directory.
	 * @param directory
	 */
	public ErrorLog(Path directory) {
		this.path = directory.resolve(FILE_NAME);
	}

	/**
	 * Path of the log file.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Number of entries written during this batch.
	 * @return
	 */
	public int getCount() {
		return count;
	}

	/**
	 * Add an entry, replacing any existing file if this is the first entry.
	 * @param image
	 * @throws IOException
	 */
	public void append(UnreadableImage image) throws IOException {
		var options = count == 0 ?
				new StandardOpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE} :
				new StandardOpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.APPEND};
		Files.write(path, List.of(image.toLogLine()), StandardCharsets.UTF_8, options);
		count++;
	}

	/**
	 * Delete the log file if there were no entries during this batch.
	 * @return true if a file was deleted
	 * @throws IOException
	 */
	public boolean deleteIfEmpty() throws IOException {
		if (count > 0)
			return false;
		boolean deleted = Files.deleteIfExists(path);
		if (deleted)
			logger.debug("Deleted {}", path);
		return deleted;
	}

}
