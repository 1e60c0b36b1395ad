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

package papyri.lib.io;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Helper class providing Gson instances for reading and writing Papyri settings.
 *
 * @author Papyri developers
 */
public class GsonTools {

	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private final static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient();

	/**
	 * Get default Gson.
	 * @return
	 *
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 *
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 *
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

	/**
	 * Read an object of the specified class from a JSON file.
	 * @param <T>
	 * @param path
	 * @param cls
	 * @return
	 * @throws IOException if the file cannot be read or does not contain valid JSON for the class
	 */
	public static <T> T readJson(Path path, Class<T> cls) throws IOException {
		logger.debug("Reading {} from {}", cls.getSimpleName(), path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			T result = getInstance().fromJson(reader, cls);
			if (result == null)
				throw new IOException("No JSON content in " + path);
			return result;
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse " + path + ": " + e.getLocalizedMessage(), e);
		}
	}

	/**
	 * Write an object as pretty-printed JSON.
	 * @param path
	 * @param object
	 * @throws IOException
	 */
	public static void writeJson(Path path, Object object) throws IOException {
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			getInstance(true).toJson(object, writer);
		}
	}

}
