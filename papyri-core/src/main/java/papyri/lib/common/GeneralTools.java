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

package papyri.lib.common;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A collection of generally-useful static methods.
 *
 * @author Papyri developers
 */
public final class GeneralTools {

	final private static Logger logger = LoggerFactory.getLogger(GeneralTools.class);

	private final static String LATEST_VERSION = getCurrentVersion();

	/**
	 * Extensions that are treated as a single unit, despite containing more than one dot.
	 */
	private final static List<String> DEFAULT_EXTENSIONS = Arrays.asList(
			".ome.tif", ".ome.tiff", ".tar.gz"
			);

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Request the version of Papyri.
	 *
	 * @return the version, or null if it is unknown
	 */
	public static String getVersion() {
		return LATEST_VERSION;
	}

	private static String getCurrentVersion() {
		var version = getPackageVersion(GeneralTools.class);
		if (version == null) {
			logger.debug("Papyri version is unknown");
			return null;
		}
		return version.strip();
	}

	/**
	 * Try to determine the version of a jar containing a specified class.
	 * This first checks the implementation version in the package, then looks for a VERSION
	 * file stored as a resource.
	 *
	 * @param cls
	 * @return the version, if available, or null if no version is known.
	 */
	public static String getPackageVersion(Class<?> cls) {
		String version = cls.getPackage().getImplementationVersion();
		if (version == null) {
			try (InputStream stream = cls.getResourceAsStream("/VERSION")) {
				if (stream != null)
					version = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
			} catch (IOException e) {
				logger.error("Error reading version: " + e.getLocalizedMessage(), e);
			}
		}
		return version;
	}

	/**
	 * Get extension from a file.
	 * @param file
	 * @return
	 * @see #getExtension(String)
	 */
	public static Optional<String> getExtension(File file) {
		Objects.requireNonNull(file);
		return getExtension(file.getName());
	}

	/**
	 * Get extension from a filename. Some implementation notes:
	 * <ul>
	 * <li>This is <i>generally</i> 'the final dot and beyond', however ".ome.tif", ".ome.tiff" and ".tar.gz"
	 * are kept whole.</li>
	 * <li>The dot is included as the first character.</li>
	 * <li>If a dot is the final character then no extension is returned.</li>
	 * <li>The extension is returned as-is, without adjusting to be upper or lower case.
	 * Output names embed the extension, so the case of the input is kept.</li>
	 * </ul>
	 * @param name
	 * @return
	 * @see #getNameWithoutExtension(String)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		var lower = name.toLowerCase();
		String ext = null;
		for (var temp : DEFAULT_EXTENSIONS) {
			if (lower.endsWith(temp)) {
				ext = name.substring(name.length() - temp.length());
				break;
			}
		}
		if (ext == null) {
			int ind = name.lastIndexOf(".");
			if (ind >= 0) {
				ext = name.substring(ind);
				// Check we only have letters
				if (!ext.matches(".\\w*"))
					ext = null;
			}
		}
		return ext == null || ext.equals(".") ? Optional.empty() : Optional.of(ext);
	}

	/**
	 * Get the file name with extension removed.
	 * @param file
	 * @return
	 * @see #getExtension(File)
	 */
	public static String getNameWithoutExtension(File file) {
		return getNameWithoutExtension(file.getName());
	}

	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 * @see #getExtension(String)
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext ==  null ? name : name.substring(0, name.length() - ext.length());
	}

	/**
	 * Strip characters that would make a String invalid as a filename.
	 * This test is very simple, and may not catch all problems.
	 * @param name
	 * @return the (possibly-shortened) filename without invalid characters
	 */
	public static String stripInvalidFilenameChars(String name) {
		return name.replaceAll("[\\\\/:\"*?<>|\\n\\r]+", "");
	}

	/**
	 * Returns true if the output of {@link #stripInvalidFilenameChars(String)} matches the provided name,
	 * and the name is not null or blank.
	 * @param name
	 * @return true if the name is expected to be valid, false otherwise
	 */
	public static boolean isValidFilename(String name) {
		return name != null && !name.isBlank() && name.equals(stripInvalidFilenameChars(name));
	}

	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Join the non-blank parts with a single space, stripping the result.
	 * @param parts
	 * @return
	 */
	public static String joinNonBlank(String... parts) {
		var sb = new StringBuilder();
		for (var part : parts) {
			if (blankString(part, true))
				continue;
			if (sb.length() > 0)
				sb.append(" ");
			sb.append(part.strip());
		}
		return sb.toString();
	}

	/**
	 * Return "s" for any count other than 1, for simple plural messages.
	 * @param count
	 * @return
	 */
	public static String pluralSuffix(long count) {
		return count == 1 ? "" : "s";
	}

}
