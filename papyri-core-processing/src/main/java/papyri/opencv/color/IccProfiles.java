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

package papyri.opencv.color;

import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods to access the ICC profiles used for gamut expansion and embedding.
 *
 * @author Papyri developers
 */
public class IccProfiles {

	private final static Logger logger = LoggerFactory.getLogger(IccProfiles.class);

	/**
	 * Classpath resource checked for an Adobe RGB (1998) profile.
	 */
	public static final String ADOBE_RGB_RESOURCE = "/papyri/icc/AdobeRGB1998.icc";

	// Primaries of Adobe RGB (1998), adapted to D50 as required for the profile connection space
	private static final double[][] ADOBE_RGB_COLORANTS = {
			{0.6097559, 0.3111145, 0.0194702},
			{0.2052401, 0.6256714, 0.0608902},
			{0.1492124, 0.0632141, 0.7445343}
	};
	private static final double[] D65_WHITE = {0.9504547, 1.0, 1.0890503};
	private static final double[] D50_WHITE = {0.9642029, 1.0, 0.8249054};
	// Gamma of 2.19921875 encoded as u8Fixed8Number
	private static final int ADOBE_RGB_GAMMA = 563;

	private IccProfiles() {
		throw new AssertionError();
	}

	/**
	 * The built-in sRGB IEC 61966-2.1 profile.
	 * @return
	 */
	public static ICC_Profile getSRGB() {
		return ICC_Profile.getInstance(ColorSpace.CS_sRGB);
	}

	/**
	 * Get an Adobe RGB (1998) profile.
	 * <p>
	 * If a path is provided, the profile is read from the path.
	 * Otherwise, the profile is read from {@link #ADOBE_RGB_RESOURCE} if available, or else
	 * built from the published Adobe RGB (1998) primaries, white point and gamma.
	 *
	 * @param path optional path to an ICC profile; may be null
	 * @return
	 * @throws IOException if a path was provided but the profile could not be read
	 */
	public static ICC_Profile getAdobeRGB(Path path) throws IOException {
		if (path != null) {
			logger.debug("Reading Adobe RGB profile from {}", path);
			return readProfile(path);
		}
		try (InputStream stream = IccProfiles.class.getResourceAsStream(ADOBE_RGB_RESOURCE)) {
			if (stream != null) {
				logger.debug("Reading Adobe RGB profile from {}", ADOBE_RGB_RESOURCE);
				return ICC_Profile.getInstance(stream);
			}
		}
		logger.debug("Using built-in Adobe RGB (1998) compatible profile");
		return ICC_Profile.getInstance(createAdobeRGBCompatibleData());
	}

	/**
	 * Read an ICC profile from a file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or does not contain a valid profile
	 */
	public static ICC_Profile readProfile(Path path) throws IOException {
		if (!Files.isRegularFile(path))
			throw new IOException("ICC profile not found: " + path);
		try (InputStream stream = Files.newInputStream(path)) {
			return ICC_Profile.getInstance(stream);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid ICC profile: " + path, e);
		}
	}

	/**
	 * Create a copy of a profile that requests the perceptual rendering intent.
	 * @param profile
	 * @return
	 */
	public static ICC_Profile withPerceptualIntent(ICC_Profile profile) {
		var copy = ICC_Profile.getInstance(profile.getData());
		byte[] header = copy.getData(ICC_Profile.icSigHead);
		for (int i = 0; i < 4; i++)
			header[ICC_Profile.icHdrRenderingIntent + i] = 0;
		header[ICC_Profile.icHdrRenderingIntent + 3] = (byte)ICC_Profile.icPerceptual;
		copy.setData(ICC_Profile.icSigHead, header);
		return copy;
	}

	/**
	 * Create the bytes of a matrix/TRC display profile with the Adobe RGB (1998) primaries,
	 * white point and gamma.
	 * @return
	 */
	static byte[] createAdobeRGBCompatibleData() {
		var description = "Adobe RGB (1998) compatible".getBytes(StandardCharsets.US_ASCII);
		var copyright = "No copyright, use freely".getBytes(StandardCharsets.US_ASCII);

		int[] tags = {
				ICC_Profile.icSigProfileDescriptionTag,
				ICC_Profile.icSigCopyrightTag,
				ICC_Profile.icSigMediaWhitePointTag,
				ICC_Profile.icSigRedColorantTag,
				ICC_Profile.icSigGreenColorantTag,
				ICC_Profile.icSigBlueColorantTag,
				ICC_Profile.icSigRedTRCTag,
				ICC_Profile.icSigGreenTRCTag,
				ICC_Profile.icSigBlueTRCTag
		};
		int descSize = 12 + description.length + 1 + 8 + 3 + 67;
		int cprtSize = 8 + copyright.length + 1;
		int xyzSize = 20;
		int curvSize = 14;
		int[] sizes = {descSize, cprtSize, xyzSize, xyzSize, xyzSize, xyzSize, curvSize, curvSize, curvSize};

		int tableSize = 4 + tags.length * 12;
		int[] offsets = new int[tags.length];
		int offset = 128 + tableSize;
		for (int i = 0; i < tags.length; i++) {
			// The three curves share their data
			if (i > 6) {
				offsets[i] = offsets[6];
				continue;
			}
			offsets[i] = offset;
			offset = pad4(offset + sizes[i]);
		}
		int totalSize = offset;

		var buffer = ByteBuffer.allocate(totalSize).order(ByteOrder.BIG_ENDIAN);
		// Header
		buffer.putInt(0, totalSize);
		buffer.putInt(8, 0x02100000);
		buffer.putInt(12, ICC_Profile.icSigDisplayClass);
		buffer.putInt(16, ICC_Profile.icSigRgbData);
		buffer.putInt(20, ICC_Profile.icSigXYZData);
		buffer.putShort(24, (short)2023);
		buffer.putShort(26, (short)1);
		buffer.putShort(28, (short)1);
		buffer.putInt(36, 0x61637370); // 'acsp'
		buffer.putInt(ICC_Profile.icHdrRenderingIntent, ICC_Profile.icPerceptual);
		putXYZNumber(buffer, 68, D50_WHITE);

		// Tag table
		buffer.position(128);
		buffer.putInt(tags.length);
		for (int i = 0; i < tags.length; i++) {
			buffer.putInt(tags[i]);
			buffer.putInt(offsets[i]);
			buffer.putInt(sizes[i]);
		}

		// textDescriptionType
		buffer.position(offsets[0]);
		buffer.putInt(0x64657363); // 'desc'
		buffer.putInt(0);
		buffer.putInt(description.length + 1);
		buffer.put(description);
		buffer.put((byte)0);
		// Remaining Unicode and ScriptCode fields are left empty (zero)

		// textType
		buffer.position(offsets[1]);
		buffer.putInt(0x74657874); // 'text'
		buffer.putInt(0);
		buffer.put(copyright);
		buffer.put((byte)0);

		putXYZType(buffer, offsets[2], D65_WHITE);
		for (int c = 0; c < 3; c++)
			putXYZType(buffer, offsets[3 + c], ADOBE_RGB_COLORANTS[c]);

		// curveType with a single gamma value
		buffer.position(offsets[6]);
		buffer.putInt(0x63757276); // 'curv'
		buffer.putInt(0);
		buffer.putInt(1);
		buffer.putShort((short)ADOBE_RGB_GAMMA);

		return buffer.array();
	}

	private static void putXYZType(ByteBuffer buffer, int offset, double[] xyz) {
		buffer.putInt(offset, 0x58595A20); // 'XYZ '
		buffer.putInt(offset + 4, 0);
		putXYZNumber(buffer, offset + 8, xyz);
	}

	private static void putXYZNumber(ByteBuffer buffer, int offset, double[] xyz) {
		for (int i = 0; i < 3; i++)
			buffer.putInt(offset + i * 4, (int)Math.round(xyz[i] * 65536.0));
	}

	private static int pad4(int value) {
		return (value + 3) / 4 * 4;
	}

}
