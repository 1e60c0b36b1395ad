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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import papyri.lib.common.GeneralTools;
import papyri.lib.io.GsonTools;

/**
 * Configuration snapshot for one enhancement run.
 * <p>
 * A request states which base methods are enabled, which postprocessing is applied to each,
 * whether the background should be masked, and how outputs are written.
 * Requests are immutable; use {@link #builder()} to create one, or {@link #fromJson(String)} to
 * read one written with {@link #toJson()}. Values missing from JSON take their defaults.
 *
 * @author Papyri developers
 */
public class EnhancementRequest {

	/**
	 * Default name of the output directory, created alongside the input images.
	 */
	public static final String DEFAULT_OUTPUT_DIRECTORY = "enhanced";

	/**
	 * Default JPEG quality.
	 */
	public static final int DEFAULT_JPEG_QUALITY = 75;

	private boolean vividness = true;
	private boolean lsv = true;
	private boolean adapthisteq = true;
	private boolean retinex = true;
	private List<String> retinexMethods = new ArrayList<>(RetinexMethods.getDefaultMethods());

	private boolean negative = true;
	private boolean blue = true;

	private boolean mask = false;
	private MaskParameters maskParameters = MaskParameters.getDefault();
	private boolean redChannelOnly = false;

	private boolean jpeg = true;
	private boolean tiff = false;
	private int jpegQuality = DEFAULT_JPEG_QUALITY;
	private String outputDirectory = DEFAULT_OUTPUT_DIRECTORY;

	private EnhancementRequest() {}

	/**
	 * Get a request with all default settings.
	 * @return
	 */
	public static EnhancementRequest getDefault() {
		return new EnhancementRequest();
	}

	/**
	 * Create a builder initialized with the default settings.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new EnhancementRequest());
	}

	/**
	 * Create a builder initialized with the settings of this request.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(this);
	}

	/**
	 * Returns true if the base method is enabled.
	 * @param method
	 * @return
	 */
	public boolean isEnabled(BaseMethod method) {
		switch (method) {
		case VIVIDNESS:
			return vividness;
		case LSV:
			return lsv;
		case ADAPTHISTEQ:
			return adapthisteq;
		case RETINEX:
			return retinex;
		default:
			throw new IllegalArgumentException("Unknown method " + method);
		}
	}

	/**
	 * Get the enabled base methods, in the order they are applied.
	 * @return
	 */
	public List<BaseMethod> getEnabledMethods() {
		List<BaseMethod> methods = new ArrayList<>();
		for (var method : BaseMethod.values()) {
			if (isEnabled(method))
				methods.add(method);
		}
		return Collections.unmodifiableList(methods);
	}

	/**
	 * Get the requested retinex methods for color images, in the order they are applied.
	 * @return
	 */
	public List<String> getRetinexMethods() {
		if (retinexMethods == null)
			return Collections.emptyList();
		return Collections.unmodifiableList(new ArrayList<>(retinexMethods));
	}

	/**
	 * Get the postprocessing to apply to each base method, starting with {@link Postprocessing#NONE}.
	 * @param grayscale if true, postprocessing that cannot be applied to grayscale images is omitted
	 * @return
	 */
	public List<Postprocessing> getPostprocessing(boolean grayscale) {
		List<Postprocessing> list = new ArrayList<>();
		list.add(Postprocessing.NONE);
		if (negative)
			list.add(Postprocessing.NEGATIVE);
		if (blue && !grayscale)
			list.add(Postprocessing.BLUE_NEGATIVE);
		return Collections.unmodifiableList(list);
	}

	/**
	 * Returns true if the negative postprocessing is enabled.
	 * @return
	 */
	public boolean doNegative() {
		return negative;
	}

	/**
	 * Returns true if the blue negative postprocessing is enabled.
	 * This is independent of {@link #doNegative()}, but has no effect on grayscale images.
	 * @return
	 */
	public boolean doBlue() {
		return blue;
	}

	/**
	 * Returns true if a masked run should precede the unmasked run.
	 * @return
	 */
	public boolean doMask() {
		return mask;
	}

	/**
	 * Parameters used for background segmentation.
	 * @return
	 */
	public MaskParameters getMaskParameters() {
		return maskParameters == null ? MaskParameters.getDefault() : maskParameters;
	}

	/**
	 * Returns true if color images should be reduced to their red channel.
	 * @return
	 */
	public boolean isRedChannelOnly() {
		return redChannelOnly;
	}

	/**
	 * Get the output formats to write; may be empty.
	 * @return
	 */
	public Set<OutputFormat> getOutputFormats() {
		var formats = EnumSet.noneOf(OutputFormat.class);
		if (tiff)
			formats.add(OutputFormat.TIFF);
		if (jpeg)
			formats.add(OutputFormat.JPEG);
		return Collections.unmodifiableSet(formats);
	}

	/**
	 * JPEG quality, in the range 0-100.
	 * @return
	 */
	public int getJpegQuality() {
		return jpegQuality;
	}

	/**
	 * Name of the output directory, created alongside each input image.
	 * @return
	 */
	public String getOutputDirectory() {
		return outputDirectory == null ? DEFAULT_OUTPUT_DIRECTORY : outputDirectory;
	}

	/**
	 * Check the request can be used for a run.
	 * @throws IllegalArgumentException if the request is invalid, with a message suitable for display
	 */
	public void validate() throws IllegalArgumentException {
		if (!vividness && !lsv && !adapthisteq && !retinex)
			throw new IllegalArgumentException("Please select at least one enhancement method");
		if (retinex) {
			if (retinexMethods == null || retinexMethods.isEmpty())
				throw new IllegalArgumentException("Please select at least one retinex method");
			for (var name : retinexMethods) {
				if (!RetinexMethods.isColorMethod(name))
					throw new IllegalArgumentException("Unknown retinex method: " + name);
			}
			if (new LinkedHashSet<>(retinexMethods).size() != retinexMethods.size())
				throw new IllegalArgumentException("Retinex methods must not be repeated: " + retinexMethods);
		}
		if (jpegQuality < 0 || jpegQuality > 100)
			throw new IllegalArgumentException("JPEG quality must be between 0 and 100, but was " + jpegQuality);
		if (!GeneralTools.isValidFilename(getOutputDirectory()))
			throw new IllegalArgumentException("Invalid output directory name: " + getOutputDirectory());
		getMaskParameters().validate();
	}

	/**
	 * Write this request as JSON.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance(true).toJson(this);
	}

	/**
	 * Read a request from JSON, using defaults for missing values.
	 * The request is not validated.
	 * @param json
	 * @return
	 */
	public static EnhancementRequest fromJson(String json) {
		var request = GsonTools.getInstance().fromJson(json, EnhancementRequest.class);
		return request == null ? getDefault() : request;
	}

	/**
	 * Read a request from a JSON file, using defaults for missing values.
	 * The request is not validated.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static EnhancementRequest readJson(Path path) throws IOException {
		return GsonTools.readJson(path, EnhancementRequest.class);
	}

	@Override
	public int hashCode() {
		return Objects.hash(adapthisteq, blue, jpeg, jpegQuality, lsv, mask, getMaskParameters(), negative, getOutputDirectory(),
				redChannelOnly, retinex, getRetinexMethods(), tiff, vividness);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof EnhancementRequest))
			return false;
		EnhancementRequest other = (EnhancementRequest) obj;
		return adapthisteq == other.adapthisteq && blue == other.blue && jpeg == other.jpeg
				&& jpegQuality == other.jpegQuality && lsv == other.lsv && mask == other.mask
				&& getMaskParameters().equals(other.getMaskParameters()) && negative == other.negative
				&& getOutputDirectory().equals(other.getOutputDirectory()) && redChannelOnly == other.redChannelOnly
				&& retinex == other.retinex && getRetinexMethods().equals(other.getRetinexMethods()) && tiff == other.tiff
				&& vividness == other.vividness;
	}

	@Override
	public String toString() {
		return "EnhancementRequest [methods=" + getEnabledMethods() + ", retinexMethods=" + getRetinexMethods()
				+ ", negative=" + negative + ", blue=" + blue + ", mask=" + mask + ", redChannelOnly=" + redChannelOnly
				+ ", formats=" + getOutputFormats() + "]";
	}


	/**
	 * Builder for {@link EnhancementRequest}.
	 */
	public static class Builder {

		private final EnhancementRequest request = new EnhancementRequest();

		private Builder(EnhancementRequest template) {
			copy(template, request);
		}

		private static void copy(EnhancementRequest source, EnhancementRequest target) {
			target.vividness = source.vividness;
			target.lsv = source.lsv;
			target.adapthisteq = source.adapthisteq;
			target.retinex = source.retinex;
			target.retinexMethods = new ArrayList<>(source.getRetinexMethods());
			target.negative = source.negative;
			target.blue = source.blue;
			target.mask = source.mask;
			target.maskParameters = source.getMaskParameters();
			target.redChannelOnly = source.redChannelOnly;
			target.jpeg = source.jpeg;
			target.tiff = source.tiff;
			target.jpegQuality = source.jpegQuality;
			target.outputDirectory = source.getOutputDirectory();
		}

		/**
		 * Enable or disable a base method.
		 * @param method
		 * @param enabled
		 * @return this builder
		 */
		public Builder method(BaseMethod method, boolean enabled) {
			switch (method) {
			case VIVIDNESS:
				request.vividness = enabled;
				break;
			case LSV:
				request.lsv = enabled;
				break;
			case ADAPTHISTEQ:
				request.adapthisteq = enabled;
				break;
			case RETINEX:
				request.retinex = enabled;
				break;
			default:
				throw new IllegalArgumentException("Unknown method " + method);
			}
			return this;
		}

		/**
		 * Enable only the specified base methods, disabling all others.
		 * @param methods
		 * @return this builder
		 */
		public Builder methods(BaseMethod... methods) {
			for (var method : BaseMethod.values())
				method(method, false);
			for (var method : methods)
				method(method, true);
			return this;
		}

		/**
		 * Set the retinex methods to apply to color images, in order.
		 * @param methods
		 * @return this builder
		 */
		public Builder retinexMethods(List<String> methods) {
			request.retinexMethods = new ArrayList<>(methods);
			return this;
		}

		/**
		 * Set the retinex methods to apply to color images, in order.
		 * @param methods
		 * @return this builder
		 */
		public Builder retinexMethods(String... methods) {
			return retinexMethods(List.of(methods));
		}

		/**
		 * Enable or disable the negative postprocessing.
		 * @param negative
		 * @return this builder
		 */
		public Builder negative(boolean negative) {
			request.negative = negative;
			return this;
		}

		/**
		 * Enable or disable the blue negative postprocessing.
		 * @param blue
		 * @return this builder
		 */
		public Builder blue(boolean blue) {
			request.blue = blue;
			return this;
		}

		/**
		 * Enable or disable background masking.
		 * @param mask
		 * @return this builder
		 */
		public Builder mask(boolean mask) {
			request.mask = mask;
			return this;
		}

		/**
		 * Set the background segmentation parameters.
		 * @param params
		 * @return this builder
		 */
		public Builder maskParameters(MaskParameters params) {
			request.maskParameters = Objects.requireNonNull(params);
			return this;
		}

		/**
		 * Request that color images are reduced to their red channel.
		 * @param redChannelOnly
		 * @return this builder
		 */
		public Builder redChannelOnly(boolean redChannelOnly) {
			request.redChannelOnly = redChannelOnly;
			return this;
		}

		/**
		 * Enable or disable JPEG output.
		 * @param jpeg
		 * @return this builder
		 */
		public Builder jpeg(boolean jpeg) {
			request.jpeg = jpeg;
			return this;
		}

		/**
		 * Enable or disable TIFF output.
		 * @param tiff
		 * @return this builder
		 */
		public Builder tiff(boolean tiff) {
			request.tiff = tiff;
			return this;
		}

		/**
		 * Set the JPEG quality (0-100).
		 * @param quality
		 * @return this builder
		 */
		public Builder jpegQuality(int quality) {
			request.jpegQuality = quality;
			return this;
		}

		/**
		 * Set the name of the output directory.
		 * @param name
		 * @return this builder
		 */
		public Builder outputDirectory(String name) {
			request.outputDirectory = name;
			return this;
		}

		/**
		 * Build and validate the request.
		 * @return
		 * @throws IllegalArgumentException if the request is invalid
		 * @see EnhancementRequest#validate()
		 */
		public EnhancementRequest build() throws IllegalArgumentException {
			var built = new EnhancementRequest();
			copy(request, built);
			built.validate();
			return built;
		}

	}

}
