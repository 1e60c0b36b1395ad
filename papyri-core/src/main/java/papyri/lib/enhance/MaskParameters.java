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

import java.util.Objects;

/**
 * Parameters used to segment the background of an image.
 * <p>
 * The Gabor parameters default to values tuned for papyri: a short wavelength close to the sampling
 * limit, a high bandwidth and a narrow aspect ratio that favours thin, elongated structures.
 * <p>
 * Instances are immutable; use {@link #builder()} to create one.
 *
 * @author Papyri developers
 */
public class MaskParameters {

	private MaskBackground background = MaskBackground.LIGHT;
	private boolean deshadow = false;

	private double wavelength = 2.0;
	private double orientationStep = 45.0;
	private double bandwidth = 15.0;
	private double aspectRatio = 0.05;

	private MaskParameters() {}

	/**
	 * Default parameters: light background, shadows kept.
	 * @return
	 */
	public static MaskParameters getDefault() {
		return new MaskParameters();
	}

	/**
	 * Create a new builder, initialized with the default parameters.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new MaskParameters());
	}

	/**
	 * Create a new builder, initialized with the values of these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(this);
	}

	/**
	 * Background polarity.
	 * @return
	 */
	public MaskBackground getBackground() {
		return background == null ? MaskBackground.LIGHT : background;
	}

	/**
	 * Returns true if shadows should be removed before segmentation.
	 * @return
	 */
	public boolean doDeshadow() {
		return deshadow;
	}

	/**
	 * Wavelength of the Gabor filters, in pixels.
	 * @return
	 */
	public double getWavelength() {
		return wavelength;
	}

	/**
	 * Angle between successive filter orientations, in degrees.
	 * @return
	 */
	public double getOrientationStep() {
		return orientationStep;
	}

	/**
	 * Spatial-frequency bandwidth of the Gabor filters, in octaves.
	 * @return
	 */
	public double getBandwidth() {
		return bandwidth;
	}

	/**
	 * Spatial aspect ratio of the Gabor filters.
	 * @return
	 */
	public double getAspectRatio() {
		return aspectRatio;
	}

	/**
	 * Orientations of the filter bank in degrees, starting at 0 and below 180.
	 * @return
	 */
	public double[] getOrientations() {
		int n = (int)Math.ceil(180.0 / orientationStep);
		double[] orientations = new double[n];
		for (int i = 0; i < n; i++)
			orientations[i] = i * orientationStep;
		return orientations;
	}

	void validate() throws IllegalArgumentException {
		if (!(wavelength >= 2.0))
			throw new IllegalArgumentException("Gabor wavelength must be at least 2 pixels, but was " + wavelength);
		if (!(orientationStep > 0 && orientationStep <= 180))
			throw new IllegalArgumentException("Gabor orientation step must be in the range (0, 180], but was " + orientationStep);
		if (!(bandwidth > 0))
			throw new IllegalArgumentException("Gabor bandwidth must be > 0, but was " + bandwidth);
		if (!(aspectRatio > 0))
			throw new IllegalArgumentException("Gabor aspect ratio must be > 0, but was " + aspectRatio);
	}

	@Override
	public int hashCode() {
		return Objects.hash(aspectRatio, background, bandwidth, deshadow, orientationStep, wavelength);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MaskParameters))
			return false;
		MaskParameters other = (MaskParameters) obj;
		return Double.doubleToLongBits(aspectRatio) == Double.doubleToLongBits(other.aspectRatio)
				&& getBackground() == other.getBackground()
				&& Double.doubleToLongBits(bandwidth) == Double.doubleToLongBits(other.bandwidth)
				&& deshadow == other.deshadow
				&& Double.doubleToLongBits(orientationStep) == Double.doubleToLongBits(other.orientationStep)
				&& Double.doubleToLongBits(wavelength) == Double.doubleToLongBits(other.wavelength);
	}

	@Override
	public String toString() {
		return "MaskParameters [background=" + getBackground() + ", deshadow=" + deshadow + ", wavelength=" + wavelength
				+ ", orientationStep=" + orientationStep + ", bandwidth=" + bandwidth + ", aspectRatio=" + aspectRatio + "]";
	}


	/**
	 * Builder for {@link MaskParameters}.
	 */
	public static class Builder {

		private MaskParameters params = new MaskParameters();

		private Builder(MaskParameters template) {
			params.background = template.getBackground();
			params.deshadow = template.deshadow;
			params.wavelength = template.wavelength;
			params.orientationStep = template.orientationStep;
			params.bandwidth = template.bandwidth;
			params.aspectRatio = template.aspectRatio;
		}

		/**
		 * Specify the background polarity.
		 * @param background
		 * @return this builder
		 */
		public Builder background(MaskBackground background) {
			params.background = Objects.requireNonNull(background);
			return this;
		}

		/**
		 * Specify whether shadows should be removed before segmentation.
		 * @param deshadow
		 * @return this builder
		 */
		public Builder deshadow(boolean deshadow) {
			params.deshadow = deshadow;
			return this;
		}

		/**
		 * Specify the Gabor wavelength, in pixels.
		 * @param wavelength
		 * @return this builder
		 */
		public Builder wavelength(double wavelength) {
			params.wavelength = wavelength;
			return this;
		}

		/**
		 * Specify the angle between filter orientations, in degrees.
		 * @param step
		 * @return this builder
		 */
		public Builder orientationStep(double step) {
			params.orientationStep = step;
			return this;
		}

		/**
		 * Specify the Gabor spatial-frequency bandwidth, in octaves.
		 * @param bandwidth
		 * @return this builder
		 */
		public Builder bandwidth(double bandwidth) {
			params.bandwidth = bandwidth;
			return this;
		}

		/**
		 * Specify the Gabor spatial aspect ratio.
		 * @param aspectRatio
		 * @return this builder
		 */
		public Builder aspectRatio(double aspectRatio) {
			params.aspectRatio = aspectRatio;
			return this;
		}

		/**
		 * Build the parameters.
		 * @return
		 * @throws IllegalArgumentException if any Gabor parameter is out of range
		 */
		public MaskParameters build() throws IllegalArgumentException {
			var built = new Builder(params).params;
			built.validate();
			return built;
		}

	}

}
