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

package papyri.opencv.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.EnhancementRequest;
import papyri.lib.enhance.RetinexMethods;
import papyri.opencv.classify.ImageClass;
import papyri.opencv.color.ColorSpaces;
import papyri.opencv.tools.OpenCVTools;

/**
 * Static factory methods for the base {@link EnhancementOperator}s.
 *
 * @author Papyri developers
 */
public class EnhancementOperators {

	private EnhancementOperators() {
		throw new AssertionError();
	}

	/**
	 * Operator that replaces the lightness with the norm of the CIELAB triple. Color images only.
	 * @return
	 */
	public static EnhancementOperator vividness() {
		return new VividnessOperator();
	}

	/**
	 * Operator that blends inverted lightness with a saturation/value contrast from HSV. Color images only.
	 * @return
	 */
	public static EnhancementOperator lsv() {
		return new LsvOperator();
	}

	/**
	 * Operator that applies contrast-limited adaptive histogram equalization to the lightness or intensity.
	 * @return
	 */
	public static EnhancementOperator adapthisteq() {
		return new AdapthisteqOperator(AdaptiveHistogramEqualization.createDefault());
	}

	/**
	 * Operator that delegates to a {@link RetinexProvider}.
	 * @param method name of the retinex method
	 * @return
	 */
	public static EnhancementOperator retinex(String method) {
		return new RetinexOperator(method);
	}

	/**
	 * Create the operators requested, in the order they are applied.
	 * <p>
	 * For grayscale images, retinex uses only {@link RetinexMethods#getGrayscaleMethod()}.
	 * Operators that do not support the image class are included; callers should check
	 * {@link EnhancementOperator#supports(ImageClass)}.
	 *
	 * @param request
	 * @param grayscale
	 * @return
	 */
	public static List<EnhancementOperator> createOperators(EnhancementRequest request, boolean grayscale) {
		List<EnhancementOperator> operators = new ArrayList<>();
		for (var method : request.getEnabledMethods()) {
			switch (method) {
			case VIVIDNESS:
				operators.add(vividness());
				break;
			case LSV:
				operators.add(lsv());
				break;
			case ADAPTHISTEQ:
				operators.add(adapthisteq());
				break;
			case RETINEX:
				if (grayscale)
					operators.add(retinex(RetinexMethods.getGrayscaleMethod()));
				else {
					for (var name : request.getRetinexMethods())
						operators.add(retinex(name));
				}
				break;
			default:
				throw new IllegalArgumentException("Unknown method " + method);
			}
		}
		return Collections.unmodifiableList(operators);
	}

	/**
	 * Get the background of a masked context as a Mat suitable for excluding pixels from statistics.
	 * @param context
	 * @return the mask, or null if the context is not masked
	 */
	static Mat backgroundOrNull(EnhancementContext context) {
		return context.isMasked() ? context.getMask().getMat() : null;
	}


	abstract static class AbstractLightnessOperator implements EnhancementOperator {

		private final BaseMethod method;

		AbstractLightnessOperator(BaseMethod method) {
			this.method = method;
		}

		@Override
		public BaseMethod getMethod() {
			return method;
		}

		@Override
		public boolean supports(ImageClass imageClass) {
			return method.supportsGrayscale() || !imageClass.isGrayscale();
		}

		@Override
		public EnhancedField apply(EnhancementContext context) {
			if (!supports(context.getImageClass()))
				throw new IllegalArgumentException(method.getLabel() + " does not support " + context.getImageClass());
			return EnhancedField.lightness(context, computeLightness(context));
		}

		/**
		 * Compute the new lightness, in [0, 1].
		 * @param context
		 * @return
		 */
		protected abstract Mat computeLightness(EnhancementContext context);

		@Override
		public String toString() {
			return method.getLabel();
		}

	}


	static class VividnessOperator extends AbstractLightnessOperator {

		VividnessOperator() {
			super(BaseMethod.VIVIDNESS);
		}

		@Override
		protected Mat computeLightness(EnhancementContext context) {
			var lab = context.getLab();
			var norm = new Mat();
			try (var scope = new PointerScope()) {
				var sum = new Mat();
				var temp = new Mat();
				opencv_core.multiply(lab.getL(), lab.getL(), sum);
				opencv_core.multiply(lab.getA(), lab.getA(), temp);
				opencv_core.add(sum, temp, sum);
				opencv_core.multiply(lab.getB(), lab.getB(), temp);
				opencv_core.add(sum, temp, sum);
				opencv_core.sqrt(sum, norm);
			}
			var background = backgroundOrNull(context);
			var result = ColorSpaces.rescale(norm, background);
			norm.close();
			if (background != null)
				background.close();
			return result;
		}

	}


	static class LsvOperator extends AbstractLightnessOperator {

		LsvOperator() {
			super(BaseMethod.LSV);
		}

		@Override
		protected Mat computeLightness(EnhancementContext context) {
			var background = backgroundOrNull(context);
			var hsv = ColorSpaces.rgbToHsv(context.getRgb());
			var saturationInverted = ColorSpaces.negate(hsv.get(1));
			var diff = new Mat();
			opencv_core.absdiff(hsv.get(2), saturationInverted, diff);
			var sv = ColorSpaces.rescale(diff, background);
			hsv.forEach(Mat::close);
			saturationInverted.close();
			diff.close();

			var lightnessInverted = new Mat();
			context.getLab().getL().convertTo(lightnessInverted, opencv_core.CV_32F, -1.0, 100.0);
			var lightness = ColorSpaces.rescale(lightnessInverted, background);
			lightnessInverted.close();

			var mean = new Mat();
			opencv_core.addWeighted(lightness, 0.5, sv, 0.5, 0.0, mean);
			var result = ColorSpaces.negate(mean);
			mean.close();
			lightness.close();
			sv.close();
			if (background != null)
				background.close();
			return result;
		}

	}


	static class AdapthisteqOperator extends AbstractLightnessOperator {

		private final AdaptiveHistogramEqualization clahe;

		AdapthisteqOperator(AdaptiveHistogramEqualization clahe) {
			super(BaseMethod.ADAPTHISTEQ);
			this.clahe = Objects.requireNonNull(clahe);
		}

		@Override
		protected Mat computeLightness(EnhancementContext context) {
			var lightness = context.getLightness().clone();
			var background = backgroundOrNull(context);
			if (background != null)
				OpenCVTools.fill(lightness, background, 0);
			var rescaled = ColorSpaces.rescale(lightness, null);
			lightness.close();
			var equalized = clahe.apply(rescaled);
			rescaled.close();
			var result = ColorSpaces.rescale(equalized, null);
			equalized.close();
			if (background != null)
				background.close();
			return result;
		}

	}


	static class RetinexOperator implements EnhancementOperator {

		private final String method;

		RetinexOperator(String method) {
			this.method = Objects.requireNonNull(method);
		}

		@Override
		public BaseMethod getMethod() {
			return BaseMethod.RETINEX;
		}

		@Override
		public String getRetinexMethod() {
			return method;
		}

		@Override
		public boolean supports(ImageClass imageClass) {
			if (imageClass.isGrayscale())
				return RetinexMethods.getGrayscaleMethod().equals(method);
			return RetinexMethods.isColorMethod(method);
		}

		@Override
		public EnhancedField apply(EnhancementContext context) {
			if (!supports(context.getImageClass()))
				throw new IllegalArgumentException("Retinex " + method + " does not support " + context.getImageClass());
			return EnhancedField.retinex(context, method);
		}

		@Override
		public String toString() {
			return "Retinex " + method;
		}

	}

}
