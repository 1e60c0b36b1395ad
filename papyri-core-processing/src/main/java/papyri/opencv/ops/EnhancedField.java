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

import java.io.IOException;

import org.bytedeco.opencv.opencv_core.Mat;

import papyri.lib.enhance.Postprocessing;
import papyri.opencv.color.ColorSpaces;

/**
 * The result of an {@link EnhancementOperator}, which can be rendered as an 8-bit image with different postprocessing.
 * <p>
 * If the context is masked, the background of the rendered image is restored from the original.
 *
 * @author Papyri developers
 */
public abstract class EnhancedField {

	private final EnhancementContext context;

	EnhancedField(EnhancementContext context) {
		this.context = context;
	}

	/**
	 * The context used to create the field.
	 * @return
	 */
	public EnhancementContext getContext() {
		return context;
	}

	/**
	 * Render the field as an 8-bit image.
	 * @param postprocessing
	 * @return an 8-bit RGB image (color) or single-channel image (grayscale)
	 * @throws IOException if the field relies on an external implementation that failed
	 */
	public abstract Mat render(Postprocessing postprocessing) throws IOException;

	/**
	 * Create a field from a new lightness; for color images the chromatic planes of the context are kept.
	 * @param context
	 * @param lightness lightness in [0, 1]
	 * @return
	 */
	static EnhancedField lightness(EnhancementContext context, Mat lightness) {
		return new LightnessField(context, lightness);
	}

	/**
	 * Create a field that applies a retinex method when rendered.
	 * @param context
	 * @param method
	 * @return
	 */
	static EnhancedField retinex(EnhancementContext context, String method) {
		return new RetinexField(context, method);
	}


	static class LightnessField extends EnhancedField {

		private final Mat lightness;

		LightnessField(EnhancementContext context, Mat lightness) {
			super(context);
			this.lightness = lightness;
		}

		@Override
		public Mat render(Postprocessing postprocessing) {
			var context = getContext();
			var mask = context.getMask();
			Mat l = postprocessing == Postprocessing.NONE ? lightness.clone() : ColorSpaces.negate(lightness);
			if (mask != null)
				l = replace(l, MaskedReinsertion.apply(l, context.getLightness(), mask));

			var lab = context.getLab();
			if (lab == null) {
				if (postprocessing == Postprocessing.BLUE_NEGATIVE)
					throw new IllegalArgumentException("Blue negative is not supported for grayscale images");
				var gray = ColorSpaces.quantize(l);
				l.close();
				return gray;
			}

			Mat a;
			Mat b;
			if (postprocessing == Postprocessing.BLUE_NEGATIVE) {
				a = ColorSpaces.negateChroma(lab.getA());
				b = ColorSpaces.negateChroma(lab.getB());
				if (mask != null) {
					a = replace(a, MaskedReinsertion.apply(a, lab.getA(), mask));
					b = replace(b, MaskedReinsertion.apply(b, lab.getB(), mask));
				}
			} else {
				a = lab.getA().clone();
				b = lab.getB().clone();
			}
			var rgb = ColorSpaces.labToRgb(l, a, b);
			l.close();
			a.close();
			b.close();
			return rgb;
		}

		private static Mat replace(Mat previous, Mat next) {
			previous.close();
			return next;
		}

	}


	static class RetinexField extends EnhancedField {

		private final String method;

		RetinexField(EnhancementContext context, String method) {
			super(context);
			this.method = method;
		}

		@Override
		public Mat render(Postprocessing postprocessing) throws IOException {
			var context = getContext();
			var provider = EnhancementContext.require(context.getRetinexProvider(), "Retinex provider");
			var input = context.getRgb();
			Mat output;
			try {
				output = provider.retinex(input, method, RetinexPostprocessing.of(postprocessing));
			} catch (RuntimeException e) {
				throw new IOException(provider.getName() + " failed for " + method + ": " + e.getLocalizedMessage(), e);
			}
			if (output == null)
				throw new IOException(provider.getName() + " returned no image for " + method);
			if (output.type() != input.type() || output.cols() != input.cols() || output.rows() != input.rows()) {
				output.close();
				throw new IOException(provider.getName() + " returned an image with the wrong size or type for " + method);
			}
			if (context.getMask() == null)
				return output;
			var result = MaskedReinsertion.apply(output, input, context.getMask());
			output.close();
			return result;
		}

	}

}
