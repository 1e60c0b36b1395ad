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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.EnhancementRequest;
import papyri.lib.images.writers.ImageSink;
import papyri.lib.images.writers.OutputNaming;
import papyri.lib.labels.MethodLabel;
import papyri.lib.plugins.CancellationHandler;
import papyri.lib.plugins.CancellationHandler.Decision;
import papyri.lib.plugins.CancellationToken;
import papyri.opencv.tools.OpenCVTools;

/**
 * Generate every requested variant for one image.
 * <p>
 * Operators are applied in their fixed order; for each, the primary variant is followed by the negative and
 * blue negative (where enabled). Each variant is written to an {@link ImageSink} and recorded in the
 * {@link ExpansionState}. Cancellation is checked after every variant.
 *
 * @author Papyri developers
 */
public class VariantExpander {

	private final static Logger logger = LoggerFactory.getLogger(VariantExpander.class);

	/**
	 * Status when color-only methods were requested for a grayscale image.
	 */
	public static final String GRAYSCALE_WARNING = "The selected methods do not support grayscale images. Please select Adapthisteq and/or Retinex.";

	/**
	 * Status when retinex was requested, but no implementation is available.
	 */
	public static final String NO_RETINEX_WARNING = "No retinex implementation available, retinex methods skipped.";

	/**
	 * Status when an ICC profile could not be embedded.
	 */
	public static final String NO_ICC_WARNING = "No ICC color profiles embedded in JPEG files.";

	private final EnhancementRequest request;
	private final ImageSink sink;
	private final CancellationToken token;
	private final CancellationHandler handler;

	/**
	 * Create an expander.
	 * @param request the enhancement request
	 * @param sink sink for writing variants; may be null if nothing should be written
	 * @param token cancellation token
	 * @param handler handler called when cancellation is requested
	 */
	public VariantExpander(EnhancementRequest request, ImageSink sink, CancellationToken token, CancellationHandler handler) {
		this.request = Objects.requireNonNull(request);
		this.sink = sink;
		this.token = Objects.requireNonNull(token);
		this.handler = Objects.requireNonNull(handler);
	}

	/**
	 * Generate the variants for an image, masked if the context has a mask.
	 * @param context the image context
	 * @param naming output naming for the image; may be null if nothing should be written
	 * @param state the current state
	 * @return the updated state
	 */
	public ExpansionState expand(EnhancementContext context, OutputNaming naming, ExpansionState state) {
		boolean grayscale = context.isGrayscale();
		boolean masked = context.isMasked();
		var postprocessing = request.getPostprocessing(grayscale);

		for (var op : EnhancementOperators.createOperators(request, grayscale)) {
			if (state.isStopped())
				break;
			if (!op.supports(context.getImageClass())) {
				logger.warn("{} does not support {} images", op, context.getImageClass());
				if (grayscale)
					state = state.withStatus(GRAYSCALE_WARNING);
				continue;
			}
			if (op.getMethod() == BaseMethod.RETINEX && context.getRetinexProvider() == null) {
				logger.warn("Skipping {}: no retinex implementation available", op);
				state = state.withStatus(NO_RETINEX_WARNING);
				continue;
			}
			logger.debug("Applying {} to {}", op, context);
			var field = op.apply(context);
			for (var post : postprocessing) {
				var label = op.getLabel(post, masked);
				BufferedImage img;
				try {
					var mat = field.render(post);
					img = OpenCVTools.matToBufferedImage(mat);
					mat.close();
				} catch (IOException e) {
					logger.warn("Unable to apply {}: {}", label, e.getLocalizedMessage());
					logger.debug(e.getLocalizedMessage(), e);
					state = state.withStatus("Unable to apply " + label.getDisplayLabel() + ": " + e.getLocalizedMessage());
					break;
				}
				state = write(img, label, naming, grayscale, state);
				state = state.withOutput(label.getDisplayLabel(), img);
				state = checkCancellation(state);
				if (state.isStopped())
					break;
			}
		}
		return state;
	}

	private ExpansionState write(BufferedImage img, MethodLabel label, OutputNaming naming, boolean grayscale, ExpansionState state) {
		if (sink == null || naming == null)
			return state;
		var base = naming.variantBase(label);
		for (var format : request.getOutputFormats()) {
			try {
				if (!sink.write(img, base, format, request.getJpegQuality(), !grayscale))
					state = state.withStatus(NO_ICC_WARNING);
			} catch (IOException e) {
				var path = ImageSink.resolve(base, format);
				logger.error("Unable to write {}: {}", path, e.getLocalizedMessage(), e);
				state = state.withStatus("Unable to write " + path.getFileName());
			}
		}
		return state;
	}

	private ExpansionState checkCancellation(ExpansionState state) {
		if (!token.isCancellationRequested())
			return state;
		var decision = handler.onCancellationRequested();
		if (decision == Decision.ABORT) {
			logger.info("Enhancement cancelled");
			return state.stop();
		}
		logger.debug("Cancellation request ignored, resuming");
		token.reset();
		return state;
	}

}
