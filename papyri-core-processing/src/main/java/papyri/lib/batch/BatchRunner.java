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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import papyri.imagej.tools.ImageReaders;
import papyri.lib.common.GeneralTools;
import papyri.lib.enhance.EnhancementRequest;
import papyri.lib.images.OutputSet;
import papyri.lib.images.writers.ExifToolIccEmbedder;
import papyri.lib.images.writers.FileImageSink;
import papyri.lib.images.writers.ImageSink;
import papyri.lib.images.writers.OutputNaming;
import papyri.lib.plugins.CancellationHandler;
import papyri.lib.plugins.CancellationToken;
import papyri.opencv.classify.ClassifiedImage;
import papyri.opencv.classify.ImageClassifier;
import papyri.opencv.color.GamutExpansion;
import papyri.opencv.color.IccProfiles;
import papyri.opencv.ops.EnhancementContext;
import papyri.opencv.ops.EnhancementOperators;
import papyri.opencv.ops.ExpansionState;
import papyri.opencv.ops.RetinexProvider;
import papyri.opencv.ops.VariantExpander;
import papyri.opencv.segment.BackgroundSegmenter;
import papyri.opencv.tools.OpenCVTools;

/**
 * Apply an {@link EnhancementRequest} to a list of images, one after another.
 * <p>
 * Outputs are written to a subdirectory of each image's directory. Unreadable images are logged and skipped.
 * The outputs of the first image that can be read are also returned for display.
 *
 * @author Papyri developers
 */
public class BatchRunner {

	private final static Logger logger = LoggerFactory.getLogger(BatchRunner.class);

	private final GamutExpansion gamut;
	private final RetinexProvider retinexProvider;
	private final ImageSink sink;
	private final CancellationToken token;
	private final CancellationHandler handler;

	private BatchRunner(Builder builder) {
		this.gamut = builder.gamut == null ? GamutExpansion.load(null) : builder.gamut;
		this.retinexProvider = builder.findRetinex ? RetinexProvider.findProvider() : builder.retinexProvider;
		this.sink = builder.sink == null ? new FileImageSink(IccProfiles.getSRGB(), new ExifToolIccEmbedder()) : builder.sink;
		this.token = builder.token == null ? new CancellationToken() : builder.token;
		this.handler = builder.handler == null ? CancellationHandler.alwaysAbort() : builder.handler;
		if (retinexProvider != null)
			logger.debug("Using retinex implementation {}", retinexProvider.getName());
	}

	/**
	 * Create a runner with default settings.
	 * @return
	 */
	public static BatchRunner createDefault() {
		return builder().build();
	}

	/**
	 * Create a builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Token that can be used to request cancellation while a batch is running.
	 * @return
	 */
	public CancellationToken getCancellationToken() {
		return token;
	}

	/**
	 * Run a batch.
	 * @param request
	 * @param inputs input image paths
	 * @return
	 * @throws IllegalArgumentException if the request is invalid; no image is processed in this case
	 */
	public BatchResult runBatch(EnhancementRequest request, List<Path> inputs) throws IllegalArgumentException {
		Objects.requireNonNull(request);
		request.validate();

		var expander = new VariantExpander(request, sink, token, handler);
		Set<String> statuses = new LinkedHashSet<>();
		gamut.getWarning().ifPresent(statuses::add);

		List<ImageSummary> summaries = new ArrayList<>();
		List<UnreadableImage> unreadable = new ArrayList<>();
		Map<Path, ErrorLog> errorLogs = new LinkedHashMap<>();
		OutputSet firstOutputs = null;
		boolean firstGrayscale = false;
		boolean aborted = false;

		int position = 0;
		for (var path : inputs) {
			position++;
			var outputDir = path.toAbsolutePath().getParent().resolve(request.getOutputDirectory());
			try {
				Files.createDirectories(outputDir);
			} catch (IOException e) {
				logger.error("Unable to create output directory {}: {}", outputDir, e.getLocalizedMessage(), e);
				statuses.add("Unable to create output directory " + outputDir);
				continue;
			}
			var errorLog = errorLogs.computeIfAbsent(outputDir, ErrorLog::new);

			try (var scope = new PointerScope()) {
				Mat mat;
				try {
					mat = ImageReaders.readMat(path);
				} catch (IOException e) {
					logger.warn("Unable to read image {} ({}): {}", position, path, e.getLocalizedMessage());
					var entry = new UnreadableImage(position, path);
					unreadable.add(entry);
					writeLog(errorLog, entry, statuses);
					continue;
				}

				boolean retain = firstOutputs == null;
				logger.info("Processing image {}/{}: {}", position, inputs.size(), path);
				ClassifiedImage classified;
				BufferedImage original;
				ExpansionState state;
				try {
					classified = ImageClassifier.classify(mat, request.isRedChannelOnly());
					// The classified Mat is released once the context has been created
					original = retain ? OpenCVTools.matToBufferedImage(classified.getImage()) : null;
					state = processImage(expander, request, classified, path, outputDir, ExpansionState.initial(retain));
				} catch (RuntimeException e) {
					logger.error("Unable to process image {} ({}): {}", position, path, e.getLocalizedMessage(), e);
					statuses.add("Unable to process " + path.getFileName() + ": " + e.getLocalizedMessage());
					continue;
				}
				statuses.addAll(state.getStatuses());

				var outputs = state.getOutputSet();
				summaries.add(new ImageSummary(position, path, classified.getImageClass(), outputs.getLabels()));
				if (retain) {
					firstGrayscale = classified.isGrayscale();
					if (!outputs.isEmpty())
						outputs = outputs.withOriginal(original);
					firstOutputs = outputs;
				}
				if (state.isStopped()) {
					aborted = true;
					break;
				}
			}
		}

		for (var log : errorLogs.values()) {
			try {
				log.deleteIfEmpty();
			} catch (IOException e) {
				logger.warn("Unable to delete {}: {}", log.getPath(), e.getLocalizedMessage());
			}
		}

		if (!unreadable.isEmpty())
			statuses.add(unreadable.size() + "/" + inputs.size() + " unreadable image" + GeneralTools.pluralSuffix(unreadable.size()));

		if (aborted)
			logger.info("Batch aborted after {} images", summaries.size());
		else
			logger.info("Batch complete: {} images processed, {} unreadable", summaries.size(), unreadable.size());
		return new BatchResult(firstOutputs, firstGrayscale, summaries, unreadable, new ArrayList<>(statuses), aborted);
	}

	private ExpansionState processImage(VariantExpander expander, EnhancementRequest request, ClassifiedImage classified,
			Path path, Path outputDir, ExpansionState state) {
		var naming = OutputNaming.forImage(path, outputDir, classified.isRedChannel(), request.getMaskParameters());
		var context = EnhancementContext.create(classified, gamut, retinexProvider);
		if (request.doMask() && hasSupportedOperator(request, context)) {
			var segmenter = new BackgroundSegmenter(request.getMaskParameters());
			var mask = segmenter.segment(context.getLightness(), context.isGrayscale() ? null : context.getRgb());
			try {
				sink.writeMask(mask.toBinaryImage(), naming.maskFile());
			} catch (IOException e) {
				logger.error("Unable to write mask {}: {}", naming.maskFile(), e.getLocalizedMessage(), e);
				state = state.withStatus("Unable to write " + naming.maskFile().getFileName());
			}
			state = expander.expand(context.withMask(mask), naming, state);
			if (state.isStopped())
				return state;
		}
		return expander.expand(context, naming, state);
	}

	/**
	 * Check if any requested operator can be applied, so that a mask is only computed when it will be used.
	 */
	private static boolean hasSupportedOperator(EnhancementRequest request, EnhancementContext context) {
		return EnhancementOperators.createOperators(request, context.isGrayscale())
				.stream()
				.anyMatch(op -> op.supports(context.getImageClass()));
	}

	private static void writeLog(ErrorLog errorLog, UnreadableImage entry, Set<String> statuses) {
		try {
			errorLog.append(entry);
		} catch (IOException e) {
			logger.error("Unable to write {}: {}", errorLog.getPath(), e.getLocalizedMessage(), e);
			statuses.add("Unable to write " + ErrorLog.FILE_NAME);
		}
	}


	/**
	 * Builder for {@link BatchRunner}.
	 */
	public static class Builder {

		private GamutExpansion gamut;
		private boolean findRetinex = true;
		private RetinexProvider retinexProvider;
		private ImageSink sink;
		private CancellationToken token;
		private CancellationHandler handler;

		private Builder() {}

		/**
		 * Specify the gamut expansion for color images.
		 * If not set, {@link GamutExpansion#load(Path)} is used with the default Adobe RGB profile.
		 * @param gamut
		 * @return this builder
		 */
		public Builder gamutExpansion(GamutExpansion gamut) {
			this.gamut = gamut;
			return this;
		}

		/**
		 * Specify the retinex implementation. If not set, one is found with {@link RetinexProvider#findProvider()}.
		 * @param provider the provider; may be null to disable retinex
		 * @return this builder
		 */
		public Builder retinexProvider(RetinexProvider provider) {
			this.retinexProvider = provider;
			this.findRetinex = false;
			return this;
		}

		/**
		 * Specify where outputs are written. If not set, a {@link FileImageSink} is used.
		 * @param sink
		 * @return this builder
		 */
		public Builder sink(ImageSink sink) {
			this.sink = sink;
			return this;
		}

		/**
		 * Specify the cancellation token.
		 * @param token
		 * @return this builder
		 */
		public Builder cancellationToken(CancellationToken token) {
			this.token = token;
			return this;
		}

		/**
		 * Specify what happens when cancellation is requested. If not set, the batch is aborted.
		 * @param handler
		 * @return this builder
		 */
		public Builder cancellationHandler(CancellationHandler handler) {
			this.handler = handler;
			return this;
		}

		/**
		 * Build the runner.
		 * @return
		 */
		public BatchRunner build() {
			return new BatchRunner(this);
		}

	}

}
