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

package papyri;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParseResult;
import papyri.lib.batch.BatchResult;
import papyri.lib.batch.BatchRunner;
import papyri.lib.common.GeneralTools;
import papyri.lib.enhance.BaseMethod;
import papyri.lib.enhance.EnhancementRequest;
import papyri.lib.enhance.MaskBackground;
import papyri.lib.images.writers.ExifToolIccEmbedder;
import papyri.lib.images.writers.FileImageSink;
import papyri.lib.io.GsonTools;
import papyri.lib.labels.DisplayOrder;
import papyri.logging.LogManager;
import papyri.logging.LogManager.LogLevel;
import papyri.opencv.color.GamutExpansion;
import papyri.opencv.color.IccProfiles;

/**
 * Main Papyri launcher.
 *
 * @author Papyri developers
 *
 */
@Command(name = "papyri", subcommands = {HelpCommand.class, EnhanceCommand.class},
	footer = {"",
			"Papyri is free software, distributed under the GNU General Public License v3."
			}, mixinStandardHelpOptions = true, versionProvider = Papyri.VersionProvider.class)
public class Papyri {

	private final static Logger logger = LoggerFactory.getLogger(Papyri.class);

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogLevel logLevel = LogLevel.INFO;

	@Option(names = {"--log-file"}, description = "Also write log messages to the specified file.", paramLabel = "file")
	private Path logFile;


	/**
	 * Main class to launch Papyri.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0)
			logger.debug("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}

	/**
	 * Parse the arguments and run any subcommand.
	 * @param args
	 * @return the exit code
	 */
	static int run(String... args) {
		var papyri = new Papyri();
		var cmd = createCommandLine(papyri);
		ParseResult pr;
		try {
			pr = cmd.parseArgs(args);
		} catch (Exception e) {
			logger.error("An error has occurred, please type -h to display help message.\n" + e.getLocalizedMessage());
			return 2;
		}

		// Catch -h/--help and -V/--version
		if (cmd.isUsageHelpRequested()) {
			cmd.usage(System.out);
			return 0;
		} else if (cmd.isVersionHelpRequested()) {
			cmd.printVersionHelp(System.out);
			return 0;
		}

		if (papyri.logLevel != null)
			LogManager.setRootLogLevel(papyri.logLevel);
		if (papyri.logFile != null)
			LogManager.logToFile(papyri.logFile.toFile());

		if (!pr.hasSubcommand()) {
			cmd.usage(System.out);
			return 0;
		}
		return cmd.execute(args);
	}

	static CommandLine createCommandLine(Papyri papyri) {
		CommandLine cmd = new CommandLine(papyri);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd;
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = GeneralTools.getVersion();
			if (version == null || version.isBlank())
				return new String[] {"Unknown Papyri version!"};
			if (!version.startsWith("v"))
				version = "v" + version;
			return new String[] {"Papyri " + version};
		}

	}

}


@Command(name = "enhance", description = {
		"Enhance the legibility of one or more images.",
		"Outputs are written to a subdirectory next to each image."},
		sortOptions = false)
class EnhanceCommand implements Callable<Integer> {

	final private static Logger logger = LoggerFactory.getLogger(EnhanceCommand.class);

	@Parameters(arity = "1..*", description = "Images to enhance.", paramLabel = "image")
	private List<Path> images = new ArrayList<>();

	@Option(names = {"-c", "--config"}, description = "JSON file containing the enhancement settings. Other options override its values.", paramLabel = "file")
	private Path config;

	@Option(names = {"-m", "--methods"}, split = ",", description = {"Base methods to apply.", "Options: ${COMPLETION-CANDIDATES}"}, paramLabel = "method")
	private List<BaseMethod> methods;

	@Option(names = {"-r", "--retinex"}, split = ",", description = "Retinex methods for color images, e.g. MSRCR-RGB,MSR-V.", paramLabel = "method")
	private List<String> retinexMethods;

	@Option(names = {"--negative"}, negatable = true, description = "Create negative variants.")
	private Boolean negative;

	@Option(names = {"--blue"}, negatable = true, description = "Create blue negative variants (color images only).")
	private Boolean blue;

	@Option(names = {"--mask"}, negatable = true, description = "Also create variants with the original background restored.")
	private Boolean mask;

	@Option(names = {"--background"}, description = {"Background polarity used for masking.", "Options: ${COMPLETION-CANDIDATES}"})
	private MaskBackground background;

	@Option(names = {"--deshadow"}, negatable = true, description = "Remove shading before computing the mask.")
	private Boolean deshadow;

	@Option(names = {"--red"}, negatable = true, description = "Process the red channel only.")
	private Boolean redChannel;

	@Option(names = {"--jpeg"}, negatable = true, description = "Write JPEG files.")
	private Boolean jpeg;

	@Option(names = {"--tiff"}, negatable = true, description = "Write TIFF files.")
	private Boolean tiff;

	@Option(names = {"-q", "--quality"}, description = "JPEG quality (0-100).", paramLabel = "quality")
	private Integer quality;

	@Option(names = {"-o", "--output-dir"}, description = "Name of the output subdirectory (default = enhanced).", paramLabel = "name")
	private String outputDirectory;

	@Option(names = {"--adobe-rgb-profile"}, description = "Adobe RGB (1998) ICC profile used for gamut expansion.", paramLabel = "file")
	private Path adobeProfile;

	@Option(names = {"--exiftool"}, description = "ExifTool executable used to embed ICC profiles in JPEG files.", paramLabel = "path")
	private String exiftool = ExifToolIccEmbedder.DEFAULT_EXECUTABLE;

	@Option(names = {"--order"}, description = {"Order used to list the variants of the first image.", "Options: ${COMPLETION-CANDIDATES}"})
	private DisplayOrder order = DisplayOrder.INTERLEAVED;

	@Option(names = {"--save-config"}, description = "Write the settings used to a JSON file.", paramLabel = "file")
	private Path saveConfig;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() throws IOException {
		EnhancementRequest request;
		try {
			request = buildRequest();
		} catch (IllegalArgumentException e) {
			logger.error(e.getLocalizedMessage());
			return 2;
		}
		if (saveConfig != null) {
			GsonTools.writeJson(saveConfig, request);
			logger.info("Settings written to {}", saveConfig);
		}

		var runner = BatchRunner.builder()
				.gamutExpansion(GamutExpansion.load(adobeProfile))
				.sink(new FileImageSink(IccProfiles.getSRGB(), new ExifToolIccEmbedder(exiftool)))
				.build();
		var result = runner.runBatch(request, images);
		report(result);
		if (result.getSummaries().isEmpty())
			return 1;
		return 0;
	}

	/**
	 * Build the request from the configuration file (if any) and the options.
	 * @return
	 * @throws IOException if the configuration file cannot be read
	 * @throws IllegalArgumentException if the request is invalid
	 */
	EnhancementRequest buildRequest() throws IOException, IllegalArgumentException {
		var base = config == null ? EnhancementRequest.getDefault() : EnhancementRequest.readJson(config);
		var builder = base.toBuilder();
		if (methods != null)
			builder.methods(methods.toArray(BaseMethod[]::new));
		if (retinexMethods != null)
			builder.retinexMethods(retinexMethods);
		if (negative != null)
			builder.negative(negative);
		if (blue != null)
			builder.blue(blue);
		if (mask != null)
			builder.mask(mask);
		if (background != null || deshadow != null) {
			var params = base.getMaskParameters().toBuilder();
			if (background != null)
				params.background(background);
			if (deshadow != null)
				params.deshadow(deshadow);
			builder.maskParameters(params.build());
		}
		if (redChannel != null)
			builder.redChannelOnly(redChannel);
		if (jpeg != null)
			builder.jpeg(jpeg);
		if (tiff != null)
			builder.tiff(tiff);
		if (quality != null)
			builder.jpegQuality(quality);
		if (outputDirectory != null)
			builder.outputDirectory(outputDirectory);
		return builder.build();
	}

	private void report(BatchResult result) {
		for (var summary : result.getSummaries())
			logger.info("{}: {} ({} variants)", summary.getPath().getFileName(), summary.getImageClass(), summary.getVariantCount());
		result.getFirstOutputSet().ifPresent(outputs -> {
			var ordered = outputs.reorder(result.isFirstImageGrayscale(), order);
			logger.info("Variants of the first image: {}", String.join(", ", ordered.getLabels()));
		});
		for (var status : result.getStatuses())
			logger.warn(status);
		if (result.isAborted())
			logger.warn("Enhancement cancelled");
	}

}
