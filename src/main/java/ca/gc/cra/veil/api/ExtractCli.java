package ca.gc.cra.veil.api;

import ca.gc.cra.veil.application.pipeline.ExtractResult;
import ca.gc.cra.veil.application.pipeline.ExtractUseCase;
import ca.gc.cra.veil.config.CodecConfig;
import ca.gc.cra.veil.config.CompositionRoot;
import ca.gc.cra.veil.config.ExtractConfig;
import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.error.StegoException;
import ca.gc.cra.veil.logging.LoggingConfigurator;
import ca.gc.cra.veil.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> CLI entry point for {@code veil extract}.
 * <p><strong>Role:</strong> Driving adapter around {@link ExtractUseCase}. Recovered text goes to
 * stdout; recovered files and images are written to disk and their paths printed.</p>
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String SUMMARY_USAGE =
      "usage: extract type=text|file|image in=PNG [outDir=DIR] [out=PNG] [config=FILE.yaml] "
          + "[--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      VEIL extract

      Usage:
        extract type=text  in=cover_steg.png
        extract type=file  in=cover_steg_file.png [outDir=./recovered]
        extract type=image in=cover_steg_img.png [out=secret.png]

      Required:
        type=text|file|image   Payload kind hidden in the image
        in=PATH                Stego image

      Optional:
        outDir=DIR             Directory for recovered_<name> (type=file; default next to in)
        out=PATH               Recovered image (type=image; default recovered_image.png next to in)
        config=FILE.yaml       Load defaults from the common and extract sections
        --dry-run              Validate inputs and print the plan without extracting
        --allow-overwrite      Replace an existing recovered file
        --verbose              Enable DEBUG logging
        --help                 Show this message

      Notes:
        Codec settings (header sizes, terminator length) must match the ones used to hide.
      """;

  private ExtractCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for extract CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("extract", input, SUMMARY_USAGE, log);
    if (resolution.isFailure()) {
      return resolution.failure().get();
    }
    Map<String, String> effective = resolution.effective();
    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    CodecConfig codecConfig;
    try {
      codecConfig = CodecConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid codec configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ExtractConfig config;
    try {
      config = validatePaths(ExtractConfig.fromMap(effective), allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    ExtractUseCase useCase = new CompositionRoot(codecConfig).extractUseCase();
    try {
      ExtractResult result = useCase.run(config, allowOverwrite);
      printResult(result);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (StegoException ex) {
      log.error("Extract failed: {}", ex.getMessage());
      return ExitCode.CODEC_FAILURE;
    } catch (IOException ex) {
      log.error("Extract I/O failure for carrier {}", config.carrier(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in extract", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExtractConfig validatePaths(ExtractConfig config, boolean allowOverwrite, boolean create) {
    Path carrier = Paths.validateReadableFile("in", config.carrier());
    ExtractConfig resolved = new ExtractConfig(config.type(), carrier, config.output(), config.outputDirectory());
    return switch (config.type()) {
      case TEXT -> resolved;
      case FILE -> new ExtractConfig(
          config.type(),
          carrier,
          Optional.empty(),
          Optional.of(Paths.validateWritableDir(resolved.effectiveOutputDirectory(), create)));
      case IMAGE -> new ExtractConfig(
          config.type(),
          carrier,
          Optional.of(Paths.validateOutputFile("out", resolved.effectiveImageOutput(), allowOverwrite, create)),
          Optional.empty());
    };
  }

  private static void printDryRunPlan(ExtractConfig config, boolean allowOverwrite) {
    String destination = switch (config.type()) {
      case TEXT -> "<stdout>";
      case FILE -> config.effectiveOutputDirectory().resolve("recovered_<name>").toString();
      case IMAGE -> config.effectiveImageOutput().toString();
    };
    CliPrinter.printLines(
        "Extract dry-run: nothing will be recovered.",
        " Payload type     : " + config.type(),
        " Stego image      : " + config.carrier(),
        " Destination      : " + destination,
        " Allow overwrite  : " + allowOverwrite,
        " Re-run without --dry-run to extract the payload.");
  }

  private static void printResult(ExtractResult result) {
    if (result.type() == PayloadType.TEXT) {
      CliPrinter.println(result.message().orElse(""));
      return;
    }
    CliPrinter.println("Recovered " + result.payloadBytes() + " bytes to " + result.output().map(Path::toString).orElse("?"));
    result.imageHeader().ifPresent(header -> CliPrinter.println(
        "Parameters: lsb=" + header.lsb() + ", msb=" + header.msb() + ", stride=" + header.stride()
            + " (payload " + header.width() + "x" + header.height() + ")"));
  }
}
