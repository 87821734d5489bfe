package ca.gc.cra.veil.api;

import ca.gc.cra.veil.application.pipeline.HideResult;
import ca.gc.cra.veil.application.pipeline.HideUseCase;
import ca.gc.cra.veil.config.CodecConfig;
import ca.gc.cra.veil.config.CompositionRoot;
import ca.gc.cra.veil.config.HideConfig;
import ca.gc.cra.veil.config.PayloadType;
import ca.gc.cra.veil.domain.error.StegoException;
import ca.gc.cra.veil.domain.header.ImageHeader;
import ca.gc.cra.veil.logging.LoggingConfigurator;
import ca.gc.cra.veil.logging.Logs;
import ca.gc.cra.veil.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> CLI entry point for {@code veil hide}.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, validates paths and runs
 * {@link HideUseCase}.</p>
 * <p><strong>Exit codes:</strong> {@link ExitCode#INVALID_ARGS} for bad arguments or paths,
 * {@link ExitCode#CODEC_FAILURE} when the payload does not fit, {@link ExitCode#IO_ERROR} when a
 * file cannot be read or written.</p>
 *
 * @since 0.1.0
 */
public final class HideCli {
  private static final Logger log = LoggerFactory.getLogger(HideCli.class);
  private static final String SUMMARY_USAGE =
      "usage: hide type=text|file|image in=IMG (message=TEXT|secret=PATH) [out=PNG] "
          + "[lsb=1..8] [msb=1..8] [stride=X] [config=FILE.yaml] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      VEIL hide

      Usage:
        hide type=text  in=cover.png message="meet at noon"
        hide type=file  in=cover.png secret=report.pdf
        hide type=image in=cover.png secret=photo.png [lsb=N msb=N] [stride=X]

      Required:
        type=text|file|image   Payload kind
        in=PATH                Carrier image (PNG, BMP, GIF or JPEG; written back as PNG)
        message=TEXT           Message to hide (type=text)
        secret=PATH            File or image to hide (type=file, type=image)

      Optional:
        out=PATH               Stego image (default <carrier>_steg.png, _steg_file.png or _steg_img.png)
        lsb=1..8               Carrier bits per channel (type=image)
        msb=1..8               Payload bits kept per channel (type=image)
        stride=X               Carrier slots per payload slot, X >= 1 (type=image; needs lsb or msb)
        config=FILE.yaml       Load defaults from the common and hide sections
        --dry-run              Validate inputs and print the plan without writing
        --allow-overwrite      Replace an existing output file
        --verbose              Enable DEBUG logging
        --help                 Show this message

      Notes:
        Without lsb and msb the image variant picks the lowest lsb and highest msb that fit.
        Save stego images losslessly; any re-encoding destroys the hidden bits.
      """;

  private HideCli() {}

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
      log.debug("Verbose logging enabled for hide CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("hide", input, SUMMARY_USAGE, log);
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

    HideConfig config;
    try {
      config = validatePaths(HideConfig.fromMap(effective), allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid hide arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, codecConfig, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    HideUseCase useCase = new CompositionRoot(codecConfig).hideUseCase();
    try {
      HideResult result = useCase.run(config);
      printResult(result);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid hide arguments: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (StegoException ex) {
      log.error("Hide failed: {}", ex.getMessage());
      return ExitCode.CODEC_FAILURE;
    } catch (IOException ex) {
      log.error("Hide I/O failure for carrier {}", config.carrier(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in hide", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static HideConfig validatePaths(HideConfig config, boolean allowOverwrite, boolean createParents) {
    Path carrier = Paths.validateReadableFile("in", config.carrier());
    Optional<Path> secret = config.secret().map(path -> Paths.validateReadableFile("secret", path));
    Path output = Paths.validateOutputFile("out", config.effectiveOutput(), allowOverwrite, createParents);
    if (output.equals(carrier)) {
      throw new IllegalArgumentException("out must differ from in: " + output);
    }
    return new HideConfig(
        config.type(),
        carrier,
        Optional.of(output),
        config.message(),
        secret,
        config.lsb(),
        config.msb(),
        config.stride());
  }

  private static void printDryRunPlan(HideConfig config, CodecConfig codecConfig, boolean allowOverwrite) {
    String depths = config.automaticDepths()
        ? "automatic"
        : "lsb=" + config.lsb().orElse(codecConfig.defaultLsb())
            + ", msb=" + config.msb().orElse(codecConfig.defaultMsb());
    CliPrinter.printLines(
        "Hide dry-run: no files will be written.",
        " Payload type     : " + config.type(),
        " Carrier          : " + config.carrier(),
        " Secret           : " + config.secret().map(Path::toString)
            .orElseGet(() -> config.message().map(Logs::redact).orElse("<none>")),
        " Output           : " + config.effectiveOutput(),
        " Depths           : " + (config.type() == PayloadType.IMAGE ? depths : "lsb=1"),
        " Stride           : " + (config.stride().isPresent() ? config.stride().getAsDouble() : "<optimal>"),
        " Allow overwrite  : " + allowOverwrite,
        " Re-run without --dry-run to hide the payload.");
  }

  private static void printResult(HideResult result) {
    CliPrinter.println("Hid " + result.type().name().toLowerCase(Locale.ROOT)
        + " payload (" + result.payloadBytes() + " bytes) in " + result.output());
    result.imageHeader().map(HideCli::describe).ifPresent(CliPrinter::println);
  }

  private static String describe(ImageHeader header) {
    return "Parameters: lsb=" + header.lsb() + ", msb=" + header.msb() + ", stride=" + header.stride()
        + " (payload " + header.width() + "x" + header.height() + ")";
  }
}
