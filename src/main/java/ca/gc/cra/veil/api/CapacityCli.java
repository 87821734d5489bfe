package ca.gc.cra.veil.api;

import ca.gc.cra.veil.application.pipeline.CapacitySummary;
import ca.gc.cra.veil.config.CapacityConfig;
import ca.gc.cra.veil.config.CodecConfig;
import ca.gc.cra.veil.config.CompositionRoot;
import ca.gc.cra.veil.domain.capacity.CapacityReport;
import ca.gc.cra.veil.domain.capacity.ImageCapacityEstimate;
import ca.gc.cra.veil.logging.LoggingConfigurator;
import ca.gc.cra.veil.validation.Paths;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point for {@code veil capacity}: prints how much each payload kind fits in a carrier,
 * as a table or, with {@code --json}, as one JSON document.
 *
 * @since 0.1.0
 */
public final class CapacityCli {
  private static final Logger log = LoggerFactory.getLogger(CapacityCli.class);
  private static final String SUMMARY_USAGE =
      "usage: capacity in=IMG [type=text|file|image] [config=FILE.yaml] [--json]";
  private static final String HELP_TEXT = """
      VEIL capacity

      Usage:
        capacity in=cover.png [type=text|file|image] [--json]

      Required:
        in=PATH                Carrier image

      Optional:
        type=text|file|image   Report one payload kind only (default: all)
        config=FILE.yaml       Load defaults from the common and capacity sections
        --json                 Print a JSON document instead of a table
        --verbose              Enable DEBUG logging
        --help                 Show this message

      Notes:
        The safe figure is an advisory share of the available bytes (safeUsageFraction).
      """;

  private CapacityCli() {}

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
      log.debug("Verbose logging enabled for capacity CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("capacity", input, SUMMARY_USAGE, log);
    if (resolution.isFailure()) {
      return resolution.failure().get();
    }
    Map<String, String> effective = resolution.effective();
    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CodecConfig codecConfig;
    try {
      codecConfig = CodecConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid codec configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    CapacityConfig config;
    try {
      CapacityConfig parsed = CapacityConfig.fromMap(effective);
      config = new CapacityConfig(
          Paths.validateReadableFile("in", parsed.carrier()),
          parsed.type(),
          parsed.json() || input.hasFlag("--json"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid capacity arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CompositionRoot root = new CompositionRoot(codecConfig);
    try {
      CapacitySummary summary = root.capacityUseCase().run(config);
      if (config.json()) {
        CliPrinter.println(root.capacityReportJsonWriter().render(summary));
      } else {
        CliPrinter.printLines(renderTable(summary).toArray(String[]::new));
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid capacity arguments: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read carrier {}", config.carrier(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in capacity", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> renderTable(CapacitySummary summary) {
    List<String> lines = new ArrayList<>();
    lines.add("Carrier " + summary.carrier() + " (" + summary.width() + "x" + summary.height() + ")");
    summary.text().ifPresent(report -> lines.add(describe("Text", report)));
    summary.file().ifPresent(report -> lines.add(describe("File", report)));
    if (!summary.image().isEmpty()) {
      lines.add(" Image payloads (full precision, msb=8):");
      for (ImageCapacityEstimate estimate : summary.image()) {
        lines.add(String.format(Locale.ROOT,
            "  lsb=%d  %10.2f KiB  %,12d pixels  up to %dx%d",
            estimate.lsb(),
            estimate.availableKib(),
            estimate.maxHiddenPixels(),
            estimate.maxSquareSide(),
            estimate.maxSquareSide()));
      }
    }
    return lines;
  }

  private static String describe(String label, CapacityReport report) {
    return String.format(Locale.ROOT,
        " %s payloads: %,d bytes available (%,d bits reserved), %,d bytes recommended",
        label, report.availableBytes(), report.reservedBits(), report.safeUsageBytes());
  }
}
