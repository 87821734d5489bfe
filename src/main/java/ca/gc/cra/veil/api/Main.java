package ca.gc.cra.veil.api;

import ca.gc.cra.veil.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Top-level {@code veil} command dispatcher.
 * <p><strong>Role:</strong> Selects the subcommand from the first argument that is not a flag and
 * hands every other argument, flags included, to it.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: veil <hide|extract|capacity> [options]";
  private static final String HELP_TEXT = """
      VEIL image steganography

      Usage:
        veil <command> [key=value...] [flags]

      Commands:
        hide        Hide text, a file or an image in a carrier image (hide --help for details)
        extract     Recover a hidden payload from a stego image
        capacity    Report how much a carrier image can hold

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null) {
          continue;
        }
        String trimmed = arg.strip();
        if (command == null && !trimmed.isEmpty() && !trimmed.startsWith("-") && !trimmed.contains("=")) {
          command = trimmed.toLowerCase(Locale.ROOT);
        } else {
          delegate.add(arg);
        }
      }
    }

    if (command == null || "help".equals(command)) {
      CliInput input = CliInput.parse(args);
      if (input.help() || "help".equals(command)) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case "hide" -> HideCli.run(delegateArgs);
      case "extract" -> ExtractCli.run(delegateArgs);
      case "capacity" -> CapacityCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
