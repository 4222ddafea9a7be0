package ca.gc.cra.dart.api;

import ca.gc.cra.dart.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DART command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: dart <analyze> [options]";
  private static final String HELP_TEXT = """
      DART command dispatcher

      Usage:
        dart <command> [options]

      Commands:
        analyze     Deadline compliance report from client logs and qlog traces (analyze --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(tokens);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    // flags before the command apply to the dispatcher, the rest go to the command
    CliInput global = CliInput.parse(Arrays.copyOfRange(tokens, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, commandIndex + 1, tokens.length);

    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] tokens) {
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i];
      if (token == null || token.isBlank()) {
        continue;
      }
      String trimmed = token.trim();
      if (!trimmed.startsWith("-") && !trimmed.equalsIgnoreCase("help") && !trimmed.contains("=")) {
        return i;
      }
    }
    return -1;
  }
}
