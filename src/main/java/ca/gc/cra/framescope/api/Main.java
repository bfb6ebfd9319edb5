package ca.gc.cra.framescope.api;

import ca.gc.cra.framescope.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command dispatcher for the {@code framescope} executable. */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: framescope <replay> [options]";
  private static final String HELP_TEXT = """
      FrameScope command dispatcher

      Usage:
        framescope <command> [options]

      Commands:
        replay      Feed a recorded frame log through an observer and print the session summary

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, indexOf(args, remainder[0]) + 1, args.length);
    if ("replay".equals(command)) {
      return ReplayCli.run(delegateArgs);
    }
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }

  private static int indexOf(String[] args, String token) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(token)) {
        return i;
      }
    }
    return args.length - 1;
  }
}
