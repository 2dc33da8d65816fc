// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pushdown.demo;

import com.github.pushdown.PushdownLogger;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.stream.Collectors;

/// Runs one of the demo recognizers over the words given on the command line and prints `ACCEPT` or `REJECT` for
/// each:
///
/// ```
/// java com.github.pushdown.demo.RecognizerMain parens "(())" ")("
///```
///
/// Set the `LOG_LEVEL` environment variable, for example to `FINEST`, to see every step.
public class RecognizerMain {

  static final int USAGE = 2;

  static final Map<String, Recognizer> RECOGNIZERS = List.<Recognizer>of(
          new BalancedParentheses(),
          new EqualCounts(),
          new MarkedPalindrome())
      .stream()
      .collect(Collectors.toMap(Recognizer::name, Function.identity()));

  public static void main(String[] args) {
    configureLogging(Optional.ofNullable(System.getenv("LOG_LEVEL")).orElse("WARNING"), System.err);
    System.exit(run(args, System.out, System.err));
  }

  /// @return the process exit code.
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length < 1 || !RECOGNIZERS.containsKey(args[0])) {
      err.println("usage: RecognizerMain <" + String.join("|", RECOGNIZERS.keySet().stream().sorted().toList()) + "> <word>...");
      return USAGE;
    }
    final var recognizer = RECOGNIZERS.get(args[0]);
    Arrays.stream(args, 1, args.length).forEach(word -> {
      final var result = recognizer.run(word);
      final var verdict = result.outcome().map(Enum::name).orElse("UNRESOLVED");
      out.println(verdict + "\t" + word);
    });
    return 0;
  }

  /// Send the library log to the console at the named level. An unknown level is reported and logging is left as it is.
  ///
  /// @return the level now in use, or empty if the name was not a level.
  static Optional<Level> configureLogging(String levelName, PrintStream err) {
    final Level level;
    try {
      level = Level.parse(levelName);
    } catch (IllegalArgumentException e) {
      err.println("Ignoring unknown LOG_LEVEL " + levelName + ": " + e.getMessage());
      return Optional.empty();
    }
    final Logger logger = PushdownLogger.LOGGER;
    final var handler = new ConsoleHandler();
    handler.setLevel(level);
    handler.setFormatter(new SimpleFormatter() {
      @Override
      public String format(LogRecord record) {
        return String.format("[%s] %s%n", record.getLevel().getName(), record.getMessage());
      }
    });
    logger.setLevel(level);
    logger.addHandler(handler);
    logger.setUseParentHandlers(false);
    return Optional.of(level);
  }
}
