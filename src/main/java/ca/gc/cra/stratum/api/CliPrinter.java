package ca.gc.cra.stratum.api;

import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Standard output of the {@code stratum} command: resolved {@code name=value (source)} lines, help
 * and version text, and the usage line. Errors and warnings are logged to stderr instead, so
 * stdout stays parseable.
 *
 * @since 0.1.0
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(new BufferedWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8)));
  private static PrintWriter target = STDOUT;

  private CliPrinter() {}

  static void print(String line) {
    print(List.of(line));
  }

  /**
   * Writes a block of output and flushes it, so a block is never interleaved with log output.
   *
   * @param lines output lines, written in order
   */
  static void print(List<String> lines) {
    PrintWriter out = target;
    lines.forEach(out::println);
    out.flush();
  }

  /**
   * Sends output to another writer; {@code null} restores stdout.
   *
   * @param writer destination, or {@code null}
   */
  static void redirect(PrintWriter writer) {
    target = writer == null ? STDOUT : writer;
  }
}
