package ca.gc.cra.dart.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Stdout writer for usage text, dry-run plans, and reports printed to the console.
 *
 * <p>Writes through the native stdout descriptor in UTF-8 so report output is independent of
 * {@code System.out} redirection by logging setups. Tests swap the writer.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints each argument on its own line.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints a multi-line document verbatim and flushes.
   *
   * @param document text whose line breaks are already in place
   */
  public static void printDocument(String document) {
    PrintWriter writer = writer();
    writer.print(document);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
