package ca.gc.cra.conduit.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text and command results.
 *
 * <p>Writes through the native stdout descriptor rather than {@code System.out}. The {@code connect} command owns
 * stdout for tunnel payload, so it only prints here before the relay starts.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints each line in order.
   *
   * @param lines lines to emit; {@code null} prints nothing
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
