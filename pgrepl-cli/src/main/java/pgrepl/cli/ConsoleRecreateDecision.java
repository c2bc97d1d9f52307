package pgrepl.cli;

import pgrepl.schema.RecreateDecision;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Asks on the console whether existing tables should be dropped. Only {@code y} or {@code yes}
 * agrees; end of input declines.
 */
final class ConsoleRecreateDecision implements RecreateDecision {
  private final BufferedReader in;
  private final PrintWriter out;

  ConsoleRecreateDecision(BufferedReader in, PrintWriter out) {
    this.in = in;
    this.out = out;
  }

  @Override
  public boolean shouldRecreate(String database, List<String> existingTables) {
    out.println("Tables already exist in the " + database + " database: " + String.join(", ", existingTables));
    out.print("Do you want to drop and recreate the tables? (y/n): ");
    out.flush();
    String answer;
    try {
      answer = in.readLine();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read answer", e);
    }
    if (answer == null) {
      out.println();
      return false;
    }
    String normalized = answer.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("y") || normalized.equals("yes");
  }
}
