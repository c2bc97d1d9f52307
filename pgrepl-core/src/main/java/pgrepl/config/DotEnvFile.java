package pgrepl.config;

import pgrepl.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reader for {@code .env} files: {@code KEY=VALUE} lines, {@code #} comments, blank lines,
 * an optional {@code export } prefix and optional matching single or double quotes around the
 * value. Later duplicates win.
 */
public final class DotEnvFile {

  private DotEnvFile() {}

  /**
   * @throws ConfigurationException if the file cannot be read or a line is malformed
   */
  public static Map<String, String> read(Path path) {
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read " + path, e);
    }
    return parse(lines, path.toString());
  }

  static Map<String, String> parse(List<String> lines, String origin) {
    Map<String, String> values = new LinkedHashMap<>();
    int lineNo = 0;
    for (String raw : lines) {
      lineNo++;
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).stripLeading();
      }
      int eq = line.indexOf('=');
      if (eq <= 0) {
        throw new ConfigurationException(origin + ":" + lineNo + ": expected KEY=VALUE");
      }
      String key = line.substring(0, eq).strip();
      String value = unquote(line.substring(eq + 1).strip());
      values.put(key, value);
    }
    return values;
  }

  private static String unquote(String value) {
    if (value.length() >= 2) {
      char first = value.charAt(0);
      char last = value.charAt(value.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return value.substring(1, value.length() - 1);
      }
    }
    int comment = value.indexOf(" #");
    return comment >= 0 ? value.substring(0, comment).stripTrailing() : value;
  }
}
