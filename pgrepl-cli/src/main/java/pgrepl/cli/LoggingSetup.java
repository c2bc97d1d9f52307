package pgrepl.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Installs the bundled {@code logging.properties} unless the JVM was started with
 * {@code -Djava.util.logging.config.file=...}.
 */
final class LoggingSetup {
  static final String CONFIG_FILE_PROPERTY = "java.util.logging.config.file";
  static final String RESOURCE = "/logging.properties";

  private LoggingSetup() {}

  static boolean configure() {
    if (System.getProperty(CONFIG_FILE_PROPERTY) != null) {
      return false;
    }
    try (InputStream in = LoggingSetup.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        return false;
      }
      LogManager.getLogManager().readConfiguration(in);
      return true;
    } catch (IOException e) {
      Logger.getLogger(LoggingSetup.class.getName())
          .log(Level.WARNING, "Failed to load " + RESOURCE + ", keeping JVM logging defaults", e);
      return false;
    }
  }
}
