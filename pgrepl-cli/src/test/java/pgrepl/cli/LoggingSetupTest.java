package pgrepl.cli;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class LoggingSetupTest {

  @Test
  void bundledConfigurationIsApplied() {
    String previous = System.getProperty(LoggingSetup.CONFIG_FILE_PROPERTY);
    System.clearProperty(LoggingSetup.CONFIG_FILE_PROPERTY);
    try {
      assertTrue(LoggingSetup.configure());
      assertEquals(Level.INFO, Logger.getLogger("pgrepl").getLevel());
    } finally {
      if (previous != null) {
        System.setProperty(LoggingSetup.CONFIG_FILE_PROPERTY, previous);
      }
    }
  }

  @Test
  void explicitConfigFileWins() {
    String previous = System.getProperty(LoggingSetup.CONFIG_FILE_PROPERTY);
    System.setProperty(LoggingSetup.CONFIG_FILE_PROPERTY, "custom-logging.properties");
    try {
      assertFalse(LoggingSetup.configure());
    } finally {
      if (previous != null) {
        System.setProperty(LoggingSetup.CONFIG_FILE_PROPERTY, previous);
      } else {
        System.clearProperty(LoggingSetup.CONFIG_FILE_PROPERTY);
      }
    }
  }
}
