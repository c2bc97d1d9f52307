package pgrepl.config;

import pgrepl.ConfigurationException;
import pgrepl.SetupConfig;

import java.util.Objects;

/**
 * Supplies the configuration of a setup run. Consulted once at the start of every run, before
 * any connection is opened.
 */
@FunctionalInterface
public interface SetupConfigSource {

  /**
   * @throws ConfigurationException if a required parameter is missing or malformed
   */
  SetupConfig load();

  static SetupConfigSource of(SetupConfig config) {
    Objects.requireNonNull(config, "config");
    return () -> config;
  }
}
