package pgrepl.cli;

import pgrepl.ReplicationSetup;
import pgrepl.SetupConfig;
import pgrepl.SetupResult;
import pgrepl.config.EnvironmentConfigSource;
import pgrepl.config.SetupConfigSource;
import pgrepl.jdbc.DriverManagerConnectionProvider;
import pgrepl.jdbc.PostgresReplicationCatalog;
import pgrepl.spi.ConnectionProvider;

import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Command-line entry point. Without a subcommand it runs {@code setup}.
 *
 * <p>Exit codes: {@code 0} on success, {@code 1} when a run fails, {@code 2} on invalid usage.
 */
@CommandLine.Command(
    name = "pgrepl",
    mixinStandardHelpOptions = true,
    version = "pgrepl 0.1.0",
    description = "Sets up PostgreSQL logical replication between a primary and a replica.",
    subcommands = {SetupCommand.class, SchemaCommand.class})
public final class ReplicationSetupCommand implements Callable<Integer> {

  @CommandLine.Option(names = "--env-file", defaultValue = ".env", paramLabel = "FILE",
      description = "Optional KEY=VALUE file read before the environment (default: ${DEFAULT-VALUE}).")
  Path envFile;

  @CommandLine.Spec
  CommandLine.Model.CommandSpec spec;

  private final Map<String, String> environment;
  private final ConnectionProvider connectionProvider;
  private final BufferedReader input;

  public ReplicationSetupCommand() {
    this(System.getenv(), new DriverManagerConnectionProvider(),
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
  }

  ReplicationSetupCommand(Map<String, String> environment, ConnectionProvider connectionProvider,
      BufferedReader input) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.input = Objects.requireNonNull(input, "input");
  }

  public static void main(String[] args) {
    LoggingSetup.configure();
    System.exit(commandLine(new ReplicationSetupCommand()).execute(args));
  }

  static CommandLine commandLine(ReplicationSetupCommand command) {
    return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
  }

  @Override
  public Integer call() {
    return runSetup(null, null);
  }

  int runSetup(String publicationName, String subscriptionName) {
    SetupConfigSource source = () -> {
      SetupConfig config = configSource().load();
      if (publicationName == null && subscriptionName == null) {
        return config;
      }
      SetupConfig.Builder builder = config.toBuilder();
      if (publicationName != null) {
        builder.publicationName(publicationName);
      }
      if (subscriptionName != null) {
        builder.subscriptionName(subscriptionName);
      }
      return builder.build();
    };

    SetupResult result = ReplicationSetup.builder()
        .configSource(source)
        .connectionProvider(connectionProvider)
        .catalog(new PostgresReplicationCatalog())
        .build()
        .run();

    PrintWriter writer = result.succeeded() ? out() : err();
    result.describe().forEach(writer::println);
    writer.flush();
    return result.exitCode();
  }

  /**
   * Reads the {@code .env} file only when the returned source is loaded, so a malformed file
   * surfaces as a failed run.
   */
  SetupConfigSource configSource() {
    return () -> EnvironmentConfigSource.merged(envFile, environment).load();
  }

  ConnectionProvider connectionProvider() {
    return connectionProvider;
  }

  BufferedReader input() {
    return input;
  }

  PrintWriter out() {
    return spec.commandLine().getOut();
  }

  PrintWriter err() {
    return spec.commandLine().getErr();
  }
}
