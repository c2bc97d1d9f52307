package pgrepl.cli;

import pgrepl.Endpoint;
import pgrepl.ReplicationSetupException;
import pgrepl.SetupConfig;
import pgrepl.connect.EndpointConnector;
import pgrepl.jdbc.CatalogException;
import pgrepl.jdbc.JdbcSchemaDefiner;
import pgrepl.schema.RecreateDecision;
import pgrepl.schema.SchemaInitializer;

import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the replicated application tables. Logical replication needs the tables on both
 * sides, so this runs before {@code setup}.
 */
@CommandLine.Command(
    name = "schema",
    mixinStandardHelpOptions = true,
    description = "Create the products and orders tables on the primary, the replica or both.")
final class SchemaCommand implements Callable<Integer> {
  private static final Logger logger = Logger.getLogger(SchemaCommand.class.getName());

  enum Target {
    PRIMARY,
    REPLICA,
    BOTH
  }

  @CommandLine.ParentCommand
  ReplicationSetupCommand parent;

  @CommandLine.Option(names = "--target", defaultValue = "BOTH", paramLabel = "TARGET",
      description = "Where to create the tables: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
  Target target;

  @CommandLine.ArgGroup(exclusive = true)
  ExistingTables existing;

  static final class ExistingTables {
    @CommandLine.Option(names = "--recreate", required = true,
        description = "Drop and recreate tables that already exist.")
    boolean recreate;

    @CommandLine.Option(names = {"-i", "--interactive"}, required = true,
        description = "Ask before dropping tables that already exist.")
    boolean interactive;
  }

  @Override
  public Integer call() {
    PrintWriter out = parent.out();
    PrintWriter err = parent.err();
    try {
      SetupConfig config = parent.configSource().load();
      EndpointConnector connector = new EndpointConnector(
          parent.connectionProvider(), config.connectTimeout(), config.queryTimeout());
      SchemaInitializer initializer = new SchemaInitializer(
          new JdbcSchemaDefiner(config.queryTimeout()), decision(out));

      for (Endpoint endpoint : endpoints(config)) {
        out.println("Setting up " + endpoint.database() + " database on " + endpoint.host() + "...");
        out.flush();
        SchemaInitializer.Outcome outcome = initializer.prepare(connector, endpoint, endpoint.database());
        out.println(describe(outcome, endpoint.database()));
      }
      out.println("Database setup completed successfully!");
      out.flush();
      return 0;
    } catch (ReplicationSetupException | CatalogException | UncheckedIOException e) {
      logger.log(Level.FINE, "Schema setup failed", e);
      err.println("Error setting up database: " + e.getMessage());
      if (e instanceof ReplicationSetupException rse) {
        rse.remediation().forEach(step -> err.println("  - " + step));
      }
      err.flush();
      return 1;
    }
  }

  private List<Endpoint> endpoints(SetupConfig config) {
    List<Endpoint> endpoints = new ArrayList<>();
    if (target != Target.REPLICA) {
      endpoints.add(config.primary());
    }
    if (target != Target.PRIMARY) {
      endpoints.add(config.replica());
    }
    return endpoints;
  }

  private RecreateDecision decision(PrintWriter out) {
    if (existing == null) {
      return RecreateDecision.never();
    }
    if (existing.recreate) {
      return RecreateDecision.always();
    }
    return new ConsoleRecreateDecision(parent.input(), out);
  }

  private static String describe(SchemaInitializer.Outcome outcome, String database) {
    switch (outcome) {
      case CREATED:
        return "Tables created in the " + database + " database.";
      case RECREATED:
        return "Tables dropped and recreated in the " + database + " database.";
      default:
        return "Using existing tables in the " + database + " database.";
    }
  }
}
