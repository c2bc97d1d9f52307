package pgrepl.cli;

import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Verifies the primary, ensures the publication and subscription exist and prints the
 * replication status.
 */
@CommandLine.Command(
    name = "setup",
    mixinStandardHelpOptions = true,
    description = "Create the publication on the primary and the subscription on the replica.")
final class SetupCommand implements Callable<Integer> {

  @CommandLine.ParentCommand
  ReplicationSetupCommand parent;

  @CommandLine.Option(names = "--publication", paramLabel = "NAME",
      description = "Publication name (overrides REPLICATION_PUBLICATION_NAME).")
  String publication;

  @CommandLine.Option(names = "--subscription", paramLabel = "NAME",
      description = "Subscription name (overrides REPLICATION_SUBSCRIPTION_NAME).")
  String subscription;

  @Override
  public Integer call() {
    return parent.runSetup(publication, subscription);
  }
}
