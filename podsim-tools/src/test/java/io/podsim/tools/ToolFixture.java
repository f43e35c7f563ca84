package io.podsim.tools;

import io.podsim.core.CommandContext;
import io.podsim.core.CommandParser;
import io.podsim.core.CommandResult;
import io.podsim.core.Simulator;
import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.render.Ansi;

/** A simulator wired to a fresh default cluster, logged into dgx-00. */
public final class ToolFixture {
  private final Simulator simulator;
  private final ClusterStore store;
  private final CommandContext context;

  private ToolFixture(Simulator simulator, ClusterStore store, String node) {
    this.simulator = simulator;
    this.store = store;
    this.context = new CommandContext(node, store);
  }

  public static ToolFixture of(Simulator simulator) {
    return new ToolFixture(simulator, new ClusterStore(), "dgx-00");
  }

  public static ToolFixture on(Simulator simulator, String node) {
    return new ToolFixture(simulator, new ClusterStore(), node);
  }

  /** A fixture whose context has no cluster behind it. */
  public static CommandResult detached(Simulator simulator, String line) {
    return simulator.execute(CommandParser.parse(line), CommandContext.detached("dgx-00"));
  }

  public CommandResult run(String line) {
    return simulator.execute(CommandParser.parse(line), context);
  }

  public CommandResult interactive(String line) {
    return simulator.executeInteractive(line, context);
  }

  /** Output of a successful command with colors removed. */
  public String output(String line) {
    CommandResult result = run(line);
    if (!result.isSuccess()) {
      throw new AssertionError("'" + line + "' failed with " + result.exitCode() + ": "
          + result.output());
    }
    return Ansi.strip(result.output());
  }

  public ClusterStore store() {
    return store;
  }

  public CommandContext context() {
    return context;
  }
}
