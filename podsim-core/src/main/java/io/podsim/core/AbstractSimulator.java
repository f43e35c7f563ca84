package io.podsim.core;

import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for simulators. Subclasses implement {@link #run} and may throw {@link
 * SimulatorException} anywhere; this class turns every failure into an error result so nothing
 * escapes to the terminal.
 */
public abstract class AbstractSimulator implements Simulator {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractSimulator.class);

  @Override
  public final CommandResult execute(ParsedCommand command, CommandContext context) {
    try {
      return run(command, context);
    } catch (SimulatorException e) {
      return CommandResult.error(e.getMessage(), e.getExitCode());
    } catch (RuntimeException e) {
      LOG.error("{} failed on '{}'", getMetadata().name(), command.raw(), e);
      return CommandResult.error(command.baseCommand() + ": internal error: " + e.getMessage());
    }
  }

  /**
   * Guards {@link #runInteractive} the same way as {@link #execute}. A failure ends the
   * tool's session since its state can no longer be trusted.
   */
  @Override
  public final CommandResult executeInteractive(String line, CommandContext context) {
    String name = getMetadata().name();
    try {
      return runInteractive(line, context);
    } catch (SimulatorException e) {
      return CommandResult.error(e.getMessage(), e.getExitCode());
    } catch (RuntimeException e) {
      LOG.error("{} failed on interactive line '{}'", name, line, e);
      return CommandResult.error(name + ": internal error: " + e.getMessage());
    }
  }

  /** Executes a command; see {@link Simulator#execute}. */
  protected abstract CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException;

  /** Executes one line of an interactive session; see {@link Simulator#executeInteractive}. */
  protected CommandResult runInteractive(String line, CommandContext context)
      throws SimulatorException {
    return CommandResult.error(getMetadata().name() + ": no interactive session");
  }

  /** Standard {@code --version} answer. */
  protected CommandResult version() {
    SimulatorMetadata meta = getMetadata();
    return CommandResult.success(meta.name() + " version " + meta.version());
  }

  protected Optional<DgxNode> resolveNode(CommandContext context) {
    return context.getCluster().flatMap(c -> c.findNode(context.getCurrentNode()));
  }

  /**
   * Resolves the node the session is logged into.
   *
   * @param message error text when the node cannot be resolved
   */
  protected DgxNode requireNode(CommandContext context, String message) throws SimulatorException {
    return resolveNode(context).orElseThrow(() -> new SimulatorException(message));
  }

  protected ClusterStore requireCluster(CommandContext context, String message)
      throws SimulatorException {
    return context.getCluster().orElseThrow(() -> new SimulatorException(message));
  }

  protected List<DgxNode> allNodes(CommandContext context) {
    return context.getCluster().map(ClusterStore::nodes).orElse(List.of());
  }

  /** Parses a non-negative integer argument or fails with the given message. */
  protected static int parseIndex(String value, String message) throws SimulatorException {
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 0) {
        throw new SimulatorException(message);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new SimulatorException(message);
    }
  }
}
