package io.podsim.tools.nvsm;

import io.podsim.core.AbstractSimulator;
import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.FlagSchema;
import io.podsim.core.ParsedCommand;
import io.podsim.core.SimulatorException;
import io.podsim.core.SimulatorMetadata;
import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates NVIDIA System Management. The bare command opens a session rooted at
 * {@code /systems/localhost}; {@code nvsm show ...} and {@code nvsm dump health} answer directly.
 */
public final class NvsmSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(NvsmSimulator.class);

  static final String VERSION = "24.03";

  // reports are stamped two hours after the cluster boot, like the Slurm clock
  private static final Duration UPTIME = Duration.ofHours(2);

  private static final FlagSchema FLAGS =
      FlagSchema.builder("nvsm")
          .flag("h", "help")
          .flag("V", "version")
          .unknownFlagMessage("nvsm: unrecognized option '%s'. Run 'nvsm --help' for usage.")
          .build();

  private NvsmState state;

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    if (command.hasFlag("h", "help")) {
      return CommandResult.success(usage());
    }
    if (command.hasFlag("V", "version")) {
      return version();
    }
    if (command.subcommand().isPresent()) {
      NvsmShell.Step step = NvsmShell.apply(NvsmState.initial(), remainder(command),
          resolveNode(context), now(context));
      return new CommandResult(step.output(), step.exitCode(), Optional.empty());
    }
    ParsedCommand cmd = FLAGS.validate(command);
    if (!cmd.positionalArgs().isEmpty()) {
      throw new SimulatorException("nvsm: Unknown command '" + cmd.positionalArgs().get(0)
          + "'. Run 'nvsm --help' for usage.");
    }
    DgxNode node = requireNode(context, NvsmShell.NO_DAEMON);
    state = NvsmState.initial();
    LOG.debug("nvsm session opened on {}", node.id());
    return CommandResult.interactive(
        "NVIDIA System Management " + VERSION + " on " + node.hostname() + "\n"
            + "Type 'help' for a list of verbs.\n",
        0,
        state.prompt());
  }

  @Override
  protected CommandResult runInteractive(String line, CommandContext context) {
    if (state == null) {
      return CommandResult.error("nvsm: no interactive session");
    }
    NvsmShell.Step step = NvsmShell.apply(state, line, resolveNode(context), now(context));
    state = step.next();
    if (step.ended()) {
      LOG.debug("nvsm session closed");
      return new CommandResult(step.output(), step.exitCode(), Optional.empty());
    }
    return CommandResult.interactive(step.output(), step.exitCode(), state.prompt());
  }

  /** Current session position, empty when no session is open. */
  public Optional<NvsmState> currentState() {
    return Optional.ofNullable(state);
  }

  private static Instant now(CommandContext context) {
    return context.getCluster().map(ClusterStore::bootTime).orElse(Instant.EPOCH).plus(UPTIME);
  }

  private static String remainder(ParsedCommand command) {
    String raw = command.raw().trim();
    int start = raw.indexOf(command.baseCommand());
    return raw.substring(start + command.baseCommand().length()).trim();
  }

  private static String usage() {
    return "NVIDIA System Management (NVSM) " + VERSION + "\n\n"
        + "Usage: nvsm [options] [verb [target] [arguments]]\n\n"
        + "Options:\n"
        + "  -h, --help       Show this help\n"
        + "  -V, --version    Show version information\n\n"
        + "Verbs:\n"
        + "  show [target]              Show a target\n"
        + "  show health [--detailed]   Run the health checks\n"
        + "  dump health                Write a health snapshot tarball\n\n"
        + "Run 'nvsm' without arguments for an interactive session.\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "nvsm",
        VERSION,
        "NVIDIA System Management for DGX systems",
        List.of(
            new CommandInfo(
                "nvsm",
                "Inspect system targets and run health checks",
                "nvsm [show [target] | show health [--detailed] | dump health]",
                List.of("show", "dump"),
                List.of("nvsm", "nvsm show health", "nvsm show health --detailed",
                    "nvsm dump health"))));
  }
}
