package io.podsim.tools.cmsh;

import io.podsim.core.AbstractSimulator;
import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.FlagSchema;
import io.podsim.core.ParsedCommand;
import io.podsim.core.SimulatorException;
import io.podsim.core.SimulatorMetadata;
import io.podsim.core.cluster.ClusterStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the Base Command Manager shell. The bare command opens an interactive session whose
 * position is a {@link CmshState}; {@code cmsh device list} and {@code cmsh -c "device; list"}
 * run without one.
 */
public final class CmshSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(CmshSimulator.class);

  static final String VERSION = "10.3.0";
  static final String BANNER =
      "\nCluster Management Shell (cmsh)\nType \"help\" for available commands.\n";
  private static final String NO_DAEMON =
      "cmsh: Unable to connect to CMDaemon on localhost:8081 (connection refused)";

  private static final FlagSchema FLAGS =
      FlagSchema.builder("cmsh")
          .flag("h", "help")
          .flag("v", "version")
          .option("c", "command")
          .unknownFlagMessage("cmsh: unknown option '%s'. Run 'cmsh --help' for usage.")
          .build();

  private CmshState state;

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    if (command.hasFlag("h", "help")) {
      return CommandResult.success(usage());
    }
    if (command.hasFlag("v", "version")) {
      return version();
    }
    if (command.subcommand().isPresent()) {
      ClusterStore store = requireCluster(context, NO_DAEMON);
      return oneShot(List.of(remainder(command)), store);
    }
    ParsedCommand cmd = FLAGS.validate(command);
    if (!cmd.positionalArgs().isEmpty()) {
      throw new SimulatorException("cmsh: unknown command '" + cmd.positionalArgs().get(0)
          + "'. Run 'cmsh --help' for usage.");
    }
    ClusterStore store = requireCluster(context, NO_DAEMON);
    Optional<String> script = cmd.flagValue("c", "command");
    if (script.isPresent()) {
      return oneShot(List.of(script.get().split(";")), store);
    }
    state = CmshState.root(store.controlMachine());
    LOG.debug("cmsh session opened on {}", state.headnode());
    return CommandResult.interactive(BANNER, 0, state.prompt());
  }

  @Override
  protected CommandResult runInteractive(String line, CommandContext context) {
    if (state == null) {
      return CommandResult.error("cmsh: no interactive session");
    }
    Optional<ClusterStore> store = context.getCluster();
    if (store.isEmpty()) {
      return CommandResult.interactive(NO_DAEMON, 1, state.prompt());
    }
    CmshShell.Step step = CmshShell.apply(state, line, store.get());
    state = step.next();
    if (step.ended()) {
      LOG.debug("cmsh session closed");
      return new CommandResult(step.output(), step.exitCode(), Optional.empty());
    }
    return CommandResult.interactive(step.output(), step.exitCode(), state.prompt());
  }

  /** Current session position, empty when no session is open. */
  public Optional<CmshState> currentState() {
    return Optional.ofNullable(state);
  }

  /** Runs lines from a fresh root state without opening a session. */
  private static CommandResult oneShot(List<String> lines, ClusterStore store) {
    CmshState position = CmshState.root(store.controlMachine());
    StringBuilder out = new StringBuilder();
    int exitCode = 0;
    for (String line : lines) {
      CmshShell.Step step = CmshShell.apply(position, line, store);
      if (!step.output().isEmpty()) {
        out.append(step.output());
        if (!step.output().endsWith("\n")) {
          out.append('\n');
        }
      }
      exitCode = Math.max(exitCode, step.exitCode());
      if (step.ended()) {
        break;
      }
      position = step.next();
    }
    return new CommandResult(out.toString(), exitCode, Optional.empty());
  }

  /** The typed line after the base command, with flags in their original positions. */
  private static String remainder(ParsedCommand command) {
    String raw = command.raw().trim();
    int start = raw.indexOf(command.baseCommand());
    return raw.substring(start + command.baseCommand().length()).trim();
  }

  private static String usage() {
    return "Usage: cmsh [options] [mode [command]]\n\n"
        + "Options:\n"
        + "  -c, --command <cmds>   Run ';' separated commands and exit\n"
        + "  -h, --help             Show this help\n"
        + "  -v, --version          Show version information\n\n"
        + "Modes:\n"
        + "  device, category, softwareimage, partition\n\n"
        + "Run 'cmsh' without arguments for an interactive session.\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "cmsh",
        VERSION,
        "Base Command Manager cluster management shell",
        List.of(
            new CommandInfo(
                "cmsh",
                "Manage devices, categories, software images and partitions",
                "cmsh [-c \"cmd; cmd\"] [mode [command]]",
                List.of("device", "category", "softwareimage", "partition"),
                List.of("cmsh", "cmsh device list", "cmsh -c \"device; list -d {}\""))));
  }
}
