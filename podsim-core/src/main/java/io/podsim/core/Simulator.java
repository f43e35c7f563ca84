package io.podsim.core;

import java.util.List;

/**
 * Service Provider Interface for simulated command-line tools. Each implementation renders one tool
 * family (nvidia-smi, the Slurm client tools, cmsh, ...) from the shared cluster state.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Interactive tools keep
 * session state in the instance, so each terminal session needs its own instances.
 */
public interface Simulator {

  /**
   * Runs a single command line.
   *
   * @param command parsed command whose base command is one of {@link #commandNames()}
   * @param context session context
   * @return the result; a present prompt means the tool entered interactive mode
   */
  CommandResult execute(ParsedCommand command, CommandContext context);

  /**
   * Runs one line typed inside the tool's interactive session. Tools without a REPL keep the
   * default, which reports an error.
   *
   * @param line raw line as typed at the tool prompt
   * @param context session context
   * @return the result; an empty prompt ends the session
   */
  default CommandResult executeInteractive(String line, CommandContext context) {
    return CommandResult.error(getMetadata().name() + ": no interactive session");
  }

  SimulatorMetadata getMetadata();

  /** Base command names dispatched to this simulator. */
  default List<String> commandNames() {
    return getMetadata().commands().stream().map(CommandInfo::name).toList();
  }
}
