package io.podsim.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps base command names to simulators. Dispatch is a plain lookup: the registry does nothing but
 * delegate to the resolved simulator.
 *
 * <p>Interactive simulators hold session state, so each terminal session should own its registry
 * (obtain a fresh one from {@link #load()}).
 */
public final class SimulatorRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(SimulatorRegistry.class);

  private final Map<String, Simulator> byCommand = new LinkedHashMap<>();
  private final Set<Simulator> simulators = new LinkedHashSet<>();

  /**
   * Creates a registry holding new instances of every simulator registered under {@code
   * META-INF/services/io.podsim.core.Simulator}.
   *
   * @return the populated registry
   */
  public static SimulatorRegistry load() {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = SimulatorRegistry.class.getClassLoader();
    }
    SimulatorRegistry registry = new SimulatorRegistry();
    for (Simulator simulator : ServiceLoader.load(Simulator.class, classLoader)) {
      registry.register(simulator);
    }
    LOG.debug("Loaded {} simulators for {} commands", registry.simulators.size(),
        registry.byCommand.size());
    return registry;
  }

  /**
   * Registers a simulator under each of its command names. A later registration of the same name
   * replaces the earlier one.
   */
  public SimulatorRegistry register(Simulator simulator) {
    simulators.add(simulator);
    for (String name : simulator.commandNames()) {
      Simulator previous = byCommand.put(name, simulator);
      if (previous != null && previous != simulator) {
        LOG.warn("Command '{}' of {} replaced by {}", name, previous.getMetadata().name(),
            simulator.getMetadata().name());
      }
    }
    return this;
  }

  public Optional<Simulator> find(String baseCommand) {
    return Optional.ofNullable(byCommand.get(baseCommand));
  }

  public boolean isAvailable(String baseCommand) {
    return byCommand.containsKey(baseCommand);
  }

  public Set<String> commandNames() {
    return Collections.unmodifiableSet(byCommand.keySet());
  }

  public Collection<Simulator> listAll() {
    return Collections.unmodifiableSet(simulators);
  }

  /**
   * Resolves and runs a command.
   *
   * @return the simulator's result, or exit code 1 with "command not found" for unknown commands
   */
  public CommandResult dispatch(ParsedCommand command, CommandContext context) {
    if (command.isEmpty()) {
      return CommandResult.success("");
    }
    Simulator simulator = byCommand.get(command.baseCommand());
    if (simulator == null) {
      return CommandResult.error(command.baseCommand() + ": command not found");
    }
    LOG.debug("Dispatching '{}' to {}", command.baseCommand(), simulator.getMetadata().name());
    return simulator.execute(command, context);
  }

  /** Standard grammar extended with the subcommands every registered simulator declares. */
  public CommandGrammar grammar() {
    CommandGrammar grammar = CommandGrammar.standard();
    for (Simulator simulator : simulators) {
      for (CommandInfo info : simulator.getMetadata().commands()) {
        grammar = grammar.withCommand(info.name(), info.subcommands());
      }
    }
    return grammar;
  }

  public CommandParser parser() {
    return new CommandParser(grammar());
  }
}
