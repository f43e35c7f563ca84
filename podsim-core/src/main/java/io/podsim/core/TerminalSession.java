package io.podsim.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes typed lines for one terminal session. A line is parsed and dispatched through the
 * registry; when the result carries a prompt, the resolved simulator becomes the active
 * interactive tool and later lines go to its {@link Simulator#executeInteractive} until a result
 * without prompt ends that session.
 */
public final class TerminalSession {
  private static final Logger LOG = LoggerFactory.getLogger(TerminalSession.class);

  private final SimulatorRegistry registry;
  private final CommandParser parser;
  private final CommandContext context;
  private final List<ToolUsageListener> listeners = new CopyOnWriteArrayList<>();
  private Simulator active;
  private String activePrompt;

  public TerminalSession(SimulatorRegistry registry, CommandContext context) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.context = Objects.requireNonNull(context, "context");
    this.parser = registry.parser();
  }

  public CommandContext context() {
    return context;
  }

  public SimulatorRegistry registry() {
    return registry;
  }

  public void addListener(ToolUsageListener listener) {
    listeners.add(listener);
  }

  public void removeListener(ToolUsageListener listener) {
    listeners.remove(listener);
  }

  /** Prompt of the active interactive tool, empty at the top-level shell. */
  public Optional<String> prompt() {
    return Optional.ofNullable(activePrompt);
  }

  public boolean isInteractive() {
    return active != null;
  }

  /** Name of the active interactive tool, if any. */
  public Optional<String> activeTool() {
    return active == null ? Optional.empty() : Optional.of(active.getMetadata().name());
  }

  /**
   * Executes one line.
   *
   * @param line the line as typed
   * @return the command result
   */
  public CommandResult submit(String line) {
    String input = line == null ? "" : line;
    if (!input.isBlank()) {
      context.getHistory().add(input);
    }
    if (active != null) {
      CommandResult result = active.executeInteractive(input, context);
      if (result.isInteractive()) {
        activePrompt = result.prompt().get();
      } else {
        LOG.debug("Leaving interactive session of {}", active.getMetadata().name());
        active = null;
        activePrompt = null;
      }
      return result;
    }

    ParsedCommand command = parser.parseLine(input);
    if (command.isEmpty()) {
      return CommandResult.success("");
    }
    CommandResult result = registry.dispatch(command, context);
    if (result.isInteractive()) {
      active = registry.find(command.baseCommand()).orElse(null);
      activePrompt = active == null ? null : result.prompt().get();
    }
    for (ToolUsageListener listener : listeners) {
      listener.toolUsed(command.baseCommand(), result);
    }
    return result;
  }
}
