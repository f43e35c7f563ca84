package io.podsim.shell;

import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.Simulator;
import io.podsim.core.SimulatorRegistry;
import io.podsim.core.TerminalSession;
import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.completion.CompletionEngine;
import io.podsim.core.render.Ansi;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Comparator;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Read-eval-print loop over a {@link TerminalSession}. */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final TerminalSession session;
  private final ShellConfig config;
  private boolean running = true;

  public Shell(ShellConfig config) throws IOException {
    this(config, openSession(config), TerminalBuilder.builder().system(true).build());
  }

  Shell(ShellConfig config, TerminalSession session, Terminal terminal) {
    this.config = config;
    this.terminal = terminal;
    this.session = session;
    SimulatorRegistry registry = session.registry();
    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .history(new DefaultHistory())
            .completer(new ShellCompleter(new CompletionEngine(registry.grammar()), session))
            .build();
  }

  /**
   * Creates a session on a fresh cluster with every service-loaded simulator.
   *
   * @throws IllegalArgumentException if the configured node does not exist
   */
  static TerminalSession openSession(ShellConfig config) {
    ClusterStore store = new ClusterStore();
    DgxNode node =
        store
            .findNode(config.node())
            .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + config.node()));
    SimulatorRegistry registry = SimulatorRegistry.load();
    LOG.debug("Loaded {} simulators, starting on {}", registry.listAll().size(), node.id());
    return new TerminalSession(registry, new CommandContext(node.id(), store));
  }

  TerminalSession session() {
    return session;
  }

  /** Prompt of the active tool, or a root shell prompt on the current node. */
  String prompt() {
    return session.prompt().orElseGet(() -> "root@" + hostname() + ":~# ");
  }

  private String hostname() {
    CommandContext ctx = session.context();
    return ctx.getCluster()
        .flatMap(store -> store.findNode(ctx.getCurrentNode()))
        .map(DgxNode::hostname)
        .orElse(ctx.getCurrentNode());
  }

  public void run(boolean quiet) {
    if (!quiet) {
      printBanner();
    }
    while (running) {
      try {
        String input = lineReader.readLine(prompt());
        if (input == null) {
          continue;
        }
        handle(input.trim());
      } catch (UserInterruptException e) {
        println("^C");
      } catch (EndOfFileException e) {
        println("");
        println("logout");
        running = false;
      }
    }
  }

  /** Executes one line, handling the top-level built-ins. */
  void handle(String input) {
    if (!session.isInteractive()) {
      if (input.isEmpty()) {
        return;
      }
      if ("exit".equals(input) || "logout".equals(input)) {
        running = false;
        return;
      }
      if ("help".equals(input)) {
        printHelp();
        return;
      }
      if ("reset-cluster".equals(input)) {
        session.context().getCluster().ifPresent(ClusterStore::reset);
        println("Cluster state restored to defaults.");
        return;
      }
    }
    CommandResult result = session.submit(input);
    String output = config.color() ? result.output() : Ansi.strip(result.output());
    if (!output.isEmpty()) {
      print(output.endsWith("\n") ? output : output + "\n");
    }
  }

  boolean isRunning() {
    return running;
  }

  private void printBanner() {
    println("podsim: DGX SuperPOD command simulator");
    println("Type 'help' for the available commands, 'exit' to leave.");
  }

  private void printHelp() {
    println("Available commands:");
    session.registry().listAll().stream()
        .sorted(Comparator.comparing(s -> s.getMetadata().name()))
        .forEach(this::printCommands);
    println("");
    println("Built-ins: help, reset-cluster, exit");
  }

  private void printCommands(Simulator simulator) {
    for (CommandInfo info : simulator.getMetadata().commands()) {
      println(String.format("  %-22s%s", info.name(), info.description()));
    }
  }

  private void print(String s) {
    PrintWriter writer = terminal.writer();
    writer.print(s);
    terminal.flush();
  }

  private void println(String s) {
    terminal.writer().println(s);
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      lineReader.getHistory().save();
    } catch (IOException e) {
      LOG.warn("Failed to save history: {}", e.getMessage());
    }
    terminal.close();
  }
}
