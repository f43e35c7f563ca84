package io.podsim.shell;

import io.podsim.core.CommandResult;
import io.podsim.core.TerminalSession;
import io.podsim.core.render.Ansi;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "podsim",
    description = "Simulated DGX SuperPOD terminal",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  @CommandLine.Option(
      names = {"-n", "--node"},
      description = "Node id or hostname to start on")
  private String node;

  @CommandLine.Option(
      names = {"-c", "--command"},
      description = "Run one command, print its output and exit with its status")
  private String command;

  @CommandLine.Option(names = {"-q", "--quiet"}, description = "Suppress banner")
  private boolean quiet;

  @CommandLine.Option(names = "--no-color", description = "Strip ANSI colors from output")
  private boolean noColor;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    ShellConfig config = ShellConfig.load();
    if (node != null) {
      config = config.withNode(node);
    }
    if (noColor) {
      config = config.withColor(false);
    }

    if (command != null) {
      return runOnce(config);
    }
    try (Shell shell = new Shell(config)) {
      shell.run(quiet);
      return 0;
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 2;
    }
  }

  private int runOnce(ShellConfig config) {
    TerminalSession session;
    try {
      session = Shell.openSession(config);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 2;
    }
    CommandResult result = session.submit(command);
    String output = config.color() ? result.output() : Ansi.strip(result.output());
    if (!output.isEmpty()) {
      (result.isSuccess() ? System.out : System.err)
          .print(output.endsWith("\n") ? output : output + "\n");
    }
    return result.exitCode();
  }
}
