package io.podsim.core;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.cluster.ClusterStore;
import java.util.List;
import org.junit.jupiter.api.Test;

class AbstractSimulatorTest {

  static final class EchoSimulator extends AbstractSimulator {
    @Override
    protected CommandResult run(ParsedCommand command, CommandContext context)
        throws SimulatorException {
      if (command.hasFlag("version")) {
        return version();
      }
      if (command.hasFlag("fail")) {
        throw new SimulatorException("echo: failed on purpose", 3);
      }
      if (command.hasFlag("boom")) {
        throw new IllegalStateException("kaboom");
      }
      if (command.hasFlag("node")) {
        return CommandResult.success(requireNode(context, "No node found").hostname());
      }
      if (command.hasFlag("index")) {
        return CommandResult.success(
            String.valueOf(parseIndex(command.flagValue("index").orElse(""), "bad index")));
      }
      return CommandResult.success(String.join(" ", command.positionalArgs()));
    }

    @Override
    protected CommandResult runInteractive(String line, CommandContext context)
        throws SimulatorException {
      if ("boom".equals(line)) {
        throw new IllegalStateException("lost track of " + line);
      }
      if ("fail".equals(line)) {
        throw new SimulatorException("echo: bad line", 2);
      }
      return CommandResult.interactive(line, 0, "echo> ");
    }

    @Override
    public SimulatorMetadata getMetadata() {
      return new SimulatorMetadata(
          "echo", "2.1", "echo", List.of(CommandInfo.of("echo", "echo", "echo [args]")));
    }
  }

  private final EchoSimulator echo = new EchoSimulator();
  private final CommandContext context = new CommandContext("dgx-node03", new ClusterStore());

  @Test
  void successPassesThrough() {
    CommandResult result = echo.execute(CommandParser.parse("echo a b"), context);

    assertEquals("a b", result.output());
    assertTrue(result.isSuccess());
  }

  @Test
  void simulatorExceptionBecomesErrorResult() {
    CommandResult result = echo.execute(CommandParser.parse("echo --fail"), context);

    assertEquals(3, result.exitCode());
    assertEquals("echo: failed on purpose", result.output());
    assertFalse(result.isInteractive());
  }

  @Test
  void runtimeExceptionDoesNotEscape() {
    CommandResult result = echo.execute(CommandParser.parse("echo --boom"), context);

    assertEquals(1, result.exitCode());
    assertEquals("echo: internal error: kaboom", result.output());
  }

  @Test
  void versionLine() {
    assertEquals("echo version 2.1", echo.execute(CommandParser.parse("echo --version"), context)
        .output());
  }

  @Test
  void nodeResolution() {
    assertEquals(
        "dgx-node03", echo.execute(CommandParser.parse("echo --node"), context).output());

    CommandResult detached =
        echo.execute(CommandParser.parse("echo --node"), CommandContext.detached("dgx-00"));
    assertEquals("No node found", detached.output());
    assertEquals(1, detached.exitCode());
  }

  @Test
  void indexParsing() {
    assertEquals("4", echo.execute(CommandParser.parse("echo --index 4"), context).output());
    assertEquals(
        "bad index", echo.execute(CommandParser.parse("echo --index x"), context).output());
    assertEquals(
        "bad index", echo.execute(CommandParser.parse("echo --index=-1"), context).output());
  }

  @Test
  void interactiveLinesPassThrough() {
    CommandResult result = echo.executeInteractive("anything", context);

    assertEquals("anything", result.output());
    assertEquals("echo> ", result.prompt().orElseThrow());
    assertEquals(List.of("echo"), echo.commandNames());
  }

  @Test
  void interactiveRuntimeExceptionEndsSession() {
    CommandResult result = echo.executeInteractive("boom", context);

    assertEquals(1, result.exitCode());
    assertEquals("echo: internal error: lost track of boom", result.output());
    assertFalse(result.isInteractive());
  }

  @Test
  void interactiveSimulatorExceptionKeepsExitCode() {
    CommandResult result = echo.executeInteractive("fail", context);

    assertEquals(2, result.exitCode());
    assertEquals("echo: bad line", result.output());
  }

  @Test
  void defaultInteractiveEntryReportsError() {
    AbstractSimulator plain =
        new AbstractSimulator() {
          @Override
          protected CommandResult run(ParsedCommand command, CommandContext context) {
            return CommandResult.success("");
          }

          @Override
          public SimulatorMetadata getMetadata() {
            return echo.getMetadata();
          }
        };

    CommandResult result = plain.executeInteractive("anything", context);

    assertEquals(1, result.exitCode());
    assertEquals("echo: no interactive session", result.output());
  }
}
