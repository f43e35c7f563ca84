package io.podsim.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

/** Exercises the entry point in single-command mode. */
class MainTest {
  private ByteArrayOutputStream outContent;
  private ByteArrayOutputStream errContent;
  private PrintStream originalOut;
  private PrintStream originalErr;

  @BeforeEach
  void setUp() {
    outContent = new ByteArrayOutputStream();
    errContent = new ByteArrayOutputStream();
    originalOut = System.out;
    originalErr = System.err;
    System.setOut(new PrintStream(outContent));
    System.setErr(new PrintStream(errContent));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    System.setErr(originalErr);
  }

  private int execute(String... args) {
    return new CommandLine(new Main()).execute(args);
  }

  @Test
  void runsOneCommand() {
    int exit = execute("-c", "nvidia-smi -L");

    assertEquals(0, exit);
    String out = outContent.toString();
    assertTrue(out.startsWith("GPU 0: NVIDIA H100 80GB HBM3"), out);
    assertEquals(8, out.split("\n").length);
  }

  @Test
  void startsOnTheRequestedNode() {
    int exit = execute("--node", "dgx-node02", "-c", "squeue");

    assertEquals(0, exit);
    assertTrue(outContent.toString().contains("llm-pret"));
  }

  @Test
  void commandExitCodeIsPropagated() {
    int exit = execute("-c", "frobnicate");

    assertEquals(1, exit);
    assertTrue(errContent.toString().contains("frobnicate: command not found"));
  }

  @Test
  void unknownNodeIsRejected() {
    int exit = execute("--node", "dgx-99", "-c", "nvidia-smi");

    assertEquals(2, exit);
    assertTrue(errContent.toString().contains("Unknown node: dgx-99"));
  }

  @Test
  void noColorStripsEscapes() {
    execute("--no-color", "-c", "nvsm show health");

    assertFalse(outContent.toString().contains("\u001b["));
  }

  @Test
  void helpAndVersion() {
    assertEquals(0, execute("--help"));
    assertTrue(outContent.toString().contains("--node"));

    outContent.reset();
    assertEquals(0, execute("--version"));
    assertTrue(outContent.toString().contains("0.1.0"));
  }
}
