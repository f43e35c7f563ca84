package io.podsim.core;

/**
 * Raised inside a simulator to abort the current command with an error message. {@link
 * AbstractSimulator} turns it into a failed {@link CommandResult}; it never reaches the terminal.
 */
public class SimulatorException extends Exception {
  private final int exitCode;

  public SimulatorException(String message) {
    this(message, 1);
  }

  public SimulatorException(String message, int exitCode) {
    super(message);
    this.exitCode = exitCode;
  }

  public int getExitCode() {
    return exitCode;
  }
}
