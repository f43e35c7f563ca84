package io.podsim.core;

/** Observes which tools a session used, e.g. to unlock learning content. */
@FunctionalInterface
public interface ToolUsageListener {

  /**
   * Called once per dispatched command line.
   *
   * @param baseCommand the resolved base command
   * @param result the command's result
   */
  void toolUsed(String baseCommand, CommandResult result);
}
