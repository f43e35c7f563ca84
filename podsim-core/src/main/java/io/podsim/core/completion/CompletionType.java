package io.podsim.core.completion;

/** What kind of word a completion produces. */
public enum CompletionType {
  /** Command name in first position. */
  COMMAND,
  /** Subcommand in second position. */
  SUBCOMMAND,
  /** Flag starting with a dash. */
  FLAG,
  /** Argument value such as a service name. */
  VALUE,
  /** Simulated filesystem path. */
  PATH
}
