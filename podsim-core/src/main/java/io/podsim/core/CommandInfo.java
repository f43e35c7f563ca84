package io.podsim.core;

import java.util.List;

/**
 * Describes one command a simulator answers to.
 *
 * @param name command name as typed
 * @param description one-line summary
 * @param usage usage synopsis
 * @param subcommands subcommands the parser should recognise
 * @param examples example invocations
 */
public record CommandInfo(
    String name,
    String description,
    String usage,
    List<String> subcommands,
    List<String> examples) {

  public CommandInfo {
    subcommands = List.copyOf(subcommands);
    examples = List.copyOf(examples);
  }

  public static CommandInfo of(String name, String description, String usage) {
    return new CommandInfo(name, description, usage, List.of(), List.of());
  }
}
