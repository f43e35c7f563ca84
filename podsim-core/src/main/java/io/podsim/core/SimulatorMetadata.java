package io.podsim.core;

import java.util.List;

/**
 * Static description of a simulator used by help output and completion.
 *
 * @param name tool family name
 * @param version version string reported by {@code --version}
 * @param description one-line summary
 * @param commands commands the simulator answers to
 */
public record SimulatorMetadata(
    String name, String version, String description, List<CommandInfo> commands) {

  public SimulatorMetadata {
    commands = List.copyOf(commands);
  }
}
