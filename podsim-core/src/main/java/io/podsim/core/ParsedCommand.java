package io.podsim.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A command line broken into its parts. Instances are immutable.
 *
 * @param baseCommand first token, empty for blank input
 * @param subcommand second token when it is a known subcommand of the base command
 * @param flags flags in order of appearance, keyed by name without leading dashes
 * @param positionalArgs remaining tokens in order
 * @param raw the line as typed
 */
public record ParsedCommand(
    String baseCommand,
    Optional<String> subcommand,
    Map<String, FlagValue> flags,
    List<String> positionalArgs,
    String raw) {

  public ParsedCommand {
    flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    positionalArgs = List.copyOf(positionalArgs);
  }

  /** The result of parsing blank input. */
  public static ParsedCommand empty(String raw) {
    return new ParsedCommand("", Optional.empty(), Map.of(), List.of(), raw == null ? "" : raw);
  }

  public boolean isEmpty() {
    return baseCommand.isEmpty();
  }

  /** True if any of the given flag names was supplied. */
  public boolean hasFlag(String... names) {
    for (String name : names) {
      if (flags.containsKey(name)) {
        return true;
      }
    }
    return false;
  }

  public Optional<FlagValue> flag(String name) {
    return Optional.ofNullable(flags.get(name));
  }

  /** String argument of the first given flag that carries one. */
  public Optional<String> flagValue(String... names) {
    for (String name : names) {
      FlagValue value = flags.get(name);
      if (value != null && !value.isBoolean()) {
        return value.asString();
      }
    }
    return Optional.empty();
  }

  public Optional<String> positional(int index) {
    return index < positionalArgs.size()
        ? Optional.of(positionalArgs.get(index))
        : Optional.empty();
  }

  /**
   * Returns a copy with the given flags and positional arguments, keeping base command, subcommand
   * and raw line.
   */
  public ParsedCommand with(Map<String, FlagValue> newFlags, List<String> newPositionals) {
    return new ParsedCommand(baseCommand, subcommand, newFlags, newPositionals, raw);
  }

  /**
   * Re-joins the parts into a line that parses back to the same parts: base command, subcommand,
   * valued flags as {@code --name=value}, positional arguments, then boolean flags.
   */
  public String toCommandLine() {
    List<String> tokens = new ArrayList<>();
    if (!baseCommand.isEmpty()) {
      tokens.add(baseCommand);
    }
    subcommand.ifPresent(tokens::add);
    List<String> booleans = new ArrayList<>();
    for (Map.Entry<String, FlagValue> e : flags.entrySet()) {
      String name = e.getKey();
      String dashed = name.length() == 1 ? "-" + name : "--" + name;
      if (e.getValue().isBoolean()) {
        booleans.add(dashed);
      } else {
        tokens.add(dashed + "=" + quoteIfNeeded(e.getValue().toString()));
      }
    }
    for (String arg : positionalArgs) {
      tokens.add(quoteIfNeeded(arg));
    }
    tokens.addAll(booleans);
    return String.join(" ", tokens);
  }

  private static String quoteIfNeeded(String token) {
    boolean plain =
        !token.isEmpty()
            && !token.startsWith("-")
            && token.chars().noneMatch(c -> Character.isWhitespace(c) || c == '"' || c == '\'');
    if (plain) {
      return token;
    }
    return token.indexOf('"') < 0 ? "\"" + token + "\"" : "'" + token + "'";
  }
}
