package io.podsim.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared flags of one tool. A simulator validates its command against the schema before
 * rendering anything, instead of probing the raw flag map.
 *
 * <p>The parser cannot know that a flag is boolean, so {@code sbatch --exclusive job.sh} parses
 * with {@code job.sh} as the flag's value. {@link #normalize} hands such values back to the
 * positional arguments.
 */
public final class FlagSchema {

  /** Number of arguments a flag takes. */
  public enum Arity {
    NONE,
    ONE
  }

  /**
   * One declared flag.
   *
   * @param name canonical name without dashes
   * @param aliases alternative names without dashes
   * @param arity number of arguments
   * @param required whether the flag must be present
   */
  public record FlagSpec(String name, List<String> aliases, Arity arity, boolean required) {

    public FlagSpec {
      aliases = List.copyOf(aliases);
    }

    public boolean matches(String key) {
      return name.equals(key) || aliases.contains(key);
    }
  }

  private final String tool;
  private final List<FlagSpec> specs;
  private final boolean lenient;
  private final String unknownFormat;

  private FlagSchema(Builder b) {
    this.tool = b.tool;
    this.specs = List.copyOf(b.specs);
    this.lenient = b.lenient;
    this.unknownFormat = b.unknownFormat;
  }

  public static Builder builder(String tool) {
    return new Builder(tool);
  }

  public List<FlagSpec> specs() {
    return specs;
  }

  public Optional<FlagSpec> spec(String key) {
    return specs.stream().filter(s -> s.matches(key)).findFirst();
  }

  /** Returns boolean flags' captured values to the front of the positional arguments. */
  public ParsedCommand normalize(ParsedCommand command) {
    Map<String, FlagValue> flags = new LinkedHashMap<>();
    List<String> reclaimed = new ArrayList<>();
    for (Map.Entry<String, FlagValue> e : command.flags().entrySet()) {
      Optional<FlagSpec> spec = spec(e.getKey());
      if (spec.isPresent() && spec.get().arity() == Arity.NONE && !e.getValue().isBoolean()) {
        flags.put(e.getKey(), FlagValue.present());
        reclaimed.add(e.getValue().toString());
      } else {
        flags.put(e.getKey(), e.getValue());
      }
    }
    if (reclaimed.isEmpty()) {
      return command;
    }
    reclaimed.addAll(command.positionalArgs());
    return command.with(flags, reclaimed);
  }

  /**
   * Normalizes the command and checks it against the schema.
   *
   * @return the normalized command
   * @throws SimulatorException on an undeclared flag (unless lenient), a missing argument or a
   *     missing required flag
   */
  public ParsedCommand validate(ParsedCommand command) throws SimulatorException {
    ParsedCommand normalized = normalize(command);
    for (Map.Entry<String, FlagValue> e : normalized.flags().entrySet()) {
      Optional<FlagSpec> spec = spec(e.getKey());
      if (spec.isEmpty()) {
        if (!lenient) {
          throw new SimulatorException(String.format(unknownFormat, dashed(e.getKey())));
        }
        continue;
      }
      if (spec.get().arity() == Arity.ONE && e.getValue().isBoolean()) {
        throw new SimulatorException(
            tool + ": option '" + dashed(e.getKey()) + "' requires an argument");
      }
    }
    for (FlagSpec spec : specs) {
      if (spec.required() && !present(normalized, spec)) {
        throw new SimulatorException("Missing required flag: " + dashed(spec.name()));
      }
    }
    return normalized;
  }

  private static boolean present(ParsedCommand command, FlagSpec spec) {
    if (command.hasFlag(spec.name())) {
      return true;
    }
    for (String alias : spec.aliases()) {
      if (command.hasFlag(alias)) {
        return true;
      }
    }
    return false;
  }

  static String dashed(String name) {
    return name.length() == 1 ? "-" + name : "--" + name;
  }

  public static final class Builder {
    private final String tool;
    private final List<FlagSpec> specs = new ArrayList<>();
    private boolean lenient;
    private String unknownFormat;

    private Builder(String tool) {
      this.tool = tool;
      this.unknownFormat = tool + ": unrecognized option '%s'";
    }

    /** Declares a boolean flag. */
    public Builder flag(String name, String... aliases) {
      specs.add(new FlagSpec(name, List.of(aliases), Arity.NONE, false));
      return this;
    }

    /** Declares a flag that takes one argument. */
    public Builder option(String name, String... aliases) {
      specs.add(new FlagSpec(name, List.of(aliases), Arity.ONE, false));
      return this;
    }

    /** Declares a mandatory flag that takes one argument. */
    public Builder required(String name, String... aliases) {
      specs.add(new FlagSpec(name, List.of(aliases), Arity.ONE, true));
      return this;
    }

    /** Declares a mandatory boolean flag. */
    public Builder requiredFlag(String name, String... aliases) {
      specs.add(new FlagSpec(name, List.of(aliases), Arity.NONE, true));
      return this;
    }

    /** Undeclared flags are ignored instead of rejected. */
    public Builder lenient() {
      this.lenient = true;
      return this;
    }

    /** Message for undeclared flags; {@code %s} is replaced by the flag as typed. */
    public Builder unknownFlagMessage(String format) {
      this.unknownFormat = format;
      return this;
    }

    public FlagSchema build() {
      return new FlagSchema(this);
    }
  }
}
