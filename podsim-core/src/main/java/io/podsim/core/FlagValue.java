package io.podsim.core;

import java.util.Objects;
import java.util.Optional;

/** Value of a parsed flag: either a string argument or bare presence. */
public final class FlagValue {
  private static final FlagValue PRESENT = new FlagValue(null);

  private final String value;

  private FlagValue(String value) {
    this.value = value;
  }

  public static FlagValue of(String value) {
    return new FlagValue(Objects.requireNonNull(value, "value"));
  }

  /** A flag given without an argument. */
  public static FlagValue present() {
    return PRESENT;
  }

  public boolean isBoolean() {
    return value == null;
  }

  public Optional<String> asString() {
    return Optional.ofNullable(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof FlagValue other && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return value == null ? "true" : value;
  }
}
