package io.podsim.core.cluster;

/** Health of a GPU, node or individual check, ordered from best to worst. */
public enum HealthStatus {
  OK("OK"),
  WARNING("Warning"),
  CRITICAL("Critical");

  private final String label;

  HealthStatus(String label) {
    this.label = label;
  }

  /** Label as printed by the management tools ("OK", "Warning", "Critical"). */
  public String label() {
    return label;
  }

  public boolean isWorseThan(HealthStatus other) {
    return ordinal() > other.ordinal();
  }

  public static HealthStatus worst(HealthStatus a, HealthStatus b) {
    return a.isWorseThan(b) ? a : b;
  }
}
