package io.podsim.core.cluster;

/** Severity class of an XID code as published in the driver documentation. */
public enum XidSeverity {
  CRITICAL("Critical", HealthStatus.CRITICAL),
  WARNING("Warning", HealthStatus.WARNING),
  INFORMATIONAL("Informational", HealthStatus.OK);

  private final String label;
  private final HealthStatus health;

  XidSeverity(String label, HealthStatus health) {
    this.label = label;
    this.health = health;
  }

  public String label() {
    return label;
  }

  /** Health status an occurrence of this severity imposes on the GPU. */
  public HealthStatus health() {
    return health;
  }
}
