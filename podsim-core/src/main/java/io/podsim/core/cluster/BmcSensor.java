package io.podsim.core.cluster;

/**
 * A BMC sensor reading.
 *
 * @param name sensor name
 * @param value current reading
 * @param unit unit of the reading ("degrees C", "Volts", "RPM", "Watts")
 * @param lowerCritical lower critical threshold
 * @param upperCritical upper critical threshold
 */
public record BmcSensor(
    String name, double value, String unit, double lowerCritical, double upperCritical) {

  /** ipmitool status code: "ok" inside thresholds, "cr" outside. */
  public String status() {
    return value < lowerCritical || value > upperCritical ? "cr" : "ok";
  }
}
