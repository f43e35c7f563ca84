package io.podsim.core.cluster;

import java.util.List;

/** Baseboard management controller of a node. */
public record BmcInfo(
    String ipAddress,
    String macAddress,
    String firmwareVersion,
    String manufacturer,
    List<BmcSensor> sensors,
    String powerState) {

  public BmcInfo {
    sensors = List.copyOf(sensors);
  }
}
