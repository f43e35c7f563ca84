package io.podsim.tools.dcgm;

import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.cluster.XidError;
import java.util.ArrayList;
import java.util.List;

/**
 * One finding of a DCGM health check.
 *
 * @param system health watch system that raised it (Thermal, Memory, NVLink, ...)
 * @param status severity of the finding
 * @param message explanation printed under the GPU
 */
record HealthIncident(String system, HealthStatus status, String message) {

  /** Findings for one GPU, derived from the same rules every other tool uses. */
  static List<HealthIncident> of(Gpu gpu) {
    List<HealthIncident> incidents = new ArrayList<>();
    HealthStatus thermal = FaultRules.temperatureStatus(gpu.temperature());
    if (thermal != HealthStatus.OK) {
      incidents.add(new HealthIncident("Thermal", thermal, String.format(
          "GPU %d temperature %d C is above the slowdown threshold of %d C",
          gpu.index(), gpu.temperature(), FaultRules.TEMPERATURE_WARNING)));
    }
    HealthStatus ecc = FaultRules.eccStatus(gpu.eccErrors());
    if (ecc == HealthStatus.CRITICAL) {
      incidents.add(new HealthIncident("Memory", ecc, String.format(
          "GPU %d has %d uncorrectable double-bit ECC errors",
          gpu.index(), gpu.eccErrors().aggregateDoubleBit())));
    } else if (ecc == HealthStatus.WARNING) {
      incidents.add(new HealthIncident("Memory", ecc, String.format(
          "GPU %d has %d correctable single-bit ECC errors",
          gpu.index(), gpu.eccErrors().aggregateSingleBit())));
    }
    for (NvLinkConnection link : gpu.nvlinks()) {
      HealthStatus status = FaultRules.nvlinkStatus(link);
      if (status != HealthStatus.OK) {
        incidents.add(new HealthIncident("NVLink", status, String.format(
            "GPU %d NVLink %d is %s", gpu.index(), link.linkId(), link.status().label())));
      }
    }
    for (XidError xid : gpu.xidErrors()) {
      HealthStatus status = xid.severity().health();
      if (status != HealthStatus.OK) {
        incidents.add(new HealthIncident("Driver", status, String.format(
            "GPU %d reported XID %d: %s", gpu.index(), xid.code(), xid.description())));
      }
    }
    return incidents;
  }

  /** DCGM wording of a health status. */
  static String word(HealthStatus status) {
    return switch (status) {
      case OK -> "Healthy";
      case WARNING -> "Warning";
      case CRITICAL -> "Failure";
    };
  }
}
