package io.podsim.core.cluster;

import java.util.List;

/**
 * Threshold rules shared by every tool that judges GPU health. A rendering never applies its own
 * thresholds; it asks here.
 */
public final class FaultRules {

  /** Above this temperature (Celsius) a GPU is critical. */
  public static final int TEMPERATURE_CRITICAL = 90;

  /** From this temperature (Celsius) a GPU is in warning. */
  public static final int TEMPERATURE_WARNING = 80;

  /** More aggregate single-bit errors than this is a warning. */
  public static final long SINGLE_BIT_WARNING = 100;

  /** Power draw at or above this fraction of the limit counts as near the limit. */
  public static final double POWER_NEAR_LIMIT_RATIO = 0.95;

  /** XID reported when a GPU drops off the PCIe bus. */
  public static final int XID_FALLEN_OFF_BUS = 79;

  private FaultRules() {}

  public static HealthStatus temperatureStatus(int celsius) {
    if (celsius > TEMPERATURE_CRITICAL) {
      return HealthStatus.CRITICAL;
    }
    if (celsius >= TEMPERATURE_WARNING) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.OK;
  }

  public static boolean isThermalSlowdown(int celsius) {
    return temperatureStatus(celsius) != HealthStatus.OK;
  }

  public static HealthStatus eccStatus(EccErrors ecc) {
    if (ecc.aggregateDoubleBit() > 0) {
      return HealthStatus.CRITICAL;
    }
    if (ecc.aggregateSingleBit() > SINGLE_BIT_WARNING) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.OK;
  }

  public static HealthStatus nvlinkStatus(NvLinkConnection link) {
    return switch (link.status()) {
      case DOWN -> HealthStatus.CRITICAL;
      case INACTIVE -> HealthStatus.WARNING;
      case ACTIVE -> HealthStatus.OK;
    };
  }

  public static HealthStatus xidStatus(List<XidError> errors) {
    HealthStatus status = HealthStatus.OK;
    for (XidError error : errors) {
      status = HealthStatus.worst(status, error.severity().health());
    }
    return status;
  }

  /** True once the GPU has logged XID 79; tools then stop reading it over PCIe. */
  public static boolean isOffBus(Gpu gpu) {
    return gpu.xidErrors().stream().anyMatch(e -> e.code() == XID_FALLEN_OFF_BUS);
  }

  public static boolean isNearPowerLimit(Gpu gpu) {
    return gpu.powerLimit() > 0 && gpu.powerDraw() >= gpu.powerLimit() * POWER_NEAR_LIMIT_RATIO;
  }

  /** Worst status over temperature, ECC, NVLink and XID history. */
  public static HealthStatus gpuHealth(Gpu gpu) {
    HealthStatus status = temperatureStatus(gpu.temperature());
    status = HealthStatus.worst(status, eccStatus(gpu.eccErrors()));
    for (NvLinkConnection link : gpu.nvlinks()) {
      status = HealthStatus.worst(status, nvlinkStatus(link));
    }
    return HealthStatus.worst(status, xidStatus(gpu.xidErrors()));
  }

  public static HealthStatus portStatus(InfiniBandPort port) {
    return port.isActive() ? HealthStatus.OK : HealthStatus.CRITICAL;
  }

  /** Symbol errors point at a cable, a link that went down is critical. */
  public static HealthStatus portErrorStatus(PortErrors errors) {
    if (errors.linkDowned() > 0) {
      return HealthStatus.CRITICAL;
    }
    if (errors.symbolErrors() > 0 || errors.portRcvErrors() > 0) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.OK;
  }

  public static HealthStatus nodeHealth(DgxNode node) {
    HealthStatus status = HealthStatus.OK;
    for (Gpu gpu : node.gpus()) {
      status = HealthStatus.worst(status, gpu.healthStatus());
    }
    for (InfiniBandHca hca : node.hcas()) {
      for (InfiniBandPort port : hca.ports()) {
        if (!port.isActive()) {
          status = HealthStatus.worst(status, HealthStatus.WARNING);
        }
      }
    }
    return status;
  }
}
