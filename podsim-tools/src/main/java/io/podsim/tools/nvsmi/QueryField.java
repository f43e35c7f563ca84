package io.podsim.tools.nvsmi;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;

/** Fields accepted by {@code nvidia-smi --query-gpu}. */
enum QueryField {
  INDEX("index", "", (n, g) -> String.valueOf(g.index())),
  NAME("name", "", (n, g) -> g.name()),
  UUID("uuid", "", (n, g) -> g.uuid()),
  PCI_BUS_ID("pci.bus_id", "", (n, g) -> NvidiaSmiSimulator.busId(g)),
  DRIVER_VERSION("driver_version", "", (n, g) -> n.driverVersion()),
  PERSISTENCE_MODE(
      "persistence_mode", "", (n, g) -> g.persistenceMode() ? "Enabled" : "Disabled"),
  PSTATE("pstate", "", (n, g) -> "P0"),
  TEMPERATURE_GPU("temperature.gpu", "", (n, g) -> String.valueOf(g.temperature())),
  UTILIZATION_GPU("utilization.gpu", "%", (n, g) -> String.valueOf(g.utilization())),
  UTILIZATION_MEMORY(
      "utilization.memory",
      "%",
      (n, g) -> String.valueOf(g.memoryTotal() == 0 ? 0 : g.memoryUsed() * 100 / g.memoryTotal())),
  MEMORY_TOTAL("memory.total", "MiB", (n, g) -> String.valueOf(g.memoryTotal())),
  MEMORY_USED("memory.used", "MiB", (n, g) -> String.valueOf(g.memoryUsed())),
  MEMORY_FREE("memory.free", "MiB", (n, g) -> String.valueOf(g.memoryTotal() - g.memoryUsed())),
  POWER_DRAW("power.draw", "W", (n, g) -> String.format(Locale.ROOT, "%.2f", g.powerDraw())),
  POWER_LIMIT("power.limit", "W", (n, g) -> String.format(Locale.ROOT, "%.2f", g.powerLimit())),
  CLOCKS_SM("clocks.sm", "MHz", (n, g) -> String.valueOf(g.clocksSm()), "clocks.current.sm"),
  CLOCKS_MEM(
      "clocks.mem", "MHz", (n, g) -> String.valueOf(g.clocksMem()), "clocks.current.memory"),
  ECC_MODE("ecc.mode.current", "", (n, g) -> g.eccEnabled() ? "Enabled" : "Disabled"),
  ECC_CORRECTED_VOLATILE(
      "ecc.errors.corrected.volatile.total",
      "",
      (n, g) -> String.valueOf(g.eccErrors().volatileSingleBit())),
  ECC_UNCORRECTED_VOLATILE(
      "ecc.errors.uncorrected.volatile.total",
      "",
      (n, g) -> String.valueOf(g.eccErrors().volatileDoubleBit())),
  ECC_CORRECTED_AGGREGATE(
      "ecc.errors.corrected.aggregate.total",
      "",
      (n, g) -> String.valueOf(g.eccErrors().aggregateSingleBit())),
  ECC_UNCORRECTED_AGGREGATE(
      "ecc.errors.uncorrected.aggregate.total",
      "",
      (n, g) -> String.valueOf(g.eccErrors().aggregateDoubleBit())),
  MIG_MODE("mig.mode.current", "", (n, g) -> g.migMode() ? "Enabled" : "Disabled"),
  THERMAL_SLOWDOWN(
      "clocks_throttle_reasons.hw_thermal_slowdown",
      "",
      (n, g) -> FaultRules.isThermalSlowdown(g.temperature()) ? "Active" : "Not Active",
      "clocks_event_reasons.hw_thermal_slowdown");

  private final String key;
  private final String unit;
  private final BiFunction<DgxNode, Gpu, String> reader;
  private final List<String> aliases;

  QueryField(String key, String unit, BiFunction<DgxNode, Gpu, String> reader, String... aliases) {
    this.key = key;
    this.unit = unit;
    this.reader = reader;
    this.aliases = List.of(aliases);
  }

  static Optional<QueryField> find(String name) {
    String wanted = name.trim();
    return Arrays.stream(values())
        .filter(f -> f.key.equals(wanted) || f.aliases.contains(wanted))
        .findFirst();
  }

  String header(boolean units) {
    return units && !unit.isEmpty() ? key + " [" + unit + "]" : key;
  }

  String value(DgxNode node, Gpu gpu, boolean units) {
    String raw = reader.apply(node, gpu);
    return units && !unit.isEmpty() ? raw + " " + unit : raw;
  }
}
