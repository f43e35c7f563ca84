package io.podsim.tools.nvsmi;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Renders {@code nvidia-smi -q}, optionally restricted to display sections with {@code -d}. */
final class SmiQueryReport {
  private static final int KEY_WIDTH = 42;

  /** Display sections selectable with {@code -d}. */
  enum Section {
    MEMORY,
    UTILIZATION,
    ECC,
    TEMPERATURE,
    POWER,
    CLOCK,
    PERFORMANCE
  }

  private final StringBuilder sb = new StringBuilder();

  private SmiQueryReport() {}

  static String render(DgxNode node, List<Gpu> gpus, Set<Section> sections, Instant timestamp) {
    SmiQueryReport report = new SmiQueryReport();
    report.write(node, gpus, sections.isEmpty() ? EnumSet.allOf(Section.class) : sections,
        !sections.isEmpty(), timestamp);
    return report.sb.toString();
  }

  private void write(
      DgxNode node, List<Gpu> gpus, Set<Section> sections, boolean filtered, Instant timestamp) {
    sb.append("\n==============NVSMI LOG==============\n\n");
    kv(0, "Timestamp", NvidiaSmiSimulator.TIMESTAMP.format(timestamp));
    kv(0, "Driver Version", node.driverVersion());
    kv(0, "CUDA Version", node.cudaVersion());
    sb.append('\n');
    kv(0, "Attached GPUs", node.gpus().size());
    for (Gpu gpu : gpus) {
      sb.append("GPU ").append(NvidiaSmiSimulator.busId(gpu)).append('\n');
      if (FaultRules.isOffBus(gpu)) {
        kv(1, "Product Name", "[Unknown Error]");
        sb.append(NvidiaSmiSimulator.offBusMessage(gpu)).append("\n\n");
        continue;
      }
      if (!filtered) {
        identity(node, gpu);
      }
      for (Section section : sections) {
        switch (section) {
          case MEMORY -> memory(gpu);
          case UTILIZATION -> utilization(gpu);
          case ECC -> ecc(gpu);
          case TEMPERATURE -> temperature(gpu);
          case POWER -> power(gpu);
          case CLOCK -> clocks(gpu);
          case PERFORMANCE -> performance(gpu);
        }
      }
      sb.append('\n');
    }
  }

  private void identity(DgxNode node, Gpu gpu) {
    kv(1, "Product Name", gpu.name());
    kv(1, "Product Brand", "NVIDIA");
    kv(1, "Product Architecture", gpu.name().contains("A100") ? "Ampere" : "Hopper");
    kv(1, "Persistence Mode", gpu.persistenceMode() ? "Enabled" : "Disabled");
    heading(1, "MIG Mode");
    kv(2, "Current", gpu.migMode() ? "Enabled" : "Disabled");
    kv(2, "Pending", gpu.migMode() ? "Enabled" : "Disabled");
    kv(1, "Minor Number", gpu.index());
    kv(1, "GPU UUID", gpu.uuid());
    kv(1, "VBIOS Version", "96.00.74.00.01");
    heading(1, "PCI");
    kv(2, "Bus Id", NvidiaSmiSimulator.busId(gpu));
    kv(2, "Device Id", gpu.name().contains("A100") ? "0x20B210DE" : "0x233010DE");
    kv(1, "Driver Model", "N/A");
    kv(1, "Host", node.hostname());
  }

  private void memory(Gpu gpu) {
    heading(1, "FB Memory Usage");
    kv(2, "Total", gpu.memoryTotal() + " MiB");
    kv(2, "Reserved", "0 MiB");
    kv(2, "Used", gpu.memoryUsed() + " MiB");
    kv(2, "Free", (gpu.memoryTotal() - gpu.memoryUsed()) + " MiB");
  }

  private void utilization(Gpu gpu) {
    heading(1, "Utilization");
    kv(2, "Gpu", gpu.utilization() + " %");
    int memory = gpu.memoryTotal() == 0 ? 0 : gpu.memoryUsed() * 100 / gpu.memoryTotal();
    kv(2, "Memory", memory + " %");
  }

  private void ecc(Gpu gpu) {
    heading(1, "ECC Mode");
    kv(2, "Current", gpu.eccEnabled() ? "Enabled" : "Disabled");
    kv(2, "Pending", gpu.eccEnabled() ? "Enabled" : "Disabled");
    heading(1, "ECC Errors");
    heading(2, "Volatile");
    kv(3, "Single Bit ECC", gpu.eccErrors().volatileSingleBit());
    kv(3, "Double Bit ECC", gpu.eccErrors().volatileDoubleBit());
    heading(2, "Aggregate");
    kv(3, "Single Bit ECC", gpu.eccErrors().aggregateSingleBit());
    kv(3, "Double Bit ECC", gpu.eccErrors().aggregateDoubleBit());
    kv(1, "ECC Status", FaultRules.eccStatus(gpu.eccErrors()).label());
  }

  private void temperature(Gpu gpu) {
    heading(1, "Temperature");
    kv(2, "GPU Current Temp", gpu.temperature() + " C");
    kv(2, "GPU Slowdown Temp", FaultRules.TEMPERATURE_WARNING + " C");
    kv(2, "GPU Max Operating Temp", FaultRules.TEMPERATURE_CRITICAL + " C");
    kv(2, "Thermal Slowdown",
        FaultRules.isThermalSlowdown(gpu.temperature()) ? "Active" : "Not Active");
  }

  private void power(Gpu gpu) {
    heading(1, "GPU Power Readings");
    kv(2, "Power Draw", watts(gpu.powerDraw()));
    kv(2, "Current Power Limit", watts(gpu.powerLimit()));
    kv(2, "Default Power Limit", watts(NvidiaSmiSimulator.maxPowerLimit(gpu)));
    kv(2, "Min Power Limit", watts(NvidiaSmiSimulator.minPowerLimit(gpu)));
    kv(2, "Max Power Limit", watts(NvidiaSmiSimulator.maxPowerLimit(gpu)));
  }

  private void clocks(Gpu gpu) {
    heading(1, "Clocks");
    kv(2, "Graphics", gpu.clocksSm() + " MHz");
    kv(2, "SM", gpu.clocksSm() + " MHz");
    kv(2, "Memory", gpu.clocksMem() + " MHz");
    heading(1, "Max Clocks");
    kv(2, "SM", "1980 MHz");
    kv(2, "Memory", gpu.clocksMem() + " MHz");
  }

  private void performance(Gpu gpu) {
    kv(1, "Performance State", "P0");
    heading(1, "Clocks Event Reasons");
    kv(2, "Idle", gpu.utilization() == 0 ? "Active" : "Not Active");
    kv(2, "SW Power Cap", FaultRules.isNearPowerLimit(gpu) ? "Active" : "Not Active");
    kv(2, "HW Thermal Slowdown",
        FaultRules.isThermalSlowdown(gpu.temperature()) ? "Active" : "Not Active");
  }

  private static String watts(double value) {
    return String.format(Locale.ROOT, "%.2f W", value);
  }

  private void heading(int depth, String title) {
    sb.append("    ".repeat(depth)).append(title).append('\n');
  }

  private void kv(int depth, String key, Object value) {
    String indent = "    ".repeat(depth);
    int width = Math.max(1, KEY_WIDTH - indent.length());
    sb.append(indent).append(String.format("%-" + width + "s: %s", key, value)).append('\n');
  }
}
