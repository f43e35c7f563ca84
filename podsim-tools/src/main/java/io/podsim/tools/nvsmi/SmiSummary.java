package io.podsim.tools.nvsmi;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.render.Ansi;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * The default {@code nvidia-smi} screen: a boxed table with three cells per GPU followed by the
 * process list. Borders only use {@code |}, {@code -} and {@code =}.
 */
final class SmiSummary {
  static final int WIDTH = 89;
  private static final int COL1 = 41;
  private static final int COL2 = 22;
  private static final int COL3 = 22;
  private static final int FIRST_PID = 41230;

  private SmiSummary() {}

  static String render(DgxNode node, List<Gpu> gpus, Instant timestamp) {
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      if (FaultRules.isOffBus(gpu)) {
        sb.append(NvidiaSmiSimulator.offBusMessage(gpu)).append('\n');
      }
    }
    sb.append(NvidiaSmiSimulator.TIMESTAMP.format(timestamp)).append('\n');
    sb.append(full('-'));
    sb.append(
        boxed(
            String.format(
                " NVIDIA-SMI %-22s Driver Version: %-14s CUDA Version: %s",
                node.driverVersion(), node.driverVersion(), node.cudaVersion())));
    sb.append(split('-'));
    sb.append(cells(
        String.format(" %-3s %-22s%13s ", "GPU", "Name", "Persistence-M"),
        String.format(" %-14s%6s ", "Bus-Id", "Disp.A"),
        String.format(" %20s ", "Volatile Uncorr. ECC")));
    sb.append(cells(
        String.format(" %-4s %-5s %-4s %23s ", "Fan", "Temp", "Perf", "Pwr:Usage/Cap"),
        String.format(" %20s ", "Memory-Usage"),
        String.format(" %-9s %10s ", "GPU-Util", "Compute M.")));
    sb.append(cells("", "", String.format(" %20s ", "MIG M.")));
    sb.append(split('='));
    for (Gpu gpu : gpus) {
      if (FaultRules.isOffBus(gpu)) {
        continue;
      }
      sb.append(cells(
          String.format(
              " %-3d %-22s%13s ", gpu.index(), truncate(gpu.name(), 22),
              gpu.persistenceMode() ? "On" : "Off"),
          String.format(" %-16s%4s ", NvidiaSmiSimulator.busId(gpu), "Off"),
          String.format(" %20s ", gpu.eccEnabled() ? gpu.eccErrors().volatileDoubleBit() : "N/A")));
      sb.append(cells(
          String.format(
              " %-4s %-5s %-4s %23s ", "N/A", gpu.temperature() + "C", "P0",
              String.format(
                  Locale.ROOT, "%.0fW / %.0fW", gpu.powerDraw(), gpu.powerLimit())),
          String.format(" %20s ", gpu.memoryUsed() + "MiB / " + gpu.memoryTotal() + "MiB"),
          String.format(" %-9s %10s ", gpu.utilization() + "%", "Default")));
      sb.append(cells("", "", String.format(" %20s ", gpu.migMode() ? "Enabled" : "Disabled")));
      sb.append(split('-'));
    }
    sb.append('\n');
    sb.append(processes(gpus));
    return sb.toString();
  }

  private static String processes(List<Gpu> gpus) {
    StringBuilder sb = new StringBuilder();
    sb.append(full('-'));
    sb.append(boxed(" Processes:"));
    sb.append(boxed(String.format(
        "  %-5s %-4s %-4s %9s   %-4s   %-36s %10s", "GPU", "GI", "CI", "PID", "Type",
        "Process name", "GPU Memory")));
    sb.append(boxed(String.format(
        "  %-5s %-4s %-4s %9s   %-4s   %-36s %10s", "", "ID", "ID", "", "", "", "Usage")));
    sb.append(full('='));
    boolean any = false;
    for (Gpu gpu : gpus) {
      if (FaultRules.isOffBus(gpu) || gpu.memoryUsed() == 0) {
        continue;
      }
      any = true;
      sb.append(boxed(String.format(
          "  %-5d %-4s %-4s %9d   %-4s   %-36s %10s", gpu.index(), "N/A", "N/A",
          FIRST_PID + gpu.index(), "C", "python", gpu.memoryUsed() + "MiB")));
    }
    if (!any) {
      sb.append(boxed("  No running processes found"));
    }
    sb.append(full('-'));
    return sb.toString();
  }

  private static String truncate(String s, int width) {
    return s.length() <= width ? s : s.substring(0, width);
  }

  private static String boxed(String inner) {
    return "|" + Ansi.padRight(inner, WIDTH - 2) + "|\n";
  }

  private static String full(char c) {
    return "|" + String.valueOf(c).repeat(WIDTH - 2) + "|\n";
  }

  private static String split(char c) {
    String ch = String.valueOf(c);
    return "|" + ch.repeat(COL1) + "|" + ch.repeat(COL2) + "|" + ch.repeat(COL3) + "|\n";
  }

  private static String cells(String a, String b, String c) {
    return "|" + Ansi.padRight(a, COL1) + "|" + Ansi.padRight(b, COL2) + "|"
        + Ansi.padRight(c, COL3) + "|\n";
  }
}
