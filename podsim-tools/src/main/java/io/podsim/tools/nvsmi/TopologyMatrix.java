package io.podsim.tools.nvsmi;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.NvLinkConnection;
import java.util.ArrayList;
import java.util.List;

/**
 * GPUDirect communication matrix printed by {@code nvidia-smi topo -m}. GPUs talk over their
 * bonded NVLinks; each pair of GPUs shares a PCIe switch with one NIC, everything else crosses
 * the socket interconnect.
 */
final class TopologyMatrix {
  private static final int CELL = 7;

  private TopologyMatrix() {}

  static String render(DgxNode node) {
    List<Gpu> gpus = node.gpus();
    List<InfiniBandHca> nics = node.hcas();
    List<String> labels = new ArrayList<>();
    gpus.forEach(g -> labels.add("GPU" + g.index()));
    for (int n = 0; n < nics.size(); n++) {
      labels.add("NIC" + n);
    }

    StringBuilder sb = new StringBuilder();
    sb.append(" ".repeat(CELL));
    labels.forEach(l -> sb.append(pad(l)));
    sb.append(pad("CPU Affinity")).append("    NUMA Affinity\n");

    int half = Math.max(1, node.cpuCount() / 2);
    for (int r = 0; r < labels.size(); r++) {
      sb.append(pad(labels.get(r)));
      for (int c = 0; c < labels.size(); c++) {
        sb.append(pad(relation(gpus, r, c)));
      }
      if (r < gpus.size()) {
        int socket = gpus.get(r).index() < gpus.size() / 2 ? 0 : 1;
        sb.append(pad(String.format("%d-%d", socket * half, socket * half + half - 1)));
        sb.append("    ").append(socket);
      }
      sb.append('\n');
    }

    sb.append("\nLegend:\n\n")
        .append("  X    = Self\n")
        .append("  SYS  = Connection traversing PCIe as well as the SMP interconnect between NUMA "
            + "nodes (e.g., QPI/UPI)\n")
        .append("  NODE = Connection traversing PCIe as well as the interconnect between PCIe Host "
            + "Bridges within a NUMA node\n")
        .append("  PHB  = Connection traversing PCIe as well as a PCIe Host Bridge (typically the "
            + "CPU)\n")
        .append("  PXB  = Connection traversing multiple PCIe bridges (without traversing the PCIe "
            + "Host Bridge)\n")
        .append("  PIX  = Connection traversing at most a single PCIe bridge\n")
        .append("  NV#  = Connection traversing a bonded set of # NVLinks\n\n")
        .append("NIC Legend:\n\n");
    for (int n = 0; n < nics.size(); n++) {
      sb.append("  NIC").append(n).append(": ").append(nics.get(n).caName()).append('\n');
    }
    return sb.toString();
  }

  private static String relation(List<Gpu> gpus, int r, int c) {
    if (r == c) {
      return "X";
    }
    int g = gpus.size();
    if (r < g && c < g) {
      return "NV" + Math.min(activeLinks(gpus.get(r)), activeLinks(gpus.get(c)));
    }
    if (r >= g && c >= g) {
      return "SYS";
    }
    int gpu = r < g ? r : c;
    int nic = r < g ? c - g : r - g;
    return gpu / 2 == nic ? "PIX" : "SYS";
  }

  private static int activeLinks(Gpu gpu) {
    int count = 0;
    for (NvLinkConnection link : gpu.nvlinks()) {
      if (link.isActive()) {
        count++;
      }
    }
    return count;
  }

  private static String pad(String s) {
    return String.format("%-" + CELL + "s", s);
  }
}
