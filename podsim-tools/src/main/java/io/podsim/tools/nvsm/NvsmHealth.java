package io.podsim.tools.nvsm;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.InfiniBandPort;
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.render.Ansi;
import io.podsim.core.render.DotLeader;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** The {@code show health} check list and its report. */
final class NvsmHealth {
  /** Checks listed without {@code --detailed}. */
  static final int SUMMARY_LIMIT = 20;

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss yyyy", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);

  record Check(String description, HealthStatus status) {}

  private NvsmHealth() {}

  /** nvsm wording of a status: "Healthy", "Warning" or "Critical". */
  static String label(HealthStatus status) {
    return status == HealthStatus.OK ? "Healthy" : status.label();
  }

  /**
   * Checks in report order: per-GPU temperature, ECC and PCIe link, then every NVLink, the XID
   * history of every GPU, the InfiniBand ports and finally the platform checks.
   */
  static List<Check> checks(DgxNode node) {
    List<Check> checks = new ArrayList<>();
    for (Gpu gpu : node.gpus()) {
      String tag = "[GPU" + gpu.index() + "]";
      boolean offBus = FaultRules.isOffBus(gpu);
      checks.add(new Check("GPU temperature " + tag,
          FaultRules.temperatureStatus(gpu.temperature())));
      checks.add(new Check("GPU ECC status " + tag, FaultRules.eccStatus(gpu.eccErrors())));
      HealthStatus link = offBus ? HealthStatus.CRITICAL : HealthStatus.OK;
      String bus = gpu.pciAddress().substring(5);
      checks.add(new Check("GPU link speed " + tag + " [" + bus + "][32GT/s]", link));
      checks.add(new Check("GPU link width " + tag + " [" + bus + "][x16]", link));
    }
    for (Gpu gpu : node.gpus()) {
      for (NvLinkConnection nvlink : gpu.nvlinks()) {
        checks.add(new Check("NVLink " + nvlink.linkId() + " status [GPU" + gpu.index() + "]",
            FaultRules.nvlinkStatus(nvlink)));
      }
    }
    for (Gpu gpu : node.gpus()) {
      checks.add(new Check("GPU XID error check [GPU" + gpu.index() + "]",
          FaultRules.xidStatus(gpu.xidErrors())));
    }
    for (InfiniBandHca hca : node.hcas()) {
      for (InfiniBandPort port : hca.ports()) {
        checks.add(new Check(
            "InfiniBand port " + port.portNumber() + " [" + hca.model() + "] " + hca.caName(),
            FaultRules.portStatus(port)));
      }
    }
    checks.add(new Check("Verify installed DIMM memory sticks", HealthStatus.OK));
    checks.add(new Check("Number of logical CPU cores [" + node.cpuCount() + "]",
        HealthStatus.OK));
    checks.add(new Check("Root file system usage", HealthStatus.OK));
    return checks;
  }

  static String render(DgxNode node, Instant now, boolean detailed) {
    List<Check> checks = checks(node);
    StringBuilder sb = new StringBuilder();
    sb.append("\nInfo\n----\n")
        .append(String.format("%-35s: %s\n", "Timestamp", TIMESTAMP.format(now)))
        .append(String.format("%-35s: %s\n", "Hostname", node.hostname()))
        .append(String.format("%-35s: %s\n", "Version", NvsmSimulator.VERSION))
        .append("\nChecks\n------\n");

    int shown = detailed ? checks.size() : Math.min(SUMMARY_LIMIT, checks.size());
    for (Check check : checks.subList(0, shown)) {
      sb.append(DotLeader.line(check.description(), colored(check.status()))).append('\n');
    }
    if (shown < checks.size()) {
      sb.append(String.format("... %d more checks (use --detailed to show all)\n",
          checks.size() - shown));
    }

    int[] counts = new int[HealthStatus.values().length];
    HealthStatus overall = HealthStatus.OK;
    for (Check check : checks) {
      counts[check.status().ordinal()]++;
      overall = HealthStatus.worst(overall, check.status());
    }
    int total = checks.size();
    sb.append("\nHealth Summary\n--------------\n")
        .append(String.format("%d out of %d checks are Healthy\n",
            counts[HealthStatus.OK.ordinal()], total));
    if (counts[HealthStatus.WARNING.ordinal()] > 0) {
      sb.append(String.format("%d out of %d checks are Warning\n",
          counts[HealthStatus.WARNING.ordinal()], total));
    }
    if (counts[HealthStatus.CRITICAL.ordinal()] > 0) {
      sb.append(String.format("%d out of %d checks are Critical\n",
          counts[HealthStatus.CRITICAL.ordinal()], total));
    }
    sb.append("Overall system status is ").append(colored(overall)).append('\n');
    return sb.toString();
  }

  private static String colored(HealthStatus status) {
    return Ansi.status(label(status), status);
  }
}
