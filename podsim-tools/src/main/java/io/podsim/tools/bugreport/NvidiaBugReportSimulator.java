package io.podsim.tools.bugreport;

import io.podsim.core.AbstractSimulator;
import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.FlagSchema;
import io.podsim.core.ParsedCommand;
import io.podsim.core.SimulatorException;
import io.podsim.core.SimulatorMetadata;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.EccErrors;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.InfiniBandPort;
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.core.cluster.XidError;
import io.podsim.core.cluster.XidInfo;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates {@code nvidia-bug-report.sh}. The report is assembled from the node state, so every
 * fault visible in the other tools shows up here with the same XID descriptions and the same
 * threshold rules driving the recommendations.
 */
public final class NvidiaBugReportSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(NvidiaBugReportSimulator.class);

  static final String DEFAULT_DRIVER = "535.104.05";
  static final String DEFAULT_OUTPUT = "/tmp/nvidia-bug-report.log.gz";

  private static final DateTimeFormatter XID_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);

  private static final List<String> STEPS = List.of(
      "nvidia-smi -q (GPU state)",
      "nvidia-smi topo -m (GPU topology)",
      "nvidia-smi nvlink -s (NVLink status)",
      "/proc/driver/nvidia/version (driver)",
      "dmesg (kernel ring buffer)",
      "journalctl -b (system journal)",
      "lspci -d 10de: (PCI devices)",
      "dcgmi discovery -l (DCGM inventory)",
      "ibstat (InfiniBand adapters)",
      "/var/log/syslog (system log)");

  private static final List<String> EXTRA_STEPS = List.of(
      "lspci -vvv (lspci verbose)",
      "dmidecode (firmware and board data)",
      "lsmod (kernel modules)");

  private static final FlagSchema FLAGS =
      FlagSchema.builder("nvidia-bug-report.sh")
          .option("o", "output-file")
          .flag("v", "verbose")
          .flag("no-compress")
          .flag("extra-system-data")
          .flag("h", "help")
          .flag("version")
          .unknownFlagMessage("nvidia-bug-report.sh: unrecognized option '%s'\n"
              + "Run 'nvidia-bug-report.sh --help' for usage.")
          .build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    ParsedCommand cmd = FLAGS.validate(command);
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(usage());
    }
    if (cmd.hasFlag("version")) {
      return CommandResult.success("nvidia-bug-report.sh version "
          + resolveNode(context).map(DgxNode::driverVersion).orElse(DEFAULT_DRIVER));
    }
    DgxNode node = requireNode(context,
        "ERROR: nvidia-bug-report.sh could not find an NVIDIA kernel driver on this host");

    boolean compress = !cmd.hasFlag("no-compress");
    boolean extra = cmd.hasFlag("extra-system-data");
    String file = cmd.flagValue("o", "output-file").orElse(DEFAULT_OUTPUT);
    if (!compress && file.endsWith(".gz")) {
      file = file.substring(0, file.length() - ".gz".length());
    }
    LOG.debug("bug report for {} into {}", node.id(), file);

    StringBuilder sb = new StringBuilder();
    sb.append("nvidia-bug-report.sh will now collect information about your system and create\n")
        .append("the file '").append(file).append("'.\n\n")
        .append("NVIDIA Bug Report Generator\n")
        .append("===========================\n\n")
        .append("Collecting:\n");
    List<String> steps = new ArrayList<>(STEPS);
    if (extra) {
      steps.addAll(EXTRA_STEPS);
    }
    boolean verbose = cmd.hasFlag("v", "verbose");
    for (int i = 0; i < steps.size(); i++) {
      if (verbose) {
        sb.append(String.format("[%d/%d] %s... done\n", i + 1, steps.size(), steps.get(i)));
      } else {
        sb.append("  - ").append(steps.get(i)).append('\n');
      }
    }
    sb.append('\n');

    systemInformation(sb, node);
    gpuSummary(sb, node);
    driverInformation(sb, node);
    xidHistory(sb, node);
    nvlinkSummary(sb, node);
    eccStatus(sb, node);
    gpuDetails(sb, node);
    if (extra) {
      extraSystemData(sb, node);
    }
    recommendations(sb, node);

    int xids = node.gpus().stream().mapToInt(g -> g.xidErrors().size()).sum();
    double megabytes = 3.2 + 0.1 * node.gpus().size() + 0.4 * xids + (extra ? 1.8 : 0);
    sb.append("Report written to ").append(file).append('\n');
    if (compress) {
      sb.append(String.format(Locale.ROOT, "Compressed size: %d KB\n",
          Math.round(megabytes * 1024 / 9)));
    } else {
      sb.append(String.format(Locale.ROOT, "Size: %.1f MB\n", megabytes));
    }
    sb.append("nvidia-bug-report.sh completed successfully.\n");
    return CommandResult.success(sb.toString());
  }

  private static void section(StringBuilder sb, String title) {
    sb.append(title).append('\n').append("-".repeat(title.length())).append('\n');
  }

  private static void field(StringBuilder sb, String label, Object value) {
    sb.append(String.format("  %-20s%s\n", label + ":", value));
  }

  private static void systemInformation(StringBuilder sb, DgxNode node) {
    section(sb, "System Information");
    field(sb, "Hostname", node.hostname());
    field(sb, "System Type", node.systemType());
    field(sb, "OS", node.osVersion());
    field(sb, "Kernel", node.kernelVersion());
    field(sb, "CPU", node.cpuModel() + " (" + node.cpuCount() + " cores)");
    field(sb, "Memory", node.ramTotalGb() + " GB");
    sb.append('\n');
  }

  private static void gpuSummary(StringBuilder sb, DgxNode node) {
    int[] counts = new int[HealthStatus.values().length];
    for (Gpu gpu : node.gpus()) {
      counts[gpu.healthStatus().ordinal()]++;
    }
    section(sb, "GPU Summary");
    field(sb, "Total GPUs", node.gpus().size());
    field(sb, "Model", node.gpus().isEmpty() ? "N/A" : node.gpus().get(0).name());
    field(sb, "Healthy", counts[HealthStatus.OK.ordinal()]);
    field(sb, "Warning", counts[HealthStatus.WARNING.ordinal()]);
    field(sb, "Critical", counts[HealthStatus.CRITICAL.ordinal()]);
    sb.append('\n');
  }

  private static void driverInformation(StringBuilder sb, DgxNode node) {
    section(sb, "Driver Information");
    field(sb, "Driver Version", node.driverVersion());
    field(sb, "CUDA Version", node.cudaVersion());
    field(sb, "Kernel Module", "nvidia " + node.driverVersion());
    sb.append('\n');
  }

  private static void xidHistory(StringBuilder sb, DgxNode node) {
    section(sb, "XID Error History");
    boolean any = false;
    for (Gpu gpu : node.gpus()) {
      for (XidError xid : gpu.xidErrors()) {
        any = true;
        sb.append(String.format("  GPU %d (%s): XID %d at %s [%s] %s\n", gpu.index(),
            gpu.pciAddress(), xid.code(), XID_TIME.format(xid.timestamp()),
            xid.severity().label(), xid.description()));
      }
    }
    if (!any) {
      sb.append("  No XID errors recorded\n");
    }
    sb.append('\n');
  }

  private static void nvlinkSummary(StringBuilder sb, DgxNode node) {
    int[] counts = new int[NvLinkStatus.values().length];
    int total = 0;
    for (Gpu gpu : node.gpus()) {
      for (NvLinkConnection link : gpu.nvlinks()) {
        counts[link.status().ordinal()]++;
        total++;
      }
    }
    section(sb, "NVLink Summary");
    field(sb, "Total Links", total);
    for (NvLinkStatus status : NvLinkStatus.values()) {
      field(sb, status.label(), counts[status.ordinal()]);
    }
    sb.append('\n');
  }

  private static void eccStatus(StringBuilder sb, DgxNode node) {
    long single = 0;
    long dbl = 0;
    for (Gpu gpu : node.gpus()) {
      single += gpu.eccErrors().aggregateSingleBit();
      dbl += gpu.eccErrors().aggregateDoubleBit();
    }
    section(sb, "ECC Memory Status");
    field(sb, "Single-Bit Errors", single);
    field(sb, "Double-Bit Errors", dbl);
    sb.append('\n');
  }

  private static void gpuDetails(StringBuilder sb, DgxNode node) {
    section(sb, "GPU Details");
    for (Gpu gpu : node.gpus()) {
      sb.append("  GPU ").append(gpu.index()).append(": ").append(gpu.name()).append('\n');
      field(sb, "  UUID", gpu.uuid());
      field(sb, "  PCI Bus", gpu.pciAddress());
      if (FaultRules.isOffBus(gpu)) {
        field(sb, "  Temperature", "N/A (not responding)");
        field(sb, "  Power", "N/A (not responding)");
      } else {
        field(sb, "  Temperature", gpu.temperature() + " C");
        field(sb, "  Power", String.format(Locale.ROOT, "%.1f W / %.1f W",
            gpu.powerDraw(), gpu.powerLimit()));
      }
      EccErrors ecc = gpu.eccErrors();
      field(sb, "  ECC (SBE/DBE)", ecc.aggregateSingleBit() + " / " + ecc.aggregateDoubleBit());
      field(sb, "  Health", gpu.healthStatus().label());
    }
    sb.append('\n');
  }

  private static void extraSystemData(StringBuilder sb, DgxNode node) {
    section(sb, "Extra System Data");
    sb.append("  lspci verbose: ").append(node.gpus().size() + node.hcas().size())
        .append(" NVIDIA and Mellanox functions captured\n")
        .append("  dmidecode: ").append(node.systemType()).append(", BMC firmware ")
        .append(node.bmc() == null ? "N/A" : node.bmc().firmwareVersion()).append('\n')
        .append("  kernel modules: nvidia, nvidia_uvm, nvidia_drm, nvidia_peermem, mlx5_core, "
            + "mlx5_ib\n\n");
  }

  /** Findings in GPU order, then the fabric. Uses the same rules as the health checks. */
  static List<String> findings(DgxNode node) {
    List<String> findings = new ArrayList<>();
    for (Gpu gpu : node.gpus()) {
      String id = "GPU " + gpu.index();
      if (gpu.healthStatus() != HealthStatus.OK) {
        findings.add(id + " is in a non-OK state (" + gpu.healthStatus().label()
            + "): run 'dcgmi diag -r 3' and review the XID history");
      }
      for (XidError xid : gpu.xidErrors()) {
        XidInfo info = xid.info();
        findings.add(id + ": XID " + xid.code() + " (" + info.description() + "): "
            + info.actions().get(0));
      }
      EccErrors ecc = gpu.eccErrors();
      if (ecc.aggregateDoubleBit() > 0) {
        findings.add(id + ": Uncorrectable ECC errors (" + ecc.aggregateDoubleBit()
            + " double-bit), schedule the GPU for replacement");
      } else if (ecc.aggregateSingleBit() > FaultRules.SINGLE_BIT_WARNING) {
        findings.add(id + ": High correctable ECC error count (" + ecc.aggregateSingleBit()
            + "), monitor with nvidia-smi -q -d ECC");
      }
      if (gpu.temperature() > FaultRules.TEMPERATURE_CRITICAL) {
        findings.add(id + ": Temperature " + gpu.temperature()
            + "C above the critical threshold, check airflow and fans");
      } else if (FaultRules.isThermalSlowdown(gpu.temperature())) {
        findings.add(id + ": Temperature " + gpu.temperature()
            + "C in the warning band, clocks may be throttled");
      }
      String inactive = gpu.nvlinks().stream()
          .filter(l -> !l.isActive())
          .map(l -> String.valueOf(l.linkId()))
          .collect(Collectors.joining(", "));
      if (!inactive.isEmpty()) {
        findings.add(id + ": Inactive NVLinks (" + inactive
            + "), check the fabric with nv-fabricmanager");
      }
      if (FaultRules.isNearPowerLimit(gpu)) {
        findings.add(String.format(Locale.ROOT, "%s near power limit (%.0f W of %.0f W)", id,
            gpu.powerDraw(), gpu.powerLimit()));
      }
    }
    for (InfiniBandHca hca : node.hcas()) {
      for (InfiniBandPort port : hca.ports()) {
        if (!port.isActive()) {
          findings.add(hca.caName() + " port " + port.portNumber() + " is " + port.state()
              + ": check the cable and switch port with ibstat");
        }
      }
    }
    return findings;
  }

  private static void recommendations(StringBuilder sb, DgxNode node) {
    section(sb, "Recommendations");
    List<String> findings = findings(node);
    if (findings.isEmpty()) {
      sb.append("  No issues detected\n");
    }
    findings.forEach(f -> sb.append("  - ").append(f).append('\n'));
    sb.append('\n');
  }

  private static String usage() {
    return "nvidia-bug-report.sh\n\n"
        + "Usage: nvidia-bug-report.sh [OPTIONS]\n\n"
        + "Options:\n"
        + "  -o, --output-file FILE   Write the report to FILE (default " + DEFAULT_OUTPUT + ")\n"
        + "  -v, --verbose            Number each collection step\n"
        + "  --no-compress            Do not gzip the report\n"
        + "  --extra-system-data      Also collect lspci verbose, dmidecode and kernel modules\n"
        + "  -h, --help               Show this help\n"
        + "  --version                Show the driver version the script belongs to\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "nvidia-bug-report.sh",
        DEFAULT_DRIVER,
        "Collect a diagnostic report for NVIDIA support",
        List.of(
            new CommandInfo(
                "nvidia-bug-report.sh",
                "Collect GPU, driver, log and fabric state into one report",
                "nvidia-bug-report.sh [-o file] [-v] [--no-compress] [--extra-system-data]",
                List.of(),
                List.of("nvidia-bug-report.sh", "nvidia-bug-report.sh -o /tmp/x.log.gz",
                    "nvidia-bug-report.sh --extra-system-data"))));
  }
}
