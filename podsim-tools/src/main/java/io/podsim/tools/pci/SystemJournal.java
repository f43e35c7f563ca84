package io.podsim.tools.pci;

import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.EccErrors;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.InfiniBandPort;
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.core.cluster.SlurmJob;
import io.podsim.core.cluster.XidError;
import io.podsim.core.cluster.XidSeverity;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The systemd journal of a node, synthesized from its hardware and fault state. Boot messages
 * come first, followed by the fault history: XIDs at the time they were recorded, ECC, thermal,
 * NVLink and InfiniBand conditions at the current simulated time.
 */
final class SystemJournal {
  static final String[] PRIORITIES =
      {"emerg", "alert", "crit", "err", "warning", "notice", "info", "debug"};

  static final int CRIT = 2;
  static final int ERR = 3;
  static final int WARNING = 4;
  static final int NOTICE = 5;
  static final int INFO = 6;

  private static final DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("MMM dd HH:mm:ss", Locale.ENGLISH).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter HEADER =
      DateTimeFormatter.ofPattern("EEE yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);

  /** Driver messages that follow the XID line for specific codes. */
  private static final Map<Integer, String> XID_FOLLOW_UPS = Map.of(
      8, "GSP firmware reported an error, a GPU reset is required",
      13, "Graphics Exception: ESR 0x405840=0x80000000, channel will be reset",
      31, "MMU Fault: ENGINE GRAPHICS GPCCLIENT_T1_0 faulted @ 0x7f2a_3c000000",
      43, "GPU likely hung, the faulting channel was reset",
      48, "DBE (double-bit error) ECC error detected, page retirement pending",
      63, "Row remapping resources exhausted, GPU reset required to remap pending rows",
      74, "NVLink: Fatal error detected on link 0(0x10000, 0x0, 0x0, 0x0, 0x0, 0x0, 0x0)",
      79, "GPU has fallen off the bus.\nGPU crash dump has been created",
      92, "High single-bit ECC error rate detected, monitor for page retirement",
      95, "Uncontained ECC error, all running applications on this GPU were terminated");

  /**
   * One journal line.
   *
   * @param time event time
   * @param unit systemd unit the line belongs to, "kernel" for the kernel ring
   * @param identifier syslog identifier with pid, e.g. {@code slurmd[2101]}
   * @param message text after the identifier
   * @param priority syslog priority, 0 (emerg) to 7 (debug)
   */
  record Entry(Instant time, String unit, String identifier, String message, int priority) {
    boolean isKernel() {
      return "kernel".equals(unit);
    }

    String render(String hostname) {
      return STAMP.format(time) + " " + hostname + " " + identifier + ": " + message;
    }
  }

  private SystemJournal() {}

  /** Parses a priority given by name or number. */
  static Optional<Integer> priority(String value) {
    String v = value.toLowerCase(Locale.ROOT);
    for (int i = 0; i < PRIORITIES.length; i++) {
      if (PRIORITIES[i].equals(v) || String.valueOf(i).equals(v)) {
        return Optional.of(i);
      }
    }
    if (v.equals("error")) {
      return Optional.of(ERR);
    }
    return Optional.empty();
  }

  static String header(List<Entry> entries, Instant boot) {
    Instant end = entries.isEmpty() ? boot : entries.get(entries.size() - 1).time();
    return "-- Logs begin at " + HEADER.format(boot) + ", end at " + HEADER.format(end) + ". --";
  }

  /** All entries of the current boot, in time order. */
  static List<Entry> entries(ClusterStore store, DgxNode node) {
    Instant boot = store.bootTime();
    Instant now = boot.plus(Duration.ofHours(2));
    List<Entry> entries = new ArrayList<>();
    kernelBoot(entries, node, boot);
    services(entries, node, boot);
    for (Gpu gpu : node.gpus()) {
      gpuFaults(entries, store, node, gpu, now);
    }
    for (InfiniBandHca hca : node.hcas()) {
      for (InfiniBandPort port : hca.ports()) {
        if (!port.isActive()) {
          entries.add(kernel(now, "mlx5_core " + hca.pciAddress() + ": " + hca.caName()
              + ": Port " + port.portNumber() + " link down (" + port.physicalState() + ")",
              WARNING));
        }
      }
    }
    entries.sort(Comparator.comparing(Entry::time));
    return entries;
  }

  private static Entry kernel(Instant time, String message, int priority) {
    return new Entry(time, "kernel", "kernel", message, priority);
  }

  private static void kernelBoot(List<Entry> entries, DgxNode node, Instant boot) {
    entries.add(kernel(boot, "Linux version " + node.kernelVersion()
        + " (buildd@lcy02-amd64-044) (gcc (Ubuntu 11.4.0-1ubuntu1~22.04) 11.4.0)", NOTICE));
    entries.add(kernel(boot, "Command line: BOOT_IMAGE=/boot/vmlinuz-" + node.kernelVersion()
        + " root=/dev/md0 ro iommu=pt pci=realloc=off", INFO));
    Instant modules = boot.plusSeconds(5);
    entries.add(kernel(modules, "nvidia: module license 'NVIDIA' taints kernel.", WARNING));
    entries.add(kernel(modules,
        "nvidia-nvlink: Nvlink Core is being initialized, major device number 235", INFO));
    entries.add(kernel(modules, "NVRM: loading NVIDIA UNIX x86_64 Kernel Module  "
        + node.driverVersion(), INFO));
    Instant ready = boot.plusSeconds(7);
    for (Gpu gpu : node.gpus()) {
      entries.add(kernel(ready, "NVRM: GPU " + gpu.pciAddress() + ": GPU Ready", INFO));
    }
    entries.add(kernel(ready,
        "NVRM: All " + node.gpus().size() + " GPUs initialized successfully", INFO));
    Instant network = boot.plusSeconds(9);
    for (InfiniBandHca hca : node.hcas()) {
      entries.add(kernel(network, "mlx5_core " + hca.pciAddress() + ": firmware version: "
          + hca.firmwareVersion(), INFO));
    }
  }

  private static void services(List<Entry> entries, DgxNode node, Instant boot) {
    Instant t = boot.plusSeconds(15);
    started(entries, t, "nvidia-persistenced", "NVIDIA Persistence Daemon");
    entries.add(new Entry(t.plusSeconds(1), "nvidia-persistenced", "nvidia-persistenced[1712]",
        "Started NVIDIA persistence daemon. Persistence mode enabled for all devices", INFO));

    started(entries, t.plusSeconds(2), "nvidia-fabricmanager", "NVIDIA fabric manager service");
    entries.add(new Entry(t.plusSeconds(3), "nvidia-fabricmanager", "nv-fabricmanager[1820]",
        "Connected to 1 node.", INFO));
    entries.add(new Entry(t.plusSeconds(3), "nvidia-fabricmanager", "nv-fabricmanager[1820]",
        "Successfully configured all the available NVSwitches to route GPU NVLink traffic.",
        INFO));

    started(entries, t.plusSeconds(4), "nvidia-dcgm", "NVIDIA DCGM service");
    started(entries, t.plusSeconds(5), "nvsm", "NVIDIA System Management service");
    entries.add(new Entry(t.plusSeconds(6), "nvsm", "nvsm-core[1944]",
        "Health monitor started, tracking " + node.gpus().size() + " GPUs and "
            + node.hcas().size() + " HCAs", INFO));

    started(entries, t.plusSeconds(7), "slurmd", "Slurm node daemon");
    String gres = node.gresType();
    entries.add(new Entry(t.plusSeconds(8), "slurmd", "slurmd[2101]",
        "slurmd version 23.02.6 started", INFO));
    entries.add(new Entry(t.plusSeconds(8), "slurmd", "slurmd[2101]",
        "gres/gpu: _merge_system_gres_conf: type " + gres + " gres/gpu count: "
            + node.gpus().size(), INFO));
    entries.add(new Entry(t.plusSeconds(8), "slurmd", "slurmd[2101]",
        "CPUs=" + node.cpuCount() + " Boards=1 Sockets=2 Cores=" + node.cpuCount() / 2
            + " Threads=1 Memory=" + node.ramTotalGb() * 1024, INFO));

    started(entries, t.plusSeconds(9), "sshd", "OpenBSD Secure Shell server");
    entries.add(new Entry(t.plusSeconds(10), "systemd", "systemd[1]",
        "Reached target Multi-User System.", INFO));
  }

  private static void started(List<Entry> entries, Instant time, String unit, String name) {
    entries.add(new Entry(time, unit, "systemd[1]",
        "Started " + unit + ".service - " + name + ".", INFO));
  }

  private static void gpuFaults(
      List<Entry> entries, ClusterStore store, DgxNode node, Gpu gpu, Instant now) {
    String bus = gpu.pciAddress().substring(0, gpu.pciAddress().lastIndexOf('.'));
    String process = store.jobs().stream()
        .filter(j -> j.nodeId().equals(node.id()))
        .map(SlurmJob::name)
        .findFirst()
        .orElse("<unknown>");
    for (XidError xid : gpu.xidErrors()) {
      int priority = xidPriority(xid.severity());
      int pid = 1000 + (gpu.index() * 131 + xid.code() * 17) % 8000;
      String channel = String.format("%08x", 0x08 + gpu.index() * 0x10 + xid.code() % 16);
      entries.add(kernel(xid.timestamp(), "NVRM: Xid (PCI:" + bus + "): " + xid.code()
          + ", pid=" + pid + ", name=" + process + ", Ch " + channel + ", "
          + xid.description(), priority));
      String followUp = XID_FOLLOW_UPS.get(xid.code());
      if (followUp != null) {
        for (String line : followUp.split("\n")) {
          entries.add(kernel(xid.timestamp(), "NVRM: GPU at PCI:" + bus + ": " + line,
              priority));
        }
      }
    }

    EccErrors ecc = gpu.eccErrors();
    if (ecc.aggregateDoubleBit() > 0) {
      entries.add(kernel(now, "NVRM: GPU at PCI:" + bus + ": DOUBLE-BIT ECC error detected "
          + "(count: " + ecc.aggregateDoubleBit() + ")", ERR));
    }
    if (ecc.aggregateSingleBit() > 0) {
      int priority = ecc.aggregateSingleBit() > FaultRules.SINGLE_BIT_WARNING ? WARNING : NOTICE;
      entries.add(kernel(now, "NVRM: GPU at PCI:" + bus + ": single-bit ECC error corrected "
          + "(count: " + ecc.aggregateSingleBit() + ")", priority));
    }

    HealthStatus thermal = FaultRules.temperatureStatus(gpu.temperature());
    if (thermal != HealthStatus.OK) {
      entries.add(kernel(now, "NVRM: GPU at PCI:" + bus + ": GPU temperature ("
          + gpu.temperature() + "C) exceeds slowdown threshold, clocks throttled",
          thermal == HealthStatus.CRITICAL ? CRIT : WARNING));
    }

    for (NvLinkConnection link : gpu.nvlinks()) {
      if (link.status() != NvLinkStatus.ACTIVE) {
        entries.add(kernel(now, "NVRM: GPU at PCI:" + bus + ": NVLink: link " + link.linkId()
            + " is " + link.status().label(),
            link.status() == NvLinkStatus.DOWN ? ERR : WARNING));
      }
    }
  }

  static int xidPriority(XidSeverity severity) {
    return switch (severity) {
      case CRITICAL -> ERR;
      case WARNING -> WARNING;
      case INFORMATIONAL -> INFO;
    };
  }
}
