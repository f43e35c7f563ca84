package io.podsim.core.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The single table of XID codes. Every tool that prints an XID resolves its description and
 * severity here so the same fault reads identically in nvidia-smi, journalctl, lspci, nvsm and the
 * bug report.
 */
public final class XidCatalog {

  private static final Map<Integer, XidInfo> ENTRIES = new TreeMap<>();

  static {
    add(8, "GSP Error", "GSP error", XidSeverity.CRITICAL, "Hardware",
        "GPU System Processor firmware stopped responding to the driver.",
        "Collect nvidia-bug-report.sh output", "Reset the GPU with nvidia-smi --gpu-reset",
        "Update the GPU firmware if the error repeats");
    add(13, "Graphics Engine Exception", "Graphics engine exception", XidSeverity.WARNING,
        "Application",
        "Misbehaving application, shader bug or CUDA kernel timeout.",
        "Check application logs for errors", "Verify CUDA toolkit version compatibility",
        "If persistent, run dcgmi diag -r 3 to rule out hardware issues");
    add(14, "Thermal Violation", "Thermal violation", XidSeverity.WARNING, "Thermal",
        "GPU exceeded its thermal slowdown threshold.",
        "Check GPU temperature: nvidia-smi -q -d TEMPERATURE", "Verify fans and airflow",
        "Check BMC inlet temperature: ipmitool sensor");
    add(23, "GPU Shared Memory Exception", "GPU shared memory exception", XidSeverity.WARNING,
        "Application",
        "Out-of-bounds shared memory access or race condition in a CUDA kernel.",
        "Run compute-sanitizer against the application", "Review kernel launch parameters");
    add(24, "GPU Exception During Kernel Launch", "GPU exception during kernel launch",
        XidSeverity.WARNING, "Application",
        "Invalid launch configuration or resource exhaustion.",
        "Check grid and block dimensions", "Run with CUDA_LAUNCH_BLOCKING=1");
    add(27, "GPU Memory Interface Error", "GPU memory interface error", XidSeverity.CRITICAL,
        "Memory",
        "Memory controller or memory bus failure, possibly from overheating.",
        "Check GPU temperature: nvidia-smi -q -d TEMPERATURE", "Run dcgmi diag -r 3",
        "Check ECC counters: nvidia-smi -q -d ECC", "Prepare the GPU for RMA if persistent");
    add(31, "GPU Memory Page Fault", "GPU memory page fault", XidSeverity.WARNING, "Application",
        "Application accessed an invalid GPU memory address.",
        "Debug application memory management", "Enable compute-sanitizer");
    add(32, "Invalid or Corrupted Push Buffer", "Invalid or corrupted push buffer",
        XidSeverity.WARNING, "Driver",
        "Driver bug, memory corruption or PCIe instability.",
        "Update NVIDIA drivers", "Verify PCIe link stability: lspci -vv");
    add(38, "Driver Firmware Mismatch", "Driver firmware mismatch", XidSeverity.CRITICAL,
        "Driver",
        "Incomplete driver installation or firmware version mismatch.",
        "Reinstall the NVIDIA driver", "Verify firmware versions with nvidia-smi -q");
    add(43, "GPU Stopped Responding", "GPU stopped processing", XidSeverity.CRITICAL, "Hardware",
        "GPU hang caused by thermal, power or hardware failure.",
        "Check GPU temperature: nvidia-smi -q -d TEMPERATURE", "Check power delivery",
        "Attempt a GPU reset: nvidia-smi --gpu-reset");
    add(45, "Preemptive GPU Cleanup", "Preemptive cleanup due to previous errors",
        XidSeverity.INFORMATIONAL, "Driver",
        "Resources cleaned up after an application terminated.",
        "No action needed if the application exited intentionally");
    add(48, "Double-Bit ECC Error", "Double Bit ECC error", XidSeverity.CRITICAL, "Memory",
        "Uncorrectable double-bit error in GPU memory.",
        "Check ECC counters: nvidia-smi -q -d ECC", "Run dcgmi diag -r 3",
        "Replace the GPU if errors persist");
    add(54, "Hardware Watchdog Timeout", "Hardware watchdog timeout", XidSeverity.CRITICAL,
        "Hardware",
        "GPU unresponsive to internal health checks.",
        "Check the system event log: ipmitool sel list", "Power cycle the node");
    add(56, "Display Engine Error", "Display engine error", XidSeverity.WARNING, "Hardware",
        "Display engine fault, unusual on compute GPUs.",
        "Update NVIDIA drivers");
    add(57, "Error in Copy Engine", "Error programming video memory interface",
        XidSeverity.WARNING, "Driver",
        "Copy engine fault during a memory transfer.",
        "Check PCIe link health: lspci -vv", "Update NVIDIA drivers");
    add(62, "Spurious Host Interrupt", "Internal micro-controller halt", XidSeverity.INFORMATIONAL,
        "Driver",
        "Unexpected interrupt from the GPU.",
        "Monitor for repeated occurrences");
    add(63, "Row Remapping Failure", "ECC page retirement or row remapping recording event",
        XidSeverity.CRITICAL, "Memory",
        "Memory row remapping could not be recorded or resources are exhausted.",
        "Check remapped rows: nvidia-smi -q -d ROW_REMAPPER", "Reset the GPU to apply remapping",
        "Replace the GPU if remapping resources are exhausted");
    add(64, "Row Remapping Threshold Exceeded", "ECC page retirement or row remapper failure",
        XidSeverity.CRITICAL, "Memory",
        "Row remapper exceeded its threshold.",
        "Schedule GPU replacement");
    add(68, "Video Processor Exception", "NVDEC0 exception", XidSeverity.WARNING, "Hardware",
        "Video decoder fault.",
        "Check application video workloads");
    add(69, "Graphics Engine Class Error", "Graphics engine class error", XidSeverity.WARNING,
        "Driver",
        "Invalid class method issued to the graphics engine.",
        "Update NVIDIA drivers");
    add(72, "NVLink Flow Control Error", "NVLink flow control error", XidSeverity.WARNING,
        "NVLink",
        "Flow control credit error on an NVLink.",
        "Check NVLink counters: nvidia-smi nvlink -e");
    add(74, "NVLink Error", "NVLink error", XidSeverity.CRITICAL, "NVLink",
        "Fatal error detected on an NVLink connection.",
        "Check NVLink status: nvidia-smi nvlink -s", "Check Fabric Manager logs",
        "Reseat or replace the affected GPU baseboard");
    add(76, "NVLink Training Error", "NVLink training error", XidSeverity.CRITICAL, "NVLink",
        "NVLink failed to train during initialization.",
        "Restart nvidia-fabricmanager", "Check NVSwitch health");
    add(77, "NVLink Timeout", "NVLink timeout", XidSeverity.CRITICAL, "NVLink",
        "NVLink transaction timed out.",
        "Check NVLink status: nvidia-smi nvlink -s");
    add(78, "NVLink ECC Error", "NVLink ECC error", XidSeverity.CRITICAL, "NVLink",
        "Uncorrectable ECC error on an NVLink.",
        "Check NVLink error counters", "Replace the affected hardware");
    add(79, "GPU Fallen Off Bus", "GPU has fallen off the bus", XidSeverity.CRITICAL, "Hardware",
        "GPU no longer reachable over PCIe: power, thermal or hardware failure.",
        "Check PCIe link: lspci -vv", "Check the system event log: ipmitool sel list",
        "Cold reboot the node", "Replace the GPU if the error repeats");
    add(92, "High Single-Bit ECC Rate", "High single-bit ECC error rate", XidSeverity.WARNING,
        "Memory",
        "Correctable ECC errors occurring at a high rate.",
        "Monitor ECC counters: nvidia-smi -q -d ECC");
    add(94, "Contained ECC Error", "Contained ECC error", XidSeverity.WARNING, "Memory",
        "ECC error contained to one application.",
        "Restart the affected application", "Reset the GPU when idle");
    add(95, "Uncontained ECC Error", "Uncontained ECC error", XidSeverity.CRITICAL, "Memory",
        "ECC error that could not be contained; all applications on the GPU are affected.",
        "Drain the node", "Reset the GPU", "Run dcgmi diag -r 3");
    add(119, "GSP RPC Timeout", "GSP RPC timeout", XidSeverity.CRITICAL, "Hardware",
        "Driver timed out waiting for the GPU System Processor.",
        "Collect nvidia-bug-report.sh output", "Reset the GPU");
  }

  private XidCatalog() {}

  private static void add(
      int code,
      String name,
      String description,
      XidSeverity severity,
      String category,
      String cause,
      String... actions) {
    ENTRIES.put(
        code, new XidInfo(code, name, description, severity, category, cause, List.of(actions)));
  }

  /** Looks up a code, returning empty when it is not in the reference table. */
  public static Optional<XidInfo> find(int code) {
    return Optional.ofNullable(ENTRIES.get(code));
  }

  /**
   * Resolves a code to its entry. Unknown codes resolve to a generic warning entry so callers never
   * need a null check.
   */
  public static XidInfo lookup(int code) {
    XidInfo info = ENTRIES.get(code);
    if (info != null) {
      return info;
    }
    return new XidInfo(
        code,
        "Unknown XID",
        "Unknown XID error",
        XidSeverity.WARNING,
        "Driver",
        "Code is not in the reference table.",
        List.of("Consult the NVIDIA XID documentation"));
  }

  public static List<XidInfo> all() {
    return Collections.unmodifiableList(new ArrayList<>(ENTRIES.values()));
  }

  public static List<XidInfo> bySeverity(XidSeverity severity) {
    List<XidInfo> result = new ArrayList<>();
    for (XidInfo info : ENTRIES.values()) {
      if (info.severity() == severity) {
        result.add(info);
      }
    }
    return result;
  }
}
