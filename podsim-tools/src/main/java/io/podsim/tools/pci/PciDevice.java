package io.podsim.tools.pci;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.XidError;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A PCI function as lspci reports it.
 *
 * @param address domain-qualified address, e.g. 0000:18:00.0
 * @param className device class name
 * @param classCode class code, 4 hex digits
 * @param vendorId vendor id, 4 hex digits
 * @param vendorName vendor name
 * @param deviceId device id, 4 hex digits
 * @param deviceName device name
 * @param subsystemId subsystem device id
 * @param driver kernel driver bound to the function
 * @param modules kernel modules that can drive it
 * @param numaNode NUMA node of the slot
 * @param responding false when the device no longer answers config reads
 * @param faults fault annotations shown in verbose listings
 */
record PciDevice(
    String address,
    String className,
    String classCode,
    String vendorId,
    String vendorName,
    String deviceId,
    String deviceName,
    String subsystemId,
    String driver,
    String modules,
    int numaNode,
    boolean responding,
    List<String> faults) {

  static final String NVIDIA = "10de";
  static final String MELLANOX = "15b3";

  PciDevice {
    faults = List.copyOf(faults);
  }

  /** Short bus address without the domain, e.g. 18:00.0. */
  String slot() {
    return address.substring(address.indexOf(':') + 1);
  }

  int bus() {
    return Integer.parseInt(address.substring(5, 7), 16);
  }

  /** GPUs and HCAs of a node in bus order. */
  static List<PciDevice> of(DgxNode node) {
    List<PciDevice> devices = new ArrayList<>();
    for (Gpu gpu : node.gpus()) {
      devices.add(gpu(gpu));
    }
    for (InfiniBandHca hca : node.hcas()) {
      devices.add(hca(hca));
    }
    devices.sort(Comparator.comparing(PciDevice::address));
    return devices;
  }

  private static PciDevice gpu(Gpu gpu) {
    List<String> faults = new ArrayList<>();
    Set<Integer> seen = new LinkedHashSet<>();
    for (XidError xid : gpu.xidErrors()) {
      if (seen.add(xid.code())) {
        faults.add("Device is in error state (XID " + xid.code() + "), " + xid.description());
      }
    }
    if (FaultRules.isThermalSlowdown(gpu.temperature())) {
      faults.add("Thermal throttling active (" + gpu.temperature() + "C)");
    }
    boolean a100 = gpu.type().startsWith("A100");
    int bus = Integer.parseInt(gpu.pciAddress().substring(5, 7), 16);
    return new PciDevice(
        gpu.pciAddress(),
        "3D controller",
        "0302",
        NVIDIA,
        "NVIDIA Corporation",
        a100 ? "20b2" : "2330",
        gpu.type(),
        a100 ? "1463" : "16c1",
        "nvidia",
        "nvidiafb, nouveau, nvidia_drm, nvidia",
        bus < 0x80 ? 0 : 1,
        !FaultRules.isOffBus(gpu),
        faults);
  }

  private static PciDevice hca(InfiniBandHca hca) {
    boolean cx7 = hca.model().contains("ConnectX-7");
    int bus = Integer.parseInt(hca.pciAddress().substring(5, 7), 16);
    return new PciDevice(
        hca.pciAddress(),
        "Infiniband controller",
        "0207",
        MELLANOX,
        "Mellanox Technologies",
        cx7 ? "1021" : "101b",
        (cx7 ? "MT2910 Family" : "MT28908 Family") + " [" + hca.model() + "]",
        "0023",
        "mlx5_core",
        "mlx5_core",
        bus < 0x80 ? 0 : 1,
        true,
        List.of());
  }
}
