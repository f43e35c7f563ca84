package io.podsim.tools.nvsm;

import io.podsim.core.cluster.BmcSensor;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.InfiniBandHca;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One node of the NVSM target tree. The tree is rebuilt from the node on every command, so it
 * always reflects the current cluster state.
 *
 * @param name last path segment, empty for the root
 * @param properties properties printed by {@code show}
 * @param children sub-targets in display order
 * @param verbs verbs accepted at this target
 */
record NvsmTarget(
    String name, Map<String, String> properties, List<NvsmTarget> children, List<String> verbs) {

  private static final List<String> NAV_VERBS = List.of("cd", "show");

  NvsmTarget {
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    children = List.copyOf(children);
    verbs = List.copyOf(verbs);
  }

  private static NvsmTarget leaf(String name, Map<String, String> properties) {
    return new NvsmTarget(name, properties, List.of(), NAV_VERBS);
  }

  Optional<NvsmTarget> child(String childName) {
    return children.stream().filter(c -> c.name().equals(childName)).findFirst();
  }

  List<String> childNames() {
    return children.stream().map(NvsmTarget::name).toList();
  }

  /** Follows an absolute, normalized path from this target. */
  Optional<NvsmTarget> resolve(String path) {
    NvsmTarget current = this;
    for (String segment : path.split("/")) {
      if (segment.isEmpty()) {
        continue;
      }
      Optional<NvsmTarget> next = current.child(segment);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    return Optional.of(current);
  }

  /** {@code /} with {@code systems/localhost} below it, describing the given node. */
  static NvsmTarget tree(DgxNode node) {
    Map<String, String> system = new LinkedHashMap<>();
    system.put("Hostname", node.hostname());
    system.put("SystemType", node.systemType());
    system.put("Manufacturer", node.bmc().manufacturer());
    system.put("OSVersion", node.osVersion());
    system.put("KernelVersion", node.kernelVersion());
    system.put("DriverVersion", node.driverVersion());
    system.put("CUDAVersion", node.cudaVersion());
    system.put("Health", NvsmHealth.label(FaultRules.nodeHealth(node)));

    List<NvsmTarget> sections = List.of(
        gpus(node), network(node), storage(), processors(node), memory(node),
        sensors("power", node, "Watts"), sensors("thermal", node, "degrees C"));
    NvsmTarget localhost =
        new NvsmTarget("localhost", system, sections, List.of("cd", "show", "dump"));
    NvsmTarget systems = new NvsmTarget("systems", Map.of(), List.of(localhost), NAV_VERBS);
    return new NvsmTarget("", Map.of(), List.of(systems), NAV_VERBS);
  }

  private static NvsmTarget gpus(DgxNode node) {
    List<NvsmTarget> gpus = new ArrayList<>();
    for (Gpu gpu : node.gpus()) {
      Map<String, String> props = new LinkedHashMap<>();
      props.put("Name", gpu.name());
      props.put("UUID", gpu.uuid());
      props.put("PCIAddress", gpu.pciAddress());
      if (FaultRules.isOffBus(gpu)) {
        props.put("State", "Not present on PCIe bus");
      } else {
        props.put("Temperature", gpu.temperature() + " C");
        props.put("PowerDraw", String.format("%.0f W", gpu.powerDraw()));
        props.put("MemoryTotal", gpu.memoryTotal() + " MiB");
      }
      props.put("Health", NvsmHealth.label(gpu.healthStatus()));
      gpus.add(leaf("GPU" + gpu.index(), props));
    }
    Map<String, String> props = new LinkedHashMap<>();
    props.put("GPUCount", String.valueOf(node.gpus().size()));
    props.put("DriverVersion", node.driverVersion());
    return new NvsmTarget("gpus", props, gpus, NAV_VERBS);
  }

  private static NvsmTarget network(DgxNode node) {
    List<NvsmTarget> adapters = new ArrayList<>();
    for (InfiniBandHca hca : node.hcas()) {
      Map<String, String> props = new LinkedHashMap<>();
      props.put("Model", hca.model());
      props.put("FirmwareVersion", hca.firmwareVersion());
      props.put("PCIAddress", hca.pciAddress());
      hca.ports().forEach(p -> props.put("Port" + p.portNumber(),
          p.state() + " (" + p.rateGbps() + " Gb/sec " + p.rateName() + ")"));
      adapters.add(leaf(hca.caName(), props));
    }
    return new NvsmTarget("network", Map.of("AdapterCount", String.valueOf(adapters.size())),
        adapters, NAV_VERBS);
  }

  private static NvsmTarget storage() {
    Map<String, String> props = new LinkedHashMap<>();
    props.put("RootFileSystem", "/dev/md0");
    props.put("DataVolume", "/raid (RAID-0, 8x NVMe)");
    return leaf("storage", props);
  }

  private static NvsmTarget processors(DgxNode node) {
    Map<String, String> props = new LinkedHashMap<>();
    props.put("Model", node.cpuModel());
    props.put("LogicalCores", String.valueOf(node.cpuCount()));
    return leaf("processors", props);
  }

  private static NvsmTarget memory(DgxNode node) {
    return leaf("memory", Map.of("TotalMemory", node.ramTotalGb() + " GB"));
  }

  private static NvsmTarget sensors(String name, DgxNode node, String unit) {
    Map<String, String> props = new LinkedHashMap<>();
    for (BmcSensor sensor : node.bmc().sensors()) {
      if (sensor.unit().equals(unit)) {
        props.put(sensor.name().replace(" ", ""),
            String.format("%.0f %s", sensor.value(), sensor.unit()));
      }
    }
    return leaf(name, props);
  }
}
