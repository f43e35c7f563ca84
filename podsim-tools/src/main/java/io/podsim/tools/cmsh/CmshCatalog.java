package io.podsim.tools.cmsh;

import com.google.gson.annotations.SerializedName;
import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.render.CapitalizedJson;
import io.podsim.core.render.ParameterTable;
import io.podsim.core.render.PipeTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The objects cmsh manages in each mode, derived from the cluster store: devices (the head node
 * plus every compute node), categories, software images and Slurm partitions.
 */
final class CmshCatalog {
  static final String NETWORK = "internalnet";
  static final String BASE_IMAGE = "baseos-image-v10";
  static final String MAINTENANCE_IMAGE = "maintenance-image";
  private static final String HEADNODE_CATEGORY = "headnode";

  private CmshCatalog() {}

  /** One device as {@code list -d {}} prints it. */
  record DeviceEntry(
      @SerializedName("Hostname (key)") String hostname,
      @SerializedName("IPAddress") String ipAddress,
      String mac,
      String category,
      String network,
      String status) {}

  record CategoryEntry(
      @SerializedName("Name (key)") String name, String softwareImage, int nodes) {}

  record ImageEntry(
      @SerializedName("Name (key)") String name, String path, String kernelVersion, int nodes) {}

  record PartitionEntry(@SerializedName("Name (key)") String name, boolean isDefault, int nodes) {}

  static List<DeviceEntry> devices(ClusterStore store) {
    List<DeviceEntry> devices = new ArrayList<>();
    devices.add(new DeviceEntry(store.controlMachine(), "10.141.0.1", "FA:16:3E:C4:28:1C",
        HEADNODE_CATEGORY, NETWORK, "UP"));
    List<DgxNode> nodes = store.nodes();
    for (int i = 0; i < nodes.size(); i++) {
      DgxNode node = nodes.get(i);
      devices.add(new DeviceEntry(node.hostname(), "10.141.0." + (i + 2),
          String.format("FA:16:3E:C4:28:%02X", 0x1D + i), node.category(), NETWORK,
          status(node)));
    }
    return devices;
  }

  static List<CategoryEntry> categories(ClusterStore store) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    counts.put(HEADNODE_CATEGORY, 1);
    for (DgxNode node : store.nodes()) {
      counts.merge(node.category(), 1, Integer::sum);
    }
    List<CategoryEntry> categories = new ArrayList<>();
    counts.forEach((name, n) -> categories.add(new CategoryEntry(name, BASE_IMAGE, n)));
    return categories;
  }

  static List<ImageEntry> images(ClusterStore store) {
    String kernel = store.nodes().isEmpty()
        ? "5.15.0-1035-nvidia"
        : store.nodes().get(0).kernelVersion();
    return List.of(
        new ImageEntry(BASE_IMAGE, "/cm/images/" + BASE_IMAGE, kernel, store.nodes().size()),
        new ImageEntry(MAINTENANCE_IMAGE, "/cm/images/" + MAINTENANCE_IMAGE, kernel, 0));
  }

  static List<PartitionEntry> partitions(ClusterStore store) {
    List<PartitionEntry> partitions = new ArrayList<>();
    for (String name : store.partitions()) {
      partitions.add(new PartitionEntry(name, store.partitions().indexOf(name) == 0,
          store.nodes().size()));
    }
    return partitions;
  }

  static String list(CmshMode mode, ClusterStore store, boolean json) {
    return switch (mode) {
      case ROOT, DEVICE -> json ? CapitalizedJson.toJson(devices(store)) : deviceTable(store);
      case CATEGORY -> {
        if (json) {
          yield CapitalizedJson.toJson(categories(store));
        }
        PipeTable table = new PipeTable("Name (key)", "Software image", "Nodes").minWidths(14);
        categories(store).forEach(c -> table.addRow(c.name(), c.softwareImage(), c.nodes()));
        yield table.render();
      }
      case SOFTWAREIMAGE -> {
        if (json) {
          yield CapitalizedJson.toJson(images(store));
        }
        PipeTable table = new PipeTable("Name (key)", "Path", "Kernel version", "Nodes")
            .minWidths(21, 31, 20);
        images(store).forEach(i -> table.addRow(i.name(), i.path(), i.kernelVersion(), i.nodes()));
        yield table.render();
      }
      case PARTITION -> {
        if (json) {
          yield CapitalizedJson.toJson(partitions(store));
        }
        PipeTable table = new PipeTable("Name (key)", "Nodes").minWidths(11);
        partitions(store).forEach(p -> table.addRow(p.name(), p.nodes()));
        yield table.render();
      }
    };
  }

  private static String deviceTable(ClusterStore store) {
    PipeTable table = new PipeTable("Name (key)", "Network", "IP", "Mac", "Category")
        .minWidths(19, 12, 13, 18);
    for (DeviceEntry d : devices(store)) {
      table.addRow(d.hostname(), d.network(), d.ipAddress(), d.mac(), d.category());
    }
    return table.render();
  }

  /** Parameter listing of one object, empty when the mode has no such object. */
  static Optional<String> show(CmshMode mode, String id, ClusterStore store) {
    return switch (mode) {
      case ROOT, DEVICE -> showDevice(id, store);
      case CATEGORY -> categories(store).stream().filter(c -> c.name().equals(id)).findFirst()
          .map(c -> new ParameterTable()
              .add("Name", c.name())
              .add("Software image", c.softwareImage())
              .add("Slurm client", HEADNODE_CATEGORY.equals(c.name()) ? "no" : "yes")
              .add("Slurm submit", "yes")
              .add("Assign to role", "default")
              .add("Nodes", c.nodes())
              .render());
      case SOFTWAREIMAGE -> images(store).stream().filter(i -> i.name().equals(id)).findFirst()
          .map(i -> new ParameterTable()
              .add("Name", i.name())
              .add("Path", i.path())
              .add("Kernel version", i.kernelVersion())
              .add("Boot FS part", "/cm/images/" + i.name() + "/boot")
              .add("Nodes", i.nodes())
              .render());
      case PARTITION -> partitions(store).stream().filter(p -> p.name().equals(id)).findFirst()
          .map(p -> new ParameterTable()
              .add("Name", p.name())
              .add("Default", p.isDefault() ? "yes" : "no")
              .add("Nodes", p.nodes())
              .add("Node list", String.join(",",
                  store.nodes().stream().map(DgxNode::hostname).toList()))
              .render());
    };
  }

  private static Optional<String> showDevice(String id, ClusterStore store) {
    if (store.controlMachine().equals(id)) {
      return Optional.of(new ParameterTable()
          .add("Hostname", id)
          .add("Category", HEADNODE_CATEGORY)
          .add("IP", "10.141.0.1")
          .add("MAC", "FA:16:3E:C4:28:1C")
          .add("Network", NETWORK)
          .add("Status", "UP")
          .render());
    }
    Optional<DgxNode> found = store.findNode(id);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    DgxNode node = found.get();
    int index = store.nodes().indexOf(node);
    return Optional.of(new ParameterTable()
        .add("Hostname", node.hostname())
        .add("Category", node.category())
        .add("IP", "10.141.0." + (index + 2))
        .add("MAC", String.format("FA:16:3E:C4:28:%02X", 0x1D + index))
        .add("Network", NETWORK)
        .add("Software image", BASE_IMAGE)
        .add("Kernel version", node.kernelVersion())
        .add("Status", status(node))
        .add("GPU Count", node.gpus().size())
        .add("Driver version", node.driverVersion())
        .render());
  }

  /** {@code status} verb in device mode. */
  static String statusReport(ClusterStore store) {
    StringBuilder sb = new StringBuilder();
    for (DeviceEntry d : devices(store)) {
      sb.append(String.format("%-20s [ %-4s ]\n", d.hostname(), d.status()));
    }
    return sb.toString();
  }

  static String status(DgxNode node) {
    if ("down".equals(node.slurmState()) || node.healthStatus() == HealthStatus.CRITICAL) {
      return "DOWN";
    }
    return "UP";
  }
}
