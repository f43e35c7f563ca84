package io.podsim.core.cluster;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Builds the default virtual SuperPOD used by a fresh session. */
public final class ClusterFactory {

  public static final int DEFAULT_NODE_COUNT = 8;
  public static final int GPUS_PER_NODE = 8;
  public static final Instant DEFAULT_BOOT_TIME = Instant.parse("2024-03-15T08:00:00Z");

  // PCI bus numbers of the eight SXM slots on a DGX H100 baseboard
  private static final int[] GPU_BUS = {0x18, 0x2a, 0x3a, 0x5d, 0x9a, 0xab, 0xba, 0xdb};
  private static final int[] HCA_BUS = {0x1a, 0x3c, 0x9c, 0xbc};

  private ClusterFactory() {}

  /** Eight idle DGX H100 nodes except dgx-01, which runs one 8-GPU training job. */
  public static ClusterConfig createDefault() {
    List<DgxNode> nodes = new ArrayList<>();
    for (int i = 0; i < DEFAULT_NODE_COUNT; i++) {
      nodes.add(createNode(i, "DGX-H100", i == 1));
    }
    List<SlurmJob> jobs = new ArrayList<>();
    jobs.add(
        new SlurmJob(
            1000, "llm-pretrain", "mlops", "gpu", "dgx-01", GPUS_PER_NODE, "RUNNING",
            DEFAULT_BOOT_TIME.plusSeconds(3600)));
    return new ClusterConfig(
        "dgx-superpod", nodes, DEFAULT_BOOT_TIME, "dgx-headnode", List.of("gpu", "debug"), jobs);
  }

  /** Builds an empty-of-faults cluster with the given number of nodes and no running jobs. */
  public static ClusterConfig create(int nodeCount, String systemType) {
    List<DgxNode> nodes = new ArrayList<>();
    for (int i = 0; i < nodeCount; i++) {
      nodes.add(createNode(i, systemType, false));
    }
    return new ClusterConfig(
        "dgx-superpod",
        nodes,
        DEFAULT_BOOT_TIME,
        "dgx-headnode",
        List.of("gpu", "debug"),
        List.of());
  }

  /**
   * Creates node number {@code index}: id {@code dgx-NN}, hostname {@code dgx-nodeNN} (one-based).
   * A busy node has its GPUs loaded and is in Slurm state alloc.
   */
  public static DgxNode createNode(int index, String systemType, boolean busy) {
    String id = String.format("dgx-%02d", index);
    String hostname = String.format("dgx-node%02d", index + 1);
    List<Gpu> gpus = new ArrayList<>();
    for (int g = 0; g < GPUS_PER_NODE; g++) {
      gpus.add(createGpu(index, g, systemType, busy));
    }
    List<InfiniBandHca> hcas = new ArrayList<>();
    for (int h = 0; h < HCA_BUS.length; h++) {
      hcas.add(createHca(index, h));
    }
    return DgxNode.builder(id, hostname)
        .systemType(systemType)
        .gpus(gpus)
        .hcas(hcas)
        .bmc(createBmc(index))
        .slurmState(busy ? "alloc" : "idle")
        .build();
  }

  static Gpu createGpu(int nodeIndex, int gpuIndex, String systemType, boolean busy) {
    boolean a100 = systemType.contains("A100");
    int linkCount = a100 ? 12 : 18;
    int linkSpeed = a100 ? 25 : 50;
    List<NvLinkConnection> links = new ArrayList<>();
    for (int l = 0; l < linkCount; l++) {
      links.add(NvLinkConnection.active(l, linkSpeed));
    }
    return Gpu.builder()
        .index(gpuIndex)
        .name(a100 ? "NVIDIA A100-SXM4-80GB" : "NVIDIA H100 80GB HBM3")
        .type(a100 ? "A100-SXM4-80GB" : "H100-SXM5-80GB")
        .uuid(
            String.format(
                "GPU-%08x-%04x-%04x-%04x-%012x",
                0x5e3a7c00 + nodeIndex * 16 + gpuIndex, 0x1d2c, 0x4b8a, 0x9f00 + gpuIndex,
                0x3c8e2a7b1000L + nodeIndex))
        .pciAddress(String.format("0000:%02x:00.0", GPU_BUS[gpuIndex % GPU_BUS.length]))
        .temperature(busy ? 62 + gpuIndex % 3 : 34 + gpuIndex % 4)
        .powerDraw(busy ? 615 + gpuIndex * 3 : 72 + gpuIndex)
        .powerLimit(a100 ? 400 : 700)
        .memoryTotal(81920)
        .memoryUsed(busy ? 71234 : 0)
        .utilization(busy ? 97 : 0)
        .nvlinks(links)
        .build();
  }

  static InfiniBandHca createHca(int nodeIndex, int hcaIndex) {
    String guid = String.format("0x%016x", 0xb83fd20300a1b000L + nodeIndex * 16L + hcaIndex);
    InfiniBandPort port =
        new InfiniBandPort(
            1, "Active", "LinkUp", 400, 100 + nodeIndex * 8 + hcaIndex, guid, "InfiniBand");
    return new InfiniBandHca(
        "mlx5_" + hcaIndex,
        "ConnectX-7",
        "28.39.1002",
        String.format("0000:%02x:00.0", HCA_BUS[hcaIndex]),
        List.of(port));
  }

  static BmcInfo createBmc(int nodeIndex) {
    List<BmcSensor> sensors =
        List.of(
            new BmcSensor("Inlet Temp", 24, "degrees C", 5, 45),
            new BmcSensor("Exhaust Temp", 38, "degrees C", 5, 70),
            new BmcSensor("CPU0 Temp", 46, "degrees C", 5, 95),
            new BmcSensor("CPU1 Temp", 48, "degrees C", 5, 95),
            new BmcSensor("PSU0 Input Power", 1840, "Watts", 0, 3300),
            new BmcSensor("PSU1 Input Power", 1835, "Watts", 0, 3300),
            new BmcSensor("FAN1", 7200, "RPM", 1000, 20000),
            new BmcSensor("FAN2", 7150, "RPM", 1000, 20000),
            new BmcSensor("P12V", 12.06, "Volts", 10.8, 13.2));
    return new BmcInfo(
        String.format("10.141.1.%d", nodeIndex + 2),
        String.format("7C:C2:55:3A:10:%02X", nodeIndex + 0x20),
        "24.01.05",
        "NVIDIA",
        sensors,
        "On");
  }
}
