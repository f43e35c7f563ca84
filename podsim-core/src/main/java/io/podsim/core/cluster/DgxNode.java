package io.podsim.core.cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A DGX compute node. Identity and hardware inventory are fixed at construction; GPUs, HCAs and
 * the Slurm state change only through {@link ClusterStore}.
 */
public final class DgxNode {
  private final String id;
  private final String hostname;
  private final String systemType;
  private final String driverVersion;
  private final String cudaVersion;
  private final String osVersion;
  private final String kernelVersion;
  private final String cpuModel;
  private final int cpuCount;
  private final int ramTotalGb;
  private final BmcInfo bmc;
  private List<Gpu> gpus;
  private List<InfiniBandHca> hcas;
  private String slurmState;

  private DgxNode(Builder b) {
    this.id = b.id;
    this.hostname = b.hostname;
    this.systemType = b.systemType;
    this.driverVersion = b.driverVersion;
    this.cudaVersion = b.cudaVersion;
    this.osVersion = b.osVersion;
    this.kernelVersion = b.kernelVersion;
    this.cpuModel = b.cpuModel;
    this.cpuCount = b.cpuCount;
    this.ramTotalGb = b.ramTotalGb;
    this.bmc = b.bmc;
    this.gpus = List.copyOf(b.gpus);
    this.hcas = List.copyOf(b.hcas);
    this.slurmState = b.slurmState;
  }

  public static Builder builder(String id, String hostname) {
    return new Builder(id, hostname);
  }

  public String id() {
    return id;
  }

  public String hostname() {
    return hostname;
  }

  /** System type such as "DGX-H100". */
  public String systemType() {
    return systemType;
  }

  /** Lowercase cmsh category name, e.g. "dgx-h100". */
  public String category() {
    return "dgx-" + systemType.replace("DGX-", "").toLowerCase(Locale.ROOT);
  }

  public String driverVersion() {
    return driverVersion;
  }

  public String cudaVersion() {
    return cudaVersion;
  }

  public String osVersion() {
    return osVersion;
  }

  public String kernelVersion() {
    return kernelVersion;
  }

  public String cpuModel() {
    return cpuModel;
  }

  public int cpuCount() {
    return cpuCount;
  }

  public int ramTotalGb() {
    return ramTotalGb;
  }

  public BmcInfo bmc() {
    return bmc;
  }

  public List<Gpu> gpus() {
    return gpus;
  }

  public Optional<Gpu> gpu(int index) {
    return gpus.stream().filter(g -> g.index() == index).findFirst();
  }

  public List<InfiniBandHca> hcas() {
    return hcas;
  }

  public String slurmState() {
    return slurmState;
  }

  public HealthStatus healthStatus() {
    return FaultRules.nodeHealth(this);
  }

  /** GPU model token used in Slurm GRES strings, e.g. "h100". */
  public String gresType() {
    return systemType.replace("DGX-", "").toLowerCase(Locale.ROOT);
  }

  /** Chassis serial number as programmed into the FRU and SMBIOS tables. */
  public String serialNumber() {
    return String.format("16604230%05d", hostname.hashCode() & 0xffff);
  }

  /** A node with the same inventory and current state that later mutations do not share. */
  DgxNode copy() {
    return builder(id, hostname)
        .systemType(systemType)
        .driverVersion(driverVersion)
        .cudaVersion(cudaVersion)
        .osVersion(osVersion)
        .kernelVersion(kernelVersion)
        .cpu(cpuModel, cpuCount)
        .ramTotalGb(ramTotalGb)
        .bmc(bmc)
        .gpus(gpus)
        .hcas(hcas)
        .slurmState(slurmState)
        .build();
  }

  void replaceGpu(Gpu gpu) {
    List<Gpu> copy = new ArrayList<>(gpus);
    for (int i = 0; i < copy.size(); i++) {
      if (copy.get(i).index() == gpu.index()) {
        copy.set(i, gpu);
      }
    }
    this.gpus = List.copyOf(copy);
  }

  void replaceHca(InfiniBandHca hca) {
    List<InfiniBandHca> copy = new ArrayList<>(hcas);
    for (int i = 0; i < copy.size(); i++) {
      if (copy.get(i).caName().equals(hca.caName())) {
        copy.set(i, hca);
      }
    }
    this.hcas = List.copyOf(copy);
  }

  void slurmState(String state) {
    this.slurmState = state;
  }

  public static final class Builder {
    private final String id;
    private final String hostname;
    private String systemType = "DGX-H100";
    private String driverVersion = "535.104.05";
    private String cudaVersion = "12.2";
    private String osVersion = "Ubuntu 22.04.3 LTS";
    private String kernelVersion = "5.15.0-1035-nvidia";
    private String cpuModel = "Intel(R) Xeon(R) Platinum 8480C";
    private int cpuCount = 112;
    private int ramTotalGb = 2048;
    private BmcInfo bmc;
    private List<Gpu> gpus = new ArrayList<>();
    private List<InfiniBandHca> hcas = new ArrayList<>();
    private String slurmState = "idle";

    private Builder(String id, String hostname) {
      this.id = id;
      this.hostname = hostname;
    }

    public Builder systemType(String systemType) {
      this.systemType = systemType;
      return this;
    }

    public Builder driverVersion(String driverVersion) {
      this.driverVersion = driverVersion;
      return this;
    }

    public Builder cudaVersion(String cudaVersion) {
      this.cudaVersion = cudaVersion;
      return this;
    }

    public Builder osVersion(String osVersion) {
      this.osVersion = osVersion;
      return this;
    }

    public Builder kernelVersion(String kernelVersion) {
      this.kernelVersion = kernelVersion;
      return this;
    }

    public Builder cpu(String model, int count) {
      this.cpuModel = model;
      this.cpuCount = count;
      return this;
    }

    public Builder ramTotalGb(int ramTotalGb) {
      this.ramTotalGb = ramTotalGb;
      return this;
    }

    public Builder bmc(BmcInfo bmc) {
      this.bmc = bmc;
      return this;
    }

    public Builder gpus(List<Gpu> gpus) {
      this.gpus = new ArrayList<>(gpus);
      return this;
    }

    public Builder hcas(List<InfiniBandHca> hcas) {
      this.hcas = new ArrayList<>(hcas);
      return this;
    }

    public Builder slurmState(String slurmState) {
      this.slurmState = slurmState;
      return this;
    }

    public DgxNode build() {
      return new DgxNode(this);
    }
  }
}
