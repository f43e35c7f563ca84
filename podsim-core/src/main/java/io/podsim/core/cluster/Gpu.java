package io.podsim.core.cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one GPU. The store replaces snapshots through {@link
 * ClusterStore#updateGpu}; health is always derived from the fault fields and never stored.
 */
public final class Gpu {
  private final int index;
  private final String name;
  private final String type;
  private final String uuid;
  private final String pciAddress;
  private final int temperature;
  private final double powerDraw;
  private final double powerLimit;
  private final int memoryTotal;
  private final int memoryUsed;
  private final int utilization;
  private final int clocksSm;
  private final int clocksMem;
  private final boolean eccEnabled;
  private final EccErrors eccErrors;
  private final boolean migMode;
  private final boolean persistenceMode;
  private final List<NvLinkConnection> nvlinks;
  private final List<XidError> xidErrors;

  private Gpu(Builder b) {
    this.index = b.index;
    this.name = Objects.requireNonNull(b.name, "name");
    this.type = b.type;
    this.uuid = b.uuid;
    this.pciAddress = b.pciAddress;
    this.temperature = b.temperature;
    this.powerDraw = b.powerDraw;
    this.powerLimit = b.powerLimit;
    this.memoryTotal = b.memoryTotal;
    this.memoryUsed = b.memoryUsed;
    this.utilization = b.utilization;
    this.clocksSm = b.clocksSm;
    this.clocksMem = b.clocksMem;
    this.eccEnabled = b.eccEnabled;
    this.eccErrors = b.eccErrors;
    this.migMode = b.migMode;
    this.persistenceMode = b.persistenceMode;
    this.nvlinks = List.copyOf(b.nvlinks);
    this.xidErrors = List.copyOf(b.xidErrors);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.index = index;
    b.name = name;
    b.type = type;
    b.uuid = uuid;
    b.pciAddress = pciAddress;
    b.temperature = temperature;
    b.powerDraw = powerDraw;
    b.powerLimit = powerLimit;
    b.memoryTotal = memoryTotal;
    b.memoryUsed = memoryUsed;
    b.utilization = utilization;
    b.clocksSm = clocksSm;
    b.clocksMem = clocksMem;
    b.eccEnabled = eccEnabled;
    b.eccErrors = eccErrors;
    b.migMode = migMode;
    b.persistenceMode = persistenceMode;
    b.nvlinks = new ArrayList<>(nvlinks);
    b.xidErrors = new ArrayList<>(xidErrors);
    return b;
  }

  public int index() {
    return index;
  }

  /** Marketing name, e.g. "NVIDIA H100 80GB HBM3". */
  public String name() {
    return name;
  }

  /** Board type as printed by lspci, e.g. "H100-SXM5-80GB". */
  public String type() {
    return type;
  }

  public String uuid() {
    return uuid;
  }

  public String pciAddress() {
    return pciAddress;
  }

  public int temperature() {
    return temperature;
  }

  public double powerDraw() {
    return powerDraw;
  }

  public double powerLimit() {
    return powerLimit;
  }

  /** Framebuffer size in MiB. */
  public int memoryTotal() {
    return memoryTotal;
  }

  public int memoryUsed() {
    return memoryUsed;
  }

  public int utilization() {
    return utilization;
  }

  public int clocksSm() {
    return clocksSm;
  }

  public int clocksMem() {
    return clocksMem;
  }

  public boolean eccEnabled() {
    return eccEnabled;
  }

  public EccErrors eccErrors() {
    return eccErrors;
  }

  public boolean migMode() {
    return migMode;
  }

  public boolean persistenceMode() {
    return persistenceMode;
  }

  public List<NvLinkConnection> nvlinks() {
    return nvlinks;
  }

  public List<XidError> xidErrors() {
    return xidErrors;
  }

  public HealthStatus healthStatus() {
    return FaultRules.gpuHealth(this);
  }

  public static final class Builder {
    private int index;
    private String name = "NVIDIA H100 80GB HBM3";
    private String type = "H100-SXM5-80GB";
    private String uuid = "";
    private String pciAddress = "";
    private int temperature = 35;
    private double powerDraw = 70;
    private double powerLimit = 700;
    private int memoryTotal = 81920;
    private int memoryUsed;
    private int utilization;
    private int clocksSm = 1980;
    private int clocksMem = 2619;
    private boolean eccEnabled = true;
    private EccErrors eccErrors = EccErrors.NONE;
    private boolean migMode;
    private boolean persistenceMode = true;
    private List<NvLinkConnection> nvlinks = new ArrayList<>();
    private List<XidError> xidErrors = new ArrayList<>();

    private Builder() {}

    public Builder index(int index) {
      this.index = index;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder uuid(String uuid) {
      this.uuid = uuid;
      return this;
    }

    public Builder pciAddress(String pciAddress) {
      this.pciAddress = pciAddress;
      return this;
    }

    public Builder temperature(int temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder powerDraw(double powerDraw) {
      this.powerDraw = powerDraw;
      return this;
    }

    public Builder powerLimit(double powerLimit) {
      this.powerLimit = powerLimit;
      return this;
    }

    public Builder memoryTotal(int memoryTotal) {
      this.memoryTotal = memoryTotal;
      return this;
    }

    public Builder memoryUsed(int memoryUsed) {
      this.memoryUsed = memoryUsed;
      return this;
    }

    public Builder utilization(int utilization) {
      this.utilization = utilization;
      return this;
    }

    public Builder clocks(int sm, int mem) {
      this.clocksSm = sm;
      this.clocksMem = mem;
      return this;
    }

    public Builder eccEnabled(boolean eccEnabled) {
      this.eccEnabled = eccEnabled;
      return this;
    }

    public Builder eccErrors(EccErrors eccErrors) {
      this.eccErrors = Objects.requireNonNull(eccErrors);
      return this;
    }

    public Builder migMode(boolean migMode) {
      this.migMode = migMode;
      return this;
    }

    public Builder persistenceMode(boolean persistenceMode) {
      this.persistenceMode = persistenceMode;
      return this;
    }

    public Builder nvlinks(List<NvLinkConnection> nvlinks) {
      this.nvlinks = new ArrayList<>(nvlinks);
      return this;
    }

    /** Replaces the status of one link, leaving the others untouched. */
    public Builder nvlinkStatus(int linkId, NvLinkStatus status) {
      for (int i = 0; i < nvlinks.size(); i++) {
        if (nvlinks.get(i).linkId() == linkId) {
          nvlinks.set(i, nvlinks.get(i).withStatus(status));
        }
      }
      return this;
    }

    public Builder xidErrors(List<XidError> xidErrors) {
      this.xidErrors = new ArrayList<>(xidErrors);
      return this;
    }

    public Builder addXidError(XidError error) {
      this.xidErrors.add(error);
      return this;
    }

    public Gpu build() {
      return new Gpu(this);
    }
  }
}
