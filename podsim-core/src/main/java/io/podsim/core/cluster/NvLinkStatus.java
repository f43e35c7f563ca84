package io.podsim.core.cluster;

public enum NvLinkStatus {
  ACTIVE("Active"),
  INACTIVE("Inactive"),
  DOWN("Down");

  private final String label;

  NvLinkStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
