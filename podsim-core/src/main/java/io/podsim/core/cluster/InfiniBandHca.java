package io.podsim.core.cluster;

import java.util.List;

/**
 * InfiniBand host channel adapter.
 *
 * @param caName device name as reported by the verbs stack (e.g. mlx5_0)
 * @param model adapter model (e.g. ConnectX-7)
 * @param firmwareVersion firmware version string
 * @param pciAddress PCI bus address
 * @param ports adapter ports
 */
public record InfiniBandHca(
    String caName,
    String model,
    String firmwareVersion,
    String pciAddress,
    List<InfiniBandPort> ports) {

  public InfiniBandHca {
    ports = List.copyOf(ports);
  }

  /** Hardware device id printed by ibstat. */
  public String deviceId() {
    return model.contains("ConnectX-7") ? "MT4129" : "MT4123";
  }

  public String nodeGuid() {
    return ports.isEmpty() ? "0x0000000000000000" : ports.get(0).guid();
  }
}
