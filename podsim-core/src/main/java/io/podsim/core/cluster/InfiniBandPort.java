package io.podsim.core.cluster;

/**
 * Port of an InfiniBand HCA.
 *
 * @param portNumber 1-based port number
 * @param state logical state ("Active", "Down", "Initializing")
 * @param physicalState physical state ("LinkUp", "Polling", "Disabled")
 * @param rateGbps signalling rate in Gb/s
 * @param lid local identifier
 * @param guid port GUID, 0x-prefixed
 * @param linkLayer "InfiniBand" or "Ethernet"
 * @param errors PMA error counters
 */
public record InfiniBandPort(
    int portNumber,
    String state,
    String physicalState,
    int rateGbps,
    int lid,
    String guid,
    String linkLayer,
    PortErrors errors) {

  public InfiniBandPort {
    errors = errors == null ? PortErrors.NONE : errors;
  }

  /** A port with clean counters. */
  public InfiniBandPort(
      int portNumber,
      String state,
      String physicalState,
      int rateGbps,
      int lid,
      String guid,
      String linkLayer) {
    this(portNumber, state, physicalState, rateGbps, lid, guid, linkLayer, PortErrors.NONE);
  }

  public boolean isActive() {
    return "Active".equals(state);
  }

  public InfiniBandPort withState(String newState, String newPhysicalState) {
    return new InfiniBandPort(
        portNumber, newState, newPhysicalState, rateGbps, lid, guid, linkLayer, errors);
  }

  public InfiniBandPort withErrors(PortErrors newErrors) {
    return new InfiniBandPort(
        portNumber, state, physicalState, rateGbps, lid, guid, linkLayer, newErrors);
  }

  /** IBTA name of the signalling rate (QDR through XDR). */
  public String rateName() {
    if (rateGbps >= 800) {
      return "XDR";
    }
    if (rateGbps >= 400) {
      return "NDR";
    }
    if (rateGbps >= 200) {
      return "HDR";
    }
    if (rateGbps >= 100) {
      return "EDR";
    }
    if (rateGbps >= 56) {
      return "FDR";
    }
    return "QDR";
  }
}
