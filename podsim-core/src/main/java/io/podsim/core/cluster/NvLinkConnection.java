package io.podsim.core.cluster;

/** One NVLink of a GPU with its error counters. */
public record NvLinkConnection(
    int linkId,
    NvLinkStatus status,
    int speedGbps,
    long txErrors,
    long rxErrors,
    long replayErrors) {

  public static NvLinkConnection active(int linkId, int speedGbps) {
    return new NvLinkConnection(linkId, NvLinkStatus.ACTIVE, speedGbps, 0, 0, 0);
  }

  public NvLinkConnection withStatus(NvLinkStatus newStatus) {
    return new NvLinkConnection(linkId, newStatus, speedGbps, txErrors, rxErrors, replayErrors);
  }

  public boolean isActive() {
    return status == NvLinkStatus.ACTIVE;
  }
}
