package io.podsim.core.cluster;

/**
 * Error counters of an InfiniBand port, as read from the port's PMA.
 *
 * @param symbolErrors minor link errors, usually a dirty or marginal cable
 * @param linkDowned times the link went down since the counters were cleared
 * @param portRcvErrors malformed packets received
 * @param portXmitDiscards outbound packets dropped
 * @param portXmitWait ticks the port had data but no credits to send
 */
public record PortErrors(
    long symbolErrors,
    long linkDowned,
    long portRcvErrors,
    long portXmitDiscards,
    long portXmitWait) {

  public static final PortErrors NONE = new PortErrors(0, 0, 0, 0, 0);

  public boolean isClean() {
    return symbolErrors == 0 && linkDowned == 0 && portRcvErrors == 0 && portXmitDiscards == 0;
  }
}
