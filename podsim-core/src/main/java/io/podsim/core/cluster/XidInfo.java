package io.podsim.core.cluster;

import java.util.List;

/**
 * Reference entry for one XID code.
 *
 * @param code driver XID number
 * @param name short reference name
 * @param description canonical one-line description printed by every tool
 * @param severity severity class
 * @param category fault category (Hardware, Memory, NVLink, ...)
 * @param cause typical root cause
 * @param actions recommended operator actions, in order
 */
public record XidInfo(
    int code,
    String name,
    String description,
    XidSeverity severity,
    String category,
    String cause,
    List<String> actions) {

  public XidInfo {
    actions = List.copyOf(actions);
  }

  public boolean isCritical() {
    return severity == XidSeverity.CRITICAL;
  }
}
