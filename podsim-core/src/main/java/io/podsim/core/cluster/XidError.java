package io.podsim.core.cluster;

import java.time.Instant;

/**
 * One recorded XID occurrence on a GPU. Description and severity are not stored here; they always
 * come from {@link XidCatalog}.
 */
public record XidError(int code, Instant timestamp) {

  public XidInfo info() {
    return XidCatalog.lookup(code);
  }

  public String description() {
    return info().description();
  }

  public XidSeverity severity() {
    return info().severity();
  }
}
