package io.podsim.tools.cmsh;

import java.util.Locale;
import java.util.Optional;

/** Top-level cmsh modes. */
public enum CmshMode {
  ROOT,
  DEVICE,
  CATEGORY,
  SOFTWAREIMAGE,
  PARTITION;

  /** The word typed to enter the mode, empty for the root. */
  public String keyword() {
    return this == ROOT ? "" : name().toLowerCase(Locale.ROOT);
  }

  public static Optional<CmshMode> byKeyword(String word) {
    for (CmshMode mode : values()) {
      if (mode != ROOT && mode.keyword().equals(word)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
