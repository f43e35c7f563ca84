package io.podsim.core.render;

import io.podsim.core.cluster.HealthStatus;
import java.util.regex.Pattern;

/** ANSI SGR helpers. Width calculations always use {@link #visibleLength}. */
public final class Ansi {
  public static final String RESET = "\u001b[0m";
  public static final String BOLD = "\u001b[1m";
  public static final String RED = "\u001b[31m";
  public static final String GREEN = "\u001b[32m";
  public static final String YELLOW = "\u001b[33m";
  public static final String CYAN = "\u001b[36m";

  private static final Pattern SGR = Pattern.compile("\u001b\\[[0-9;]*[A-Za-z]");

  private Ansi() {}

  public static String strip(String s) {
    if (s == null || s.indexOf('\u001b') < 0) {
      return s;
    }
    return SGR.matcher(s).replaceAll("");
  }

  public static int visibleLength(String s) {
    return s == null ? 0 : strip(s).length();
  }

  public static String color(String text, String code) {
    return code + text + RESET;
  }

  /** Red for critical, yellow for warning, green otherwise. */
  public static String colorFor(HealthStatus status) {
    return switch (status) {
      case CRITICAL -> RED;
      case WARNING -> YELLOW;
      case OK -> GREEN;
    };
  }

  /** Colors {@code text} by health status. */
  public static String status(String text, HealthStatus status) {
    return color(text, colorFor(status));
  }

  /** Pads on the right to a visible width; escape codes do not count. */
  public static String padRight(String s, int width) {
    int visible = visibleLength(s);
    return visible >= width ? s : s + " ".repeat(width - visible);
  }

  public static String padLeft(String s, int width) {
    int visible = visibleLength(s);
    return visible >= width ? s : " ".repeat(width - visible) + s;
  }
}
