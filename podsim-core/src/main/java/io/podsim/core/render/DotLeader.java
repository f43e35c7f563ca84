package io.podsim.core.render;

/**
 * Fixed-width report lines of the form {@code description ..... status}, as printed by nvsm. The
 * dot run fills the line to the target width and is never shorter than one dot.
 */
public final class DotLeader {

  /** Width of a health report line. */
  public static final int DEFAULT_WIDTH = 70;

  private DotLeader() {}

  public static String line(String description, String status) {
    return line(description, status, DEFAULT_WIDTH);
  }

  /**
   * Formats one line. Lengths are measured without ANSI codes, which are kept in the output.
   *
   * @param description left-hand text
   * @param status right-hand text, possibly colored
   * @param width target visible width
   * @return the formatted line, exactly {@code width} visible characters unless the texts are too
   *     long to fit with one dot
   */
  public static String line(String description, String status, int width) {
    int dots = dotCount(description, status, width);
    return description + " " + ".".repeat(dots) + " " + status;
  }

  static int dotCount(String description, String status, int width) {
    int separators = 2;
    return Math.max(
        1, width - Ansi.visibleLength(description) - Ansi.visibleLength(status) - separators);
  }
}
