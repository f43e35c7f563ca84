package io.podsim.core.render;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.cluster.HealthStatus;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/** Width invariants of the fixed-width formatters. */
class PropertyBasedFormatterTests {

  @Property
  void dotLeaderIsSeventyColumnsWhenItFits(
      @ForAll @AlphaChars @StringLength(max = 59) String description,
      @ForAll HealthStatus status) {
    String label = Ansi.status(status == HealthStatus.OK ? "Healthy" : status.label(), status);
    String line = DotLeader.line(description, label);

    assertEquals(DotLeader.DEFAULT_WIDTH, Ansi.visibleLength(line));
  }

  @Property
  void nearFullDescriptionKeepsOneDotAndOverflows(
      @ForAll @AlphaChars @StringLength(min = 60, max = 90) String description,
      @ForAll HealthStatus status) {
    String text = status == HealthStatus.OK ? "Healthy" : status.label();
    String label = Ansi.status(text, status);
    String line = DotLeader.line(description, label);
    int fill = DotLeader.DEFAULT_WIDTH - description.length() - text.length() - 2;

    if (fill >= 1) {
      assertEquals(DotLeader.DEFAULT_WIDTH, Ansi.visibleLength(line));
    } else {
      assertEquals(description + " . " + text, Ansi.strip(line));
      assertTrue(Ansi.visibleLength(line) > DotLeader.DEFAULT_WIDTH);
    }
  }

  @Property
  void dotLeaderAlwaysHasAtLeastOneDot(
      @ForAll @AlphaChars @StringLength(max = 200) String description,
      @ForAll @AlphaChars @StringLength(min = 1, max = 20) String status) {
    String line = DotLeader.line(description, status);
    String between =
        line.substring(description.length(), line.length() - status.length()).trim();

    assertFalse(between.isEmpty());
    assertTrue(between.chars().allMatch(c -> c == '.'));
  }

  @Property
  void padRightReachesRequestedVisibleWidth(
      @ForAll @AlphaChars @StringLength(max = 30) String text,
      @ForAll @IntRange(max = 40) int width) {
    String padded = Ansi.padRight(Ansi.color(text, Ansi.YELLOW), width);

    assertEquals(Math.max(width, text.length()), Ansi.visibleLength(padded));
  }
}
