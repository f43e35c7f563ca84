package io.podsim.core.render;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.cluster.HealthStatus;
import org.junit.jupiter.api.Test;

class DotLeaderTest {

  @Test
  void shortDescriptionFillsToSeventyColumns() {
    String line = DotLeader.line("Root file system usage", "Healthy");

    assertEquals(70, line.length());
    assertTrue(line.startsWith("Root file system usage ..."));
    assertTrue(line.endsWith("... Healthy"));
  }

  @Test
  void ansiCodesDoNotCountTowardsWidth() {
    String status = Ansi.status("Critical", HealthStatus.CRITICAL);
    String line = DotLeader.line("GPU ECC status [GPU0]", status);

    assertEquals(70, Ansi.visibleLength(line));
    assertTrue(line.length() > 70);
    assertTrue(line.endsWith(Ansi.RESET));
  }

  @Test
  void overlongDescriptionStillGetsOneDot() {
    String description = "x".repeat(80);
    String line = DotLeader.line(description, "Healthy");

    assertEquals(description + " . Healthy", line);
  }

  @Test
  void exactFitKeepsOneDot() {
    String description = "d".repeat(70 - 2 - 1 - "OK".length());
    String line = DotLeader.line(description, "OK");

    assertEquals(70, line.length());
    assertEquals(1, DotLeader.dotCount(description, "OK", 70));
  }

  @Test
  void descriptionFillingTheLineOverflowsByOneDot() {
    String description = "e".repeat(60);
    String line = DotLeader.line(description, Ansi.status("Critical", HealthStatus.CRITICAL));

    assertEquals(71, Ansi.visibleLength(line));
    assertEquals(description + " . Critical", Ansi.strip(line));
  }

  @Test
  void customWidth() {
    assertEquals("a .... b", DotLeader.line("a", "b", 8));
  }

  @Test
  void stripRemovesSgrSequencesOnly() {
    String colored = Ansi.BOLD + "GPU" + Ansi.RESET + " " + Ansi.color("ok", Ansi.CYAN);

    assertEquals("GPU ok", Ansi.strip(colored));
    assertEquals(6, Ansi.visibleLength(colored));
    assertEquals("plain", Ansi.strip("plain"));
    assertEquals(0, Ansi.visibleLength(null));
  }

  @Test
  void paddingIsAnsiAware() {
    String warn = Ansi.status("Warning", HealthStatus.WARNING);

    assertEquals(10, Ansi.visibleLength(Ansi.padRight(warn, 10)));
    assertEquals("   ab", Ansi.padLeft("ab", 5));
    assertEquals("abcdef", Ansi.padRight("abcdef", 3));
  }
}
