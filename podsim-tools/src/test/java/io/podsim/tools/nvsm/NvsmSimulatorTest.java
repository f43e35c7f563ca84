package io.podsim.tools.nvsm;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.core.cluster.EccErrors;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.core.render.Ansi;
import io.podsim.tools.ToolFixture;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NvsmSimulatorTest {
  private NvsmSimulator simulator;
  private ToolFixture nvsm;

  @BeforeEach
  void setUp() {
    simulator = new NvsmSimulator();
    nvsm = ToolFixture.of(simulator);
  }

  private static String line(String output, String description) {
    return Arrays.stream(Ansi.strip(output).split("\n"))
        .filter(l -> l.startsWith(description + " "))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no line for " + description));
  }

  @Nested
  class Health {
    @Test
    void summaryIsTruncated() {
      String out = nvsm.output("nvsm show health");

      assertTrue(out.contains("Checks\n------\n"));
      assertTrue(out.contains("... 171 more checks"));
      assertTrue(out.contains("Health Summary"));
      assertTrue(out.contains("191 out of 191 checks are Healthy"));
      assertTrue(out.contains("Overall system status is Healthy"));
    }

    @Test
    void detailedListsEveryCheck() {
      String out = nvsm.output("nvsm show health --detailed");

      assertFalse(out.contains("more checks"));
      assertTrue(out.contains("GPU temperature [GPU7]"));
      assertTrue(out.contains("NVLink 17 status [GPU7]"));
      assertTrue(out.contains("GPU XID error check [GPU0]"));
      assertTrue(out.contains("InfiniBand port 1 [ConnectX-7]"));
      assertTrue(out.contains("Verify installed DIMM memory sticks"));
      assertTrue(out.contains("Number of logical CPU cores"));
      assertTrue(out.contains("Root file system usage"));
    }

    @Test
    void everyLeaderLineIsSeventyColumns() {
      nvsm.store().addXidError("dgx-00", 3, 79);
      String raw = nvsm.run("nvsm show health --detailed").output();

      List<String> lines = Arrays.stream(raw.split("\n")).filter(l -> l.contains("...")).toList();
      assertFalse(lines.isEmpty());
      for (String l : lines) {
        assertEquals(70, Ansi.visibleLength(l), l);
        assertTrue(Ansi.strip(l).matches(".*\\. (Healthy|Warning|Critical)$"), l);
      }
    }

    @Test
    void doubleBitEccIsCritical() {
      nvsm.store().updateGpu("dgx-00", 0, b -> b.eccErrors(EccErrors.of(0, 2)));

      String out = nvsm.run("nvsm show health --detailed").output();

      assertTrue(line(out, "GPU ECC status [GPU0]").endsWith("Critical"));
      assertTrue(line(out, "GPU ECC status [GPU1]").endsWith("Healthy"));
      assertTrue(Ansi.strip(out).contains("Overall system status is Critical"));
    }

    @Test
    void singleBitEccAboveLimitIsWarning() {
      nvsm.store().updateGpu("dgx-00", 2, b -> b.eccErrors(EccErrors.of(150, 0)));

      String out = nvsm.run("nvsm show health --detailed").output();

      assertTrue(line(out, "GPU ECC status [GPU2]").endsWith("Warning"));
    }

    @Test
    void temperatureBands() {
      nvsm.store().updateGpu("dgx-00", 0, b -> b.temperature(85));
      nvsm.store().updateGpu("dgx-00", 1, b -> b.temperature(95));
      nvsm.store().updateGpu("dgx-00", 2, b -> b.temperature(90));

      String out = nvsm.run("nvsm show health --detailed").output();

      assertTrue(line(out, "GPU temperature [GPU0]").endsWith("Warning"));
      assertTrue(line(out, "GPU temperature [GPU1]").endsWith("Critical"));
      assertTrue(line(out, "GPU temperature [GPU2]").endsWith("Warning"));
    }

    @Test
    void downNvlinkIsCritical() {
      nvsm.store().updateGpu("dgx-00", 4, b -> b.nvlinkStatus(3, NvLinkStatus.DOWN));

      String out = nvsm.run("nvsm show health --detailed").output();

      assertTrue(line(out, "NVLink 3 status [GPU4]").endsWith("Critical"));
      assertTrue(line(out, "NVLink 2 status [GPU4]").endsWith("Healthy"));
    }

    @Test
    void xidHistoryDrivesXidCheck() {
      nvsm.store().addXidError("dgx-00", 0, 79);
      nvsm.store().addXidError("dgx-00", 1, 31);

      String out = nvsm.run("nvsm show health --detailed").output();

      assertTrue(line(out, "GPU XID error check [GPU0]").endsWith("Critical"));
      assertTrue(line(out, "GPU XID error check [GPU1]").endsWith("Warning"));
      assertTrue(line(out, "GPU link speed [GPU0]").endsWith("Critical"));
    }

    @Test
    void downInfinibandPortIsCritical() {
      nvsm.store().setPortState("dgx-00", "mlx5_2", 1, "Down", "Disabled");

      String out = nvsm.run("nvsm show health --detailed").output();

      assertTrue(line(out, "InfiniBand port 1 [ConnectX-7] mlx5_2").endsWith("Critical"));
    }
  }

  @Nested
  class Session {
    @BeforeEach
    void enter() {
      CommandResult result = nvsm.run("nvsm");
      assertEquals("nvsm> ", result.prompt().orElseThrow());
    }

    @Test
    void promptFollowsPath() {
      assertEquals("nvsm(/)> ", nvsm.interactive("cd /").prompt().get());
      assertEquals("nvsm(/systems)> ", nvsm.interactive("cd systems").prompt().get());
      assertEquals("nvsm> ", nvsm.interactive("cd localhost").prompt().get());
      assertEquals("nvsm(/systems/localhost/gpus/GPU0)> ",
          nvsm.interactive("cd gpus/GPU0").prompt().get());
      assertEquals("nvsm(/systems/localhost/gpus)> ", nvsm.interactive("cd ..").prompt().get());
      assertEquals("nvsm> ", nvsm.interactive("cd").prompt().get());
      assertFalse(nvsm.interactive("cd /").prompt().get().contains("->"));
    }

    @Test
    void invalidTargetListsAlternatives() {
      CommandResult result = nvsm.interactive("cd /nonexistent");

      assertEquals(1, result.exitCode());
      assertTrue(result.output().contains("does not exist"));
      assertTrue(result.output().contains("Available targets: gpus, network"));
      assertEquals("nvsm> ", result.prompt().get());
      assertEquals(NvsmState.DEFAULT_PATH, simulator.currentState().orElseThrow().path());
    }

    @Test
    void showListsPropertiesTargetsVerbs() {
      String out = nvsm.interactive("show").output();

      assertTrue(out.startsWith("/systems/localhost\n"));
      assertTrue(out.contains("Properties:\n    Hostname = dgx-node01\n"));
      assertTrue(out.contains("SystemType = DGX-H100"));
      assertTrue(out.contains("Targets:\n    gpus\n    network\n    storage\n"));
      assertTrue(out.contains("Verbs:\n    cd\n    show\n    dump\n"));

      nvsm.interactive("cd gpus");
      assertTrue(nvsm.interactive("show").output().contains("GPUCount = 8"));
      assertTrue(nvsm.interactive("show GPU3").output().contains("PCIAddress = 0000:5d:00.0"));
    }

    @Test
    void healthAndDumpInsideSession() {
      CommandResult health = nvsm.interactive("show health --detailed");
      assertEquals(0, health.exitCode());
      assertFalse(health.output().contains("more checks"));

      CommandResult dump = nvsm.interactive("dump health");
      assertTrue(dump.output().contains(
          "Writing output to /tmp/nvsm-health-dgx-node01-20240315100000.tar.xz"));
      assertTrue(dump.output().contains("Done."));

      CommandResult bare = nvsm.interactive("dump");
      assertEquals(1, bare.exitCode());
      assertTrue(bare.output().contains("Usage: dump health"));
    }

    @Test
    void unknownVerbsAndEmptyLines() {
      CommandResult list = nvsm.interactive("list");
      assertEquals(1, list.exitCode());
      assertTrue(list.output().contains("Unknown verb 'list'"));

      CommandResult empty = nvsm.interactive("");
      assertEquals(0, empty.exitCode());
      assertEquals("", empty.output());
      assertEquals("nvsm> ", empty.prompt().get());

      assertTrue(nvsm.interactive("help").output()
          .contains("NVIDIA System Management (NVSM) Interactive Shell"));
    }

    @Test
    void exitAndQuitEndTheSession() {
      nvsm.interactive("cd gpus");
      CommandResult exit = nvsm.interactive("exit");

      assertEquals(0, exit.exitCode());
      assertFalse(exit.isInteractive());
      assertTrue(simulator.currentState().isEmpty());

      nvsm.run("nvsm");
      assertFalse(nvsm.interactive("quit").isInteractive());
    }
  }

  @Test
  void directFormsDoNotOpenSession() {
    CommandResult show = nvsm.run("nvsm show");
    assertTrue(show.output().contains("/systems/localhost"));
    assertFalse(show.isInteractive());

    CommandResult health = nvsm.run("nvsm show health");
    assertTrue(health.output().contains("Checks"));
    assertFalse(health.isInteractive());

    assertTrue(nvsm.output("nvsm dump health").contains("tar.xz"));
    assertTrue(simulator.currentState().isEmpty());
  }

  @Test
  void helpVersionAndUnknown() {
    String help = nvsm.output("nvsm --help");
    assertTrue(help.contains("NVIDIA System Management"));
    assertTrue(help.contains("Usage:"));
    assertEquals("nvsm version 24.03", nvsm.output("nvsm --version"));

    CommandResult bogus = nvsm.run("nvsm bogus");
    assertEquals(1, bogus.exitCode());
    assertTrue(bogus.output().contains("Unknown command"));
  }

  @Test
  void missingNodeCannotReachDaemon() {
    ToolFixture elsewhere = ToolFixture.on(new NvsmSimulator(), "login-01");

    CommandResult result = elsewhere.run("nvsm show health");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("Cannot connect to NVSM daemon"));
    assertEquals(1, elsewhere.run("nvsm").exitCode());
  }
}
