package io.podsim.tools.fabric;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.core.cluster.XidCatalog;
import io.podsim.tools.ToolFixture;
import io.podsim.tools.system.SystemdUnit;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class FabricManagerSimulatorTest {
  private static final Pattern SWITCH_UUID =
      Pattern.compile("NVSwitch-[0-9a-f]{8}-[0-9a-f]{8}-[0-9a-f]{8}-[0-9a-f]{8}");

  private ToolFixture fm;

  @BeforeEach
  void setUp() {
    fm = ToolFixture.of(new FabricManagerSimulator());
  }

  private static String value(String out, String label) {
    return Arrays.stream(out.split("\n"))
        .filter(l -> l.trim().startsWith(label))
        .map(l -> l.trim().substring(label.length()).trim())
        .findFirst()
        .orElseThrow(() -> new AssertionError(label + " missing from\n" + out));
  }

  private void downLink(int gpu, int link) {
    fm.store().updateGpu("dgx-00", gpu, b -> b.nvlinkStatus(link, NvLinkStatus.DOWN));
  }

  @ParameterizedTest
  @ValueSource(strings = {"nv-fabricmanager", "nv-fabricmanager --help", "nv-fabricmanager -h"})
  void help(String line) {
    String out = fm.output(line);

    assertTrue(out.startsWith("NVIDIA Fabric Manager CLI\n"));
    assertTrue(out.contains("Commands:\n"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"--version", "-v"})
  void version(String flag) {
    assertEquals("nv-fabricmanager version 535.104.05\nCUDA Version: 12.2\n"
        + "Driver Version: 535.104.05\n", fm.output("nv-fabricmanager " + flag));
  }

  @Test
  void unknownSubcommand() {
    CommandResult result = fm.run("nv-fabricmanager badcommand");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().startsWith("Unknown subcommand: badcommand\n"));
  }

  @ParameterizedTest
  @CsvSource({"8, 6", "16, 6", "4, 2", "2, 0", "0, 0"})
  void nvswitchCountFollowsBaseboard(int gpus, int switches) {
    assertEquals(switches, FabricManagerSimulator.nvswitchCount(gpus));
  }

  @Nested
  class Status {

    @Test
    void healthyNode() {
      String out = fm.output("nv-fabricmanager status");

      assertEquals("Running", value(out, "Fabric Manager:"));
      assertEquals("1820", value(out, "PID:"));
      assertEquals("0d 1h 59m", value(out, "Uptime:"));
      assertEquals(FabricManagerSimulator.CONFIG_FILE, value(out, "Config File:"));
      assertEquals("DGX H100", value(out, "System Type:"));
      assertEquals("6", value(out, "NVSwitches:"));
      assertEquals("144", value(out, "NVLinks Total:"));
      assertEquals("144", value(out, "NVLinks Active:"));
      assertEquals("Healthy", value(out, "Overall:"));
    }

    @Test
    void downLinkDegrades() {
      downLink(2, 5);

      String out = fm.output("nv-fabricmanager status");
      assertEquals("143", value(out, "NVLinks Active:"));
      assertEquals("Degraded", value(out, "Overall:"));
      assertEquals("1", value(out, "Errors Detected:"));
    }

    @Test
    void stoppedServiceStillReportsStatus() {
      fm.store().setServiceActive("dgx-00", SystemdUnit.FABRIC_MANAGER, false);

      String out = fm.output("nv-fabricmanager status");
      assertEquals("Stopped", value(out, "Fabric Manager:"));
      assertFalse(out.contains("PID:"));
      assertEquals("Degraded", value(out, "Overall:"));
    }
  }

  @Nested
  class ServiceControl {

    @Test
    void stopAndStartToggleTheUnit() {
      assertTrue(fm.output("nv-fabricmanager stop").contains("NVIDIA Fabric Manager stopped."));
      assertFalse(fm.store().isServiceActive("dgx-00", SystemdUnit.FABRIC_MANAGER));

      String started = fm.output("nv-fabricmanager start");
      assertTrue(started.startsWith("Starting NVIDIA Fabric Manager..."));
      assertTrue(started.contains("started successfully"));
      assertTrue(fm.store().isServiceActive("dgx-00", SystemdUnit.FABRIC_MANAGER));
    }

    @Test
    void startWhileRunning() {
      assertEquals("NVIDIA Fabric Manager is already running (PID 1820).\n",
          fm.output("nv-fabricmanager start"));
    }

    @Test
    void restart() {
      fm.run("nv-fabricmanager stop");

      String out = fm.output("nv-fabricmanager restart");
      assertTrue(out.startsWith("Restarting NVIDIA Fabric Manager..."));
      assertTrue(out.contains("restarted successfully"));
      assertTrue(fm.store().isServiceActive("dgx-00", SystemdUnit.FABRIC_MANAGER));
    }

    @ParameterizedTest
    @ValueSource(strings = {"query nvswitch", "diag", "topo"})
    void fabricCommandsNeedTheService(String sub) {
      fm.run("nv-fabricmanager stop");

      CommandResult result = fm.run("nv-fabricmanager " + sub);
      assertEquals(1, result.exitCode());
      assertTrue(result.output().startsWith(
          "Error: Unable to connect to Fabric Manager on dgx-node01."));
    }
  }

  @Nested
  class Query {

    @Test
    void nvswitchesHaveStableIdentity() {
      String out = fm.output("nv-fabricmanager query nvswitch");

      Matcher m = SWITCH_UUID.matcher(out);
      Set<String> uuids = new HashSet<>();
      while (m.find()) {
        uuids.add(m.group());
      }
      assertEquals(6, uuids.size());
      assertEquals(out, fm.output("nv-fabricmanager query nvswitch"));
      assertTrue(out.contains("Total NVSwitches: 6\n"));
      assertFalse(out.contains("+--"));
    }

    @Test
    void switchPowerWithinEnvelope() {
      DgxNode node = fm.store().findNode("dgx-00").orElseThrow();
      for (int i = 0; i < 6; i++) {
        int watts = FabricManagerSimulator.nvswitchPower(node, i);
        assertTrue(watts >= 60 && watts <= 120, "switch " + i + ": " + watts);
      }
      assertNotEquals(FabricManagerSimulator.nvswitchUuid(node, 0),
          FabricManagerSimulator.nvswitchUuid(node, 1));
    }

    @Test
    void topologyListsGpusAndSwitches() {
      downLink(0, 0);

      String out = fm.output("nv-fabricmanager query topology");
      assertTrue(out.contains("Hostname: dgx-node01\n"));
      assertTrue(out.contains("GPU 0: NVIDIA H100 80GB HBM3 - 17/18 NVLinks active\n"));
      assertTrue(out.contains("GPU 1: NVIDIA H100 80GB HBM3 - 18/18 NVLinks active\n"));
      assertTrue(out.contains("NVSwitch 0: Connected to GPUs [0, 1, 2, 3, 4, 5, 6, 7]\n"));
    }

    @Test
    void nvlinkCounts() {
      downLink(1, 3);
      downLink(1, 4);

      String out = fm.output("nv-fabricmanager query nvlink");
      assertTrue(out.startsWith("NVLink Status\n"));
      assertTrue(out.contains("NVLink4"));
      assertTrue(out.contains("Total NVLinks: 144\n"));
      assertTrue(out.contains("Active NVLinks: 142\n"));
      assertTrue(out.contains("Inactive NVLinks: 2\n"));
    }

    @Test
    void queryTypes() {
      assertTrue(fm.output("nv-fabricmanager query").startsWith("Query types:\n"));

      CommandResult bad = fm.run("nv-fabricmanager query bogus");
      assertEquals(1, bad.exitCode());
      assertTrue(bad.output().startsWith("Invalid query type: bogus"));
    }
  }

  @Test
  void config() {
    String out = fm.output("nv-fabricmanager config");

    assertEquals(out, fm.output("nv-fabricmanager config show"));
    for (String section : List.of("[General]", "[Fabric]", "[NVSwitch]", "[Health]")) {
      assertTrue(out.contains(section + "\n"), section);
    }
    assertTrue(out.contains("  FABRIC_MODE=FULL_SPEED\n"));
    assertTrue(out.contains("  FM_CMD_PORT_NUMBER=16001\n"));
    assertEquals(1, fm.run("nv-fabricmanager config edit").exitCode());
  }

  @Nested
  class Diagnostics {

    @Test
    void basicRunsFiveChecks() {
      String out = fm.output("nv-fabricmanager diag");

      for (int i = 1; i <= 5; i++) {
        assertTrue(out.contains("[" + i + "/5]"), "step " + i);
      }
      assertTrue(out.contains("Aggregate Bandwidth: 7200 GB/s\n"));
      assertTrue(out.endsWith("Diagnostic Summary: PASSED\n"));
    }

    @Test
    void quickNeedsAttentionWithDownLink() {
      assertTrue(fm.output("nv-fabricmanager diag quick").contains("Result: HEALTHY\n"));

      downLink(7, 17);
      String out = fm.output("nv-fabricmanager diag quick");
      assertEquals("143/144 active", value(out, "NVLinks:"));
      assertTrue(out.contains("Result: ATTENTION NEEDED\n"));
    }

    @Test
    void fullSuite() {
      String healthy = fm.output("nv-fabricmanager diag full");
      for (int phase = 1; phase <= 5; phase++) {
        assertTrue(healthy.contains("Phase " + phase + ":"), "phase " + phase);
      }
      assertEquals("8", value(healthy, "GPUs detected:"));
      assertEquals("6", value(healthy, "NVSwitches detected:"));
      assertTrue(healthy.contains("ALL TESTS PASSED"));

      fm.store().addXidError("dgx-00", 4, 74);
      String failing = fm.output("nv-fabricmanager diag full");
      assertTrue(failing.contains("ISSUES DETECTED"));
      assertTrue(failing.contains("  - 1 XID error(s) recorded\n"));
    }

    @Test
    void stress() {
      String out = fm.output("nv-fabricmanager diag stress");

      assertTrue(out.contains("Warning:"));
      assertTrue(out.contains("Pattern: Bidirectional all-to-all\n"));
      assertTrue(out.contains("  Peak bandwidth:    864.0 GB/s\n"));
      assertTrue(out.contains("Stress test completed successfully."));
    }

    @Test
    void errorsCleanAndDirty() {
      String clean = fm.output("nv-fabricmanager diag errors");
      assertTrue(clean.contains("No fabric errors detected"));
      assertTrue(clean.contains("CRC Errors:"));
      assertFalse(clean.contains("Recommendations"));

      fm.store().addXidError("dgx-00", 2, 74);
      String dirty = fm.output("nv-fabricmanager diag errors");
      assertTrue(dirty.contains("Error Details:\n"));
      assertTrue(dirty.contains("  GPU 2: XID 74 - " + XidCatalog.lookup(74).description()));
      assertTrue(dirty.contains("Review XID error patterns"));
    }

    @Test
    void ports() {
      downLink(3, 9);

      String out = fm.output("nv-fabricmanager diag ports");
      assertTrue(out.contains("GPU NVLink Ports:\n"));
      assertTrue(out.contains("  GPU 3: 17/18 ports up (down: 9)\n"));
      assertTrue(out.contains("NVSwitch Ports:\n"));
      assertTrue(out.contains("  NVSwitch 3: 23 ports up\n"));
    }

    @Test
    void unknownMode() {
      assertEquals(1, fm.run("nv-fabricmanager diag deep").exitCode());
    }
  }

  @Test
  void topoMap() {
    String out = fm.output("nv-fabricmanager topo");

    assertTrue(out.contains("[SW0]"));
    assertTrue(out.contains("[SW5]"));
    assertTrue(out.contains("[G7]"));
    assertTrue(out.contains("    [SW#] = NVSwitch #\n"));
    assertTrue(out.contains("    - Full mesh GPU-to-GPU via NVSwitch\n"));
  }
}
