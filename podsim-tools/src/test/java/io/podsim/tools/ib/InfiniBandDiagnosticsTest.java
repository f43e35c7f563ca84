package io.podsim.tools.ib;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.core.cluster.PortErrors;
import io.podsim.tools.ToolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class InfiniBandDiagnosticsTest {
  private ToolFixture ib;

  @BeforeEach
  void setUp() {
    ib = ToolFixture.of(new InfiniBandDiagnostics());
  }

  private PortErrors errorsOf(String node, int hca) {
    return ib.store().findNode(node).orElseThrow().hcas().get(hca).ports().get(0).errors();
  }

  @ParameterizedTest
  @CsvSource({
    "ibportstate, 5.9-0", "perfquery, 5.9-0", "iblinkinfo, 5.9-0", "ibdiagnet, 2.9.0"
  })
  void versionBanner(String tool, String version) {
    assertEquals(tool + " BUILD VERSION: " + version, ib.output(tool + " -V"));
  }

  @Test
  void dottedKeysLineUp() {
    assertEquals("LinkState:.......................Active\n",
        InfiniBandDiagnostics.dotted("LinkState", "Active"));
    assertEquals("ExcessiveBufferOverrunErrors:....0\n",
        InfiniBandDiagnostics.dotted("ExcessiveBufferOverrunErrors", 0));
  }

  @Nested
  class PortState {

    @Test
    void defaultsToFirstLocalPort() {
      String out = ib.output("ibportstate");

      assertTrue(out.startsWith("CA PortInfo:\n# Port info: Lid 100 port 1\n"));
      assertTrue(out.contains(InfiniBandDiagnostics.dotted("LinkState", "Active")));
      assertTrue(out.contains(InfiniBandDiagnostics.dotted("LinkSpeedActive", "NDR")));
      assertTrue(out.contains(InfiniBandDiagnostics.dotted("LinkRate", "400 Gb/s")));
    }

    @Test
    void remoteLidResolvesAcrossTheFabric() {
      assertTrue(ib.output("ibportstate 108 1").contains("# Port info: Lid 108 port 1\n"));
    }

    @Test
    void downPortIsReported() {
      ib.store().setPortState("dgx-00", "mlx5_1", 1, "Down", "Disabled");

      String out = ib.output("ibportstate 101");
      assertTrue(out.contains(InfiniBandDiagnostics.dotted("LinkState", "Down")));
      assertTrue(out.contains(InfiniBandDiagnostics.dotted("PhysLinkState", "Disabled")));
    }

    @Test
    void unknownLidOrPort() {
      CommandResult lid = ib.run("ibportstate 999");
      assertEquals(1, lid.exitCode());
      assertEquals("ibwarn: [ibportstate] lid 999 not found in the fabric", lid.output());

      CommandResult port = ib.run("ibportstate 100 2");
      assertEquals(1, port.exitCode());
      assertTrue(port.output().contains("port 2 does not exist on lid 100"));
    }
  }

  @Nested
  class PortErrorCounters {

    @Test
    void cleanPortsListEveryCounter() {
      String out = ib.output("ibporterrors");

      assertTrue(out.startsWith("Errors for:\n  mlx5_0 port 1 (lid 100):\n"));
      assertTrue(out.contains("  mlx5_3 port 1 (lid 103):\n"));
      assertTrue(out.contains(String.format("    %-25s%d\n", "SymbolErrors:", 0)));
      assertFalse(out.contains("Warning"));
      assertFalse(out.contains("Critical"));
    }

    @Test
    void dirtyCableWarnsAndFlapCritical() {
      ib.store().setPortErrors("dgx-00", "mlx5_2", 1, new PortErrors(40, 3, 7, 0, 0));

      String out = ib.output("ibporterrors -C mlx5_2");
      assertFalse(out.contains("mlx5_0"));
      assertTrue(out.contains(String.format("    %-25s%d\n", "SymbolErrors:", 40)));
      assertTrue(out.contains("Warning: Symbol errors detected - check cable quality"));
      assertTrue(out.contains("Critical: Link has gone down 3 times"));
    }

    @Test
    void filters() {
      assertEquals("Errors for:\n", ib.output("ibporterrors -P 2"));

      CommandResult result = ib.run("ibporterrors -C mlx5_9");
      assertEquals(1, result.exitCode());
      assertEquals("ibporterrors: CA 'mlx5_9' not found", result.output());
    }
  }

  @Nested
  class LinkInfo {

    @Test
    void blockPerAdapter() {
      String out = ib.output("iblinkinfo");

      assertTrue(out.startsWith("InfiniBand Link Information:\n\nCA: mlx5_0 "));
      assertEquals(4, out.split("CA: mlx5_", -1).length - 1);
      assertTrue(out.contains("port 1 lid 100 lmc 0 Active 400 Gb/s NDR (InfiniBand)"));
      assertFalse(out.contains("Link errors:"));
    }

    @Test
    void verboseAddsCounters() {
      ib.store().setPortErrors("dgx-00", "mlx5_0", 1, new PortErrors(9, 0, 0, 0, 0));

      String out = ib.output("iblinkinfo -v");
      assertTrue(out.contains("Link errors:"));
      assertTrue(out.contains(String.format("           %-20s%d\n", "Symbol errors:", 9)));
    }

    @Test
    void lineFormatNamesTheRail() {
      String[] lines = ib.output("iblinkinfo -l").split("\n");

      assertEquals(4, lines.length);
      assertTrue(lines[0].contains("\"dgx-node01 mlx5_0\" 100 1[  ] ==( 4X 400 Gbps "
          + "Active/LinkUp)==> Rail-0"));
      assertTrue(lines[3].endsWith("==> Rail-3"));
    }
  }

  @Nested
  class Perfquery {

    @Test
    void countersAreStableBetweenReads() {
      String first = ib.output("perfquery");

      assertTrue(first.startsWith("# Port counters: Lid 100 port 1\n"));
      assertTrue(first.contains(InfiniBandDiagnostics.dotted("SymbolErrorCounter", 0)));
      assertEquals(first, ib.output("perfquery"));
      assertNotEquals(first, ib.output("perfquery 101"));
    }

    @Test
    void extendedCountersOnlyCarryTraffic() {
      String out = ib.output("perfquery -x");

      assertTrue(out.startsWith("# Port extended counters: Lid 100 port 1 (CapMask: 0x5A00)\n"));
      assertTrue(out.contains("PortUnicastXmitPkts:"));
      assertFalse(out.contains("SymbolErrorCounter"));
    }

    @Test
    void resetAfterReadClearsTheStore() {
      ib.store().setPortErrors("dgx-00", "mlx5_1", 1, new PortErrors(4, 1, 0, 0, 0));

      String read = ib.output("perfquery -r 101");
      assertTrue(read.contains(InfiniBandDiagnostics.dotted("LinkDownedCounter", 1)));
      assertTrue(errorsOf("dgx-00", 1).isClean());
      assertTrue(ib.output("perfquery 101")
          .contains(InfiniBandDiagnostics.dotted("LinkDownedCounter", 0)));
    }

    @Test
    void resetOnlyPrintsNothing() {
      ib.store().setPortErrors("dgx-00", "mlx5_0", 1, new PortErrors(4, 0, 0, 0, 0));

      assertEquals("", ib.output("perfquery -R"));
      assertTrue(errorsOf("dgx-00", 0).isClean());
    }
  }

  @Nested
  class Diagnet {

    @Test
    void healthyFabric() {
      String out = ib.output("ibdiagnet");

      assertTrue(out.startsWith("Running ibdiagnet 2.9.0\n"));
      assertTrue(out.contains("-I- Discovering ... 16 nodes (8 Switches & 32 CA-s) discovered."));
      assertTrue(out.contains("-I- # of links: 48\n"));
      assertTrue(out.contains("-I- No errors found\n"));
      assertTrue(out.endsWith("-I- See report in /var/tmp/ibdiagnet2\n"));
    }

    @Test
    void downPortIsAnError() {
      ib.store().setPortState("dgx-03", "mlx5_2", 1, "Down", "Disabled");

      String out = ib.output("ibdiagnet -o /tmp/diag");
      assertTrue(out.contains("-E- Port dgx-node04/mlx5_2/1 (lid 126) is Down/Disabled"));
      assertTrue(out.contains("-I- Errors: 1, Warnings: 0\n"));
      assertTrue(out.endsWith("-I- See report in /tmp/diag\n"));
    }

    @Test
    void symbolErrorsWarnAndFailSignalQuality() {
      ib.store().setPortErrors("dgx-00", "mlx5_0", 1, new PortErrors(25, 0, 2, 0, 0));

      String out = ib.output("ibdiagnet --detailed");
      assertTrue(out.contains("-W- Port dgx-node01/mlx5_0/1: SymbolErrorCounter=25 "
          + "PortRcvErrors=2"));
      assertTrue(out.contains("Cable Validation Report - dgx-node01"));
      assertTrue(out.contains("Bit Error Rate: 2.40e-08"));
      assertTrue(out.contains("Status: FAIL"));
      assertTrue(out.contains("-I- Errors: 0, Warnings: 1\n"));
    }
  }

  @Nested
  class NetDiscover {

    @Test
    void summaryCountsTheFabric() {
      String out = ib.output("ibnetdiscover");

      assertTrue(out.contains("# Spine Switches\n"));
      assertTrue(out.contains("# Channel Adapters (HCAs)\n"));
      assertTrue(out.contains("#   32 HCAs\n"));
      assertTrue(out.contains("#   8 Switches (4 spine + 4 rail)\n"));
      assertTrue(out.contains("\"QM9700/Spine-0\""));
    }

    @Test
    void listFilters() {
      assertFalse(ib.output("ibnetdiscover -H").contains("# Spine Switches"));
      assertFalse(ib.output("ibnetdiscover -S").contains("# Channel Adapters"));
      assertTrue(ib.output("ibnetdiscover -p").contains("lid 100 lmc 0 \"dgx-node01\" Active"));
    }
  }

  @ParameterizedTest
  @CsvSource({"100, QM8700", "200, QM8790", "400, QM9700", "800, QM9790"})
  void switchGenerationFollowsHcaRate(int rate, String model) {
    assertEquals(model, FabricTopology.switchModel(rate));
  }
}
