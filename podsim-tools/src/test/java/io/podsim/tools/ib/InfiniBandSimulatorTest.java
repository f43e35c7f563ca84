package io.podsim.tools.ib;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.core.cluster.InfiniBandPort;
import io.podsim.tools.ToolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class InfiniBandSimulatorTest {
  private ToolFixture ib;

  @BeforeEach
  void setUp() {
    ib = ToolFixture.of(new InfiniBandSimulator());
  }

  @Test
  void ibstatListsEveryAdapter() {
    String out = ib.output("ibstat");

    assertTrue(out.startsWith("CA 'mlx5_0'\n\tCA type: MT4129\n"));
    assertTrue(out.contains("CA 'mlx5_3'"));
    assertTrue(out.contains("\tFirmware version: 28.39.1002\n"));
    assertTrue(out.contains("\t\tState: Active\n"));
    assertTrue(out.contains("\t\tRate: 400 Gb/s (NDR)\n"));
    assertTrue(out.contains("\t\tLink layer: InfiniBand\n"));
  }

  @Test
  void listShortAndPortForms() {
    assertEquals("mlx5_0\nmlx5_1\nmlx5_2\nmlx5_3\n", ib.output("ibstat -l"));
    assertEquals(4, ib.output("ibstat -p").split("\n").length);

    String brief = ib.output("ibstat -s mlx5_1");
    assertTrue(brief.startsWith("CA 'mlx5_1'"));
    assertFalse(brief.contains("Port 1:"));

    String port = ib.output("ibstat mlx5_2 1");
    assertTrue(port.startsWith("CA: 'mlx5_2'\nPort 1:\n\tState: Active\n"));
  }

  @Test
  void downPortIsReported() {
    ib.store().setPortState("dgx-00", "mlx5_2", 1, "Down", "Disabled");

    String out = ib.output("ibstat mlx5_2");
    assertTrue(out.contains("\t\tState: Down\n"));
    assertTrue(out.contains("\t\tPhysical state: Disabled\n"));
    assertTrue(ib.output("ibdev2netdev").contains("mlx5_2 port 1 ==> ib2 (Down)"));
  }

  @Test
  void unknownAdapter() {
    CommandResult result = ib.run("ibstat mlx5_9");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("'mlx5_9' failed"));
  }

  @ParameterizedTest
  @CsvSource({"40, QDR", "56, FDR", "100, EDR", "200, HDR", "400, NDR", "800, XDR"})
  void standardRateNames(int gbps, String name) {
    InfiniBandPort port = new InfiniBandPort(1, "Active", "LinkUp", gbps, 1, "0x1", "InfiniBand");

    assertEquals(name, port.rateName());
  }

  @Test
  void ibdev2netdevMapsPorts() {
    String[] lines = ib.output("ibdev2netdev").split("\n");

    assertEquals(4, lines.length);
    assertEquals("mlx5_0 port 1 ==> ib0 (Up)", lines[0]);

    String verbose = ib.output("ibdev2netdev -v");
    assertTrue(verbose.startsWith("0000:1a:00.0 mlx5_0 (MT4129 - ConnectX-7) fw 28.39.1002 "
        + "port 1 (ACTIVE) ==> ib0 (Up)\n"));
  }

  @Test
  void versionAndHelp() {
    assertEquals("ibstat BUILD VERSION: 5.9-0", ib.output("ibstat -V"));
    assertTrue(ib.output("ibstat --help").startsWith("Usage: ibstat"));
    assertTrue(ib.output("ibdev2netdev --help").contains("ibdev2netdev"));
  }

  @Test
  void noNode() {
    CommandResult result = ToolFixture.detached(new InfiniBandSimulator(), "ibstat");

    assertEquals(1, result.exitCode());
    assertEquals("ibstat: no InfiniBand devices found", result.output());
  }
}
