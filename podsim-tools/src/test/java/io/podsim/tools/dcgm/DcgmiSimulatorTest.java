package io.podsim.tools.dcgm;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.core.cluster.EccErrors;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.tools.ToolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DcgmiSimulatorTest {
  private ToolFixture dcgmi;

  @BeforeEach
  void setUp() {
    dcgmi = ToolFixture.of(new DcgmiSimulator());
  }

  @Test
  void discoveryListsEveryGpu() {
    String out = dcgmi.output("dcgmi discovery -l");

    assertTrue(out.startsWith("8 GPU(s) found."));
    assertTrue(out.contains("Device Information"));
    assertTrue(out.contains("GPU 0: NVIDIA H100 80GB HBM3"));
    assertTrue(out.contains("GPU 7:"));
    assertTrue(out.contains("GPU-"));
    assertEquals("Missing required flag: -l", dcgmi.run("dcgmi discovery").output());
  }

  @Test
  void healthyGroup() {
    String out = dcgmi.output("dcgmi health -g 0 -c");

    assertTrue(out.contains("Health monitoring"));
    assertTrue(out.contains("Overall Health: Healthy"));
    assertTrue(out.contains("GPU 0: Healthy"));
    assertTrue(out.contains("GPU 1: Healthy"));
  }

  @Test
  void healthReportsInjectedFaults() {
    dcgmi.store().updateGpu("dgx-00", 1, b -> b.temperature(85));
    dcgmi.store().updateGpu("dgx-00", 2, b -> b.eccErrors(EccErrors.of(0, 2)));
    dcgmi.store().updateGpu("dgx-00", 3, b -> b.nvlinkStatus(5, NvLinkStatus.INACTIVE));
    dcgmi.store().addXidError("dgx-00", 4, 79);

    String out = dcgmi.output("dcgmi health -c");

    assertTrue(out.contains("Overall Health: Failure"));
    assertTrue(out.contains("GPU 1: Warning"));
    assertTrue(out.contains("Thermal warning: GPU 1 temperature 85 C"));
    assertTrue(out.contains("GPU 2: Failure"));
    assertTrue(out.contains("2 uncorrectable double-bit ECC errors"));
    assertTrue(out.contains("GPU 3 NVLink 5 is Inactive"));
    assertTrue(out.contains("XID 79: GPU has fallen off the bus"));
  }

  @Test
  void healthRequiresCheckFlag() {
    CommandResult result = dcgmi.run("dcgmi health -g 0");

    assertEquals(1, result.exitCode());
    assertEquals("Missing required flag: -c", result.output());
  }

  @ParameterizedTest
  @ValueSource(strings = {"dcgmi health -g 99 -c", "dcgmi health -g 9999 -c",
      "dcgmi health -g -1 -c", "dcgmi health -g x -c"})
  void unknownGroupsAreRejected(String line) {
    assertNotEquals(0, dcgmi.run(line).exitCode());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3})
  void diagnosticLevels(int level) {
    String out = dcgmi.output("dcgmi diag -r " + level + " -g 0");

    assertTrue(out.contains("Running level " + level + " diagnostic"));
    assertTrue(out.contains("Successfully ran diagnostic"));
    assertTrue(out.contains("Denylist"));
    assertEquals(level >= 2, out.contains("PCIe"));
    assertEquals(level == 3, out.contains("Targeted Stress"));
    assertFalse(out.contains("Fail"));
  }

  @Test
  void diagnosticFlagsFaultyGpus() {
    dcgmi.store().updateGpu("dgx-00", 6, b -> b.eccErrors(EccErrors.of(0, 1)));

    String out = dcgmi.output("dcgmi diag -r long");

    assertTrue(out.contains("Fail - GPU: 6"));
    assertTrue(out.contains("test(s) reported problems"));
  }

  @Test
  void diagnosticLevelValidation() {
    CommandResult bad = dcgmi.run("dcgmi diag -r 5 -g 0");
    assertEquals(1, bad.exitCode());
    assertTrue(bad.output().contains("mode must be 1, 2 or 3"));

    assertTrue(dcgmi.run("dcgmi diag -r 99").output().contains("mode must be"));
    assertEquals("Missing required flag: -r", dcgmi.run("dcgmi diag").output());
    assertTrue(dcgmi.run("dcgmi diag -r 1").isSuccess());
  }

  @Test
  void statsRecordingAndJobReport() {
    assertTrue(dcgmi.run("dcgmi stats -g 0").isSuccess());
    assertNotEquals(0, dcgmi.run("dcgmi stats -g 0 -j 1000").exitCode());

    assertTrue(dcgmi.output("dcgmi stats -g 0 -e").contains("started"));
    String out = dcgmi.output("dcgmi stats -g 0 -j 1000");
    assertTrue(out.contains("Successfully retrieved statistics for job: 1000."));
    assertTrue(out.contains("llm-pretrain"));
    assertTrue(out.contains("dgx-01"));
    assertNotEquals(0, dcgmi.run("dcgmi stats -g 0 -j 4242").exitCode());

    assertTrue(dcgmi.output("dcgmi stats -g 0 -d").contains("stopped"));
  }

  @Test
  void dmonSamplesFields() {
    String out = dcgmi.output("dcgmi dmon -e 150,155 -c 2 -i 0");

    assertTrue(out.startsWith("#Entity"));
    assertTrue(out.contains("TMPTR"));
    assertTrue(out.contains("POWER"));
    assertEquals(2, out.split("GPU 0").length - 1);
    assertTrue(out.contains("72.000"));

    assertEquals(8, dcgmi.output("dcgmi dmon -g 0").split("GPU ").length - 1);
    assertTrue(dcgmi.run("dcgmi dmon -e 155,156").isSuccess());
    assertNotEquals(0, dcgmi.run("dcgmi dmon -e 9999").exitCode());
    assertTrue(dcgmi.output("dcgmi dmon -l").contains("FBUSD"));
  }

  @Test
  void groupsAreSessionState() {
    String created = dcgmi.output("dcgmi group -c training -a 0,1");
    assertTrue(created.contains("Successfully created group \"training\" with a group ID of 2"));

    String health = dcgmi.output("dcgmi health -g 2 -c");
    assertTrue(health.contains("GPU 1: Healthy"));
    assertFalse(health.contains("GPU 2:"));

    assertTrue(dcgmi.output("dcgmi group -g 2 -a 5").contains("successful"));
    assertTrue(dcgmi.output("dcgmi group -l").contains("GPU 0, GPU 1, GPU 5"));

    assertTrue(dcgmi.output("dcgmi group -d 2").contains("removed"));
    assertNotEquals(0, dcgmi.run("dcgmi health -g 2 -c").exitCode());
    assertNotEquals(0, dcgmi.run("dcgmi group -d 0").exitCode());
  }

  @Test
  void nvlinkStatusGrid() {
    dcgmi.store().updateGpu("dgx-00", 0, b -> b.nvlinkStatus(0, NvLinkStatus.DOWN));

    String out = dcgmi.output("dcgmi nvlink -s");

    assertTrue(out.contains("gpuId 0:\n        D U U"));
    assertTrue(dcgmi.output("dcgmi nvlink -e -g 1").contains("NVLINK Error Counts"));
  }

  @Test
  void helpVersionAndUsage() {
    String help = dcgmi.output("dcgmi --help");
    assertTrue(help.contains("Data Center GPU Manager"));
    assertTrue(help.contains("discovery"));
    assertTrue(help.contains("health"));
    assertTrue(help.contains("diag"));
    assertEquals("dcgmi version 3.3.5", dcgmi.output("dcgmi --version"));
    assertTrue(dcgmi.output("dcgmi").contains("Usage:"));
  }

  @Test
  void invalidSubcommand() {
    CommandResult result = dcgmi.run("dcgmi fakecommand");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("not a valid subcommand"));
  }

  @Test
  void noHostEngineWithoutCluster() {
    CommandResult result = ToolFixture.detached(new DcgmiSimulator(), "dcgmi discovery -l");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("Unable to connect to host engine"));
  }
}
