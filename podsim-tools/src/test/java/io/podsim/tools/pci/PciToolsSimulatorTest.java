package io.podsim.tools.pci;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.core.cluster.EccErrors;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.tools.ToolFixture;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PciToolsSimulatorTest {
  private ToolFixture tools;

  @BeforeEach
  void setUp() {
    tools = ToolFixture.of(new PciToolsSimulator());
  }

  private static long count(String text, String needle) {
    return Arrays.stream(text.split("\n")).filter(l -> l.contains(needle)).count();
  }

  @Nested
  class Lspci {
    @Test
    void listsGpusAndHcasInBusOrder() {
      String[] lines = tools.output("lspci").split("\n");

      assertEquals(12, lines.length);
      assertEquals("0000:18:00.0 3D controller: NVIDIA Corporation H100-SXM5-80GB (rev a1)",
          lines[0]);
      assertEquals("0000:1a:00.0 Infiniband controller: Mellanox Technologies MT2910 Family "
          + "[ConnectX-7] (rev a1)", lines[1]);
    }

    @Test
    void vendorAndDeviceFilter() {
      assertEquals(8, tools.output("lspci -d 10de:").split("\n").length);
      assertEquals(4, tools.output("lspci -d 15b3:1021").split("\n").length);
      assertEquals(8, tools.output("lspci -d :2330").split("\n").length);
      assertEquals("", tools.output("lspci -d 8086:"));

      CommandResult bad = tools.run("lspci -d zz:");
      assertEquals(1, bad.exitCode());
      assertTrue(bad.output().contains("Invalid vendor ID"));
    }

    @Test
    void slotFilterAcceptsShortAndFullAddress() {
      assertEquals(tools.output("lspci -s 18:00.0"), tools.output("lspci -s 0000:18:00.0"));
      assertTrue(tools.output("lspci -s 3c:00.0").startsWith("0000:3c:00.0 Infiniband"));
    }

    @Test
    void numericIds() {
      String out = tools.output("lspci -nn -s 18:00.0");

      assertEquals("0000:18:00.0 3D controller [0302]: NVIDIA Corporation H100-SXM5-80GB "
          + "[10de:2330] (rev a1)\n", out);
    }

    @Test
    void kernelDrivers() {
      String out = tools.output("lspci -k -d 15b3:");

      assertEquals(4, count(out, "Kernel driver in use: mlx5_core"));
      assertFalse(out.contains("Control:"));
    }

    @Test
    void verbosityLevels() {
      String v = tools.output("lspci -v -s 18:00.0");
      assertTrue(v.contains("\tKernel driver in use: nvidia"));
      assertTrue(v.contains("\tNUMA node: 0"));
      assertFalse(v.contains("LnkSta"));

      String vv = tools.output("lspci -vv -s 18:00.0");
      assertTrue(vv.contains("LnkCap:\tPort #0, Speed 32GT/s, Width x16"));
      assertTrue(vv.contains("LnkSta:\tSpeed 32GT/s (ok), Width x16 (ok)"));
    }

    @Test
    void fallenOffGpuIsAnnotated() {
      tools.store().addXidError("dgx-00", 0, 79);

      assertTrue(tools.output("lspci -s 18:00.0").contains("(rev ff)"));
      assertFalse(tools.output("lspci -s 18:00.0").contains("XID"));

      String vv = tools.output("lspci -vv -s 18:00.0");
      assertTrue(vv.contains(
          "Fault: Device is in error state (XID 79), GPU has fallen off the bus"));
      assertTrue(vv.contains("(downgraded)"));
      assertTrue(vv.contains("BusMaster-"));
    }

    @Test
    void hotGpuIsAnnotated() {
      tools.store().updateGpu("dgx-00", 3, b -> b.temperature(92));

      assertTrue(tools.output("lspci -v -s 5d:00.0").contains("Thermal throttling active (92C)"));
    }

    @Test
    void detachedContextHasNoDevices() {
      CommandResult result = ToolFixture.detached(new PciToolsSimulator(), "lspci");

      assertEquals(0, result.exitCode());
      assertEquals("No PCI devices found", result.output());
    }
  }

  @Nested
  class Journalctl {
    @Test
    void bootLogReportsHardwareBringUp() {
      String out = tools.output("journalctl -b --no-pager");

      assertTrue(out.startsWith("-- Logs begin at Fri 2024-03-15 08:00:00 UTC"));
      assertEquals(8, count(out, ": GPU Ready"));
      assertTrue(out.contains("kernel: NVRM: All 8 GPUs initialized successfully"));
      assertTrue(out.contains("slurmd[2101]: gres/gpu: _merge_system_gres_conf: type h100 "
          + "gres/gpu count: 8"));
      assertTrue(out.contains("Mar 15 08:00:25 dgx-node01 systemd[1]: Reached target "
          + "Multi-User System."));
    }

    @Test
    void xidShowsWithFollowUps() {
      tools.store().addXidError("dgx-00", 0, 79);

      String out = tools.output("journalctl -k");
      assertTrue(out.contains("NVRM: Xid (PCI:0000:18:00): 79, pid="));
      assertTrue(out.contains("name=<unknown>"));
      assertTrue(out.contains("GPU has fallen off the bus"));
      assertTrue(out.contains("NVRM: GPU at PCI:0000:18:00: GPU crash dump has been created"));
    }

    @Test
    void xidNamesTheRunningJob() {
      ToolFixture onBusyNode = ToolFixture.on(new PciToolsSimulator(), "dgx-01");
      onBusyNode.store().addXidError("dgx-01", 2, 31);

      assertTrue(onBusyNode.output("journalctl -k").contains("name=llm-pretrain"));
    }

    @Test
    void priorityFilterIsStrict() {
      String clean = tools.output("journalctl -p err");
      assertTrue(clean.contains("-- No entries --"));

      tools.store().updateGpu("dgx-00", 1, b -> b.eccErrors(EccErrors.of(150, 2)));
      String faulty = tools.output("journalctl -p err");
      assertTrue(faulty.contains("DOUBLE-BIT ECC error detected (count: 2)"));
      assertFalse(faulty.contains("single-bit"));
      assertTrue(tools.output("journalctl -p warning")
          .contains("single-bit ECC error corrected (count: 150)"));
      assertEquals(tools.output("journalctl -p 3"), faulty);
    }

    @Test
    void thermalAndLinkFaults() {
      tools.store().updateGpu("dgx-00", 4, b -> b.temperature(95)
          .nvlinkStatus(5, NvLinkStatus.DOWN));
      tools.store().setPortState("dgx-00", "mlx5_2", 1, "Down", "Disabled");

      String out = tools.output("journalctl -p crit");
      assertTrue(out.contains("GPU temperature (95C) exceeds slowdown threshold"));
      assertFalse(out.contains("NVLink"));

      String err = tools.output("journalctl -p err");
      assertTrue(err.contains("NVLink: link 5 is Down"));
      assertTrue(tools.output("journalctl -p warning").contains("mlx5_2: Port 1 link down"));
    }

    @Test
    void unitAndLineFilters() {
      String slurmd = tools.output("journalctl -u slurmd.service");
      assertEquals(5, slurmd.split("\n").length);
      assertTrue(slurmd.contains("slurmd version 23.02.6 started"));

      assertTrue(tools.output("journalctl -u openibd").contains("-- No entries --"));
      assertEquals(4, tools.output("journalctl -n 3").split("\n").length);
    }

    @Test
    void invalidPriority() {
      CommandResult result = tools.run("journalctl -p loud");

      assertEquals(1, result.exitCode());
      assertTrue(result.output().contains("Failed to parse priority value: loud"));
    }

    @Test
    void detachedContext() {
      CommandResult result = ToolFixture.detached(new PciToolsSimulator(), "journalctl -b");

      assertEquals(1, result.exitCode());
      assertEquals("No journal files were found.", result.output());
    }
  }

  @Nested
  class Dmesg {
    @Test
    void relativeTimestamps() {
      String[] lines = tools.output("dmesg").split("\n");

      assertTrue(lines[0].startsWith("[    0.000000] Linux version"));
      assertTrue(Arrays.stream(lines).anyMatch(l -> l.startsWith("[    7.000000] NVRM: GPU ")));
      assertTrue(Arrays.stream(lines).noneMatch(l -> l.contains("slurmd")));
    }

    @Test
    void wallClockTimestamps() {
      assertTrue(tools.output("dmesg -T").startsWith("[Fri Mar 15 08:00:00 2024] Linux version"));
    }

    @Test
    void levelFilter() {
      tools.store().addXidError("dgx-00", 6, 79);

      String out = tools.output("dmesg -l err,warn");
      assertTrue(out.contains("nvidia: module license 'NVIDIA' taints kernel."));
      assertTrue(out.contains("Xid (PCI:0000:ba:00): 79"));
      assertFalse(out.contains("GPU Ready"));

      assertEquals(1, tools.run("dmesg -l chatty").exitCode());
    }
  }

  @ParameterizedTest
  @ValueSource(strings = {"lspci --version", "journalctl --version", "dmesg -V"})
  void versions(String line) {
    String out = tools.output(line);

    assertTrue(out.contains(PciToolsSimulator.LSPCI_VERSION)
        || out.contains(PciToolsSimulator.SYSTEMD_VERSION)
        || out.contains(PciToolsSimulator.UTIL_LINUX_VERSION));
  }

  @ParameterizedTest
  @ValueSource(strings = {"lspci --help", "journalctl --help", "dmesg --help"})
  void help(String line) {
    assertTrue(tools.output(line).toLowerCase().contains("usage")
        || tools.output(line).contains("Query the journal"));
  }

  @Test
  void unknownFlag() {
    CommandResult result = tools.run("lspci -x");

    assertEquals(1, result.exitCode());
    assertEquals("lspci: unknown option '-x'", result.output());
  }
}
