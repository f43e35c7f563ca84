package io.podsim.tools.ipmi;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.tools.ToolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IpmitoolSimulatorTest {
  private ToolFixture ipmi;

  @BeforeEach
  void setUp() {
    ipmi = ToolFixture.of(new IpmitoolSimulator());
  }

  @Test
  void sdrListShowsBmcAndGpuSensors() {
    String out = ipmi.output("ipmitool sdr list");

    assertTrue(out.contains("Inlet Temp       | 24 degrees C      | ok"));
    assertTrue(out.contains("P12V             | 12.06 Volts       | ok"));
    assertTrue(out.contains("FAN1             | 7200 RPM          | ok"));
    assertTrue(out.contains("GPU7 Temp"));
    assertEquals(17, out.split("\n").length);
    assertFalse(out.contains("+--"));
  }

  @Test
  void hotGpuIsCriticalEverywhere() {
    ipmi.store().updateGpu("dgx-00", 2, b -> b.temperature(95));

    assertTrue(ipmi.output("ipmitool sdr").contains("GPU2 Temp        | 95 degrees C      | cr"));
    assertTrue(ipmi.output("ipmitool sensor").contains("| 95.000     | degrees C  | cr"));
    assertTrue(ipmi.output("ipmitool sel elist")
        .contains("Temperature GPU2 Temp | Upper Critical going high | Asserted"));
  }

  @Test
  void fallenOffGpuHasNoReading() {
    ipmi.store().addXidError("dgx-00", 0, 79);

    assertTrue(ipmi.output("ipmitool sdr list")
        .contains("GPU0 Temp        | no reading        | ns"));
    String sel = ipmi.output("ipmitool sel list");
    assertTrue(sel.contains("Critical Interrupt #0x90 | Bus Fatal Error | Asserted"));
  }

  @Test
  void extendedSdrAndCsv() {
    String elist = ipmi.output("ipmitool sdr elist");
    assertTrue(elist.startsWith("Inlet Temp       | 01h | ok  |  7.1 | 24 degrees C"));

    String csv = ipmi.output("ipmitool -c sdr list");
    assertTrue(csv.startsWith("Inlet Temp,24,degrees C,ok\n"));
  }

  @Test
  void selListStartsWithBootRecords() {
    String[] lines = ipmi.output("ipmitool sel list").split("\n");

    assertEquals(2, lines.length);
    assertTrue(lines[0].contains("System Boot Initiated #0x01 | Initiated by power up"));
    assertTrue(lines[1].startsWith("   2 | "));
    assertTrue(ipmi.output("ipmitool sel info").contains("Entries          : 2"));
  }

  @Test
  void managementControllerInfo() {
    String out = ipmi.output("ipmitool mc info");

    assertTrue(out.contains("Firmware Revision         : 24.01.05"));
    assertTrue(out.contains("Product Name              : DGX H100 BMC"));
    assertTrue(out.contains("IPMI Version              : 2.0"));
  }

  @Test
  void chassisAndPower() {
    String status = ipmi.output("ipmitool chassis status");

    assertTrue(status.contains("System Power         : on"));
    assertTrue(status.contains("Cooling/Fan Fault    : false"));
    assertEquals("Chassis Power is on", ipmi.output("ipmitool power status"));
    assertEquals("Chassis Power is on", ipmi.output("ipmitool chassis power status"));
    assertEquals("Chassis Power Control: Cycle", ipmi.output("ipmitool power cycle"));
  }

  @Test
  void lanAndFru() {
    String lan = ipmi.output("ipmitool lan print 1");
    assertTrue(lan.contains("IP Address              : 10.141.1.2"));
    assertTrue(lan.contains("MAC Address             : 7c:c2:55:3a:10:20"));

    String fru = ipmi.output("ipmitool fru print");
    assertTrue(fru.contains("Product Name          : DGX H100"));
    assertTrue(fru.contains("Board Mfg             : NVIDIA"));
  }

  @Test
  void remoteBmcByAddress() {
    String lan = ipmi.output("ipmitool -I lanplus -H 10.141.1.5 -U admin -P admin lan print");

    assertTrue(lan.contains("IP Address              : 10.141.1.5"));

    CommandResult unknown = ipmi.run("ipmitool -I lanplus -H 10.9.9.9 -U admin -P admin sdr");
    assertEquals(1, unknown.exitCode());
    assertTrue(unknown.output().contains("Unable to establish IPMI v2 / RMCP+ session"));
  }

  @Test
  void invalidInput() {
    CommandResult none = ipmi.run("ipmitool");
    assertNotEquals(0, none.exitCode());
    assertTrue(none.output().startsWith("No command provided!"));

    assertTrue(ipmi.run("ipmitool bogus").output().contains("Invalid command: bogus"));
    assertNotEquals(0, ipmi.run("ipmitool sdr frobnicate").exitCode());
    assertNotEquals(0, ipmi.run("ipmitool --nope sdr").exitCode());
    assertNotEquals(0, ipmi.run("ipmitool -H").exitCode());
  }

  @Test
  void versionAndHelp() {
    assertEquals("ipmitool version 1.8.19", ipmi.output("ipmitool -V"));
    assertTrue(ipmi.output("ipmitool -h").contains("usage: ipmitool"));
  }

  @Test
  void noLocalDevice() {
    CommandResult result = ToolFixture.detached(new IpmitoolSimulator(), "ipmitool sdr");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("/dev/ipmi0"));
  }
}
