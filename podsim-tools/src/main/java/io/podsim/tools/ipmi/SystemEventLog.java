package io.podsim.tools.ipmi;

import io.podsim.core.cluster.BmcSensor;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.XidError;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * BMC event log. Two boot records, one record per GPU XID and one per sensor outside its critical
 * thresholds, in time order.
 */
final class SystemEventLog {
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter TIME =
      DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

  private SystemEventLog() {}

  /**
   * One SEL record.
   *
   * @param time when the event was logged
   * @param sensorType IPMI sensor type
   * @param sensorNumber raw sensor number, shown by {@code sel list}
   * @param sensorName sensor name, shown by {@code sel elist}
   * @param event event description
   */
  record Entry(
      Instant time, String sensorType, int sensorNumber, String sensorName, String event) {}

  static List<Entry> entries(DgxNode node, Instant bootTime) {
    List<Entry> entries = new ArrayList<>();
    entries.add(new Entry(bootTime, "System Boot Initiated", 0x01, "System Boot",
        "Initiated by power up"));
    entries.add(new Entry(bootTime.plusSeconds(12), "System Event", 0x83, "Clock Sync",
        "Timestamp Clock Sync"));

    for (Gpu gpu : node.gpus()) {
      for (XidError xid : gpu.xidErrors()) {
        String event = xid.code() == FaultRules.XID_FALLEN_OFF_BUS
            ? "Bus Fatal Error"
            : "XID " + xid.code() + " " + xid.description();
        entries.add(new Entry(xid.timestamp(), "Critical Interrupt", 0x90 + gpu.index(),
            "GPU" + gpu.index(), event));
      }
    }

    Instant sampled = bootTime.plus(Duration.ofHours(2));
    int number = 0x30;
    for (IpmitoolSimulator.Reading reading : IpmitoolSimulator.readings(node)) {
      BmcSensor sensor = reading.sensor();
      if (reading.available() && "cr".equals(sensor.status())) {
        String direction = sensor.value() > sensor.upperCritical()
            ? "Upper Critical going high"
            : "Lower Critical going low";
        entries.add(new Entry(sampled, sensorType(sensor.unit()), number, sensor.name(),
            direction));
      }
      number++;
    }
    entries.sort(Comparator.comparing(Entry::time));
    return entries;
  }

  static String render(DgxNode node, Instant bootTime, boolean extended) {
    StringBuilder sb = new StringBuilder();
    int id = 1;
    for (Entry e : entries(node, bootTime)) {
      String sensor = extended
          ? e.sensorType() + " " + e.sensorName()
          : String.format("%s #0x%02x", e.sensorType(), e.sensorNumber());
      sb.append(String.format("%4x | %s | %s | %s | %s | Asserted\n", id++,
          DATE.format(e.time()), TIME.format(e.time()), sensor, e.event()));
    }
    return sb.toString();
  }

  private static String sensorType(String unit) {
    return switch (unit) {
      case "degrees C" -> "Temperature";
      case "Volts" -> "Voltage";
      case "RPM" -> "Fan";
      case "Watts" -> "Power Supply";
      default -> "OEM";
    };
  }
}
