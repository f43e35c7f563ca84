package io.podsim.tools.ipmi;

import io.podsim.core.AbstractSimulator;
import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.FlagSchema;
import io.podsim.core.ParsedCommand;
import io.podsim.core.SimulatorException;
import io.podsim.core.SimulatorMetadata;
import io.podsim.core.cluster.BmcInfo;
import io.podsim.core.cluster.BmcSensor;
import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates {@code ipmitool} against the node's BMC, or against another node's BMC when {@code -H}
 * names its address. Sensor readings combine the BMC's own sensors with one temperature sensor per
 * GPU, read from the live GPU state.
 */
public final class IpmitoolSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(IpmitoolSimulator.class);

  static final String VERSION = "1.8.19";

  private static final FlagSchema FLAGS =
      FlagSchema.builder("ipmitool")
          .option("I", "interface")
          .option("H", "host")
          .option("U", "user")
          .option("P", "password")
          .flag("c", "csv")
          .flag("V", "version")
          .flag("h", "help")
          .unknownFlagMessage("ipmitool: invalid option -- '%s'")
          .build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    ParsedCommand cmd = FLAGS.validate(command);
    if (cmd.hasFlag("V", "version")) {
      return version();
    }
    List<String> args = new ArrayList<>();
    cmd.subcommand().ifPresent(args::add);
    args.addAll(cmd.positionalArgs());
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(usage());
    }
    if (args.isEmpty()) {
      return CommandResult.error("No command provided!\n" + usage());
    }

    DgxNode node = target(cmd, context);
    String verb = args.get(0);
    String action = args.size() > 1 ? args.get(1) : "";
    boolean csv = cmd.hasFlag("c", "csv");
    LOG.debug("ipmitool {} {} against {}", verb, action, node.id());
    return switch (verb) {
      case "sdr" -> sdr(node, action, csv);
      case "sensor" -> sensor(node, action, csv);
      case "mc" -> mc(node, action);
      case "chassis" -> chassis(node, action, args);
      case "power" -> power(node, action);
      case "sel" -> sel(node, action, context);
      case "lan" -> lan(node, action);
      case "fru" -> fru(node, action);
      case "user" -> user(action);
      default -> throw new SimulatorException("Invalid command: " + verb);
    };
  }

  private DgxNode target(ParsedCommand cmd, CommandContext context) throws SimulatorException {
    Optional<String> host = cmd.flagValue("H", "host");
    if (host.isEmpty()) {
      return requireNode(context, "Could not open device at /dev/ipmi0 or /dev/ipmi/0 or "
          + "/dev/ipmidev/0: No such file or directory");
    }
    if (!"lanplus".equals(cmd.flagValue("I", "interface").orElse("lanplus"))) {
      throw new SimulatorException("Invalid interface: " + cmd.flagValue("I").orElse(""));
    }
    String address = host.get();
    for (DgxNode node : allNodes(context)) {
      BmcInfo bmc = node.bmc();
      if (bmc != null && (bmc.ipAddress().equals(address) || (node.hostname() + "-bmc")
          .equals(address))) {
        return node;
      }
    }
    throw new SimulatorException("Error: Unable to establish IPMI v2 / RMCP+ session");
  }

  /** BMC sensors followed by one temperature sensor per GPU. */
  static List<Reading> readings(DgxNode node) {
    List<Reading> readings = new ArrayList<>();
    if (node.bmc() != null) {
      for (BmcSensor sensor : node.bmc().sensors()) {
        readings.add(new Reading(sensor, true));
      }
    }
    for (Gpu gpu : node.gpus()) {
      BmcSensor sensor = new BmcSensor("GPU" + gpu.index() + " Temp", gpu.temperature(),
          "degrees C", 5, FaultRules.TEMPERATURE_CRITICAL);
      readings.add(new Reading(sensor, !FaultRules.isOffBus(gpu)));
    }
    return readings;
  }

  /** A sensor and whether the BMC can currently read it. */
  record Reading(BmcSensor sensor, boolean available) {

    String status() {
      return available ? sensor.status() : "ns";
    }

    String value() {
      return available ? number(sensor.value()) + " " + sensor.unit() : "no reading";
    }
  }

  private CommandResult sdr(DgxNode node, String action, boolean csv)
      throws SimulatorException {
    boolean extended = "elist".equals(action);
    if (!action.isEmpty() && !"list".equals(action) && !extended) {
      throw new SimulatorException("Invalid SDR command: " + action);
    }
    StringBuilder sb = new StringBuilder();
    int id = 1;
    for (Reading r : readings(node)) {
      if (csv) {
        sb.append(r.sensor().name()).append(',')
            .append(r.available() ? number(r.sensor().value()) : "").append(',')
            .append(r.sensor().unit()).append(',').append(r.status()).append('\n');
      } else if (extended) {
        sb.append(String.format("%-16s | %02Xh | %-3s | %4s | %s\n", r.sensor().name(), id,
            r.status(), "7." + id, r.value()));
      } else {
        sb.append(String.format("%-16s | %-17s | %s\n", r.sensor().name(), r.value(), r.status()));
      }
      id++;
    }
    return CommandResult.success(sb.toString());
  }

  private CommandResult sensor(DgxNode node, String action, boolean csv)
      throws SimulatorException {
    if (!action.isEmpty() && !"list".equals(action)) {
      throw new SimulatorException("Invalid sensor command: " + action);
    }
    StringBuilder sb = new StringBuilder();
    for (Reading r : readings(node)) {
      BmcSensor s = r.sensor();
      String value = r.available() ? String.format(Locale.ROOT, "%.3f", s.value()) : "na";
      String lcr = String.format(Locale.ROOT, "%.3f", s.lowerCritical());
      String ucr = String.format(Locale.ROOT, "%.3f", s.upperCritical());
      if (csv) {
        sb.append(String.join(",", s.name(), value, s.unit(), r.status(), "na", lcr, "na", "na",
            ucr, "na")).append('\n');
      } else {
        sb.append(String.format("%-16s | %-10s | %-10s | %-5s | %-9s | %-9s | %-9s | %-9s | %-9s "
            + "| %s", s.name(), value, s.unit(), r.status(), "na", lcr, "na", "na", ucr, "na"))
            .append('\n');
      }
    }
    return CommandResult.success(sb.toString());
  }

  private CommandResult mc(DgxNode node, String action) throws SimulatorException {
    if ("reset".equals(action)) {
      return CommandResult.success("Sent cold reset command to MC");
    }
    if (!"info".equals(action)) {
      throw new SimulatorException("Invalid mc command: " + action);
    }
    BmcInfo bmc = requireBmc(node);
    return CommandResult.success(String.join("\n",
        "Device ID                 : 32",
        "Device Revision           : 1",
        "Firmware Revision         : " + bmc.firmwareVersion(),
        "IPMI Version              : 2.0",
        "Manufacturer ID           : 5703",
        "Manufacturer Name         : " + bmc.manufacturer(),
        "Product ID                : 5 (0x0005)",
        "Product Name              : " + node.systemType().replace('-', ' ') + " BMC",
        "Device Available          : yes",
        "Provides Device SDRs      : yes",
        "Additional Device Support :",
        "    Sensor Device",
        "    SDR Repository Device",
        "    SEL Device",
        "    FRU Inventory Device",
        "    Chassis Device",
        ""));
  }

  private CommandResult chassis(DgxNode node, String action, List<String> args)
      throws SimulatorException {
    BmcInfo bmc = requireBmc(node);
    if ("power".equals(action)) {
      return power(node, args.size() > 2 ? args.get(2) : "status");
    }
    if (!"status".equals(action)) {
      throw new SimulatorException("Invalid chassis command: " + action);
    }
    boolean fanFault = bmc.sensors().stream()
        .anyMatch(s -> "RPM".equals(s.unit()) && "cr".equals(s.status()));
    boolean powerFault = bmc.sensors().stream()
        .anyMatch(s -> "Watts".equals(s.unit()) && "cr".equals(s.status()));
    return CommandResult.success(String.join("\n",
        "System Power         : " + bmc.powerState().toLowerCase(Locale.ROOT),
        "Power Overload       : " + powerFault,
        "Power Interlock      : inactive",
        "Main Power Fault     : false",
        "Power Control Fault  : false",
        "Power Restore Policy : always-off",
        "Last Power Event     : ",
        "Chassis Intrusion    : inactive",
        "Front-Panel Lockout  : inactive",
        "Drive Fault          : false",
        "Cooling/Fan Fault    : " + fanFault,
        ""));
  }

  private CommandResult power(DgxNode node, String action) throws SimulatorException {
    BmcInfo bmc = requireBmc(node);
    if (action.isEmpty() || "status".equals(action)) {
      return CommandResult.success(
          "Chassis Power is " + bmc.powerState().toLowerCase(Locale.ROOT));
    }
    return switch (action) {
      case "on", "off", "cycle", "reset", "soft" -> CommandResult.success(
          "Chassis Power Control: " + Character.toUpperCase(action.charAt(0))
              + action.substring(1));
      default -> throw new SimulatorException("Invalid chassis power command: " + action);
    };
  }

  private CommandResult sel(DgxNode node, String action, CommandContext context)
      throws SimulatorException {
    return switch (action) {
      case "", "list", "elist" -> CommandResult.success(
          SystemEventLog.render(node, bootTime(context), "elist".equals(action)));
      case "info" -> CommandResult.success(String.join("\n",
          "SEL Information",
          "Version          : 1.5 (v1.5, v2 compliant)",
          "Entries          : " + SystemEventLog.entries(node, bootTime(context)).size(),
          "Free Space       : 65408 bytes",
          "Percent Used     : 0%",
          "Overflow         : false",
          ""));
      case "clear" -> CommandResult.success("Clearing SEL.  Please allow a few seconds to erase.");
      default -> throw new SimulatorException("Invalid SEL command: " + action);
    };
  }

  private CommandResult lan(DgxNode node, String action) throws SimulatorException {
    if (!"print".equals(action)) {
      throw new SimulatorException("Invalid LAN command: " + action);
    }
    BmcInfo bmc = requireBmc(node);
    return CommandResult.success(String.join("\n",
        "Set in Progress         : Set Complete",
        "Auth Type Support       : MD5 PASSWORD",
        "IP Address Source       : Static Address",
        "IP Address              : " + bmc.ipAddress(),
        "Subnet Mask             : 255.255.0.0",
        "MAC Address             : " + bmc.macAddress().toLowerCase(Locale.ROOT),
        "Default Gateway IP      : 10.141.0.1",
        "802.1q VLAN ID          : Disabled",
        "Cipher Suite Priv Max   : aaaaaaaaaaaaaaa",
        ""));
  }

  private CommandResult fru(DgxNode node, String action) throws SimulatorException {
    if (!action.isEmpty() && !"print".equals(action) && !"list".equals(action)) {
      throw new SimulatorException("Invalid FRU command: " + action);
    }
    BmcInfo bmc = requireBmc(node);
    String serial = node.serialNumber();
    String product = node.systemType().replace('-', ' ');
    return CommandResult.success(String.join("\n",
        "FRU Device Description : Builtin FRU Device (ID 0)",
        " Chassis Type          : Rack Mount Chassis",
        " Chassis Part Number   : 965-24387-0002-000",
        " Chassis Serial        : " + serial,
        " Board Mfg Date        : Mon Jan  8 00:00:00 2024 UTC",
        " Board Mfg             : " + bmc.manufacturer(),
        " Board Product         : " + product.replace(" ", ""),
        " Board Serial          : " + serial,
        " Product Manufacturer  : " + bmc.manufacturer(),
        " Product Name          : " + product,
        " Product Serial        : " + serial,
        ""));
  }

  private CommandResult user(String action) throws SimulatorException {
    if (!"list".equals(action)) {
      throw new SimulatorException("Invalid user command: " + action);
    }
    return CommandResult.success(String.join("\n",
        "ID  Name             Callin  Link Auth  IPMI Msg   Channel Priv Limit",
        "1                    true    false      false      Unknown (0x00)",
        "2   admin            true    true       true       ADMINISTRATOR",
        ""));
  }

  private static BmcInfo requireBmc(DgxNode node) throws SimulatorException {
    if (node.bmc() == null) {
      throw new SimulatorException("Error: no BMC found on " + node.hostname());
    }
    return node.bmc();
  }

  private static Instant bootTime(CommandContext context) {
    return context.getCluster().map(ClusterStore::bootTime).orElse(Instant.EPOCH);
  }

  static String number(double value) {
    if (value == Math.rint(value)) {
      return String.valueOf((long) value);
    }
    return String.format(Locale.ROOT, "%.2f", value);
  }

  private static String usage() {
    return "ipmitool version " + VERSION + "\n\n"
        + "usage: ipmitool [options...] <command>\n\n"
        + "       -I intf       Interface to use (lanplus)\n"
        + "       -H hostname   Remote host name for LAN interface\n"
        + "       -U username   Remote session username\n"
        + "       -P password   Remote session password\n"
        + "       -c            Display output in comma separated format\n"
        + "       -V            Show version information\n\n"
        + "Commands:\n"
        + "\tsdr          Print Sensor Data Repository entries and readings\n"
        + "\tsensor       Print detailed sensor information\n"
        + "\tmc           Management Controller status and global enables\n"
        + "\tchassis      Get chassis status and set power state\n"
        + "\tpower        Shortcut to chassis power commands\n"
        + "\tsel          Print System Event Log (SEL)\n"
        + "\tlan          Configure LAN Channels\n"
        + "\tfru          Print built-in FRU and scan SDR for FRU locators\n"
        + "\tuser         Configure Management Controller users\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "ipmitool",
        VERSION,
        "IPMI management utility for the node BMC",
        List.of(
            new CommandInfo(
                "ipmitool",
                "Query the baseboard management controller",
                "ipmitool [-I lanplus -H host -U user -P pass] <command>",
                List.of("sdr", "sensor", "mc", "chassis", "sel", "lan", "fru", "user", "power"),
                List.of("ipmitool sdr list", "ipmitool sensor", "ipmitool sel list",
                    "ipmitool -I lanplus -H 10.141.1.3 -U admin -P admin chassis status"))));
  }
}
