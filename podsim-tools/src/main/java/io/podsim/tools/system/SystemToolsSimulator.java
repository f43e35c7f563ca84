package io.podsim.tools.system;

import io.podsim.core.AbstractSimulator;
import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.FlagSchema;
import io.podsim.core.ParsedCommand;
import io.podsim.core.SimulatorException;
import io.podsim.core.SimulatorMetadata;
import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the basic Linux inspection tools {@code lscpu}, {@code free}, {@code dmidecode},
 * {@code systemctl}, {@code hostnamectl} and {@code timedatectl}. Hardware figures come from the
 * node inventory. Unit state lives in the cluster store, so a service stopped here is stopped for
 * {@code nv-fabricmanager} too.
 */
public final class SystemToolsSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(SystemToolsSimulator.class);

  static final String SYSTEMD_VERSION = "249 (249.11-0ubuntu3.12)";
  static final String UTIL_LINUX_VERSION = "2.37.2";
  static final String DMIDECODE_VERSION = "3.3";

  /** Simulated wall clock: two hours after boot, like every other tool. */
  static final Duration UPTIME = Duration.ofHours(2);

  private static final int SOCKETS = 2;
  private static final int DIMMS = 32;
  private static final long GIB_IN_KIB = 1024L * 1024L;

  private static final Set<String> BOOLEANS =
      Set.of("yes", "no", "true", "false", "on", "off", "1", "0");

  private static final DateTimeFormatter SINCE =
      DateTimeFormatter.ofPattern("EEE yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter RTC =
      DateTimeFormatter.ofPattern("EEE yyyy-MM-dd HH:mm:ss", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);

  private static final FlagSchema LSCPU =
      FlagSchema.builder("lscpu")
          .flag("h", "help")
          .flag("V", "version")
          .unknownFlagMessage("lscpu: unrecognized option '%s'\n"
              + "Try 'lscpu --help' for more information.")
          .build();

  private static final FlagSchema FREE =
      FlagSchema.builder("free")
          .flag("h", "human")
          .flag("g", "gibi")
          .flag("m", "mebi")
          .flag("k", "kibi")
          .flag("help")
          .flag("V", "version")
          .unknownFlagMessage("free: unrecognized option '%s'\n"
              + "Try 'free --help' for more information.")
          .build();

  private static final FlagSchema DMIDECODE =
      FlagSchema.builder("dmidecode")
          .option("t", "type")
          .flag("h", "help")
          .flag("V", "version")
          .unknownFlagMessage("dmidecode: unrecognized option '%s'")
          .build();

  private static final FlagSchema SYSTEMCTL =
      FlagSchema.builder("systemctl")
          .flag("no-pager")
          .flag("a", "all")
          .flag("q", "quiet")
          .flag("h", "help")
          .flag("version")
          .unknownFlagMessage("systemctl: unrecognized option '%s'")
          .build();

  private static final FlagSchema HOSTNAMECTL =
      FlagSchema.builder("hostnamectl").flag("h", "help").flag("version").build();

  private static final FlagSchema TIMEDATECTL =
      FlagSchema.builder("timedatectl").flag("h", "help").flag("version").build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    LOG.debug("{} on {}", command.baseCommand(), context.getCurrentNode());
    return switch (command.baseCommand()) {
      case "lscpu" -> lscpu(LSCPU.validate(command), context);
      case "free" -> free(FREE.validate(command), context);
      case "dmidecode" -> dmidecode(DMIDECODE.validate(command), context);
      case "systemctl" -> systemctl(SYSTEMCTL.validate(command), context);
      case "hostnamectl" -> hostnamectl(HOSTNAMECTL.validate(command), context);
      case "timedatectl" -> timedatectl(TIMEDATECTL.validate(command), context);
      default -> throw new SimulatorException("Unknown system tool: " + command.baseCommand());
    };
  }

  private DgxNode node(CommandContext context, String tool) throws SimulatorException {
    return requireNode(context, tool + ": cannot determine the current host");
  }

  private static Instant now(ClusterStore store) {
    return store.bootTime().plus(UPTIME);
  }

  // lscpu

  private CommandResult lscpu(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success("Usage:\n lscpu [options]\n\n"
          + "Display information about the CPU architecture.\n");
    }
    if (cmd.hasFlag("V", "version")) {
      return CommandResult.success("lscpu from util-linux " + UTIL_LINUX_VERSION);
    }
    DgxNode node = node(context, "lscpu");
    int cpus = node.cpuCount();
    int perSocket = Math.max(1, cpus / SOCKETS);
    StringBuilder sb = new StringBuilder()
        .append(field("Architecture:", "x86_64"))
        .append(field("CPU op-mode(s):", "32-bit, 64-bit"))
        .append(field("Byte Order:", "Little Endian"))
        .append(field("CPU(s):", cpus))
        .append(field("On-line CPU(s) list:", "0-" + (cpus - 1)))
        .append(field("Vendor ID:", node.cpuModel().startsWith("AMD")
            ? "AuthenticAMD" : "GenuineIntel"))
        .append(field("Model name:", node.cpuModel()))
        .append(field("Thread(s) per core:", 1))
        .append(field("Core(s) per socket:", perSocket))
        .append(field("Socket(s):", SOCKETS))
        .append(field("CPU max MHz:", "3800.0000"))
        .append(field("CPU min MHz:", "800.0000"))
        .append(field("Virtualization:", "VT-x"))
        .append(field("L1d cache:", (48 * cpus / 1024) + " MiB (" + cpus + " instances)"))
        .append(field("L2 cache:", (2 * cpus) + " MiB (" + cpus + " instances)"))
        .append(field("L3 cache:", (105 * SOCKETS) + " MiB (" + SOCKETS + " instances)"))
        .append(field("NUMA node(s):", SOCKETS));
    for (int s = 0; s < SOCKETS; s++) {
      sb.append(field("NUMA node" + s + " CPU(s):",
          (s * perSocket) + "-" + (s * perSocket + perSocket - 1)));
    }
    return CommandResult.success(sb.toString());
  }

  private static String field(String label, Object value) {
    return String.format("%-33s %s\n", label, value);
  }

  // free

  private CommandResult free(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("help")) {
      return CommandResult.success("Usage:\n free [options]\n\n"
          + "Options:\n"
          + " -k, --kibi          show output in kibibytes\n"
          + " -m, --mebi          show output in mebibytes\n"
          + " -g, --gibi          show output in gibibytes\n"
          + " -h, --human         show human-readable output\n"
          + "     --help          display this help and exit\n");
    }
    if (cmd.hasFlag("V", "version")) {
      return CommandResult.success("free from procps-ng 3.3.17");
    }
    DgxNode node = node(context, "free");
    ClusterStore store = requireCluster(context, "free: cannot determine the current host");
    MemoryUsage mem = MemoryUsage.of(node, store.gpusInUse(node.id()));

    Unit unit = cmd.hasFlag("h", "human") ? Unit.HUMAN
        : cmd.hasFlag("g", "gibi") ? Unit.GIB
        : cmd.hasFlag("m", "mebi") ? Unit.MIB
        : Unit.KIB;
    StringBuilder sb = new StringBuilder()
        .append(String.format("%-7s%12s%12s%12s%12s%12s%12s\n",
            "", "total", "used", "free", "shared", "buff/cache", "available"))
        .append(String.format("%-7s%12s%12s%12s%12s%12s%12s\n", "Mem:",
            unit.format(mem.total()), unit.format(mem.used()), unit.format(mem.free()),
            unit.format(mem.shared()), unit.format(mem.buffCache()),
            unit.format(mem.available())))
        .append(String.format("%-7s%12s%12s%12s\n", "Swap:",
            unit.format(MemoryUsage.SWAP), unit.format(0), unit.format(MemoryUsage.SWAP)));
    return CommandResult.success(sb.toString());
  }

  /** Memory figures in KiB. Each GPU in use pins host memory for its job. */
  record MemoryUsage(long total, long used, long shared, long buffCache) {
    static final long SWAP = 32 * GIB_IN_KIB;

    static MemoryUsage of(DgxNode node, int gpusInUse) {
      long total = node.ramTotalGb() * GIB_IN_KIB;
      long used = (48 + 96L * gpusInUse) * GIB_IN_KIB;
      return new MemoryUsage(total, Math.min(used, total), 4 * GIB_IN_KIB, 180 * GIB_IN_KIB);
    }

    long free() {
      return Math.max(0, total - used - buffCache);
    }

    long available() {
      return Math.max(0, total - used - shared);
    }
  }

  enum Unit {
    KIB(1),
    MIB(1024),
    GIB(1024 * 1024),
    HUMAN(0);

    private final long divisor;

    Unit(long divisor) {
      this.divisor = divisor;
    }

    String format(long kib) {
      if (this != HUMAN) {
        return String.valueOf(kib / divisor);
      }
      if (kib == 0) {
        return "0B";
      }
      String[] suffixes = {"Ki", "Mi", "Gi", "Ti"};
      double value = kib;
      int i = 0;
      while (value >= 1024 && i < suffixes.length - 1) {
        value /= 1024;
        i++;
      }
      String pattern = value < 10 ? "%.1f%s" : "%.0f%s";
      return String.format(Locale.ROOT, pattern, value, suffixes[i]);
    }
  }

  // dmidecode

  private CommandResult dmidecode(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success("Usage: dmidecode [OPTIONS]\n"
          + "Options are:\n"
          + " -t, --type TYPE        Only display the entries of given type\n"
          + " -h, --help             Display this help text and exit\n"
          + " -V, --version          Display the version and exit\n");
    }
    if (cmd.hasFlag("V", "version")) {
      return CommandResult.success(DMIDECODE_VERSION);
    }
    DgxNode node = node(context, "dmidecode");
    StringBuilder sb = new StringBuilder("# dmidecode ").append(DMIDECODE_VERSION).append('\n')
        .append("Getting SMBIOS data from sysfs.\n")
        .append("SMBIOS 3.5.0 present.\n");
    Optional<String> type = cmd.flagValue("t", "type");
    if (type.isEmpty()) {
      for (DmiType t : DmiType.values()) {
        sb.append('\n').append(t.render(node));
      }
      return CommandResult.success(sb.toString());
    }
    DmiType selected = DmiType.parse(type.get())
        .orElseThrow(() -> new SimulatorException("Invalid type keyword: " + type.get() + "\n"
            + "Valid type keywords are:\n"
            + "  bios\n  system\n  baseboard\n  chassis\n  processor\n  memory", 2));
    sb.append('\n').append(selected.render(node));
    return CommandResult.success(sb.toString());
  }

  enum DmiType {
    BIOS("bios", 0) {
      @Override
      String render(DgxNode node) {
        return "Handle 0x0000, DMI type 0, 26 bytes\n"
            + "BIOS Information\n"
            + "\tVendor: American Megatrends International, LLC.\n"
            + "\tVersion: 1.6.7\n"
            + "\tRelease Date: 09/15/2023\n"
            + "\tROM Size: 32 MB\n"
            + "\tCharacteristics:\n"
            + "\t\tPCI is supported\n"
            + "\t\tBIOS is upgradeable\n"
            + "\t\tBIOS shadowing is allowed\n"
            + "\t\tUEFI is supported\n"
            + "\tBIOS Revision: 5.29\n"
            + "\tFirmware Revision: " + node.bmc().firmwareVersion() + "\n";
      }
    },
    SYSTEM("system", 1) {
      @Override
      String render(DgxNode node) {
        String serial = node.serialNumber();
        return "Handle 0x0001, DMI type 1, 27 bytes\n"
            + "System Information\n"
            + "\tManufacturer: NVIDIA\n"
            + "\tProduct Name: " + node.systemType().replace("-", "") + "\n"
            + "\tVersion: Not Specified\n"
            + "\tSerial Number: " + serial + "\n"
            + "\tUUID: " + uuid("system-" + node.id()) + "\n"
            + "\tWake-up Type: Power Switch\n"
            + "\tSKU Number: Not Specified\n"
            + "\tFamily: DGX\n";
      }
    },
    BASEBOARD("baseboard", 2) {
      @Override
      String render(DgxNode node) {
        return "Handle 0x0002, DMI type 2, 15 bytes\n"
            + "Base Board Information\n"
            + "\tManufacturer: NVIDIA\n"
            + "\tProduct Name: " + node.systemType().replace("-", "") + "\n"
            + "\tSerial Number: " + node.serialNumber() + "\n"
            + "\tType: Motherboard\n";
      }
    },
    CHASSIS("chassis", 3) {
      @Override
      String render(DgxNode node) {
        return "Handle 0x0003, DMI type 3, 22 bytes\n"
            + "Chassis Information\n"
            + "\tManufacturer: NVIDIA\n"
            + "\tType: Rack Mount Chassis\n"
            + "\tSerial Number: " + node.serialNumber() + "\n"
            + "\tBoot-up State: Safe\n"
            + "\tPower Supply State: Safe\n"
            + "\tThermal State: Safe\n"
            + "\tHeight: 8 U\n";
      }
    },
    PROCESSOR("processor", 4) {
      @Override
      String render(DgxNode node) {
        int cores = Math.max(1, node.cpuCount() / SOCKETS);
        StringBuilder sb = new StringBuilder();
        for (int s = 0; s < SOCKETS; s++) {
          if (s > 0) {
            sb.append('\n');
          }
          sb.append(String.format("Handle 0x%04X, DMI type 4, 48 bytes\n", 0x0040 + s))
              .append("Processor Information\n")
              .append("\tSocket Designation: CPU").append(s).append('\n')
              .append("\tType: Central Processor\n")
              .append("\tManufacturer: ").append(node.cpuModel().startsWith("AMD")
                  ? "Advanced Micro Devices, Inc." : "Intel(R) Corporation").append('\n')
              .append("\tVersion: ").append(node.cpuModel()).append('\n')
              .append("\tMax Speed: 3800 MHz\n")
              .append("\tCore Count: ").append(cores).append('\n')
              .append("\tThread Count: ").append(cores).append('\n');
        }
        return sb.toString();
      }
    },
    MEMORY("memory", 17) {
      @Override
      String render(DgxNode node) {
        int size = Math.max(1, node.ramTotalGb() / DIMMS);
        StringBuilder sb = new StringBuilder("Handle 0x0039, DMI type 16, 23 bytes\n")
            .append("Physical Memory Array\n")
            .append("\tLocation: System Board Or Motherboard\n")
            .append("\tUse: System Memory\n")
            .append("\tError Correction Type: Multi-bit ECC\n")
            .append("\tMaximum Capacity: ").append(node.ramTotalGb() * 2 / 1024).append(" TB\n")
            .append("\tNumber Of Devices: ").append(DIMMS).append('\n');
        for (int d = 0; d < DIMMS; d++) {
          int socket = d / (DIMMS / SOCKETS);
          int channel = d % (DIMMS / SOCKETS);
          sb.append('\n')
              .append(String.format("Handle 0x%04X, DMI type 17, 92 bytes\n", 0x003C + d))
              .append("Memory Device\n")
              .append("\tArray Handle: 0x0039\n")
              .append("\tTotal Width: 80 bits\n")
              .append("\tData Width: 64 bits\n")
              .append("\tSize: ").append(size).append(" GB\n")
              .append("\tForm Factor: DIMM\n")
              .append("\tLocator: CPU").append(socket).append("_DIMM_")
              .append((char) ('A' + channel)).append("1\n")
              .append("\tType: DDR5\n")
              .append("\tSpeed: 4800 MT/s\n")
              .append("\tManufacturer: Samsung\n")
              .append("\tPart Number: M321R8GA0BB0-CQKZJ\n");
        }
        return sb.toString();
      }
    };

    private final String keyword;
    private final int code;

    DmiType(String keyword, int code) {
      this.keyword = keyword;
      this.code = code;
    }

    abstract String render(DgxNode node);

    /** Accepts a keyword or a DMI type number; 16 and 17 both select memory. */
    static Optional<DmiType> parse(String value) {
      for (DmiType t : values()) {
        if (t.keyword.equals(value) || String.valueOf(t.code).equals(value)) {
          return Optional.of(t);
        }
      }
      return "16".equals(value) ? Optional.of(MEMORY) : Optional.empty();
    }
  }

  static String uuid(String seed) {
    return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
  }

  // systemctl

  private CommandResult systemctl(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success("systemctl [OPTIONS...] COMMAND ...\n\n"
          + "Query or send control commands to the system manager.\n\n"
          + "Unit Commands:\n"
          + "  list-units            List units currently in memory\n"
          + "  is-active UNIT...     Check whether units are active\n"
          + "  status UNIT...        Show runtime status of one or more units\n"
          + "  start UNIT...         Start (activate) one or more units\n"
          + "  stop UNIT...          Stop (deactivate) one or more units\n"
          + "  restart UNIT...       Start or restart one or more units\n"
          + "  enable UNIT...        Enable one or more unit files\n"
          + "  disable UNIT...       Disable one or more unit files\n"
          + "  daemon-reload         Reload the systemd manager configuration\n");
    }
    if (cmd.hasFlag("version")) {
      return CommandResult.success("systemd " + SYSTEMD_VERSION);
    }
    DgxNode node = node(context, "systemctl");
    ClusterStore store = requireCluster(context, "systemctl: cannot determine the current host");
    String action = cmd.subcommand().orElse(cmd.positional(0).orElse("list-units"));
    List<String> units = cmd.subcommand().isPresent()
        ? cmd.positionalArgs()
        : cmd.positionalArgs().stream().skip(1).toList();

    switch (action) {
      case "list-units":
        return CommandResult.success(listUnits(store, node));
      case "daemon-reload":
        return CommandResult.success("");
      case "status":
      case "is-active":
      case "start":
      case "stop":
      case "restart":
      case "enable":
      case "disable":
        break;
      default:
        throw new SimulatorException("Unknown command verb " + action + ".");
    }
    if (units.isEmpty()) {
      throw new SimulatorException("Too few arguments.");
    }

    StringBuilder sb = new StringBuilder();
    int exitCode = 0;
    for (String name : units) {
      Optional<SystemdUnit> found = SystemdUnit.find(name);
      if (found.isEmpty()) {
        if ("is-active".equals(action)) {
          sb.append("inactive\n");
          exitCode = 3;
          continue;
        }
        String file = name.endsWith(".service") ? name : name + ".service";
        String message = "status".equals(action)
            ? "Unit " + file + " could not be found."
            : "Failed to " + action + " " + file + ": Unit " + file + " not found.";
        return new CommandResult(sb + message, "status".equals(action) ? 4 : 5, Optional.empty());
      }
      SystemdUnit unit = found.get();
      boolean active = store.isServiceActive(node.id(), unit.name());
      switch (action) {
        case "status" -> {
          if (sb.length() > 0) {
            sb.append('\n');
          }
          sb.append(status(unit, active, store));
          if (!active) {
            exitCode = 3;
          }
        }
        case "is-active" -> {
          sb.append(active ? "active" : "inactive").append('\n');
          if (!active) {
            exitCode = 3;
          }
        }
        case "start", "restart" -> store.setServiceActive(node.id(), unit.name(), true);
        case "stop" -> store.setServiceActive(node.id(), unit.name(), false);
        case "enable" -> sb.append("Created symlink /etc/systemd/system/multi-user.target.wants/")
            .append(unit.fileName()).append(" → /lib/systemd/system/")
            .append(unit.fileName()).append(".\n");
        default -> sb.append("Removed /etc/systemd/system/multi-user.target.wants/")
            .append(unit.fileName()).append(".\n");
      }
    }
    return new CommandResult(sb.toString(), exitCode, Optional.empty());
  }

  static String status(SystemdUnit unit, boolean active, ClusterStore store) {
    Instant since = store.bootTime().plusSeconds(unit.startOffsetSeconds());
    StringBuilder sb = new StringBuilder()
        .append(active ? "● " : "○ ").append(unit.fileName()).append(" - ")
        .append(unit.description()).append('\n')
        .append("     Loaded: loaded (/lib/systemd/system/").append(unit.fileName())
        .append("; enabled; vendor preset: enabled)\n");
    if (!active) {
      sb.append("     Active: inactive (dead) since ").append(SINCE.format(now(store)))
          .append("; 0s ago\n");
      return sb.toString();
    }
    sb.append("     Active: active (running) since ").append(SINCE.format(since)).append("; ")
        .append(ago(Duration.between(since, now(store)))).append(" ago\n")
        .append("   Main PID: ").append(unit.pid()).append(" (")
        .append(processName(unit)).append(")\n")
        .append("      Tasks: 18 (limit: 4915)\n")
        .append("     CGroup: /system.slice/").append(unit.fileName()).append('\n')
        .append("             └─").append(unit.pid()).append(' ')
        .append(unit.execStart()).append('\n');
    return sb.toString();
  }

  private static String processName(SystemdUnit unit) {
    String exec = unit.execStart().split(" ")[0];
    return exec.substring(exec.lastIndexOf('/') + 1).replace(":", "");
  }

  static String ago(Duration d) {
    long hours = d.toHours();
    long minutes = d.toMinutesPart();
    if (hours > 0) {
      return hours + "h " + minutes + "min";
    }
    return minutes + "min " + d.toSecondsPart() + "s";
  }

  private static String listUnits(ClusterStore store, DgxNode node) {
    StringBuilder sb = new StringBuilder(String.format("  %-30s %-7s %-8s %-8s %s\n",
        "UNIT", "LOAD", "ACTIVE", "SUB", "DESCRIPTION"));
    List<SystemdUnit> units = SystemdUnit.all();
    for (SystemdUnit unit : units) {
      boolean active = store.isServiceActive(node.id(), unit.name());
      sb.append(String.format("  %-30s %-7s %-8s %-8s %s\n", unit.fileName(), "loaded",
          active ? "active" : "inactive", active ? "running" : "dead", unit.description()));
    }
    sb.append('\n')
        .append("LOAD   = Reflects whether the unit definition was properly loaded.\n")
        .append("ACTIVE = The high-level unit activation state, i.e. generalization of SUB.\n")
        .append("SUB    = The low-level unit activation state, values depend on unit type.\n")
        .append(units.size()).append(" loaded units listed.\n");
    return sb.toString();
  }

  // hostnamectl

  private CommandResult hostnamectl(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success("hostnamectl [OPTIONS...] COMMAND ...\n\n"
          + "Query or change system hostname.\n\n"
          + "Commands:\n"
          + "  status                 Show current hostname settings\n"
          + "  set-hostname NAME      Set system hostname\n");
    }
    if (cmd.hasFlag("version")) {
      return CommandResult.success("systemd " + SYSTEMD_VERSION);
    }
    DgxNode node = node(context, "hostnamectl");
    String action = cmd.subcommand().orElse(cmd.positional(0).orElse("status"));
    switch (action) {
      case "status":
        return CommandResult.success(
            String.format("%16s: %s\n", "Static hostname", node.hostname())
                + String.format("%16s: %s\n", "Icon name", "computer-server")
                + String.format("%16s: %s\n", "Chassis", "server")
                + String.format("%16s: %s\n", "Machine ID", hex(uuid("machine-" + node.id())))
                + String.format("%16s: %s\n", "Boot ID", hex(uuid("boot-" + node.id())))
                + String.format("%16s: %s\n", "Operating System", node.osVersion())
                + String.format("%16s: %s\n", "Kernel", "Linux " + node.kernelVersion())
                + String.format("%16s: %s\n", "Architecture", "x86-64")
                + String.format("%16s: %s\n", "Hardware Vendor", "NVIDIA")
                + String.format("%16s: %s\n", "Hardware Model",
                    node.systemType().replace('-', ' ')));
      case "set-hostname":
        if (cmd.positionalArgs().isEmpty()) {
          throw new SimulatorException("Too few arguments.");
        }
        // The cluster names hosts from the cmsh device list, so a rename is not persisted.
        LOG.info("hostnamectl set-hostname {} ignored on {}", cmd.positionalArgs().get(0),
            node.id());
        return CommandResult.success("");
      default:
        throw new SimulatorException("Unknown command verb " + action + ".");
    }
  }

  private static String hex(String uuid) {
    return uuid.replace("-", "");
  }

  // timedatectl

  private CommandResult timedatectl(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success("timedatectl [OPTIONS...] COMMAND ...\n\n"
          + "Query or change system time and date settings.\n\n"
          + "Commands:\n"
          + "  status                   Show current time settings\n"
          + "  set-timezone ZONE        Set system time zone\n"
          + "  list-timezones           Show known time zones\n"
          + "  set-ntp BOOL             Enable or disable network time synchronization\n");
    }
    if (cmd.hasFlag("version")) {
      return CommandResult.success("systemd " + SYSTEMD_VERSION);
    }
    DgxNode node = node(context, "timedatectl");
    ClusterStore store = requireCluster(context, "timedatectl: cannot determine the current host");
    String action = cmd.subcommand().orElse(cmd.positional(0).orElse("status"));
    switch (action) {
      case "status": {
        Instant now = now(store);
        boolean ntp = store.isServiceActive(node.id(), "chronyd");
        return CommandResult.success(
            String.format("%25s: %s\n", "Local time", SINCE.format(now))
                + String.format("%25s: %s\n", "Universal time", SINCE.format(now))
                + String.format("%25s: %s\n", "RTC time", RTC.format(now))
                + String.format("%25s: %s\n", "Time zone", "Etc/UTC (UTC, +0000)")
                + String.format("%25s: %s\n", "System clock synchronized", ntp ? "yes" : "no")
                + String.format("%25s: %s\n", "NTP service", ntp ? "active" : "inactive")
                + String.format("%25s: %s\n", "RTC in local TZ", "no"));
      }
      case "list-timezones":
        return CommandResult.success(String.join("\n", List.of(
            "Africa/Cairo", "America/Chicago", "America/Los_Angeles", "America/New_York",
            "Asia/Shanghai", "Asia/Tokyo", "Europe/London", "Europe/Paris", "Pacific/Auckland",
            "UTC")) + "\n");
      case "set-timezone":
        if (cmd.positionalArgs().isEmpty()) {
          throw new SimulatorException("Too few arguments.");
        }
        return CommandResult.success("");
      case "set-ntp": {
        if (cmd.positionalArgs().isEmpty()) {
          throw new SimulatorException("Too few arguments.");
        }
        String value = cmd.positionalArgs().get(0).toLowerCase(Locale.ROOT);
        if (!BOOLEANS.contains(value)) {
          throw new SimulatorException(
              "Failed to parse argument: " + cmd.positionalArgs().get(0));
        }
        boolean enable = Set.of("yes", "true", "on", "1").contains(value);
        store.setServiceActive(node.id(), "chronyd", enable);
        return CommandResult.success("");
      }
      default:
        throw new SimulatorException("Unknown command verb " + action + ".");
    }
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "system-tools",
        SYSTEMD_VERSION,
        "Basic Linux system inspection tools",
        List.of(
            new CommandInfo("lscpu", "Display CPU architecture information", "lscpu",
                List.of(), List.of("lscpu")),
            new CommandInfo("free", "Display memory usage", "free [-h|-m|-g]",
                List.of(), List.of("free", "free -h")),
            new CommandInfo("dmidecode", "Display SMBIOS hardware information",
                "dmidecode [-t <type>]", List.of(),
                List.of("dmidecode -t bios", "dmidecode -t memory", "dmidecode -t system")),
            new CommandInfo("systemctl", "Query and control systemd services",
                "systemctl [status|start|stop|restart|is-active|list-units] [unit]",
                List.of("start", "stop", "restart", "status", "enable", "disable", "is-active",
                    "list-units", "daemon-reload"),
                List.of("systemctl status nvidia-fabricmanager", "systemctl restart nvsm-core")),
            new CommandInfo("hostnamectl", "Query the system hostname", "hostnamectl [status]",
                List.of("status", "set-hostname"), List.of("hostnamectl")),
            new CommandInfo("timedatectl", "Query time and NTP settings",
                "timedatectl [status|set-ntp <bool>|list-timezones]",
                List.of("status", "set-timezone", "set-ntp", "list-timezones"),
                List.of("timedatectl", "timedatectl set-ntp true"))));
  }
}
