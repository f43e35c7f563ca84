package io.podsim.tools.pci;

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
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the host-level diagnostics {@code lspci}, {@code journalctl} and {@code dmesg}. All
 * three read the node's hardware and fault state, so an XID recorded on a GPU shows up in the PCI
 * listing and in both logs.
 */
public final class PciToolsSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(PciToolsSimulator.class);

  static final String LSPCI_VERSION = "3.7.0";
  static final String SYSTEMD_VERSION = "249 (249.11-0ubuntu3.12)";
  static final String UTIL_LINUX_VERSION = "2.37.2";

  private static final Pattern DEVICE_FILTER =
      Pattern.compile("([0-9a-fA-F]{0,4})(?::([0-9a-fA-F]{0,4}))?");

  private static final DateTimeFormatter CTIME =
      DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);

  private static final FlagSchema LSPCI =
      FlagSchema.builder("lspci")
          .flag("v")
          .flag("vv")
          .flag("vvv")
          .flag("nn")
          .flag("k")
          .option("d")
          .option("s")
          .flag("h", "help")
          .flag("version")
          .unknownFlagMessage("lspci: unknown option '%s'")
          .build();

  private static final FlagSchema JOURNALCTL =
      FlagSchema.builder("journalctl")
          .flag("b", "boot")
          .flag("k", "dmesg")
          .option("u", "unit")
          .option("p", "priority")
          .option("n", "lines")
          .flag("no-pager")
          .flag("h", "help")
          .flag("version")
          .unknownFlagMessage("journalctl: unrecognized option '%s'")
          .build();

  private static final FlagSchema DMESG =
      FlagSchema.builder("dmesg")
          .flag("T", "ctime")
          .option("l", "level")
          .flag("h", "help")
          .flag("V", "version")
          .unknownFlagMessage("dmesg: unrecognized option '%s'\n"
              + "Try 'dmesg --help' for more information.")
          .build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    LOG.debug("{} on {}", command.baseCommand(), context.getCurrentNode());
    return switch (command.baseCommand()) {
      case "lspci" -> lspci(LSPCI.validate(command), context);
      case "journalctl" -> journalctl(JOURNALCTL.validate(command), context);
      case "dmesg" -> dmesg(DMESG.validate(command), context);
      default -> throw new SimulatorException("Unknown PCI tool: " + command.baseCommand());
    };
  }

  // lspci

  private CommandResult lspci(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(lspciUsage());
    }
    if (cmd.hasFlag("version")) {
      return CommandResult.success("lspci version " + LSPCI_VERSION);
    }
    Optional<DgxNode> node = resolveNode(context);
    if (node.isEmpty()) {
      return CommandResult.success("No PCI devices found");
    }
    int verbosity = cmd.hasFlag("vvv") ? 3 : cmd.hasFlag("vv") ? 2 : cmd.hasFlag("v") ? 1 : 0;
    boolean numeric = cmd.hasFlag("nn");
    boolean drivers = cmd.hasFlag("k");

    List<PciDevice> devices = new ArrayList<>(PciDevice.of(node.get()));
    Optional<String> filter = cmd.flagValue("d");
    if (filter.isPresent()) {
      Matcher m = DEVICE_FILTER.matcher(filter.get());
      if (!m.matches()) {
        throw new SimulatorException("lspci: -d: Invalid vendor ID");
      }
      String vendor = m.group(1).toLowerCase(Locale.ROOT);
      String device = m.group(2) == null ? "" : m.group(2).toLowerCase(Locale.ROOT);
      devices.removeIf(d -> (!vendor.isEmpty() && !d.vendorId().equals(vendor))
          || (!device.isEmpty() && !d.deviceId().equals(device)));
    }
    Optional<String> slot = cmd.flagValue("s");
    if (slot.isPresent()) {
      String s = slot.get().toLowerCase(Locale.ROOT);
      devices.removeIf(d -> !(d.address().equals(s) || d.slot().equals(s)
          || (s.endsWith(":") && d.slot().startsWith(s))));
    }

    StringBuilder sb = new StringBuilder();
    for (PciDevice device : devices) {
      sb.append(describe(device, verbosity, numeric, drivers));
      if (verbosity > 0) {
        sb.append('\n');
      }
    }
    return CommandResult.success(sb.toString());
  }

  static String describe(PciDevice d, int verbosity, boolean numeric, boolean drivers) {
    StringBuilder sb = new StringBuilder(d.address()).append(' ').append(d.className());
    if (numeric) {
      sb.append(" [").append(d.classCode()).append(']');
    }
    sb.append(": ").append(d.vendorName()).append(' ').append(d.deviceName());
    if (numeric) {
      sb.append(" [").append(d.vendorId()).append(':').append(d.deviceId()).append(']');
    }
    sb.append(" (rev ").append(d.responding() ? "a1" : "ff").append(")\n");

    if (verbosity > 0 || drivers) {
      sb.append("\tSubsystem: ").append(d.vendorName()).append(" Device ")
          .append(d.subsystemId());
      if (numeric) {
        sb.append(" [").append(d.vendorId()).append(':').append(d.subsystemId()).append(']');
      }
      sb.append('\n');
    }
    if (verbosity > 0) {
      long bar = 0x9000_0000L + (long) d.bus() * 0x0100_0000L;
      sb.append("\tControl: I/O- Mem").append(d.responding() ? '+' : '-')
          .append(" BusMaster").append(d.responding() ? '+' : '-')
          .append(" SpecCycle- MemWINV- VGASnoop- ParErr- Stepping- SERR- FastB2B- DisINTx+\n")
          .append("\tStatus: Cap+ 66MHz- UDF- FastB2B- ParErr- DEVSEL=fast >TAbort- <TAbort- "
              + "<MAbort- >SERR- <PERR- INTx-\n")
          .append("\tLatency: 0\n")
          .append("\tInterrupt: pin A routed to IRQ ").append(16 + d.bus() % 200).append('\n')
          .append("\tNUMA node: ").append(d.numaNode()).append('\n')
          .append(String.format("\tMemory at %x (32-bit, non-prefetchable) [size=16M]\n", bar));
      if (verbosity > 1) {
        String speed = d.responding() ? "Speed 32GT/s (ok), Width x16 (ok)"
            : "Speed 2.5GT/s (downgraded), Width x1 (downgraded)";
        sb.append("\tCapabilities: [60] Express (v2) Endpoint, MSI 00\n")
            .append("\t\tLnkCap:\tPort #0, Speed 32GT/s, Width x16, ASPM not supported\n")
            .append("\t\tLnkSta:\t").append(speed).append('\n');
      }
      for (String fault : d.faults()) {
        sb.append("\tFault: ").append(fault).append('\n');
      }
    }
    if (verbosity > 0 || drivers) {
      sb.append("\tKernel driver in use: ").append(d.driver()).append('\n')
          .append("\tKernel modules: ").append(d.modules()).append('\n');
    }
    return sb.toString();
  }

  // journalctl

  private CommandResult journalctl(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(journalctlUsage());
    }
    if (cmd.hasFlag("version")) {
      return CommandResult.success("systemd " + SYSTEMD_VERSION + "\n"
          + "+PAM +AUDIT +SELINUX +APPARMOR +IMA +SMACK +SECCOMP +GCRYPT +GNUTLS +OPENSSL +ACL");
    }
    ClusterStore store = requireCluster(context, "No journal files were found.");
    DgxNode node = requireNode(context, "No journal files were found.");

    List<SystemJournal.Entry> entries = SystemJournal.entries(store, node);
    if (cmd.hasFlag("k", "dmesg")) {
      entries.removeIf(e -> !e.isKernel());
    }
    Optional<String> unit = cmd.flagValue("u", "unit");
    if (unit.isPresent()) {
      String name = unit.get().endsWith(".service")
          ? unit.get().substring(0, unit.get().length() - ".service".length())
          : unit.get();
      entries.removeIf(e -> e.isKernel() || !e.unit().equals(name));
    }
    Optional<String> priority = cmd.flagValue("p", "priority");
    if (priority.isPresent()) {
      int max = SystemJournal.priority(priority.get())
          .orElseThrow(() -> new SimulatorException(
              "Failed to parse priority value: " + priority.get()));
      entries.removeIf(e -> e.priority() > max);
    }
    Optional<String> lines = cmd.flagValue("n", "lines");
    if (lines.isPresent()) {
      int n = parseIndex(lines.get(), "Failed to parse lines '" + lines.get() + "'");
      if (entries.size() > n) {
        entries = new ArrayList<>(entries.subList(entries.size() - n, entries.size()));
      }
    }

    StringBuilder sb = new StringBuilder(SystemJournal.header(entries, store.bootTime()))
        .append('\n');
    if (entries.isEmpty()) {
      sb.append("-- No entries --\n");
    }
    for (SystemJournal.Entry e : entries) {
      sb.append(e.render(node.hostname())).append('\n');
    }
    return CommandResult.success(sb.toString());
  }

  // dmesg

  private CommandResult dmesg(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(dmesgUsage());
    }
    if (cmd.hasFlag("V", "version")) {
      return CommandResult.success("dmesg from util-linux " + UTIL_LINUX_VERSION);
    }
    ClusterStore store = requireCluster(context,
        "dmesg: read kernel buffer failed: Operation not permitted");
    DgxNode node = requireNode(context,
        "dmesg: read kernel buffer failed: Operation not permitted");

    Set<Integer> levels = levels(cmd.flagValue("l", "level"));
    boolean ctime = cmd.hasFlag("T", "ctime");
    Instant boot = store.bootTime();
    StringBuilder sb = new StringBuilder();
    for (SystemJournal.Entry e : SystemJournal.entries(store, node)) {
      if (!e.isKernel() || (!levels.isEmpty() && !levels.contains(e.priority()))) {
        continue;
      }
      if (ctime) {
        sb.append('[').append(CTIME.format(e.time())).append("] ");
      } else {
        double seconds = Duration.between(boot, e.time()).toMillis() / 1000.0;
        sb.append(String.format(Locale.ROOT, "[%12.6f] ", seconds));
      }
      sb.append(e.message()).append('\n');
    }
    return CommandResult.success(sb.toString());
  }

  private static Set<Integer> levels(Optional<String> value) throws SimulatorException {
    Set<Integer> levels = new HashSet<>();
    if (value.isEmpty()) {
      return levels;
    }
    for (String name : value.get().split(",")) {
      String level = name.trim().equals("warn") ? "warning" : name.trim();
      Optional<Integer> parsed = SystemJournal.priority(level)
          .filter(p -> !Character.isDigit(level.charAt(0)));
      if (parsed.isEmpty()) {
        throw new SimulatorException("dmesg: unknown level '" + name.trim() + "'");
      }
      levels.add(parsed.get());
    }
    return levels;
  }

  private static String lspciUsage() {
    return "Usage: lspci [<switches>]\n\n"
        + "Display options:\n"
        + "-v\t\tBe verbose (-vv or -vvv for higher verbosity)\n"
        + "-k\t\tShow kernel drivers handling each device\n"
        + "-nn\t\tShow both textual and numeric ID's (names & numbers)\n\n"
        + "Selection of devices:\n"
        + "-s [[[[<domain>]:]<bus>]:][<slot>][.[<func>]]\tShow only devices in selected slots\n"
        + "-d [<vendor>]:[<device>]\t\t\tShow only devices with specified ID's\n";
  }

  private static String journalctlUsage() {
    return "journalctl [OPTIONS...] [MATCHES...]\n\n"
        + "Query the journal.\n\n"
        + "Options:\n"
        + "  -b --boot[=ID]             Show current boot or the specified boot\n"
        + "  -k --dmesg                 Show kernel message log from the current boot\n"
        + "  -u --unit=UNIT             Show logs from the specified unit\n"
        + "  -p --priority=RANGE        Show entries with the specified priority\n"
        + "  -n --lines[=INTEGER]       Number of journal entries to show\n"
        + "     --no-pager              Do not pipe output into a pager\n"
        + "  -h --help                  Show this help text\n"
        + "     --version               Show package version\n";
  }

  private static String dmesgUsage() {
    return "\nUsage:\n dmesg [options]\n\n"
        + "Display or control the kernel ring buffer.\n\n"
        + "Options:\n"
        + " -l, --level <list>          restrict output to defined levels\n"
        + " -T, --ctime                 show human-readable timestamp\n"
        + " -h, --help                  display this help\n"
        + " -V, --version               display version\n\n"
        + "Supported log levels (priorities):\n"
        + String.join(", ", SystemJournal.PRIORITIES).replace("warning", "warn") + "\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "pci-tools",
        LSPCI_VERSION,
        "PCI device listing and system logs",
        List.of(
            new CommandInfo(
                "lspci",
                "List PCI devices",
                "lspci [-v|-vv|-vvv] [-nn] [-k] [-d vendor:[device]] [-s slot]",
                List.of(),
                List.of("lspci", "lspci -d 10de:", "lspci -vv -s 18:00.0")),
            new CommandInfo(
                "journalctl",
                "Query the systemd journal",
                "journalctl [-b] [-k] [-u unit] [-p priority] [-n lines] [--no-pager]",
                List.of(),
                List.of("journalctl -b", "journalctl -k -p err", "journalctl -u slurmd")),
            new CommandInfo(
                "dmesg",
                "Print the kernel ring buffer",
                "dmesg [-T] [-l levels]",
                List.of(),
                List.of("dmesg", "dmesg -T", "dmesg -l err,warn"))));
  }
}
