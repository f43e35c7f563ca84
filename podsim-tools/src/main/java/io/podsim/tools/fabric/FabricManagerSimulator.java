package io.podsim.tools.fabric;

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
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.cluster.XidError;
import io.podsim.core.render.Ansi;
import io.podsim.core.render.PipeTable;
import io.podsim.tools.system.SystemdUnit;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the {@code nv-fabricmanager} CLI that manages the NVSwitch fabric of a node. Link
 * and XID state come from the cluster store. The service itself is the
 * {@code nvidia-fabricmanager} systemd unit, so {@code start} and {@code stop} here are seen by
 * {@code systemctl} and the other way round.
 */
public final class FabricManagerSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(FabricManagerSimulator.class);

  static final String VERSION = "535.104.05";
  static final String CONFIG_FILE = "/etc/nvidia-fabricmanager/fabricmanager.cfg";
  private static final Duration UPTIME = Duration.ofHours(2);

  private static final FlagSchema FLAGS =
      FlagSchema.builder("nv-fabricmanager")
          .flag("h", "help")
          .flag("v", "version")
          .unknownFlagMessage("nv-fabricmanager: unrecognized option '%s'\n"
              + "Run 'nv-fabricmanager --help' for usage.")
          .build();

  /** NVSwitch count of the baseboard: six on an eight-GPU HGX board, two on a four-GPU one. */
  static int nvswitchCount(int gpuCount) {
    if (gpuCount >= 8) {
      return 6;
    }
    return gpuCount >= 4 ? 2 : 0;
  }

  /** Stable per-switch UUID in the driver's {@code NVSwitch-xxxxxxxx-...} form. */
  static String nvswitchUuid(DgxNode node, int index) {
    String hex = UUID.nameUUIDFromBytes(
            (node.hostname() + "/nvswitch" + index).getBytes(StandardCharsets.UTF_8))
        .toString()
        .replace("-", "");
    return "NVSwitch-" + hex.substring(0, 8) + "-" + hex.substring(8, 16) + "-"
        + hex.substring(16, 24) + "-" + hex.substring(24, 32);
  }

  /** Switch power in watts, between 60 and 120. */
  static int nvswitchPower(DgxNode node, int index) {
    return 60 + Math.floorMod((node.hostname() + index).hashCode(), 61);
  }

  static int nvswitchTemperature(DgxNode node, int index) {
    return 40 + Math.floorMod((node.hostname() + "t" + index).hashCode(), 15);
  }

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    ParsedCommand cmd = FLAGS.validate(command);
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(help());
    }
    if (cmd.hasFlag("v", "version")) {
      return CommandResult.success("nv-fabricmanager version " + VERSION + "\n"
          + "CUDA Version: 12.2\n"
          + "Driver Version: " + VERSION + "\n");
    }
    if (cmd.subcommand().isEmpty()) {
      if (cmd.positionalArgs().isEmpty()) {
        return CommandResult.success(help());
      }
      throw new SimulatorException("Unknown subcommand: " + cmd.positionalArgs().get(0)
          + "\nRun 'nv-fabricmanager --help' for usage.");
    }
    DgxNode node = requireNode(context, "Error: Unable to determine current node");
    ClusterStore store = requireCluster(context, "Error: Unable to determine current node");
    String sub = cmd.subcommand().get();
    LOG.debug("nv-fabricmanager {} on {}", sub, node.id());
    return switch (sub) {
      case "status" -> CommandResult.success(status(node, store));
      case "start" -> start(node, store);
      case "stop" -> stop(node, store);
      case "restart" -> restart(node, store);
      case "config" -> config(cmd);
      case "query" -> query(cmd, requireRunning(node, store));
      case "diag" -> diag(cmd, requireRunning(node, store), store);
      case "topo" -> CommandResult.success(topo(requireRunning(node, store)));
      default -> throw new SimulatorException("Unknown subcommand: " + sub);
    };
  }

  private static boolean running(DgxNode node, ClusterStore store) {
    return store.isServiceActive(node.id(), SystemdUnit.FABRIC_MANAGER);
  }

  private static DgxNode requireRunning(DgxNode node, ClusterStore store)
      throws SimulatorException {
    if (!running(node, store)) {
      throw new SimulatorException("Error: Unable to connect to Fabric Manager on "
          + node.hostname() + ". Is the nvidia-fabricmanager service running?");
    }
    return node;
  }

  private static String help() {
    return "NVIDIA Fabric Manager CLI\n\n"
        + "Usage: nv-fabricmanager [options] <command> [args]\n\n"
        + "Options:\n"
        + "  -h, --help           Show this help message\n"
        + "  -v, --version        Show version information\n\n"
        + "Commands:\n"
        + "  status               Show fabric manager status\n"
        + "  query <type>         Query fabric information (nvswitch, topology, nvlink)\n"
        + "  start                Start fabric manager service\n"
        + "  stop                 Stop fabric manager service\n"
        + "  restart              Restart fabric manager service\n"
        + "  config [show]        Show configuration\n"
        + "  diag [mode]          Run fabric diagnostics (quick, full, stress, errors, ports)\n"
        + "  topo                 Display topology map\n\n"
        + "Examples:\n"
        + "  nv-fabricmanager status\n"
        + "  nv-fabricmanager query nvswitch\n"
        + "  nv-fabricmanager diag\n";
  }

  private static String heading(String title) {
    return Ansi.BOLD + title + Ansi.RESET + "\n";
  }

  private static String row(String label, Object value) {
    return String.format("  %-22s%s\n", label + ":", value);
  }

  /** NVLink totals of a node. */
  record LinkCounts(int total, int active) {
    static LinkCounts of(DgxNode node) {
      int total = 0;
      int active = 0;
      for (Gpu gpu : node.gpus()) {
        for (NvLinkConnection link : gpu.nvlinks()) {
          total++;
          if (link.isActive()) {
            active++;
          }
        }
      }
      return new LinkCounts(total, active);
    }

    boolean allActive() {
      return total == active;
    }
  }

  private static List<XidError> xidErrors(DgxNode node) {
    return node.gpus().stream().flatMap(g -> g.xidErrors().stream()).toList();
  }

  private static boolean healthy(DgxNode node) {
    return LinkCounts.of(node).allActive()
        && node.gpus().stream().allMatch(g -> g.healthStatus() == HealthStatus.OK);
  }

  // status

  static String status(DgxNode node, ClusterStore store) {
    SystemdUnit unit = SystemdUnit.find(SystemdUnit.FABRIC_MANAGER).orElseThrow();
    boolean running = running(node, store);
    LinkCounts links = LinkCounts.of(node);
    int gpuCount = node.gpus().size();
    StringBuilder sb = new StringBuilder(heading("NVIDIA Fabric Manager Status")).append('\n')
        .append(heading("Service Status:"))
        .append(row("Fabric Manager", running
            ? Ansi.color("Running", Ansi.GREEN) : Ansi.color("Stopped", Ansi.RED)));
    if (running) {
      Instant started = store.bootTime().plusSeconds(unit.startOffsetSeconds());
      Duration up = Duration.between(started, store.bootTime().plus(UPTIME));
      sb.append(row("PID", unit.pid()))
          .append(row("Uptime", String.format("%dd %dh %dm",
              up.toDays(), up.toHoursPart(), up.toMinutesPart())));
    }
    sb.append(row("Config File", CONFIG_FILE)).append('\n')
        .append(heading("Fabric Topology:"))
        .append(row("System Type", node.systemType().replace('-', ' ')))
        .append(row("GPUs", gpuCount))
        .append(row("NVSwitches", nvswitchCount(gpuCount)))
        .append(row("NVLinks Total", links.total()))
        .append(row("NVLinks Active", links.active()))
        .append(row("Topology", nvswitchCount(gpuCount) > 0
            ? "Fully Connected (NVSwitch)" : "Direct NVLink"))
        .append('\n')
        .append(heading("Health Status:"));
    boolean healthy = running && healthy(node);
    int errors = (links.total() - links.active()) + xidErrors(node).size();
    sb.append(row("Overall", healthy
            ? Ansi.color("Healthy", Ansi.GREEN) : Ansi.color("Degraded", Ansi.YELLOW)))
        .append(row("Errors Detected", errors));
    return sb.toString();
  }

  // service control

  private CommandResult start(DgxNode node, ClusterStore store) {
    if (running(node, store)) {
      return CommandResult.success("NVIDIA Fabric Manager is already running (PID "
          + SystemdUnit.find(SystemdUnit.FABRIC_MANAGER).orElseThrow().pid() + ").\n");
    }
    store.setServiceActive(node.id(), SystemdUnit.FABRIC_MANAGER, true);
    LOG.info("Fabric manager started on {}", node.id());
    return CommandResult.success("Starting NVIDIA Fabric Manager...\n"
        + "Initializing NVSwitch fabric...\n"
        + "Discovering GPUs...\n"
        + "Configuring NVLink topology...\n"
        + Ansi.color("NVIDIA Fabric Manager started successfully.", Ansi.GREEN) + "\n");
  }

  private CommandResult stop(DgxNode node, ClusterStore store) {
    store.setServiceActive(node.id(), SystemdUnit.FABRIC_MANAGER, false);
    LOG.info("Fabric manager stopped on {}", node.id());
    return CommandResult.success("Stopping NVIDIA Fabric Manager...\n"
        + "Shutting down NVLink connections...\n"
        + Ansi.color("NVIDIA Fabric Manager stopped.", Ansi.YELLOW) + "\n");
  }

  private CommandResult restart(DgxNode node, ClusterStore store) {
    store.setServiceActive(node.id(), SystemdUnit.FABRIC_MANAGER, true);
    LOG.info("Fabric manager restarted on {}", node.id());
    return CommandResult.success("Restarting NVIDIA Fabric Manager...\n"
        + "Stopping service...\n"
        + "Starting service...\n"
        + "Initializing NVSwitch fabric...\n"
        + Ansi.color("NVIDIA Fabric Manager restarted successfully.", Ansi.GREEN) + "\n");
  }

  // config

  private CommandResult config(ParsedCommand cmd) throws SimulatorException {
    String option = cmd.positional(0).orElse("show");
    if (!"show".equals(option)) {
      throw new SimulatorException("Unknown config option: " + option
          + "\nUse 'nv-fabricmanager config show' to display configuration.");
    }
    return CommandResult.success(heading("Fabric Manager Configuration") + "\n"
        + "Configuration file: " + CONFIG_FILE + "\n\n"
        + "[General]\n"
        + "  LOG_LEVEL=4\n"
        + "  LOG_FILE=/var/log/nvidia-fabricmanager.log\n"
        + "  DAEMONIZE=1\n\n"
        + "[Fabric]\n"
        + "  FM_STAY_RESIDENT=1\n"
        + "  FM_NSEC_POLL_INTERVAL=100000000\n"
        + "  FABRIC_MODE=FULL_SPEED\n"
        + "  FM_CMD_BIND_INTERFACE=127.0.0.1\n"
        + "  FM_CMD_PORT_NUMBER=16001\n\n"
        + "[NVSwitch]\n"
        + "  NVSWITCH_BLACKLIST_MODE=0\n"
        + "  NVSWITCH_ERR_THRESHOLD=16\n"
        + "  ACCESS_LINK_TIMEOUT_MS=5000\n\n"
        + "[Health]\n"
        + "  HEALTH_CHECK_ENABLED=1\n"
        + "  HEALTH_CHECK_INTERVAL_SEC=60\n");
  }

  // query

  private CommandResult query(ParsedCommand cmd, DgxNode node) throws SimulatorException {
    if (cmd.positionalArgs().isEmpty()) {
      return CommandResult.success("Query types:\n"
          + "  nvswitch   - Query NVSwitch status\n"
          + "  topology   - Query fabric topology\n"
          + "  nvlink     - Query NVLink status\n\n"
          + "Usage: nv-fabricmanager query <type>\n");
    }
    String type = cmd.positionalArgs().get(0);
    return switch (type) {
      case "nvswitch" -> CommandResult.success(queryNvswitch(node));
      case "topology" -> CommandResult.success(queryTopology(node));
      case "nvlink" -> CommandResult.success(queryNvlink(node));
      default -> throw new SimulatorException("Invalid query type: " + type
          + "\nValid types: nvswitch, topology, nvlink");
    };
  }

  static String queryNvswitch(DgxNode node) {
    int count = nvswitchCount(node.gpus().size());
    StringBuilder sb = new StringBuilder(heading("NVSwitch Status")).append('\n');
    if (count == 0) {
      return sb.append("No NVSwitches detected in this system configuration.\n").toString();
    }
    PipeTable table = new PipeTable("NVSwitch", "UUID", "State", "Temp", "Power");
    for (int i = 0; i < count; i++) {
      table.addRow(i, nvswitchUuid(node, i), "Active",
          nvswitchTemperature(node, i) + "C", nvswitchPower(node, i) + "W");
    }
    return sb.append(table.render()).append('\n')
        .append("Total NVSwitches: ").append(count).append('\n')
        .append("All NVSwitches operational.\n")
        .toString();
  }

  static String queryTopology(DgxNode node) {
    StringBuilder sb = new StringBuilder(heading("Fabric Topology")).append('\n')
        .append("System: ").append(node.systemType().replace('-', ' ')).append('\n')
        .append("Hostname: ").append(node.hostname()).append("\n\n")
        .append("GPU Topology:\n");
    for (Gpu gpu : node.gpus()) {
      long active = gpu.nvlinks().stream().filter(NvLinkConnection::isActive).count();
      sb.append("  GPU ").append(gpu.index()).append(": ").append(gpu.name()).append(" - ")
          .append(active).append('/').append(gpu.nvlinks().size())
          .append(" NVLinks active\n");
    }
    int switches = nvswitchCount(node.gpus().size());
    if (switches > 0) {
      sb.append("\nNVSwitch Connectivity:\n");
      for (int sw = 0; sw < switches; sw++) {
        sb.append("  NVSwitch ").append(sw).append(": Connected to GPUs [")
            .append(connectedGpus(node, sw)).append("]\n");
      }
    }
    return sb.toString();
  }

  /**
   * GPUs reaching a switch. The links of each GPU are spread round robin across the switches, so
   * a GPU is connected to switch {@code sw} while any link with {@code linkId % switches == sw}
   * is active.
   */
  private static String connectedGpus(DgxNode node, int sw) {
    int switches = nvswitchCount(node.gpus().size());
    return node.gpus().stream()
        .filter(g -> g.nvlinks().stream()
            .anyMatch(l -> l.isActive() && l.linkId() % switches == sw))
        .map(g -> String.valueOf(g.index()))
        .collect(Collectors.joining(", "));
  }

  static String queryNvlink(DgxNode node) {
    StringBuilder sb = new StringBuilder(heading("NVLink Status")).append('\n');
    PipeTable table = new PipeTable("GPU", "Link", "State", "Speed", "Remote", "Bandwidth");
    int switches = nvswitchCount(node.gpus().size());
    for (Gpu gpu : node.gpus()) {
      for (NvLinkConnection link : gpu.nvlinks()) {
        table.addRow(gpu.index(), link.linkId(),
            link.isActive()
                ? Ansi.color("Active", Ansi.GREEN)
                : Ansi.color(link.status().label(), Ansi.RED),
            generation(node),
            switches > 0 ? "NVSwitch " + link.linkId() % switches : "Direct",
            link.isActive() ? link.speedGbps() + " GB/s" : "N/A");
      }
    }
    LinkCounts counts = LinkCounts.of(node);
    return sb.append(table.render()).append('\n')
        .append("Total NVLinks: ").append(counts.total()).append('\n')
        .append("Active NVLinks: ").append(counts.active()).append('\n')
        .append("Inactive NVLinks: ").append(counts.total() - counts.active()).append('\n')
        .toString();
  }

  private static String generation(DgxNode node) {
    return node.systemType().contains("A100") ? "NVLink3" : "NVLink4";
  }

  // diag

  private CommandResult diag(ParsedCommand cmd, DgxNode node, ClusterStore store)
      throws SimulatorException {
    String mode = cmd.positional(0).orElse("basic");
    LOG.debug("Fabric diagnostics '{}' on {}", mode, node.id());
    return switch (mode) {
      case "basic" -> CommandResult.success(diagBasic(node, store));
      case "quick" -> CommandResult.success(diagQuick(node, store));
      case "full" -> CommandResult.success(diagFull(node, store));
      case "stress" -> CommandResult.success(diagStress(node));
      case "errors" -> CommandResult.success(diagErrors(node));
      case "ports" -> CommandResult.success(diagPorts(node));
      default -> throw new SimulatorException("Unknown diagnostic mode: " + mode
          + "\nValid modes: quick, full, stress, errors, ports");
    };
  }

  private static String pass(boolean ok, String good, String bad) {
    return ok ? Ansi.color(good, Ansi.GREEN) : Ansi.color(bad, Ansi.YELLOW);
  }

  static String diagBasic(DgxNode node, ClusterStore store) {
    LinkCounts links = LinkCounts.of(node);
    int switches = nvswitchCount(node.gpus().size());
    int errors = xidErrors(node).size();
    StringBuilder sb = new StringBuilder(heading("NVIDIA Fabric Manager Diagnostics"))
        .append('\n')
        .append("Running fabric diagnostics...\n\n")
        .append(heading("[1/5] Checking Fabric Manager Service"))
        .append("  Service Status: ").append(pass(running(node, store), "Running", "Stopped"))
        .append('\n')
        .append("  Configuration: ").append(Ansi.color("Valid", Ansi.GREEN)).append("\n\n")
        .append(heading("[2/5] Checking NVSwitch Devices"));
    if (switches > 0) {
      sb.append("  Detected: ").append(switches).append(" NVSwitches\n")
          .append("  Status: ").append(Ansi.color("All Operational", Ansi.GREEN)).append("\n\n");
    } else {
      sb.append("  No NVSwitch devices detected\n\n");
    }
    sb.append(heading("[3/5] Checking NVLink Connections"))
        .append("  Total Links: ").append(links.total()).append('\n')
        .append("  Active Links: ").append(links.active()).append('\n')
        .append("  Status: ")
        .append(pass(links.allActive(), "All Links Active", "Some Links Inactive"))
        .append("\n\n")
        .append(heading("[4/5] Testing NVLink Bandwidth"))
        .append("  Aggregate Bandwidth: ").append(aggregateBandwidth(node)).append(" GB/s\n")
        .append("  Per-Link Bandwidth: ~").append(linkSpeed(node)).append(" GB/s\n")
        .append("  Status: ").append(Ansi.color("Within Expected Range", Ansi.GREEN))
        .append("\n\n")
        .append(heading("[5/5] Checking Error Logs"))
        .append("  Recent Errors: ").append(errors).append('\n')
        .append("  Status: ").append(pass(errors == 0, "No Errors", "Errors Detected"))
        .append("\n\n");
    boolean passed = links.allActive() && errors == 0;
    sb.append(Ansi.BOLD).append("Diagnostic Summary:").append(Ansi.RESET).append(' ')
        .append(pass(passed, "PASSED", "WARNINGS")).append('\n');
    return sb.toString();
  }

  private static int linkSpeed(DgxNode node) {
    return node.gpus().stream()
        .flatMap(g -> g.nvlinks().stream())
        .mapToInt(NvLinkConnection::speedGbps)
        .findFirst()
        .orElse(0);
  }

  private static int aggregateBandwidth(DgxNode node) {
    return node.gpus().stream()
        .flatMap(g -> g.nvlinks().stream())
        .filter(NvLinkConnection::isActive)
        .mapToInt(NvLinkConnection::speedGbps)
        .sum();
  }

  static String diagQuick(DgxNode node, ClusterStore store) {
    LinkCounts links = LinkCounts.of(node);
    int errors = xidErrors(node).size();
    boolean running = running(node, store);
    boolean ok = running && links.allActive() && errors == 0;
    return heading("Quick Fabric Health Check") + "\n"
        + row("Fabric Manager", pass(running, "Running", "Stopped"))
        + row("NVSwitches", nvswitchCount(node.gpus().size()))
        + row("NVLinks", links.active() + "/" + links.total() + " active")
        + row("XID Errors", errors)
        + "\n"
        + "Result: " + (ok
            ? Ansi.color("HEALTHY", Ansi.GREEN)
            : Ansi.color("ATTENTION NEEDED", Ansi.YELLOW)) + "\n";
  }

  static String diagFull(DgxNode node, ClusterStore store) {
    LinkCounts links = LinkCounts.of(node);
    int switches = nvswitchCount(node.gpus().size());
    List<XidError> errors = xidErrors(node);
    List<String> issues = new ArrayList<>();
    if (!running(node, store)) {
      issues.add("Fabric Manager service is not running");
    }
    if (!links.allActive()) {
      issues.add((links.total() - links.active()) + " NVLink(s) not active");
    }
    if (!errors.isEmpty()) {
      issues.add(errors.size() + " XID error(s) recorded");
    }
    StringBuilder sb = new StringBuilder(heading("Full Fabric Diagnostic Suite")).append('\n')
        .append(heading("Phase 1: Hardware Detection"))
        .append("  GPUs detected: ").append(node.gpus().size()).append('\n')
        .append("  NVSwitches detected: ").append(switches).append("\n\n")
        .append(heading("Phase 2: NVLink Training"))
        .append("  Links trained: ").append(links.active()).append('/').append(links.total())
        .append("\n\n")
        .append(heading("Phase 3: Fabric Routing"))
        .append("  Routing tables: ").append(switches > 0 ? "Programmed" : "Not applicable")
        .append("\n\n")
        .append(heading("Phase 4: Bandwidth Verification"))
        .append("  Aggregate bandwidth: ").append(aggregateBandwidth(node)).append(" GB/s\n\n")
        .append(heading("Phase 5: Error Log Review"))
        .append("  XID errors: ").append(errors.size()).append("\n\n");
    if (issues.isEmpty()) {
      sb.append("Result: ").append(Ansi.color("ALL TESTS PASSED", Ansi.GREEN)).append('\n');
    } else {
      sb.append("Result: ").append(Ansi.color("ISSUES DETECTED", Ansi.YELLOW)).append('\n');
      issues.forEach(i -> sb.append("  - ").append(i).append('\n'));
    }
    return sb.toString();
  }

  static String diagStress(DgxNode node) {
    List<Integer> perGpu = node.gpus().stream()
        .map(g -> g.nvlinks().stream()
            .filter(NvLinkConnection::isActive)
            .mapToInt(NvLinkConnection::speedGbps)
            .sum())
        .toList();
    int peak = perGpu.stream().mapToInt(Integer::intValue).max().orElse(0);
    int minimum = perGpu.stream().mapToInt(Integer::intValue).min().orElse(0);
    double average = perGpu.stream().mapToInt(Integer::intValue).average().orElse(0);
    return heading("NVLink Stress Test") + "\n"
        + Ansi.color("Warning: stress testing saturates every NVLink on this node.", Ansi.YELLOW)
        + "\n\n"
        + "Pattern: Bidirectional all-to-all\n"
        + "GPUs under test: " + node.gpus().size() + "\n\n"
        + "Results:\n"
        + String.format(Locale.ROOT, "  Peak bandwidth:    %.1f GB/s\n", peak * 0.96)
        + String.format(Locale.ROOT, "  Average bandwidth: %.1f GB/s\n", average * 0.93)
        + String.format(Locale.ROOT, "  Minimum bandwidth: %.1f GB/s\n", minimum * 0.90)
        + "\n"
        + Ansi.color("Stress test completed successfully.", Ansi.GREEN) + "\n";
  }

  static String diagErrors(DgxNode node) {
    List<XidError> errors = xidErrors(node);
    long crc = 0;
    long replay = 0;
    long tx = 0;
    for (Gpu gpu : node.gpus()) {
      for (NvLinkConnection link : gpu.nvlinks()) {
        crc += link.rxErrors();
        tx += link.txErrors();
        replay += link.replayErrors();
      }
    }
    StringBuilder sb = new StringBuilder(heading("Fabric Error Analysis")).append('\n')
        .append("Error Summary:\n")
        .append("  XID errors: ").append(errors.size()).append('\n');
    if (errors.isEmpty()) {
      sb.append("  ").append(Ansi.color("No fabric errors detected", Ansi.GREEN)).append('\n');
    } else {
      sb.append("\nError Details:\n");
      for (Gpu gpu : node.gpus()) {
        for (XidError e : gpu.xidErrors()) {
          sb.append("  GPU ").append(gpu.index()).append(": XID ").append(e.code())
              .append(" - ").append(e.description()).append('\n');
        }
      }
    }
    sb.append("\nPort Error Counters:\n")
        .append("  CRC Errors:    ").append(crc).append('\n')
        .append("  TX Errors:     ").append(tx).append('\n')
        .append("  Replay Errors: ").append(replay).append('\n');
    if (!errors.isEmpty() || crc + tx + replay > 0) {
      sb.append("\nRecommendations:\n");
      if (!errors.isEmpty()) {
        sb.append("  - Review XID error patterns with 'nvidia-smi -q' and 'dmesg'\n");
      }
      if (crc + tx + replay > 0) {
        sb.append("  - Reseat or replace the affected NVLink bridge or baseboard\n");
      }
    }
    return sb.toString();
  }

  static String diagPorts(DgxNode node) {
    int switches = nvswitchCount(node.gpus().size());
    StringBuilder sb = new StringBuilder(heading("Port-Level Diagnostics")).append('\n')
        .append("GPU NVLink Ports:\n");
    for (Gpu gpu : node.gpus()) {
      long active = gpu.nvlinks().stream().filter(NvLinkConnection::isActive).count();
      String down = gpu.nvlinks().stream()
          .filter(l -> !l.isActive())
          .map(l -> String.valueOf(l.linkId()))
          .collect(Collectors.joining(","));
      sb.append("  GPU ").append(gpu.index()).append(": ").append(active).append('/')
          .append(gpu.nvlinks().size()).append(" ports up");
      if (!down.isEmpty()) {
        sb.append(' ').append(Ansi.color("(down: " + down + ")", Ansi.RED));
      }
      sb.append('\n');
    }
    sb.append('\n');
    if (switches == 0) {
      return sb.append("No NVSwitch devices detected; GPUs use direct NVLink connections.\n")
          .toString();
    }
    sb.append("NVSwitch Ports:\n");
    for (int sw = 0; sw < switches; sw++) {
      int s = sw;
      long up = node.gpus().stream()
          .flatMap(g -> g.nvlinks().stream())
          .filter(l -> l.isActive() && l.linkId() % switches == s)
          .count();
      sb.append("  NVSwitch ").append(sw).append(": ").append(up).append(" ports up\n");
    }
    return sb.toString();
  }

  // topo

  static String topo(DgxNode node) {
    int gpus = node.gpus().size();
    int switches = nvswitchCount(gpus);
    StringBuilder sb = new StringBuilder(heading("NVSwitch Fabric Topology Map")).append('\n');
    if (switches == 0) {
      return sb.append("  No NVSwitch fabric detected.\n")
          .append("  System uses direct GPU-to-GPU NVLink connections.\n")
          .toString();
    }
    String switchRow = IntStream.range(0, switches)
        .mapToObj(i -> "[SW" + i + "]")
        .collect(Collectors.joining(" "));
    String gpuRow = node.gpus().stream()
        .map(g -> "[G" + g.index() + "]")
        .collect(Collectors.joining(" "));
    sb.append("  NVSwitch tier:  ").append(switchRow).append('\n')
        .append("                  ").append("\\ | NVLink | /\n")
        .append("  GPU tier:       ").append(gpuRow).append("\n\n")
        .append("  Legend:\n")
        .append("    [SW#] = NVSwitch #\n")
        .append("    [G#]  = GPU #\n\n")
        .append("  Connectivity:\n")
        .append("    - Each GPU connected to all ").append(switches).append(" NVSwitches\n")
        .append("    - Full mesh GPU-to-GPU via NVSwitch\n")
        .append("    - Aggregate bandwidth: ").append(aggregateBandwidth(node)).append(" GB/s\n");
    return sb.toString();
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "nv-fabricmanager",
        VERSION,
        "NVIDIA Fabric Manager CLI",
        List.of(
            new CommandInfo(
                "nv-fabricmanager",
                "Manage the NVSwitch fabric",
                "nv-fabricmanager [status|query|start|stop|restart|config|diag|topo]",
                List.of("status", "query", "start", "stop", "restart", "config", "diag", "topo"),
                List.of(
                    "nv-fabricmanager status",
                    "nv-fabricmanager query nvswitch",
                    "nv-fabricmanager diag full"))));
  }
}
