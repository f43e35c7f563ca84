package io.podsim.tools.dcgm;

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
import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.cluster.NvLinkStatus;
import io.podsim.core.cluster.SlurmJob;
import io.podsim.core.render.Ansi;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the DCGM command line client. GPU groups and stats recording are session state held
 * by this instance; everything else is read from the cluster store.
 *
 * <p>Some flag combinations are accepted loosely on purpose: {@code health -c} without a group
 * checks every GPU, {@code diag -r} without a group runs on every GPU, {@code stats} without an
 * action prints its usage and {@code dmon} without {@code -g} samples every GPU.
 */
public final class DcgmiSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(DcgmiSimulator.class);

  static final String VERSION = "3.3.5";
  private static final String NO_HOST_ENGINE =
      "Error: unable to establish a connection to the specified host: localhost\n"
          + "Error: Unable to connect to host engine. Host engine connection invalid/disconnected.";

  private static final FlagSchema TOP_FLAGS =
      FlagSchema.builder("dcgmi").flag("h", "help").flag("v", "version").build();

  private static final FlagSchema DISCOVERY_FLAGS =
      FlagSchema.builder("dcgmi discovery").requiredFlag("l", "list").flag("h", "help").build();

  private static final FlagSchema HEALTH_FLAGS =
      FlagSchema.builder("dcgmi health")
          .option("g", "group")
          .requiredFlag("c", "check")
          .flag("h", "help")
          .build();

  private static final FlagSchema DIAG_FLAGS =
      FlagSchema.builder("dcgmi diag")
          .required("r", "run")
          .option("g", "group")
          .flag("h", "help")
          .build();

  private static final FlagSchema STATS_FLAGS =
      FlagSchema.builder("dcgmi stats")
          .option("g", "group")
          .flag("e", "enable")
          .flag("d", "disable")
          .option("j", "job")
          .flag("h", "help")
          .build();

  private static final FlagSchema DMON_FLAGS =
      FlagSchema.builder("dcgmi dmon")
          .option("e", "field-id")
          .option("d", "delay")
          .option("c", "count")
          .option("g", "group-id")
          .option("i", "gpu-id")
          .flag("l", "list")
          .flag("h", "help")
          .build();

  private static final FlagSchema GROUP_FLAGS =
      FlagSchema.builder("dcgmi group")
          .flag("l", "list")
          .option("c", "create")
          .option("d", "delete")
          .option("g", "group")
          .option("a", "add")
          .flag("h", "help")
          .build();

  private static final FlagSchema NVLINK_FLAGS =
      FlagSchema.builder("dcgmi nvlink")
          .flag("s", "link-status")
          .flag("e", "errors")
          .option("g", "gpuid")
          .flag("h", "help")
          .build();

  private static final int MAX_SAMPLES = 100;

  private final Map<Integer, GpuGroup> groups = new TreeMap<>();
  private final Set<Integer> recording = new HashSet<>();
  private int nextGroupId = 2;

  public DcgmiSimulator() {
    groups.put(GpuGroup.ALL_GPUS, new GpuGroup(GpuGroup.ALL_GPUS, "DCGM_ALL_SUPPORTED_GPUS",
        List.of()));
    groups.put(GpuGroup.ALL_NVSWITCHES, new GpuGroup(GpuGroup.ALL_NVSWITCHES,
        "DCGM_ALL_SUPPORTED_NVSWITCHES", List.of()));
  }

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    if (command.subcommand().isEmpty()) {
      ParsedCommand cmd = TOP_FLAGS.validate(command);
      if (cmd.hasFlag("v", "version")) {
        return version();
      }
      if (!cmd.hasFlag("h", "help") && !cmd.positionalArgs().isEmpty()) {
        throw new SimulatorException("dcgmi: '" + cmd.positionalArgs().get(0)
            + "' is not a valid subcommand. Run 'dcgmi --help' for usage.");
      }
      return CommandResult.success(usage());
    }
    String sub = command.subcommand().get();
    if (command.hasFlag("h", "help")) {
      return CommandResult.success(usage());
    }
    return switch (sub) {
      case "discovery" -> discovery(DISCOVERY_FLAGS.validate(command), context);
      case "health" -> health(HEALTH_FLAGS.validate(command), context);
      case "diag" -> diag(DIAG_FLAGS.validate(command), context);
      case "stats" -> stats(STATS_FLAGS.validate(command), context);
      case "dmon" -> dmon(DMON_FLAGS.validate(command), context);
      case "group" -> group(GROUP_FLAGS.validate(command), context);
      case "nvlink" -> nvlink(NVLINK_FLAGS.validate(command), context);
      default -> throw new SimulatorException(
          "dcgmi: '" + sub + "' is not a valid subcommand. Run 'dcgmi --help' for usage.");
    };
  }

  private CommandResult discovery(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    DgxNode node = requireNode(context, NO_HOST_ENGINE);
    StringBuilder sb = new StringBuilder();
    sb.append(node.gpus().size()).append(" GPU(s) found.\n");
    BoxTable table = new BoxTable(6, 69).rule().row("GPU ID", "Device Information").rule();
    for (Gpu gpu : node.gpus()) {
      table.row(String.valueOf(gpu.index()), "GPU " + gpu.index() + ": " + gpu.name());
      table.row("", "PCI Bus ID: " + busId(gpu));
      table.row("", "Device UUID: " + gpu.uuid());
      table.rule();
    }
    sb.append(table.render());
    sb.append("0 NvSwitch(es) found.\n");
    return CommandResult.success(sb.toString());
  }

  private CommandResult health(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    DgxNode node = requireNode(context, NO_HOST_ENGINE);
    GpuGroup group = resolveGroup(cmd.flagValue("g", "group"));
    List<Gpu> gpus = members(node, group);

    HealthStatus overall = HealthStatus.OK;
    StringBuilder detail = new StringBuilder();
    for (Gpu gpu : gpus) {
      List<HealthIncident> incidents = HealthIncident.of(gpu);
      HealthStatus status = HealthStatus.OK;
      for (HealthIncident incident : incidents) {
        status = HealthStatus.worst(status, incident.status());
      }
      overall = HealthStatus.worst(overall, status);
      detail.append("GPU ").append(gpu.index()).append(": ")
          .append(Ansi.status(HealthIncident.word(status), status)).append('\n');
      for (HealthIncident incident : incidents) {
        detail.append("    ").append(incident.system()).append(' ')
            .append(HealthIncident.word(incident.status()).toLowerCase(Locale.ROOT))
            .append(": ").append(incident.message()).append('\n');
      }
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Health monitoring report for group ").append(group.id())
        .append(" (").append(group.name()).append(")\n");
    sb.append("Overall Health: ")
        .append(Ansi.status(HealthIncident.word(overall), overall))
        .append("\n\n");
    sb.append(detail);
    return CommandResult.success(sb.toString());
  }

  private CommandResult diag(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    String mode = cmd.flagValue("r", "run").orElse("");
    int level =
        switch (mode.toLowerCase(Locale.ROOT)) {
          case "1", "short" -> 1;
          case "2", "medium" -> 2;
          case "3", "long" -> 3;
          default -> throw new SimulatorException(
              "Error: Invalid diagnostic level '" + mode + "': mode must be 1, 2 or 3.");
        };
    DgxNode node = requireNode(context, NO_HOST_ENGINE);
    GpuGroup group = resolveGroup(cmd.flagValue("g", "group"));
    LOG.debug("Running diag level {} on group {} of {}", level, group.id(), node.id());
    return CommandResult.success(DiagnosticSuite.run(level, group, members(node, group)));
  }

  private CommandResult stats(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    ClusterStore store = requireCluster(context, NO_HOST_ENGINE);
    GpuGroup group = resolveGroup(cmd.flagValue("g", "group"));
    if (cmd.hasFlag("e", "enable")) {
      recording.add(group.id());
      return CommandResult.success(
          "Successfully started process watches on group " + group.id() + ".");
    }
    if (cmd.hasFlag("d", "disable")) {
      recording.remove(group.id());
      return CommandResult.success(
          "Successfully stopped process watches on group " + group.id() + ".");
    }
    if (cmd.flagValue("j", "job").isPresent()) {
      String id = cmd.flagValue("j", "job").get();
      if (!recording.contains(group.id())) {
        throw new SimulatorException("Error: Job stats are not being recorded for group "
            + group.id() + ". Enable them with 'dcgmi stats -g " + group.id() + " -e'.");
      }
      int jobId = parseIndex(id, "Error: Invalid job id '" + id + "'.");
      SlurmJob job = store.job(jobId).orElseThrow(
          () -> new SimulatorException("Error: No data for job " + id + " was found."));
      return CommandResult.success(jobStats(store, job));
    }
    return CommandResult.success(
        "Usage: dcgmi stats -g <groupId> [-e | -d | -j <jobId>]\n\n"
            + "  -e  --enable   Start recording process statistics for the group.\n"
            + "  -d  --disable  Stop recording process statistics for the group.\n"
            + "  -j  --job      Display the statistics recorded for a job.\n");
  }

  private String jobStats(ClusterStore store, SlurmJob job) {
    BoxTable table = new BoxTable(30, 44).rule()
        .title("Summary for job " + job.jobId() + " (" + job.name() + ")").rule();
    table.row("Node", job.nodeId());
    table.row("Number of GPUs", String.valueOf(job.gpuCount()));
    Optional<DgxNode> node = store.findNode(job.nodeId());
    double energy = 0;
    int maxTemp = 0;
    int xids = 0;
    if (node.isPresent()) {
      List<Gpu> gpus = node.get().gpus();
      for (int i = 0; i < job.gpuCount() && i < gpus.size(); i++) {
        Gpu gpu = gpus.get(i);
        energy += gpu.powerDraw() * 3600;
        maxTemp = Math.max(maxTemp, gpu.temperature());
        xids += gpu.xidErrors().size();
      }
    }
    table.row("Energy Consumed (Joules)", String.format(Locale.ROOT, "%.0f", energy));
    table.row("Max GPU Temperature (C)", String.valueOf(maxTemp));
    table.row("XID Errors", String.valueOf(xids));
    table.rule();
    return "Successfully retrieved statistics for job: " + job.jobId() + ".\n" + table.render();
  }

  private CommandResult dmon(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("l", "list")) {
      StringBuilder sb = new StringBuilder("___________________________________________\n");
      sb.append(String.format("%-10s %-10s", "Short Name", "Field ID")).append('\n');
      for (DmonField field : DmonField.values()) {
        sb.append(String.format("%-10s %-10d", field.tag(), field.id())).append('\n');
      }
      return CommandResult.success(sb.toString());
    }
    DgxNode node = requireNode(context, NO_HOST_ENGINE);
    List<DmonField> fields = new ArrayList<>();
    for (String token : cmd.flagValue("e", "field-id").orElse(DmonField.DEFAULT_FIELDS)
        .split(",")) {
      String message = "Error: Invalid field id '" + token.trim() + "'.";
      int id = parseIndex(token, message);
      fields.add(DmonField.byId(id).orElseThrow(() -> new SimulatorException(message)));
    }
    String countValue = cmd.flagValue("c", "count").orElse("1");
    int count = parseIndex(countValue, "Error: Invalid sample count '" + countValue + "'.");
    String delay = cmd.flagValue("d", "delay").orElse("1000");
    parseIndex(delay, "Error: Invalid delay '" + delay + "'.");

    List<Gpu> gpus;
    if (cmd.flagValue("i", "gpu-id").isPresent()) {
      gpus = new ArrayList<>();
      for (String id : cmd.flagValue("i", "gpu-id").get().split(",")) {
        String message = "Error: Invalid GPU id '" + id.trim() + "'.";
        gpus.add(node.gpu(parseIndex(id, message))
            .orElseThrow(() -> new SimulatorException(message)));
      }
    } else {
      gpus = members(node, resolveGroup(cmd.flagValue("g", "group-id")));
    }

    StringBuilder sb = new StringBuilder("#Entity   ");
    fields.forEach(f -> sb.append(String.format("%-9s", f.tag())));
    sb.append("\nID        \n");
    for (int sample = 0; sample < Math.min(Math.max(count, 1), MAX_SAMPLES); sample++) {
      for (Gpu gpu : gpus) {
        sb.append(String.format("%-10s", "GPU " + gpu.index()));
        for (DmonField field : fields) {
          sb.append(String.format("%-9s", FaultRules.isOffBus(gpu) ? "N/A" : field.sample(gpu)));
        }
        sb.append('\n');
      }
    }
    return CommandResult.success(sb.toString());
  }

  private CommandResult group(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    DgxNode node = requireNode(context, NO_HOST_ENGINE);
    if (cmd.flagValue("c", "create").isPresent()) {
      String name = cmd.flagValue("c", "create").get();
      List<Integer> ids = gpuIds(node, cmd.flagValue("a", "add"));
      GpuGroup group = new GpuGroup(nextGroupId++, name, ids);
      groups.put(group.id(), group);
      LOG.debug("Created DCGM group {} '{}' with GPUs {}", group.id(), name, ids);
      String out = "Successfully created group \"" + name + "\" with a group ID of " + group.id();
      return CommandResult.success(
          ids.isEmpty() ? out : out + "\nAdd to group operation successful.");
    }
    if (cmd.flagValue("d", "delete").isPresent()) {
      GpuGroup group = resolveGroup(cmd.flagValue("d", "delete"));
      if (group.isDefault()) {
        throw new SimulatorException("Error: Cannot delete default group " + group.id() + ".");
      }
      groups.remove(group.id());
      return CommandResult.success("Successfully removed group " + group.id());
    }
    if (cmd.flagValue("a", "add").isPresent()) {
      GpuGroup group = resolveGroup(Optional.of(cmd.flagValue("g", "group").orElseThrow(
          () -> new SimulatorException("Missing required flag: -g"))));
      if (group.isDefault()) {
        throw new SimulatorException("Error: Cannot modify default group " + group.id() + ".");
      }
      List<Integer> ids = new ArrayList<>(group.gpuIds());
      for (Integer id : gpuIds(node, cmd.flagValue("a", "add"))) {
        if (!ids.contains(id)) {
          ids.add(id);
        }
      }
      groups.put(group.id(), group.withGpus(ids));
      return CommandResult.success("Add to group operation successful.");
    }
    if (cmd.hasFlag("l", "list")) {
      return CommandResult.success(listGroups(node));
    }
    return CommandResult.success(
        "Usage: dcgmi group [-l] [-c <name> [-a <gpuIds>]] [-d <groupId>] [-g <groupId> -a "
            + "<gpuIds>]\n");
  }

  private String listGroups(DgxNode node) {
    BoxTable table = new BoxTable(20, 54).rule().title("GROUPS")
        .title(groups.size() + " groups found.").rule();
    for (GpuGroup group : groups.values()) {
      table.row("Groups", "");
      table.row("-> " + group.id(), "");
      table.row("   -> Group ID", String.valueOf(group.id()));
      table.row("   -> Group Name", group.name());
      List<String> entities = new ArrayList<>();
      if (group.id() == GpuGroup.ALL_GPUS) {
        node.gpus().forEach(g -> entities.add("GPU " + g.index()));
      } else {
        group.gpuIds().forEach(id -> entities.add("GPU " + id));
      }
      table.row("   -> Entities", entities.isEmpty() ? "None" : String.join(", ", entities));
      table.rule();
    }
    return table.render();
  }

  private CommandResult nvlink(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    DgxNode node = requireNode(context, NO_HOST_ENGINE);
    if (cmd.hasFlag("e", "errors")) {
      String id = cmd.flagValue("g", "gpuid").orElseThrow(
          () -> new SimulatorException("Missing required flag: -g"));
      String message = "Error: Invalid GPU id '" + id + "'.";
      Gpu gpu = node.gpu(parseIndex(id, message))
          .orElseThrow(() -> new SimulatorException(message));
      BoxTable table = new BoxTable(22, 50).rule()
          .title("NVLINK Error Counts").title("GPU " + gpu.index()).rule();
      for (NvLinkConnection link : gpu.nvlinks()) {
        table.row("Link " + link.linkId(), String.format(
            "CRC FLIT Error: %d  Recovery Error: 0  Replay Error: %d",
            link.txErrors() + link.rxErrors(), link.replayErrors()));
      }
      return CommandResult.success(table.rule().render());
    }
    if (!cmd.hasFlag("s", "link-status")) {
      return CommandResult.success(
          "Usage: dcgmi nvlink [-s] [-e -g <gpuId>]\n");
    }
    StringBuilder sb = new StringBuilder("|----------------------|\n|  Link Status         |\n"
        + "|----------------------|\nGPUs:\n");
    for (Gpu gpu : node.gpus()) {
      sb.append("    gpuId ").append(gpu.index()).append(":\n        ");
      List<String> states = new ArrayList<>();
      for (NvLinkConnection link : gpu.nvlinks()) {
        states.add(link.status() == NvLinkStatus.ACTIVE ? "U"
            : link.status() == NvLinkStatus.DOWN ? "D" : "X");
      }
      sb.append(String.join(" ", states)).append('\n');
    }
    sb.append("\nKey: Up=U, Down=D, Disabled=X, Not Supported=_\n");
    return CommandResult.success(sb.toString());
  }

  private GpuGroup resolveGroup(Optional<String> value) throws SimulatorException {
    String raw = value.orElse(String.valueOf(GpuGroup.ALL_GPUS));
    int id = parseIndex(raw, "Error: Invalid group ID '" + raw + "'.");
    GpuGroup group = groups.get(id);
    if (group == null) {
      throw new SimulatorException("Error: Group " + id + " does not exist.");
    }
    return group;
  }

  private static List<Gpu> members(DgxNode node, GpuGroup group) {
    if (group.id() == GpuGroup.ALL_GPUS) {
      return node.gpus();
    }
    List<Gpu> gpus = new ArrayList<>();
    for (Integer id : group.gpuIds()) {
      node.gpu(id).ifPresent(gpus::add);
    }
    return gpus;
  }

  private static List<Integer> gpuIds(DgxNode node, Optional<String> spec)
      throws SimulatorException {
    List<Integer> ids = new ArrayList<>();
    if (spec.isEmpty()) {
      return ids;
    }
    for (String token : spec.get().split(",")) {
      String message = "Error: Invalid GPU id '" + token.trim() + "'.";
      int id = parseIndex(token, message);
      if (node.gpu(id).isEmpty()) {
        throw new SimulatorException(message);
      }
      ids.add(id);
    }
    return ids;
  }

  private static String busId(Gpu gpu) {
    return "0000" + gpu.pciAddress().toUpperCase(Locale.ROOT);
  }

  private static String usage() {
    return "dcgmi -- NVIDIA Data Center GPU Manager (DCGM) command line interface\n\n"
        + "Usage: dcgmi <subsystem> [options]\n\n"
        + "Subsystems:\n"
        + "  discovery   Discover GPUs on the system (dcgmi discovery -l)\n"
        + "  group       Manage GPU groups (dcgmi group -l | -c <name> | -d <id>)\n"
        + "  health      Check GPU health (dcgmi health -g <groupId> -c)\n"
        + "  diag        Run diagnostics (dcgmi diag -r <1|2|3> -g <groupId>)\n"
        + "  stats       Record and show job statistics (dcgmi stats -g <groupId> -e)\n"
        + "  dmon        Monitor GPU fields (dcgmi dmon -e <fieldIds> -c <count>)\n"
        + "  nvlink      Show NVLink status and error counters (dcgmi nvlink -s)\n\n"
        + "  --help      Show this help\n"
        + "  --version   Show the DCGM version\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "dcgmi",
        VERSION,
        "NVIDIA Data Center GPU Manager command line interface",
        List.of(
            new CommandInfo(
                "dcgmi",
                "Data Center GPU Manager",
                "dcgmi <subsystem> [options]",
                List.of("discovery", "health", "diag", "stats", "dmon", "group", "nvlink"),
                List.of(
                    "dcgmi discovery -l",
                    "dcgmi health -g 0 -c",
                    "dcgmi diag -r 3 -g 0",
                    "dcgmi dmon -e 150,155 -c 5"))));
  }
}
