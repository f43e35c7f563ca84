package io.podsim.tools.slurm;

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
import io.podsim.core.cluster.SlurmJob;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the Slurm client tools. Node states, jobs and GPU allocation live in the cluster store;
 * the reason text given to {@code scontrol update} is kept by this instance.
 */
public final class SlurmSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(SlurmSimulator.class);

  static final String VERSION = "23.02.6";
  private static final String UNREACHABLE =
      ": error: Unable to contact slurm controller (connect failure)";
  private static final Pattern GRES =
      Pattern.compile("gpu(?::([A-Za-z][A-Za-z0-9_]*))?(?::(\\d+))?");
  private static final Set<String> UPDATE_STATES =
      Set.of("idle", "resume", "undrain", "drain", "down");

  private static final FlagSchema SINFO_FLAGS =
      FlagSchema.builder("sinfo")
          .flag("N", "Node")
          .flag("l", "long")
          .option("o", "format")
          .option("p", "partition")
          .flag("R", "list-reasons")
          .flag("s", "summarize")
          .flag("h", "noheader")
          .flag("help")
          .unknownFlagMessage(
              "sinfo: unrecognized option '%s'\nTry \"sinfo --help\" for more information")
          .build();

  private static final FlagSchema SQUEUE_FLAGS =
      FlagSchema.builder("squeue")
          .option("u", "user")
          .option("j", "jobs")
          .option("p", "partition")
          .option("w", "nodelist")
          .option("o", "format")
          .flag("l", "long")
          .flag("h", "noheader")
          .flag("help")
          .unknownFlagMessage(
              "squeue: unrecognized option '%s'\nTry \"squeue --help\" for more information")
          .build();

  private static final FlagSchema SCONTROL_FLAGS =
      FlagSchema.builder("scontrol").flag("help").flag("V", "version").build();

  private static final FlagSchema SBATCH_FLAGS =
      FlagSchema.builder("sbatch")
          .option("gres")
          .option("G", "gpus")
          .option("N", "nodes")
          .option("n", "ntasks")
          .option("p", "partition")
          .option("w", "nodelist")
          .option("J", "job-name")
          .option("t", "time")
          .option("o", "output")
          .flag("exclusive")
          .flag("help")
          .unknownFlagMessage(
              "sbatch: unrecognized option '%s'\nTry \"sbatch --help\" for more information")
          .build();

  private static final FlagSchema SCANCEL_FLAGS =
      FlagSchema.builder("scancel").option("u", "user").option("n", "name").flag("help").build();

  private final Map<String, String> reasons = new HashMap<>();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    String tool = command.baseCommand();
    if (command.hasFlag("version", "V") && !"scontrol".equals(tool)) {
      return CommandResult.success("slurm " + VERSION);
    }
    LOG.debug("{} {}", tool, command.positionalArgs());
    return switch (tool) {
      case "sinfo" -> sinfo(SINFO_FLAGS.validate(command), context);
      case "squeue" -> squeue(SQUEUE_FLAGS.validate(command), context);
      case "scontrol" -> scontrol(SCONTROL_FLAGS.validate(command), context);
      case "sbatch" -> sbatch(SBATCH_FLAGS.validate(command), context);
      case "scancel" -> scancel(SCANCEL_FLAGS.validate(command), context);
      default -> throw new SimulatorException(tool + ": command not found", 127);
    };
  }

  private ClusterStore controller(String tool, CommandContext context) throws SimulatorException {
    return requireCluster(context, tool + UNREACHABLE);
  }

  // sinfo

  private CommandResult sinfo(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("help")) {
      return CommandResult.success(help("sinfo [OPTIONS]",
          "View information about Slurm nodes and partitions.",
          "-N, --Node              print one line per node",
          "-l, --long              long output, displays more information",
          "-o, --format=format     format specification (%n %N %P %t %T %G %c %m %a %l %D %R)",
          "-p, --partition=name    report on specific partition",
          "-R, --list-reasons      list reason nodes are down or drained",
          "-s, --summarize         report state summary only",
          "-h, --noheader          no headers on output"));
    }
    ClusterStore store = controller("sinfo", context);
    List<String> partitions = selectPartitions(store, cmd.flagValue("p", "partition"));
    boolean header = !cmd.hasFlag("h", "noheader");
    Optional<String> format = cmd.flagValue("o", "format");
    if (format.isPresent()) {
      return CommandResult.success(formatted(store, partitions, FormatString.parse(format.get()),
          header));
    }
    if (cmd.hasFlag("R", "list-reasons")) {
      return CommandResult.success(listReasons(store, header));
    }
    if (cmd.hasFlag("s", "summarize")) {
      return CommandResult.success(summary(store, partitions, header));
    }
    if (cmd.hasFlag("N", "Node")) {
      return CommandResult.success(nodeOriented(store, partitions, header));
    }
    return CommandResult.success(
        partitionView(store, partitions, header, cmd.hasFlag("l", "long")));
  }

  private static List<String> selectPartitions(ClusterStore store, Optional<String> filter) {
    if (filter.isEmpty()) {
      return store.partitions();
    }
    List<String> wanted = List.of(filter.get().split(","));
    return store.partitions().stream().filter(wanted::contains).toList();
  }

  private String partitionView(ClusterStore store, List<String> partitions, boolean header,
      boolean longFormat) {
    StringBuilder sb = new StringBuilder();
    if (longFormat) {
      if (header) {
        sb.append(String.format("%-9s %5s %10s %10s %4s %8s %10s %6s %11s %s\n", "PARTITION",
            "AVAIL", "TIMELIMIT", "JOB_SIZE", "ROOT", "OVERSUBS", "GROUPS", "NODES", "STATE",
            "NODELIST"));
      }
    } else if (header) {
      sb.append("PARTITION AVAIL  TIMELIMIT  NODES  STATE NODELIST\n");
    }
    for (String partition : partitions) {
      Map<String, List<String>> byState = new LinkedHashMap<>();
      for (DgxNode node : store.nodes()) {
        int used = store.gpusInUse(node.id());
        String state = longFormat ? longState(node.slurmState(), used)
            : compactState(node.slurmState(), used);
        byState.computeIfAbsent(state, k -> new ArrayList<>()).add(node.id());
      }
      String name = partitionLabel(store, partition);
      for (Map.Entry<String, List<String>> e : byState.entrySet()) {
        String nodes = Hostlist.compress(e.getValue());
        if (longFormat) {
          sb.append(String.format("%-9s %5s %10s %10s %4s %8s %10s %6d %11s %s\n", name, "up",
              "infinite", "1-infinite", "no", "NO", "all", e.getValue().size(), e.getKey(),
              nodes));
        } else {
          sb.append(String.format("%-9s %5s %10s %6d %6s %s\n", name, "up", "infinite",
              e.getValue().size(), e.getKey(), nodes));
        }
      }
    }
    return sb.toString();
  }

  private static String nodeOriented(ClusterStore store, List<String> partitions,
      boolean header) {
    StringBuilder sb = new StringBuilder();
    if (header) {
      sb.append("NODELIST   NODES PARTITION STATE\n");
    }
    for (DgxNode node : store.nodes()) {
      for (String partition : partitions) {
        sb.append(String.format("%-10s %5d %9s %s\n", node.id(), 1,
            partitionLabel(store, partition),
            compactState(node.slurmState(), store.gpusInUse(node.id()))));
      }
    }
    return sb.toString();
  }

  private static String summary(ClusterStore store, List<String> partitions, boolean header) {
    int allocated = 0;
    int idle = 0;
    int other = 0;
    for (DgxNode node : store.nodes()) {
      switch (node.slurmState()) {
        case "alloc", "mix" -> allocated++;
        case "idle" -> idle++;
        default -> other++;
      }
    }
    String counts = allocated + "/" + idle + "/" + other + "/" + store.nodes().size();
    String nodes = Hostlist.compress(store.nodes().stream().map(DgxNode::id).toList());
    StringBuilder sb = new StringBuilder();
    if (header) {
      sb.append("PARTITION AVAIL  TIMELIMIT   NODES(A/I/O/T) NODELIST\n");
    }
    for (String partition : partitions) {
      sb.append(String.format("%-9s %5s %10s %16s %s\n", partitionLabel(store, partition), "up",
          "infinite", counts, nodes));
    }
    return sb.toString();
  }

  private String listReasons(ClusterStore store, boolean header) {
    StringBuilder sb = new StringBuilder();
    if (header) {
      sb.append(String.format("%-20s %-9s %-19s %s\n", "REASON", "USER", "TIMESTAMP", "NODELIST"));
    }
    String stamp = ScontrolReport.TIMESTAMP.format(now(store));
    for (DgxNode node : store.nodes()) {
      reason(node).ifPresent(r ->
          sb.append(String.format("%-20s %-9s %-19s %s\n", r, "root", stamp, node.id())));
    }
    return sb.toString();
  }

  private String formatted(ClusterStore store, List<String> partitions, FormatString format,
      boolean header) throws SimulatorException {
    StringBuilder sb = new StringBuilder();
    if (header) {
      sb.append(format.render(SlurmSimulator::sinfoHeader)).append('\n');
    }
    for (String partition : partitions) {
      Map<String, List<DgxNode>> groups = new LinkedHashMap<>();
      for (DgxNode node : store.nodes()) {
        String key = format.render(f -> f == 'N' || f == 'D'
            ? ""
            : sinfoField(store, List.of(node), partition, f));
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(node);
      }
      for (List<DgxNode> group : groups.values()) {
        sb.append(format.render(f -> sinfoField(store, group, partition, f))).append('\n');
      }
    }
    return sb.toString();
  }

  private String sinfoField(ClusterStore store, List<DgxNode> nodes, String partition, char field)
      throws SimulatorException {
    DgxNode node = nodes.get(0);
    int used = store.gpusInUse(node.id());
    return switch (field) {
      case 'n' -> node.hostname();
      case 'N' -> Hostlist.compress(nodes.stream().map(DgxNode::id).toList());
      case 'P' -> partitionLabel(store, partition);
      case 't' -> compactState(node.slurmState(), used);
      case 'T' -> longState(node.slurmState(), used);
      case 'G' -> gres(node);
      case 'c' -> String.valueOf(node.cpuCount());
      case 'm' -> String.valueOf(memoryMb(node));
      case 'a' -> "up";
      case 'l' -> "infinite";
      case 'D' -> String.valueOf(nodes.size());
      case 'R' -> reason(node).orElse("none");
      default -> throw new SimulatorException("sinfo: error: Invalid node format specification: %"
          + field);
    };
  }

  private static String sinfoHeader(char field) throws SimulatorException {
    return switch (field) {
      case 'n' -> "HOSTNAMES";
      case 'N' -> "NODELIST";
      case 'P' -> "PARTITION";
      case 't', 'T' -> "STATE";
      case 'G' -> "GRES";
      case 'c' -> "CPUS";
      case 'm' -> "MEMORY";
      case 'a' -> "AVAIL";
      case 'l' -> "TIMELIMIT";
      case 'D' -> "NODES";
      case 'R' -> "REASON";
      default -> throw new SimulatorException("sinfo: error: Invalid node format specification: %"
          + field);
    };
  }

  // squeue

  private CommandResult squeue(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("help")) {
      return CommandResult.success(help("squeue [OPTIONS]",
          "View information about jobs in the Slurm scheduling queue.",
          "-u, --user=user_list    report jobs of these users",
          "-j, --jobs=job_list     report these job ids",
          "-p, --partition=list    report jobs in these partitions",
          "-w, --nodelist=node     report jobs on this node",
          "-o, --format=format     format specification (%i %P %j %u %t %T %M %D %N %b %C)",
          "-l, --long              long report",
          "-h, --noheader          no headers on output"));
    }
    ClusterStore store = controller("squeue", context);
    List<SlurmJob> jobs = new ArrayList<>(store.jobs());
    jobs.sort(Comparator.comparingInt(SlurmJob::jobId));
    Optional<String> ids = cmd.flagValue("j", "jobs");
    if (ids.isPresent()) {
      List<Integer> wanted = new ArrayList<>();
      for (String id : ids.get().split(",")) {
        int jobId = parseIndex(id, "slurm_load_jobs error: Invalid job id specified");
        if (store.job(jobId).isEmpty()) {
          throw new SimulatorException("slurm_load_jobs error: Invalid job id specified");
        }
        wanted.add(jobId);
      }
      jobs.removeIf(j -> !wanted.contains(j.jobId()));
    }
    Optional<String> user = cmd.flagValue("u", "user");
    user.ifPresent(u -> jobs.removeIf(j -> !List.of(u.split(",")).contains(j.user())));
    Optional<String> partition = cmd.flagValue("p", "partition");
    partition.ifPresent(p -> jobs.removeIf(j -> !List.of(p.split(",")).contains(j.partition())));
    Optional<String> nodelist = cmd.flagValue("w", "nodelist");
    if (nodelist.isPresent()) {
      List<String> wanted = new ArrayList<>();
      for (String name : nodelist.get().split(",")) {
        wanted.add(store.findNode(name).map(DgxNode::id).orElse(name));
      }
      jobs.removeIf(j -> !wanted.contains(j.nodeId()));
    }

    boolean header = !cmd.hasFlag("h", "noheader");
    Instant now = now(store);
    StringBuilder sb = new StringBuilder();
    Optional<String> format = cmd.flagValue("o", "format");
    if (format.isPresent()) {
      FormatString fmt = FormatString.parse(format.get());
      if (header) {
        sb.append(fmt.render(SlurmSimulator::squeueHeader)).append('\n');
      }
      for (SlurmJob job : jobs) {
        sb.append(fmt.render(f -> squeueField(job, now, f))).append('\n');
      }
      return CommandResult.success(sb.toString());
    }
    boolean longFormat = cmd.hasFlag("l", "long");
    if (longFormat && header) {
      sb.append(String.format("%18s %9s %8s %8s %8s %10s %9s %6s %s\n", "JOBID", "PARTITION",
          "NAME", "USER", "STATE", "TIME", "TIME_LIMI", "NODES", "NODELIST(REASON)"));
    } else if (header) {
      sb.append(String.format("%18s %9s %8s %8s %2s %10s %6s %s\n", "JOBID", "PARTITION", "NAME",
          "USER", "ST", "TIME", "NODES", "NODELIST(REASON)"));
    }
    for (SlurmJob job : jobs) {
      if (longFormat) {
        sb.append(String.format("%18d %9s %8s %8s %8s %10s %9s %6d %s\n", job.jobId(),
            job.partition(), truncate(job.name()), truncate(job.user()), job.state(),
            elapsed(job, now, false), "UNLIMITED", 1, job.nodeId()));
      } else {
        sb.append(String.format("%18d %9s %8s %8s %2s %10s %6d %s\n", job.jobId(),
            job.partition(), truncate(job.name()), truncate(job.user()),
            compactJobState(job.state()), elapsed(job, now, false), 1, job.nodeId()));
      }
    }
    return CommandResult.success(sb.toString());
  }

  private static String squeueField(SlurmJob job, Instant now, char field)
      throws SimulatorException {
    return switch (field) {
      case 'i' -> String.valueOf(job.jobId());
      case 'P' -> job.partition();
      case 'j' -> job.name();
      case 'u' -> job.user();
      case 't' -> compactJobState(job.state());
      case 'T' -> job.state();
      case 'M' -> elapsed(job, now, false);
      case 'D' -> "1";
      case 'N' -> job.nodeId();
      case 'b' -> "gres/gpu:" + job.gpuCount();
      case 'C' -> String.valueOf(job.gpuCount() * 14);
      default -> throw new SimulatorException("squeue: error: Invalid job format specification: %"
          + field);
    };
  }

  private static String squeueHeader(char field) throws SimulatorException {
    return switch (field) {
      case 'i' -> "JOBID";
      case 'P' -> "PARTITION";
      case 'j' -> "NAME";
      case 'u' -> "USER";
      case 't' -> "ST";
      case 'T' -> "STATE";
      case 'M' -> "TIME";
      case 'D' -> "NODES";
      case 'N' -> "NODELIST";
      case 'b' -> "TRES_PER_NODE";
      case 'C' -> "CPUS";
      default -> throw new SimulatorException("squeue: error: Invalid job format specification: %"
          + field);
    };
  }

  // scontrol

  private CommandResult scontrol(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("V", "version")) {
      return CommandResult.success("slurm " + VERSION);
    }
    if (cmd.hasFlag("help") || cmd.subcommand().isEmpty()) {
      CommandResult help = CommandResult.success(help("scontrol [OPTIONS] [COMMAND]",
          "View or modify Slurm configuration and state.",
          "show node [name]        display node state",
          "show partition [name]   display partition configuration",
          "show job [id]           display job state",
          "show config             display controller configuration",
          "update nodename=<node> state=<idle|drain|down|resume> [reason=<text>]",
          "ping                    report the controller status",
          "reconfigure             re-read the configuration files"));
      if (cmd.hasFlag("help") || cmd.positionalArgs().isEmpty()) {
        return help;
      }
      throw new SimulatorException("invalid keyword: " + cmd.positionalArgs().get(0));
    }
    ClusterStore store = controller("scontrol", context);
    String sub = cmd.subcommand().get();
    return switch (sub) {
      case "show" -> show(store, cmd);
      case "update" -> update(store, cmd);
      case "ping" -> CommandResult.success(
          "Slurmctld(primary) at " + store.controlMachine() + " is UP");
      case "reconfigure" -> CommandResult.success("");
      default -> throw new SimulatorException("invalid keyword: " + sub);
    };
  }

  private CommandResult show(ClusterStore store, ParsedCommand cmd) throws SimulatorException {
    String entity = cmd.positional(0).orElseThrow(
        () -> new SimulatorException("scontrol: error: show requires an entity"))
        .toLowerCase(Locale.ROOT);
    Optional<String> name = cmd.positional(1);
    switch (entity) {
      case "node", "nodes" -> {
        if (name.isPresent()) {
          DgxNode node = store.findNode(name.get())
              .orElseThrow(() -> new SimulatorException("Node " + name.get() + " not found"));
          return CommandResult.success(ScontrolReport.node(store, node, reason(node)));
        }
        List<String> blocks = new ArrayList<>();
        for (DgxNode node : store.nodes()) {
          blocks.add(ScontrolReport.node(store, node, reason(node)));
        }
        return CommandResult.success(String.join("\n", blocks));
      }
      case "partition", "partitions" -> {
        if (name.isPresent()) {
          if (!store.partitions().contains(name.get())) {
            throw new SimulatorException("Partition " + name.get() + " not found");
          }
          return CommandResult.success(ScontrolReport.partition(store, name.get()));
        }
        List<String> blocks = new ArrayList<>();
        for (String partition : store.partitions()) {
          blocks.add(ScontrolReport.partition(store, partition));
        }
        return CommandResult.success(String.join("\n", blocks));
      }
      case "job", "jobs" -> {
        Instant now = now(store);
        if (name.isPresent()) {
          int id = parseIndex(name.get(), "slurm_load_jobs error: Invalid job id specified");
          SlurmJob job = store.job(id).orElseThrow(
              () -> new SimulatorException("slurm_load_jobs error: Invalid job id specified"));
          return CommandResult.success(ScontrolReport.job(store, job, now));
        }
        if (store.jobs().isEmpty()) {
          return CommandResult.success("No jobs in the system");
        }
        List<String> blocks = new ArrayList<>();
        for (SlurmJob job : store.jobs()) {
          blocks.add(ScontrolReport.job(store, job, now));
        }
        return CommandResult.success(String.join("\n", blocks));
      }
      case "config" -> {
        return CommandResult.success(ScontrolReport.config(store, now(store)));
      }
      default -> throw new SimulatorException("invalid entity: " + entity + " for keyword: show");
    }
  }

  private CommandResult update(ClusterStore store, ParsedCommand cmd) throws SimulatorException {
    Map<String, String> settings = new LinkedHashMap<>();
    for (String arg : cmd.positionalArgs()) {
      int eq = arg.indexOf('=');
      if (eq <= 0) {
        throw new SimulatorException("Invalid input: " + arg + "\nRequest aborted");
      }
      settings.put(arg.substring(0, eq).toLowerCase(Locale.ROOT), arg.substring(eq + 1));
    }
    String nodeName = settings.get("nodename");
    if (nodeName == null) {
      throw new SimulatorException("No valid entity in update command\nRequest aborted");
    }
    DgxNode node = store.findNode(nodeName).orElseThrow(
        () -> new SimulatorException("slurm_update error: Invalid node name specified"));
    String state = settings.getOrDefault("state", "").toLowerCase(Locale.ROOT);
    if (!UPDATE_STATES.contains(state)) {
      throw new SimulatorException("Invalid input: state=" + settings.getOrDefault("state", "")
          + "\nRequest aborted\nValid states: IDLE DRAIN DOWN RESUME UNDRAIN");
    }
    String reason = settings.get("reason");
    if (("drain".equals(state) || "down".equals(state)) && (reason == null || reason.isBlank())) {
      throw new SimulatorException(
          "You must specify a reason when DOWNING or DRAINING a node. Request denied");
    }
    String target = switch (state) {
      case "drain", "down" -> state;
      default -> allocationState(store, node);
    };
    store.setSlurmState(node.id(), target);
    if (reason != null && ("drain".equals(target) || "down".equals(target))) {
      reasons.put(node.id(), reason);
    } else {
      reasons.remove(node.id());
    }
    LOG.debug("Node {} updated to {}", node.id(), target);
    return CommandResult.success("");
  }

  private static String allocationState(ClusterStore store, DgxNode node) {
    int used = store.gpusInUse(node.id());
    if (used == 0) {
      return "idle";
    }
    return used >= node.gpus().size() ? "alloc" : "mix";
  }

  // sbatch

  private CommandResult sbatch(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("help")) {
      return CommandResult.success(help("sbatch [OPTIONS] script",
          "Submit a batch script to Slurm.",
          "    --gres=gpu[:type]:N  generic resources required per node, e.g. --gres=gpu:h100:8",
          "-G, --gpus=N            number of gpus required by the job",
          "-N, --nodes=N           number of nodes (1)",
          "-n, --ntasks=N          number of tasks",
          "-p, --partition=name    partition requested",
          "-w, --nodelist=node     request a specific node",
          "-J, --job-name=name     name of the job",
          "-t, --time=minutes      time limit",
          "-o, --output=file       file for batch script's standard output",
          "    --exclusive         allocate nodes in exclusive mode"));
    }
    ClusterStore store = controller("sbatch", context);
    String script = cmd.positional(0)
        .orElseThrow(() -> new SimulatorException("sbatch: error: Batch script is empty!"));
    String partition = cmd.flagValue("p", "partition").orElse(store.partitions().get(0));
    if (!store.partitions().contains(partition)) {
      throw new SimulatorException("sbatch: error: invalid partition specified: " + partition);
    }
    Optional<String> nodes = cmd.flagValue("N", "nodes");
    if (nodes.isPresent() && !"1".equals(nodes.get())) {
      throw new SimulatorException("sbatch: error: Batch job submission failed: "
          + "Node count specification invalid");
    }

    Optional<String> type = Optional.empty();
    int gpus = 0;
    Optional<String> gres = cmd.flagValue("gres");
    if (gres.isPresent()) {
      Matcher m = GRES.matcher(gres.get());
      if (!m.matches()) {
        throw new SimulatorException(
            "sbatch: error: Invalid generic resource (gres) specification");
      }
      type = Optional.ofNullable(m.group(1));
      gpus = m.group(2) == null ? 1 : Integer.parseInt(m.group(2));
    }
    Optional<String> gpuOption = cmd.flagValue("G", "gpus");
    if (gpuOption.isPresent()) {
      String value = gpuOption.get();
      int colon = value.lastIndexOf(':');
      if (colon > 0) {
        type = Optional.of(value.substring(0, colon));
        value = value.substring(colon + 1);
      }
      gpus = parseIndex(value, "sbatch: error: Invalid --gpus specification");
    }
    if (cmd.hasFlag("exclusive") && gpus == 0) {
      gpus = -1;
    }

    List<DgxNode> candidates = new ArrayList<>();
    Optional<String> nodelist = cmd.flagValue("w", "nodelist");
    if (nodelist.isPresent()) {
      candidates.add(store.findNode(nodelist.get()).orElseThrow(() -> new SimulatorException(
          "sbatch: error: Batch job submission failed: Invalid node name specified")));
    } else {
      candidates.addAll(store.nodes());
    }
    Optional<String> wantedType = type;
    candidates.removeIf(n -> wantedType.isPresent() && !n.gresType().equals(wantedType.get()));
    if (candidates.isEmpty()) {
      throw new SimulatorException("sbatch: error: Invalid generic resource (gres) specification");
    }

    String name = cmd.flagValue("J", "job-name").orElse(baseName(script));
    for (DgxNode node : candidates) {
      int count = gpus < 0 ? node.gpus().size() : gpus;
      Optional<SlurmJob> job = store.allocateGpusForJob(node.id(), name, "root", partition, count);
      if (job.isPresent()) {
        LOG.debug("Submitted job {} on {}", job.get().jobId(), node.id());
        return CommandResult.success("Submitted batch job " + job.get().jobId());
      }
    }
    throw new SimulatorException("sbatch: error: Batch job submission failed: "
        + "Requested node configuration is not available");
  }

  // scancel

  private CommandResult scancel(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("help")) {
      return CommandResult.success(help("scancel [OPTIONS] [job_id...]",
          "Signal or cancel jobs.",
          "-u, --user=user_name    cancel all jobs of this user",
          "-n, --name=job_name     cancel jobs with this name"));
    }
    ClusterStore store = controller("scancel", context);
    List<Integer> ids = new ArrayList<>();
    for (String arg : cmd.positionalArgs()) {
      ids.add(parseIndex(arg, "scancel: error: Invalid job id " + arg));
    }
    Optional<String> user = cmd.flagValue("u", "user");
    Optional<String> name = cmd.flagValue("n", "name");
    if (ids.isEmpty() && user.isEmpty() && name.isEmpty()) {
      throw new SimulatorException("scancel: error: No job identification provided");
    }
    if (ids.isEmpty()) {
      for (SlurmJob job : store.jobs()) {
        boolean byUser = user.map(u -> u.equals(job.user())).orElse(false);
        boolean byName = name.map(n -> n.equals(job.name())).orElse(false);
        if (byUser || byName) {
          ids.add(job.jobId());
        }
      }
    }
    for (int id : ids) {
      if (store.deallocateGpusForJob(id).isEmpty()) {
        throw new SimulatorException(
            "scancel: error: Kill job error on job id " + id + ": Invalid job id specified");
      }
      LOG.debug("Cancelled job {}", id);
    }
    return CommandResult.success("");
  }

  // shared

  private Optional<String> reason(DgxNode node) {
    return switch (node.slurmState()) {
      case "drain", "down" -> Optional.of(reasons.getOrDefault(node.id(),
          "down".equals(node.slurmState()) ? "Not responding" : "Admin drain"));
      default -> Optional.empty();
    };
  }

  static String gres(DgxNode node) {
    return "gpu:" + node.gresType() + ":" + node.gpus().size();
  }

  static long memoryMb(DgxNode node) {
    return node.ramTotalGb() * 1024L;
  }

  static Instant now(ClusterStore store) {
    return store.bootTime().plus(Duration.ofHours(2));
  }

  /** Run time of a job: {@code M:SS} or {@code H:MM:SS} for squeue, {@code HH:MM:SS} otherwise. */
  static String elapsed(SlurmJob job, Instant now, boolean padded) {
    long seconds = Math.max(0, Duration.between(job.submitTime(), now).getSeconds());
    long days = seconds / 86400;
    long hours = seconds % 86400 / 3600;
    long minutes = seconds % 3600 / 60;
    long secs = seconds % 60;
    String time;
    if (padded || hours > 0) {
      time = String.format(padded ? "%02d:%02d:%02d" : "%d:%02d:%02d", hours, minutes, secs);
    } else {
      time = String.format("%d:%02d", minutes, secs);
    }
    return days > 0 ? days + "-" + time : time;
  }

  private static String partitionLabel(ClusterStore store, String partition) {
    return store.partitions().indexOf(partition) == 0 ? partition + "*" : partition;
  }

  static String compactState(String state, int used) {
    if ("drain".equals(state)) {
      return used > 0 ? "drng" : "drain";
    }
    return state;
  }

  static String longState(String state, int used) {
    return switch (state) {
      case "alloc" -> "allocated";
      case "mix" -> "mixed";
      case "drain" -> used > 0 ? "draining" : "drained";
      default -> state;
    };
  }

  private static String compactJobState(String state) {
    return switch (state) {
      case "RUNNING" -> "R";
      case "PENDING" -> "PD";
      case "COMPLETING" -> "CG";
      default -> state.substring(0, Math.min(2, state.length()));
    };
  }

  private static String truncate(String value) {
    return value.length() > 8 ? value.substring(0, 8) : value;
  }

  private static String baseName(String script) {
    int slash = script.lastIndexOf('/');
    return slash < 0 ? script : script.substring(slash + 1);
  }

  private static String help(String usage, String description, String... options) {
    StringBuilder sb = new StringBuilder();
    sb.append("Usage: ").append(usage).append("\n\nDescription:\n  ").append(description)
        .append("\n\nOptions:\n");
    for (String option : options) {
      sb.append("  ").append(option).append('\n');
    }
    sb.append("      --help              show this help message\n");
    return sb.toString();
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "slurm",
        VERSION,
        "Slurm workload manager client tools",
        List.of(
            new CommandInfo("sinfo", "View nodes and partitions", "sinfo [-N] [-o format]",
                List.of(), List.of("sinfo", "sinfo -N", "sinfo -o \"%n %G\"")),
            new CommandInfo("squeue", "View the job queue", "squeue [-u user] [-j id]",
                List.of(), List.of("squeue", "squeue -u root")),
            new CommandInfo("scontrol", "View or modify Slurm state",
                "scontrol show|update|ping ...",
                List.of("show", "update", "reconfigure", "ping"),
                List.of("scontrol show node dgx-00", "scontrol show config",
                    "scontrol update nodename=dgx-00 state=drain reason=maintenance")),
            new CommandInfo("sbatch", "Submit a batch job",
                "sbatch [--gres=gpu[:type]:N] [-w node] script",
                List.of(), List.of("sbatch --gres=gpu:h100:8 train.sh")),
            new CommandInfo("scancel", "Cancel jobs", "scancel <jobid>",
                List.of(), List.of("scancel 1000"))));
  }
}
