package io.podsim.tools.nvsmi;

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
import io.podsim.core.cluster.NvLinkConnection;
import io.podsim.core.cluster.NvLinkStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates {@code nvidia-smi}: the summary table, {@code -L}, {@code -q [-d]}, CSV queries,
 * persistence mode and power limits, plus the {@code topo}, {@code nvlink} and {@code mig}
 * subcommands.
 */
public final class NvidiaSmiSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(NvidiaSmiSimulator.class);

  static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US).withZone(ZoneOffset.UTC);

  static final String DRIVER_ERROR =
      "NVIDIA-SMI has failed because it couldn't communicate with the NVIDIA driver. "
          + "Make sure that the latest NVIDIA driver is installed and running.";

  private static final FlagSchema FLAGS =
      FlagSchema.builder("nvidia-smi")
          .flag("L", "list-gpus")
          .flag("q", "query")
          .option("i", "id")
          .option("d", "display")
          .option("pm", "persistence-mode")
          .option("pl", "power-limit")
          .option("query-gpu")
          .option("format")
          .flag("h", "help")
          .flag("version")
          .unknownFlagMessage(
              "Invalid combination of input arguments: unrecognized option '%s'.\n"
                  + "Please run 'nvidia-smi -h' for help.")
          .build();

  private static final FlagSchema TOPO_FLAGS =
      FlagSchema.builder("nvidia-smi topo").flag("m", "matrix").flag("h", "help").build();

  private static final FlagSchema NVLINK_FLAGS =
      FlagSchema.builder("nvidia-smi nvlink")
          .flag("s", "status")
          .flag("e", "error-counters")
          .option("i", "id")
          .flag("h", "help")
          .build();

  private static final FlagSchema MIG_FLAGS =
      FlagSchema.builder("nvidia-smi mig")
          .flag("lgi", "list-gpu-instances")
          .flag("lgip", "list-gpu-instance-profiles")
          .option("i", "id")
          .flag("h", "help")
          .build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    if (command.subcommand().isPresent()) {
      return switch (command.subcommand().get()) {
        case "topo" -> topo(TOPO_FLAGS.validate(command), context);
        case "nvlink" -> nvlink(NVLINK_FLAGS.validate(command), context);
        default -> mig(MIG_FLAGS.validate(command), context);
      };
    }
    ParsedCommand cmd = FLAGS.validate(command);
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(help());
    }
    if (cmd.hasFlag("version")) {
      DgxNode node = requireNode(context, DRIVER_ERROR);
      return CommandResult.success(String.format(
          "NVIDIA-SMI version  : %s\nNVML version        : %s\nDRIVER version      : %s\n"
              + "CUDA Version        : %s",
          node.driverVersion(), node.driverVersion().substring(0, 7), node.driverVersion(),
          node.cudaVersion()));
    }

    DgxNode node = requireNode(context, DRIVER_ERROR);
    List<Gpu> gpus = selectGpus(node, cmd);
    Instant now = snapshotTime(context);

    if (cmd.flagValue("pm", "persistence-mode").isPresent()) {
      return persistenceMode(cmd.flagValue("pm", "persistence-mode").get(), node, gpus, context);
    }
    if (cmd.flagValue("pl", "power-limit").isPresent()) {
      return powerLimit(cmd.flagValue("pl", "power-limit").get(), node, gpus, context);
    }
    if (cmd.flagValue("query-gpu").isPresent()) {
      return queryGpu(cmd, node, gpus);
    }
    if (cmd.hasFlag("L", "list-gpus")) {
      StringBuilder sb = new StringBuilder();
      for (Gpu gpu : gpus) {
        sb.append(String.format("GPU %d: %s (UUID: %s)\n", gpu.index(), gpu.name(), gpu.uuid()));
      }
      return CommandResult.success(sb.toString());
    }
    if (cmd.hasFlag("q", "query")) {
      return CommandResult.success(SmiQueryReport.render(node, gpus, sections(cmd), now));
    }
    if (cmd.hasFlag("d", "display")) {
      throw new SimulatorException("Option -d requires -q. Please run 'nvidia-smi -h' for help.");
    }
    return CommandResult.success(SmiSummary.render(node, gpus, now));
  }

  private List<Gpu> selectGpus(DgxNode node, ParsedCommand cmd) throws SimulatorException {
    if (!cmd.hasFlag("i", "id")) {
      return node.gpus();
    }
    String spec = cmd.flagValue("i", "id").orElse("");
    Set<Gpu> selected = new LinkedHashSet<>();
    for (String id : spec.split(",", -1)) {
      selected.add(findGpu(node, id.trim()));
    }
    return new ArrayList<>(selected);
  }

  /** Resolves a GPU by index, UUID or PCI bus id, as accepted by {@code -i}. */
  static Gpu findGpu(DgxNode node, String id) throws SimulatorException {
    for (Gpu gpu : node.gpus()) {
      if (gpu.uuid().equalsIgnoreCase(id)
          || gpu.pciAddress().equalsIgnoreCase(id)
          || busId(gpu).equalsIgnoreCase(id)) {
        return gpu;
      }
    }
    String message = "Invalid GPU index or identifier: '" + id + "'. No devices were found.";
    int index = parseIndex(id, message);
    return node.gpu(index).orElseThrow(() -> new SimulatorException(message, 6));
  }

  private Set<SmiQueryReport.Section> sections(ParsedCommand cmd) throws SimulatorException {
    Set<SmiQueryReport.Section> sections = EnumSet.noneOf(SmiQueryReport.Section.class);
    if (!cmd.hasFlag("d", "display")) {
      return sections;
    }
    String value = cmd.flagValue("d", "display").orElse("");
    for (String name : value.split(",")) {
      try {
        sections.add(SmiQueryReport.Section.valueOf(name.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new SimulatorException(
            "Invalid display type: '" + name.trim() + "'. Valid types are: "
                + "MEMORY, UTILIZATION, ECC, TEMPERATURE, POWER, CLOCK, PERFORMANCE");
      }
    }
    return sections;
  }

  private CommandResult queryGpu(ParsedCommand cmd, DgxNode node, List<Gpu> gpus)
      throws SimulatorException {
    String format = cmd.flagValue("format").orElseThrow(
        () -> new SimulatorException("Option --format= must be given with --query-gpu."));
    List<String> options = List.of(format.split(","));
    if (!options.contains("csv")) {
      throw new SimulatorException("Invalid format: '" + format + "'. Only csv is supported.");
    }
    boolean header = !options.contains("noheader");
    boolean units = !options.contains("nounits");

    List<QueryField> fields = new ArrayList<>();
    for (String name : cmd.flagValue("query-gpu").orElse("").split(",")) {
      fields.add(QueryField.find(name).orElseThrow(() -> new SimulatorException(
          "Field \"" + name.trim() + "\" is not a valid field to query.\n\n"
              + "Please run 'nvidia-smi --help-query-gpu' for the list of fields.")));
    }

    StringBuilder sb = new StringBuilder();
    if (header) {
      List<String> names = new ArrayList<>();
      fields.forEach(f -> names.add(f.header(units)));
      sb.append(String.join(", ", names)).append('\n');
    }
    for (Gpu gpu : gpus) {
      List<String> values = new ArrayList<>();
      for (QueryField field : fields) {
        values.add(FaultRules.isOffBus(gpu) ? "[Unknown Error]" : field.value(node, gpu, units));
      }
      sb.append(String.join(", ", values)).append('\n');
    }
    return CommandResult.success(sb.toString());
  }

  private CommandResult persistenceMode(
      String value, DgxNode node, List<Gpu> gpus, CommandContext context)
      throws SimulatorException {
    boolean enable =
        switch (value.toUpperCase(Locale.ROOT)) {
          case "1", "ENABLED" -> true;
          case "0", "DISABLED" -> false;
          default -> throw new SimulatorException(
              "Invalid persistence mode value: '" + value + "'. Use 0/DISABLED or 1/ENABLED.");
        };
    ClusterStore store = requireCluster(context, DRIVER_ERROR);
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      store.updateGpu(node.id(), gpu.index(), b -> b.persistenceMode(enable));
      sb.append(enable ? "Enabled" : "Disabled")
          .append(" persistence mode for GPU ")
          .append(busId(gpu))
          .append(".\n");
    }
    LOG.debug("Persistence mode {} on {} GPUs of {}", enable, gpus.size(), node.id());
    return CommandResult.success(sb.append("All done.").toString());
  }

  private CommandResult powerLimit(
      String value, DgxNode node, List<Gpu> gpus, CommandContext context)
      throws SimulatorException {
    double watts = parseWatts(value);
    ClusterStore store = requireCluster(context, DRIVER_ERROR);
    for (Gpu gpu : gpus) {
      if (watts < minPowerLimit(gpu) || watts > maxPowerLimit(gpu)) {
        throw new SimulatorException(String.format(Locale.ROOT,
            "Provided power limit %.2f W is not a valid power limit which should be between "
                + "%.2f W and %.2f W for GPU %s\nTerminating early due to previous errors.",
            watts, minPowerLimit(gpu), maxPowerLimit(gpu), busId(gpu)));
      }
    }
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      store.updateGpu(node.id(), gpu.index(), b -> b.powerLimit(watts));
      sb.append(String.format(Locale.ROOT,
          "Power limit for GPU %s was set to %.2f W from %.2f W.\n",
          busId(gpu), watts, gpu.powerLimit()));
    }
    LOG.debug("Power limit {} W on {} GPUs of {}", watts, gpus.size(), node.id());
    return CommandResult.success(sb.append("All done.").toString());
  }

  private static double parseWatts(String value) throws SimulatorException {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new SimulatorException("Invalid power limit value: '" + value + "'.");
    }
  }

  private CommandResult topo(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (!cmd.hasFlag("m", "matrix")) {
      return CommandResult.success(
          "Usage: nvidia-smi topo [options]\n\n"
              + "    -m,   --matrix     Display the GPUDirect communication matrix "
              + "for the system.\n");
    }
    DgxNode node = requireNode(context, DRIVER_ERROR);
    return CommandResult.success(TopologyMatrix.render(node));
  }

  private CommandResult nvlink(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    boolean status = cmd.hasFlag("s", "status");
    boolean errors = cmd.hasFlag("e", "error-counters");
    if (!status && !errors) {
      return CommandResult.success(
          "Usage: nvidia-smi nvlink [options]\n\n"
              + "    -s,   --status          Display link state (active/inactive).\n"
              + "    -e,   --error-counters  Display error counters.\n"
              + "    -i,   --id              Target a specific GPU.\n");
    }
    DgxNode node = requireNode(context, DRIVER_ERROR);
    List<Gpu> gpus = selectGpus(node, cmd);
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      sb.append(String.format("GPU %d: %s (UUID: %s)\n", gpu.index(), gpu.name(), gpu.uuid()));
      if (FaultRules.isOffBus(gpu)) {
        sb.append("\t NVML: Unable to retrieve NVLink information as all links are inActive\n");
        continue;
      }
      for (NvLinkConnection link : gpu.nvlinks()) {
        if (status) {
          sb.append(String.format("\t Link %d: %s\n", link.linkId(), linkState(link)));
        }
        if (errors) {
          sb.append(String.format("\t Link %d: Replay Errors: %d\n", link.linkId(),
              link.replayErrors()));
          sb.append(String.format("\t Link %d: Recovery Errors: 0\n", link.linkId()));
          sb.append(String.format("\t Link %d: CRC Errors: %d\n", link.linkId(),
              link.txErrors() + link.rxErrors()));
        }
      }
    }
    return CommandResult.success(sb.toString());
  }

  private static String linkState(NvLinkConnection link) {
    if (link.status() == NvLinkStatus.ACTIVE) {
      return link.speedGbps() + " GB/s";
    }
    return link.status() == NvLinkStatus.DOWN ? "<down>" : "<inactive>";
  }

  private CommandResult mig(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    DgxNode node = requireNode(context, DRIVER_ERROR);
    List<Gpu> enabled = new ArrayList<>();
    for (Gpu gpu : selectGpus(node, cmd)) {
      if (gpu.migMode()) {
        enabled.add(gpu);
      }
    }
    if (!cmd.hasFlag("lgi", "lgip")) {
      return CommandResult.success(
          "Usage: nvidia-smi mig [options]\n\n"
              + "    -lgi,  --list-gpu-instances          List GPU instances.\n"
              + "    -lgip, --list-gpu-instance-profiles  List supported GPU instance profiles.\n");
    }
    if (enabled.isEmpty()) {
      return CommandResult.error("No MIG-enabled devices found.", 6);
    }
    if (cmd.hasFlag("lgi")) {
      return CommandResult.error("No GPU instances found: Not Found", 6);
    }
    StringBuilder sb = new StringBuilder();
    sb.append("|-----------------------------------------------------------------------------|\n");
    sb.append("| GPU instance profiles:                                                      |\n");
    sb.append("| GPU   Name             ID    Instances   Memory     P2P    SM    DEC   ENC  |\n");
    sb.append("|                              Free/Total   GiB              CE    JPEG  OFA  |\n");
    sb.append("|=============================================================================|\n");
    String[][] profiles = {
      {"MIG 1g.10gb", "19", "7/7", "9.75"},
      {"MIG 2g.20gb", "14", "3/3", "19.62"},
      {"MIG 3g.40gb", "9", "2/2", "39.50"},
      {"MIG 4g.40gb", "5", "1/1", "39.50"},
      {"MIG 7g.80gb", "0", "1/1", "79.25"}
    };
    for (Gpu gpu : enabled) {
      for (String[] p : profiles) {
        sb.append(String.format("|   %-3d %-16s %-5s %-11s %-10s %-6s %-5s %-5s %-4s |\n",
            gpu.index(), p[0], p[1], p[2], p[3], "No", "-", "-", "-"));
      }
    }
    return CommandResult.success(sb.toString());
  }

  /** Clock shown in report headers: two hours after the cluster booted. */
  private static Instant snapshotTime(CommandContext context) {
    Instant boot =
        context.getCluster().map(ClusterStore::bootTime).orElse(Instant.EPOCH);
    return boot.plus(Duration.ofHours(2));
  }

  static String busId(Gpu gpu) {
    return "0000" + gpu.pciAddress().toUpperCase(Locale.ROOT);
  }

  static String offBusMessage(Gpu gpu) {
    return "Unable to determine the device handle for GPU"
        + gpu.pciAddress().toUpperCase(Locale.ROOT) + ": Unknown Error";
  }

  static double maxPowerLimit(Gpu gpu) {
    return gpu.name().contains("A100") ? 400 : 700;
  }

  static double minPowerLimit(Gpu gpu) {
    return gpu.name().contains("A100") ? 100 : 200;
  }

  private static String help() {
    return "NVIDIA System Management Interface -- v535.104.05\n\n"
        + "NVSMI provides monitoring information for Tesla and select Quadro devices.\n\n"
        + "Usage: nvidia-smi [OPTION1 [ARG1]] [OPTION2 [ARG2]] ...\n\n"
        + "    -h,   --help                Print usage information and exit.\n\n"
        + "  LIST OPTIONS:\n"
        + "    -L,   --list-gpus           Display a list of GPUs connected to the system.\n\n"
        + "  SUMMARY OPTIONS:\n"
        + "    -i,   --id=                 Target a specific GPU (index, UUID or PCI bus id).\n\n"
        + "  QUERY OPTIONS:\n"
        + "    -q,   --query               Display GPU or Unit info.\n"
        + "    -d,   --display=            Display only selected information: MEMORY,\n"
        + "                                UTILIZATION, ECC, TEMPERATURE, POWER, CLOCK,\n"
        + "                                PERFORMANCE. Flags can be combined with comma.\n"
        + "    --query-gpu=                Information about GPU. Pass comma separated list.\n"
        + "    --format=                   Comma separated list of format options: csv,\n"
        + "                                noheader, nounits.\n\n"
        + "  DEVICE MODIFICATION OPTIONS:\n"
        + "    -pm,  --persistence-mode=   Set persistence mode: 0/DISABLED, 1/ENABLED\n"
        + "    -pl,  --power-limit=        Specifies maximum power management limit in watts.\n\n"
        + "  SUBCOMMANDS:\n"
        + "    topo -m                     Display the GPUDirect communication matrix.\n"
        + "    nvlink -s | -e              Display NVLink status or error counters.\n"
        + "    mig -lgi | -lgip            List MIG GPU instances or profiles.\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "nvidia-smi",
        "535.104.05",
        "NVIDIA System Management Interface",
        List.of(
            new CommandInfo(
                "nvidia-smi",
                "Query and manage NVIDIA GPUs",
                "nvidia-smi [OPTION1 [ARG1]] [OPTION2 [ARG2]] ...",
                List.of("topo", "nvlink", "mig"),
                List.of(
                    "nvidia-smi",
                    "nvidia-smi -L",
                    "nvidia-smi -q -d ECC,TEMPERATURE",
                    "nvidia-smi --query-gpu=index,temperature.gpu --format=csv",
                    "nvidia-smi topo -m"))));
  }
}
