package io.podsim.tools.ib;

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
import io.podsim.core.cluster.HealthStatus;
import io.podsim.core.cluster.InfiniBandPort;
import io.podsim.core.cluster.PortErrors;
import io.podsim.core.render.Ansi;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates the fabric diagnostics of infiniband-diags: {@code ibportstate}, {@code ibporterrors},
 * {@code iblinkinfo}, {@code perfquery}, {@code ibdiagnet} and {@code ibnetdiscover}. Port states
 * and error counters come from the cluster store, so a degraded link or a dirty cable reads the
 * same in every one of them and in {@code ibstat}.
 */
public final class InfiniBandDiagnostics extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(InfiniBandDiagnostics.class);

  static final String IBDIAGNET_VERSION = "2.9.0";

  // width of the dotted key column in perfquery and ibportstate output
  private static final int KEY_WIDTH = 33;

  private static final FlagSchema IBPORTSTATE =
      FlagSchema.builder("ibportstate")
          .flag("V", "version")
          .flag("h", "help")
          .build();

  private static final FlagSchema IBPORTERRORS =
      FlagSchema.builder("ibporterrors")
          .option("C", "Ca")
          .option("P", "Port")
          .flag("V", "version")
          .flag("h", "help")
          .build();

  private static final FlagSchema IBLINKINFO =
      FlagSchema.builder("iblinkinfo")
          .flag("v", "verbose")
          .flag("l", "line")
          .flag("V", "version")
          .flag("h", "help")
          .build();

  private static final FlagSchema PERFQUERY =
      FlagSchema.builder("perfquery")
          .flag("x", "extended")
          .flag("r", "reset_after_read")
          .flag("R", "Reset_only")
          .flag("V", "version")
          .flag("h", "help")
          .build();

  private static final FlagSchema IBDIAGNET =
      FlagSchema.builder("ibdiagnet")
          .option("o", "output")
          .flag("detailed")
          .flag("signal-quality")
          .flag("V", "version")
          .flag("h", "help")
          .unknownFlagMessage("-E- Unknown option: %s")
          .build();

  private static final FlagSchema IBNETDISCOVER =
      FlagSchema.builder("ibnetdiscover")
          .flag("H", "Hca_list")
          .flag("S", "Switch_list")
          .flag("p", "ports")
          .flag("V", "version")
          .flag("h", "help")
          .build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    String tool = command.baseCommand();
    LOG.debug("{} on {}", tool, context.getCurrentNode());
    ParsedCommand cmd =
        switch (tool) {
          case "ibportstate" -> IBPORTSTATE.validate(command);
          case "ibporterrors" -> IBPORTERRORS.validate(command);
          case "iblinkinfo" -> IBLINKINFO.validate(command);
          case "perfquery" -> PERFQUERY.validate(command);
          case "ibdiagnet" -> IBDIAGNET.validate(command);
          case "ibnetdiscover" -> IBNETDISCOVER.validate(command);
          default -> throw new SimulatorException("Unknown InfiniBand tool: " + tool);
        };
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(usage(tool));
    }
    if (cmd.hasFlag("V", "version")) {
      String version =
          "ibdiagnet".equals(tool) ? IBDIAGNET_VERSION : InfiniBandSimulator.VERSION;
      return CommandResult.success(tool + " BUILD VERSION: " + version);
    }
    return switch (tool) {
      case "ibportstate" -> ibportstate(cmd, context);
      case "ibporterrors" -> ibporterrors(cmd, context);
      case "iblinkinfo" -> iblinkinfo(cmd, context);
      case "perfquery" -> perfquery(cmd, context);
      case "ibdiagnet" -> ibdiagnet(cmd, context);
      default -> ibnetdiscover(cmd, context);
    };
  }

  private List<FabricPort> localPorts(CommandContext context, String tool)
      throws SimulatorException {
    DgxNode node = requireNode(context, tool + ": no InfiniBand devices found");
    List<FabricPort> ports = FabricPort.of(node);
    if (ports.isEmpty()) {
      throw new SimulatorException(tool + ": no InfiniBand devices found");
    }
    return ports;
  }

  /**
   * The port named by an optional {@code <lid> [port]} argument pair, or the first local port.
   */
  private FabricPort targetPort(ParsedCommand cmd, CommandContext context, String tool)
      throws SimulatorException {
    List<FabricPort> local = localPorts(context, tool);
    Optional<String> lidArg = cmd.positional(0);
    if (lidArg.isEmpty()) {
      return local.get(0);
    }
    int lid = parseIndex(lidArg.get(), tool + ": invalid lid '" + lidArg.get() + "'");
    FabricPort found =
        FabricPort.byLid(allNodes(context), lid)
            .orElseThrow(() -> new SimulatorException(
                "ibwarn: [" + tool + "] lid " + lid + " not found in the fabric"));
    Optional<String> portArg = cmd.positional(1);
    if (portArg.isPresent()) {
      int number = parseIndex(portArg.get(), tool + ": invalid port '" + portArg.get() + "'");
      if (number != found.port().portNumber()) {
        throw new SimulatorException(
            "ibwarn: [" + tool + "] port " + number + " does not exist on lid " + lid);
      }
    }
    return found;
  }

  static String dotted(String key, Object value) {
    String label = key + ":";
    int dots = Math.max(1, KEY_WIDTH - label.length());
    return label + ".".repeat(dots) + value + "\n";
  }

  // ibportstate

  private CommandResult ibportstate(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    FabricPort target = targetPort(cmd, context, "ibportstate");
    InfiniBandPort port = target.port();
    StringBuilder sb = new StringBuilder("CA PortInfo:\n")
        .append("# Port info: Lid ").append(port.lid()).append(" port ")
        .append(port.portNumber()).append('\n')
        .append(dotted("LinkState", port.state()))
        .append(dotted("PhysLinkState", port.physicalState()))
        .append(dotted("Lid", port.lid()))
        .append(dotted("SMLid", 1))
        .append(dotted("LMC", 0))
        .append(dotted("LinkWidthActive", "4X"))
        .append(dotted("LinkSpeedActive", port.rateName()))
        .append(dotted("LinkRate", port.rateGbps() + " Gb/s"))
        .append(dotted("LinkLayer", port.linkLayer()));
    return CommandResult.success(sb.toString());
  }

  // ibporterrors

  private CommandResult ibporterrors(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    List<FabricPort> ports = new ArrayList<>(localPorts(context, "ibporterrors"));
    Optional<String> ca = cmd.flagValue("C", "Ca");
    if (ca.isPresent()) {
      ports.removeIf(p -> !p.hca().caName().equals(ca.get()));
      if (ports.isEmpty()) {
        throw new SimulatorException("ibporterrors: CA '" + ca.get() + "' not found");
      }
    }
    Optional<String> portArg = cmd.flagValue("P", "Port");
    if (portArg.isPresent()) {
      int number = parseIndex(portArg.get(), "ibporterrors: invalid port '" + portArg.get() + "'");
      ports.removeIf(p -> p.port().portNumber() != number);
    }

    StringBuilder sb = new StringBuilder("Errors for:\n");
    for (FabricPort fp : ports) {
      PortErrors errors = fp.port().errors();
      sb.append("  ").append(fp.hca().caName()).append(" port ").append(fp.port().portNumber())
          .append(" (lid ").append(fp.port().lid()).append("):\n")
          .append(String.format("    %-25s%d\n", "SymbolErrors:", errors.symbolErrors()))
          .append(String.format("    %-25s%d\n", "LinkDowned:", errors.linkDowned()))
          .append(String.format("    %-25s%d\n", "PortRcvErrors:", errors.portRcvErrors()))
          .append(String.format("    %-25s%d\n", "PortXmitDiscards:", errors.portXmitDiscards()))
          .append(String.format("    %-25s%d\n", "PortXmitWait:", errors.portXmitWait()));
      if (errors.symbolErrors() > 0) {
        sb.append("    ").append(Ansi.status(
            "Warning: Symbol errors detected - check cable quality", HealthStatus.WARNING))
            .append('\n');
      }
      if (errors.linkDowned() > 0) {
        sb.append("    ").append(Ansi.status(
            "Critical: Link has gone down " + errors.linkDowned() + " times",
            HealthStatus.CRITICAL)).append('\n');
      }
    }
    return CommandResult.success(sb.toString());
  }

  // iblinkinfo

  private CommandResult iblinkinfo(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    List<FabricPort> ports = localPorts(context, "iblinkinfo");
    boolean verbose = cmd.hasFlag("v", "verbose");
    StringBuilder sb = new StringBuilder();
    if (cmd.hasFlag("l", "line")) {
      for (FabricPort fp : ports) {
        InfiniBandPort port = fp.port();
        sb.append(port.guid()).append(" \"").append(fp.node().hostname()).append(' ')
            .append(fp.hca().caName()).append("\" ").append(port.lid()).append(' ')
            .append(port.portNumber()).append("[  ] ==( 4X ").append(port.rateGbps())
            .append(" Gbps ").append(port.state()).append('/').append(port.physicalState())
            .append(")==> Rail-").append(fp.node().hcas().indexOf(fp.hca())).append('\n');
      }
      return CommandResult.success(sb.toString());
    }
    sb.append("InfiniBand Link Information:\n\n");
    for (FabricPort fp : ports) {
      InfiniBandPort port = fp.port();
      sb.append("CA: ").append(fp.hca().caName()).append(' ').append(fp.hca().model())
          .append('\n')
          .append("      ").append(port.guid()).append('\n')
          .append("         port ").append(port.portNumber()).append(" lid ")
          .append(port.lid()).append(" lmc 0 ").append(port.state()).append(' ')
          .append(port.rateGbps()).append(" Gb/s ").append(port.rateName())
          .append(" (").append(port.linkLayer()).append(")\n");
      if (verbose) {
        PortErrors errors = port.errors();
        sb.append("         Link errors:\n")
            .append(String.format("           %-20s%d\n", "Symbol errors:", errors.symbolErrors()))
            .append(String.format("           %-20s%d\n", "Link downed:", errors.linkDowned()))
            .append(String.format("           %-20s%d\n", "Receive errors:",
                errors.portRcvErrors()));
      }
    }
    return CommandResult.success(sb.toString());
  }

  // perfquery

  private CommandResult perfquery(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    FabricPort target = targetPort(cmd, context, "perfquery");
    ClusterStore store = requireCluster(context, "perfquery: no InfiniBand devices found");
    if (cmd.hasFlag("R", "Reset_only")) {
      store.setPortErrors(target.node().id(), target.hca().caName(),
          target.port().portNumber(), PortErrors.NONE);
      return CommandResult.success("");
    }
    String report = counters(target.port(), cmd.hasFlag("x", "extended"));
    if (cmd.hasFlag("r", "reset_after_read")) {
      store.setPortErrors(target.node().id(), target.hca().caName(),
          target.port().portNumber(), PortErrors.NONE);
    }
    return CommandResult.success(report);
  }

  /** Traffic counters derived from the LID, so repeated reads agree. */
  static String counters(InfiniBandPort port, boolean extended) {
    long seed = port.lid() * 7919L;
    long xmitData = 500_000_000L + seed % 500_000_000L;
    long rcvData = 450_000_000L + (seed * 3) % 500_000_000L;
    long xmitPkts = 5_000_000L + seed % 5_000_000L;
    long rcvPkts = 4_800_000L + (seed * 3) % 5_000_000L;
    PortErrors errors = port.errors();

    StringBuilder sb = new StringBuilder();
    if (extended) {
      sb.append("# Port extended counters: Lid ").append(port.lid()).append(" port ")
          .append(port.portNumber()).append(" (CapMask: 0x5A00)\n")
          .append(dotted("PortSelect", port.portNumber()))
          .append(dotted("CounterSelect", "0x0000"))
          .append(dotted("PortXmitData", xmitData))
          .append(dotted("PortRcvData", rcvData))
          .append(dotted("PortXmitPkts", xmitPkts))
          .append(dotted("PortRcvPkts", rcvPkts))
          .append(dotted("PortUnicastXmitPkts", xmitPkts))
          .append(dotted("PortUnicastRcvPkts", rcvPkts))
          .append(dotted("PortMulticastXmitPkts", 0))
          .append(dotted("PortMulticastRcvPkts", 0));
      return sb.toString();
    }
    sb.append("# Port counters: Lid ").append(port.lid()).append(" port ")
        .append(port.portNumber()).append('\n')
        .append(dotted("PortSelect", port.portNumber()))
        .append(dotted("PortXmitData", xmitData))
        .append(dotted("PortRcvData", rcvData))
        .append(dotted("PortXmitPkts", xmitPkts))
        .append(dotted("PortRcvPkts", rcvPkts))
        .append(dotted("SymbolErrorCounter", errors.symbolErrors()))
        .append(dotted("LinkErrorRecoveryCounter", 0))
        .append(dotted("LinkDownedCounter", errors.linkDowned()))
        .append(dotted("PortRcvErrors", errors.portRcvErrors()))
        .append(dotted("PortRcvRemotePhysicalErrors", 0))
        .append(dotted("PortRcvSwitchRelayErrors", 0))
        .append(dotted("PortXmitDiscards", errors.portXmitDiscards()))
        .append(dotted("PortXmitConstraintErrors", 0))
        .append(dotted("PortRcvConstraintErrors", 0))
        .append(dotted("LocalLinkIntegrityErrors", 0))
        .append(dotted("ExcessiveBufferOverrunErrors", 0))
        .append(dotted("VL15Dropped", 0))
        .append(dotted("PortXmitWait", errors.portXmitWait()));
    return sb.toString();
  }

  // ibdiagnet

  private CommandResult ibdiagnet(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    DgxNode local = requireNode(context, "-E- Failed to open local port: no InfiniBand devices");
    if (local.hcas().isEmpty()) {
      throw new SimulatorException("-E- Failed to open local port: no InfiniBand devices");
    }
    List<DgxNode> nodes = allNodes(context);
    FabricTopology topology = new FabricTopology(nodes);
    List<FabricPort> ports = FabricPort.of(nodes);
    String outputDir = cmd.flagValue("o", "output").orElse("/var/tmp/ibdiagnet2");

    StringBuilder sb = new StringBuilder()
        .append("Running ibdiagnet ").append(IBDIAGNET_VERSION).append('\n')
        .append("-I- Using port 1 as the local port\n")
        .append("-I- Discovering ... ").append(nodes.size() + topology.switchCount())
        .append(" nodes (").append(topology.switchCount()).append(" Switches & ")
        .append(topology.hcaCount()).append(" CA-s) discovered.\n")
        .append("-I- # of links: ").append(ports.size() + FabricTopology.SPINES
            * topology.rails()).append('\n')
        .append("-I- Checking fabric health...\n");

    int errors = 0;
    int warnings = 0;
    for (FabricPort fp : ports) {
      if (FaultRules.portStatus(fp.port()) == HealthStatus.CRITICAL) {
        errors++;
        sb.append(Ansi.status("-E- Port " + fp.label() + " (lid " + fp.port().lid() + ") is "
            + fp.port().state() + "/" + fp.port().physicalState(), HealthStatus.CRITICAL))
            .append('\n');
      }
      PortErrors counters = fp.port().errors();
      HealthStatus counterStatus = FaultRules.portErrorStatus(counters);
      if (counterStatus == HealthStatus.CRITICAL) {
        errors++;
        sb.append(Ansi.status("-E- Port " + fp.label() + ": LinkDownedCounter="
            + counters.linkDowned(), HealthStatus.CRITICAL)).append('\n');
      } else if (counterStatus == HealthStatus.WARNING) {
        warnings++;
        sb.append(Ansi.status("-W- Port " + fp.label() + ": SymbolErrorCounter="
            + counters.symbolErrors() + " PortRcvErrors=" + counters.portRcvErrors(),
            HealthStatus.WARNING)).append('\n');
      }
    }

    if (cmd.hasFlag("detailed", "signal-quality")) {
      sb.append("-I- Running signal quality checks...\n\n")
          .append("Cable Validation Report - ").append(local.hostname()).append('\n')
          .append("=".repeat(60)).append("\n\n");
      for (FabricPort fp : FabricPort.of(local)) {
        appendSignalQuality(sb, fp);
      }
    }

    sb.append("-I- Fabric health check completed\n");
    if (errors == 0 && warnings == 0) {
      sb.append("-I- No errors found\n");
    } else {
      sb.append("-I- Errors: ").append(errors).append(", Warnings: ").append(warnings)
          .append('\n');
    }
    sb.append("-I- See report in ").append(outputDir).append('\n');
    return CommandResult.success(sb.toString());
  }

  /** Optical readings for one cable; symbol errors degrade the bit error rate. */
  private static void appendSignalQuality(StringBuilder sb, FabricPort fp) {
    InfiniBandPort port = fp.port();
    int spread = port.lid() % 5;
    double rxPower = -2.5 + spread * 0.1;
    double txPower = -1.8 + spread * 0.06;
    double snr = 25.0 + spread;
    double ber = port.errors().symbolErrors() > 0 ? 2.4e-8 : 1.0e-13 * (spread + 1);
    boolean pass = port.isActive() && rxPower > -3 && ber < 1e-9 && snr > 20;

    sb.append("Port ").append(fp.hca().caName()).append('/').append(port.portNumber())
        .append(": ").append(port.guid()).append('\n')
        .append("  Cable Type: QSFP-DD AOC\n")
        .append("  Cable Length: 5m\n")
        .append("  Link State: ").append(port.state()).append('\n')
        .append("  Link Speed: ").append(port.rateGbps()).append(" Gb/s (")
        .append(port.rateName()).append(")\n\n")
        .append("  Signal Quality Metrics:\n")
        .append(String.format(Locale.ROOT,
            "    RX Power: %.2f dBm (Normal: -3.0 to -1.5)\n", rxPower))
        .append(String.format(Locale.ROOT,
            "    TX Power: %.2f dBm (Normal: -2.0 to -1.0)\n", txPower))
        .append(String.format(Locale.ROOT,
            "    Bit Error Rate: %.2e (Threshold: < 1e-9)\n", ber))
        .append(String.format(Locale.ROOT, "    SNR: %.1f dB (Normal: > 20 dB)\n", snr))
        .append("    Eye Opening: 95% (Normal: > 80%)\n")
        .append("    Status: ")
        .append(pass
            ? Ansi.status("PASS", HealthStatus.OK)
            : Ansi.status("FAIL", HealthStatus.CRITICAL))
        .append("\n\n");
  }

  // ibnetdiscover

  private CommandResult ibnetdiscover(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    localPorts(context, "ibnetdiscover");
    FabricTopology topology = new FabricTopology(allNodes(context));
    return CommandResult.success(topology.render(
        cmd.hasFlag("H", "Hca_list"), cmd.hasFlag("S", "Switch_list"), cmd.hasFlag("p", "ports")));
  }

  private static String usage(String tool) {
    return switch (tool) {
      case "ibportstate" -> "Usage: ibportstate [options] [<lid> [<portnum>]]\n\n"
          + "Options:\n"
          + "  -V, --version        show version\n"
          + "  -h, --help           show this help\n";
      case "ibporterrors" -> "Usage: ibporterrors [options]\n\n"
          + "Options:\n"
          + "  -C, --Ca <ca>        CA name\n"
          + "  -P, --Port <port>    port number\n"
          + "  -V, --version        show version\n"
          + "  -h, --help           show this help\n";
      case "iblinkinfo" -> "Usage: iblinkinfo [options]\n\n"
          + "Options:\n"
          + "  -v, --verbose        include link error counters\n"
          + "  -l, --line           one line per port\n"
          + "  -V, --version        show version\n"
          + "  -h, --help           show this help\n";
      case "perfquery" -> "Usage: perfquery [options] [<lid> [<port>]]\n\n"
          + "Options:\n"
          + "  -x, --extended           extended counters\n"
          + "  -r, --reset_after_read   reset counters after read\n"
          + "  -R, --Reset_only         only reset counters\n"
          + "  -V, --version            show version\n"
          + "  -h, --help               show this help\n";
      case "ibdiagnet" -> "Usage: ibdiagnet [options]\n\n"
          + "Options:\n"
          + "  -o, --output <dir>   output directory\n"
          + "  --detailed           show signal quality metrics\n"
          + "  --signal-quality     same as --detailed\n"
          + "  -V, --version        show version\n"
          + "  -h, --help           show this help\n";
      default -> "Usage: ibnetdiscover [options]\n\n"
          + "Options:\n"
          + "  -H, --Hca_list       list of HCAs only\n"
          + "  -S, --Switch_list    list of switches only\n"
          + "  -p, --ports          show port connections\n"
          + "  -V, --version        show version\n"
          + "  -h, --help           show this help\n";
    };
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "infiniband-diags",
        InfiniBandSimulator.VERSION,
        "InfiniBand fabric diagnostics",
        List.of(
            new CommandInfo("ibportstate", "Show the state of an InfiniBand port",
                "ibportstate [<lid> [<portnum>]]", List.of(),
                List.of("ibportstate", "ibportstate 100 1")),
            new CommandInfo("ibporterrors", "Show InfiniBand port error counters",
                "ibporterrors [-C <ca>] [-P <port>]", List.of(),
                List.of("ibporterrors", "ibporterrors -C mlx5_0")),
            new CommandInfo("iblinkinfo", "Show InfiniBand link information",
                "iblinkinfo [-v|-l]", List.of(), List.of("iblinkinfo", "iblinkinfo -v")),
            new CommandInfo("perfquery", "Query InfiniBand port performance counters",
                "perfquery [-x] [-r|-R] [<lid> [<port>]]", List.of(),
                List.of("perfquery", "perfquery -x", "perfquery 101 1")),
            new CommandInfo("ibdiagnet", "Run a fabric-wide InfiniBand health check",
                "ibdiagnet [--detailed] [-o <dir>]", List.of(),
                List.of("ibdiagnet", "ibdiagnet --detailed")),
            new CommandInfo("ibnetdiscover", "Discover the InfiniBand fabric topology",
                "ibnetdiscover [-H|-S] [-p]", List.of(),
                List.of("ibnetdiscover", "ibnetdiscover -p"))));
  }
}
