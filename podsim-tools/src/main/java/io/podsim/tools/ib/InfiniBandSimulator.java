package io.podsim.tools.ib;

import io.podsim.core.AbstractSimulator;
import io.podsim.core.CommandContext;
import io.podsim.core.CommandInfo;
import io.podsim.core.CommandResult;
import io.podsim.core.FlagSchema;
import io.podsim.core.ParsedCommand;
import io.podsim.core.SimulatorException;
import io.podsim.core.SimulatorMetadata;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.InfiniBandPort;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Simulates the InfiniBand host tools {@code ibstat} and {@code ibdev2netdev}. */
public final class InfiniBandSimulator extends AbstractSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(InfiniBandSimulator.class);

  static final String VERSION = "5.9-0";

  private static final FlagSchema IBSTAT =
      FlagSchema.builder("ibstat")
          .flag("l", "list_of_cas")
          .flag("s", "short")
          .flag("p", "port_list")
          .flag("V", "version")
          .flag("h", "help")
          .unknownFlagMessage("ibstat: unrecognized option '%s'\n"
              + "Usage: ibstat [options] [<ca_name>] [portnum]")
          .build();

  private static final FlagSchema IBDEV2NETDEV =
      FlagSchema.builder("ibdev2netdev")
          .flag("v", "verbose")
          .flag("h", "help")
          .unknownFlagMessage("ibdev2netdev: unrecognized option '%s'")
          .build();

  @Override
  protected CommandResult run(ParsedCommand command, CommandContext context)
      throws SimulatorException {
    LOG.debug("{} on {}", command.baseCommand(), context.getCurrentNode());
    return switch (command.baseCommand()) {
      case "ibstat" -> ibstat(IBSTAT.validate(command), context);
      case "ibdev2netdev" -> ibdev2netdev(IBDEV2NETDEV.validate(command), context);
      default -> throw new SimulatorException("Unknown InfiniBand tool: "
          + command.baseCommand());
    };
  }

  private List<InfiniBandHca> hcas(CommandContext context, String tool)
      throws SimulatorException {
    DgxNode node = requireNode(context, tool + ": no InfiniBand devices found");
    if (node.hcas().isEmpty()) {
      throw new SimulatorException(tool + ": no InfiniBand devices found");
    }
    return node.hcas();
  }

  private CommandResult ibstat(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success(ibstatUsage());
    }
    if (cmd.hasFlag("V", "version")) {
      return CommandResult.success("ibstat BUILD VERSION: " + VERSION);
    }
    List<InfiniBandHca> hcas = hcas(context, "ibstat");
    if (cmd.hasFlag("l", "list_of_cas")) {
      StringBuilder sb = new StringBuilder();
      hcas.forEach(h -> sb.append(h.caName()).append('\n'));
      return CommandResult.success(sb.toString());
    }
    if (cmd.hasFlag("p", "port_list")) {
      StringBuilder sb = new StringBuilder();
      for (InfiniBandHca hca : hcas) {
        hca.ports().forEach(p -> sb.append(p.guid()).append('\n'));
      }
      return CommandResult.success(sb.toString());
    }

    Optional<String> caName = cmd.positional(0);
    if (caName.isPresent()) {
      InfiniBandHca hca = hcas.stream()
          .filter(h -> h.caName().equals(caName.get()))
          .findFirst()
          .orElseThrow(() -> new SimulatorException("ibpanic: [2210] main: stat of IB device '"
              + caName.get() + "' failed: No such file or directory"));
      Optional<String> portArg = cmd.positional(1);
      if (portArg.isPresent()) {
        int number = parseIndex(portArg.get(), "ibstat: invalid port number " + portArg.get());
        InfiniBandPort port = hca.ports().stream()
            .filter(p -> p.portNumber() == number)
            .findFirst()
            .orElseThrow(() -> new SimulatorException("ibpanic: [2210] main: stat of port "
                + number + " of '" + hca.caName() + "' failed"));
        StringBuilder sb = new StringBuilder("CA: '").append(hca.caName()).append("'\n");
        appendPort(sb, port, "");
        return CommandResult.success(sb.toString());
      }
      return CommandResult.success(describe(hca, cmd.hasFlag("s", "short")));
    }

    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < hcas.size(); i++) {
      if (i > 0) {
        sb.append('\n');
      }
      sb.append(describe(hcas.get(i), cmd.hasFlag("s", "short")));
    }
    return CommandResult.success(sb.toString());
  }

  static String describe(InfiniBandHca hca, boolean shortForm) {
    StringBuilder sb = new StringBuilder();
    sb.append("CA '").append(hca.caName()).append("'\n")
        .append("\tCA type: ").append(hca.deviceId()).append('\n')
        .append("\tNumber of ports: ").append(hca.ports().size()).append('\n')
        .append("\tFirmware version: ").append(hca.firmwareVersion()).append('\n')
        .append("\tHardware version: 0\n")
        .append("\tNode GUID: ").append(hca.nodeGuid()).append('\n')
        .append("\tSystem image GUID: ").append(hca.nodeGuid()).append('\n');
    if (!shortForm) {
      hca.ports().forEach(p -> appendPort(sb, p, "\t"));
    }
    return sb.toString();
  }

  private static void appendPort(StringBuilder sb, InfiniBandPort port, String indent) {
    String in = indent + "\t";
    sb.append(indent).append("Port ").append(port.portNumber()).append(":\n")
        .append(in).append("State: ").append(port.state()).append('\n')
        .append(in).append("Physical state: ").append(port.physicalState()).append('\n')
        .append(in).append("Rate: ").append(port.rateGbps()).append(" Gb/s (")
        .append(port.rateName()).append(")\n")
        .append(in).append("Base lid: ").append(port.lid()).append('\n')
        .append(in).append("LMC: 0\n")
        .append(in).append("SM lid: 1\n")
        .append(in).append("Capability mask: 0x2651e848\n")
        .append(in).append("Port GUID: ").append(port.guid()).append('\n')
        .append(in).append("Link layer: ").append(port.linkLayer()).append('\n');
  }

  private CommandResult ibdev2netdev(ParsedCommand cmd, CommandContext context)
      throws SimulatorException {
    if (cmd.hasFlag("h", "help")) {
      return CommandResult.success("Usage: ibdev2netdev [options]\n"
          + "  -v, --verbose   also print PCI address, device type and firmware\n"
          + "  -h, --help      show this help\n");
    }
    List<InfiniBandHca> hcas = hcas(context, "ibdev2netdev");
    boolean verbose = cmd.hasFlag("v", "verbose");
    StringBuilder sb = new StringBuilder();
    int netdev = 0;
    for (InfiniBandHca hca : hcas) {
      for (InfiniBandPort port : hca.ports()) {
        String link = port.isActive() ? "Up" : "Down";
        if (verbose) {
          sb.append(hca.pciAddress()).append(' ').append(hca.caName())
              .append(" (").append(hca.deviceId()).append(" - ").append(hca.model())
              .append(") fw ").append(hca.firmwareVersion())
              .append(" port ").append(port.portNumber())
              .append(" (").append(port.state().toUpperCase(Locale.ROOT)).append(')');
        } else {
          sb.append(hca.caName()).append(" port ").append(port.portNumber());
        }
        sb.append(" ==> ib").append(netdev++).append(" (").append(link).append(")\n");
      }
    }
    return CommandResult.success(sb.toString());
  }

  private static String ibstatUsage() {
    return "Usage: ibstat [options] [<ca_name>] [portnum]\n\n"
        + "Options:\n"
        + "  -l, --list_of_cas    list all IB devices\n"
        + "  -s, --short          short output\n"
        + "  -p, --port_list      show port list\n"
        + "  -V, --version        show version\n"
        + "  -h, --help           show this help message\n";
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return new SimulatorMetadata(
        "infiniband-tools",
        VERSION,
        "InfiniBand adapter status and device mapping",
        List.of(
            new CommandInfo(
                "ibstat",
                "Show InfiniBand adapter and port status",
                "ibstat [-l|-s|-p] [ca_name [portnum]]",
                List.of(),
                List.of("ibstat", "ibstat -l", "ibstat mlx5_0 1")),
            new CommandInfo(
                "ibdev2netdev",
                "Map InfiniBand devices to network interfaces",
                "ibdev2netdev [-v]",
                List.of(),
                List.of("ibdev2netdev", "ibdev2netdev -v"))));
  }
}
