package io.podsim.tools.ib;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.InfiniBandPort;
import java.util.List;

/**
 * Rail-optimized two-tier fabric behind the compute nodes: four spine switches and one leaf
 * (rail) switch per HCA index. HCA {@code mlx5_N} of every node cables into rail switch N.
 */
final class FabricTopology {
  static final int SPINES = 4;

  private static final int SPINE_LID_BASE = 10;
  private static final int RAIL_LID_BASE = 20;

  private final List<DgxNode> nodes;
  private final int rails;
  private final String switchModel;

  FabricTopology(List<DgxNode> nodes) {
    this.nodes = nodes;
    this.rails = nodes.isEmpty() ? 0 : nodes.get(0).hcas().size();
    this.switchModel = switchModel(firstRate(nodes));
  }

  private static int firstRate(List<DgxNode> nodes) {
    for (DgxNode node : nodes) {
      for (InfiniBandHca hca : node.hcas()) {
        if (!hca.ports().isEmpty()) {
          return hca.ports().get(0).rateGbps();
        }
      }
    }
    return 400;
  }

  /** Quantum switch generation that matches the HCA signalling rate. */
  static String switchModel(int rateGbps) {
    if (rateGbps >= 800) {
      return "QM9790";
    }
    if (rateGbps >= 400) {
      return "QM9700";
    }
    if (rateGbps >= 200) {
      return "QM8790";
    }
    return "QM8700";
  }

  int rails() {
    return rails;
  }

  int switchCount() {
    return SPINES + rails;
  }

  int hcaCount() {
    return nodes.stream().mapToInt(n -> n.hcas().size()).sum();
  }

  int portCount() {
    return nodes.stream()
        .flatMap(n -> n.hcas().stream())
        .mapToInt(h -> h.ports().size())
        .sum();
  }

  private static String spineGuid(int i) {
    return String.format("0x%016x", 0x1000 + i);
  }

  private static String railGuid(int i) {
    return String.format("0x%016x", 0x2000 + i);
  }

  /** ibnetdiscover topology file. */
  String render(boolean hcaOnly, boolean switchOnly, boolean showPorts) {
    StringBuilder sb = new StringBuilder();
    sb.append("#\n# Topology file: generated by ibnetdiscover\n#\n")
        .append("# Topology discovery for fabric (DGX Cluster)\n#\n\n");
    if (!hcaOnly) {
      appendSwitches(sb, showPorts);
    }
    if (!switchOnly) {
      appendHcas(sb, showPorts);
    }
    sb.append("#\n# Summary:\n")
        .append("#   ").append(hcaCount()).append(" HCAs\n")
        .append("#   ").append(switchCount()).append(" Switches (").append(SPINES)
        .append(" spine + ").append(rails).append(" rail)\n")
        .append("#   ").append(portCount()).append(" Ports\n")
        .append("#\n");
    return sb.toString();
  }

  private void appendSwitches(StringBuilder sb, boolean showPorts) {
    sb.append("# Spine Switches\n");
    for (int s = 0; s < SPINES; s++) {
      sb.append(String.format("Switch\t64 \"%s\"\t# \"%s/Spine-%d\" enhanced port 0 lid %d\n",
          spineGuid(s), switchModel, s, SPINE_LID_BASE + s));
      if (showPorts) {
        for (int r = 0; r < rails; r++) {
          sb.append(String.format("[%d]\t\"%s\"[%d]\t\t# \"%s/Rail-%d\" lid %d\n",
              r + 1, railGuid(r), s + 1, switchModel, r, RAIL_LID_BASE + r));
        }
      }
      sb.append('\n');
    }
    sb.append("# Leaf (Rail) Switches\n");
    for (int r = 0; r < rails; r++) {
      sb.append(String.format("Switch\t64 \"%s\"\t# \"%s/Rail-%d\" enhanced port 0 lid %d\n",
          railGuid(r), switchModel, r, RAIL_LID_BASE + r));
      if (showPorts) {
        for (int s = 0; s < SPINES; s++) {
          sb.append(String.format("[%d]\t\"%s\"[%d]\t\t# \"%s/Spine-%d\" lid %d\n",
              s + 1, spineGuid(s), r + 1, switchModel, s, SPINE_LID_BASE + s));
        }
        for (int n = 0; n < nodes.size(); n++) {
          DgxNode node = nodes.get(n);
          if (r < node.hcas().size()) {
            InfiniBandHca hca = node.hcas().get(r);
            sb.append(String.format("[%d]\t\"%s\"[1]\t\t# \"%s\" %s\n",
                SPINES + n + 1, hca.nodeGuid(), node.hostname(), hca.caName()));
          }
        }
      }
      sb.append('\n');
    }
  }

  private void appendHcas(StringBuilder sb, boolean showPorts) {
    sb.append("# Channel Adapters (HCAs)\n");
    for (int n = 0; n < nodes.size(); n++) {
      DgxNode node = nodes.get(n);
      for (int h = 0; h < node.hcas().size(); h++) {
        InfiniBandHca hca = node.hcas().get(h);
        sb.append(String.format("Ca\t%d \"%s\"\t# \"%s/%s\" Rail-%d\n",
            hca.ports().size(), hca.nodeGuid(), node.hostname(), hca.caName(), h));
        if (showPorts) {
          for (InfiniBandPort port : hca.ports()) {
            sb.append(String.format("[%d](%s)\t\"%s\"[%d]\t\t# lid %d lmc 0 \"%s\" %s\n",
                port.portNumber(), port.guid(), railGuid(h), SPINES + n + 1, port.lid(),
                node.hostname(), port.state()));
          }
        }
        sb.append('\n');
      }
    }
  }
}
