package io.podsim.tools.ib;

import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.InfiniBandHca;
import io.podsim.core.cluster.InfiniBandPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** An HCA port located in the fabric: the node and adapter it belongs to. */
record FabricPort(DgxNode node, InfiniBandHca hca, InfiniBandPort port) {

  static List<FabricPort> of(DgxNode node) {
    List<FabricPort> ports = new ArrayList<>();
    for (InfiniBandHca hca : node.hcas()) {
      for (InfiniBandPort port : hca.ports()) {
        ports.add(new FabricPort(node, hca, port));
      }
    }
    return ports;
  }

  static List<FabricPort> of(List<DgxNode> nodes) {
    List<FabricPort> ports = new ArrayList<>();
    nodes.forEach(n -> ports.addAll(of(n)));
    return ports;
  }

  /** Finds a port by LID anywhere in the fabric. */
  static Optional<FabricPort> byLid(List<DgxNode> nodes, int lid) {
    return of(nodes).stream().filter(p -> p.port().lid() == lid).findFirst();
  }

  /** {@code hostname/mlx5_N/port}, the way ibdiagnet names a port. */
  String label() {
    return node.hostname() + "/" + hca.caName() + "/" + port.portNumber();
  }
}
