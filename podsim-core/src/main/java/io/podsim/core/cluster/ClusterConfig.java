package io.podsim.core.cluster;

import java.time.Instant;
import java.util.List;

/**
 * The virtual cluster as built by {@link ClusterFactory}.
 *
 * @param name cluster name
 * @param nodes compute nodes in rack order
 * @param bootTime instant every node finished booting; log timestamps are derived from it
 * @param controlMachine Slurm controller host
 * @param partitions Slurm partitions, the first one being the default
 * @param jobs jobs already running when the session starts
 */
public record ClusterConfig(
    String name,
    List<DgxNode> nodes,
    Instant bootTime,
    String controlMachine,
    List<String> partitions,
    List<SlurmJob> jobs) {

  public ClusterConfig {
    nodes = List.copyOf(nodes);
    partitions = List.copyOf(partitions);
    jobs = List.copyOf(jobs);
  }

  /** Copy whose nodes are independent of this one's. */
  ClusterConfig copy() {
    return new ClusterConfig(
        name, nodes.stream().map(DgxNode::copy).toList(), bootTime, controlMachine, partitions,
        jobs);
  }
}
