package io.podsim.core.cluster;

import java.time.Instant;

/** A job that holds GPUs on one node. */
public record SlurmJob(
    int jobId,
    String name,
    String user,
    String partition,
    String nodeId,
    int gpuCount,
    String state,
    Instant submitTime) {}
