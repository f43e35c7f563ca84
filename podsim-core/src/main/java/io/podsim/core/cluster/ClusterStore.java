package io.podsim.core.cluster;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-owned state of the virtual cluster. Simulators read through the accessors and write
 * only through the named mutators below; nothing else holds a writable reference to the model.
 *
 * <p>The store is not thread-safe. Commands execute one at a time.
 */
public final class ClusterStore {
  private static final Logger LOG = LoggerFactory.getLogger(ClusterStore.class);

  private static final Set<String> UNSCHEDULABLE = Set.of("down", "drain", "drained", "fail");

  private final Supplier<ClusterConfig> factory;
  private ClusterConfig config;
  private final List<SlurmJob> jobs = new ArrayList<>();
  private final Map<String, Set<String>> stoppedServices = new HashMap<>();
  private int nextJobId;
  private int eventCount;

  /** Creates a store seeded with the default cluster. */
  public ClusterStore() {
    this(ClusterFactory::createDefault);
  }

  /**
   * Creates a store whose initial state (and state after {@link #reset()}) comes from the given
   * factory.
   */
  public ClusterStore(Supplier<ClusterConfig> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
    load(factory.get());
  }

  /**
   * Creates a store over a fixed configuration. The store works on copies, so {@link #reset()}
   * returns to the configuration as given here.
   */
  public static ClusterStore of(ClusterConfig config) {
    ClusterConfig pristine = config.copy();
    return new ClusterStore(pristine::copy);
  }

  private void load(ClusterConfig fresh) {
    this.config = fresh;
    this.jobs.clear();
    this.jobs.addAll(fresh.jobs());
    int maxId = 999;
    for (SlurmJob job : fresh.jobs()) {
      maxId = Math.max(maxId, job.jobId());
    }
    this.nextJobId = maxId + 1;
    this.eventCount = 0;
    this.stoppedServices.clear();
  }

  /** Restores the state produced by the factory, discarding faults and jobs. */
  public void reset() {
    LOG.debug("Resetting cluster state");
    load(factory.get());
  }

  public String name() {
    return config.name();
  }

  public Instant bootTime() {
    return config.bootTime();
  }

  public String controlMachine() {
    return config.controlMachine();
  }

  public List<String> partitions() {
    return config.partitions();
  }

  public List<DgxNode> nodes() {
    return config.nodes();
  }

  /** Finds a node by id ({@code dgx-00}) or hostname ({@code dgx-node01}). */
  public Optional<DgxNode> findNode(String idOrHostname) {
    if (idOrHostname == null) {
      return Optional.empty();
    }
    for (DgxNode node : config.nodes()) {
      if (node.id().equals(idOrHostname) || node.hostname().equals(idOrHostname)) {
        return Optional.of(node);
      }
    }
    return Optional.empty();
  }

  public List<SlurmJob> jobs() {
    return Collections.unmodifiableList(jobs);
  }

  public Optional<SlurmJob> job(int jobId) {
    return jobs.stream().filter(j -> j.jobId() == jobId).findFirst();
  }

  /** Number of GPUs held by running jobs on the node. */
  public int gpusInUse(String nodeId) {
    int used = 0;
    for (SlurmJob job : jobs) {
      if (job.nodeId().equals(nodeId)) {
        used += job.gpuCount();
      }
    }
    return used;
  }

  public boolean setSlurmState(String nodeId, String state) {
    Optional<DgxNode> node = findNode(nodeId);
    if (node.isEmpty()) {
      return false;
    }
    LOG.debug("Slurm state of {} -> {}", nodeId, state);
    node.get().slurmState(state.toLowerCase(Locale.ROOT));
    return true;
  }

  /**
   * Places a job on a node if it has enough free GPUs and is schedulable.
   *
   * @return the submitted job, or empty when the node cannot take it
   */
  public Optional<SlurmJob> allocateGpusForJob(
      String nodeId, String jobName, String user, String partition, int gpuCount) {
    Optional<DgxNode> found = findNode(nodeId);
    if (found.isEmpty() || gpuCount < 0) {
      return Optional.empty();
    }
    DgxNode node = found.get();
    if (UNSCHEDULABLE.contains(node.slurmState())) {
      return Optional.empty();
    }
    int free = node.gpus().size() - gpusInUse(node.id());
    if (gpuCount > free) {
      return Optional.empty();
    }
    SlurmJob job =
        new SlurmJob(
            nextJobId++, jobName, user, partition, node.id(), gpuCount, "RUNNING", nextEventTime());
    jobs.add(job);
    refreshAllocationState(node);
    LOG.debug("Allocated {} GPUs on {} for job {}", gpuCount, node.id(), job.jobId());
    return Optional.of(job);
  }

  /** Releases the GPUs of a job. */
  public Optional<SlurmJob> deallocateGpusForJob(int jobId) {
    Optional<SlurmJob> job = job(jobId);
    if (job.isEmpty()) {
      return job;
    }
    jobs.remove(job.get());
    findNode(job.get().nodeId()).ifPresent(this::refreshAllocationState);
    LOG.debug("Released job {}", jobId);
    return job;
  }

  private void refreshAllocationState(DgxNode node) {
    if (UNSCHEDULABLE.contains(node.slurmState())) {
      return;
    }
    int used = gpusInUse(node.id());
    if (used == 0) {
      node.slurmState("idle");
    } else if (used >= node.gpus().size()) {
      node.slurmState("alloc");
    } else {
      node.slurmState("mix");
    }
  }

  /**
   * Replaces a GPU snapshot with the result of applying {@code update} to its builder.
   *
   * @return false when the node or GPU does not exist
   */
  public boolean updateGpu(String nodeId, int gpuIndex, UnaryOperator<Gpu.Builder> update) {
    Optional<DgxNode> node = findNode(nodeId);
    if (node.isEmpty()) {
      return false;
    }
    Optional<Gpu> gpu = node.get().gpu(gpuIndex);
    if (gpu.isEmpty()) {
      return false;
    }
    Gpu updated = update.apply(gpu.get().toBuilder()).index(gpuIndex).build();
    node.get().replaceGpu(updated);
    LOG.debug("Updated GPU {} on {}: health {}", gpuIndex, nodeId, updated.healthStatus());
    return true;
  }

  /** Records an XID on a GPU, stamped with the next simulated event time. */
  public Optional<XidError> addXidError(String nodeId, int gpuIndex, int code) {
    XidError error = new XidError(code, nextEventTime());
    boolean applied = updateGpu(nodeId, gpuIndex, b -> b.addXidError(error));
    return applied ? Optional.of(error) : Optional.empty();
  }

  /** Changes the state of one HCA port (link degradation). */
  public boolean setPortState(
      String nodeId, String caName, int portNumber, String state, String physicalState) {
    return updatePort(nodeId, caName, portNumber, p -> p.withState(state, physicalState));
  }

  /** Replaces the error counters of one HCA port. */
  public boolean setPortErrors(String nodeId, String caName, int portNumber, PortErrors errors) {
    return updatePort(nodeId, caName, portNumber, p -> p.withErrors(errors));
  }

  private boolean updatePort(
      String nodeId, String caName, int portNumber, UnaryOperator<InfiniBandPort> update) {
    Optional<DgxNode> node = findNode(nodeId);
    if (node.isEmpty()) {
      return false;
    }
    for (InfiniBandHca hca : node.get().hcas()) {
      if (!hca.caName().equals(caName)) {
        continue;
      }
      List<InfiniBandPort> ports = new ArrayList<>();
      boolean found = false;
      for (InfiniBandPort port : hca.ports()) {
        if (port.portNumber() == portNumber) {
          ports.add(update.apply(port));
          found = true;
        } else {
          ports.add(port);
        }
      }
      if (found) {
        node.get()
            .replaceHca(
                new InfiniBandHca(
                    hca.caName(), hca.model(), hca.firmwareVersion(), hca.pciAddress(), ports));
        LOG.debug("Updated port {}/{} on {}", caName, portNumber, nodeId);
        return true;
      }
    }
    return false;
  }

  /** Every systemd unit runs until something stops it. */
  public boolean isServiceActive(String nodeId, String service) {
    String id = findNode(nodeId).map(DgxNode::id).orElse(nodeId);
    return !stoppedServices.getOrDefault(id, Set.of()).contains(service);
  }

  /**
   * Starts or stops a systemd unit on a node.
   *
   * @return false when the node does not exist
   */
  public boolean setServiceActive(String nodeId, String service, boolean active) {
    Optional<DgxNode> node = findNode(nodeId);
    if (node.isEmpty()) {
      return false;
    }
    Set<String> stopped = stoppedServices.computeIfAbsent(node.get().id(), k -> new HashSet<>());
    if (active) {
      stopped.remove(service);
    } else {
      stopped.add(service);
    }
    LOG.debug("{} {} on {}", active ? "Started" : "Stopped", service, node.get().id());
    return true;
  }

  /** Deterministic clock for injected events: two hours after boot plus one minute per event. */
  private Instant nextEventTime() {
    return config.bootTime().plus(Duration.ofHours(2)).plus(Duration.ofMinutes(eventCount++));
  }
}
