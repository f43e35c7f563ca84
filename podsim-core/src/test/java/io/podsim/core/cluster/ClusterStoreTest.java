package io.podsim.core.cluster;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClusterStoreTest {
  private ClusterStore store;

  @BeforeEach
  void setUp() {
    store = new ClusterStore();
  }

  @Test
  void defaultClusterLayout() {
    assertEquals(8, store.nodes().size());
    DgxNode first = store.nodes().get(0);
    assertEquals("dgx-00", first.id());
    assertEquals("dgx-node01", first.hostname());
    assertEquals(8, first.gpus().size());
    assertEquals(4, first.hcas().size());
    assertEquals("ConnectX-7", first.hcas().get(0).model());
    assertEquals("dgx-h100", first.category());
    assertEquals("h100", first.gresType());
    assertEquals("0000:18:00.0", first.gpus().get(0).pciAddress());
    assertEquals(18, first.gpus().get(0).nvlinks().size());
  }

  @Test
  void seededJobOccupiesSecondNode() {
    assertEquals("alloc", store.findNode("dgx-01").orElseThrow().slurmState());
    assertEquals(8, store.gpusInUse("dgx-01"));
    assertEquals(0, store.gpusInUse("dgx-00"));
    assertEquals("llm-pretrain", store.job(1000).orElseThrow().name());
  }

  @Test
  void nodesResolveByIdOrHostname() {
    assertSame(store.findNode("dgx-03").orElseThrow(), store.findNode("dgx-node04").orElseThrow());
    assertTrue(store.findNode("nope").isEmpty());
    assertTrue(store.findNode(null).isEmpty());
  }

  @Test
  void allocationTracksGpusAndNodeState() {
    SlurmJob job = store.allocateGpusForJob("dgx-00", "train", "root", "gpu", 4).orElseThrow();

    assertEquals(1001, job.jobId());
    assertEquals("RUNNING", job.state());
    assertEquals(4, store.gpusInUse("dgx-00"));
    assertEquals("mix", store.findNode("dgx-00").orElseThrow().slurmState());

    store.allocateGpusForJob("dgx-00", "train2", "root", "gpu", 4).orElseThrow();
    assertEquals("alloc", store.findNode("dgx-00").orElseThrow().slurmState());

    assertTrue(store.allocateGpusForJob("dgx-00", "late", "root", "gpu", 1).isEmpty());

    store.deallocateGpusForJob(job.jobId());
    assertEquals(4, store.gpusInUse("dgx-00"));
    assertEquals("mix", store.findNode("dgx-00").orElseThrow().slurmState());
  }

  @Test
  void drainedNodeRefusesJobs() {
    assertTrue(store.setSlurmState("dgx-02", "DRAIN"));
    assertEquals("drain", store.findNode("dgx-02").orElseThrow().slurmState());

    assertTrue(store.allocateGpusForJob("dgx-02", "x", "root", "gpu", 1).isEmpty());
    assertFalse(store.setSlurmState("dgx-99", "idle"));
  }

  @Test
  void deallocatingUnknownJobIsEmpty() {
    assertTrue(store.deallocateGpusForJob(4242).isEmpty());
  }

  @Test
  void xidInjectionIsTimestampedDeterministically() {
    XidError first = store.addXidError("dgx-00", 0, 79).orElseThrow();
    XidError second = store.addXidError("dgx-00", 1, 48).orElseThrow();

    assertEquals(Instant.parse("2024-03-15T10:00:00Z"), first.timestamp());
    assertEquals(Instant.parse("2024-03-15T10:01:00Z"), second.timestamp());
    Gpu gpu = store.findNode("dgx-00").orElseThrow().gpu(0).orElseThrow();
    assertEquals(HealthStatus.CRITICAL, gpu.healthStatus());
    assertEquals("GPU has fallen off the bus", gpu.xidErrors().get(0).description());
  }

  @Test
  void updateGpuRederivesHealth() {
    assertTrue(store.updateGpu("dgx-00", 2, b -> b.temperature(85)));

    Gpu gpu = store.findNode("dgx-00").orElseThrow().gpu(2).orElseThrow();
    assertEquals(85, gpu.temperature());
    assertEquals(2, gpu.index());
    assertEquals(HealthStatus.WARNING, gpu.healthStatus());
    assertEquals(HealthStatus.WARNING, store.findNode("dgx-00").orElseThrow().healthStatus());
  }

  @Test
  void updateOfMissingGpuFails() {
    assertFalse(store.updateGpu("dgx-00", 12, b -> b.temperature(99)));
    assertFalse(store.updateGpu("dgx-42", 0, b -> b.temperature(99)));
    assertEquals(Optional.empty(), store.addXidError("dgx-42", 0, 79));
  }

  @Test
  void resetRestoresFactoryState() {
    store.addXidError("dgx-00", 0, 79);
    store.allocateGpusForJob("dgx-03", "x", "root", "gpu", 2);
    store.setSlurmState("dgx-04", "down");

    store.reset();

    assertEquals(HealthStatus.OK, store.findNode("dgx-00").orElseThrow().healthStatus());
    assertEquals(1, store.jobs().size());
    assertEquals("idle", store.findNode("dgx-04").orElseThrow().slurmState());
    assertEquals(
        Instant.parse("2024-03-15T10:00:00Z"),
        store.addXidError("dgx-00", 0, 43).orElseThrow().timestamp());
  }

  @Test
  void smallerClustersHaveNoJobs() {
    ClusterStore small = new ClusterStore(() -> ClusterFactory.create(2, "DGX-A100"));

    assertEquals(2, small.nodes().size());
    assertTrue(small.jobs().isEmpty());
    Gpu gpu = small.nodes().get(0).gpus().get(0);
    assertEquals(12, gpu.nvlinks().size());
    assertEquals(400, gpu.powerLimit());
    assertEquals("dgx-a100", small.nodes().get(0).category());
  }

  @Test
  void resetOfFixedConfigurationDiscardsFaults() {
    ClusterConfig config = ClusterFactory.create(2, "DGX-H100");
    ClusterStore fixed = ClusterStore.of(config);

    fixed.addXidError("dgx-00", 0, 79);
    fixed.updateGpu("dgx-00", 1, b -> b.temperature(95));
    fixed.setSlurmState("dgx-01", "drain");
    fixed.reset();

    DgxNode node = fixed.findNode("dgx-00").orElseThrow();
    assertTrue(node.gpus().get(0).xidErrors().isEmpty());
    assertEquals(HealthStatus.OK, node.gpus().get(1).healthStatus());
    assertEquals("idle", fixed.findNode("dgx-01").orElseThrow().slurmState());
    assertTrue(config.nodes().get(0).gpus().get(0).xidErrors().isEmpty());
  }

  @Test
  void portErrorsSurviveStateChanges() {
    PortErrors errors = new PortErrors(7, 1, 0, 0, 0);

    assertTrue(store.setPortErrors("dgx-node01", "mlx5_3", 1, errors));
    assertTrue(store.setPortState("dgx-00", "mlx5_3", 1, "Down", "Polling"));

    InfiniBandPort port = store.findNode("dgx-00").orElseThrow().hcas().get(3).ports().get(0);
    assertEquals(errors, port.errors());
    assertEquals("Down", port.state());
    assertFalse(store.setPortErrors("dgx-00", "mlx5_9", 1, errors));
    assertFalse(store.setPortErrors("dgx-99", "mlx5_0", 1, errors));
  }

  @Test
  void servicesRunUntilStopped() {
    assertTrue(store.isServiceActive("dgx-00", "nvidia-fabricmanager"));

    assertTrue(store.setServiceActive("dgx-node01", "nvidia-fabricmanager", false));
    assertFalse(store.isServiceActive("dgx-00", "nvidia-fabricmanager"));
    assertTrue(store.isServiceActive("dgx-01", "nvidia-fabricmanager"));
    assertFalse(store.setServiceActive("dgx-99", "sshd", false));

    store.setServiceActive("dgx-00", "nvidia-fabricmanager", true);
    assertTrue(store.isServiceActive("dgx-node01", "nvidia-fabricmanager"));
  }

  @Test
  void resetRestartsServicesAndClearsCounters() {
    store.setServiceActive("dgx-02", "slurmd", false);
    store.setPortErrors("dgx-02", "mlx5_0", 1, new PortErrors(3, 0, 0, 0, 0));

    store.reset();

    assertTrue(store.isServiceActive("dgx-02", "slurmd"));
    assertTrue(store.findNode("dgx-02").orElseThrow().hcas().get(0).ports().get(0).errors()
        .isClean());
  }
}
