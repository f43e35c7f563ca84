package io.podsim.tools.slurm;

import io.podsim.core.cluster.ClusterStore;
import io.podsim.core.cluster.DgxNode;
import io.podsim.core.cluster.SlurmJob;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Key=value blocks printed by {@code scontrol show}. */
final class ScontrolReport {
  static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

  private ScontrolReport() {}

  static String node(ClusterStore store, DgxNode node, Optional<String> reason) {
    int gpus = node.gpus().size();
    int used = store.gpusInUse(node.id());
    int cpuAlloc = gpus == 0 ? 0 : node.cpuCount() * used / gpus;
    long memory = SlurmSimulator.memoryMb(node);
    long allocMem = gpus == 0 ? 0 : memory * used / gpus;
    StringBuilder sb = new StringBuilder();
    sb.append("NodeName=").append(node.id()).append(" Arch=x86_64 CoresPerSocket=")
        .append(node.cpuCount() / 2).append('\n');
    sb.append(String.format(Locale.ROOT, "   CPUAlloc=%d CPUEfctv=%d CPUTot=%d CPULoad=%.2f\n",
        cpuAlloc, node.cpuCount(), node.cpuCount(), used > 0 ? cpuAlloc * 0.93 : 0.05));
    sb.append("   AvailableFeatures=").append(node.gresType()).append(",nvlink\n");
    sb.append("   ActiveFeatures=").append(node.gresType()).append(",nvlink\n");
    sb.append("   Gres=").append(SlurmSimulator.gres(node)).append('\n');
    sb.append("   GresUsed=gpu:").append(node.gresType()).append(':').append(used).append('\n');
    sb.append("   NodeAddr=").append(node.hostname()).append(" NodeHostName=")
        .append(node.hostname()).append(" Version=").append(SlurmSimulator.VERSION).append('\n');
    sb.append("   OS=Linux ").append(node.kernelVersion()).append(" #1 SMP ")
        .append(node.osVersion()).append('\n');
    sb.append("   RealMemory=").append(memory).append(" AllocMem=").append(allocMem)
        .append(" FreeMem=").append(memory - allocMem).append(" Sockets=2 Boards=1\n");
    sb.append("   State=").append(state(node.slurmState(), used))
        .append(" ThreadsPerCore=1 TmpDisk=0 Weight=1 Owner=N/A MCS_label=N/A\n");
    sb.append("   Partitions=").append(String.join(",", store.partitions())).append('\n');
    String boot = TIMESTAMP.format(store.bootTime());
    sb.append("   BootTime=").append(boot).append(" SlurmdStartTime=").append(boot).append('\n');
    sb.append(String.format("   CfgTRES=cpu=%d,mem=%dM,billing=%d,gres/gpu=%d\n",
        node.cpuCount(), memory, node.cpuCount(), gpus));
    sb.append("   AllocTRES=");
    if (used > 0) {
      sb.append(String.format("cpu=%d,mem=%dM,gres/gpu=%d", cpuAlloc, allocMem, used));
    }
    sb.append('\n');
    reason.ifPresent(r -> sb.append("   Reason=").append(r).append(" [root@")
        .append(TIMESTAMP.format(store.bootTime().plus(Duration.ofHours(2)))).append("]\n"));
    return sb.toString();
  }

  static String partition(ClusterStore store, String name) {
    List<DgxNode> nodes = store.nodes();
    int cpus = nodes.stream().mapToInt(DgxNode::cpuCount).sum();
    long memory = nodes.stream().mapToLong(SlurmSimulator::memoryMb).sum();
    int gpus = nodes.stream().mapToInt(n -> n.gpus().size()).sum();
    boolean isDefault = store.partitions().indexOf(name) == 0;
    return "PartitionName=" + name + "\n"
        + "   AllowGroups=ALL AllowAccounts=ALL AllowQos=ALL\n"
        + "   Default=" + (isDefault ? "YES" : "NO") + " QoS=N/A\n"
        + "   MaxNodes=UNLIMITED MaxTime=UNLIMITED MinNodes=0\n"
        + "   Nodes=" + Hostlist.compress(nodes.stream().map(DgxNode::id).toList()) + "\n"
        + "   State=UP TotalCPUs=" + cpus + " TotalNodes=" + nodes.size() + "\n"
        + "   TRES=cpu=" + cpus + ",mem=" + memory + "M,node=" + nodes.size() + ",billing=" + cpus
        + ",gres/gpu=" + gpus + "\n";
  }

  static String config(ClusterStore store, Instant now) {
    return String.join("\n",
        "Configuration data as of " + TIMESTAMP.format(now),
        "AccountingStorageTRES = cpu,mem,energy,node,billing,fs/disk,vmem,pages,gres/gpu",
        "ClusterName = " + store.name(),
        "GresTypes = gpu",
        "MpiDefault = pmix",
        "ProctrackType = proctrack/cgroup",
        "SchedulerType = sched/backfill",
        "SelectType = select/cons_tres",
        "SelectTypeParameters = CR_CORE_MEMORY",
        "SlurmctldHost[0] = " + store.controlMachine(),
        "SlurmctldPort = 6817",
        "SlurmdPort = 6818",
        "SLURM_VERSION = " + SlurmSimulator.VERSION,
        "TaskPlugin = task/affinity,task/cgroup",
        "",
        "Slurmctld(primary) at " + store.controlMachine() + " is UP",
        "");
  }

  static String job(ClusterStore store, SlurmJob job, Instant now) {
    DgxNode node = store.findNode(job.nodeId()).orElse(null);
    int cpus = node == null || node.gpus().isEmpty()
        ? 1
        : Math.max(1, node.cpuCount() * job.gpuCount() / node.gpus().size());
    long memory = node == null || node.gpus().isEmpty()
        ? 0
        : SlurmSimulator.memoryMb(node) * job.gpuCount() / node.gpus().size();
    int uid = "root".equals(job.user()) ? 0 : 1001;
    return "JobId=" + job.jobId() + " JobName=" + job.name() + "\n"
        + "   UserId=" + job.user() + "(" + uid + ") GroupId=" + job.user() + "(" + uid + ")\n"
        + "   Priority=4294901759 Nice=0 Account=(null) QOS=normal\n"
        + "   JobState=" + job.state() + " Reason=None Dependency=(null)\n"
        + "   RunTime=" + SlurmSimulator.elapsed(job, now, true) + " TimeLimit=UNLIMITED\n"
        + "   SubmitTime=" + TIMESTAMP.format(job.submitTime()) + " StartTime="
        + TIMESTAMP.format(job.submitTime()) + "\n"
        + "   Partition=" + job.partition() + " AllocNode:Sid=" + store.controlMachine() + ":4242\n"
        + "   NodeList=" + job.nodeId() + "\n"
        + "   NumNodes=1 NumCPUs=" + cpus + " NumTasks=1 CPUs/Task=1\n"
        + "   TRES=cpu=" + cpus + ",mem=" + memory + "M,node=1,billing=" + cpus + ",gres/gpu="
        + job.gpuCount() + "\n"
        + "   TresPerNode=gres:gpu:" + job.gpuCount() + "\n"
        + "   WorkDir=/root\n";
  }

  /** Node state as scontrol spells it. */
  static String state(String slurmState, int used) {
    return switch (slurmState) {
      case "idle" -> "IDLE";
      case "alloc" -> "ALLOCATED";
      case "mix" -> "MIXED";
      case "drain" -> used > 0 ? "MIXED+DRAIN" : "IDLE+DRAIN";
      default -> slurmState.toUpperCase(Locale.ROOT);
    };
  }
}
