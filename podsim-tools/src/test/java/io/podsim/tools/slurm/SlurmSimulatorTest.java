package io.podsim.tools.slurm;

import static org.junit.jupiter.api.Assertions.*;

import io.podsim.core.CommandResult;
import io.podsim.tools.ToolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SlurmSimulatorTest {
  private ToolFixture slurm;

  @BeforeEach
  void setUp() {
    slurm = ToolFixture.of(new SlurmSimulator());
  }

  @Test
  void sinfoGroupsNodesByState() {
    String out = slurm.output("sinfo");

    assertTrue(out.startsWith("PARTITION AVAIL  TIMELIMIT  NODES  STATE NODELIST\n"));
    assertTrue(out.contains("gpu*         up   infinite      7   idle dgx-[00,02-07]"));
    assertTrue(out.contains("gpu*         up   infinite      1  alloc dgx-01"));
    assertTrue(out.contains("debug        up   infinite"));
  }

  @Test
  void sinfoPartitionFilterAndNodeView() {
    assertFalse(slurm.output("sinfo -p debug").contains("gpu*"));
    assertFalse(slurm.output("sinfo --partition=gpu").contains("debug"));

    String nodes = slurm.output("sinfo -N -h -p gpu");
    assertEquals(8, nodes.split("\n").length);
    assertTrue(nodes.startsWith("dgx-00         1      gpu* idle"));
  }

  @Test
  void sinfoFormatRendersGres() {
    String out = slurm.output("sinfo -p gpu -o \"%n %G\"");

    assertTrue(out.startsWith("HOSTNAMES GRES\n"));
    assertTrue(out.contains("dgx-node01 gpu:h100:8"));
    assertTrue(out.contains("dgx-node08 gpu:h100:8"));
  }

  @Test
  void sinfoFormatAggregatesIdenticalNodes() {
    String out = slurm.output("sinfo -h -p gpu -o \"%P %t %D %N\"");

    assertEquals("gpu* idle 7 dgx-[00,02-07]\ngpu* alloc 1 dgx-01\n", out);
    assertNotEquals(0, slurm.run("sinfo -o \"%Q\"").exitCode());
  }

  @Test
  void sinfoSummary() {
    assertTrue(slurm.output("sinfo -s -p gpu").contains("1/7/0/8 dgx-[00-07]"));
  }

  @Test
  void scontrolShowNodeReportsGres() {
    String idle = slurm.output("scontrol show node dgx-00");
    assertTrue(idle.startsWith("NodeName=dgx-00 "));
    assertTrue(idle.contains("Gres=gpu:h100:8"));
    assertTrue(idle.contains("GresUsed=gpu:h100:0"));
    assertTrue(idle.contains("State=IDLE"));

    String busy = slurm.output("scontrol show node dgx-node02");
    assertTrue(busy.contains("GresUsed=gpu:h100:8"));
    assertTrue(busy.contains("State=ALLOCATED"));
    assertTrue(busy.contains("AllocTRES=cpu=112,"));

    assertEquals(8, slurm.output("scontrol show nodes").split("NodeName=").length - 1);
    assertNotEquals(0, slurm.run("scontrol show node dgx-99").exitCode());
  }

  @Test
  void scontrolShowConfigPartitionAndJob() {
    assertTrue(slurm.output("scontrol show config").contains("GresTypes = gpu"));
    assertTrue(slurm.output("scontrol show partition gpu").contains("Default=YES"));
    assertTrue(slurm.output("scontrol show partition debug").contains("Default=NO"));

    String job = slurm.output("scontrol show job 1000");
    assertTrue(job.startsWith("JobId=1000 JobName=llm-pretrain"));
    assertTrue(job.contains("RunTime=01:00:00"));
    assertTrue(job.contains("TresPerNode=gres:gpu:8"));
    assertNotEquals(0, slurm.run("scontrol show job 4242").exitCode());
    assertEquals("Slurmctld(primary) at dgx-headnode is UP", slurm.output("scontrol ping"));
  }

  @Test
  void sbatchAllocatesThroughTheStore() {
    assertEquals("Submitted batch job 1001", slurm.output("sbatch --gres=gpu:4 train.sh"));

    assertEquals(4, slurm.store().gpusInUse("dgx-00"));
    assertTrue(slurm.output("scontrol show node dgx-00").contains("GresUsed=gpu:h100:4"));
    assertTrue(slurm.output("sinfo -N -p gpu").contains("dgx-00         1      gpu* mix"));
    assertTrue(slurm.output("squeue -u root").contains("train.sh"));
  }

  @Test
  void sbatchGresForms() {
    assertTrue(slurm.output("sbatch --gres=gpu:h100:8 train.sh").startsWith("Submitted"));
    assertTrue(slurm.output("sbatch --gpus=2 -J small train.sh").startsWith("Submitted"));
    assertTrue(slurm.output("sbatch -w dgx-03 --exclusive train.sh").startsWith("Submitted"));
    assertEquals(8, slurm.store().gpusInUse("dgx-03"));

    assertTrue(slurm.run("sbatch --gres=gpu:a100:2 train.sh").output()
        .contains("Invalid generic resource"));
    assertTrue(slurm.run("sbatch --gres=gpu:h100:9 train.sh").output()
        .contains("Requested node configuration is not available"));
    assertTrue(slurm.run("sbatch -w dgx-01 --gres=gpu:1 train.sh").output()
        .contains("Requested node configuration is not available"));
    assertTrue(slurm.run("sbatch -p nope train.sh").output().contains("invalid partition"));
    assertTrue(slurm.run("sbatch --gres=gpu:2").output().contains("Batch script is empty"));
  }

  @Test
  void squeueShowsSeededJob() {
    String out = slurm.output("squeue");

    assertTrue(out.contains("JOBID PARTITION     NAME     USER ST       TIME  NODES"));
    assertTrue(out.contains("1000       gpu llm-pret    mlops  R    1:00:00      1 dgx-01"));
    assertEquals("", slurm.output("squeue -h -u root"));
    assertEquals("1000 mlops gres/gpu:8\n", slurm.output("squeue -h -o \"%i %u %b\""));
    assertTrue(slurm.run("squeue -j 77").output().contains("Invalid job id"));
  }

  @Test
  void scancelReleasesGpus() {
    assertEquals("", slurm.output("scancel 1000"));

    assertEquals(0, slurm.store().gpusInUse("dgx-01"));
    assertEquals("idle", slurm.store().findNode("dgx-01").orElseThrow().slurmState());
    assertTrue(slurm.run("scancel 1000").output().contains("Invalid job id specified"));
    assertNotEquals(0, slurm.run("scancel abc").exitCode());
    assertNotEquals(0, slurm.run("scancel").exitCode());
  }

  @Test
  void scancelByUser() {
    slurm.output("sbatch --gres=gpu:1 a.sh");
    slurm.output("sbatch --gres=gpu:1 b.sh");

    slurm.output("scancel -u root");

    assertEquals(1, slurm.store().jobs().size());
    assertEquals(1000, slurm.store().jobs().get(0).jobId());
  }

  @Test
  void scancelByNameCancelsEveryMatch() {
    slurm.output("sbatch -J sweep --gres=gpu:1 a.sh");
    slurm.output("sbatch -J sweep --gres=gpu:1 b.sh");
    slurm.output("sbatch -J keep --gres=gpu:1 c.sh");

    CommandResult result = slurm.run("scancel -n sweep");

    assertEquals(0, result.exitCode());
    assertEquals(2, slurm.store().jobs().size());
    assertTrue(slurm.store().jobs().stream().noneMatch(j -> "sweep".equals(j.name())));
  }

  @Test
  void drainAndResume() {
    CommandResult noReason = slurm.run("scontrol update nodename=dgx-00 state=drain");
    assertTrue(noReason.output().contains("You must specify a reason"));

    slurm.output("scontrol update nodename=dgx-00 state=drain reason=maintenance");
    assertEquals("drain", slurm.store().findNode("dgx-00").orElseThrow().slurmState());
    assertTrue(slurm.output("sinfo -R").contains("maintenance"));
    assertTrue(slurm.output("scontrol show node dgx-00").contains("Reason=maintenance"));
    assertTrue(slurm.run("sbatch -w dgx-00 --gres=gpu:1 x.sh").output()
        .contains("not available"));

    slurm.output("scontrol update NodeName=dgx-00 State=RESUME");
    assertEquals("idle", slurm.store().findNode("dgx-00").orElseThrow().slurmState());
    assertFalse(slurm.output("sinfo -R").contains("maintenance"));
  }

  @Test
  void updateRejectsBadInput() {
    assertTrue(slurm.run("scontrol update nodename=dgx-42 state=idle").output()
        .contains("Invalid node name"));
    assertTrue(slurm.run("scontrol update nodename=dgx-00 state=sleepy").output()
        .contains("Invalid input: state=sleepy"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"sinfo", "squeue", "scontrol", "sbatch", "scancel"})
  void helpHasDescriptionAndOptions(String tool) {
    String out = slurm.output(tool + " --help");

    assertTrue(out.contains(tool));
    assertTrue(out.contains("Description:"));
    assertTrue(out.contains("Options:"));
  }

  @Test
  void sbatchHelpMentionsGpus() {
    assertTrue(slurm.output("sbatch --help").contains("--gres=gpu"));
  }

  @Test
  void unknownFlag() {
    CommandResult result = slurm.run("sinfo --bogus");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("unrecognized option '--bogus'"));
  }

  @Test
  void noController() {
    CommandResult result = ToolFixture.detached(new SlurmSimulator(), "squeue");

    assertEquals(1, result.exitCode());
    assertTrue(result.output().contains("Unable to contact slurm controller"));
  }
}
