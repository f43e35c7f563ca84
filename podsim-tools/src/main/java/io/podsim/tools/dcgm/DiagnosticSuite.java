package io.podsim.tools.dcgm;

import io.podsim.core.cluster.FaultRules;
import io.podsim.core.cluster.Gpu;
import io.podsim.core.cluster.HealthStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * The test plan of {@code dcgmi diag}. Level 1 runs the deployment checks, level 2 adds the
 * integration and hardware checks, level 3 adds the stress tests. A test fails on the GPUs its
 * predicate flags.
 */
final class DiagnosticSuite {

  private record Check(
      String section, String name, int level, Predicate<Gpu> fails, boolean warn) {}

  private static final List<Check> TESTS =
      List.of(
          new Check("Deployment", "Denylist", 1, g -> false, false),
          new Check("Deployment", "NVML Library", 1, g -> false, false),
          new Check("Deployment", "CUDA Main Library", 1, g -> false, false),
          new Check("Deployment", "Permissions and OS Blocks", 1, g -> false, false),
          new Check("Deployment", "Persistence Mode", 1, g -> !g.persistenceMode(), true),
          new Check("Deployment", "Environment Variables", 1, g -> false, false),
          new Check("Deployment", "Page Retirement/Row Remap", 1,
              g -> g.eccErrors().aggregateDoubleBit() > 0, false),
          new Check("Deployment", "Graphics Processes", 1, g -> false, false),
          new Check("Deployment", "Inforom", 1, g -> false, false),
          new Check("Integration", "PCIe", 2, FaultRules::isOffBus, false),
          new Check("Hardware", "GPU Memory", 2,
              g -> FaultRules.eccStatus(g.eccErrors()) == HealthStatus.CRITICAL, false),
          new Check("Hardware", "Diagnostic", 3,
              g -> g.healthStatus() == HealthStatus.CRITICAL, false),
          new Check("Stress", "Targeted Stress", 3,
              g -> FaultRules.temperatureStatus(g.temperature()) == HealthStatus.CRITICAL, false),
          new Check("Stress", "Targeted Power", 3, FaultRules::isNearPowerLimit, true),
          new Check("Stress", "Memory Bandwidth", 3,
              g -> g.eccErrors().aggregateSingleBit() > FaultRules.SINGLE_BIT_WARNING, true));

  private DiagnosticSuite() {}

  static String run(int level, GpuGroup group, List<Gpu> gpus) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("Running level %d diagnostic on group %d (%d GPUs)...\n\n",
        level, group.id(), gpus.size()));
    sb.append("Successfully ran diagnostic for group.\n");
    BoxTable table = new BoxTable(25, 48).rule().row("Diagnostic", "Result").doubleRule();
    String section = null;
    int failures = 0;
    for (Check test : TESTS) {
      if (test.level() > level) {
        continue;
      }
      if (!test.section().equals(section)) {
        section = test.section();
        table.title("-----  " + section + "  " + "-".repeat(Math.max(1, 62 - section.length())));
      }
      List<String> failing = new ArrayList<>();
      for (Gpu gpu : gpus) {
        if (test.fails().test(gpu)) {
          failing.add(String.valueOf(gpu.index()));
        }
      }
      String result;
      if (failing.isEmpty()) {
        result = "Pass";
      } else {
        failures++;
        result = (test.warn() ? "Warn" : "Fail") + " - GPU: " + String.join(", ", failing);
      }
      table.row(test.name(), result);
    }
    table.rule();
    sb.append(table.render());
    if (failures > 0) {
      sb.append(failures)
          .append(" test(s) reported problems. Review the failing GPUs with 'dcgmi health -c'.\n");
    }
    return sb.toString();
  }
}
