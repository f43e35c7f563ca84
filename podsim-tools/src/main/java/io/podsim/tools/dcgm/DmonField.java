package io.podsim.tools.dcgm;

import io.podsim.core.cluster.Gpu;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/** DCGM field ids that {@code dcgmi dmon -e} can sample. */
enum DmonField {
  SM_CLOCK(100, "SMCLK", g -> String.valueOf(g.clocksSm())),
  MEM_CLOCK(101, "MMCLK", g -> String.valueOf(g.clocksMem())),
  GPU_TEMP(150, "TMPTR", g -> String.valueOf(g.temperature())),
  POWER_USAGE(155, "POWER", g -> String.format(Locale.ROOT, "%.3f", g.powerDraw())),
  TOTAL_ENERGY(
      156, "TOTEC", g -> String.valueOf(Math.round(g.powerDraw() * 7200 * 1000))),
  GPU_UTIL(203, "GPUTL", g -> String.valueOf(g.utilization())),
  MEM_COPY_UTIL(
      204,
      "MCUTL",
      g -> String.valueOf(g.memoryTotal() == 0 ? 0 : g.memoryUsed() * 100 / g.memoryTotal())),
  FB_TOTAL(250, "FBTTL", g -> String.valueOf(g.memoryTotal())),
  FB_FREE(251, "FBFRE", g -> String.valueOf(g.memoryTotal() - g.memoryUsed())),
  FB_USED(252, "FBUSD", g -> String.valueOf(g.memoryUsed()));

  static final String DEFAULT_FIELDS = "203,204,150,155";

  private final int id;
  private final String tag;
  private final Function<Gpu, String> sampler;

  DmonField(int id, String tag, Function<Gpu, String> sampler) {
    this.id = id;
    this.tag = tag;
    this.sampler = sampler;
  }

  static Optional<DmonField> byId(int id) {
    return Arrays.stream(values()).filter(f -> f.id == id).findFirst();
  }

  int id() {
    return id;
  }

  String tag() {
    return tag;
  }

  String sample(Gpu gpu) {
    return sampler.apply(gpu);
  }
}
