package io.podsim.tools.dcgm;

import java.util.List;

/**
 * A DCGM GPU group. Groups 0 and 1 are the built-in groups; group 0 always stands for every GPU
 * of the node, whatever its member list says.
 *
 * @param id group id
 * @param name group name
 * @param gpuIds member GPU indices
 */
record GpuGroup(int id, String name, List<Integer> gpuIds) {
  static final int ALL_GPUS = 0;
  static final int ALL_NVSWITCHES = 1;

  GpuGroup {
    gpuIds = List.copyOf(gpuIds);
  }

  boolean isDefault() {
    return id == ALL_GPUS || id == ALL_NVSWITCHES;
  }

  GpuGroup withGpus(List<Integer> ids) {
    return new GpuGroup(id, name, ids);
  }
}
