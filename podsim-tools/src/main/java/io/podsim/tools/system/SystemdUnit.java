package io.podsim.tools.system;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A systemd service installed on every DGX node.
 *
 * @param name unit name without the {@code .service} suffix
 * @param description unit description
 * @param pid main PID while running
 * @param execStart main process command line
 * @param startOffsetSeconds seconds after boot the unit came up
 */
public record SystemdUnit(
    String name, String description, int pid, String execStart, int startOffsetSeconds) {

  public static final String FABRIC_MANAGER = "nvidia-fabricmanager";

  private static final Map<String, SystemdUnit> UNITS = new LinkedHashMap<>();

  static {
    add(new SystemdUnit("chronyd", "chrony, an NTP client/server", 988,
        "/usr/sbin/chronyd -F 1", 9));
    add(new SystemdUnit("containerd", "containerd container runtime", 1402,
        "/usr/bin/containerd", 12));
    add(new SystemdUnit("docker", "Docker Application Container Engine", 1588,
        "/usr/bin/dockerd -H fd:// --containerd=/run/containerd/containerd.sock", 14));
    add(new SystemdUnit("munge", "MUNGE authentication service", 1106,
        "/usr/sbin/munged", 10));
    add(new SystemdUnit("nvidia-dcgm", "NVIDIA DCGM service", 1876,
        "/usr/bin/nv-hostengine -n --service-account nvidia-dcgm", 19));
    add(new SystemdUnit(FABRIC_MANAGER, "NVIDIA fabric manager service", 1820,
        "/usr/bin/nv-fabricmanager -c /usr/share/nvidia/nvswitch/fabricmanager.cfg", 17));
    add(new SystemdUnit("nvidia-persistenced", "NVIDIA Persistence Daemon", 1712,
        "/usr/bin/nvidia-persistenced --user root --persistence-mode --verbose", 15));
    add(new SystemdUnit("nvsm", "NVIDIA System Management service", 1940,
        "/usr/bin/nvsm-api-gateway", 20));
    add(new SystemdUnit("nvsm-core", "NVSM Core Service", 1944, "/usr/bin/nvsm-core", 20));
    add(new SystemdUnit("openibd", "openibd - configure Mellanox devices", 902,
        "/etc/init.d/openibd start bootid=0", 6));
    add(new SystemdUnit("opensm", "OpenSM InfiniBand subnet manager", 1290,
        "/usr/sbin/opensm --daemon", 11));
    add(new SystemdUnit("slurmctld", "Slurm controller daemon", 2010,
        "/usr/sbin/slurmctld -D -s", 22));
    add(new SystemdUnit("slurmd", "Slurm node daemon", 2031, "/usr/sbin/slurmd -D -s", 22));
    add(new SystemdUnit("slurmdbd", "Slurm DBD accounting daemon", 2022,
        "/usr/sbin/slurmdbd -D -s", 22));
    add(new SystemdUnit("sshd", "OpenBSD Secure Shell server", 1034,
        "sshd: /usr/sbin/sshd -D [listener] 0 of 10-100 startups", 9));
  }

  private static void add(SystemdUnit unit) {
    UNITS.put(unit.name(), unit);
  }

  /** Finds a unit by name, with or without the {@code .service} suffix. */
  public static Optional<SystemdUnit> find(String name) {
    String bare = name.endsWith(".service") ? name.substring(0, name.length() - 8) : name;
    return Optional.ofNullable(UNITS.get(bare));
  }

  public static List<SystemdUnit> all() {
    return List.copyOf(UNITS.values());
  }

  public String fileName() {
    return name + ".service";
  }
}
