package io.podsim.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static knowledge about the simulated command set: command names, their subcommands and common
 * flags, the simulated filesystem and the systemd services. The parser uses it to recognise
 * subcommands; completion uses all of it. Nothing here changes at runtime.
 */
public final class CommandGrammar {

  private static final CommandGrammar STANDARD = buildStandard();

  private final Set<String> commands;
  private final Map<String, List<String>> subcommands;
  private final Map<String, List<String>> flags;
  private final Map<String, List<String>> paths;
  private final List<String> services;

  private CommandGrammar(
      Set<String> commands,
      Map<String, List<String>> subcommands,
      Map<String, List<String>> flags,
      Map<String, List<String>> paths,
      List<String> services) {
    this.commands = Collections.unmodifiableSet(new TreeSet<>(commands));
    this.subcommands = copy(subcommands);
    this.flags = copy(flags);
    this.paths = copy(paths);
    this.services = List.copyOf(services);
  }

  private static Map<String, List<String>> copy(Map<String, List<String>> source) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    source.forEach((k, v) -> result.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(result);
  }

  /** The built-in grammar of the simulated DGX environment. */
  public static CommandGrammar standard() {
    return STANDARD;
  }

  /** Sorted names of every command the terminal knows about. */
  public Set<String> commands() {
    return commands;
  }

  public List<String> subcommandsOf(String command) {
    return subcommands.getOrDefault(command, List.of());
  }

  public boolean isSubcommand(String command, String token) {
    return subcommandsOf(command).contains(token);
  }

  public List<String> flagsOf(String command) {
    return flags.getOrDefault(command, List.of());
  }

  /** Simulated directory listing keyed by absolute directory path. */
  public Map<String, List<String>> paths() {
    return paths;
  }

  public List<String> services() {
    return services;
  }

  /**
   * Returns a grammar that additionally knows the given command with its subcommands. Existing
   * entries are kept and extended.
   */
  public CommandGrammar withCommand(String command, List<String> extraSubcommands) {
    Set<String> newCommands = new LinkedHashSet<>(commands);
    newCommands.add(command);
    Map<String, List<String>> newSubs = new LinkedHashMap<>(subcommands);
    Set<String> merged = new LinkedHashSet<>(subcommandsOf(command));
    merged.addAll(extraSubcommands);
    newSubs.put(command, new ArrayList<>(merged));
    return new CommandGrammar(newCommands, newSubs, flags, paths, services);
  }

  private static CommandGrammar buildStandard() {
    Set<String> commands =
        new LinkedHashSet<>(
            List.of(
                "nvidia-smi", "nvsm", "dcgmi", "ipmitool", "cmsh",
                "sinfo", "squeue", "scontrol", "sbatch", "scancel", "srun", "sacct",
                "lspci", "journalctl", "dmesg", "nvidia-bug-report.sh",
                "ibstat", "ibdev2netdev", "iblinkinfo", "ibdiagnet", "perfquery", "ibnetdiscover",
                "ibportstate", "ibporterrors",
                "docker", "nvidia-docker", "singularity", "enroot",
                "systemctl", "nv-fabricmanager", "mst", "mlxconfig",
                "lscpu", "free", "dmidecode", "hostnamectl", "timedatectl",
                "df", "top", "uname", "hostname", "uptime",
                "cat", "ls", "cd", "pwd", "echo", "history", "clear", "help", "exit"));

    Map<String, List<String>> subs = new LinkedHashMap<>();
    subs.put("nvidia-smi", List.of("topo", "nvlink", "mig"));
    subs.put(
        "dcgmi",
        List.of("discovery", "health", "diag", "stats", "dmon", "group", "nvlink"));
    subs.put(
        "ipmitool",
        List.of("sdr", "sensor", "mc", "chassis", "sel", "lan", "fru", "user", "power"));
    subs.put("scontrol", List.of("show", "update", "reconfigure", "ping"));
    subs.put("cmsh", List.of("device", "category", "softwareimage", "partition"));
    subs.put("nvsm", List.of("show", "dump"));
    subs.put(
        "docker",
        List.of("run", "ps", "images", "pull", "exec", "logs", "stop", "rm", "inspect", "build"));
    subs.put("nvidia-docker", List.of("run", "ps", "images", "pull", "exec"));
    subs.put("singularity", List.of("exec", "run", "shell", "pull", "build", "inspect"));
    subs.put("enroot", List.of("import", "create", "start", "list", "remove"));
    subs.put(
        "systemctl",
        List.of(
            "start", "stop", "restart", "status", "enable", "disable", "is-active",
            "list-units", "daemon-reload"));
    subs.put("mst", List.of("start", "stop", "status", "restart"));
    subs.put(
        "nv-fabricmanager",
        List.of("status", "query", "start", "stop", "restart", "config", "diag", "topo"));
    subs.put("hostnamectl", List.of("status", "set-hostname"));
    subs.put("timedatectl", List.of("status", "set-timezone", "set-ntp", "list-timezones"));

    Map<String, List<String>> flags = new LinkedHashMap<>();
    flags.put(
        "nvidia-smi",
        List.of(
            "-L", "-q", "-i", "-d", "-pm", "-pl", "--query-gpu", "--format",
            "--help", "--version"));
    flags.put("dcgmi", List.of("-l", "-g", "-c", "-r", "-e", "-d", "-j", "--help", "--version"));
    flags.put("ipmitool", List.of("-I", "-H", "-U", "-P", "-c", "-V"));
    flags.put("sinfo", List.of("-N", "-l", "-o", "-p", "-R", "-s", "--help"));
    flags.put("squeue", List.of("-u", "-j", "-p", "-l", "-o", "-w", "--help"));
    flags.put("sbatch", List.of("--gres", "--gpus", "-N", "-n", "-p", "-w", "-J", "--help"));
    flags.put("scancel", List.of("-u", "-n", "--help"));
    flags.put("lspci", List.of("-v", "-vv", "-vvv", "-d", "-s", "-nn", "-k"));
    flags.put("journalctl", List.of("-b", "-k", "-u", "-p", "-n", "--no-pager"));
    flags.put("dmesg", List.of("-T", "-l", "--help"));
    flags.put(
        "nvidia-bug-report.sh",
        List.of(
            "--output-file", "--verbose", "--no-compress", "--extra-system-data", "--help",
            "--version"));
    flags.put("ibstat", List.of("-l", "-s", "-p", "-V", "--help"));
    flags.put("ibdev2netdev", List.of("-v"));
    flags.put("ibportstate", List.of("-V", "--help"));
    flags.put("ibporterrors", List.of("-C", "-P", "-V", "--help"));
    flags.put("iblinkinfo", List.of("-v", "-l", "-V", "--help"));
    flags.put("perfquery", List.of("-x", "-r", "-R", "-V", "--help"));
    flags.put("ibdiagnet", List.of("-o", "--detailed", "--signal-quality", "-V", "--help"));
    flags.put("ibnetdiscover", List.of("-H", "-S", "-p", "-V", "--help"));
    flags.put("nv-fabricmanager", List.of("--help", "--version"));
    flags.put("free", List.of("-h", "-g", "-m", "--help"));
    flags.put("dmidecode", List.of("-t", "--help"));
    flags.put("nvsm", List.of("--help", "--version"));
    flags.put("cmsh", List.of("--help", "--version"));

    Map<String, List<String>> paths = new LinkedHashMap<>();
    paths.put(
        "/",
        List.of("bin", "boot", "dev", "etc", "home", "opt", "proc", "root", "sys", "tmp", "usr",
            "var"));
    paths.put("/root", List.of(".bashrc", "train.sh", "jobs"));
    paths.put("/etc", List.of("hosts", "fstab", "os-release", "nvidia", "slurm"));
    paths.put("/etc/slurm", List.of("slurm.conf", "gres.conf", "cgroup.conf"));
    paths.put("/etc/nvidia", List.of("nvidia-persistenced.conf", "fabricmanager.cfg"));
    paths.put("/var", List.of("log", "lib", "tmp"));
    paths.put("/var/log", List.of("syslog", "kern.log", "nvidia-installer.log", "slurm"));
    paths.put("/opt", List.of("nvidia", "dgx"));
    paths.put("/home", List.of("user"));
    paths.put("/tmp", List.of());

    List<String> services =
        List.of(
            "nvidia-fabricmanager", "nvidia-persistenced", "nvidia-dcgm", "nvsm", "nvsm-core",
            "slurmd", "slurmctld", "slurmdbd", "munge", "docker", "containerd", "openibd",
            "opensm", "sshd", "chronyd");

    return new CommandGrammar(commands, subs, flags, paths, services);
  }
}
