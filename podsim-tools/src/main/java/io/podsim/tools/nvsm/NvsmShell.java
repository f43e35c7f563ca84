package io.podsim.tools.nvsm;

import io.podsim.core.cluster.DgxNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The nvsm line interpreter. {@link #apply} maps a state and a line to the next state and the
 * output; it never touches the cluster.
 */
public final class NvsmShell {
  static final String NO_DAEMON =
      "ERROR: Cannot connect to NVSM daemon. Is the nvsm service running?";

  private static final Set<String> SYSTEM_VERBS = Set.of("cd", "show", "dump");

  private static final DateTimeFormatter DUMP_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

  /**
   * Result of one line.
   *
   * @param next state after the line, null when the session ended
   * @param output text to print
   * @param exitCode 0 on success
   */
  public record Step(NvsmState next, String output, int exitCode) {
    public boolean ended() {
      return next == null;
    }
  }

  private NvsmShell() {}

  /**
   * Interprets one line.
   *
   * @param state current position
   * @param line line as typed
   * @param node the system nvsm reports on, empty when the daemon is unreachable
   * @param now time stamped on reports
   */
  public static Step apply(NvsmState state, String line, Optional<DgxNode> node, Instant now) {
    String trimmed = line == null ? "" : line.trim();
    if (trimmed.isEmpty()) {
      return new Step(state, "", 0);
    }
    List<String> tokens = Arrays.asList(trimmed.split("\\s+"));
    String verb = tokens.get(0).toLowerCase(Locale.ROOT);
    List<String> args = tokens.subList(1, tokens.size());
    if (verb.equals("exit") || verb.equals("quit")) {
      return new Step(null, "", 0);
    }
    if (verb.equals("help")) {
      return new Step(state, help(), 0);
    }
    if (!SYSTEM_VERBS.contains(verb)) {
      return new Step(state,
          "ERROR: Unknown verb '" + tokens.get(0) + "'. Type 'help' for a list of verbs.", 1);
    }
    if (node.isEmpty()) {
      return new Step(state, NO_DAEMON, 1);
    }
    NvsmTarget root = NvsmTarget.tree(node.get());
    return switch (verb) {
      case "cd" -> cd(state, args, root);
      case "show" -> show(state, args, root, node.get(), now);
      default -> dump(state, args, node.get(), now);
    };
  }

  private static Step cd(NvsmState state, List<String> args, NvsmTarget root) {
    String target = args.isEmpty() ? NvsmState.DEFAULT_PATH : state.normalize(args.get(0));
    if (root.resolve(target).isEmpty()) {
      return new Step(state, missing(target, state, root), 1);
    }
    return new Step(state.cd(target), "", 0);
  }

  private static Step show(
      NvsmState state, List<String> args, NvsmTarget root, DgxNode node, Instant now) {
    if (!args.isEmpty() && args.get(0).equals("health")) {
      boolean detailed = args.contains("--detailed") || args.contains("-detailed");
      return new Step(state, NvsmHealth.render(node, now, detailed), 0);
    }
    String path = args.isEmpty() ? state.path() : state.normalize(args.get(0));
    Optional<NvsmTarget> target = root.resolve(path);
    if (target.isEmpty()) {
      return new Step(state, missing(path, state, root), 1);
    }
    return new Step(state, describe(path, target.get()), 0);
  }

  private static Step dump(NvsmState state, List<String> args, DgxNode node, Instant now) {
    if (args.isEmpty() || !args.get(0).equals("health")) {
      return new Step(state, "Usage: dump health", 1);
    }
    String file = "/tmp/nvsm-health-" + node.hostname() + "-" + DUMP_STAMP.format(now)
        + ".tar.xz";
    return new Step(state,
        "Health dump started. This may take a few minutes.\n"
            + "Collecting health information from " + node.hostname() + "...\n"
            + "Writing output to " + file + "\n"
            + "Done.\n",
        0);
  }

  private static String missing(String path, NvsmState state, NvsmTarget root) {
    List<String> available = root.resolve(state.path()).map(NvsmTarget::childNames)
        .orElse(List.of());
    return "ERROR: Target " + path + " does not exist\n"
        + "Available targets: " + (available.isEmpty() ? "(none)" : String.join(", ", available));
  }

  static String describe(String path, NvsmTarget target) {
    StringBuilder sb = new StringBuilder(path).append('\n');
    if (!target.properties().isEmpty()) {
      sb.append("Properties:\n");
      for (Map.Entry<String, String> e : target.properties().entrySet()) {
        sb.append("    ").append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
      }
    }
    if (!target.children().isEmpty()) {
      sb.append("Targets:\n");
      target.childNames().forEach(name -> sb.append("    ").append(name).append('\n'));
    }
    sb.append("Verbs:\n");
    target.verbs().forEach(v -> sb.append("    ").append(v).append('\n'));
    return sb.toString();
  }

  static String help() {
    return "NVIDIA System Management (NVSM) Interactive Shell\n\n"
        + "Verbs:\n"
        + "  cd [target]              Change the current target (absolute, relative or ..)\n"
        + "  show [target]            Show properties, targets and verbs of a target\n"
        + "  show health [--detailed] Run the system health checks\n"
        + "  dump health              Collect a health snapshot into a tarball\n"
        + "  help                     Show this help\n"
        + "  exit, quit               Leave nvsm\n";
  }
}
