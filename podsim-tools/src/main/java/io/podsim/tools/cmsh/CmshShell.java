package io.podsim.tools.cmsh;

import io.podsim.core.cluster.ClusterStore;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The cmsh line interpreter. {@link #apply} is a pure function of the current state, the typed
 * line and the cluster; the simulator only stores the state it returns.
 */
public final class CmshShell {

  /**
   * Result of one line.
   *
   * @param next state after the line, null when the session ended
   * @param output text to print
   * @param exitCode 0 on success
   */
  public record Step(CmshState next, String output, int exitCode) {
    public boolean ended() {
      return next == null;
    }
  }

  private CmshShell() {}

  public static Step apply(CmshState state, String line, ClusterStore store) {
    String trimmed = line == null ? "" : line.trim();
    if (trimmed.isEmpty()) {
      return new Step(state, "", 0);
    }
    List<String> tokens = Arrays.asList(trimmed.split("\\s+"));
    String verb = tokens.get(0).toLowerCase(Locale.ROOT);
    List<String> args = tokens.subList(1, tokens.size());

    Optional<CmshMode> mode = CmshMode.byKeyword(verb);
    if (mode.isPresent()) {
      CmshState entered = state.enter(mode.get());
      return args.isEmpty()
          ? new Step(entered, "", 0)
          : apply(entered, String.join(" ", args), store);
    }
    return switch (verb) {
      case "list", "ls" -> list(state, args, store);
      case "use" -> use(state, args);
      case "show" -> show(state, args, store);
      case "status" -> status(state, store);
      case "help", "?" -> new Step(state, help(state), 0);
      case ".." -> new Step(up(state), "", 0);
      case "exit" -> state.mode() == CmshMode.ROOT
          ? new Step(null, "", 0)
          : new Step(state.enter(CmshMode.ROOT), "", 0);
      case "quit" -> new Step(null, "", 0);
      default -> new Step(state, tokens.get(0) + ": Command not found.", 1);
    };
  }

  private static CmshState up(CmshState state) {
    if (state.hasSelection()) {
      return state.enter(state.mode());
    }
    return state.enter(CmshMode.ROOT);
  }

  private static Step list(CmshState state, List<String> args, ClusterStore store) {
    int d = args.indexOf("-d");
    boolean json = d >= 0 && d + 1 < args.size() && "{}".equals(args.get(d + 1));
    return new Step(state, CmshCatalog.list(state.mode(), store, json), 0);
  }

  private static Step use(CmshState state, List<String> args) {
    if (state.mode() == CmshMode.ROOT) {
      return new Step(state, "Error: use is only available inside a mode, e.g. device", 1);
    }
    if (args.isEmpty()) {
      return new Step(state, "Error: use requires an object name", 1);
    }
    return new Step(state.select(args.get(0)), "", 0);
  }

  private static Step show(CmshState state, List<String> args, ClusterStore store) {
    String id = args.isEmpty() ? state.selected() : args.get(0);
    if (id == null) {
      return new Step(state, "Error: No object selected. Use \"use <object>\" first.", 1);
    }
    return CmshCatalog.show(state.mode(), id, store)
        .map(out -> new Step(state, out, 0))
        .orElseGet(() -> new Step(state, "Error: " + id + " not found", 1));
  }

  private static Step status(CmshState state, ClusterStore store) {
    if (state.mode() != CmshMode.DEVICE) {
      return new Step(state, "status: Command not found.", 1);
    }
    return new Step(state, CmshCatalog.statusReport(store), 0);
  }

  private static String help(CmshState state) {
    StringBuilder sb = new StringBuilder();
    sb.append("Top level commands:\n");
    for (CmshMode mode : CmshMode.values()) {
      if (mode != CmshMode.ROOT) {
        sb.append(String.format("  %-16s Enter %s mode\n", mode.keyword(), mode.keyword()));
      }
    }
    sb.append("  exit             Leave the current mode, or cmsh at the top level\n")
        .append("  quit             Leave cmsh\n");
    if (state.mode() != CmshMode.ROOT) {
      sb.append("\nCommands in ").append(state.mode().keyword()).append(" mode:\n")
          .append("  list [-d {}]     List objects, as JSON with -d {}\n")
          .append("  use <object>     Select an object\n")
          .append("  show [object]    Show the selected object\n")
          .append("  ..               Drop the selection, then leave the mode\n");
      if (state.mode() == CmshMode.DEVICE) {
        sb.append("  status           Show device status\n");
      }
    }
    return sb.toString();
  }
}
