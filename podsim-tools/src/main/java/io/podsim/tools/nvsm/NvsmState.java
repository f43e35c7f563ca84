package io.podsim.tools.nvsm;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Position of an nvsm session: the current working target.
 *
 * @param path absolute, normalized target path
 */
public record NvsmState(String path) {
  /** Target a session starts at. */
  public static final String DEFAULT_PATH = "/systems/localhost";

  public static NvsmState initial() {
    return new NvsmState(DEFAULT_PATH);
  }

  public NvsmState cd(String newPath) {
    return new NvsmState(newPath);
  }

  /** {@code nvsm> } at the default target, otherwise {@code nvsm(<path>)> }. */
  public String prompt() {
    return DEFAULT_PATH.equals(path) ? "nvsm> " : "nvsm(" + path + ")> ";
  }

  /** Resolves an absolute or relative argument against the current path. */
  String normalize(String argument) {
    String joined = argument.startsWith("/") ? argument : path + "/" + argument;
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : joined.split("/")) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        segments.pollLast();
      } else {
        segments.addLast(segment);
      }
    }
    return "/" + String.join("/", segments);
  }
}
