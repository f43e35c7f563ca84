package io.podsim.core;

import io.podsim.core.cluster.ClusterStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session state handed to every simulator call. The terminal owns it and passes the same
 * instance to each command of a session.
 */
public final class CommandContext {
  private String currentNode;
  private String currentPath;
  private final Map<String, String> environment;
  private final List<String> history;
  private final ClusterStore cluster;

  public CommandContext(String currentNode, ClusterStore cluster) {
    this(currentNode, "/root", new LinkedHashMap<>(), new ArrayList<>(), cluster);
  }

  public CommandContext(
      String currentNode,
      String currentPath,
      Map<String, String> environment,
      List<String> history,
      ClusterStore cluster) {
    this.currentNode = currentNode;
    this.currentPath = currentPath;
    this.environment = environment;
    this.history = history;
    this.cluster = cluster;
  }

  /** A context without cluster access; tools report that their daemon is unreachable. */
  public static CommandContext detached(String currentNode) {
    return new CommandContext(currentNode, null);
  }

  public String getCurrentNode() {
    return currentNode;
  }

  public void setCurrentNode(String currentNode) {
    this.currentNode = currentNode;
  }

  public String getCurrentPath() {
    return currentPath;
  }

  public void setCurrentPath(String currentPath) {
    this.currentPath = currentPath;
  }

  public Map<String, String> getEnvironment() {
    return environment;
  }

  public List<String> getHistory() {
    return history;
  }

  public Optional<ClusterStore> getCluster() {
    return Optional.ofNullable(cluster);
  }
}
