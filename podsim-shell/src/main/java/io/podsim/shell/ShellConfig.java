package io.podsim.shell;

import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Startup settings of the terminal.
 *
 * <p>Each value is looked up in this order:
 *
 * <ol>
 *   <li>PODSIM_NODE / PODSIM_COLOR environment variables
 *   <li>podsim.node / podsim.color system properties
 *   <li>built-in defaults: node {@code dgx-00}, color on
 * </ol>
 *
 * @param node node id or hostname the session starts on
 * @param color whether ANSI colors are passed through to the terminal
 */
public record ShellConfig(String node, boolean color) {
  static final String ENV_NODE = "PODSIM_NODE";
  static final String ENV_COLOR = "PODSIM_COLOR";
  static final String PROP_NODE = "podsim.node";
  static final String PROP_COLOR = "podsim.color";
  static final String DEFAULT_NODE = "dgx-00";

  public static ShellConfig load() {
    return load(System.getenv(), System.getProperties());
  }

  static ShellConfig load(Map<String, String> env, Properties props) {
    String node = lookup(env, props, ENV_NODE, PROP_NODE);
    String color = lookup(env, props, ENV_COLOR, PROP_COLOR);
    return new ShellConfig(
        node == null ? DEFAULT_NODE : node, color == null || parseBoolean(color));
  }

  public ShellConfig withNode(String newNode) {
    return new ShellConfig(newNode, color);
  }

  public ShellConfig withColor(boolean newColor) {
    return new ShellConfig(node, newColor);
  }

  private static String lookup(Map<String, String> env, Properties props, String var, String prop) {
    String value = env.get(var);
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    value = props.getProperty(prop);
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  private static boolean parseBoolean(String value) {
    switch (value.toLowerCase(Locale.ROOT)) {
      case "0":
      case "false":
      case "no":
      case "off":
      case "never":
        return false;
      default:
        return true;
    }
  }
}
