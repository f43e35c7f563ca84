package io.podsim.tools.dcgm;

import io.podsim.core.render.Ansi;

/** Two-column report box used by dcgmi. Rules are drawn with pipes and dashes only. */
final class BoxTable {
  private final int left;
  private final int right;
  private final StringBuilder sb = new StringBuilder();

  BoxTable(int left, int right) {
    this.left = left;
    this.right = right;
  }

  BoxTable rule() {
    sb.append('|').append("-".repeat(left + 2)).append('|').append("-".repeat(right + 2))
        .append("|\n");
    return this;
  }

  BoxTable doubleRule() {
    sb.append('|').append("=".repeat(left + 2)).append('|').append("=".repeat(right + 2))
        .append("|\n");
    return this;
  }

  /** A line spanning both columns. */
  BoxTable title(String text) {
    sb.append("| ").append(Ansi.padRight(text, left + right + 3)).append(" |\n");
    return this;
  }

  BoxTable row(String key, String value) {
    sb.append("| ").append(Ansi.padRight(key, left)).append(" | ")
        .append(Ansi.padRight(value, right)).append(" |\n");
    return this;
  }

  String render() {
    return sb.toString();
  }
}
