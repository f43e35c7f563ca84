package io.podsim.core.render;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pipe-delimited table in the style of cmsh listings:
 *
 * <pre>
 * Name (key)   | Nodes
 * gpu          | 8
 * </pre>
 *
 * There is a header row but no separator row and no box drawing. Widths ignore ANSI codes.
 */
public final class PipeTable {
  private final List<String> headers;
  private final int[] minWidths;
  private final List<List<String>> rows = new ArrayList<>();

  public PipeTable(String... headers) {
    this.headers = List.of(headers);
    this.minWidths = new int[headers.length];
  }

  /** Sets minimum column widths, left to right. Extra values are ignored. */
  public PipeTable minWidths(int... widths) {
    for (int i = 0; i < widths.length && i < minWidths.length; i++) {
      minWidths[i] = widths[i];
    }
    return this;
  }

  public PipeTable addRow(Object... cells) {
    List<String> row = new ArrayList<>(headers.size());
    for (int i = 0; i < headers.size(); i++) {
      row.add(i < cells.length && cells[i] != null ? String.valueOf(cells[i]) : "");
    }
    rows.add(row);
    return this;
  }

  public int rowCount() {
    return rows.size();
  }

  public String render() {
    int[] widths = Arrays.copyOf(minWidths, minWidths.length);
    for (int c = 0; c < headers.size(); c++) {
      widths[c] = Math.max(widths[c], Ansi.visibleLength(headers.get(c)));
      for (List<String> row : rows) {
        widths[c] = Math.max(widths[c], Ansi.visibleLength(row.get(c)));
      }
    }
    StringBuilder sb = new StringBuilder();
    appendLine(sb, headers, widths);
    for (List<String> row : rows) {
      appendLine(sb, row, widths);
    }
    return sb.toString();
  }

  private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
    for (int c = 0; c < cells.size(); c++) {
      boolean last = c == cells.size() - 1;
      sb.append(last ? cells.get(c) : Ansi.padRight(cells.get(c), widths[c]));
      if (!last) {
        sb.append(" | ");
      }
    }
    sb.append('\n');
  }

  @Override
  public String toString() {
    return render();
  }
}
