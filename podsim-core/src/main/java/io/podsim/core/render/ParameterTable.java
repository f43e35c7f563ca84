package io.podsim.core.render;

import java.util.ArrayList;
import java.util.List;

/** Two-column "Parameter / Value" listing with a dashed underline, as printed by cmsh show. */
public final class ParameterTable {
  private static final int KEY_WIDTH = 31;
  private static final int VALUE_WIDTH = 40;

  private final List<String[]> rows = new ArrayList<>();

  public ParameterTable add(String parameter, Object value) {
    rows.add(new String[] {parameter, String.valueOf(value)});
    return this;
  }

  public String render() {
    StringBuilder sb = new StringBuilder("\n");
    sb.append(Ansi.padRight("Parameter", KEY_WIDTH)).append(" Value\n");
    sb.append("-".repeat(KEY_WIDTH)).append(' ').append("-".repeat(VALUE_WIDTH)).append('\n');
    for (String[] row : rows) {
      sb.append(Ansi.padRight(row[0], KEY_WIDTH)).append(' ').append(row[1]).append('\n');
    }
    return sb.toString();
  }
}
