package io.podsim.tools.slurm;

import io.podsim.core.SimulatorException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Slurm output format such as {@code "%.10P %n %G"}. {@code %Nx} pads field {@code x} to N
 * columns left-aligned, {@code %.Nx} right-aligned.
 */
final class FormatString {
  private static final Pattern TOKEN = Pattern.compile("%(\\.)?(\\d*)([A-Za-z%])");

  @FunctionalInterface
  interface Resolver {
    String value(char field) throws SimulatorException;
  }

  private record Part(String literal, char field, int width, boolean right) {
    boolean isLiteral() {
      return literal != null;
    }
  }

  private final List<Part> parts;

  private FormatString(List<Part> parts) {
    this.parts = List.copyOf(parts);
  }

  static FormatString parse(String format) {
    List<Part> parts = new ArrayList<>();
    Matcher m = TOKEN.matcher(format);
    int last = 0;
    while (m.find()) {
      if (m.start() > last) {
        parts.add(new Part(format.substring(last, m.start()), '\0', 0, false));
      }
      char field = m.group(3).charAt(0);
      if (field == '%') {
        parts.add(new Part("%", '\0', 0, false));
      } else {
        int width = m.group(2).isEmpty() ? 0 : Integer.parseInt(m.group(2));
        parts.add(new Part(null, field, width, m.group(1) != null));
      }
      last = m.end();
    }
    if (last < format.length()) {
      parts.add(new Part(format.substring(last), '\0', 0, false));
    }
    return new FormatString(parts);
  }

  boolean uses(char field) {
    return parts.stream().anyMatch(p -> !p.isLiteral() && p.field() == field);
  }

  String render(Resolver resolver) throws SimulatorException {
    StringBuilder sb = new StringBuilder();
    for (Part part : parts) {
      if (part.isLiteral()) {
        sb.append(part.literal());
        continue;
      }
      String value = resolver.value(part.field());
      if (part.width() > 0 && value.length() > part.width()) {
        value = value.substring(0, part.width());
      }
      if (part.width() > 0) {
        value = String.format("%" + (part.right() ? "" : "-") + part.width() + "s", value);
      }
      sb.append(value);
    }
    return sb.toString();
  }
}
