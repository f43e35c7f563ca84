package io.podsim.tools.slurm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Slurm hostlist notation: {@code dgx-00,dgx-02,dgx-03} becomes {@code dgx-[00,02-03]}. */
final class Hostlist {
  private static final Pattern NUMBERED = Pattern.compile("(.*?)(\\d+)");

  private Hostlist() {}

  static String compress(List<String> names) {
    Map<String, List<String>> byPrefix = new LinkedHashMap<>();
    List<String> parts = new ArrayList<>();
    for (String name : names) {
      Matcher m = NUMBERED.matcher(name);
      if (m.matches()) {
        byPrefix.computeIfAbsent(m.group(1), k -> new ArrayList<>()).add(m.group(2));
      } else {
        parts.add(name);
      }
    }
    byPrefix.forEach((prefix, numbers) -> parts.add(prefix + ranges(numbers)));
    return String.join(",", parts);
  }

  private static String ranges(List<String> numbers) {
    if (numbers.size() == 1) {
      return numbers.get(0);
    }
    List<String> sorted = new ArrayList<>(numbers);
    sorted.sort(Comparator.comparingInt(Integer::parseInt));
    List<String> ranges = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < sorted.size(); i++) {
      boolean last = i == sorted.size() - 1;
      if (last || Integer.parseInt(sorted.get(i + 1)) != Integer.parseInt(sorted.get(i)) + 1) {
        ranges.add(start == i ? sorted.get(i) : sorted.get(start) + "-" + sorted.get(i));
        start = i + 1;
      }
    }
    return "[" + String.join(",", ranges) + "]";
  }
}
