package io.intellixity.squrrl.render;

import java.util.ArrayList;
import java.util.List;

/** Line-list helpers; every fragment is a list of lines relative to the caller's baseline. */
final class Lines {
  private Lines() {}

  static List<String> one(String line) {
    List<String> out = new ArrayList<>(1);
    out.add(line);
    return out;
  }

  static List<String> indent(List<String> lines, int step) {
    if (step == 0) return lines;
    String pad = " ".repeat(step);
    List<String> out = new ArrayList<>(lines.size());
    for (String l : lines) out.add(pad + l);
    return out;
  }

  /**
   * {@code (text)} for a single line, otherwise {@code (} / indented lines /
   * {@code )}.
   */
  static List<String> paren(List<String> lines, RenderContext ctx) {
    if (lines.size() == 1) return one("(" + lines.get(0) + ")");
    List<String> out = new ArrayList<>(lines.size() + 2);
    out.add("(");
    out.addAll(indent(lines, ctx.step()));
    out.add(")");
    return out;
  }

  /** Left's lines, then {@code token} and right's first line on left's last line, then right's rest. */
  static List<String> infix(List<String> left, String token, List<String> right) {
    List<String> out = new ArrayList<>(left.size() + right.size());
    out.addAll(left.subList(0, left.size() - 1));
    out.add(left.get(left.size() - 1) + " " + token + " " + right.get(0));
    out.addAll(right.subList(1, right.size()));
    return out;
  }

  static List<String> prefixFirst(String prefix, List<String> lines) {
    List<String> out = new ArrayList<>(lines);
    out.set(0, prefix + out.get(0));
    return out;
  }

  static List<String> appendLast(List<String> lines, String suffix) {
    List<String> out = new ArrayList<>(lines);
    int last = out.size() - 1;
    out.set(last, out.get(last) + suffix);
    return out;
  }

  /** Concatenates fragments, terminating every fragment but the last with a comma. */
  static List<String> commaSeparated(List<List<String>> fragments) {
    List<String> out = new ArrayList<>();
    for (int i = 0; i < fragments.size(); i++) {
      List<String> f = fragments.get(i);
      out.addAll(i < fragments.size() - 1 ? appendLast(f, ",") : f);
    }
    return out;
  }

  /** Fragment collapsed onto one line, used inside window specs and DISTINCT ON. */
  static String flat(List<String> lines) {
    if (lines.size() == 1) return lines.get(0);
    List<String> stripped = new ArrayList<>(lines.size());
    for (String l : lines) stripped.add(l.stripLeading());
    return String.join(" ", stripped);
  }
}
