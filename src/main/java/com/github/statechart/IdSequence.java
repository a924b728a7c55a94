package com.github.statechart;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mints node ids of the form {@code node_N}. Not thread-safe; an editor session owns one.
 */
public final class IdSequence {
  static final String PREFIX = "node_";
  private static final Pattern MINTED_ID = Pattern.compile("^" + PREFIX + "(\\d{1,18})$");

  private long next;

  public IdSequence() {
    this(1L);
  }

  public IdSequence(final long first) {
    this.next = first;
  }

  /**
   * A sequence whose ids never collide with any minted id already present, eg. after a load.
   */
  public static IdSequence continuingAfter(final Collection<? extends ChartNode> nodes) {
    long highest = 0L;
    for (final ChartNode node : nodes) {
      final Matcher matcher = MINTED_ID.matcher(node.getId());
      if (matcher.matches()) {
        highest = Math.max(highest, Long.parseLong(matcher.group(1)));
      }
    }
    return new IdSequence(highest + 1);
  }

  public String nextId() {
    return PREFIX + next++;
  }

  public long peek() {
    return next;
  }
}
