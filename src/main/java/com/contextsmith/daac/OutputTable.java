package com.contextsmith.daac;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * Side table of pattern outputs. Every state references the head entry of
 * its output list; a list is the state's own pattern ids followed by the
 * list of its failure state, so merged sets share their common tails.
 * States without outputs reference {@link #EMPTY}.
 */
public final class OutputTable {
  public static final int EMPTY = -1;

  public static class Builder {
    private int[] patternIds = new int[16];
    private int[] next = new int[16];
    private int size = 0;

    /** Appends an entry that continues with {@code tail}; returns its index. */
    public int add(int patternId, int tail) {
      if (this.size == this.patternIds.length) {
        int newLength = this.size * 2;
        this.patternIds = Arrays.copyOf(this.patternIds, newLength);
        this.next = Arrays.copyOf(this.next, newLength);
      }
      this.patternIds[this.size] = patternId;
      this.next[this.size] = tail;
      return this.size++;
    }

    public OutputTable build() {
      return new OutputTable(Arrays.copyOf(this.patternIds, this.size),
                             Arrays.copyOf(this.next, this.size));
    }
  }

  private final int[] patternIds;
  private final int[] next;

  public OutputTable(int[] patternIds, int[] next) {
    checkNotNull(patternIds);
    checkNotNull(next);
    checkArgument(patternIds.length == next.length,
                  "Output columns differ in length");
    this.patternIds = patternIds;
    this.next = next;
  }

  public int getPatternId(int entry) {
    return this.patternIds[entry];
  }

  int[] getPatternIds() {
    return this.patternIds;
  }

  int[] getNext() {
    return this.next;
  }

  public long heapBytes() {
    return 4L * (this.patternIds.length + this.next.length);
  }

  /** Returns the entry following {@code entry}, or {@link #EMPTY}. */
  public int next(int entry) {
    return this.next[entry];
  }

  public int size() {
    return this.patternIds.length;
  }

  /** Collects the pattern ids of the list starting at {@code head}. */
  public int[] toArray(int head) {
    int[] ids = new int[0];
    int count = 0;
    for (int e = head; e != EMPTY; e = this.next[e]) {
      if (count == ids.length) ids = Arrays.copyOf(ids, Math.max(4, count * 2));
      ids[count++] = this.patternIds[e];
    }
    return Arrays.copyOf(ids, count);
  }
}
