package com.contextsmith.daac;

/**
 * A pattern occurrence: {@code [start, end)} in symbol positions of the
 * searched input, plus the id of the pattern.
 */
public final class Match {
  private final int start;
  private final int end;
  private final int patternId;

  public Match(int start, int end, int patternId) {
    this.start = start;
    this.end = end;
    this.patternId = patternId;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof Match)) return false;
    Match other = (Match) obj;
    return this.start == other.start && this.end == other.end &&
           this.patternId == other.patternId;
  }

  public int getEnd() {
    return this.end;
  }

  public int getPatternId() {
    return this.patternId;
  }

  public int getStart() {
    return this.start;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * this.start + this.end) + this.patternId;
  }

  public int length() {
    return this.end - this.start;
  }

  @Override
  public String toString() {
    return String.format("[%d, %d): %d", this.start, this.end, this.patternId);
  }
}
