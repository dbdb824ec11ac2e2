package com.contextsmith.daac;

/** Match semantics of an automaton, fixed when it is built. */
public enum MatchKind {
  /** Classical Aho-Corasick; allows overlapping and non-overlapping search. */
  STANDARD(0),
  /** Non-overlapping; the longest pattern wins at the leftmost start. */
  LEFTMOST_LONGEST(1),
  /** Non-overlapping; the earliest registered pattern wins at the leftmost start. */
  LEFTMOST_FIRST(2);

  public static MatchKind fromCode(int code) {
    for (MatchKind kind : values()) {
      if (kind.code == code) return kind;
    }
    throw new IllegalArgumentException("Unknown match kind code: " + code);
  }

  private final int code;

  MatchKind(int code) {
    this.code = code;
  }

  public int getCode() {
    return this.code;
  }

  public boolean isLeftmost() {
    return this != STANDARD;
  }
}
