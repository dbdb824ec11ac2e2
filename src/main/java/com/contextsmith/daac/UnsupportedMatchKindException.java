package com.contextsmith.daac;

/**
 * Thrown when a search is not defined for the match kind the automaton was
 * built with.
 */
public class UnsupportedMatchKindException extends UnsupportedOperationException {
  private static final long serialVersionUID = -2287319120564370187L;

  private final MatchKind matchKind;

  public UnsupportedMatchKindException(String operation, MatchKind matchKind) {
    super(String.format("%s requires %s, but the automaton was built with %s",
                        operation, MatchKind.STANDARD, matchKind));
    this.matchKind = matchKind;
  }

  public MatchKind getMatchKind() {
    return this.matchKind;
  }
}
