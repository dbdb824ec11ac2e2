package com.contextsmith.daac;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
   Lazily yields the matches of one search over one input. Not thread safe;
   each search call gets its own instance.
 */
abstract class Searcher implements Iterator<Match> {
  protected final DoubleArrayAhoCorasick pma;
  protected final int[] symbols;
  // Number of symbols consumed so far.
  protected int pos = 0;

  private Match currentResult;
  private boolean isAdvanced = false;

  Searcher(DoubleArrayAhoCorasick pma, int[] symbols) {
    this.pma = pma;
    this.symbols = symbols;
  }

  /** Returns the next match, or null once the input is exhausted. */
  protected abstract Match continueSearch();

  @Override
  public boolean hasNext() {
    if (!this.isAdvanced) {
      this.currentResult = continueSearch();
      this.isAdvanced = true;
    }
    return (this.currentResult != null);
  }

  @Override
  public Match next() {
    if (!hasNext()) throw new NoSuchElementException();
    this.isAdvanced = false;
    return this.currentResult;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  protected Match toMatch(int end, int patternId) {
    return new Match(end - this.pma.getPatternLength(patternId), end, patternId);
  }
}
