package com.contextsmith.daac;

/**
 * Non-overlapping search under the leftmost kinds. The automaton is built so
 * that once a match state is passed, every failure leads to the dead state,
 * and the latest match seen before dying is the leftmost one with the
 * preferred length or priority.
 */
class LeftmostSearcher extends Searcher {

  LeftmostSearcher(DoubleArrayAhoCorasick pma, int[] symbols) {
    super(pma, symbols);
  }

  @Override
  protected Match continueSearch() {
    OutputTable outputs = this.pma.getOutputTable();
    int state = DoubleArrayAhoCorasick.ROOT_STATE;
    int lastEnd = -1;
    int lastId = -1;

    for (int at = this.pos; at < this.symbols.length; ) {
      state = this.pma.nextByCode(state, this.pma.code(this.symbols[at++]));
      if (state == DoubleArrayAhoCorasick.DEAD_STATE) break;
      int head = this.pma.outputHead(state);
      if (head != OutputTable.EMPTY) {
        lastEnd = at;
        lastId = outputs.getPatternId(head);
      }
    }
    if (lastId < 0) {
      // No match can start anywhere in the rest of the input.
      this.pos = this.symbols.length;
      return null;
    }
    this.pos = lastEnd;
    return toMatch(lastEnd, lastId);
  }
}
