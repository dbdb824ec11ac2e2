package com.contextsmith.daac;

/**
 * Non-overlapping search under STANDARD semantics: report the first output
 * of the first state that has one, then start over from the root right after
 * the match.
 */
class StandardSearcher extends Searcher {

  StandardSearcher(DoubleArrayAhoCorasick pma, int[] symbols) {
    super(pma, symbols);
  }

  @Override
  protected Match continueSearch() {
    int state = DoubleArrayAhoCorasick.ROOT_STATE;
    while (this.pos < this.symbols.length) {
      state = this.pma.nextByCode(state, this.pma.code(this.symbols[this.pos++]));
      int head = this.pma.outputHead(state);
      if (head != OutputTable.EMPTY) {
        return toMatch(this.pos, this.pma.getOutputTable().getPatternId(head));
      }
    }
    return null;
  }
}
