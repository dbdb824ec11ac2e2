package com.contextsmith.daac;

/**
 * Reports one match per end position: the first output of the state, which
 * is the longest pattern ending there. Shorter patterns that end at the same
 * position are its suffixes and are skipped.
 */
class NoSuffixSearcher extends Searcher {
  private int state = DoubleArrayAhoCorasick.ROOT_STATE;

  NoSuffixSearcher(DoubleArrayAhoCorasick pma, int[] symbols) {
    super(pma, symbols);
  }

  @Override
  protected Match continueSearch() {
    while (this.pos < this.symbols.length) {
      this.state = this.pma.nextByCode(
          this.state, this.pma.code(this.symbols[this.pos++]));
      int head = this.pma.outputHead(this.state);
      if (head != OutputTable.EMPTY) {
        return toMatch(this.pos, this.pma.getOutputTable().getPatternId(head));
      }
    }
    return null;
  }
}
