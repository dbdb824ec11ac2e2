package com.contextsmith.daac;

/** Reports every output of every state visited. */
class OverlappingSearcher extends Searcher {
  private int state = DoubleArrayAhoCorasick.ROOT_STATE;
  // Next output entry still to report at the current position.
  private int pending = OutputTable.EMPTY;

  OverlappingSearcher(DoubleArrayAhoCorasick pma, int[] symbols) {
    super(pma, symbols);
  }

  @Override
  protected Match continueSearch() {
    OutputTable outputs = this.pma.getOutputTable();
    while (this.pending == OutputTable.EMPTY) {
      if (this.pos >= this.symbols.length) return null;
      this.state = this.pma.nextByCode(
          this.state, this.pma.code(this.symbols[this.pos++]));
      this.pending = this.pma.outputHead(this.state);
    }
    int entry = this.pending;
    this.pending = outputs.next(entry);
    return toMatch(this.pos, outputs.getPatternId(entry));
  }
}
