package com.contextsmith.daac;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;

import com.contextsmith.daac.build.CompactedArrays;
import com.contextsmith.daac.build.SymbolMapper;

/**
   <p>An Aho-Corasick automaton stored as a compact double array. The
   transition from state {@code q} on a symbol with code {@code c} is the
   slot {@code BASE[q] + c} when {@code CHECK[BASE[q] + c] == q}; otherwise
   the failure link of {@code q} is followed and the lookup retried, down to
   the root, which loops to itself.</p>

   <p>Instances are immutable and may be searched by many threads at once.
   Every search starts fresh at position 0 of its input and yields matches
   lazily.</p>

   <p>
   Example usage:
   <code><pre>
       DoubleArrayAhoCorasick pma = new AutomatonBuilder()
           .matchKind(MatchKind.LEFTMOST_LONGEST)
           .build(Arrays.asList("ab", "a", "abcd"));

       Iterator&lt;Match&gt; matches = pma.find("abcd");
       while (matches.hasNext()) {
           Match m = matches.next();
           System.out.println(m.getPatternId() + " at " + m.getStart());
       }
   </pre></code>
   </p>
 */
public final class DoubleArrayAhoCorasick {
  public static final int ROOT_STATE = CompactedArrays.ROOT_STATE;
  /** Absorbing state reached after a match under leftmost kinds. */
  public static final int DEAD_STATE = CompactedArrays.DEAD_STATE;

  static int[] toSymbols(byte[] bytes) {
    int[] symbols = new int[bytes.length];
    for (int i = 0; i < bytes.length; ++i) {
      symbols[i] = bytes[i] & 0xFF;
    }
    return symbols;
  }

  static int[] toSymbols(CharSequence text) {
    return text.codePoints().toArray();
  }

  private final MatchKind matchKind;
  private final SymbolMapper mapper;
  private final int[] base;
  private final int[] check;
  private final int[] fail;
  private final int[] outputHeads;
  private final OutputTable outputTable;
  private final int[] patternLengths;
  private final int numStates;

  DoubleArrayAhoCorasick(CompactedArrays arrays) {
    this.matchKind = checkNotNull(arrays.matchKind);
    this.mapper = checkNotNull(arrays.mapper);
    this.base = checkNotNull(arrays.base);
    this.check = checkNotNull(arrays.check);
    this.fail = checkNotNull(arrays.fail);
    this.outputHeads = checkNotNull(arrays.outputHeads);
    this.outputTable = checkNotNull(arrays.outputTable);
    this.patternLengths = checkNotNull(arrays.patternLengths);
    this.numStates = arrays.numStates;
  }

  /** Size of the BASE/CHECK arrays, i.e. one past the highest state id. */
  public int arraySize() {
    return this.check.length;
  }

  /**
   * Returns non-overlapping matches. Under STANDARD, the first output at
   * each match end is reported and scanning restarts at the root; under the
   * leftmost kinds, leftmost-longest or leftmost-first semantics apply.
   */
  public Iterator<Match> find(int[] symbols) {
    checkNotNull(symbols);
    if (this.matchKind.isLeftmost()) return new LeftmostSearcher(this, symbols);
    return new StandardSearcher(this, symbols);
  }

  public Iterator<Match> find(byte[] bytes) {
    return find(toSymbols(checkNotNull(bytes)));
  }

  /** Positions of the returned matches are code point indexes. */
  public Iterator<Match> find(CharSequence text) {
    return find(toSymbols(checkNotNull(text)));
  }

  /** Returns every occurrence of every pattern. STANDARD only. */
  public Iterator<Match> findOverlapping(int[] symbols) {
    checkNotNull(symbols);
    checkStandard("findOverlapping");
    return new OverlappingSearcher(this, symbols);
  }

  public Iterator<Match> findOverlapping(byte[] bytes) {
    return findOverlapping(toSymbols(checkNotNull(bytes)));
  }

  public Iterator<Match> findOverlapping(CharSequence text) {
    return findOverlapping(toSymbols(checkNotNull(text)));
  }

  /**
   * Like {@link #findOverlapping(int[])}, but reports only the longest
   * pattern ending at each position, dropping the patterns that are its
   * suffixes. STANDARD only.
   */
  public Iterator<Match> findOverlappingNoSuffix(int[] symbols) {
    checkNotNull(symbols);
    checkStandard("findOverlappingNoSuffix");
    return new NoSuffixSearcher(this, symbols);
  }

  public Iterator<Match> findOverlappingNoSuffix(byte[] bytes) {
    return findOverlappingNoSuffix(toSymbols(checkNotNull(bytes)));
  }

  public Iterator<Match> findOverlappingNoSuffix(CharSequence text) {
    return findOverlappingNoSuffix(toSymbols(checkNotNull(text)));
  }

  public MatchKind getMatchKind() {
    return this.matchKind;
  }

  /** Approximate memory held by the compacted arrays and tables, in bytes. */
  public long heapBytes() {
    return 4L * (this.base.length + this.check.length + this.fail.length +
                 this.outputHeads.length + this.patternLengths.length) +
           this.outputTable.heapBytes() + this.mapper.heapBytes();
  }

  /**
   * Total transition function: returns the state reached from {@code state}
   * on {@code symbol}. Never fails; falls back along failure links. Under
   * the leftmost kinds the result may be {@link #DEAD_STATE}, which absorbs
   * every symbol.
   */
  public int nextState(int state, int symbol) {
    if (state == DEAD_STATE) return DEAD_STATE;
    checkState(state);
    return nextByCode(state, this.mapper.code(symbol));
  }

  public int numPatterns() {
    return this.patternLengths.length;
  }

  public int numStates() {
    return this.numStates;
  }

  /**
   * Returns the pattern ids recognized in {@code state}: its own, then those
   * of its failure chain.
   */
  public int[] outputs(int state) {
    if (state == DEAD_STATE) return new int[0];
    checkState(state);
    return this.outputTable.toArray(this.outputHeads[state]);
  }

  public int patternLength(int patternId) {
    checkElementIndex(patternId, this.patternLengths.length, "pattern id");
    return this.patternLengths[patternId];
  }

  public int rootState() {
    return ROOT_STATE;
  }

  CompactedArrays toArrays() {
    return new CompactedArrays(this.matchKind, this.mapper, this.base,
                               this.check, this.fail, this.outputHeads,
                               this.outputTable, this.patternLengths,
                               this.numStates);
  }

  int code(int symbol) {
    return this.mapper.code(symbol);
  }

  int nextByCode(int state, int code) {
    for (;;) {
      if (state == DEAD_STATE) return DEAD_STATE;
      if (code >= 0) {
        int t = this.base[state] + code;
        if (t >= 0 && t < this.check.length && this.check[t] == state) return t;
      }
      if (state == ROOT_STATE) return ROOT_STATE;
      state = this.fail[state];
    }
  }

  int outputHead(int state) {
    return this.outputHeads[state];
  }

  OutputTable getOutputTable() {
    return this.outputTable;
  }

  int getPatternLength(int patternId) {
    return this.patternLengths[patternId];
  }

  private void checkStandard(String operation) {
    if (this.matchKind != MatchKind.STANDARD) {
      throw new UnsupportedMatchKindException(operation, this.matchKind);
    }
  }

  private void checkState(int state) {
    checkElementIndex(state, this.check.length, "state");
  }
}
