package com.contextsmith.daac.build;

import com.contextsmith.daac.MatchKind;
import com.contextsmith.daac.OutputTable;

/**
 * The parallel arrays produced by {@link DoubleArrayCompactor}. All per-state
 * arrays are indexed by double-array slot, which is the state id.
 */
public class CompactedArrays {
  public static final int ROOT_STATE = 0;
  public static final int DEAD_STATE = -1;
  public static final int VACANT = -1;

  public final MatchKind matchKind;
  public final SymbolMapper mapper;
  public final int[] base;
  public final int[] check;
  public final int[] fail;
  public final int[] outputHeads;
  public final OutputTable outputTable;
  public final int[] patternLengths;
  public final int numStates;

  public CompactedArrays(MatchKind matchKind, SymbolMapper mapper, int[] base,
                         int[] check, int[] fail, int[] outputHeads,
                         OutputTable outputTable, int[] patternLengths,
                         int numStates) {
    this.matchKind = matchKind;
    this.mapper = mapper;
    this.base = base;
    this.check = check;
    this.fail = fail;
    this.outputHeads = outputHeads;
    this.outputTable = outputTable;
    this.patternLengths = patternLengths;
    this.numStates = numStates;
  }
}
