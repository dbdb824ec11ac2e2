package com.contextsmith.daac.build;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-codes raw symbols to dense codes, most frequent symbol first, so that
 * double-array offsets stay small even for a large alphabet such as Unicode.
 */
public class SymbolMapper {
  public static final int NO_CODE = -1;

  // Symbols below this bound are looked up in a flat table.
  static final int LOW_SYMBOL_LIMIT = 0x10000;

  public static SymbolMapper fromPatterns(List<int[]> patterns) {
    checkNotNull(patterns);
    Map<Integer, Integer> freqs = new HashMap<>();
    for (int[] pattern : patterns) {
      for (int symbol : pattern) {
        freqs.merge(symbol, 1, Integer::sum);
      }
    }

    // Sort distinct symbols by frequency (desc) then by value (asc).
    Integer[] symbols = freqs.keySet().toArray(new Integer[0]);
    Arrays.sort(symbols, (a, b) -> {
      int cmp = Integer.compare(freqs.get(b), freqs.get(a));
      return (cmp != 0) ? cmp : Integer.compare(a, b);
    });

    int maxLow = -1;
    int numHigh = 0;
    for (int symbol : symbols) {
      if (symbol < LOW_SYMBOL_LIMIT) maxLow = Math.max(maxLow, symbol);
      else ++numHigh;
    }

    int[] lowTable = new int[maxLow + 1];
    Arrays.fill(lowTable, NO_CODE);
    int[][] high = new int[numHigh][];
    int h = 0;
    for (int code = 0; code < symbols.length; ++code) {
      int symbol = symbols[code];
      if (symbol < LOW_SYMBOL_LIMIT) lowTable[symbol] = code;
      else high[h++] = new int[] { symbol, code };
    }
    Arrays.sort(high, (a, b) -> Integer.compare(a[0], b[0]));
    int[] highSymbols = new int[numHigh];
    int[] highCodes = new int[numHigh];
    for (int i = 0; i < numHigh; ++i) {
      highSymbols[i] = high[i][0];
      highCodes[i] = high[i][1];
    }
    return new SymbolMapper(lowTable, highSymbols, highCodes, symbols.length);
  }

  private final int[] lowTable;
  private final int[] highSymbols;  // Sorted ascending.
  private final int[] highCodes;    // Parallel to highSymbols.
  private final int alphabetSize;

  public SymbolMapper(int[] lowTable, int[] highSymbols, int[] highCodes,
                      int alphabetSize) {
    checkNotNull(lowTable);
    checkNotNull(highSymbols);
    checkNotNull(highCodes);
    checkArgument(highSymbols.length == highCodes.length,
                  "High symbol and code tables differ in length");
    this.lowTable = lowTable;
    this.highSymbols = highSymbols;
    this.highCodes = highCodes;
    this.alphabetSize = alphabetSize;
  }

  /**
   * Returns the dense code of the given symbol, or {@link #NO_CODE} if the
   * symbol does not occur in any pattern.
   */
  public int code(int symbol) {
    if (symbol < 0) return NO_CODE;
    if (symbol < LOW_SYMBOL_LIMIT) {
      return (symbol < this.lowTable.length) ? this.lowTable[symbol] : NO_CODE;
    }
    int i = Arrays.binarySearch(this.highSymbols, symbol);
    return (i < 0) ? NO_CODE : this.highCodes[i];
  }

  public int getAlphabetSize() {
    return this.alphabetSize;
  }

  public int[] getHighCodes() {
    return this.highCodes;
  }

  public int[] getHighSymbols() {
    return this.highSymbols;
  }

  public int[] getLowTable() {
    return this.lowTable;
  }

  public long heapBytes() {
    return 4L * (this.lowTable.length + this.highSymbols.length +
                 this.highCodes.length);
  }
}
