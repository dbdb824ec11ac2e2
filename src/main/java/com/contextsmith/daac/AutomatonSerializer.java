package com.contextsmith.daac;

import com.contextsmith.daac.build.CompactedArrays;
import com.contextsmith.daac.build.SymbolMapper;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * Kryo serializer writing the compacted arrays of an automaton verbatim, so
 * that a read automaton is identical to the written one.
 */
public class AutomatonSerializer extends Serializer<DoubleArrayAhoCorasick> {
  static final int FORMAT_VERSION = 1;

  private static int[] readIntArray(Input input) {
    int length = input.readVarInt(true);
    return input.readInts(length);
  }

  private static void writeIntArray(Output output, int[] values) {
    output.writeVarInt(values.length, true);
    output.writeInts(values, 0, values.length);
  }

  private static void checkSymbolTables(int[] lowTable, int[] highSymbols,
                                        int[] highCodes, int alphabetSize) {
    for (int code : lowTable) {
      if (code != SymbolMapper.NO_CODE && (code < 0 || code >= alphabetSize)) {
        throw new KryoException("Symbol code out of range: " + code);
      }
    }
    for (int i = 0; i < highCodes.length; ++i) {
      if (highCodes[i] < 0 || highCodes[i] >= alphabetSize) {
        throw new KryoException("Symbol code out of range: " + highCodes[i]);
      }
      // Looked up by binary search.
      if (i > 0 && highSymbols[i - 1] >= highSymbols[i]) {
        throw new KryoException("High symbols are not strictly ascending");
      }
    }
  }

  private static void checkStates(MatchKind matchKind, int numStates,
                                  int[] check, int[] fail) {
    int size = check.length;
    if (size == 0 || numStates < 1 || numStates > size) {
      throw new KryoException(String.format(
          "Bad state count %d for %d slots", numStates, size));
    }
    if (check[CompactedArrays.ROOT_STATE] != CompactedArrays.VACANT ||
        fail[CompactedArrays.ROOT_STATE] != CompactedArrays.ROOT_STATE) {
      throw new KryoException("Root slot is corrupt");
    }
    for (int slot = 0; slot < size; ++slot) {
      if (check[slot] < CompactedArrays.VACANT || check[slot] >= size) {
        throw new KryoException("CHECK entry out of range at slot " + slot);
      }
      if (fail[slot] < CompactedArrays.DEAD_STATE || fail[slot] >= size) {
        throw new KryoException("Failure link out of range at slot " + slot);
      }
      if (fail[slot] == CompactedArrays.DEAD_STATE && !matchKind.isLeftmost()) {
        throw new KryoException("Dead failure link in a " + matchKind + " automaton");
      }
    }

    // Every failure chain must end at the root or the dead state.
    byte[] marks = new byte[size];  // 0: unseen, 1: on current chain, 2: done
    for (int slot = 1; slot < size; ++slot) {
      int s = slot;
      while (s > 0 && marks[s] == 0) {
        marks[s] = 1;
        s = fail[s];
      }
      if (s > 0 && marks[s] == 1) {
        throw new KryoException("Failure links form a cycle through slot " + s);
      }
      for (int t = slot; t > 0 && marks[t] == 1; t = fail[t]) {
        marks[t] = 2;
      }
    }
  }

  private static void checkOutputs(int[] outputHeads, int[] patternIds,
                                   int[] next, int[] patternLengths) {
    for (int head : outputHeads) {
      if (head < OutputTable.EMPTY || head >= patternIds.length) {
        throw new KryoException("Output head out of range: " + head);
      }
    }
    for (int entry = 0; entry < patternIds.length; ++entry) {
      if (patternIds[entry] < 0 || patternIds[entry] >= patternLengths.length) {
        throw new KryoException("Pattern id out of range: " + patternIds[entry]);
      }
      // Entries only link to earlier ones, so no list can cycle.
      if (next[entry] < OutputTable.EMPTY || next[entry] >= entry) {
        throw new KryoException("Output link out of range at entry " + entry);
      }
    }
    for (int length : patternLengths) {
      if (length <= 0) {
        throw new KryoException("Pattern length must be positive: " + length);
      }
    }
  }

  public AutomatonSerializer() {
    setImmutable(true);
  }

  @Override
  public DoubleArrayAhoCorasick read(Kryo kryo, Input input,
                                     Class<? extends DoubleArrayAhoCorasick> type) {
    int version = input.readVarInt(true);
    if (version != FORMAT_VERSION) {
      throw new KryoException("Unsupported automaton format version: " + version);
    }
    MatchKind matchKind;
    try {
      matchKind = MatchKind.fromCode(input.readVarInt(true));
    } catch (IllegalArgumentException e) {
      throw new KryoException(e);
    }
    int numStates = input.readVarInt(true);
    int alphabetSize = input.readVarInt(true);
    int[] lowTable = readIntArray(input);
    int[] highSymbols = readIntArray(input);
    int[] highCodes = readIntArray(input);
    int[] base = readIntArray(input);
    int[] check = readIntArray(input);
    int[] fail = readIntArray(input);
    int[] outputHeads = readIntArray(input);
    int[] patternIds = readIntArray(input);
    int[] next = readIntArray(input);
    int[] patternLengths = readIntArray(input);

    if (check.length != base.length || fail.length != base.length ||
        outputHeads.length != base.length) {
      throw new KryoException("Per-state arrays differ in length");
    }
    if (highSymbols.length != highCodes.length || patternIds.length != next.length) {
      throw new KryoException("Parallel tables differ in length");
    }
    checkSymbolTables(lowTable, highSymbols, highCodes, alphabetSize);
    checkStates(matchKind, numStates, check, fail);
    checkOutputs(outputHeads, patternIds, next, patternLengths);
    SymbolMapper mapper =
        new SymbolMapper(lowTable, highSymbols, highCodes, alphabetSize);
    return new DoubleArrayAhoCorasick(new CompactedArrays(
        matchKind, mapper, base, check, fail, outputHeads,
        new OutputTable(patternIds, next), patternLengths, numStates));
  }

  @Override
  public void write(Kryo kryo, Output output, DoubleArrayAhoCorasick pma) {
    CompactedArrays arrays = pma.toArrays();
    output.writeVarInt(FORMAT_VERSION, true);
    output.writeVarInt(arrays.matchKind.getCode(), true);
    output.writeVarInt(arrays.numStates, true);
    output.writeVarInt(arrays.mapper.getAlphabetSize(), true);
    writeIntArray(output, arrays.mapper.getLowTable());
    writeIntArray(output, arrays.mapper.getHighSymbols());
    writeIntArray(output, arrays.mapper.getHighCodes());
    writeIntArray(output, arrays.base);
    writeIntArray(output, arrays.check);
    writeIntArray(output, arrays.fail);
    writeIntArray(output, arrays.outputHeads);
    writeIntArray(output, arrays.outputTable.getPatternIds());
    writeIntArray(output, arrays.outputTable.getNext());
    writeIntArray(output, arrays.patternLengths);
  }
}
