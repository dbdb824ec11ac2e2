package com.contextsmith.daac.build;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.daac.InvalidInputException;
import com.contextsmith.daac.MatchKind;

/**
 * Inserts patterns into a {@link Trie}, one symbol at a time, in
 * registration order. Identical input always yields identical numbering.
 */
public class TrieBuilder {
  private static final Logger log = LoggerFactory.getLogger(TrieBuilder.class);

  private final MatchKind matchKind;
  private final int maxPatternLength;

  public TrieBuilder(MatchKind matchKind, int maxPatternLength) {
    this.matchKind = checkNotNull(matchKind);
    this.maxPatternLength = maxPatternLength;
  }

  public Trie build(List<int[]> patterns) throws InvalidInputException {
    checkNotNull(patterns);
    if (patterns.isEmpty()) {
      throw new InvalidInputException("Pattern set must not be empty");
    }
    for (int id = 0; id < patterns.size(); ++id) {
      int[] pattern = patterns.get(id);
      if (pattern == null) {
        throw new InvalidInputException("Pattern " + id + " is null");
      }
      if (pattern.length == 0) {
        throw new InvalidInputException("Pattern " + id + " is empty");
      }
      if (pattern.length > this.maxPatternLength) {
        throw new InvalidInputException(String.format(
            "Pattern %d has %d symbols, more than the limit of %d",
            id, pattern.length, this.maxPatternLength));
      }
      for (int symbol : pattern) {
        if (symbol < 0) {
          throw new InvalidInputException(
              "Pattern " + id + " contains negative symbol " + symbol);
        }
      }
    }

    SymbolMapper mapper = SymbolMapper.fromPatterns(patterns);
    Trie trie = new Trie(mapper, this.matchKind, patterns.size());
    int numSkipped = 0;
    for (int id = 0; id < patterns.size(); ++id) {
      int[] pattern = patterns.get(id);
      trie.setPatternLength(id, pattern.length);
      if (!insert(trie, pattern, id)) ++numSkipped;
    }
    if (numSkipped > 0) {
      log.debug("{} pattern(s) can never win under {} and were left out",
                numSkipped, this.matchKind);
    }
    return trie;
  }

  // Returns false if the pattern was left out of the trie.
  private boolean insert(Trie trie, int[] pattern, int id) {
    SymbolMapper mapper = trie.getMapper();
    int node = Trie.ROOT;
    for (int symbol : pattern) {
      // An earlier pattern that is a prefix of this one always wins under
      // leftmost-first, so this pattern is unreachable.
      if (this.matchKind == MatchKind.LEFTMOST_FIRST &&
          trie.get(node).hasOutputs()) {
        return false;
      }
      node = trie.extend(node, mapper.code(symbol));
    }
    trie.get(node).addOutput(id);
    return true;
  }
}
