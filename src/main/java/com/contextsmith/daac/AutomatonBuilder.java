package com.contextsmith.daac;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.daac.build.CompactedArrays;
import com.contextsmith.daac.build.DoubleArrayCompactor;
import com.contextsmith.daac.build.FailureLinkResolver;
import com.contextsmith.daac.build.Trie;
import com.contextsmith.daac.build.TrieBuilder;
import com.google.common.base.Stopwatch;

/**
 * Builds a {@link DoubleArrayAhoCorasick}: trie, failure links, then the
 * double-array layout. Pattern ids are the positions in the given list.
 * Either a complete automaton is returned or a {@link ConstructionException}
 * is thrown.
 */
public class AutomatonBuilder {
  private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

  private MatchKind matchKind = MatchKind.STANDARD;
  private AutomatonConfig config;

  public AutomatonBuilder() {
    this(AutomatonConfig.getDefaults());
  }

  public AutomatonBuilder(AutomatonConfig config) {
    this.config = checkNotNull(config);
  }

  /** Builds from strings, read as sequences of Unicode code points. */
  public DoubleArrayAhoCorasick build(List<? extends CharSequence> patterns)
      throws ConstructionException {
    checkNotNull(patterns);
    List<int[]> symbols = new ArrayList<>(patterns.size());
    for (CharSequence pattern : patterns) {
      symbols.add(pattern == null ? null : DoubleArrayAhoCorasick.toSymbols(pattern));
    }
    return buildFromSymbols(symbols);
  }

  /** Builds from byte strings, each byte read as an unsigned symbol. */
  public DoubleArrayAhoCorasick buildFromBytes(List<byte[]> patterns)
      throws ConstructionException {
    checkNotNull(patterns);
    List<int[]> symbols = new ArrayList<>(patterns.size());
    for (byte[] pattern : patterns) {
      symbols.add(pattern == null ? null : DoubleArrayAhoCorasick.toSymbols(pattern));
    }
    return buildFromSymbols(symbols);
  }

  public DoubleArrayAhoCorasick buildFromSymbols(List<int[]> patterns)
      throws ConstructionException {
    checkNotNull(patterns);
    log.info("Compiling {} pattern(s) as {}...", patterns.size(), this.matchKind);
    Stopwatch stopwatch = Stopwatch.createStarted();

    Trie trie = new TrieBuilder(this.matchKind, this.config.getMaxPatternLength())
        .build(patterns);
    new FailureLinkResolver().resolve(trie);
    CompactedArrays arrays = new DoubleArrayCompactor(
        this.config.getMaxArraySize(), this.config.getMaxSlotTrials())
        .compact(trie);
    DoubleArrayAhoCorasick pma = new DoubleArrayAhoCorasick(arrays);

    log.info("Finished compilation of {} states into {} slots ({} bytes) in {}",
             pma.numStates(), pma.arraySize(), pma.heapBytes(), stopwatch);
    return pma;
  }

  public AutomatonConfig getConfig() {
    return this.config;
  }

  public MatchKind getMatchKind() {
    return this.matchKind;
  }

  public AutomatonBuilder matchKind(MatchKind matchKind) {
    this.matchKind = checkNotNull(matchKind);
    return this;
  }

  public AutomatonBuilder maxArraySize(int maxArraySize) {
    this.config = this.config.withMaxArraySize(maxArraySize);
    return this;
  }

  public AutomatonBuilder maxPatternLength(int maxPatternLength) {
    this.config = this.config.withMaxPatternLength(maxPatternLength);
    return this;
  }

  public AutomatonBuilder maxSlotTrials(int maxSlotTrials) {
    this.config = this.config.withMaxSlotTrials(maxSlotTrials);
    return this;
  }
}
