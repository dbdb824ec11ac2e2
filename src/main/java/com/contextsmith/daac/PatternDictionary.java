package com.contextsmith.daac;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.daac.utils.FileUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.io.LineProcessor;

/**
 * An automaton together with the strings it was built from, so matches can
 * be reported as the matched pattern text.
 */
public class PatternDictionary {
  private static final Logger log = LoggerFactory.getLogger(PatternDictionary.class);

  /** Collects one pattern per line; blank lines are skipped. */
  static class PatternLineProcessor implements LineProcessor<List<String>> {
    private final List<String> patterns = new ArrayList<>();
    private int numSkipped = 0;

    @Override
    public List<String> getResult() {
      return this.patterns;
    }

    int getNumSkipped() {
      return this.numSkipped;
    }

    @Override
    public boolean processLine(String line) throws IOException {
      line = StringUtils.stripEnd(line, "\r");
      if (StringUtils.isBlank(line)) {
        ++this.numSkipped;
        return true;
      }
      this.patterns.add(line);
      return true;
    }
  }

  public static PatternDictionary build(List<String> patterns,
                                        MatchKind matchKind)
      throws ConstructionException {
    return build(patterns, new AutomatonBuilder().matchKind(matchKind));
  }

  public static PatternDictionary build(List<String> patterns,
                                        AutomatonBuilder builder)
      throws ConstructionException {
    checkNotNull(patterns);
    checkNotNull(builder);
    for (int id = 0; id < patterns.size(); ++id) {
      if (patterns.get(id) == null) {
        throw new InvalidInputException("Pattern " + id + " is null");
      }
    }
    ImmutableList<String> copy = ImmutableList.copyOf(patterns);
    return new PatternDictionary(copy, builder.build(copy));
  }

  /**
   * Loads patterns from a UTF-8 file, one per line, looked up on the file
   * system first and then on the class path.
   */
  public static PatternDictionary load(String path, MatchKind matchKind)
      throws IOException, ConstructionException {
    log.info("Loading patterns from: {}", path);
    PatternLineProcessor lineProcessor = new PatternLineProcessor();
    List<String> patterns =
        FileUtil.findResourceAsCharSource(path).readLines(lineProcessor);
    if (lineProcessor.getNumSkipped() > 0) {
      log.debug("Skipped {} blank line(s) in {}", lineProcessor.getNumSkipped(), path);
    }
    return build(patterns, matchKind);
  }

  private final ImmutableList<String> patterns;
  private final DoubleArrayAhoCorasick automaton;

  private PatternDictionary(ImmutableList<String> patterns,
                            DoubleArrayAhoCorasick automaton) {
    this.patterns = patterns;
    this.automaton = automaton;
  }

  public List<Match> find(CharSequence text) {
    return ImmutableList.copyOf(this.automaton.find(text));
  }

  public List<String> findAsStrings(CharSequence text) {
    return toStrings(this.automaton.find(text));
  }

  public List<Match> findOverlapping(CharSequence text) {
    return ImmutableList.copyOf(this.automaton.findOverlapping(text));
  }

  public List<String> findOverlappingAsStrings(CharSequence text) {
    return toStrings(this.automaton.findOverlapping(text));
  }

  public List<Match> findOverlappingNoSuffix(CharSequence text) {
    return ImmutableList.copyOf(this.automaton.findOverlappingNoSuffix(text));
  }

  public List<String> findOverlappingNoSuffixAsStrings(CharSequence text) {
    return toStrings(this.automaton.findOverlappingNoSuffix(text));
  }

  public DoubleArrayAhoCorasick getAutomaton() {
    return this.automaton;
  }

  public String getPattern(int patternId) {
    checkElementIndex(patternId, this.patterns.size(), "pattern id");
    return this.patterns.get(patternId);
  }

  public List<String> getPatterns() {
    return this.patterns;
  }

  public int size() {
    return this.patterns.size();
  }

  private List<String> toStrings(Iterator<Match> matches) {
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    while (matches.hasNext()) {
      strings.add(this.patterns.get(matches.next().getPatternId()));
    }
    return strings.build();
  }
}
