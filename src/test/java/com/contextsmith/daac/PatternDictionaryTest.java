package com.contextsmith.daac;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class PatternDictionaryTest {
  private static final String PATTERN_FILE = "test-patterns.txt";
  private static final String TEXT = "this is a テスト";

  @Test
  public void testLoadSkipsBlankLines() throws Exception {
    PatternDictionary dict = PatternDictionary.load(PATTERN_FILE, MatchKind.STANDARD);
    assertEquals(4, dict.size());
    assertEquals(Arrays.asList("this", "hi", "テス", "his"), dict.getPatterns());
    assertEquals("テス", dict.getPattern(2));
    assertEquals(MatchKind.STANDARD, dict.getAutomaton().getMatchKind());
  }

  @Test
  public void testStandardAsStrings() throws Exception {
    PatternDictionary dict = PatternDictionary.load(PATTERN_FILE, MatchKind.STANDARD);
    assertEquals(Arrays.asList("hi", "テス"), dict.findAsStrings(TEXT));
    assertEquals(Arrays.asList("hi", "this", "his", "テス"),
                 dict.findOverlappingAsStrings(TEXT));
    assertEquals(Arrays.asList("hi", "this", "テス"),
                 dict.findOverlappingNoSuffixAsStrings(TEXT));
  }

  @Test
  public void testMatchesAndStringsAgree() throws Exception {
    PatternDictionary dict = PatternDictionary.load(PATTERN_FILE, MatchKind.STANDARD);
    List<Match> matches = dict.findOverlapping(TEXT);
    List<String> strings = dict.findOverlappingAsStrings(TEXT);
    assertEquals(matches.size(), strings.size());
    for (int i = 0; i < matches.size(); ++i) {
      Match m = matches.get(i);
      assertEquals(strings.get(i), dict.getPattern(m.getPatternId()));
      assertEquals(strings.get(i).codePointCount(0, strings.get(i).length()), m.length());
    }
  }

  @Test
  public void testLeftmostLongestAsStrings() throws Exception {
    PatternDictionary dict =
        PatternDictionary.load(PATTERN_FILE, MatchKind.LEFTMOST_LONGEST);
    assertEquals(Arrays.asList("this", "テス"), dict.findAsStrings(TEXT));
    assertEquals(Arrays.asList(new Match(0, 4, 0), new Match(10, 12, 2)),
                 dict.find(TEXT));
  }

  @Test
  public void testBuildWithBuilder() throws Exception {
    PatternDictionary dict = PatternDictionary.build(
        Arrays.asList("ab", "a", "abcd"),
        new AutomatonBuilder().matchKind(MatchKind.LEFTMOST_FIRST));
    assertEquals(Arrays.asList("ab"), dict.findAsStrings("abcd"));
  }

  @Test(expected = UnsupportedMatchKindException.class)
  public void testOverlappingNeedsStandard() throws Exception {
    PatternDictionary.build(Arrays.asList("a"), MatchKind.LEFTMOST_FIRST)
        .findOverlappingAsStrings("a");
  }

  @Test
  public void testMissingFile() throws Exception {
    try {
      PatternDictionary.load("no-such-patterns.txt", MatchKind.STANDARD);
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("no-such-patterns.txt"));
      return;
    }
    throw new AssertionError("Expected IOException");
  }

  @Test(expected = InvalidInputException.class)
  public void testNullPattern() throws Exception {
    PatternDictionary.build(Arrays.asList("a", null), MatchKind.STANDARD);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testUnknownPatternId() throws Exception {
    PatternDictionary.build(Arrays.asList("a"), MatchKind.STANDARD).getPattern(1);
  }
}
