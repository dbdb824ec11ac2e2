package com.contextsmith.daac;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class AutomatonBuilderTest {

  @Test
  public void testEmptyPatternSet() throws Exception {
    for (MatchKind kind : MatchKind.values()) {
      try {
        new AutomatonBuilder().matchKind(kind).build(Collections.<String>emptyList());
        fail("Expected InvalidInputException");
      } catch (InvalidInputException e) {
        // Expected.
      }
    }
  }

  @Test(expected = InvalidInputException.class)
  public void testEmptyPattern() throws Exception {
    new AutomatonBuilder().build(Arrays.asList("a", ""));
  }

  @Test(expected = InvalidInputException.class)
  public void testEmptyBytePattern() throws Exception {
    new AutomatonBuilder().buildFromBytes(Arrays.asList(new byte[] { 1 }, new byte[0]));
  }

  @Test(expected = InvalidInputException.class)
  public void testNullPattern() throws Exception {
    new AutomatonBuilder().build(Arrays.asList("a", null));
  }

  @Test
  public void testMaxPatternLength() throws Exception {
    AutomatonBuilder builder = new AutomatonBuilder().maxPatternLength(3);
    assertEquals(1, builder.build(Arrays.asList("abc")).numPatterns());
    try {
      builder.build(Arrays.asList("abc", "abcd"));
      fail("Expected InvalidInputException");
    } catch (InvalidInputException e) {
      assertTrue(e.getMessage().contains("limit of 3"));
    }
  }

  @Test(expected = ConstructionOverflowException.class)
  public void testOverflow() throws Exception {
    new AutomatonBuilder().maxArraySize(4).build(Arrays.asList("abcdef"));
  }

  @Test
  public void testOverflowIsAConstructionException() {
    try {
      new AutomatonBuilder().maxArraySize(2).build(Arrays.asList("ab", "cd"));
      fail("Expected ConstructionException");
    } catch (ConstructionException e) {
      assertTrue(e instanceof ConstructionOverflowException);
    }
  }

  @Test
  public void testSmallSlotTrialLimitStillBuilds() throws Exception {
    DoubleArrayAhoCorasick pma = new AutomatonBuilder().maxSlotTrials(1)
        .build(Arrays.asList("abc", "abd", "bcd", "cab", "ddd"));
    List<Match> matches = ImmutableList.copyOf(pma.findOverlapping("abcabdddd"));
    assertEquals(Arrays.asList(new Match(0, 3, 0), new Match(2, 5, 3),
                               new Match(3, 6, 1), new Match(5, 8, 4),
                               new Match(6, 9, 4)),
                 matches);
  }

  @Test
  public void testBuilderSettings() {
    AutomatonBuilder builder = new AutomatonBuilder(new AutomatonConfig(5, 100, 2))
        .matchKind(MatchKind.LEFTMOST_FIRST)
        .maxArraySize(200);
    assertEquals(MatchKind.LEFTMOST_FIRST, builder.getMatchKind());
    assertEquals(5, builder.getConfig().getMaxPatternLength());
    assertEquals(200, builder.getConfig().getMaxArraySize());
    assertEquals(2, builder.getConfig().getMaxSlotTrials());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveLimit() {
    new AutomatonBuilder().maxArraySize(0);
  }
}
