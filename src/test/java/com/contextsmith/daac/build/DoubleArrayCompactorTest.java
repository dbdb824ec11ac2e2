package com.contextsmith.daac.build;

import static com.contextsmith.daac.build.TrieBuilderTest.symbols;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.contextsmith.daac.ConstructionOverflowException;
import com.contextsmith.daac.MatchKind;
import com.contextsmith.daac.OutputTable;

public class DoubleArrayCompactorTest {

  private static Trie resolved(MatchKind kind, String... patterns) throws Exception {
    Trie trie = new TrieBuilder(kind, 100).build(symbols(patterns));
    new FailureLinkResolver().resolve(trie);
    return trie;
  }

  // Follows trie edges through BASE/CHECK and returns the reached slot.
  private static int walk(CompactedArrays arrays, String path) {
    int state = CompactedArrays.ROOT_STATE;
    for (int c : path.codePoints().toArray()) {
      int slot = arrays.base[state] + arrays.mapper.code(c);
      assertEquals(state, arrays.check[slot]);
      state = slot;
    }
    return state;
  }

  @Test
  public void testEveryEdgeIsChecked() throws Exception {
    Trie trie = resolved(MatchKind.STANDARD, "he", "she", "his", "hers");
    CompactedArrays arrays = new DoubleArrayCompactor(1 << 20, 16).compact(trie);

    assertEquals(trie.size(), arrays.numStates);
    assertEquals(arrays.base.length, arrays.check.length);
    assertEquals(arrays.base.length, arrays.fail.length);
    assertEquals(arrays.base.length, arrays.outputHeads.length);
    assertEquals(CompactedArrays.VACANT, arrays.check[CompactedArrays.ROOT_STATE]);
    assertEquals(CompactedArrays.ROOT_STATE, arrays.fail[CompactedArrays.ROOT_STATE]);

    int numChecked = 0;
    for (int c : arrays.check) {
      if (c != CompactedArrays.VACANT) ++numChecked;
    }
    assertEquals(trie.size() - 1, numChecked);

    // Failure links are carried over to slots.
    assertEquals(walk(arrays, "he"), arrays.fail[walk(arrays, "she")]);
    assertEquals(walk(arrays, "s"), arrays.fail[walk(arrays, "hers")]);

    OutputTable outputs = arrays.outputTable;
    assertArrayEquals(new int[] { 1, 0 },
                      outputs.toArray(arrays.outputHeads[walk(arrays, "she")]));
    assertArrayEquals(new int[] { 3 },
                      outputs.toArray(arrays.outputHeads[walk(arrays, "hers")]));
  }

  @Test
  public void testDenserThanATransitionMatrix() throws Exception {
    Trie trie = resolved(MatchKind.STANDARD, "he", "she", "his", "hers");
    CompactedArrays arrays = new DoubleArrayCompactor(1 << 20, 16).compact(trie);
    assertTrue(arrays.base.length < trie.size() * arrays.mapper.getAlphabetSize());
  }

  @Test
  public void testDeadLinksUnderLeftmost() throws Exception {
    Trie trie = resolved(MatchKind.LEFTMOST_LONGEST, "ab", "a", "abcd");
    CompactedArrays arrays = new DoubleArrayCompactor(1 << 20, 16).compact(trie);
    assertEquals(CompactedArrays.DEAD_STATE, arrays.fail[walk(arrays, "a")]);
    assertEquals(CompactedArrays.DEAD_STATE, arrays.fail[walk(arrays, "abc")]);
  }

  @Test
  public void testCompactorIsReusable() throws Exception {
    DoubleArrayCompactor compactor = new DoubleArrayCompactor(1 << 20, 16);
    CompactedArrays first = compactor.compact(resolved(MatchKind.STANDARD, "abc", "bd"));
    CompactedArrays second = compactor.compact(resolved(MatchKind.STANDARD, "abc", "bd"));
    assertArrayEquals(first.base, second.base);
    assertArrayEquals(first.check, second.check);
    assertArrayEquals(first.fail, second.fail);
  }

  @Test(expected = ConstructionOverflowException.class)
  public void testOverflow() throws Exception {
    new DoubleArrayCompactor(4, 16).compact(resolved(MatchKind.STANDARD, "abcdef"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnresolvedTrie() throws Exception {
    Trie trie = new TrieBuilder(MatchKind.STANDARD, 100).build(symbols("a"));
    new DoubleArrayCompactor(1 << 20, 16).compact(trie);
  }
}
