package com.contextsmith.daac.build;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.daac.ConstructionOverflowException;
import com.contextsmith.daac.OutputTable;

/**
 * Lays a resolved trie out as a double array: the child of state {@code q}
 * on code {@code c} lives at slot {@code BASE[q] + c} and is valid only if
 * {@code CHECK[BASE[q] + c] == q}.
 */
public class DoubleArrayCompactor {
  private static final Logger log = LoggerFactory.getLogger(DoubleArrayCompactor.class);

  private final int maxArraySize;
  private final int maxSlotTrials;

  private int[] base = new int[0];
  private int[] check = new int[0];

  public DoubleArrayCompactor(int maxArraySize, int maxSlotTrials) {
    this.maxArraySize = maxArraySize;
    this.maxSlotTrials = maxSlotTrials;
  }

  public CompactedArrays compact(Trie trie) throws ConstructionOverflowException {
    checkArgument(trie.isResolved(), "Failure links are not resolved yet");
    SlotAllocator allocator =
        new SlotAllocator(this.maxArraySize, this.maxSlotTrials);
    this.base = new int[0];
    this.check = new int[0];
    grow(allocator.capacity());

    int[] slotOf = new int[trie.size()];
    allocator.occupy(CompactedArrays.ROOT_STATE);
    slotOf[Trie.ROOT] = CompactedArrays.ROOT_STATE;

    // Parents come before children in BFS order, so every node already has
    // its slot when its own children are placed.
    for (int n : trie.getBfsOrder()) {
      long[] edges = trie.get(n).sortedEdges();
      if (edges.length == 0) continue;
      int[] codes = new int[edges.length];
      for (int i = 0; i < edges.length; ++i) {
        codes[i] = TrieNode.edgeLabel(edges[i]);
      }
      int b = allocator.findBase(codes);
      grow(allocator.capacity());
      int parent = slotOf[n];
      this.base[parent] = b;
      for (int i = 0; i < edges.length; ++i) {
        int slot = b + codes[i];
        allocator.occupy(slot);
        this.check[slot] = parent;
        slotOf[TrieNode.edgeChild(edges[i])] = slot;
      }
    }

    int extent = allocator.extent();
    verify(allocator.numUsed() == trie.size(),
           "Placed %s states for %s trie nodes", allocator.numUsed(), trie.size());
    int[] base = Arrays.copyOf(this.base, extent);
    int[] check = Arrays.copyOf(this.check, extent);
    int[] fail = new int[extent];
    int[] outputHeads = new int[extent];
    Arrays.fill(outputHeads, OutputTable.EMPTY);

    for (int n = 0; n < trie.size(); ++n) {
      int slot = slotOf[n];
      int f = trie.get(n).getFail();
      fail[slot] = (f == Trie.DEAD) ? CompactedArrays.DEAD_STATE : slotOf[f];
      outputHeads[slot] = trie.getOutputHead(n);
    }
    check[CompactedArrays.ROOT_STATE] = CompactedArrays.VACANT;

    log.debug("Placed {} states in {} slots ({} load factor)", trie.size(),
              extent, String.format("%.3f", (double) trie.size() / extent));
    return new CompactedArrays(trie.getMatchKind(), trie.getMapper(), base,
                               check, fail, outputHeads, trie.getOutputTable(),
                               trie.getPatternLengths(), trie.size());
  }

  private void grow(int capacity) {
    int oldLength = this.check.length;
    if (capacity <= oldLength) return;
    this.base = Arrays.copyOf(this.base, capacity);
    this.check = Arrays.copyOf(this.check, capacity);
    Arrays.fill(this.check, oldLength, capacity, CompactedArrays.VACANT);
  }
}
