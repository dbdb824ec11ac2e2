package com.contextsmith.daac.build;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

import java.util.Arrays;
import java.util.BitSet;

import com.contextsmith.daac.ConstructionOverflowException;

/**
 * Hands out double-array slots. Vacant slots that are still worth trying as
 * the first child of a new state are kept in an ascending doubly linked
 * list, so a first-fit search never rescans occupied ranges. A slot that
 * fails too many first-fit trials is retired from the list; it stays vacant
 * and may still be taken by a later child.
 */
public class SlotAllocator {
  private static final int NIL = -1;
  private static final int INITIAL_CAPACITY = 256;

  private final int maxArraySize;
  private final int maxTrials;
  private final BitSet used = new BitSet();

  private int capacity = 0;
  private int[] next = new int[0];
  private int[] prev = new int[0];
  private int[] trials = new int[0];
  private boolean[] linked = new boolean[0];
  private int head = NIL;
  private int tail = NIL;
  private int numUsed = 0;

  public SlotAllocator(int maxArraySize, int maxTrials)
      throws ConstructionOverflowException {
    checkArgument(maxArraySize > 0, "Max array size must be positive");
    checkArgument(maxTrials > 0, "Max trials must be positive");
    this.maxArraySize = maxArraySize;
    this.maxTrials = maxTrials;
    ensureCapacity(1);
  }

  public int capacity() {
    return this.capacity;
  }

  /** Returns one past the highest occupied slot. */
  public int extent() {
    return this.used.length();
  }

  /**
   * Returns the first base such that every {@code base + code} is vacant,
   * growing the slot space if needed. Codes must be ascending and non-empty.
   */
  public int findBase(int[] codes) throws ConstructionOverflowException {
    checkArgument(codes.length > 0, "No codes to place");
    int first = codes[0];
    int s = this.head;
    while (s != NIL) {
      int following = this.next[s];
      int base = s - first;
      if (fits(base, codes)) {
        ensureCapacity((long) base + codes[codes.length - 1] + 1);
        return base;
      }
      if (++this.trials[s] >= this.maxTrials) unlink(s);
      s = following;
    }
    // Nothing fits below the current capacity; place right after it.
    int base = this.capacity - first;
    ensureCapacity((long) base + codes[codes.length - 1] + 1);
    return base;
  }

  public boolean isUsed(int slot) {
    return this.used.get(slot);
  }

  public int numUsed() {
    return this.numUsed;
  }

  public void occupy(int slot) {
    verify(slot >= 0 && slot < this.capacity, "Slot %s out of range", slot);
    verify(!this.used.get(slot), "Slot %s is already occupied", slot);
    this.used.set(slot);
    ++this.numUsed;
    if (this.linked[slot]) unlink(slot);
  }

  private void ensureCapacity(long required) throws ConstructionOverflowException {
    if (required <= this.capacity) return;
    if (required > this.maxArraySize) {
      throw new ConstructionOverflowException(String.format(
          "Double array needs %d slots, more than the limit of %d",
          required, this.maxArraySize));
    }
    long grown = Math.max(INITIAL_CAPACITY, 2L * this.capacity);
    int newCapacity = (int) Math.min(this.maxArraySize, Math.max(required, grown));

    this.next = Arrays.copyOf(this.next, newCapacity);
    this.prev = Arrays.copyOf(this.prev, newCapacity);
    this.trials = Arrays.copyOf(this.trials, newCapacity);
    this.linked = Arrays.copyOf(this.linked, newCapacity);
    for (int slot = this.capacity; slot < newCapacity; ++slot) {
      this.prev[slot] = this.tail;
      this.next[slot] = NIL;
      this.linked[slot] = true;
      if (this.tail == NIL) this.head = slot;
      else this.next[this.tail] = slot;
      this.tail = slot;
    }
    this.capacity = newCapacity;
  }

  private boolean fits(int base, int[] codes) {
    for (int code : codes) {
      int slot = base + code;
      if (slot < this.capacity && this.used.get(slot)) return false;
    }
    return true;
  }

  private void unlink(int slot) {
    int p = this.prev[slot];
    int n = this.next[slot];
    if (p == NIL) this.head = n;
    else this.next[p] = n;
    if (n == NIL) this.tail = p;
    else this.prev[n] = p;
    this.linked[slot] = false;
  }
}
