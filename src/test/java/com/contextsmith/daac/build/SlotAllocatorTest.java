package com.contextsmith.daac.build;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.contextsmith.daac.ConstructionOverflowException;

public class SlotAllocatorTest {

  @Test
  public void testFirstFit() throws Exception {
    SlotAllocator allocator = new SlotAllocator(1000, 4);
    assertEquals(256, allocator.capacity());
    allocator.occupy(0);

    assertEquals(1, allocator.findBase(new int[] { 0, 2, 5 }));
    allocator.occupy(1);
    allocator.occupy(3);
    allocator.occupy(6);

    // Slot 2 is free but 3 is taken, so base 2 does not fit.
    assertEquals(4, allocator.findBase(new int[] { 0, 1 }));
    assertEquals(4, allocator.numUsed());
    assertEquals(7, allocator.extent());
    assertTrue(allocator.isUsed(3));
    assertFalse(allocator.isUsed(2));
  }

  @Test
  public void testNegativeBase() throws Exception {
    SlotAllocator allocator = new SlotAllocator(1000, 4);
    allocator.occupy(0);
    // The lowest code lands on the first vacant slot.
    assertEquals(-4, allocator.findBase(new int[] { 5, 7 }));
  }

  @Test
  public void testRetiredSlotsAreSkipped() throws Exception {
    SlotAllocator allocator = new SlotAllocator(1000, 1);
    allocator.occupy(0);
    allocator.occupy(2);
    assertEquals(3, allocator.findBase(new int[] { 0, 1 }));
    // Slot 1 failed once and was retired from the search.
    assertEquals(3, allocator.findBase(new int[] { 0 }));
    assertFalse(allocator.isUsed(1));
  }

  @Test
  public void testGrowsPastInitialCapacity() throws Exception {
    SlotAllocator allocator = new SlotAllocator(10_000, 4);
    allocator.occupy(0);
    int base = allocator.findBase(new int[] { 0, 300 });
    assertEquals(1, base);
    assertTrue(allocator.capacity() >= 301);
    allocator.occupy(base + 300);
  }

  @Test(expected = ConstructionOverflowException.class)
  public void testOverflow() throws Exception {
    SlotAllocator allocator = new SlotAllocator(8, 4);
    allocator.occupy(0);
    allocator.findBase(new int[] { 0, 8 });
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyCodes() throws Exception {
    new SlotAllocator(8, 4).findBase(new int[0]);
  }
}
