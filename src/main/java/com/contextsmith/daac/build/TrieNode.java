package com.contextsmith.daac.build;

import java.util.Arrays;

/**
 * A node of the construction-time trie. Nodes refer to each other by their
 * index in the owning {@link Trie}, never by reference.
 */
public class TrieNode {
  public static final int NONE = -1;

  private static final int[] EMPTY_INTS = new int[0];

  // Parallel arrays: labels[i] leads to children[i]. Kept in insertion order.
  private int[] labels = EMPTY_INTS;
  private int[] children = EMPTY_INTS;
  private int numChildren = 0;

  // Pattern ids that end exactly here, ascending.
  private int[] outputs = EMPTY_INTS;
  private int numOutputs = 0;

  private final int depth;
  private int fail = NONE;

  TrieNode(int depth) {
    this.depth = depth;
  }

  void addOutput(int patternId) {
    if (this.numOutputs == this.outputs.length) {
      this.outputs = Arrays.copyOf(this.outputs, Math.max(1, this.numOutputs * 2));
    }
    this.outputs[this.numOutputs++] = patternId;
  }

  /** Returns the child reached by {@code label}, or {@link #NONE}. */
  public int get(int label) {
    for (int i = 0; i < this.numChildren; ++i) {
      if (this.labels[i] == label) return this.children[i];
    }
    return NONE;
  }

  public int getDepth() {
    return this.depth;
  }

  public int getFail() {
    return this.fail;
  }

  public int[] getOutputs() {
    return (this.numOutputs == 0) ? EMPTY_INTS
                                  : Arrays.copyOf(this.outputs, this.numOutputs);
  }

  public boolean hasOutputs() {
    return this.numOutputs > 0;
  }

  public static int edgeChild(long edge) {
    return (int) edge;
  }

  public static int edgeLabel(long edge) {
    return (int) (edge >>> 32);
  }

  /**
   * Returns the outgoing edges sorted by label, each packed as
   * {@code label << 32 | child}. Decode with edgeLabel() and edgeChild().
   */
  public long[] sortedEdges() {
    long[] edges = new long[this.numChildren];
    for (int i = 0; i < this.numChildren; ++i) {
      edges[i] = ((long) this.labels[i] << 32) | (this.children[i] & 0xFFFFFFFFL);
    }
    Arrays.sort(edges);
    return edges;
  }

  /** Returns the children in label insertion order. */
  public int[] children() {
    return Arrays.copyOf(this.children, this.numChildren);
  }

  /** Returns the child labels in insertion order, parallel to children(). */
  public int[] labels() {
    return Arrays.copyOf(this.labels, this.numChildren);
  }

  public int numChildren() {
    return this.numChildren;
  }

  void put(int label, int child) {
    for (int i = 0; i < this.numChildren; ++i) {
      if (this.labels[i] == label) {
        this.children[i] = child;
        return;
      }
    }
    if (this.numChildren == this.labels.length) {
      int newLength = Math.max(2, this.numChildren * 2);
      this.labels = Arrays.copyOf(this.labels, newLength);
      this.children = Arrays.copyOf(this.children, newLength);
    }
    this.labels[this.numChildren] = label;
    this.children[this.numChildren] = child;
    ++this.numChildren;
  }

  void setFail(int fail) {
    this.fail = fail;
  }
}
