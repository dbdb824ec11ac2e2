package com.contextsmith.daac.build;

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.ArrayList;
import java.util.List;

import com.contextsmith.daac.MatchKind;
import com.contextsmith.daac.OutputTable;

/**
 * Arena-backed prefix tree over the dense symbol codes of all patterns.
 * Node 0 is the root.
 */
public class Trie {
  public static final int ROOT = 0;
  // Failure target that absorbs every symbol (leftmost kinds only).
  public static final int DEAD = -2;

  private final List<TrieNode> nodes = new ArrayList<>();
  private final SymbolMapper mapper;
  private final MatchKind matchKind;
  private final int[] patternLengths;
  private boolean isResolved = false;

  // Filled in by FailureLinkResolver.
  private int[] bfsOrder;
  private int[] outputHeads;
  private OutputTable outputTable;

  Trie(SymbolMapper mapper, MatchKind matchKind, int numPatterns) {
    this.mapper = mapper;
    this.matchKind = matchKind;
    this.patternLengths = new int[numPatterns];
    this.nodes.add(new TrieNode(0));
  }

  /**
   * Returns the child of {@code parent} on {@code code}, creating it if
   * absent. New nodes are numbered in creation order.
   */
  int extend(int parent, int code) {
    TrieNode node = this.nodes.get(parent);
    int child = node.get(code);
    if (child != TrieNode.NONE) return child;
    child = this.nodes.size();
    this.nodes.add(new TrieNode(node.getDepth() + 1));
    node.put(code, child);
    return child;
  }

  /** Returns node indexes in breadth-first order, root first. */
  public int[] getBfsOrder() {
    return this.bfsOrder;
  }

  /** Returns the head of the merged output list of the given node. */
  public int getOutputHead(int node) {
    return this.outputHeads[node];
  }

  public OutputTable getOutputTable() {
    return this.outputTable;
  }

  public TrieNode get(int index) {
    checkElementIndex(index, this.nodes.size());
    return this.nodes.get(index);
  }

  public SymbolMapper getMapper() {
    return this.mapper;
  }

  public MatchKind getMatchKind() {
    return this.matchKind;
  }

  public int getPatternLength(int patternId) {
    return this.patternLengths[patternId];
  }

  public int[] getPatternLengths() {
    return this.patternLengths;
  }

  public boolean isResolved() {
    return this.isResolved;
  }

  public int numPatterns() {
    return this.patternLengths.length;
  }

  public int size() {
    return this.nodes.size();
  }

  void setPatternLength(int patternId, int length) {
    this.patternLengths[patternId] = length;
  }

  void setResolved(int[] bfsOrder, int[] outputHeads, OutputTable outputTable) {
    this.bfsOrder = bfsOrder;
    this.outputHeads = outputHeads;
    this.outputTable = outputTable;
    this.isResolved = true;
  }
}
