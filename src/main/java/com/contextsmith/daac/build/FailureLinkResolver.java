package com.contextsmith.daac.build;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

import java.util.ArrayDeque;
import java.util.Queue;

import com.contextsmith.daac.OutputTable;

/**
 * Computes the failure link of every trie node and merges each node's
 * outputs with those of its failure node.
 */
public class FailureLinkResolver {

  /**
   * Follows a single transition, treating the root as having a self loop on
   * every symbol and the dead state as absorbing.
   */
  static int follow(Trie trie, int node, int code) {
    if (node == Trie.DEAD) return Trie.DEAD;
    int child = trie.get(node).get(code);
    if (child != TrieNode.NONE) return child;
    return (node == Trie.ROOT) ? Trie.ROOT : TrieNode.NONE;
  }

  /**
   * DANGER: order dependent. Nodes are visited breadth first, so the failure
   * node of every node (always shallower) is final before it is used, and
   * its output list is already merged.
   */
  public void resolve(Trie trie) {
    checkArgument(!trie.isResolved(), "Trie is already resolved");
    boolean isLeftmost = trie.getMatchKind().isLeftmost();

    int[] bfsOrder = new int[trie.size()];
    int visited = 0;
    Queue<Integer> queue = new ArrayDeque<>();

    TrieNode root = trie.get(Trie.ROOT);
    root.setFail(Trie.ROOT);
    for (long edge : root.sortedEdges()) {
      int child = TrieNode.edgeChild(edge);
      // Under leftmost kinds, once a match is seen no later start may win,
      // so match nodes (and through them, their subtrees) fail to DEAD.
      trie.get(child).setFail(
          (isLeftmost && trie.get(child).hasOutputs()) ? Trie.DEAD : Trie.ROOT);
      queue.add(child);
    }
    bfsOrder[visited++] = Trie.ROOT;

    while (!queue.isEmpty()) {
      int curr = queue.remove();
      bfsOrder[visited++] = curr;

      for (long edge : trie.get(curr).sortedEdges()) {
        int code = TrieNode.edgeLabel(edge);
        TrieNode next = trie.get(TrieNode.edgeChild(edge));
        queue.add(TrieNode.edgeChild(edge));

        if (isLeftmost && next.hasOutputs()) {
          next.setFail(Trie.DEAD);
          continue;
        }
        int failState = trie.get(curr).getFail();
        int nextStateFail;
        while ((nextStateFail = follow(trie, failState, code)) == TrieNode.NONE) {
          failState = trie.get(failState).getFail();
        }
        verify(nextStateFail == Trie.DEAD ||
               trie.get(nextStateFail).getDepth() < next.getDepth(),
               "Failure link of depth %s node does not point upwards",
               next.getDepth());
        next.setFail(nextStateFail);
      }
    }
    verify(visited == trie.size(), "Visited %s of %s trie nodes",
           visited, trie.size());

    int[] outputHeads = new int[trie.size()];
    OutputTable.Builder outputs = new OutputTable.Builder();
    for (int n : bfsOrder) {
      TrieNode node = trie.get(n);
      int tail = (n == Trie.ROOT || node.getFail() == Trie.DEAD)
          ? OutputTable.EMPTY : outputHeads[node.getFail()];
      int[] own = node.getOutputs();
      // Link own ids backwards so the list reads ascending.
      for (int i = own.length - 1; i >= 0; --i) {
        tail = outputs.add(own[i], tail);
      }
      outputHeads[n] = tail;
    }
    trie.setResolved(bfsOrder, outputHeads, outputs.build());
  }
}
