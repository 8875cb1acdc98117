/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tgs.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;

import exm.tgs.common.Logging;
import exm.tgs.typegraph.CFGNode;

/**
 * Reachability and visitation order over control flow graphs.
 *
 * Graphs may have cycles and unreachable nodes.  Nodes are only required
 * to expose their successors; see {@link CFGNode#SUCCESSORS}.
 */
public class CFGOrder {

  private static final Logger logger = Logging.getTGSLogger();

  public static Map<CFGNode, Set<CFGNode>> computePredecessors(
                                  Collection<CFGNode> nodes) {
    return computePredecessors(nodes, CFGNode.SUCCESSORS);
  }

  /**
   * Compute, for every node, the set of nodes it can be reached from.
   *
   * A node is always its own predecessor.  Paths may go through nodes not
   * in the input, but only input nodes appear as keys in the result.
   * Cost is a forward traversal per input node, so this is intended for
   * modest slices of a graph.
   *
   * @param nodes
   * @param successors
   * @return map with same iteration order as nodes
   */
  public static <N> Map<N, Set<N>> computePredecessors(
                  Collection<N> nodes, SuccessorsFunction<N> successors) {
    Map<N, Set<N>> predecessors = new LinkedHashMap<N, Set<N>>();
    for (N node: nodes) {
      predecessors.put(node, new LinkedHashSet<N>());
    }

    Traverser<N> traverser = Traverser.forGraph(successors);
    for (N start: nodes) {
      // Traversal includes start and visits each node once
      for (N reached: traverser.breadthFirst(start)) {
        Set<N> reachedPreds = predecessors.get(reached);
        if (reachedPreds != null) {
          reachedPreds.add(start);
        }
      }
    }
    return predecessors;
  }

  public static List<CFGNode> orderNodes(List<CFGNode> nodes) {
    return orderNodes(nodes, CFGNode.SUCCESSORS);
  }

  /**
   * Build an ancestors-first visitation order of the nodes reachable from
   * the first node.
   *
   * Starting from the first node, we repeatedly emit the candidate with
   * the fewest predecessors not yet emitted, and make its successors
   * candidates.  Ties go to the candidate discovered earliest.  This means
   * at least one predecessor of every node comes before it, a loop is
   * entered through its entry node, and a branch is finished before the
   * node where it joins the outer flow.
   *
   * Nodes not reachable from the first node are left out.  Paths may go
   * through nodes not in the input; those nodes are not emitted.  Cycles
   * are not an error.
   *
   * @param nodes first node is the entry point
   * @param successors
   * @return
   */
  public static <N> List<N> orderNodes(List<N> nodes,
                                       SuccessorsFunction<N> successors) {
    if (nodes.isEmpty()) {
      return Collections.emptyList();
    }
    N root = nodes.get(0);
    Map<N, Set<N>> predecessors = computePredecessors(nodes, successors);

    Set<N> dead = new HashSet<N>();
    for (Map.Entry<N, Set<N>> e: predecessors.entrySet()) {
      if (!e.getValue().contains(root)) {
        dead.add(e.getKey());
      }
    }
    if (!dead.isEmpty() && logger.isTraceEnabled()) {
      logger.trace("Unreachable from " + root + ": " + dead);
    }

    List<N> order = new ArrayList<N>();
    Set<N> seen = new HashSet<N>();
    // Insertion order records discovery order
    Set<N> candidates = new LinkedHashSet<N>();
    candidates.add(root);

    while (!candidates.isEmpty()) {
      N best = null;
      int bestUnseen = Integer.MAX_VALUE;
      for (N candidate: candidates) {
        int unseen = countUnseen(predecessors.get(candidate), seen);
        if (unseen < bestUnseen) {
          best = candidate;
          bestUnseen = unseen;
        }
      }

      candidates.remove(best);
      seen.add(best);
      order.add(best);

      for (N succ: nextInputNodes(best, predecessors.keySet(), successors)) {
        if (!seen.contains(succ) && !dead.contains(succ)) {
          candidates.add(succ);
        }
      }
    }

    if (logger.isTraceEnabled()) {
      logger.trace("Node order: " + order);
    }
    return order;
  }

  /**
   * Find the input nodes that follow node, passing through nodes that are
   * not in the input.
   * @param node
   * @param inputs
   * @param successors
   * @return nodes in breadth-first discovery order
   */
  private static <N> List<N> nextInputNodes(final N node,
          final Set<N> inputs, final SuccessorsFunction<N> successors) {
    // Traversal stops at input nodes other than the start
    SuccessorsFunction<N> throughOthers = new SuccessorsFunction<N>() {
      @Override
      public Iterable<? extends N> successors(N curr) {
        if (!curr.equals(node) && inputs.contains(curr)) {
          return Collections.<N>emptyList();
        }
        return successors.successors(curr);
      }
    };

    List<N> result = new ArrayList<N>();
    for (N reached: Traverser.forGraph(throughOthers).breadthFirst(node)) {
      if (!reached.equals(node) && inputs.contains(reached)) {
        result.add(reached);
      }
    }
    return result;
  }

  private static <N> int countUnseen(Set<N> nodes, Set<N> seen) {
    int count = 0;
    for (N node: nodes) {
      if (!seen.contains(node)) {
        count++;
      }
    }
    return count;
  }
}
