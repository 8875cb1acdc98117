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
package exm.tgs.product;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import exm.tgs.common.Logging;
import exm.tgs.common.exceptions.TooComplexException;
import exm.tgs.common.util.Pair;
import exm.tgs.typegraph.Binding;
import exm.tgs.typegraph.Variable;

/**
 * Enumerate consistent choices of bindings for a set of variables whose
 * values may depend on further variables.
 *
 * One binding is chosen per root variable.  For every chosen binding with
 * parameters, one binding is chosen from each parameter variable, and so
 * on down.  Each result is the set of all bindings chosen.
 *
 * Rules:
 * - Variables without bindings are skipped: they add nothing, but do not
 *   make the product empty.
 * - A binding that is already being expanded further up the current path
 *   is not expanded again.  It can still be chosen, which adds nothing new
 *   to the set, so cycles in the variable graph terminate.
 * - Identical results are emitted once.
 *
 * The expansions of a binding are memoized, keyed by the binding and by
 * the bindings on the path that its expansion can actually reach.  Shared
 * sub-structure is therefore expanded once per iteration, however many
 * bindings refer to it.  Root combinations are expanded lazily as the
 * iterator advances.
 *
 * Every combination built counts toward a {@link ComplexityLimit}; results
 * reused from the memo are not counted again.  Iteration throws
 * {@link TooComplexException} once the limit is passed.
 */
public class DeepVariableProduct implements Iterable<Set<Binding>> {

  private static final Logger logger = Logging.getTGSLogger();

  private final List<Variable> roots;

  /** Combination limit, or null to use the configured default */
  private final Long limit;

  public DeepVariableProduct(List<Variable> roots) {
    this.roots = ImmutableList.copyOf(roots);
    this.limit = null;
  }

  public DeepVariableProduct(List<Variable> roots, long limit) {
    this.roots = ImmutableList.copyOf(roots);
    this.limit = limit;
  }

  /**
   * @throws TooComplexException from next() or hasNext() if the expansion
   *                    builds more combinations than the limit
   */
  @Override
  public Iterator<Set<Binding>> iterator() {
    ComplexityLimit complexity = limit == null ?
            ComplexityLimit.deepProductDefault() : new ComplexityLimit(limit);
    return new Expansion(complexity).iterator(roots);
  }

  /**
   * Collect the whole product
   * @return results in iteration order
   * @throws TooComplexException
   */
  public List<Set<Binding>> toList() {
    return Lists.newArrayList(this);
  }

  /**
   * State for one pass over the product
   */
  private static class Expansion {
    private final ComplexityLimit complexity;

    /**
     * Expansions of a binding, keyed by (owning variable and binding,
     * visible part of the path).  Bindings compare by data, so the owning
     * variable is part of the key.
     */
    private final Map<Pair<Pair<Variable, Binding>, Set<Binding>>,
                      List<Set<Binding>>> memo =
        new HashMap<Pair<Pair<Variable, Binding>, Set<Binding>>,
                    List<Set<Binding>>>();

    /** Non-empty parameter variables of each binding */
    private final Map<Binding, List<Variable>> parameters =
        new HashMap<Binding, List<Variable>>();

    /** All bindings of variables reachable through a binding's parameters */
    private final Map<Binding, Set<Binding>> reachable =
        new HashMap<Binding, Set<Binding>>();

    private int memoHits = 0;

    Expansion(ComplexityLimit complexity) {
      this.complexity = complexity;
    }

    Iterator<Set<Binding>> iterator(List<Variable> rootVars) {
      final Iterator<List<Binding>> rows =
          Lists.cartesianProduct(nonEmptyBindings(rootVars)).iterator();
      final Set<Set<Binding>> emitted = new HashSet<Set<Binding>>();

      return new AbstractIterator<Set<Binding>>() {
        private Iterator<Set<Binding>> pending =
                      ImmutableList.<Set<Binding>>of().iterator();

        @Override
        protected Set<Binding> computeNext() {
          while (true) {
            while (pending.hasNext()) {
              Set<Binding> result = pending.next();
              if (emitted.add(result)) {
                return result;
              }
            }
            if (!rows.hasNext()) {
              if (logger.isDebugEnabled()) {
                logger.debug("Deep product: " + emitted.size() +
                    " results, " + complexity.count() + " combinations, " +
                    memoHits + " memo hits");
              }
              return endOfData();
            }
            pending = expandRow(rows.next()).iterator();
          }
        }
      };
    }

    /**
     * Expand each binding of a root row and combine the expansions
     */
    private List<Set<Binding>> expandRow(List<Binding> row) {
      List<List<Set<Binding>>> choices =
          new ArrayList<List<Set<Binding>>>(row.size());
      for (Binding b: row) {
        choices.add(expandBinding(b, ImmutableSet.<Binding>of()));
      }
      return combine(choices);
    }

    /**
     * @param var
     * @param seen bindings being expanded on the path
     * @return expansions of all bindings of var, deduplicated
     */
    private List<Set<Binding>> expandVariable(Variable var,
                                              Set<Binding> seen) {
      Set<Set<Binding>> result = new LinkedHashSet<Set<Binding>>();
      for (Binding b: var.bindings()) {
        result.addAll(expandBinding(b, seen));
      }
      return ImmutableList.copyOf(result);
    }

    /**
     * @param b
     * @param seen bindings being expanded on the path
     * @return sets containing b plus one expansion of each parameter
     */
    private List<Set<Binding>> expandBinding(Binding b, Set<Binding> seen) {
      List<Variable> params = parameters(b);
      if (params.isEmpty() || seen.contains(b)) {
        return ImmutableList.<Set<Binding>>of(ImmutableSet.of(b));
      }

      Pair<Pair<Variable, Binding>, Set<Binding>> key =
          Pair.create(Pair.create(b.variable(), b), visibleSeen(b, seen));
      List<Set<Binding>> cached = memo.get(key);
      if (cached != null) {
        memoHits++;
        return cached;
      }

      Set<Binding> innerSeen = ImmutableSet.<Binding>builder()
                  .addAll(seen).add(b).build();
      List<List<Set<Binding>>> choices =
          new ArrayList<List<Set<Binding>>>(params.size() + 1);
      choices.add(ImmutableList.<Set<Binding>>of(ImmutableSet.of(b)));
      for (Variable param: params) {
        choices.add(expandVariable(param, innerSeen));
      }
      List<Set<Binding>> result = combine(choices);
      memo.put(key, result);
      return result;
    }

    /**
     * Unions of one choice from each list.  Each union counts toward the
     * complexity limit.
     * @return deduplicated unions
     */
    private List<Set<Binding>> combine(List<List<Set<Binding>>> choices) {
      Set<Set<Binding>> result = new LinkedHashSet<Set<Binding>>();
      for (List<Set<Binding>> combo: Lists.cartesianProduct(choices)) {
        complexity.inc();
        ImmutableSet.Builder<Binding> union = ImmutableSet.builder();
        for (Set<Binding> part: combo) {
          union.addAll(part);
        }
        result.add(union.build());
      }
      return ImmutableList.copyOf(result);
    }

    /**
     * The part of seen that the expansion of b can observe: only bindings
     * reachable through b's parameters are ever checked against seen.
     */
    private Set<Binding> visibleSeen(Binding b, Set<Binding> seen) {
      if (seen.isEmpty()) {
        return seen;
      }
      return ImmutableSet.copyOf(Sets.intersection(seen, reachable(b)));
    }

    private Set<Binding> reachable(Binding b) {
      Set<Binding> result = reachable.get(b);
      if (result != null) {
        return result;
      }

      result = new HashSet<Binding>();
      Set<Variable> visited = new HashSet<Variable>();
      Deque<Variable> work = new ArrayDeque<Variable>(parameters(b));
      while (!work.isEmpty()) {
        Variable var = work.removeFirst();
        if (visited.add(var)) {
          for (Binding vb: var.bindings()) {
            result.add(vb);
            work.addAll(parameters(vb));
          }
        }
      }
      reachable.put(b, result);
      return result;
    }

    private List<Variable> parameters(Binding b) {
      List<Variable> result = parameters.get(b);
      if (result == null) {
        result = new ArrayList<Variable>();
        for (Variable param: b.parameters()) {
          if (!param.isEmpty()) {
            result.add(param);
          }
        }
        parameters.put(b, result);
      }
      return result;
    }
  }

  private static List<List<Binding>> nonEmptyBindings(List<Variable> vars) {
    List<List<Binding>> result = new ArrayList<List<Binding>>(vars.size());
    for (Variable var: vars) {
      if (!var.isEmpty()) {
        result.add(var.bindings());
      }
    }
    return result;
  }
}
