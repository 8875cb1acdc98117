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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Function;

import org.apache.log4j.Logger;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.tgs.common.Logging;
import exm.tgs.common.exceptions.CircularGraphException;

/**
 * Lazy topological sort of arbitrary items.
 *
 * Each item is yielded only after all of its predecessors that are also
 * in the input.  Items become ready in input order and are yielded first
 * come first served, so the result is deterministic for a given input
 * order.  If items remain but none is ready, the iterator throws
 * {@link CircularGraphException}.
 *
 * Items without ordering constraints can be sorted with
 * {@link #noPredecessors()}, or mixed in by a predecessor function that
 * returns an empty collection for them.
 */
public class TopologicalSort {

  private static final Logger logger = Logging.getTGSLogger();

  public static <T extends PredecessorReporting<? extends T>>
        Iterator<T> sort(Collection<T> items) {
    return sort(items, new Function<T, Collection<?>>() {
      @Override
      public Collection<?> apply(T item) {
        return item.predecessors();
      }
    });
  }

  /**
   * Adapter for items that carry no ordering constraints
   */
  public static <T> Function<T, Collection<?>> noPredecessors() {
    return new Function<T, Collection<?>>() {
      @Override
      public Collection<?> apply(T item) {
        return Collections.emptyList();
      }
    };
  }

  /**
   * @param items no duplicates
   * @param predecessors items that must come before the argument
   * @return lazy iterator over items in topological order
   */
  public static <T> Iterator<T> sort(Collection<T> items,
          Function<? super T, ? extends Collection<?>> predecessors) {
    return new SortIterator<T>(items, predecessors);
  }

  /**
   * Sort eagerly.
   * @throws CircularGraphException
   */
  public static <T> List<T> sortToList(Collection<T> items,
          Function<? super T, ? extends Collection<?>> predecessors) {
    List<T> result = new ArrayList<T>(items.size());
    Iterator<T> it = sort(items, predecessors);
    while (it.hasNext()) {
      result.add(it.next());
    }
    return result;
  }

  private static class SortIterator<T> implements Iterator<T> {
    /** Unyielded predecessors of each unyielded item */
    private final Map<T, Set<T>> waitingOn;

    /** Reverse edges: predecessor to items that wait on it */
    private final SetMultimap<T, T> successors;

    private final Deque<T> ready;

    SortIterator(Collection<T> items,
            Function<? super T, ? extends Collection<?>> predecessors) {
      this.waitingOn = new LinkedHashMap<T, Set<T>>();
      for (T item: items) {
        waitingOn.put(item, new LinkedHashSet<T>());
      }

      this.successors = LinkedHashMultimap.create();
      this.ready = new ArrayDeque<T>();
      for (T item: items) {
        Set<T> preds = waitingOn.get(item);
        for (Object pred: predecessors.apply(item)) {
          // Predecessors outside input are ignored
          if (waitingOn.containsKey(pred)) {
            @SuppressWarnings("unchecked")
            T inputPred = (T)pred;
            preds.add(inputPred);
            successors.put(inputPred, item);
          }
        }
        if (preds.isEmpty()) {
          ready.add(item);
        }
      }
    }

    @Override
    public boolean hasNext() {
      return !waitingOn.isEmpty();
    }

    @Override
    public T next() {
      if (waitingOn.isEmpty()) {
        throw new NoSuchElementException();
      }
      if (ready.isEmpty()) {
        List<T> remaining = new ArrayList<T>(waitingOn.keySet());
        logger.debug("Cycle among " + remaining);
        throw new CircularGraphException(remaining);
      }

      T item = ready.removeFirst();
      waitingOn.remove(item);
      for (T succ: successors.get(item)) {
        Set<T> succPreds = waitingOn.get(succ);
        succPreds.remove(item);
        if (succPreds.isEmpty()) {
          ready.addLast(succ);
        }
      }
      return item;
    }
  }
}
