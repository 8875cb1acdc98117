package exm.tgs.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.Collections2;

import exm.tgs.common.exceptions.CircularGraphException;

public class TopologicalSortTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  /**
   * Graph node for testing topological sorting.
   */
  private static class Node implements PredecessorReporting<Node> {
    final String name;
    List<Node> incoming;

    Node(String name, Node ...incoming) {
      this.name = name;
      this.incoming = Arrays.asList(incoming);
    }

    @Override
    public Collection<Node> predecessors() {
      return incoming;
    }

    @Override
    public String toString() {
      return "Node(" + name + ")";
    }
  }

  private static <T> List<T> drain(Iterator<T> it) {
    List<T> result = new ArrayList<T>();
    while (it.hasNext()) {
      result.add(it.next());
    }
    return result;
  }

  @Test
  public void testTopologicalSort() {
    Node n1 = new Node("1");
    Node n2 = new Node("2", n1);
    Node n3 = new Node("3", n2);
    Node n4 = new Node("4", n2, n3);
    for (List<Node> permutation:
          Collections2.permutations(Arrays.asList(n1, n2, n3, n4))) {
      assertEquals(Arrays.asList(n1, n2, n3, n4),
                   drain(TopologicalSort.sort(permutation)));
    }
  }

  @Test
  public void testNonReportingItems() {
    Node n1 = new Node("1");
    Node n2 = new Node("2", n1);
    List<Object> items = Arrays.<Object>asList(n1, n2, 3, 4);
    final Map<Object, Collection<?>> preds = new HashMap<Object, Collection<?>>();
    preds.put(n1, n1.predecessors());
    preds.put(n2, n2.predecessors());
    List<Object> sorted = drain(TopologicalSort.sort(items,
        new Function<Object, Collection<?>>() {
          @Override
          public Collection<?> apply(Object item) {
            return preds.getOrDefault(item,
                                      Collections.<Object>emptyList());
          }
        }));
    assertSame(n2, sorted.get(sorted.size() - 1));
    // Ready items keep input order
    assertEquals(Arrays.<Object>asList(n1, 3, 4, n2), sorted);
  }

  @Test
  public void testNoPredecessors() {
    List<Integer> items = Arrays.asList(3, 1, 2);
    assertEquals(items, TopologicalSort.sortToList(items,
                          TopologicalSort.<Integer>noPredecessors()));
  }

  @Test
  public void testPredecessorOutsideInputIgnored() {
    Node n1 = new Node("1");
    Node n2 = new Node("2", n1);
    Node n3 = new Node("3", n2);
    assertEquals(Arrays.asList(n3, n2),
        drain(TopologicalSort.sort(Arrays.asList(n3, n2))));
  }

  @Test
  public void testTopologicalSortCycle() {
    Node n1 = new Node("1");
    Node n2 = new Node("2");
    n1.incoming = Arrays.asList(n2);
    n2.incoming = Arrays.asList(n1);
    Iterator<Node> it = TopologicalSort.sort(Arrays.asList(n1, n2));
    assertTrue(it.hasNext());
    exception.expect(CircularGraphException.class);
    it.next();
  }

  @Test
  public void testTopologicalSortSubCycle() {
    Node n1 = new Node("1");
    Node n2 = new Node("2");
    Node n3 = new Node("3");
    n1.incoming = Arrays.asList(n2);
    n2.incoming = Arrays.asList(n1);
    n3.incoming = Arrays.asList(n1, n2);
    try {
      drain(TopologicalSort.sort(Arrays.asList(n1, n2, n3)));
      fail("Expected cycle to be detected");
    } catch (CircularGraphException e) {
      assertEquals(3, e.getRemaining().size());
    }
  }

  @Test
  public void testCycleAfterPartialOutput() {
    Node n0 = new Node("0");
    Node n1 = new Node("1");
    Node n2 = new Node("2");
    n1.incoming = Arrays.asList(n0, n2);
    n2.incoming = Arrays.asList(n1);
    Iterator<Node> it = TopologicalSort.sort(Arrays.asList(n2, n1, n0));
    assertSame(n0, it.next());
    try {
      it.next();
      fail("Expected cycle to be detected");
    } catch (CircularGraphException e) {
      assertEquals(Arrays.asList(n2, n1), new ArrayList<Object>(e.getRemaining()));
    }
  }

  @Test
  public void testSelfLoop() {
    Node n1 = new Node("1");
    n1.incoming = Arrays.asList(n1);
    exception.expect(CircularGraphException.class);
    TopologicalSort.sort(Arrays.asList(n1)).next();
  }

  @Test
  public void testEmpty() {
    assertEquals(Collections.emptyList(),
        drain(TopologicalSort.sort(Collections.<Node>emptyList())));
  }
}
