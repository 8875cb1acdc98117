package exm.tgs.typegraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.tgs.common.util.Monitored;

public class VariableTest {

  @Test
  public void testAddBindingDeduplicates() {
    Program prog = new Program();
    Variable v = prog.newVariable("v");
    assertTrue(v.isEmpty());
    Binding b1 = v.addBinding("data");
    Binding b2 = v.addBinding(new String("data"));
    assertSame(b1, b2);
    assertEquals(1, v.bindings().size());
    v.addBinding("other");
    assertEquals(Arrays.<Object>asList("data", "other"), v.data());
  }

  @Test
  public void testListenersNotifiedOnNewData() {
    Program prog = new Program();
    Variable v = prog.newVariable("v");
    final List<Monitored> changes = new ArrayList<Monitored>();
    Monitored.ChangeListener listener = new Monitored.ChangeListener() {
      @Override
      public void changed(Monitored source) {
        changes.add(source);
      }
    };
    v.addChangeListener(listener);
    v.addBinding(1);
    v.addBinding(1);
    v.addBinding(2);
    assertEquals(Arrays.<Monitored>asList(v, v), changes);

    v.removeChangeListener(listener);
    v.addBinding(3);
    assertEquals(2, changes.size());
  }

  @Test
  public void testBindingParameters() {
    Program prog = new Program();
    final Variable param = prog.newVariable("param");
    Variable v = prog.newVariable("v");
    Binding plain = v.addBinding("plain");
    Binding nested = v.addBinding(new Parameterized() {
      @Override
      public List<Variable> parameterVariables() {
        return Collections.singletonList(param);
      }
    });
    assertEquals(Collections.emptyList(), plain.parameters());
    assertEquals(Collections.singletonList(param), nested.parameters());
    assertSame(v, nested.variable());
  }

  @Test
  public void testBindingEqualityFollowsData() {
    Program prog = new Program();
    Variable v1 = prog.newVariable("v1", Arrays.asList("a"));
    Variable v2 = prog.newVariable("v2", Arrays.asList("a"));
    assertNotSame(v1.bindings().get(0), v2.bindings().get(0));
    assertEquals(v1.bindings().get(0), v2.bindings().get(0));
    assertEquals(v1.bindings().get(0).hashCode(),
                 v2.bindings().get(0).hashCode());
  }

  @Test
  public void testCFGEdges() {
    Program prog = new Program();
    CFGNode n1 = prog.newCFGNode();
    CFGNode n2 = n1.connectNew("n2");
    n1.connectTo(n2);
    assertEquals(Collections.singletonList(n2), n1.outgoing());
    assertEquals(Collections.singletonList(n1), n2.incoming());
    assertEquals(Arrays.asList(n1, n2), prog.cfgNodes());
    assertEquals("n" + n1.id(), n1.name());
  }
}
