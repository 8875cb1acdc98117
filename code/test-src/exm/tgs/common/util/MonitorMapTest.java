package exm.tgs.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.tgs.typegraph.Program;
import exm.tgs.typegraph.Variable;

public class MonitorMapTest {

  @Test
  public void testMonitorMap() {
    Program prog = new Program();
    MonitorMap<String, Variable> d = MonitorMap.create();
    long changestamp = d.changestamp();
    Variable var = prog.newVariable("var");
    d.put("key", var);
    assertTrue(d.changestamp() > changestamp);
    changestamp = d.changestamp();
    var.addBinding("data");
    assertTrue(d.changestamp() > changestamp);
    changestamp = d.changestamp();
    // Duplicate data: no change
    var.addBinding("data");
    assertEquals(changestamp, d.changestamp());
    d.remove("key");
    assertTrue(d.changestamp() > changestamp);
  }

  @Test
  public void testUnchangedOperations() {
    Program prog = new Program();
    MonitorMap<String, Variable> d = MonitorMap.create();
    Variable var = prog.newVariable("var");
    d.put("key", var);
    long changestamp = d.changestamp();
    d.put("key", var);
    d.remove("missing");
    d.putIfAbsent("key", prog.newVariable("other"));
    assertEquals(changestamp, d.changestamp());
  }

  @Test
  public void testRemovedValueNotWatched() {
    Program prog = new Program();
    MonitorMap<String, Variable> d = MonitorMap.create();
    Variable var1 = prog.newVariable("var1");
    Variable var2 = prog.newVariable("var2");
    d.put("key", var1);
    long changestamp = d.changestamp();
    d.put("key", var2);
    assertTrue(d.changestamp() > changestamp);

    changestamp = d.changestamp();
    var1.addBinding(1);
    assertEquals(changestamp, d.changestamp());
    var2.addBinding(1);
    assertEquals(changestamp + 1, d.changestamp());
  }

  @Test
  public void testClearCountsEachEntry() {
    MonitorMap<String, Integer> d = MonitorMap.create();
    d.put("a", 1);
    d.put("b", 2);
    d.put("c", 3);
    long changestamp = d.changestamp();
    d.clear();
    assertEquals(changestamp + 3, d.changestamp());
    assertTrue(d.isEmpty());
  }

  @Test
  public void testDerivedOperations() {
    MonitorMap<String, Integer> d = MonitorMap.create();
    long changestamp = d.changestamp();
    d.merge("a", 1, Integer::sum);
    assertEquals(++changestamp, d.changestamp());
    d.merge("a", 1, Integer::sum);
    assertEquals(++changestamp, d.changestamp());
    assertEquals(Integer.valueOf(2), d.get("a"));
    d.computeIfPresent("a", (k, v) -> null);
    assertEquals(++changestamp, d.changestamp());
    assertTrue(d.isEmpty());
    d.replace("a", 5);
    assertEquals(changestamp, d.changestamp());
  }

  @Test(expected=UnsupportedOperationException.class)
  public void testViewsReadOnly() {
    MonitorMap<String, Integer> d = MonitorMap.create();
    d.put("a", 1);
    d.keySet().remove("a");
  }
}
