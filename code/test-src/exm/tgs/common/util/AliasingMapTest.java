package exm.tgs.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tgs.common.exceptions.AliasConflictException;
import exm.tgs.typegraph.Program;
import exm.tgs.typegraph.Variable;

public class AliasingMapTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private Program prog;

  @Before
  public void setUp() {
    prog = new Program();
  }

  private static Map<String, Object> query(String ...keys) {
    Map<String, Object> q = new HashMap<String, Object>();
    for (String key: keys) {
      q.put(key, null);
    }
    return q;
  }

  @Test
  public void testAliasingMap() throws AliasConflictException {
    AliasingMap<String, Variable> d = AliasingMap.create();
    d.addAlias("alias", "name");
    assertFalse(d.containsKey("alias"));
    assertFalse(d.containsKey("name"));
    Variable var1 = prog.newVariable("var1");
    d.put("alias", var1);
    assertTrue(d.containsKey("name"));
    assertTrue(d.containsKey("alias"));
    assertSame(var1, d.get("name"));
    assertSame(d.get("name"), d.get("alias"));
    assertNull(d.get("other_name"));

    Variable var2 = prog.newVariable("var2");
    d.put("name", var2);
    assertSame(var2, d.get("name"));
    assertSame(d.get("name"), d.get("alias"));
    assertEquals(1, d.size());
    assertEquals(new HashSet<String>(Arrays.asList("name")), d.keySet());
  }

  @Test
  public void testRealiasing() throws AliasConflictException {
    AliasingMap<String, Variable> d = AliasingMap.create();
    d.addAlias("alias1", "name");
    d.addAlias("alias2", "name");
    try {
      d.addAlias("name", "other_name");
      fail("Canonical key of other aliases can't be realiased");
    } catch (AliasConflictException e) {
      assertEquals("name", e.getAlias());
    }
    try {
      d.addAlias("alias1", "other_name");
      fail("Alias can't be moved to a different key");
    } catch (AliasConflictException e) {
      assertEquals("other_name", e.getTarget());
    }
    d.addAlias("alias1", "name");
    d.addAlias("alias2", "alias1");
    d.addAlias("alias1", "alias2");

    Variable var = prog.newVariable("var");
    d.put("alias1", var);
    assertEquals(1, d.size());
    assertSame(var, d.get("name"));
    assertSame(var, d.get("alias1"));
    assertSame(var, d.get("alias2"));
    assertFalse(d.sameKey("other_name", "name"));
  }

  @Test
  public void testConflictLeavesMapUnchanged() throws AliasConflictException {
    AliasingMap<String, Integer> d = AliasingMap.create();
    d.addAlias("alias1", "name");
    d.put("other", 1);
    try {
      d.addAlias("other", "name");
      fail("Key with entry can't become an alias");
    } catch (AliasConflictException e) {
      // expected
    }
    assertFalse(d.sameKey("other", "name"));
    assertEquals(Integer.valueOf(1), d.get("other"));
    assertEquals("name", d.canonicalKey("alias1"));
    assertEquals(new HashSet<String>(Arrays.asList("name", "alias1")),
                 d.keysFor("alias1"));
  }

  @Test
  public void testMatches() throws AliasConflictException {
    AliasingMap<String, Variable> d = AliasingMap.create();
    d.put("name1", null);
    d.put("name2", null);
    d.addAlias("alias1", "name1");
    d.addAlias("alias2", "name2");
    d.addAlias("alias3", "name2");
    assertTrue(d.matches(query("name1", "name2")));
    assertTrue(d.matches(query("name1", "alias2")));
    assertTrue(d.matches(query("name1", "alias3")));
    assertTrue(d.matches(query("alias1", "name2")));
    assertTrue(d.matches(query("alias1", "alias2")));
    assertTrue(d.matches(query("alias1", "alias3")));
    assertTrue(d.matches(query("name1", "name2", "name3")));
    assertFalse(d.matches(query("name1", "alias1")));
    assertFalse(d.matches(query("alias2", "alias3")));
    assertFalse(d.matches(query("name2")));
    assertFalse(d.matches(query("name1", "name4")));
  }

  @Test
  public void testTransitive() throws AliasConflictException {
    AliasingMap<String, Variable> d = AliasingMap.create();
    d.addAlias("alias1", "name");
    d.addAlias("alias2", "alias1");
    d.put("name", prog.newVariable("var"));
    assertEquals(1, d.size());
    assertSame(d.get("name"), d.get("alias1"));
    assertSame(d.get("alias1"), d.get("alias2"));
    assertTrue(d.sameKey("alias2", "name"));
  }

  @Test
  public void testAllOperationsResolveKey() throws AliasConflictException {
    AliasingMap<String, Integer> d = AliasingMap.create();
    d.addAlias("alias", "name");
    assertNull(d.putIfAbsent("alias", 1));
    assertEquals(Integer.valueOf(1), d.putIfAbsent("name", 2));
    assertEquals(Integer.valueOf(1), d.getOrDefault("alias", 5));
    assertEquals(Integer.valueOf(3), d.merge("alias", 2, Integer::sum));
    assertEquals(Integer.valueOf(3), d.replace("name", 4));
    assertTrue(d.replace("alias", 4, 5));
    assertEquals(Integer.valueOf(6),
                 d.computeIfPresent("alias", (k, v) -> v + 1));
    assertEquals(Integer.valueOf(6), d.computeIfAbsent("alias", k -> 0));
    assertEquals(Integer.valueOf(6), d.remove("alias"));
    assertTrue(d.isEmpty());

    d.put("name", 1);
    assertFalse(d.remove("alias", 2));
    assertTrue(d.remove("alias", 1));
    d.put("alias", 1);
    d.clear();
    assertTrue(d.isEmpty());
    // Aliases survive clear()
    assertTrue(d.sameKey("alias", "name"));
  }

  @Test
  public void testGetOrThrow() throws AliasConflictException {
    AliasingMap<String, Integer> d = AliasingMap.create();
    d.addAlias("alias", "name");
    d.put("name", 1);
    assertEquals(Integer.valueOf(1), d.getOrThrow("alias"));
    exception.expect(NoSuchElementException.class);
    d.getOrThrow("missing");
  }

  @Test
  public void testNullKey() throws AliasConflictException {
    AliasingMap<String, Integer> d = AliasingMap.create();
    d.addAlias("alias", "name");
    assertTrue(d.sameKey(null, null));
    assertFalse(d.sameKey(null, "name"));
    assertFalse(d.sameKey("alias", null));
    try {
      d.getOrThrow(null);
      fail("Expected missing entry");
    } catch (NoSuchElementException e) {
      // expected
    }
    d.put(null, 1);
    assertEquals(Integer.valueOf(1), d.getOrThrow(null));
  }

  @Test
  public void testAliasDeclaredBeforeChain() throws AliasConflictException {
    AliasingMap<String, Integer> d = AliasingMap.create();
    d.addAlias("alias2", "alias1");
    // alias1 is now canonical for alias2, so it can't become an alias
    exception.expect(AliasConflictException.class);
    d.addAlias("alias1", "name");
  }
}
