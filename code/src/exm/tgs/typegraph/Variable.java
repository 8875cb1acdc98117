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
package exm.tgs.typegraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.tgs.common.util.Monitored;

/**
 * A slot holding the set of values possible at some point in the program.
 * A variable without bindings means no value reaches it.
 *
 * Variables are compared by identity.
 */
public class Variable implements Monitored {

  private final Program program;
  private final int id;
  private final String name;

  /** Data to binding, in insertion order */
  private final Map<Object, Binding> bindings =
          new LinkedHashMap<Object, Binding>();

  private final List<ChangeListener> listeners =
          new ArrayList<ChangeListener>();

  Variable(Program program, int id, String name) {
    this.program = program;
    this.id = id;
    this.name = name;
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  public Program program() {
    return program;
  }

  public List<Binding> bindings() {
    return Collections.unmodifiableList(new ArrayList<Binding>(bindings.values()));
  }

  public List<Object> data() {
    List<Object> result = new ArrayList<Object>(bindings.size());
    for (Binding b: bindings.values()) {
      result.add(b.data());
    }
    return result;
  }

  public boolean isEmpty() {
    return bindings.isEmpty();
  }

  /**
   * Add a binding for data.  If an equal datum is already bound, returns
   * the existing binding and does not notify listeners.
   * @param data
   * @return
   */
  public Binding addBinding(Object data) {
    Binding existing = bindings.get(data);
    if (existing != null) {
      return existing;
    }
    Binding b = new Binding(this, data);
    bindings.put(data, b);
    // Copy: listeners may unregister while being notified
    for (ChangeListener listener: new ArrayList<ChangeListener>(listeners)) {
      listener.changed(this);
    }
    return b;
  }

  @Override
  public void addChangeListener(ChangeListener listener) {
    listeners.add(listener);
  }

  @Override
  public void removeChangeListener(ChangeListener listener) {
    listeners.remove(listener);
  }

  @Override
  public String toString() {
    return "v" + id + (name != null ? "(" + name + ")" : "") + "=" +
            bindings.keySet();
  }
}
