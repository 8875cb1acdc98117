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

import java.util.Collections;
import java.util.List;

/**
 * One possible value of a variable.  Two bindings are equal if their data
 * are equal.
 */
public class Binding {

  private final Variable variable;
  private final Object data;

  Binding(Variable variable, Object data) {
    this.variable = variable;
    this.data = data;
  }

  public Variable variable() {
    return variable;
  }

  public Object data() {
    return data;
  }

  /**
   * @return nested variables of this binding's data, empty if it has none
   */
  public List<Variable> parameters() {
    if (data instanceof Parameterized) {
      return ((Parameterized)data).parameterVariables();
    }
    return Collections.emptyList();
  }

  @Override
  public int hashCode() {
    return data == null ? 0 : data.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Binding)) {
      return false;
    }
    Binding other = (Binding)obj;
    return data == null ? other.data == null : data.equals(other.data);
  }

  @Override
  public String toString() {
    return String.valueOf(data);
  }
}
