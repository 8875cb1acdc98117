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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Owns the CFG nodes and variables of one analysis and hands out their ids.
 */
public class Program {

  private int nextNodeID = 0;
  private int nextVariableID = 0;

  private final List<CFGNode> cfgNodes = new ArrayList<CFGNode>();

  public CFGNode newCFGNode() {
    return newCFGNode(null);
  }

  public CFGNode newCFGNode(String name) {
    CFGNode node = new CFGNode(this, nextNodeID++, name);
    cfgNodes.add(node);
    return node;
  }

  public Variable newVariable(String name) {
    return new Variable(this, nextVariableID++, name);
  }

  /**
   * Create variable with one binding per datum
   * @param name
   * @param data
   * @return
   */
  public Variable newVariable(String name, Collection<?> data) {
    Variable var = newVariable(name);
    for (Object datum: data) {
      var.addBinding(datum);
    }
    return var;
  }

  /**
   * @return nodes in creation order
   */
  public List<CFGNode> cfgNodes() {
    return Collections.unmodifiableList(cfgNodes);
  }
}
