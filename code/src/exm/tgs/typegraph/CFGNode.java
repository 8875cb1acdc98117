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
import java.util.List;

import com.google.common.graph.SuccessorsFunction;

/**
 * A node in the control flow graph.  Edges are ordered by the order they
 * were added; duplicate edges are ignored.
 */
public class CFGNode {

  /**
   * Successor view used by the graph algorithms
   */
  public static final SuccessorsFunction<CFGNode> SUCCESSORS =
      new SuccessorsFunction<CFGNode>() {
        @Override
        public Iterable<CFGNode> successors(CFGNode node) {
          return node.outgoing();
        }
      };

  private final Program program;
  private final int id;
  private final String name;

  private final List<CFGNode> outgoing = new ArrayList<CFGNode>();
  private final List<CFGNode> incoming = new ArrayList<CFGNode>();

  CFGNode(Program program, int id, String name) {
    this.program = program;
    this.id = id;
    this.name = name != null ? name : ("n" + id);
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

  public List<CFGNode> outgoing() {
    return Collections.unmodifiableList(outgoing);
  }

  public List<CFGNode> incoming() {
    return Collections.unmodifiableList(incoming);
  }

  /**
   * Create a new node with an edge from this node to it
   * @param name
   * @return
   */
  public CFGNode connectNew(String name) {
    CFGNode node = program.newCFGNode(name);
    connectTo(node);
    return node;
  }

  public void connectTo(CFGNode node) {
    if (!outgoing.contains(node)) {
      outgoing.add(node);
      node.incoming.add(this);
    }
  }

  @Override
  public String toString() {
    return "<" + id + ">" + name;
  }
}
