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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Function;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import exm.tgs.common.exceptions.TooComplexException;
import exm.tgs.typegraph.Binding;
import exm.tgs.typegraph.Variable;

/**
 * Cartesian products over the bindings of variables.
 */
public class VariableProduct {

  /**
   * All combinations picking one binding from each variable, in variable
   * order.  No variables gives one empty combination; a variable with no
   * bindings gives no combinations.
   * @param variables
   * @return lazy view of the product
   */
  public static List<List<Binding>> variableProduct(List<Variable> variables) {
    List<List<Binding>> bindingLists =
            new ArrayList<List<Binding>>(variables.size());
    for (Variable var: variables) {
      bindingLists.add(var.bindings());
    }
    return Lists.cartesianProduct(bindingLists);
  }

  /**
   * Like {@link #variableProduct(List)} but each combination maps the
   * variable's key to its chosen binding.
   * @param variables
   * @return lazy view of the product
   */
  public static <K> Iterable<Map<K, Binding>> variableProductMap(
                                        Map<K, Variable> variables) {
    final List<K> keys = new ArrayList<K>(variables.keySet());
    List<Variable> vars = new ArrayList<Variable>(variables.values());
    return Iterables.transform(variableProduct(vars),
        new Function<List<Binding>, Map<K, Binding>>() {
          @Override
          public Map<K, Binding> apply(List<Binding> row) {
            Map<K, Binding> result = new LinkedHashMap<K, Binding>();
            for (int i = 0; i < keys.size(); i++) {
              result.put(keys.get(i), row.get(i));
            }
            return result;
          }
        });
  }

  /**
   * Combinations of bindings, expanding the parameters of chosen bindings
   * recursively.  The limit on combinations built is taken from
   * {@link exm.tgs.common.Settings#DEEP_PRODUCT_LIMIT}.
   * @see DeepVariableProduct
   * @throws TooComplexException while iterating, if the limit is passed
   */
  public static Iterable<Set<Binding>> deepVariableProduct(
                                          List<Variable> variables) {
    return new DeepVariableProduct(variables);
  }

  /**
   * @param limit max combinations to build
   * @throws TooComplexException while iterating, if the limit is passed
   */
  public static Iterable<Set<Binding>> deepVariableProduct(
                              List<Variable> variables, long limit) {
    return new DeepVariableProduct(variables, limit);
  }
}
