package exm.tgs.product;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.tgs.typegraph.Parameterized;
import exm.tgs.typegraph.Variable;

/**
 * Binding data with parameters, for testing deep products.
 * Compared by identity.
 */
class DummyValue implements Parameterized {
  private final int index;
  private List<Variable> parameters = new ArrayList<Variable>();
  int parameterCalls = 0;

  DummyValue(int index) {
    this.index = index;
  }

  void setParameters(Variable ...params) {
    this.parameters = Arrays.asList(params);
  }

  @Override
  public List<Variable> parameterVariables() {
    parameterCalls++;
    return parameters;
  }

  @Override
  public String toString() {
    return "x" + index;
  }
}
