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
package exm.tgs.common.util;

import exm.tgs.common.exceptions.TGSRuntimeError;

/**
 * A dynamically scoped variable, for passing context implicitly down the
 * call stack.
 *
 * <pre>
 * try (DynamicVar.Binding b = callStack.bind(frame)) {
 *   ... callStack.get() == frame here and in callees ...
 * }
 * </pre>
 *
 * The previous value is restored when the binding is closed, which
 * try-with-resources guarantees on every exit path.  Bindings must be closed
 * in the reverse order they were made.  Not thread-safe: give each thread
 * its own instance.
 * @param <T>
 */
public class DynamicVar<T> {

  private final T defaultValue;

  private final StackLite<Binding> frames = new StackLite<Binding>();

  public DynamicVar() {
    this(null);
  }

  public DynamicVar(T defaultValue) {
    this.defaultValue = defaultValue;
  }

  /**
   * @return value of innermost active binding, or default if none
   */
  public T get() {
    if (frames.isEmpty()) {
      return defaultValue;
    }
    return frames.peek().value;
  }

  /**
   * @return number of active bindings
   */
  public int depth() {
    return frames.size();
  }

  /**
   * Bind value until the returned binding is closed
   * @param value
   * @return
   */
  public Binding bind(T value) {
    Binding binding = new Binding(value);
    frames.push(binding);
    return binding;
  }

  public class Binding implements AutoCloseable {
    private final T value;
    private boolean closed = false;

    private Binding(T value) {
      this.value = value;
    }

    public T value() {
      return value;
    }

    /**
     * Restore previous value.  Closing twice has no further effect.
     */
    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (frames.isEmpty() || frames.peek() != this) {
        throw new TGSRuntimeError("Dynamic binding of " + value +
                                  " closed out of order");
      }
      frames.pop();
      closed = true;
    }
  }
}
