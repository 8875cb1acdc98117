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

import java.util.ArrayList;
import java.util.EmptyStackException;

/**
 * Lightweight LIFO stack on top of ArrayList.  Index 0 is the bottom.
 * @param <T>
 */
public class StackLite<T> extends ArrayList<T> {

  private static final long serialVersionUID = 1L;

  public void push(T o) {
    this.add(o);
  }

  public T pop() {
    checkNotEmpty();
    return this.remove(this.size() - 1);
  }

  public T peek() {
    checkNotEmpty();
    return this.get(this.size() - 1);
  }

  private void checkNotEmpty() {
    if (isEmpty()) {
      throw new EmptyStackException();
    }
  }
}
