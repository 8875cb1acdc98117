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
package exm.tgs.common.memo;

import java.util.Collections;
import java.util.Map;

/**
 * Arguments of one call, bound to parameter names with defaults applied
 */
public class CallArgs {
  private final Object receiver;
  private final Map<String, Object> values;

  CallArgs(Object receiver, Map<String, Object> values) {
    this.receiver = receiver;
    this.values = Collections.unmodifiableMap(values);
  }

  public Object receiver() {
    return receiver;
  }

  public <T> T receiver(Class<T> clazz) {
    return clazz.cast(receiver);
  }

  public Object get(String name) {
    if (Signature.SELF.equals(name)) {
      return receiver;
    }
    if (!values.containsKey(name)) {
      throw new IllegalArgumentException("No argument named " + name);
    }
    return values.get(name);
  }

  public <T> T get(String name, Class<T> clazz) {
    return clazz.cast(get(name));
  }

  /**
   * @return argument values by name, in parameter order
   */
  public Map<String, Object> values() {
    return values;
  }

  @Override
  public String toString() {
    return (receiver != null ? receiver + "." : "") + values;
  }
}
