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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Parameter list of a memoized function: parameter names in order, default
 * values for trailing optional parameters, and whether calls have a
 * receiver (referred to as "self").
 */
public class Signature {
  public static final String SELF = "self";

  private final boolean hasReceiver;
  private final List<String> params;
  private final Map<String, Object> defaults;

  private Signature(boolean hasReceiver, List<String> params,
                    Map<String, Object> defaults) {
    this.hasReceiver = hasReceiver;
    this.params = ImmutableList.copyOf(params);
    // May hold null defaults, so no ImmutableMap
    this.defaults = Collections.unmodifiableMap(
                            new LinkedHashMap<String, Object>(defaults));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Shorthand for a signature without receiver or defaults
   */
  public static Signature of(String ...params) {
    Builder b = builder();
    for (String param: params) {
      b.param(param);
    }
    return b.build();
  }

  public boolean hasReceiver() {
    return hasReceiver;
  }

  public List<String> params() {
    return params;
  }

  public boolean hasParam(String name) {
    return params.contains(name);
  }

  public boolean hasDefault(String name) {
    return defaults.containsKey(name);
  }

  /**
   * Match arguments to parameters, filling in defaults
   * @param receiver must be non-null iff signature has a receiver
   * @param positional leading arguments in parameter order
   * @param named remaining arguments by name
   * @return bound arguments
   * @throws IllegalArgumentException if arguments don't fit signature
   */
  public CallArgs bind(Object receiver, List<?> positional,
                       Map<String, ?> named) {
    if (hasReceiver && receiver == null) {
      throw new IllegalArgumentException("Call is missing receiver");
    } else if (!hasReceiver && receiver != null) {
      throw new IllegalArgumentException("Unexpected receiver " + receiver);
    }
    if (positional.size() > params.size()) {
      throw new IllegalArgumentException("Expected at most " + params.size() +
          " arguments " + params + " but got " + positional.size());
    }

    Map<String, Object> values = new LinkedHashMap<String, Object>();
    for (int i = 0; i < positional.size(); i++) {
      values.put(params.get(i), positional.get(i));
    }

    for (Map.Entry<String, ?> e: named.entrySet()) {
      String name = e.getKey();
      if (!params.contains(name)) {
        throw new IllegalArgumentException("Unknown argument " + name +
                                           ", expected one of " + params);
      }
      if (values.containsKey(name)) {
        throw new IllegalArgumentException("Argument " + name +
                                           " given twice");
      }
      values.put(name, e.getValue());
    }

    // Rebuild in parameter order so equal calls bind identically
    Map<String, Object> ordered = new LinkedHashMap<String, Object>();
    for (String param: params) {
      if (values.containsKey(param)) {
        ordered.put(param, values.get(param));
      } else if (defaults.containsKey(param)) {
        ordered.put(param, defaults.get(param));
      } else {
        throw new IllegalArgumentException("Missing argument " + param);
      }
    }
    return new CallArgs(receiver, ordered);
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<String>();
    if (hasReceiver) {
      parts.add(SELF);
    }
    for (String param: params) {
      parts.add(defaults.containsKey(param) ?
                param + "=" + defaults.get(param) : param);
    }
    return "(" + String.join(", ", parts) + ")";
  }

  public static class Builder {
    private boolean hasReceiver = false;
    private final List<String> params = new ArrayList<String>();
    private final Map<String, Object> defaults =
                        new LinkedHashMap<String, Object>();

    public Builder receiver() {
      this.hasReceiver = true;
      return this;
    }

    public Builder param(String name) {
      checkName(name);
      Preconditions.checkArgument(defaults.isEmpty(),
          "Required parameter %s follows optional parameter", name);
      params.add(name);
      return this;
    }

    public Builder param(String name, Object defaultVal) {
      checkName(name);
      params.add(name);
      defaults.put(name, defaultVal);
      return this;
    }

    private void checkName(String name) {
      Preconditions.checkArgument(!SELF.equals(name),
          "%s is reserved for the receiver", SELF);
      Preconditions.checkArgument(!params.contains(name),
          "Duplicate parameter %s", name);
    }

    public Signature build() {
      return new Signature(hasReceiver, params, defaults);
    }
  }
}
