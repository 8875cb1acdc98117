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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.tgs.common.Logging;

/**
 * Cache results of an expensive function by a projection of its arguments.
 *
 * Arguments are bound to the function's {@link Signature} before the key is
 * computed, so positional, named and defaulted forms of the same call share
 * one entry.  The key defaults to all arguments compared by value; a
 * {@link KeyExpression} can narrow it, or compare some arguments by
 * identity.
 *
 * Entries are never evicted: the cache lives as long as the memoizer.
 * Not thread-safe.
 *
 * @param <R> result type
 */
public class Memoizer<R> {

  private static final Logger logger = Logging.getTGSLogger();

  private final String name;
  private final Signature signature;
  private final KeyExpression keyExpr;
  private final Function<CallArgs, ? extends R> body;

  private final Map<Object, R> cache = new HashMap<Object, R>();

  private Memoizer(String name, Signature signature, KeyExpression keyExpr,
                   Function<CallArgs, ? extends R> body) {
    this.name = name;
    this.signature = signature;
    this.keyExpr = keyExpr;
    this.body = body;
  }

  public static Builder builder(Signature signature) {
    return new Builder(signature);
  }

  /**
   * Call without receiver, positional arguments only
   */
  public R call(Object ...args) {
    return callNamed(null, Arrays.asList(args),
                     Collections.<String, Object>emptyMap());
  }

  /**
   * Call with receiver, positional arguments only
   */
  public R callOn(Object receiver, Object ...args) {
    return callNamed(receiver, Arrays.asList(args),
                     Collections.<String, Object>emptyMap());
  }

  /**
   * @param receiver null if signature has no receiver
   * @param positional
   * @param named
   * @return cached or newly computed result
   * @throws IllegalArgumentException if the arguments don't match the
   *    signature or can't form a key
   */
  public R callNamed(Object receiver, List<?> positional,
                     Map<String, ?> named) {
    CallArgs args = signature.bind(receiver, positional, named);
    Object key = keyExpr.key(args);

    if (cache.containsKey(key)) {
      return cache.get(key);
    }

    if (logger.isTraceEnabled()) {
      logger.trace(name + ": cache miss for " + key);
    }
    // Don't use computeIfAbsent: body may call back into this memoizer
    R result = body.apply(args);
    cache.put(key, result);
    return result;
  }

  public Signature signature() {
    return signature;
  }

  public KeyExpression keyExpression() {
    return keyExpr;
  }

  /**
   * @return number of cached entries
   */
  public int size() {
    return cache.size();
  }

  public void clear() {
    cache.clear();
  }

  @Override
  public String toString() {
    return name + signature + " key=" + keyExpr;
  }

  /**
   * Memoize a single-argument function, keyed on the argument's value
   */
  public static <T, S> Function<T, S> memoize(Function<T, S> fn) {
    return memoize(fn, Function.<T>identity());
  }

  /**
   * Memoize a single-argument function
   * @param fn
   * @param keyProjection maps argument to cache key
   * @return
   */
  public static <T, S> Function<T, S> memoize(final Function<T, S> fn,
                  final Function<? super T, ?> keyProjection) {
    final Map<Object, S> cache = new HashMap<Object, S>();
    return new Function<T, S>() {
      @Override
      public S apply(T arg) {
        Object key = keyProjection.apply(arg);
        if (cache.containsKey(key)) {
          return cache.get(key);
        }
        S result = fn.apply(arg);
        cache.put(key, result);
        return result;
      }
    };
  }

  public static class Builder {
    private final Signature signature;
    private String name = "memoized";
    private String keyText = null;

    private Builder(Signature signature) {
      this.signature = signature;
    }

    /**
     * Name used in log messages
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Set key projection, see {@link KeyExpression}
     */
    public Builder key(String keyText) {
      this.keyText = keyText;
      return this;
    }

    public <R1> Memoizer<R1> build(Function<CallArgs, ? extends R1> body) {
      Preconditions.checkNotNull(body);
      KeyExpression keyExpr = keyText == null ?
          KeyExpression.allArgs(signature) :
          KeyExpression.parse(keyText, signature);
      return new Memoizer<R1>(name, signature, keyExpr, body);
    }
  }
}
