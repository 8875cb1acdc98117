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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.google.common.collect.ForwardingMap;

/**
 * Map with a change stamp that increases whenever the logical contents of
 * the map change.  This lets callers cache results derived from the map and
 * cheaply check whether the cache is stale.
 *
 * The stamp advances when:
 * - a new key is inserted
 * - a key is removed
 * - a value is replaced by one that is not equal to it
 * - a stored value implementing {@link Monitored} reports a change
 *
 * Re-putting an equal value, or removing an absent key, leaves the stamp
 * as it was.  Views are read-only; modify through the map itself.
 */
public class MonitorMap<K, V> extends ForwardingMap<K, V> {

  private final Map<K, V> map;

  private long changestamp;

  private final Monitored.ChangeListener listener =
      new Monitored.ChangeListener() {
        @Override
        public void changed(Monitored source) {
          changestamp++;
        }
      };

  public MonitorMap() {
    this.map = new LinkedHashMap<K, V>();
    this.changestamp = 0;
  }

  public static <K1, V1> MonitorMap<K1, V1> create() {
    return new MonitorMap<K1, V1>();
  }

  @Override
  protected Map<K, V> delegate() {
    return map;
  }

  /**
   * @return current stamp, never decreases
   */
  public long changestamp() {
    return changestamp;
  }

  @Override
  public V put(K key, V value) {
    boolean existed = map.containsKey(key);
    V prev = map.put(key, value);
    if (!existed) {
      changestamp++;
      watch(value);
    } else if (!Objects.equals(prev, value)) {
      changestamp++;
      unwatch(prev);
      watch(value);
    } else if (prev != value) {
      // Equal but distinct object: move listener to stored object
      unwatch(prev);
      watch(value);
    }
    return prev;
  }

  @Override
  public void putAll(Map<? extends K, ? extends V> m) {
    standardPutAll(m);
  }

  @Override
  public V remove(Object key) {
    if (!map.containsKey(key)) {
      return null;
    }
    V prev = map.remove(key);
    changestamp++;
    unwatch(prev);
    return prev;
  }

  @Override
  public void clear() {
    for (V value: map.values()) {
      unwatch(value);
      changestamp++;
    }
    map.clear();
  }

  @Override
  public V putIfAbsent(K key, V value) {
    V curr = get(key);
    if (curr == null) {
      curr = put(key, value);
    }
    return curr;
  }

  @Override
  public V computeIfAbsent(K key,
                    Function<? super K, ? extends V> mappingFunction) {
    V curr = get(key);
    if (curr == null) {
      V newValue = mappingFunction.apply(key);
      if (newValue != null) {
        put(key, newValue);
        return newValue;
      }
    }
    return curr;
  }

  @Override
  public V computeIfPresent(K key,
          BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    V curr = get(key);
    if (curr == null) {
      return null;
    }
    return store(key, remappingFunction.apply(key, curr));
  }

  @Override
  public V compute(K key,
          BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    return store(key, remappingFunction.apply(key, get(key)));
  }

  @Override
  public V merge(K key, V value,
          BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
    V curr = get(key);
    V newValue = curr == null ? value : remappingFunction.apply(curr, value);
    return store(key, newValue);
  }

  @Override
  public boolean remove(Object key, Object value) {
    if (map.containsKey(key) && Objects.equals(map.get(key), value)) {
      remove(key);
      return true;
    }
    return false;
  }

  @Override
  public V replace(K key, V value) {
    if (map.containsKey(key)) {
      return put(key, value);
    }
    return null;
  }

  @Override
  public boolean replace(K key, V oldValue, V newValue) {
    if (map.containsKey(key) && Objects.equals(map.get(key), oldValue)) {
      put(key, newValue);
      return true;
    }
    return false;
  }

  @Override
  public void replaceAll(
          BiFunction<? super K, ? super V, ? extends V> function) {
    for (K key: new ArrayList<K>(map.keySet())) {
      put(key, function.apply(key, map.get(key)));
    }
  }

  @Override
  public Set<K> keySet() {
    return Collections.unmodifiableSet(map.keySet());
  }

  @Override
  public Set<Entry<K, V>> entrySet() {
    return Collections.unmodifiableMap(map).entrySet();
  }

  @Override
  public Collection<V> values() {
    return Collections.unmodifiableCollection(map.values());
  }

  /**
   * Store result of remapping: null means remove
   */
  private V store(K key, V newValue) {
    if (newValue == null) {
      remove(key);
    } else {
      put(key, newValue);
    }
    return newValue;
  }

  private void watch(V value) {
    if (value instanceof Monitored) {
      ((Monitored)value).addChangeListener(listener);
    }
  }

  private void unwatch(V value) {
    if (value instanceof Monitored) {
      ((Monitored)value).removeChangeListener(listener);
    }
  }
}
