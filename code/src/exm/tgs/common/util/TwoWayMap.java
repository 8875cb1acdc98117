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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ForwardingMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Map that also stores the inverse mapping to allow for efficient lookup
 * of all keys mapped to a value.  Iteration follows insertion order.
 */
public class TwoWayMap<K, V> extends ForwardingMap<K, V> {

  private final Map<K, V> map;
  private final SetMultimap<V, K> mapInv;

  public TwoWayMap() {
    this.map = new LinkedHashMap<K, V>();
    this.mapInv = LinkedHashMultimap.create();
  }

  public static <K1, V1> TwoWayMap<K1, V1> create() {
    return new TwoWayMap<K1, V1>();
  }

  @Override
  protected Map<K, V> delegate() {
    return map;
  }

  @Override
  public V remove(Object k) {
    if (!map.containsKey(k)) {
      return null;
    }
    V v = map.remove(k);
    mapInv.remove(v, k);
    return v;
  }

  @Override
  public boolean containsValue(Object value) {
    return mapInv.containsKey(value);
  }

  @Override
  public V put(K key, V value) {
    boolean existed = map.containsKey(key);
    V prev = map.put(key, value);
    if (existed) {
      mapInv.remove(prev, key);
    }
    mapInv.put(value, key);
    return prev;
  }

  @Override
  public void putAll(Map<? extends K, ? extends V> m) {
    standardPutAll(m);
  }

  @Override
  public void clear() {
    map.clear();
    mapInv.clear();
  }

  /**
   * @param v
   * @return unmodifiable view of keys currently mapped to v
   */
  public Collection<K> getByValue(V v) {
    return Collections.unmodifiableSet(mapInv.get(v));
  }

  // Views are read-only so the inverse cannot go stale

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
}
