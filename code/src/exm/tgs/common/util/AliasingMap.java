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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ForwardingMap;

import exm.tgs.common.Logging;
import exm.tgs.common.exceptions.AliasConflictException;

/**
 * Map where several keys can be declared to be names for the same entry.
 *
 * Model:
 * - Every group of equivalent keys has exactly one canonical key.
 * - The alias table maps each non-canonical key directly to its canonical
 *   key, so resolving a key is a single lookup.  Canonical keys do not
 *   appear as keys in the alias table.
 * - Entries are stored only under canonical keys.
 *
 * All key-taking map operations resolve the key first, so writing through
 * one name is visible through all other names in its group.  The views
 * (keySet(), entrySet(), values()) show canonical keys only.
 *
 * @param <K>
 * @param <V>
 */
public class AliasingMap<K, V> extends ForwardingMap<K, V> {

  private static final Logger logger = Logging.getTGSLogger();

  /**
   * Alias to canonical key.  Inverse gives all aliases of a canonical key.
   */
  private final TwoWayMap<K, K> aliases;

  /**
   * Entries, keyed by canonical key only
   */
  private final Map<K, V> store;

  public AliasingMap() {
    this.aliases = TwoWayMap.create();
    this.store = new LinkedHashMap<K, V>();
  }

  public static <K1, V1> AliasingMap<K1, V1> create() {
    return new AliasingMap<K1, V1>();
  }

  @Override
  protected Map<K, V> delegate() {
    return store;
  }

  /**
   * Declare that alias names the same entry as target.
   *
   * Declaring an alias between two keys that already resolve to the same
   * canonical key is a no-op.
   *
   * @param alias
   * @param target may itself be an alias
   * @throws AliasConflictException if alias already resolves to a
   *    different canonical key, if other keys are aliased to alias, or if
   *    alias holds an entry.  The map is unchanged in that case.
   */
  public void addAlias(K alias, K target) throws AliasConflictException {
    Preconditions.checkNotNull(alias, "alias");
    Preconditions.checkNotNull(target, "target");
    K aliasCanon = canonicalKey(alias);
    K targetCanon = canonicalKey(target);

    if (aliasCanon.equals(targetCanon)) {
      return;
    }

    if (!aliasCanon.equals(alias)) {
      throw new AliasConflictException(alias, target,
          alias + " is already an alias of " + aliasCanon);
    }

    if (!aliases.getByValue(alias).isEmpty()) {
      throw new AliasConflictException(alias, target,
          alias + " is the canonical name of " + aliases.getByValue(alias));
    }

    if (store.containsKey(alias)) {
      throw new AliasConflictException(alias, target,
          alias + " already has an entry");
    }

    aliases.put(alias, targetCanon);
    if (logger.isTraceEnabled()) {
      logger.trace("Alias " + alias + " => " + targetCanon);
    }
  }

  /**
   * @param key
   * @return the key under which entries for key are stored.  Keys that
   *    were never aliased are their own canonical key.
   */
  @SuppressWarnings("unchecked")
  public K canonicalKey(Object key) {
    K canon = aliases.get(key);
    return canon != null ? canon : (K)key;
  }

  /**
   * @return true if both keys resolve to the same canonical key
   */
  public boolean sameKey(Object key1, Object key2) {
    return Objects.equals(canonicalKey(key1), canonicalKey(key2));
  }

  /**
   * @param canon
   * @return all keys that resolve to canon, including canon itself
   */
  public Set<K> keysFor(K canon) {
    Set<K> result = new HashSet<K>(aliases.getByValue(canonicalKey(canon)));
    result.add(canonicalKey(canon));
    return result;
  }

  /**
   * Check whether query names the same entries as this map.
   *
   * Every canonical key in this map must be named by exactly one key of
   * query, directly or through an alias.  Query keys that do not resolve
   * to an entry of this map are not considered.  Query values are ignored.
   * @param query
   * @return true on match
   */
  public boolean matches(Map<?, ?> query) {
    return matchesKeys(query.keySet());
  }

  public boolean matchesKeys(Collection<?> queryKeys) {
    Set<K> matched = new HashSet<K>();
    for (Object queryKey: queryKeys) {
      K canon = canonicalKey(queryKey);
      if (store.containsKey(canon) && !matched.add(canon)) {
        // Same entry named twice
        return false;
      }
    }
    return matched.size() == store.size();
  }

  /**
   * Like get(), but fails for absent keys instead of returning null
   * @param key
   * @return
   * @throws NoSuchElementException
   */
  public V getOrThrow(Object key) {
    K canon = canonicalKey(key);
    if (!store.containsKey(canon)) {
      throw new NoSuchElementException("No entry for " + key +
              (Objects.equals(canon, key) ? "" :
                                " (alias of " + canon + ")"));
    }
    return store.get(canon);
  }

  @Override
  public V get(Object key) {
    return store.get(canonicalKey(key));
  }

  @Override
  public V getOrDefault(Object key, V defaultValue) {
    return store.getOrDefault(canonicalKey(key), defaultValue);
  }

  @Override
  public boolean containsKey(Object key) {
    return store.containsKey(canonicalKey(key));
  }

  @Override
  public V put(K key, V value) {
    return store.put(canonicalKey(key), value);
  }

  @Override
  public V putIfAbsent(K key, V value) {
    return store.putIfAbsent(canonicalKey(key), value);
  }

  @Override
  public void putAll(Map<? extends K, ? extends V> map) {
    for (Entry<? extends K, ? extends V> e: map.entrySet()) {
      put(e.getKey(), e.getValue());
    }
  }

  @Override
  public V remove(Object key) {
    return store.remove(canonicalKey(key));
  }

  @Override
  public boolean remove(Object key, Object value) {
    return store.remove(canonicalKey(key), value);
  }

  @Override
  public V replace(K key, V value) {
    return store.replace(canonicalKey(key), value);
  }

  @Override
  public boolean replace(K key, V oldValue, V newValue) {
    return store.replace(canonicalKey(key), oldValue, newValue);
  }

  @Override
  public V computeIfAbsent(K key,
                    Function<? super K, ? extends V> mappingFunction) {
    return store.computeIfAbsent(canonicalKey(key), mappingFunction);
  }

  @Override
  public V computeIfPresent(K key,
          BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    return store.computeIfPresent(canonicalKey(key), remappingFunction);
  }

  @Override
  public V compute(K key,
          BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
    return store.compute(canonicalKey(key), remappingFunction);
  }

  @Override
  public V merge(K key, V value,
          BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
    return store.merge(canonicalKey(key), value, remappingFunction);
  }

  /**
   * Remove all entries.  Aliases stay declared.
   */
  @Override
  public void clear() {
    store.clear();
  }

  @Override
  public String toString() {
    return store.toString() + " aliases=" + aliases.toString();
  }
}
