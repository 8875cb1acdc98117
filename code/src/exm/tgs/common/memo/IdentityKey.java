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

/**
 * Wrap an object so equality and hashing use object identity.
 */
public final class IdentityKey {
  private final Object obj;

  public IdentityKey(Object obj) {
    this.obj = obj;
  }

  public Object get() {
    return obj;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(obj);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof IdentityKey && ((IdentityKey)other).obj == obj;
  }

  @Override
  public String toString() {
    return "id(" + obj + ")";
  }
}
