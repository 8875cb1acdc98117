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

/**
 * A mutable value that announces changes to its contents.
 *
 * Listeners are kept as a list: registering the same listener twice means
 * it is notified twice and must be removed twice.
 */
public interface Monitored {

  public void addChangeListener(ChangeListener listener);

  /**
   * Remove one registration of listener, if present
   */
  public void removeChangeListener(ChangeListener listener);

  public static interface ChangeListener {
    /**
     * Called after source gained new distinct contents
     */
    public void changed(Monitored source);
  }
}
