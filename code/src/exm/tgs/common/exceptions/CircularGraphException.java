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

package exm.tgs.common.exceptions;

import java.util.Collection;
import java.util.Collections;

/**
 * Topological sort could not make progress: every remaining item
 * still waits on another remaining item.
 */
public class CircularGraphException extends RuntimeException
{
  private final Collection<?> remaining;

  public CircularGraphException(Collection<?> remaining)
  {
    super("Circular graph: cannot order " + remaining);
    this.remaining = Collections.unmodifiableCollection(remaining);
  }

  /**
   * @return items that were never yielded
   */
  public Collection<?> getRemaining() {
    return remaining;
  }

  private static final long serialVersionUID = 1L;
}
