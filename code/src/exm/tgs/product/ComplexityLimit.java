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
package exm.tgs.product;

import exm.tgs.common.Settings;
import exm.tgs.common.exceptions.InvalidOptionException;
import exm.tgs.common.exceptions.TGSRuntimeError;
import exm.tgs.common.exceptions.TooComplexException;

/**
 * Counter that fails once a combinatorial expansion has done too much work.
 * The deep product counts one unit per combination it builds; results it
 * reuses from its memo cost nothing.
 */
public class ComplexityLimit {
  private final long limit;
  private long count;

  public ComplexityLimit(long limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive: " + limit);
    }
    this.limit = limit;
    this.count = 0;
  }

  /**
   * @return limit configured under {@link Settings#DEEP_PRODUCT_LIMIT}
   */
  public static ComplexityLimit deepProductDefault() {
    try {
      return new ComplexityLimit(Settings.getLong(Settings.DEEP_PRODUCT_LIMIT));
    } catch (InvalidOptionException e) {
      throw new TGSRuntimeError("Bad setting: " + e.getMessage(), e);
    }
  }

  /**
   * Record one unit of work
   * @throws TooComplexException if this goes past the limit
   */
  public void inc() {
    count++;
    if (count > limit) {
      throw new TooComplexException(limit);
    }
  }

  public long count() {
    return count;
  }

  public long limit() {
    return limit;
  }
}
