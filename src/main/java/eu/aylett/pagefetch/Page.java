/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.pagefetch;

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a collection, and the cursor that continues it.
 *
 * @param items
 *          the page's items, in order; may be empty even when more pages follow
 * @param nextCursor
 *          where the next page starts, or null or blank if this is the last
 */
public record Page<T>(List<T> items, @Nullable String nextCursor) {
  public Page {
    items = List.copyOf(items);
  }

  /**
   * A page with no items that ends its collection.
   */
  public static <T> Page<T> empty() {
    return new Page<>(List.of(), null);
  }

  /**
   * Whether another page follows this one.
   */
  @Contract(pure = true)
  public boolean hasNext() {
    return nextCursor != null && !nextCursor.isBlank();
  }
}
