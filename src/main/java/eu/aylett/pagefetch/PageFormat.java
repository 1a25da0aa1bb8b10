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

import com.fasterxml.jackson.core.JsonPointer;

/**
 * Where a page's items and next cursor live in the response body.
 *
 * @param items
 *          points at the array of items
 * @param nextCursor
 *          points at the string cursor for the next page
 */
public record PageFormat(JsonPointer items, JsonPointer nextCursor) {
  /**
   * {@code {"data": {"items": [...], "next_cursor": "..."}}}
   */
  public static final PageFormat DEFAULT = of("/data/items", "/data/next_cursor");

  /**
   * @throws IllegalArgumentException
   *           if either expression isn't a valid JSON Pointer
   */
  public static PageFormat of(String items, String nextCursor) {
    return new PageFormat(JsonPointer.compile(items), JsonPointer.compile(nextCursor));
  }
}
