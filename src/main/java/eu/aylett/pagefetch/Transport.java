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

import java.io.IOException;

/**
 * Sends a single HTTP GET. No caching, throttling or retrying happens here.
 */
@FunctionalInterface
public interface Transport {
  /**
   * @param url
   *          the request URL, which implementations may resolve against a base
   *          address
   * @return the response, whatever its status
   */
  ApiResponse get(String url) throws IOException, InterruptedException;
}
