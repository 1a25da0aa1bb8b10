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

/**
 * Thrown when a request fails with a status that is neither a success nor a
 * rate limit.
 */
public class HttpStatusException extends RuntimeException {
  /**
   * The HTTP status code the server returned.
   */
  public final int statusCode;
  /**
   * The URL that was requested.
   */
  public final String url;

  /**
   * @param url
   *          the URL that was requested
   * @param statusCode
   *          the status the server returned
   */
  public HttpStatusException(String url, int statusCode) {
    super("GET " + url + " failed with HTTP status " + statusCode);
    this.url = url;
    this.statusCode = statusCode;
  }
}
