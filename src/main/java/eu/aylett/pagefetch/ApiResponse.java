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

import com.google.common.base.MoreObjects;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * The parts of an HTTP response we keep: status, headers and the body as text.
 */
public record ApiResponse(int statusCode, HttpHeaders headers, String body) {
  public static final int TOO_MANY_REQUESTS = 429;

  /**
   * A response with the given headers, mainly for tests and other transports.
   */
  public static ApiResponse of(int statusCode, Map<String, List<String>> headers, String body) {
    return new ApiResponse(statusCode, HttpHeaders.of(headers, (name, value) -> true), body);
  }

  /**
   * A response with no headers.
   */
  public static ApiResponse of(int statusCode, String body) {
    return of(statusCode, Map.of(), body);
  }

  /**
   * Whether the status is 2xx.
   */
  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * Whether the server asked us to slow down.
   */
  public boolean isRateLimited() {
    return statusCode == TOO_MANY_REQUESTS;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("statusCode", statusCode)
        .add("bodyLength", body.length())
        .toString();
  }
}
