/*
 * Copyright 2026 The Cerberus Authors
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
 * limitations under the License.
 */

package io.cerberus.authserver;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;

/**
 * Version-neutral form of an authorization decision produced by a {@link Checker}.
 *
 * <p>For allowed requests {@link #headers()} are added to the request forwarded upstream. For
 * denied requests they are sent back to the downstream client together with
 * {@link #statusCode()} and {@link #body()}.
 */
@AutoValue
public abstract class Response {
  /** Reserved header carrying the machine-readable reason of the decision. */
  public static final String REASON_HEADER = "X-Cerberus-Reason";

  /** HTTP status used for denials that don't name one. */
  public static final int DEFAULT_DENIED_STATUS = 403;

  /** Creates a builder for a response that lets the request through. */
  public static Builder allow() {
    return newBuilder().setAllowed(true);
  }

  /** Creates a builder for a response that rejects the request with HTTP 403. */
  public static Builder deny() {
    return newBuilder().setAllowed(false);
  }

  private static Builder newBuilder() {
    return new AutoValue_Response.Builder()
        .setStatusCode(DEFAULT_DENIED_STATUS)
        .setHeaders(Headers.EMPTY)
        .setBody("");
  }

  public abstract boolean allowed();

  /** HTTP status returned downstream when the request is denied. */
  public abstract int statusCode();

  public abstract Headers headers();

  /** Body returned downstream when the request is denied. */
  public abstract String body();

  /** Returns the value of {@link #REASON_HEADER}, or an empty string when it is absent. */
  public final String reason() {
    return Strings.nullToEmpty(headers().get(REASON_HEADER));
  }

  public abstract Builder toBuilder();

  /** Builder for {@link Response}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setAllowed(boolean allowed);

    public abstract Builder setStatusCode(int statusCode);

    public abstract Builder setHeaders(Headers headers);

    public abstract Builder setBody(String body);

    /** Sets {@link #REASON_HEADER} on the headers collected so far. */
    public final Builder setReason(String reason) {
      return setHeaders(headers().toBuilder().set(REASON_HEADER, reason).build());
    }

    abstract Headers headers();

    public abstract Response build();
  }
}
