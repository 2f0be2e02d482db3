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

import com.google.common.base.Strings;
import java.util.Locale;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Classification of why a decision was made, read from {@link Response#REASON_HEADER}.
 *
 * <p>Only used to label metrics. The adapter never branches on it.
 */
@Immutable
public final class CerberusReason {
  /** The classification of responses that carry no reason header. */
  public static final CerberusReason NONE = new CerberusReason("");

  private final String value;

  private CerberusReason(String value) {
    this.value = value;
  }

  /** Parses a header value. Blank or absent values yield {@link #NONE}. */
  public static CerberusReason of(@Nullable String headerValue) {
    String value = Strings.nullToEmpty(headerValue).trim().toLowerCase(Locale.ROOT);
    if (value.isEmpty()) {
      return NONE;
    }
    return new CerberusReason(value);
  }

  /** Returns the reason carried by {@code response}. */
  public static CerberusReason fromResponse(Response response) {
    return of(response.reason());
  }

  /** Returns the label value, empty for {@link #NONE}. */
  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CerberusReason && value.equals(((CerberusReason) other).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
