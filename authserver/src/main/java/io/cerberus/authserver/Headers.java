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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * An ordered, multi-valued collection of HTTP headers shared by {@link Request} and
 * {@link Response}.
 *
 * <p>Header names are case-insensitive and are kept in lower case, the form used on HTTP/2 and by
 * Envoy on both versions of the check API.
 */
@Immutable
public final class Headers {
  public static final Headers EMPTY = new Headers(ImmutableListMultimap.<String, String>of());

  private final ImmutableListMultimap<String, String> entries;

  private Headers(ImmutableListMultimap<String, String> entries) {
    this.entries = entries;
  }

  /** Creates headers with a single value per name. */
  public static Headers of(Map<String, String> headers) {
    Builder builder = builder();
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      builder.add(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the first value of {@code name}, or {@code null} if there is none. */
  @Nullable
  public String get(String name) {
    List<String> values = entries.get(normalize(name));
    return values.isEmpty() ? null : values.get(0);
  }

  /** Returns every value of {@code name} in insertion order. */
  public ImmutableList<String> getAll(String name) {
    return entries.get(normalize(name));
  }

  public boolean containsKey(String name) {
    return entries.containsKey(normalize(name));
  }

  public ImmutableSet<String> names() {
    return entries.keySet();
  }

  public ImmutableListMultimap<String, String> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.entries.putAll(entries);
    return builder;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Headers)) {
      return false;
    }
    return entries.equals(((Headers) other).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "Headers" + entries;
  }

  private static String normalize(String name) {
    return checkNotNull(name, "name").toLowerCase(Locale.ROOT);
  }

  /** Builder for {@link Headers}. */
  public static final class Builder {
    private final ListMultimap<String, String> entries = LinkedListMultimap.create();

    private Builder() {}

    /** Appends a value, keeping any existing values of the same name. */
    public Builder add(String name, String value) {
      entries.put(normalize(name), checkNotNull(value, "value"));
      return this;
    }

    /** Replaces all values of {@code name} with {@code value}. */
    public Builder set(String name, String value) {
      String key = normalize(name);
      entries.removeAll(key);
      entries.put(key, checkNotNull(value, "value"));
      return this;
    }

    public Builder remove(String name) {
      entries.removeAll(normalize(name));
      return this;
    }

    public Headers build() {
      if (entries.isEmpty()) {
        return EMPTY;
      }
      return new Headers(ImmutableListMultimap.copyOf(entries));
    }
  }
}
