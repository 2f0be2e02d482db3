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
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Source or destination of the checked request, as seen by the proxy.
 */
@AutoValue
public abstract class Peer {
  private static final Peer EMPTY = builder().build();

  /** Returns a peer with every field unset. */
  public static Peer empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new AutoValue_Peer.Builder()
        .setAddress("")
        .setPort(0)
        .setService("")
        .setPrincipal("")
        .setCertificate("")
        .setLabels(ImmutableMap.<String, String>of());
  }

  /** IP address of the peer, or empty if the proxy did not report a socket address. */
  public abstract String address();

  public abstract int port();

  public abstract String service();

  /** Identity of the peer, usually the subject or SAN of its certificate. */
  public abstract String principal();

  /** URL-encoded PEM certificate of the peer, when the proxy forwards it. */
  public abstract String certificate();

  public abstract ImmutableMap<String, String> labels();

  public abstract Builder toBuilder();

  /** Builder for {@link Peer}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAddress(String address);

    public abstract Builder setPort(int port);

    public abstract Builder setService(String service);

    public abstract Builder setPrincipal(String principal);

    public abstract Builder setCertificate(String certificate);

    public abstract Builder setLabels(Map<String, String> labels);

    public abstract Peer build();
  }
}
