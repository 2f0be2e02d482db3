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
import com.google.protobuf.Struct;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Version-neutral form of an authorization check request.
 *
 * <p>One instance is built per inbound call, by the normalizer of the wire version the proxy used,
 * and handed to the {@link Checker}. Fields the proxy did not populate hold empty values, never
 * {@code null}.
 */
@AutoValue
public abstract class Request {
  /**
   * Context extension set by the proxy when the route already carries upstream authentication.
   */
  public static final String HAS_UPSTREAM_AUTH = "HasUpstreamAuth";

  public static Builder builder() {
    return new AutoValue_Request.Builder()
        .setId("")
        .setMethod("")
        .setScheme("")
        .setHost("")
        .setPath("")
        .setQuery("")
        .setFragment("")
        .setProtocol("")
        .setSize(0)
        .setBody("")
        .setHeaders(Headers.EMPTY)
        .setSource(Peer.empty())
        .setDestination(Peer.empty())
        .setContext(ImmutableMap.<String, String>of())
        .setMetadata(ImmutableMap.<String, Struct>of())
        .setSni("");
  }

  /** Request ID assigned by the proxy, used for correlation. */
  public abstract String id();

  public abstract String method();

  public abstract String scheme();

  public abstract String host();

  /** Request path, including the query string as Envoy reports it. */
  public abstract String path();

  public abstract String query();

  public abstract String fragment();

  public abstract String protocol();

  /** Size of the HTTP request body in bytes, -1 when unknown. */
  public abstract long size();

  /** Buffered request body, empty unless the proxy is configured to send it. */
  public abstract String body();

  public abstract Headers headers();

  public abstract Peer source();

  public abstract Peer destination();

  /** Time the proxy received the request. */
  public abstract Optional<Instant> time();

  /** Context extensions configured on the proxy route or virtual host. */
  public abstract ImmutableMap<String, String> context();

  /**
   * Dynamic metadata emitted by earlier proxy filters, keyed by filter name (for example the
   * claims a JWT filter verified).
   */
  public abstract ImmutableMap<String, Struct> metadata();

  /** Server name the client asked for in the TLS handshake, empty when not reported. */
  public abstract String sni();

  /** Returns whether the proxy flagged this request as already carrying upstream auth. */
  public final boolean hasUpstreamAuth() {
    return Boolean.parseBoolean(context().get(HAS_UPSTREAM_AUTH));
  }

  public abstract Builder toBuilder();

  /** Builder for {@link Request}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(String id);

    public abstract Builder setMethod(String method);

    public abstract Builder setScheme(String scheme);

    public abstract Builder setHost(String host);

    public abstract Builder setPath(String path);

    public abstract Builder setQuery(String query);

    public abstract Builder setFragment(String fragment);

    public abstract Builder setProtocol(String protocol);

    public abstract Builder setSize(long size);

    public abstract Builder setBody(String body);

    public abstract Builder setHeaders(Headers headers);

    public abstract Builder setSource(Peer source);

    public abstract Builder setDestination(Peer destination);

    public abstract Builder setTime(Instant time);

    public abstract Builder setContext(Map<String, String> context);

    public abstract Builder setMetadata(Map<String, Struct> metadata);

    public abstract Builder setSni(String sni);

    public abstract Request build();
  }
}
