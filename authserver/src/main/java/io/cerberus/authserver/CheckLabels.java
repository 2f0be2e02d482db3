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

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import javax.annotation.Nullable;

/**
 * Label keys and builders for the check metrics.
 */
public final class CheckLabels {
  public static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");
  public static final AttributeKey<String> UPSTREAM_AUTH_KEY =
      AttributeKey.stringKey("upstream_auth");
  public static final AttributeKey<String> VERSION_KEY = AttributeKey.stringKey("version");

  private CheckLabels() {}

  public static AttributesBuilder addReasonLabel(AttributesBuilder labels, CerberusReason reason) {
    return labels.put(REASON_KEY, reason.value());
  }

  /**
   * Adds the upstream auth label from the raw {@link Request#HAS_UPSTREAM_AUTH} context value.
   * Anything but {@code "true"} (ignoring case) is labelled {@code "false"}.
   */
  public static AttributesBuilder addUpstreamAuthLabel(
      AttributesBuilder labels, @Nullable String hasUpstreamAuth) {
    return labels.put(UPSTREAM_AUTH_KEY, String.valueOf(Boolean.parseBoolean(hasUpstreamAuth)));
  }

  public static AttributesBuilder addVersionLabel(
      AttributesBuilder labels, CheckRequestVersion version) {
    return labels.put(VERSION_KEY, version.label());
  }

  /** Builds the label set of one completed check. */
  public static Attributes forCheck(
      Request request, Response response, CheckRequestVersion version) {
    AttributesBuilder labels = Attributes.builder();
    addReasonLabel(labels, CerberusReason.fromResponse(response));
    addUpstreamAuthLabel(labels, request.context().get(Request.HAS_UPSTREAM_AUTH));
    addVersionLabel(labels, version);
    return labels.build();
  }
}
