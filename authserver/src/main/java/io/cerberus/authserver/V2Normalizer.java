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

import com.google.protobuf.BoolValue;
import com.google.protobuf.Timestamp;
import com.google.rpc.Code;
import io.envoyproxy.envoy.api.v2.core.HeaderValue;
import io.envoyproxy.envoy.api.v2.core.HeaderValueOption;
import io.envoyproxy.envoy.api.v2.core.SocketAddress;
import io.envoyproxy.envoy.service.auth.v2.AttributeContext;
import io.envoyproxy.envoy.service.auth.v2.CheckRequest;
import io.envoyproxy.envoy.service.auth.v2.CheckResponse;
import io.envoyproxy.envoy.service.auth.v2.DeniedHttpResponse;
import io.envoyproxy.envoy.service.auth.v2.OkHttpResponse;
import io.envoyproxy.envoy.type.HttpStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizer for the {@code envoy.service.auth.v2} check API.
 *
 * <p>Unset wire fields map to the empty defaults of {@link Request}. This version carries no TLS
 * session, so {@link Request#sni()} is always empty. Denials without an HTTP status are sent as
 * 403. See {@link V3Normalizer} for the other version.
 */
public final class V2Normalizer implements CheckNormalizer<CheckRequest, CheckResponse> {
  public static final V2Normalizer INSTANCE = new V2Normalizer();

  private V2Normalizer() {}

  @Override
  public Request fromWire(CheckRequest check) {
    AttributeContext attributes = check.getAttributes();
    AttributeContext.HttpRequest http = attributes.getRequest().getHttp();
    Request.Builder request = Request.builder()
        .setId(http.getId())
        .setMethod(http.getMethod())
        .setScheme(http.getScheme())
        .setHost(http.getHost())
        .setPath(http.getPath())
        .setQuery(http.getQuery())
        .setFragment(http.getFragment())
        .setProtocol(http.getProtocol())
        .setSize(http.getSize())
        .setBody(http.getBody())
        .setHeaders(Headers.of(http.getHeadersMap()))
        .setSource(fromPeer(attributes.getSource()))
        .setDestination(fromPeer(attributes.getDestination()))
        .setContext(attributes.getContextExtensionsMap())
        .setMetadata(attributes.getMetadataContext().getFilterMetadataMap());
    if (attributes.getRequest().hasTime()) {
      Timestamp time = attributes.getRequest().getTime();
      request.setTime(Instant.ofEpochSecond(time.getSeconds(), time.getNanos()));
    }
    return request.build();
  }

  @Override
  public CheckResponse asWire(Response response) {
    if (response.allowed()) {
      return CheckResponse.newBuilder()
          .setStatus(com.google.rpc.Status.newBuilder().setCode(Code.OK_VALUE))
          .setOkResponse(OkHttpResponse.newBuilder()
              .addAllHeaders(toHeaderValueOptions(response.headers())))
          .build();
    }
    int statusCode = response.statusCode() > 0
        ? response.statusCode() : Response.DEFAULT_DENIED_STATUS;
    return CheckResponse.newBuilder()
        .setStatus(com.google.rpc.Status.newBuilder().setCode(Code.PERMISSION_DENIED_VALUE))
        .setDeniedResponse(DeniedHttpResponse.newBuilder()
            .setStatus(HttpStatus.newBuilder().setCodeValue(statusCode))
            .addAllHeaders(toHeaderValueOptions(response.headers()))
            .setBody(response.body()))
        .build();
  }

  private static Peer fromPeer(AttributeContext.Peer peer) {
    SocketAddress socketAddress = peer.getAddress().getSocketAddress();
    return Peer.builder()
        .setAddress(socketAddress.getAddress())
        .setPort(socketAddress.getPortValue())
        .setService(peer.getService())
        .setPrincipal(peer.getPrincipal())
        .setCertificate(peer.getCertificate())
        .setLabels(peer.getLabelsMap())
        .build();
  }

  private static List<HeaderValueOption> toHeaderValueOptions(Headers headers) {
    List<HeaderValueOption> options = new ArrayList<>(headers.size());
    for (String name : headers.names()) {
      boolean append = false;
      for (String value : headers.getAll(name)) {
        options.add(HeaderValueOption.newBuilder()
            .setHeader(HeaderValue.newBuilder().setKey(name).setValue(value))
            .setAppend(BoolValue.newBuilder().setValue(append))
            .build());
        append = true;
      }
    }
    return options;
  }
}
