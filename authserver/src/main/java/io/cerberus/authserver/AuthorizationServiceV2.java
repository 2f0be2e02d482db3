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

import io.envoyproxy.envoy.service.auth.v2.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v2.CheckRequest;
import io.envoyproxy.envoy.service.auth.v2.CheckResponse;
import io.grpc.stub.StreamObserver;

/** The {@code envoy.service.auth.v2.Authorization} service. */
final class AuthorizationServiceV2 extends AuthorizationGrpc.AuthorizationImplBase {
  private final CheckHandler<CheckRequest, CheckResponse> handler;

  AuthorizationServiceV2(CheckHandler<CheckRequest, CheckResponse> handler) {
    this.handler = handler;
  }

  @Override
  public void check(CheckRequest request, StreamObserver<CheckResponse> responseObserver) {
    handler.check(request, responseObserver);
  }
}
