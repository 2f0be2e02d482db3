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

/**
 * Translates between one wire version of the Envoy check API and the neutral
 * {@link Request}/{@link Response} model.
 *
 * @param <ReqT> the wire request type
 * @param <RespT> the wire response type
 */
public interface CheckNormalizer<ReqT, RespT> {

  /**
   * Maps a wire request to a {@link Request}. Fields the proxy left unset map to the model's empty
   * defaults; this method never fails.
   */
  Request fromWire(ReqT request);

  /** Maps a decision to the wire response. This method never fails. */
  RespT asWire(Response response);
}
