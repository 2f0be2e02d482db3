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

import io.grpc.Context;
import io.grpc.StatusException;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Makes the authorization decision for a normalized check request.
 *
 * <p>One instance serves every in-flight call of both API versions, so implementations must be
 * safe for concurrent use.
 */
@ThreadSafe
public interface Checker {

  /**
   * Decides whether {@code request} may be forwarded.
   *
   * <p>A denial is a {@link Response}, not an exception. Throwing means the decision could not be
   * made; the exception's status is returned to the proxy as the failure of the check call. When
   * {@code context} is cancelled the implementation should give up promptly by throwing.
   *
   * @param context the context of the check call, carrying its deadline and cancellation
   * @param request the normalized request
   * @return the decision, never {@code null}
   * @throws StatusException if no decision could be made
   */
  Response check(Context context, Request request) throws StatusException;
}
