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

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.grpc.Context;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.api.common.Attributes;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Answers one check call of a given wire version: normalizes the request, asks the
 * {@link Checker}, converts the decision back and records metrics.
 *
 * <p>Holds no per-call state, so a single instance serves all concurrent calls of its version.
 *
 * @param <ReqT> the wire request type
 * @param <RespT> the wire response type
 */
final class CheckHandler<ReqT, RespT> {
  private static final Logger logger = Logger.getLogger(CheckHandler.class.getName());
  private static final double SECONDS_PER_NANO = 1e-9;

  private final CheckNormalizer<ReqT, RespT> normalizer;
  private final CheckRequestVersion version;
  private final Checker checker;
  private final CheckMetrics metrics;
  private final Ticker ticker;

  CheckHandler(CheckNormalizer<ReqT, RespT> normalizer, CheckRequestVersion version,
      Checker checker, CheckMetrics metrics, Ticker ticker) {
    this.normalizer = checkNotNull(normalizer, "normalizer");
    this.version = checkNotNull(version, "version");
    this.checker = checkNotNull(checker, "checker");
    this.metrics = checkNotNull(metrics, "metrics");
    this.ticker = checkNotNull(ticker, "ticker");
  }

  void check(ReqT wireRequest, StreamObserver<RespT> responseObserver) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    Request request = normalizer.fromWire(wireRequest);

    Response response;
    try {
      response = checker.check(Context.current(), request);
    } catch (StatusException | StatusRuntimeException e) {
      logger.log(Level.FINE, "Check " + version.label() + " request " + request.id() + " failed",
          e);
      responseObserver.onError(e);
      return;
    }
    checkNotNull(response, "checker returned null response");
    RespT wireResponse = normalizer.asWire(response);

    Attributes labels = CheckLabels.forCheck(request, response, version);
    metrics.record(labels, stopwatch.elapsed(TimeUnit.NANOSECONDS) * SECONDS_PER_NANO);

    responseObserver.onNext(wireResponse);
    responseObserver.onCompleted();
  }
}
