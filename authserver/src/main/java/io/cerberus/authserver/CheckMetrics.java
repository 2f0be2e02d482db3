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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.List;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Instruments recording the outcome of successful check calls.
 */
@ThreadSafe
public final class CheckMetrics {
  public static final String INSTRUMENTATION_SCOPE = "cerberus-authserver";
  @VisibleForTesting
  static final String REQUEST_COUNT_INSTRUMENT_NAME = "cerberus.authserver.check.requests";
  @VisibleForTesting
  static final String REQUEST_DURATION_INSTRUMENT_NAME = "cerberus.authserver.check.duration";

  private static final List<Double> LATENCY_BUCKETS =
      ImmutableList.of(
          0d,     0.0001d, 0.0003d, 0.0006d, 0.001d, 0.002d, 0.003d, 0.005d,
          0.008d, 0.01d,   0.016d,  0.025d,  0.04d,  0.065d, 0.1d,   0.16d,
          0.25d,  0.4d,    0.65d,   1d,      2d,     5d,     10d);

  private final LongCounter requestCount;
  private final DoubleHistogram requestDuration;

  private CheckMetrics(LongCounter requestCount, DoubleHistogram requestDuration) {
    this.requestCount = requestCount;
    this.requestDuration = requestDuration;
  }

  /** Creates the instruments on {@code meter}. */
  public static CheckMetrics create(Meter meter) {
    checkNotNull(meter, "meter");
    return new CheckMetrics(
        meter.counterBuilder(REQUEST_COUNT_INSTRUMENT_NAME)
            .setUnit("{request}")
            .setDescription("Number of check requests answered with a decision")
            .build(),
        meter.histogramBuilder(REQUEST_DURATION_INSTRUMENT_NAME)
            .setUnit("s")
            .setDescription("Time taken to answer a check request with a decision")
            .setExplicitBucketBoundariesAdvice(LATENCY_BUCKETS)
            .build());
  }

  /** Creates the instruments on the meter of {@code openTelemetry}. */
  public static CheckMetrics create(OpenTelemetry openTelemetry) {
    return create(openTelemetry.getMeter(INSTRUMENTATION_SCOPE));
  }

  /** Returns instruments that record nothing. */
  public static CheckMetrics noop() {
    return create(OpenTelemetry.noop());
  }

  /** Counts one answered check and records its latency under {@code labels}. */
  public void record(Attributes labels, double latencySeconds) {
    requestCount.add(1, labels);
    requestDuration.record(latencySeconds, labels);
  }
}
