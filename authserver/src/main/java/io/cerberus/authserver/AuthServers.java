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

import com.google.common.base.Throwables;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.Context;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Logger;

/**
 * Registers the check services on a gRPC server and runs it.
 */
public final class AuthServers {
  private static final Logger logger = Logger.getLogger(AuthServers.class.getName());

  private static final ThreadFactory SERVE_THREAD_FACTORY =
      new ThreadFactoryBuilder().setDaemon(true).setNameFormat("authserver-serve-%d").build();

  private AuthServers() {}

  /**
   * Adds the v2 and v3 {@code Authorization} services, both backed by {@code checker}, to
   * {@code serverBuilder}.
   */
  public static void registerServer(
      ServerBuilder<?> serverBuilder, Checker checker, CheckMetrics metrics) {
    registerServer(serverBuilder, checker, metrics, Ticker.systemTicker());
  }

  static void registerServer(
      ServerBuilder<?> serverBuilder, Checker checker, CheckMetrics metrics, Ticker ticker) {
    checkNotNull(serverBuilder, "serverBuilder");
    serverBuilder
        .addService(new AuthorizationServiceV2(new CheckHandler<>(
            V2Normalizer.INSTANCE, CheckRequestVersion.V2, checker, metrics, ticker)))
        .addService(new AuthorizationServiceV3(new CheckHandler<>(
            V3Normalizer.INSTANCE, CheckRequestVersion.V3, checker, metrics, ticker)));
  }

  /**
   * Starts {@code server} and blocks until it terminates or {@code context} is cancelled.
   *
   * <p>If the server fails to start, the failure is thrown. If the server terminates because
   * something else shut it down, this method returns normally. Once {@code context} is cancelled
   * the server is stopped with {@link Server#shutdownNow()} and this method returns normally,
   * even when the server failed at about the same time; this includes a context that was already
   * cancelled when this method was called.
   *
   * @throws IOException if the server could not be started
   * @throws InterruptedException if the calling thread was interrupted, in which case the server
   *     is stopped as well
   */
  public static void runServer(Context.CancellableContext context, Server server)
      throws IOException, InterruptedException {
    checkNotNull(context, "context");
    checkNotNull(server, "server");
    if (context.isCancelled()) {
      logger.info("Context already cancelled, not starting server");
      server.shutdownNow();
      return;
    }
    final SettableFuture<Void> done = SettableFuture.create();
    Context.CancellationListener cancellationListener = new Context.CancellationListener() {
      @Override
      public void cancelled(Context cancelled) {
        done.set(null);
      }
    };
    context.addListener(cancellationListener, MoreExecutors.directExecutor());
    ExecutorService serveExecutor = Executors.newSingleThreadExecutor(SERVE_THREAD_FACTORY);
    try {
      serveExecutor.execute(new Runnable() {
        @Override
        public void run() {
          serve(server, done);
        }
      });
      try {
        done.get();
      } catch (InterruptedException e) {
        server.shutdownNow();
        throw e;
      } catch (ExecutionException e) {
        if (!context.isCancelled()) {
          Throwable cause = e.getCause();
          Throwables.throwIfInstanceOf(cause, IOException.class);
          Throwables.throwIfUnchecked(cause);
          throw new IOException("Server failed", cause);
        }
      }
      if (context.isCancelled()) {
        logger.info("Context cancelled, stopping server");
        server.shutdownNow();
      }
    } finally {
      context.removeListener(cancellationListener);
      serveExecutor.shutdown();
    }
  }

  private static void serve(Server server, SettableFuture<Void> done) {
    try {
      server.start();
      logger.info("Server started, listening on " + server.getListenSockets());
      server.awaitTermination();
      done.set(null);
    } catch (IOException | RuntimeException e) {
      done.setException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      done.setException(e);
    }
  }
}
