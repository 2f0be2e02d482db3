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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import io.grpc.Context;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerCredentials;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Runs the authorization server with the {@link Checker} found on the class path.
 *
 * <p>The checker is discovered with {@link ServiceLoader}; exactly one implementation must be
 * registered under {@code META-INF/services/io.cerberus.authserver.Checker}. Metrics go to
 * {@link GlobalOpenTelemetry}.
 */
public final class AuthServerMain {
  private static final Logger logger = Logger.getLogger(AuthServerMain.class.getName());

  private AuthServerMain() {}

  public static void main(String[] args) throws IOException, InterruptedException {
    AuthServerConfig config;
    try {
      config = AuthServerConfig.parseArgs(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(1);
      return;
    }

    ServerCredentials credentials = loadServerCredentials(config);
    if (credentials == null) {
      System.exit(1);
      return;
    }
    Checker checker = loadChecker(ServiceLoader.load(Checker.class));
    logger.info("Using checker " + checker.getClass().getName());

    ServerBuilder<?> serverBuilder = Grpc.newServerBuilderForPort(config.port(), credentials);
    AuthServers.registerServer(
        serverBuilder, checker, CheckMetrics.create(GlobalOpenTelemetry.get()));
    HealthStatusManager health = new HealthStatusManager();
    serverBuilder.addService(health.getHealthService());
    Server server = serverBuilder.build();
    health.setStatus(
        io.envoyproxy.envoy.service.auth.v2.AuthorizationGrpc.SERVICE_NAME, ServingStatus.SERVING);
    health.setStatus(
        io.envoyproxy.envoy.service.auth.v3.AuthorizationGrpc.SERVICE_NAME, ServingStatus.SERVING);

    final Context.CancellableContext context = Context.current().withCancellation();
    Runtime.getRuntime().addShutdownHook(new Thread() {
      @Override
      public void run() {
        // Use stderr here since the logger may have been reset by its JVM shutdown hook.
        System.err.println("*** shutting down authorization server since JVM is shutting down");
        health.enterTerminalState();
        context.cancel(null);
      }
    });
    AuthServers.runServer(context, server);
  }

  /** Returns the credentials for {@code config}, or {@code null} after logging why they failed. */
  @VisibleForTesting
  @Nullable
  static ServerCredentials loadServerCredentials(AuthServerConfig config) {
    try {
      return newServerCredentials(config);
    } catch (IOException | GeneralSecurityException e) {
      logger.log(Level.SEVERE, "Unable to load TLS credentials", e);
      return null;
    }
  }

  @VisibleForTesting
  static ServerCredentials newServerCredentials(AuthServerConfig config)
      throws IOException, GeneralSecurityException {
    if (config.insecure()) {
      logger.warning("Serving without TLS");
      return InsecureServerCredentials.create();
    }
    return ServerCredentialsLoader.newServerCredentials(
        config.certChain().get(), config.privateKey().get(), config.caBundle().orElse(null));
  }

  @VisibleForTesting
  static Checker loadChecker(Iterable<Checker> candidates) {
    List<Checker> checkers = ImmutableList.copyOf(candidates);
    if (checkers.size() != 1) {
      throw new IllegalStateException(
          "Expected exactly one " + Checker.class.getName() + " implementation, found "
              + checkers.size() + ": " + Iterables.toString(checkers));
    }
    return checkers.get(0);
  }
}
