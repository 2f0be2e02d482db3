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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import io.envoyproxy.envoy.service.auth.v3.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v3.CheckRequest;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerCredentials;
import io.grpc.StatusRuntimeException;
import io.grpc.TlsChannelCredentials;
import io.grpc.internal.testing.TestUtils;
import io.grpc.testing.GrpcCleanupRule;
import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.ssl.SslContext;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLEngine;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link ServerCredentialsLoader}.
 */
@RunWith(JUnit4.class)
public class ServerCredentialsLoaderTest {
  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();
  @Rule
  public final TemporaryFolder tempFolder = new TemporaryFolder();

  private File serverCert;
  private File serverKey;
  private File clientCert;
  private File clientKey;
  private File caCert;

  @Before
  public void setUp() throws IOException {
    serverCert = TestUtils.loadCert("server1.pem");
    serverKey = TestUtils.loadCert("server1.key");
    clientCert = TestUtils.loadCert("client.pem");
    clientKey = TestUtils.loadCert("client.key");
    caCert = TestUtils.loadCert("ca.pem");
  }

  @Test
  public void sslContext_withoutCa_doesNotRequestClientCertificates() throws Exception {
    SslContext sslContext =
        ServerCredentialsLoader.newServerSslContext(serverCert, serverKey, null);

    SSLEngine engine = sslContext.newEngine(ByteBufAllocator.DEFAULT);
    assertThat(sslContext.isServer()).isTrue();
    assertThat(engine.getNeedClientAuth()).isFalse();
    assertThat(engine.getWantClientAuth()).isFalse();
  }

  @Test
  public void sslContext_withCa_requiresClientCertificates() throws Exception {
    SslContext sslContext =
        ServerCredentialsLoader.newServerSslContext(serverCert, serverKey, caCert);

    assertThat(sslContext.newEngine(ByteBufAllocator.DEFAULT).getNeedClientAuth()).isTrue();
  }

  @Test
  public void sslContext_onlyTls12AndNewer() throws Exception {
    SslContext sslContext =
        ServerCredentialsLoader.newServerSslContext(serverCert, serverKey, caCert);

    SSLEngine engine = sslContext.newEngine(ByteBufAllocator.DEFAULT);
    assertThat(engine.getEnabledProtocols()).asList()
        .containsExactlyElementsIn(ServerCredentialsLoader.TLS_PROTOCOLS);
  }

  @Test
  public void missingCertificate() {
    File missing = new File(tempFolder.getRoot(), "missing.pem");

    assertThrows(IOException.class,
        () -> ServerCredentialsLoader.newServerCredentials(missing, serverKey, null));
  }

  @Test
  public void missingKey() {
    File missing = new File(tempFolder.getRoot(), "missing.key");

    assertThrows(IOException.class,
        () -> ServerCredentialsLoader.newServerCredentials(serverCert, missing, null));
  }

  @Test
  public void keyIsNotAKey() {
    assertThrows(GeneralSecurityException.class,
        () -> ServerCredentialsLoader.newServerCredentials(serverCert, caCert, null));
  }

  @Test
  public void missingCaBundle() {
    File missing = new File(tempFolder.getRoot(), "missing-ca.pem");

    assertThrows(IOException.class,
        () -> ServerCredentialsLoader.newServerCredentials(serverCert, serverKey, missing));
  }

  @Test
  public void caBundleWithoutCertificates() throws Exception {
    File garbage = tempFolder.newFile("garbage-ca.pem");
    Files.write(garbage.toPath(), "not a certificate\n".getBytes(StandardCharsets.UTF_8));
    File empty = tempFolder.newFile("empty-ca.pem");

    assertThrows(CertificateException.class,
        () -> ServerCredentialsLoader.newServerCredentials(serverCert, serverKey, garbage));
    assertThrows(CertificateException.class,
        () -> ServerCredentialsLoader.newServerCredentials(serverCert, serverKey, empty));
  }

  @Test
  public void mutualTls_clientWithTrustedCertificate() throws Exception {
    Server server = grpcCleanup.register(newServer(
        ServerCredentialsLoader.newServerCredentials(serverCert, serverKey, caCert)));
    ChannelCredentials channelCredentials = TlsChannelCredentials.newBuilder()
        .keyManager(clientCert, clientKey)
        .trustManager(caCert)
        .build();
    ManagedChannel channel = grpcCleanup.register(
        Grpc.newChannelBuilderForAddress("localhost", server.getPort(), channelCredentials)
            .overrideAuthority(TestUtils.TEST_SERVER_HOST)
            .build());

    CheckResponse response = AuthorizationGrpc.newBlockingStub(channel)
        .withDeadlineAfter(10, TimeUnit.SECONDS)
        .check(CheckRequest.getDefaultInstance());

    assertThat(response.hasOkResponse()).isTrue();
  }

  @Test
  public void mutualTls_clientWithoutCertificateRejected() throws Exception {
    Server server = grpcCleanup.register(newServer(
        ServerCredentialsLoader.newServerCredentials(serverCert, serverKey, caCert)));
    ChannelCredentials channelCredentials =
        TlsChannelCredentials.newBuilder().trustManager(caCert).build();
    ManagedChannel channel = grpcCleanup.register(
        Grpc.newChannelBuilderForAddress("localhost", server.getPort(), channelCredentials)
            .overrideAuthority(TestUtils.TEST_SERVER_HOST)
            .build());

    assertThrows(StatusRuntimeException.class,
        () -> AuthorizationGrpc.newBlockingStub(channel)
            .withDeadlineAfter(10, TimeUnit.SECONDS)
            .check(CheckRequest.getDefaultInstance()));
  }

  private static Server newServer(ServerCredentials credentials) throws IOException {
    ServerBuilder<?> serverBuilder = Grpc.newServerBuilderForPort(0, credentials);
    AuthServers.registerServer(
        serverBuilder, (context, request) -> Response.allow().build(), CheckMetrics.noop());
    return serverBuilder.build().start();
  }
}
