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
import io.grpc.ServerCredentials;
import io.grpc.netty.GrpcSslContexts;
import io.grpc.netty.NettySslContextServerCredentials;
import io.grpc.util.CertificateUtils;
import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Loads the TLS credentials of the authorization server.
 */
public final class ServerCredentialsLoader {
  private static final Logger logger = Logger.getLogger(ServerCredentialsLoader.class.getName());

  /** Protocols the server accepts. Nothing older than TLS 1.2 is negotiated. */
  @VisibleForTesting
  static final String[] TLS_PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

  private ServerCredentialsLoader() {}

  /**
   * Creates server credentials from PEM files.
   *
   * <p>When {@code caBundle} is given, clients must present a certificate issued by one of the CAs
   * it contains. Without it, client certificates are not requested.
   *
   * @param certChain the server certificate chain
   * @param privateKey the PKCS #8 private key of the server certificate
   * @param caBundle the CAs trusted to issue client certificates, or {@code null}
   * @throws IOException if a file can't be read
   * @throws GeneralSecurityException if a file doesn't hold a usable certificate or key. A CA
   *     bundle without any certificate is rejected with {@link CertificateException}.
   */
  public static ServerCredentials newServerCredentials(
      File certChain, File privateKey, @Nullable File caBundle)
      throws IOException, GeneralSecurityException {
    return NettySslContextServerCredentials.create(
        newServerSslContext(certChain, privateKey, caBundle));
  }

  @VisibleForTesting
  static SslContext newServerSslContext(
      File certChain, File privateKey, @Nullable File caBundle)
      throws IOException, GeneralSecurityException {
    checkNotNull(certChain, "certChain");
    checkNotNull(privateKey, "privateKey");
    X509Certificate[] serverCerts = readCertificates(certChain);
    PrivateKey serverKey;
    try (InputStream in = Files.newInputStream(privateKey.toPath())) {
      serverKey = CertificateUtils.getPrivateKey(in);
    }

    SslContextBuilder sslContextBuilder = GrpcSslContexts.configure(
        SslContextBuilder.forServer(serverKey, serverCerts))
        .protocols(TLS_PROTOCOLS);
    if (caBundle != null) {
      X509Certificate[] trustedCas = readCertificates(caBundle);
      sslContextBuilder.trustManager(trustedCas).clientAuth(ClientAuth.REQUIRE);
      logger.info("Requiring client certificates issued by " + trustedCas.length
          + " CA(s) from " + caBundle);
    } else {
      sslContextBuilder.clientAuth(ClientAuth.NONE);
    }
    return sslContextBuilder.build();
  }

  private static X509Certificate[] readCertificates(File file)
      throws IOException, CertificateException {
    X509Certificate[] certs;
    try (InputStream in = Files.newInputStream(file.toPath())) {
      certs = CertificateUtils.getX509Certificates(in);
    }
    if (certs.length == 0) {
      throw new CertificateException("No certificate found in " + file);
    }
    return certs;
  }
}
