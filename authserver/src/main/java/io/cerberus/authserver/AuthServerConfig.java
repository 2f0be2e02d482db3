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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.io.File;
import java.util.Optional;

/**
 * Command-line configuration of {@link AuthServerMain}.
 */
@AutoValue
public abstract class AuthServerConfig {
  public static final int DEFAULT_PORT = 9443;

  static final String USAGE =
      "Usage: authserver [--port=PORT] --tls-cert=FILE --tls-key=FILE [--tls-ca=FILE]\n"
      + "       authserver [--port=PORT] --insecure\n"
      + "\n"
      + "  --port      Port to listen on. Defaults to " + DEFAULT_PORT + "\n"
      + "  --tls-cert  PEM certificate chain of the server\n"
      + "  --tls-key   PEM (PKCS #8) private key of the server\n"
      + "  --tls-ca    PEM CA bundle; when set, clients must present a certificate it trusts\n"
      + "  --insecure  Serve plaintext. Only meant for local testing";

  public abstract int port();

  public abstract Optional<File> certChain();

  public abstract Optional<File> privateKey();

  public abstract Optional<File> caBundle();

  public abstract boolean insecure();

  public static Builder builder() {
    return new AutoValue_AuthServerConfig.Builder().setPort(DEFAULT_PORT).setInsecure(false);
  }

  /**
   * Parses {@code --name=value} arguments.
   *
   * @throws IllegalArgumentException if an argument is unknown or malformed, or if TLS is
   *     neither configured nor disabled
   */
  public static AuthServerConfig parseArgs(String... args) {
    Builder builder = builder();
    for (String arg : args) {
      checkArgument(arg.startsWith("--"), "Unexpected argument %s\n%s", arg, USAGE);
      String name = arg.substring(2);
      String value = null;
      int equals = name.indexOf('=');
      if (equals >= 0) {
        value = name.substring(equals + 1);
        name = name.substring(0, equals);
      }
      if ("insecure".equals(name)) {
        checkArgument(value == null, "--insecure takes no value\n%s", USAGE);
        builder.setInsecure(true);
        continue;
      }
      checkArgument(value != null && !value.isEmpty(), "--%s requires a value\n%s", name, USAGE);
      switch (name) {
        case "port":
          builder.setPort(parsePort(value));
          break;
        case "tls-cert":
          builder.setCertChain(new File(value));
          break;
        case "tls-key":
          builder.setPrivateKey(new File(value));
          break;
        case "tls-ca":
          builder.setCaBundle(new File(value));
          break;
        default:
          throw new IllegalArgumentException("Unknown flag --" + name + "\n" + USAGE);
      }
    }
    return builder.build();
  }

  private static int parsePort(String value) {
    int port;
    try {
      port = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port " + value + "\n" + USAGE, e);
    }
    checkArgument(port >= 0 && port <= 65535, "Port out of range: %s", port);
    return port;
  }

  /** Builder for {@link AuthServerConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPort(int port);

    public abstract Builder setCertChain(File certChain);

    public abstract Builder setPrivateKey(File privateKey);

    public abstract Builder setCaBundle(File caBundle);

    public abstract Builder setInsecure(boolean insecure);

    abstract AuthServerConfig autoBuild();

    /**
     * Builds the config.
     *
     * @throws IllegalArgumentException if TLS is half configured, or neither configured nor
     *     disabled
     */
    public AuthServerConfig build() {
      AuthServerConfig config = autoBuild();
      if (config.insecure()) {
        checkArgument(!config.certChain().isPresent() && !config.privateKey().isPresent()
            && !config.caBundle().isPresent(), "--insecure can't be combined with TLS flags");
      } else {
        checkArgument(config.certChain().isPresent() && config.privateKey().isPresent(),
            "--tls-cert and --tls-key are required unless --insecure is set\n%s", USAGE);
      }
      return config;
    }
  }
}
