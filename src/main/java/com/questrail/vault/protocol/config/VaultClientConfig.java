package com.questrail.vault.protocol.config;

import com.questrail.vault.protocol.transport.tls.ServerCertificateVerifier;
import com.questrail.vault.protocol.transport.tls.SystemTrustStoreVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the vault client.
 *
 * <p>Defaults match the desktop client: TLS on, a 120 second read timeout and
 * keys kept under {@code keys/}.</p>
 */
public record VaultClientConfig(
    String serverHost,
    int serverPort,
    boolean tlsEnabled,
    Duration readTimeout,
    Duration connectTimeout,
    Path keysDirectory,
    ServerCertificateVerifier certificateVerifier,
    boolean verifyHostname
) {
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Path DEFAULT_KEYS_DIRECTORY = Path.of("keys");

    public VaultClientConfig {
        Objects.requireNonNull(serverHost, "serverHost");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(keysDirectory, "keysDirectory");
        Objects.requireNonNull(certificateVerifier, "certificateVerifier");
        if (serverPort < 1 || serverPort > 65535) {
            throw new IllegalArgumentException("serverPort must be 1-65535");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String serverHost;
        private int serverPort;
        private boolean tlsEnabled = true;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Path keysDirectory = DEFAULT_KEYS_DIRECTORY;
        private ServerCertificateVerifier certificateVerifier = SystemTrustStoreVerifier.INSTANCE;
        private boolean verifyHostname = true;

        public Builder withServer(String host, int port) {
            this.serverHost = host;
            this.serverPort = port;
            return this;
        }

        public Builder withTlsEnabled(boolean tlsEnabled) {
            this.tlsEnabled = tlsEnabled;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withKeysDirectory(Path keysDirectory) {
            this.keysDirectory = keysDirectory;
            return this;
        }

        public Builder withCertificateVerifier(ServerCertificateVerifier verifier) {
            this.certificateVerifier = verifier;
            return this;
        }

        public Builder withVerifyHostname(boolean verifyHostname) {
            this.verifyHostname = verifyHostname;
            return this;
        }

        public VaultClientConfig build() {
            return new VaultClientConfig(serverHost, serverPort, tlsEnabled, readTimeout, connectTimeout,
                    keysDirectory, certificateVerifier, verifyHostname);
        }
    }
}
