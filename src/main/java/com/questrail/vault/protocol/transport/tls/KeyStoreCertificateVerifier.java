package com.questrail.vault.protocol.transport.tls;

import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Objects;

/**
 * Validates the server against a trust store file (PKCS12, JKS, ...).
 */
public final class KeyStoreCertificateVerifier implements ServerCertificateVerifier
{
    private final Path truststoreFile;
    private final char[] truststorePassword;
    private final String truststoreFormat;

    public KeyStoreCertificateVerifier(Path truststoreFile, char[] truststorePassword, String truststoreFormat)
    {
        this.truststoreFile = Objects.requireNonNull(truststoreFile, "truststoreFile");
        this.truststorePassword = (truststorePassword == null) ? null : truststorePassword.clone();
        this.truststoreFormat = Objects.requireNonNull(truststoreFormat, "truststoreFormat");
    }

    public KeyStoreCertificateVerifier(Path truststoreFile, char[] truststorePassword)
    {
        this(truststoreFile, truststorePassword, KeyStore.getDefaultType());
    }

    @Override
    public TrustManagerFactory trustManagerFactory() throws GeneralSecurityException, IOException
    {
        KeyStore ts = KeyStore.getInstance(truststoreFormat);
        try (InputStream in = Files.newInputStream(truststoreFile)) {
            ts.load(in, truststorePassword);
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(ts);
        return tmf;
    }

    @Override
    public String describe()
    {
        return "trust store " + truststoreFile + " (" + truststoreFormat + ")";
    }
}
