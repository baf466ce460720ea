package com.questrail.vault.protocol.transport.tls;

import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.Objects;

/**
 * Trusts exactly the certificates read from one file (PEM or DER, one or more
 * X.509 certificates). Suited to a vault server running with its own
 * self-signed {@code cert.pem}.
 *
 * <p>Chain and validity checks still apply: the pinned certificate becomes
 * the only trust anchor, it does not switch validation off.</p>
 */
public final class PinnedCertificateVerifier implements ServerCertificateVerifier
{
    private final Path certificateFile;

    public PinnedCertificateVerifier(Path certificateFile)
    {
        this.certificateFile = Objects.requireNonNull(certificateFile, "certificateFile");
    }

    @Override
    public TrustManagerFactory trustManagerFactory() throws GeneralSecurityException, IOException
    {
        Collection<? extends Certificate> certificates;
        try (InputStream in = Files.newInputStream(certificateFile)) {
            certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
        }
        if (certificates.isEmpty()) {
            throw new CertificateException("No certificate found in " + certificateFile);
        }

        KeyStore ts = KeyStore.getInstance("PKCS12");
        ts.load(null, null);
        int i = 0;
        for (Certificate certificate : certificates) {
            ts.setCertificateEntry("pinned-" + i++, certificate);
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(ts);
        return tmf;
    }

    @Override
    public String describe()
    {
        return "pinned certificate " + certificateFile;
    }
}
