package com.questrail.vault.protocol.transport.tls;

import javax.net.ssl.TrustManagerFactory;
import java.security.GeneralSecurityException;
import java.security.KeyStore;

/**
 * Validates the server against the JVM's default trust store.
 */
public final class SystemTrustStoreVerifier implements ServerCertificateVerifier
{
    public static final SystemTrustStoreVerifier INSTANCE = new SystemTrustStoreVerifier();

    private SystemTrustStoreVerifier() {}

    @Override
    public TrustManagerFactory trustManagerFactory() throws GeneralSecurityException
    {
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init((KeyStore) null);
        return tmf;
    }

    @Override
    public String describe()
    {
        return "system trust store";
    }
}
