package com.questrail.vault.protocol.transport.tls;

import javax.net.ssl.TrustManagerFactory;
import java.security.GeneralSecurityException;
import java.io.IOException;

/**
 * Policy deciding which server certificates an encrypted connection accepts.
 *
 * <p>The returned factory is handed to the TLS layer unchanged; a certificate
 * it rejects fails the handshake and surfaces as a
 * {@code TransportFailure.HANDSHAKE_FAILED}. There is deliberately no
 * accept-everything implementation.</p>
 */
public interface ServerCertificateVerifier
{
    /**
     * Build the trust managers used to validate the server's certificate chain.
     */
    TrustManagerFactory trustManagerFactory() throws GeneralSecurityException, IOException;

    /**
     * Short description for logs.
     */
    String describe();
}
