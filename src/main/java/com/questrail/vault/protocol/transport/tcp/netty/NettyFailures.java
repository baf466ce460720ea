package com.questrail.vault.protocol.transport.tcp.netty;

import com.questrail.vault.api.TransportFailure;
import com.questrail.vault.api.VaultClientException;
import com.questrail.vault.api.VaultTransportException;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.ssl.NotSslRecordException;
import io.netty.handler.timeout.ReadTimeoutException;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

/**
 * Maps Netty and JDK transport throwables onto the {@link TransportFailure}
 * taxonomy.
 *
 * <p>Classification is by exception type and walks the cause chain, because
 * Netty wraps the underlying fault (a {@code DecoderException} around an
 * {@code SSLHandshakeException}, for example).</p>
 */
final class NettyFailures
{
    private NettyFailures() {}

    static TransportFailure classify(Throwable cause)
    {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            // ConnectTimeoutException extends ConnectException: test it first.
            if (t instanceof ConnectTimeoutException
                    || t instanceof ReadTimeoutException
                    || t instanceof SocketTimeoutException) {
                return TransportFailure.CONNECTION_TIMED_OUT;
            }
            if (t instanceof ConnectException) {
                return TransportFailure.CONNECTION_REFUSED;
            }
            if (t instanceof SSLException || t instanceof NotSslRecordException) {
                return TransportFailure.HANDSHAKE_FAILED;
            }
        }
        return TransportFailure.UNKNOWN;
    }

    /**
     * Wrap {@code cause} in a classified exception, or unwrap and return it
     * when a vault exception is already in the cause chain (for example a
     * framing failure wrapped in Netty's {@code DecoderException}).
     */
    static VaultClientException toException(Throwable cause, String context)
    {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof VaultClientException) {
                return (VaultClientException) t;
            }
        }
        TransportFailure reason = classify(cause);
        return new VaultTransportException(reason, context + ": " + reason.details(), cause);
    }
}
